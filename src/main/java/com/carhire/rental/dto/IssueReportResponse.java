package com.carhire.rental.dto;

import com.carhire.rental.entity.*;
import lombok.*;

import java.time.LocalDateTime;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class IssueReportResponse {

    private Long id;
    private String ticketNumber;
    private Long customerId;
    private Long bookingId;
    private Long vehicleId;
    private IssueType issueType;
    private IssuePriority priority;
    private IssueStatus status;
    private String subject;
    private String description;
    private String location;
    private Long assignedToId;
    private String resolution;
    private LocalDateTime resolutionDate;
    private Integer customerSatisfaction;
    private String customerFeedback;
    private LocalDateTime createdAt;

    public static IssueReportResponse from(IssueReport i) {
        return IssueReportResponse.builder()
                .id(i.getId())
                .ticketNumber(i.getTicketNumber())
                .customerId(i.getCustomer().getId())
                .bookingId(i.getBooking() != null ? i.getBooking().getId() : null)
                .vehicleId(i.getVehicle() != null ? i.getVehicle().getId() : null)
                .issueType(i.getIssueType())
                .priority(i.getPriority())
                .status(i.getStatus())
                .subject(i.getSubject())
                .description(i.getDescription())
                .location(i.getLocation())
                .assignedToId(i.getAssignedTo() != null ? i.getAssignedTo().getId() : null)
                .resolution(i.getResolution())
                .resolutionDate(i.getResolutionDate())
                .customerSatisfaction(i.getCustomerSatisfaction())
                .customerFeedback(i.getCustomerFeedback())
                .createdAt(i.getCreatedAt())
                .build();
    }
}
