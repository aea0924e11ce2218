package com.carhire.rental.dto;

import com.carhire.rental.entity.Penalty;
import com.carhire.rental.entity.PenaltyStatus;
import com.carhire.rental.entity.PenaltyType;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PenaltyResponse {

    private Long id;
    private Long bookingId;
    private String bookingReference;
    private Long customerId;
    private PenaltyType penaltyType;
    private String description;
    private BigDecimal amount;
    private PenaltyStatus status;
    private boolean disputed;
    private String disputeReason;
    private String disputeResolution;
    private LocalDateTime createdAt;

    public static PenaltyResponse from(Penalty p) {
        return PenaltyResponse.builder()
                .id(p.getId())
                .bookingId(p.getBooking().getId())
                .bookingReference(p.getBooking().getBookingReference())
                .customerId(p.getCustomer().getId())
                .penaltyType(p.getPenaltyType())
                .description(p.getDescription())
                .amount(p.getAmount())
                .status(p.getStatus())
                .disputed(p.isDisputed())
                .disputeReason(p.getDisputeReason())
                .disputeResolution(p.getDisputeResolution())
                .createdAt(p.getCreatedAt())
                .build();
    }
}
