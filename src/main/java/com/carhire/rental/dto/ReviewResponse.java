package com.carhire.rental.dto;

import com.carhire.rental.entity.Review;
import lombok.*;

import java.time.LocalDateTime;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ReviewResponse {

    private Long id;
    private Long bookingId;
    private Long vehicleId;
    private String customerName;
    private int overallRating;
    private Integer vehicleConditionRating;
    private Integer serviceRating;
    private Integer valueForMoneyRating;
    private String title;
    private String comment;
    private boolean verified;
    private boolean approved;
    private boolean featured;
    private int helpfulVotes;
    private int totalVotes;
    private String companyResponse;
    private LocalDateTime responseDate;
    private LocalDateTime createdAt;

    public static ReviewResponse from(Review r) {
        return ReviewResponse.builder()
                .id(r.getId())
                .bookingId(r.getBooking().getId())
                .vehicleId(r.getVehicle().getId())
                .customerName(r.getCustomer().getFullName())
                .overallRating(r.getOverallRating())
                .vehicleConditionRating(r.getVehicleConditionRating())
                .serviceRating(r.getServiceRating())
                .valueForMoneyRating(r.getValueForMoneyRating())
                .title(r.getTitle())
                .comment(r.getComment())
                .verified(r.isVerified())
                .approved(r.isApproved())
                .featured(r.isFeatured())
                .helpfulVotes(r.getHelpfulVotes())
                .totalVotes(r.getTotalVotes())
                .companyResponse(r.getCompanyResponse())
                .responseDate(r.getResponseDate())
                .createdAt(r.getCreatedAt())
                .build();
    }
}
