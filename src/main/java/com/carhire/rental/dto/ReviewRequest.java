package com.carhire.rental.dto;

import jakarta.validation.constraints.*;
import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ReviewRequest {

    @NotNull(message = "Booking ID is required")
    private Long bookingId;

    @NotNull(message = "Overall rating is required")
    @Min(value = 1, message = "Rating must be between 1 and 5")
    @Max(value = 5, message = "Rating must be between 1 and 5")
    private Integer overallRating;

    @Min(1) @Max(5)
    private Integer vehicleConditionRating;

    @Min(1) @Max(5)
    private Integer serviceRating;

    @Min(1) @Max(5)
    private Integer valueForMoneyRating;

    @Size(max = 200)
    private String title;

    @NotBlank(message = "Comment is required")
    private String comment;
}
