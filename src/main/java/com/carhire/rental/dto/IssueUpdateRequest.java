package com.carhire.rental.dto;

import com.carhire.rental.entity.IssueStatus;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.*;

/**
 * Staff update (assignee, status, resolution) or customer feedback
 * (satisfaction, feedback); each endpoint reads the fields it needs.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class IssueUpdateRequest {

    private Long assigneeId;
    private IssueStatus status;
    private String resolution;

    @Min(value = 1, message = "Satisfaction must be between 1 and 5")
    @Max(value = 5, message = "Satisfaction must be between 1 and 5")
    private Integer satisfaction;

    private String feedback;
}
