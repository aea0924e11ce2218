package com.carhire.rental.dto;

import com.carhire.rental.entity.IssuePriority;
import com.carhire.rental.entity.IssueType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class IssueReportRequest {

    private Long bookingId;
    private Long vehicleId;

    @NotNull(message = "Issue type is required")
    private IssueType issueType;

    private IssuePriority priority;

    @NotBlank(message = "Subject is required")
    @Size(max = 200)
    private String subject;

    @NotBlank(message = "Description is required")
    private String description;

    private String location;
}
