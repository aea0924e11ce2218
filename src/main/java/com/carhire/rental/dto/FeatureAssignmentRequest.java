package com.carhire.rental.dto;

import jakarta.validation.constraints.NotNull;
import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FeatureAssignmentRequest {

    @NotNull(message = "Feature ID is required")
    private Long featureId;

    private String notes;
}
