package com.carhire.rental.dto;

import jakarta.validation.constraints.NotEmpty;
import lombok.*;

import java.util.List;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AdminActionRequest {

    @NotEmpty(message = "At least one id is required")
    private List<Long> ids;
}
