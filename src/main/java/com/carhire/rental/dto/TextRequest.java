package com.carhire.rental.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.*;

/**
 * Single free-text body: review responses, dispute reasons, resolutions.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TextRequest {

    @NotBlank(message = "Text is required")
    @Size(max = 4000)
    private String text;
}
