package com.carhire.rental.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class VehicleImageRequest {

    @NotBlank(message = "Image path is required")
    @Size(max = 500)
    private String imagePath;

    private String imageType;
    private String caption;
    private boolean primaryImage;
    private int sortOrder;
}
