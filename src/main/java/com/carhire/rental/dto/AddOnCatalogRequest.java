package com.carhire.rental.dto;

import com.carhire.rental.entity.AddOnPricingType;
import com.carhire.rental.entity.AddOnType;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.*;

import java.math.BigDecimal;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AddOnCatalogRequest {

    @NotBlank(message = "Name is required")
    private String name;

    @NotNull(message = "Add-on type is required")
    private AddOnType addOnType;

    private String description;

    @NotNull(message = "Pricing type is required")
    private AddOnPricingType pricingType;

    @NotNull(message = "Price is required")
    @DecimalMin(value = "0.00", message = "Price cannot be negative")
    private BigDecimal price;
}
