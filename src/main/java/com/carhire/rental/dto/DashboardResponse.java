package com.carhire.rental.dto;

import com.carhire.rental.entity.UserPreference;
import lombok.*;

import java.math.BigDecimal;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DashboardResponse {

    private UserProfileResponse user;
    private long totalBookings;
    private long activeBookings;
    private BigDecimal totalSpent;
    private UserPreference preferences;
}
