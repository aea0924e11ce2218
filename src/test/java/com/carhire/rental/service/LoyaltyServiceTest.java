package com.carhire.rental.service;

import com.carhire.rental.entity.Booking;
import com.carhire.rental.entity.LoyaltyProgram;
import com.carhire.rental.entity.LoyaltyTier;
import com.carhire.rental.entity.User;
import com.carhire.rental.repository.LoyaltyProgramRepository;
import com.carhire.rental.repository.UserRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LoyaltyServiceTest {

    @Mock private LoyaltyProgramRepository loyaltyProgramRepository;
    @Mock private UserRepository           userRepository;

    @InjectMocks
    private LoyaltyService loyaltyService;

    private static LoyaltyProgram program(LoyaltyTier tier, int min, String rate) {
        return LoyaltyProgram.builder().tier(tier).minPointsRequired(min).pointsPerUnit(new BigDecimal(rate)).build();
    }

    private final List<LoyaltyProgram> programs = List.of(
            program(LoyaltyTier.GOLD, 5000, "1.50"),
            program(LoyaltyTier.SILVER, 1000, "1.25"),
            program(LoyaltyTier.BRONZE, 0, "1.00"));

    @Test
    @DisplayName("Points are the floor of total times the tier's earn rate")
    void accrue_creditsFlooredPoints() {
        User customer = User.builder().id(10L).loyaltyPoints(100).build();
        Booking booking = Booking.builder().bookingReference("BK2610190001")
                .customer(customer).totalAmount(new BigDecimal("172.90")).build();
        when(loyaltyProgramRepository.findByTierAndActiveTrue(LoyaltyTier.BRONZE))
                .thenReturn(Optional.of(programs.get(2)));
        when(loyaltyProgramRepository.findByActiveTrueOrderByMinPointsRequiredDesc()).thenReturn(programs);

        int points = loyaltyService.accrue(booking);

        assertThat(points).isEqualTo(172);
        assertThat(customer.getLoyaltyPoints()).isEqualTo(272);
        assertThat(customer.getLoyaltyTier()).isEqualTo(LoyaltyTier.BRONZE);
        assertThat(booking.getLoyaltyPointsEarned()).isEqualTo(172);
        verify(userRepository).save(customer);
    }

    @Test
    @DisplayName("Crossing a threshold promotes the customer's tier")
    void accrue_crossingThreshold_promotesTier() {
        User customer = User.builder().id(10L).loyaltyPoints(950).build();
        Booking booking = Booking.builder().customer(customer).totalAmount(new BigDecimal("80.00")).build();
        when(loyaltyProgramRepository.findByTierAndActiveTrue(LoyaltyTier.BRONZE)).thenReturn(Optional.empty());
        when(loyaltyProgramRepository.findByActiveTrueOrderByMinPointsRequiredDesc()).thenReturn(programs);

        loyaltyService.accrue(booking);

        assertThat(customer.getLoyaltyPoints()).isEqualTo(1030);
        assertThat(customer.getLoyaltyTier()).isEqualTo(LoyaltyTier.SILVER);
    }

    @Test
    @DisplayName("Without configured programs every customer is bronze")
    void tierFor_noPrograms_isBronze() {
        when(loyaltyProgramRepository.findByActiveTrueOrderByMinPointsRequiredDesc()).thenReturn(List.of());

        assertThat(loyaltyService.tierFor(99_999)).isEqualTo(LoyaltyTier.BRONZE);
    }
}
