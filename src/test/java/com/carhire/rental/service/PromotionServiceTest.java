package com.carhire.rental.service;

import com.carhire.rental.entity.*;
import com.carhire.rental.exception.BusinessRuleException;
import com.carhire.rental.repository.BookingRepository;
import com.carhire.rental.repository.PromotionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PromotionServiceTest {

    // ── Mocks ────────────────────────────────────────────────────────────────

    @Mock private PromotionRepository promotionRepository;
    @Mock private BookingRepository   bookingRepository;
    @Mock private UserAccessService   userAccessService;

    private PromotionService promotionService;

    // ── Test fixtures ─────────────────────────────────────────────────────────

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 10, 19, 8, 0);

    private Booking booking;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        promotionService = new PromotionService(promotionRepository, bookingRepository, userAccessService, clock);

        booking = Booking.builder()
                .bookingReference("BK2610190001")
                .customer(User.builder().id(10L).build())
                .dailyRate(new BigDecimal("50.00"))
                .totalDays(4)
                .subtotal(new BigDecimal("200.00"))
                .build();
    }

    private Promotion promotion(DiscountType type, String value) {
        return Promotion.builder()
                .code("SPRING")
                .name("Spring")
                .discountType(type)
                .discountValue(new BigDecimal(value))
                .startDate(NOW.minusDays(1))
                .endDate(NOW.plusDays(30))
                .build();
    }

    @Test
    @DisplayName("Percentage discount is a share of the subtotal")
    void discountFor_percentage_isShareOfSubtotal() {
        assertThat(promotionService.discountFor(promotion(DiscountType.PERCENTAGE, "15"), booking))
                .isEqualByComparingTo("30.00");
    }

    @Test
    @DisplayName("Percentage discount is capped by the maximum")
    void discountFor_percentage_isCappedByMaxDiscount() {
        Promotion promotion = promotion(DiscountType.PERCENTAGE, "50");
        promotion.setMaxDiscountAmount(new BigDecimal("40.00"));

        assertThat(promotionService.discountFor(promotion, booking)).isEqualByComparingTo("40.00");
    }

    @Test
    @DisplayName("Free days never exceed the rental length")
    void discountFor_freeDays_boundedByTotalDays() {
        assertThat(promotionService.discountFor(promotion(DiscountType.FREE_DAYS, "7"), booking))
                .isEqualByComparingTo("200.00");
        assertThat(promotionService.discountFor(promotion(DiscountType.FREE_DAYS, "1"), booking))
                .isEqualByComparingTo("50.00");
    }

    @Test
    @DisplayName("A fixed discount never exceeds the subtotal")
    void discountFor_fixed_clampedToSubtotal() {
        assertThat(promotionService.discountFor(promotion(DiscountType.FIXED_AMOUNT, "250"), booking))
                .isEqualByComparingTo("200.00");
    }

    @Test
    @DisplayName("Redeeming sets the discount and counts the use")
    void redeem_setsDiscountAndCountsUse() {
        Promotion promotion = promotion(DiscountType.FIXED_AMOUNT, "25");
        when(promotionRepository.findByCodeForUpdate("spring")).thenReturn(Optional.of(promotion));
        when(bookingRepository.countByCustomerIdAndPromotionCodeIgnoreCaseAndStatusNot(
                10L, "SPRING", BookingStatus.CANCELLED)).thenReturn(0L);

        BigDecimal discount = promotionService.redeem(" spring ", booking);

        assertThat(discount).isEqualByComparingTo("25.00");
        assertThat(booking.getDiscountAmount()).isEqualByComparingTo("25.00");
        assertThat(booking.getPromotionCode()).isEqualTo("SPRING");
        assertThat(promotion.getUsageCount()).isEqualTo(1);
        verify(promotionRepository).save(promotion);
    }

    @Test
    @DisplayName("An exhausted promotion cannot be redeemed")
    void redeem_exhausted_throws() {
        Promotion promotion = promotion(DiscountType.FIXED_AMOUNT, "25");
        promotion.setUsageLimit(3);
        promotion.setUsageCount(3);
        when(promotionRepository.findByCodeForUpdate("SPRING")).thenReturn(Optional.of(promotion));

        assertThatThrownBy(() -> promotionService.redeem("SPRING", booking))
                .isInstanceOf(BusinessRuleException.class)
                .hasMessageContaining("usage limit");
        verify(promotionRepository, never()).save(any());
    }

    @Test
    @DisplayName("An expired promotion cannot be redeemed")
    void redeem_expired_throws() {
        Promotion promotion = promotion(DiscountType.FIXED_AMOUNT, "25");
        promotion.setEndDate(NOW.minusHours(1));
        when(promotionRepository.findByCodeForUpdate("SPRING")).thenReturn(Optional.of(promotion));

        assertThatThrownBy(() -> promotionService.redeem("SPRING", booking))
                .isInstanceOf(BusinessRuleException.class)
                .hasMessageContaining("not currently valid");
    }

    @Test
    @DisplayName("The per-customer limit is enforced")
    void redeem_customerLimitReached_throws() {
        when(promotionRepository.findByCodeForUpdate("SPRING"))
                .thenReturn(Optional.of(promotion(DiscountType.FIXED_AMOUNT, "25")));
        when(bookingRepository.countByCustomerIdAndPromotionCodeIgnoreCaseAndStatusNot(
                10L, "SPRING", BookingStatus.CANCELLED)).thenReturn(1L);

        assertThatThrownBy(() -> promotionService.redeem("SPRING", booking))
                .isInstanceOf(BusinessRuleException.class)
                .hasMessageContaining("already used");
    }

    @Test
    @DisplayName("Rentals shorter than the minimum do not qualify")
    void validate_belowMinimumDays_throws() {
        Promotion promotion = promotion(DiscountType.PERCENTAGE, "10");
        promotion.setMinRentalDays(7);
        when(promotionRepository.findByCodeIgnoreCase("SPRING")).thenReturn(Optional.of(promotion));
        when(bookingRepository.countByCustomerIdAndPromotionCodeIgnoreCaseAndStatusNot(
                10L, "SPRING", BookingStatus.CANCELLED)).thenReturn(0L);

        assertThatThrownBy(() -> promotionService.validate("SPRING", booking))
                .isInstanceOf(BusinessRuleException.class)
                .hasMessageContaining("7 rental days");
    }

    @Test
    @DisplayName("An unknown code is rejected")
    void validate_unknownCode_throws() {
        when(promotionRepository.findByCodeIgnoreCase("NOPE")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> promotionService.validate("NOPE", booking))
                .isInstanceOf(BusinessRuleException.class);
    }
}
