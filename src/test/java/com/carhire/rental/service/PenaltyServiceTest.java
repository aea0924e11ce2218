package com.carhire.rental.service;

import com.carhire.rental.entity.*;
import com.carhire.rental.exception.AccessDeniedException;
import com.carhire.rental.exception.InvalidTransitionException;
import com.carhire.rental.repository.BookingRepository;
import com.carhire.rental.repository.PenaltyRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PenaltyServiceTest {

    // ── Mocks ────────────────────────────────────────────────────────────────

    @Mock private PenaltyRepository penaltyRepository;
    @Mock private BookingRepository bookingRepository;
    @Mock private UserAccessService userAccessService;

    private PenaltyService penaltyService;

    // ── Test fixtures ─────────────────────────────────────────────────────────

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 10, 19, 18, 0);
    private static final LocalDateTime DUE = LocalDateTime.of(2026, 10, 18, 10, 0);

    private User customer;
    private Booking booking;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        penaltyService = new PenaltyService(penaltyRepository, bookingRepository, userAccessService, clock);
        ReflectionTestUtils.setField(penaltyService, "fuelChargePerUnit", new BigDecimal("20.00"));
        ReflectionTestUtils.setField(penaltyService, "lateGraceMinutes", 60L);

        customer = User.builder().id(10L).build();
        booking = Booking.builder()
                .id(100L)
                .bookingReference("BK2610150001")
                .customer(customer)
                .vehicle(Vehicle.builder().id(5L).fuelTankCapacity(new BigDecimal("50")).build())
                .status(BookingStatus.COMPLETED)
                .pickupDate(DUE.minusDays(3))
                .returnDate(DUE)
                .dailyRate(new BigDecimal("50.00"))
                .build();
    }

    @Test
    @DisplayName("Return within the grace period raises nothing")
    void assessReturn_withinGrace_noPenalty() {
        booking.setActualReturnDate(DUE.plusMinutes(45));

        assertThat(penaltyService.assessReturn(booking)).isEmpty();
        verifyNoInteractions(penaltyRepository);
    }

    @Test
    @DisplayName("Each started day past the grace period is billed at the daily rate")
    void assessReturn_late_billsStartedDays() {
        booking.setActualReturnDate(DUE.plusHours(25));

        List<Penalty> raised = penaltyService.assessReturn(booking);

        assertThat(raised).singleElement().satisfies(p -> {
            assertThat(p.getPenaltyType()).isEqualTo(PenaltyType.LATE_RETURN);
            assertThat(p.getAmount()).isEqualByComparingTo("100.00");
            assertThat(p.getCustomer()).isSameAs(customer);
        });
        verify(penaltyRepository).saveAll(raised);
    }

    @Test
    @DisplayName("A fuel shortage bills the missing fuel")
    void assessReturn_fuelShortage_billsMissingFuel() {
        booking.setActualReturnDate(DUE);
        booking.setPickupFuelLevel(new BigDecimal("1.00"));
        booking.setReturnFuelLevel(new BigDecimal("0.75"));

        List<Penalty> raised = penaltyService.assessReturn(booking);

        assertThat(raised).singleElement().satisfies(p -> {
            assertThat(p.getPenaltyType()).isEqualTo(PenaltyType.FUEL_SHORTAGE);
            assertThat(p.getAmount()).isEqualByComparingTo("250.00");
        });
    }

    @Test
    @DisplayName("The owner can dispute a penalty")
    void dispute_byOwner_marksDisputed() {
        Penalty penalty = Penalty.builder().id(3L).booking(booking).customer(customer)
                .penaltyType(PenaltyType.LATE_RETURN).amount(new BigDecimal("100.00")).build();
        when(penaltyRepository.findById(3L)).thenReturn(Optional.of(penalty));
        when(userAccessService.requireUser(10L)).thenReturn(customer);
        when(penaltyRepository.save(penalty)).thenReturn(penalty);

        penaltyService.dispute(10L, 3L, "Traffic accident on the M1");

        assertThat(penalty.getStatus()).isEqualTo(PenaltyStatus.DISPUTED);
        assertThat(penalty.isDisputed()).isTrue();
        assertThat(penalty.getDisputeDate()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("Another customer cannot dispute the penalty")
    void dispute_byOtherCustomer_isDenied() {
        Penalty penalty = Penalty.builder().id(3L).booking(booking).customer(customer)
                .penaltyType(PenaltyType.DAMAGE).amount(BigDecimal.TEN).build();
        when(penaltyRepository.findById(3L)).thenReturn(Optional.of(penalty));
        when(userAccessService.requireUser(11L)).thenReturn(User.builder().id(11L).build());

        assertThatThrownBy(() -> penaltyService.dispute(11L, 3L, "not mine"))
                .isInstanceOf(AccessDeniedException.class);
    }

    @Test
    @DisplayName("A pending penalty cannot be marked paid")
    void markPaid_pending_throws() {
        Penalty penalty = Penalty.builder().id(3L).booking(booking).customer(customer)
                .penaltyType(PenaltyType.DAMAGE).amount(BigDecimal.TEN).build();
        when(userAccessService.requireStaff(1L)).thenReturn(User.builder().id(1L).userType(UserType.STAFF).build());
        when(penaltyRepository.findById(3L)).thenReturn(Optional.of(penalty));

        assertThatThrownBy(() -> penaltyService.markPaid(1L, 3L))
                .isInstanceOf(InvalidTransitionException.class);
    }
}
