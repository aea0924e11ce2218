package com.carhire.rental.service;

import com.carhire.rental.dto.BookingRequest;
import com.carhire.rental.dto.BookingResponse;
import com.carhire.rental.dto.RentalHandoverRequest;
import com.carhire.rental.entity.*;
import com.carhire.rental.exception.AccessDeniedException;
import com.carhire.rental.exception.BusinessRuleException;
import com.carhire.rental.exception.InvalidTransitionException;
import com.carhire.rental.repository.BookingAddOnRepository;
import com.carhire.rental.repository.BookingRepository;
import com.carhire.rental.repository.UserRepository;
import com.carhire.rental.repository.VehicleRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.mockito.ArgumentCaptor;
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

/**
 * Unit tests for BookingService.
 *
 * Covers creation (overlap and date checks), the lifecycle guards and the
 * side effects of returning a vehicle.
 */
@ExtendWith(MockitoExtension.class)
class BookingServiceTest {

    // ── Mocks ────────────────────────────────────────────────────────────────

    @Mock private BookingRepository      bookingRepository;
    @Mock private VehicleRepository      vehicleRepository;
    @Mock private BookingAddOnRepository addOnRepository;
    @Mock private UserRepository         userRepository;
    @Mock private UserAccessService      userAccessService;
    @Mock private IdentifierService      identifierService;
    @Mock private PricingService         pricingService;
    @Mock private PromotionService       promotionService;
    @Mock private LoyaltyService         loyaltyService;
    @Mock private PenaltyService         penaltyService;
    @Mock private NotificationService    notificationService;

    private BookingService bookingService;

    // ── Test fixtures ─────────────────────────────────────────────────────────

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 10, 19, 12, 0);

    private static final Long CUSTOMER_ID = 10L;
    private static final Long STAFF_ID    = 1L;
    private static final Long VEHICLE_ID  = 5L;
    private static final Long BOOKING_ID  = 100L;

    private User customer;
    private User staff;
    private Vehicle vehicle;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        bookingService = new BookingService(bookingRepository, vehicleRepository, addOnRepository,
                userRepository, userAccessService, identifierService, pricingService, promotionService,
                loyaltyService, penaltyService, notificationService, clock);

        customer = User.builder().id(CUSTOMER_ID).username("chikondi").build();
        staff = User.builder().id(STAFF_ID).username("admin").userType(UserType.STAFF).build();
        vehicle = Vehicle.builder()
                .id(VEHICLE_ID)
                .licensePlate("LL 4521")
                .dailyRate(new BigDecimal("45.00"))
                .currentMileage(18_000)
                .build();
    }

    private Booking booking(BookingStatus status, LocalDateTime pickup) {
        return Booking.builder()
                .id(BOOKING_ID)
                .bookingReference("BK2610190001")
                .customer(customer)
                .vehicle(vehicle)
                .status(status)
                .pickupDate(pickup)
                .returnDate(pickup.plusDays(3))
                .dailyRate(vehicle.getDailyRate())
                .build();
    }

    private BookingRequest request(LocalDateTime pickup, LocalDateTime dropOff) {
        BookingRequest request = new BookingRequest();
        request.setVehicleId(VEHICLE_ID);
        request.setPickupDate(pickup);
        request.setReturnDate(dropOff);
        request.setPickupLocation("Lilongwe Airport");
        request.setReturnLocation("Lilongwe Airport");
        return request;
    }

    // ── Creation ──────────────────────────────────────────────────────────────

    @Test
    @DisplayName("New booking is PENDING with a generated reference and is broadcast")
    void create_valid_savesPendingBooking() {
        when(userAccessService.requireUser(CUSTOMER_ID)).thenReturn(customer);
        when(vehicleRepository.findByIdForUpdate(VEHICLE_ID)).thenReturn(Optional.of(vehicle));
        when(bookingRepository.countOverlapping(eq(VEHICLE_ID), any(), any(), eq(BookingStatus.BLOCKING)))
                .thenReturn(0L);
        when(identifierService.nextBookingReference()).thenReturn("BK2610190007");
        when(bookingRepository.save(any(Booking.class))).thenAnswer(inv -> inv.getArgument(0));

        BookingResponse response = bookingService.create(CUSTOMER_ID,
                request(NOW.plusDays(1), NOW.plusDays(4)));

        assertThat(response.getBookingReference()).isEqualTo("BK2610190007");
        assertThat(response.getStatus()).isEqualTo(BookingStatus.PENDING);
        assertThat(response.getCreatedAt()).isEqualTo(NOW);
        verify(pricingService).recalculate(any(Booking.class));
        verify(promotionService, never()).redeem(anyString(), any());
        verify(notificationService).bookingStatusChanged(any(), eq("BK2610190007"),
                eq(CUSTOMER_ID), eq(BookingStatus.PENDING));
    }

    @Test
    @DisplayName("Overlapping live booking rejects the request")
    void create_overlap_throws() {
        when(userAccessService.requireUser(CUSTOMER_ID)).thenReturn(customer);
        when(vehicleRepository.findByIdForUpdate(VEHICLE_ID)).thenReturn(Optional.of(vehicle));
        when(bookingRepository.countOverlapping(eq(VEHICLE_ID), any(), any(), eq(BookingStatus.BLOCKING)))
                .thenReturn(1L);

        assertThatThrownBy(() -> bookingService.create(CUSTOMER_ID,
                request(NOW.plusDays(1), NOW.plusDays(4))))
                .isInstanceOf(BusinessRuleException.class)
                .hasMessageContaining("already booked");
        verify(bookingRepository, never()).save(any());
    }

    @Test
    @DisplayName("Return before pickup is rejected")
    void create_returnBeforePickup_throws() {
        when(userAccessService.requireUser(CUSTOMER_ID)).thenReturn(customer);
        when(vehicleRepository.findByIdForUpdate(VEHICLE_ID)).thenReturn(Optional.of(vehicle));

        assertThatThrownBy(() -> bookingService.create(CUSTOMER_ID,
                request(NOW.plusDays(4), NOW.plusDays(1))))
                .isInstanceOf(BusinessRuleException.class);
        verify(identifierService, never()).nextBookingReference();
    }

    @Test
    @DisplayName("Pickup in the past is rejected")
    void create_pickupInPast_throws() {
        when(userAccessService.requireUser(CUSTOMER_ID)).thenReturn(customer);
        when(vehicleRepository.findByIdForUpdate(VEHICLE_ID)).thenReturn(Optional.of(vehicle));

        assertThatThrownBy(() -> bookingService.create(CUSTOMER_ID,
                request(NOW.minusHours(2), NOW.plusDays(1))))
                .isInstanceOf(BusinessRuleException.class)
                .hasMessageContaining("past");
    }

    @Test
    @DisplayName("A vehicle in maintenance cannot be booked")
    void create_vehicleInMaintenance_throws() {
        vehicle.setStatus(VehicleStatus.MAINTENANCE);
        when(userAccessService.requireUser(CUSTOMER_ID)).thenReturn(customer);
        when(vehicleRepository.findByIdForUpdate(VEHICLE_ID)).thenReturn(Optional.of(vehicle));

        assertThatThrownBy(() -> bookingService.create(CUSTOMER_ID,
                request(NOW.plusDays(1), NOW.plusDays(2))))
                .isInstanceOf(BusinessRuleException.class)
                .hasMessageContaining("not available");
    }

    @Test
    @DisplayName("A suspended customer cannot book")
    void create_suspendedCustomer_throws() {
        customer.setSuspended(true);
        when(userAccessService.requireUser(CUSTOMER_ID)).thenReturn(customer);

        assertThatThrownBy(() -> bookingService.create(CUSTOMER_ID,
                request(NOW.plusDays(1), NOW.plusDays(2))))
                .isInstanceOf(BusinessRuleException.class);
        verifyNoInteractions(vehicleRepository);
    }

    // ── Lifecycle ─────────────────────────────────────────────────────────────

    @Test
    @DisplayName("A completed booking cannot be confirmed again")
    void confirm_completedBooking_throwsInvalidTransition() {
        when(userAccessService.requireStaff(STAFF_ID)).thenReturn(staff);
        when(bookingRepository.findByIdForUpdate(BOOKING_ID))
                .thenReturn(Optional.of(booking(BookingStatus.COMPLETED, NOW.minusDays(5))));

        assertThatThrownBy(() -> bookingService.confirm(STAFF_ID, BOOKING_ID))
                .isInstanceOf(InvalidTransitionException.class)
                .hasMessageContaining("COMPLETED");
        verify(bookingRepository, never()).save(any());
        verifyNoInteractions(notificationService);
    }

    @Test
    @DisplayName("Confirming a pending booking stamps the time and assigns staff")
    void confirm_pending_setsConfirmedAtAndAssignsStaff() {
        Booking booking = booking(BookingStatus.PENDING, NOW.plusDays(2));
        when(userAccessService.requireStaff(STAFF_ID)).thenReturn(staff);
        when(bookingRepository.findByIdForUpdate(BOOKING_ID)).thenReturn(Optional.of(booking));
        when(bookingRepository.save(booking)).thenReturn(booking);

        BookingResponse response = bookingService.confirm(STAFF_ID, BOOKING_ID);

        assertThat(response.getStatus()).isEqualTo(BookingStatus.CONFIRMED);
        assertThat(response.getConfirmedAt()).isEqualTo(NOW);
        assertThat(booking.getAssignedStaff()).isSameAs(staff);
        assertThat(booking.isConfirmationSent()).isTrue();
    }

    @Test
    @DisplayName("Cancelling before pickup stamps cancelledAt with the current time")
    void cancel_beforePickup_succeeds() {
        Booking booking = booking(BookingStatus.CONFIRMED, NOW.plusDays(1));
        when(bookingRepository.findByIdForUpdate(BOOKING_ID)).thenReturn(Optional.of(booking));
        when(userAccessService.requireOwnerOrStaff(CUSTOMER_ID, customer)).thenReturn(customer);
        when(bookingRepository.save(booking)).thenReturn(booking);

        BookingResponse response = bookingService.cancel(CUSTOMER_ID, BOOKING_ID, "Change of plans");

        assertThat(response.getStatus()).isEqualTo(BookingStatus.CANCELLED);
        assertThat(response.getCancelledAt()).isEqualTo(NOW);
        assertThat(response.getCancellationReason()).isEqualTo("Change of plans");
        verify(notificationService).bookingStatusChanged(BOOKING_ID, "BK2610190001",
                CUSTOMER_ID, BookingStatus.CANCELLED);
    }

    @Test
    @DisplayName("Cancelling after the pickup time is rejected")
    void cancel_afterPickup_throws() {
        Booking booking = booking(BookingStatus.CONFIRMED, NOW.minusHours(1));
        when(bookingRepository.findByIdForUpdate(BOOKING_ID)).thenReturn(Optional.of(booking));
        when(userAccessService.requireOwnerOrStaff(CUSTOMER_ID, customer)).thenReturn(customer);

        assertThatThrownBy(() -> bookingService.cancel(CUSTOMER_ID, BOOKING_ID, null))
                .isInstanceOf(InvalidTransitionException.class);
        assertThat(booking.getStatus()).isEqualTo(BookingStatus.CONFIRMED);
        assertThat(booking.getCancelledAt()).isNull();
    }

    @Test
    @DisplayName("Another customer cannot cancel the booking")
    void cancel_byOtherCustomer_isDenied() {
        Booking booking = booking(BookingStatus.PENDING, NOW.plusDays(1));
        when(bookingRepository.findByIdForUpdate(BOOKING_ID)).thenReturn(Optional.of(booking));
        when(userAccessService.requireOwnerOrStaff(99L, customer))
                .thenThrow(new AccessDeniedException("Not allowed to access this record"));

        assertThatThrownBy(() -> bookingService.cancel(99L, BOOKING_ID, null))
                .isInstanceOf(AccessDeniedException.class);
        assertThat(booking.getStatus()).isEqualTo(BookingStatus.PENDING);
    }

    @Test
    @DisplayName("Starting a confirmed booking marks the vehicle rented")
    void start_confirmed_rentsVehicle() {
        Booking booking = booking(BookingStatus.CONFIRMED, NOW);
        when(userAccessService.requireStaff(STAFF_ID)).thenReturn(staff);
        when(bookingRepository.findByIdForUpdate(BOOKING_ID)).thenReturn(Optional.of(booking));
        when(bookingRepository.save(booking)).thenReturn(booking);

        bookingService.start(STAFF_ID, BOOKING_ID, new RentalHandoverRequest());

        assertThat(booking.getStatus()).isEqualTo(BookingStatus.ACTIVE);
        assertThat(booking.getPickupMileage()).isEqualTo(18_000);
        assertThat(booking.getActualPickupDate()).isEqualTo(NOW);
        assertThat(vehicle.getStatus()).isEqualTo(VehicleStatus.RENTED);
        verify(vehicleRepository).save(vehicle);
    }

    @Test
    @DisplayName("Returning a vehicle frees it, accrues points and assesses penalties")
    void complete_active_releasesVehicleAndAccrues() {
        Booking booking = booking(BookingStatus.ACTIVE, NOW.minusDays(3));
        booking.setPickupMileage(18_000);
        vehicle.setStatus(VehicleStatus.RENTED);
        when(userAccessService.requireStaff(STAFF_ID)).thenReturn(staff);
        when(bookingRepository.findByIdForUpdate(BOOKING_ID)).thenReturn(Optional.of(booking));
        when(bookingRepository.save(booking)).thenReturn(booking);

        RentalHandoverRequest handover = new RentalHandoverRequest();
        handover.setMileage(18_420);
        bookingService.complete(STAFF_ID, BOOKING_ID, handover);

        assertThat(booking.getStatus()).isEqualTo(BookingStatus.COMPLETED);
        assertThat(booking.isReviewEligible()).isTrue();
        assertThat(booking.getActualReturnDate()).isEqualTo(NOW);
        assertThat(vehicle.getStatus()).isEqualTo(VehicleStatus.AVAILABLE);
        assertThat(vehicle.getCurrentMileage()).isEqualTo(18_420);
        verify(loyaltyService).accrue(booking);
        verify(penaltyService).assessReturn(booking);
    }

    @Test
    @DisplayName("Return mileage below pickup mileage is rejected")
    void complete_mileageBelowPickup_throws() {
        Booking booking = booking(BookingStatus.ACTIVE, NOW.minusDays(3));
        booking.setPickupMileage(18_000);
        when(userAccessService.requireStaff(STAFF_ID)).thenReturn(staff);
        when(bookingRepository.findByIdForUpdate(BOOKING_ID)).thenReturn(Optional.of(booking));

        RentalHandoverRequest handover = new RentalHandoverRequest();
        handover.setMileage(17_500);

        assertThatThrownBy(() -> bookingService.complete(STAFF_ID, BOOKING_ID, handover))
                .isInstanceOf(BusinessRuleException.class);
        verifyNoInteractions(loyaltyService, penaltyService);
    }

    @Test
    @DisplayName("A confirmed booking can be marked as a no-show")
    void markNoShow_requiresConfirmed() {
        ArgumentCaptor<Booking> saved = ArgumentCaptor.forClass(Booking.class);
        Booking booking = booking(BookingStatus.CONFIRMED, NOW.minusHours(3));
        when(userAccessService.requireStaff(STAFF_ID)).thenReturn(staff);
        when(bookingRepository.findByIdForUpdate(BOOKING_ID)).thenReturn(Optional.of(booking));
        when(bookingRepository.save(saved.capture())).thenReturn(booking);

        bookingService.markNoShow(STAFF_ID, BOOKING_ID);

        assertThat(saved.getValue().getStatus()).isEqualTo(BookingStatus.NO_SHOW);
    }

    // ── Terminal states ───────────────────────────────────────────────────────

    @ParameterizedTest
    @EnumSource(value = BookingStatus.class, names = {"COMPLETED", "CANCELLED", "NO_SHOW"})
    @DisplayName("A finished booking cannot be started")
    void start_finishedBooking_throws(BookingStatus status) {
        when(userAccessService.requireStaff(STAFF_ID)).thenReturn(staff);
        when(bookingRepository.findByIdForUpdate(BOOKING_ID)).thenReturn(Optional.of(booking(status, NOW)));

        assertThatThrownBy(() -> bookingService.start(STAFF_ID, BOOKING_ID, new RentalHandoverRequest()))
                .isInstanceOf(InvalidTransitionException.class);
        verify(bookingRepository, never()).save(any());
        verifyNoInteractions(vehicleRepository);
    }

    @ParameterizedTest
    @EnumSource(value = BookingStatus.class, names = {"COMPLETED", "CANCELLED", "NO_SHOW"})
    @DisplayName("A finished booking cannot be completed")
    void complete_finishedBooking_throws(BookingStatus status) {
        when(userAccessService.requireStaff(STAFF_ID)).thenReturn(staff);
        when(bookingRepository.findByIdForUpdate(BOOKING_ID))
                .thenReturn(Optional.of(booking(status, NOW.minusDays(3))));

        assertThatThrownBy(() -> bookingService.complete(STAFF_ID, BOOKING_ID, new RentalHandoverRequest()))
                .isInstanceOf(InvalidTransitionException.class);
        verify(bookingRepository, never()).save(any());
        verifyNoInteractions(loyaltyService, penaltyService);
    }

    @ParameterizedTest
    @EnumSource(value = BookingStatus.class, names = {"COMPLETED", "CANCELLED", "NO_SHOW"})
    @DisplayName("A finished booking cannot be cancelled even before its pickup time")
    void cancel_finishedBooking_throws(BookingStatus status) {
        Booking booking = booking(status, NOW.plusDays(1));
        when(bookingRepository.findByIdForUpdate(BOOKING_ID)).thenReturn(Optional.of(booking));
        when(userAccessService.requireOwnerOrStaff(STAFF_ID, customer)).thenReturn(staff);

        assertThatThrownBy(() -> bookingService.cancel(STAFF_ID, BOOKING_ID, "Late change"))
                .isInstanceOf(InvalidTransitionException.class);
        assertThat(booking.getStatus()).isEqualTo(status);
        verify(bookingRepository, never()).save(any());
    }

    @ParameterizedTest
    @EnumSource(value = BookingStatus.class, names = {"COMPLETED", "CANCELLED", "NO_SHOW"})
    @DisplayName("A finished booking cannot be marked as a no-show")
    void markNoShow_finishedBooking_throws(BookingStatus status) {
        when(userAccessService.requireStaff(STAFF_ID)).thenReturn(staff);
        when(bookingRepository.findByIdForUpdate(BOOKING_ID))
                .thenReturn(Optional.of(booking(status, NOW.minusHours(3))));

        assertThatThrownBy(() -> bookingService.markNoShow(STAFF_ID, BOOKING_ID))
                .isInstanceOf(InvalidTransitionException.class);
        verify(bookingRepository, never()).save(any());
    }

    @ParameterizedTest
    @EnumSource(value = BookingStatus.class, names = {"CANCELLED", "NO_SHOW"})
    @DisplayName("Cancelled and no-show bookings cannot be confirmed")
    void confirm_finishedBooking_throws(BookingStatus status) {
        when(userAccessService.requireStaff(STAFF_ID)).thenReturn(staff);
        when(bookingRepository.findByIdForUpdate(BOOKING_ID))
                .thenReturn(Optional.of(booking(status, NOW.plusDays(1))));

        assertThatThrownBy(() -> bookingService.confirm(STAFF_ID, BOOKING_ID))
                .isInstanceOf(InvalidTransitionException.class);
        verify(bookingRepository, never()).save(any());
    }
}
