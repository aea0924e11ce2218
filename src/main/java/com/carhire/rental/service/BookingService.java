package com.carhire.rental.service;

import com.carhire.rental.dto.AddOnRequest;
import com.carhire.rental.dto.AdditionalDriverRequest;
import com.carhire.rental.dto.BookingRequest;
import com.carhire.rental.dto.BookingResponse;
import com.carhire.rental.dto.RentalHandoverRequest;
import com.carhire.rental.entity.*;
import com.carhire.rental.exception.BusinessRuleException;
import com.carhire.rental.exception.DuplicateResourceException;
import com.carhire.rental.exception.InvalidTransitionException;
import com.carhire.rental.exception.ResourceNotFoundException;
import com.carhire.rental.repository.BookingAddOnRepository;
import com.carhire.rental.repository.BookingRepository;
import com.carhire.rental.repository.UserRepository;
import com.carhire.rental.repository.VehicleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Booking lifecycle.
 *
 * <pre>
 *   PENDING ──confirm──▶ CONFIRMED ──start──▶ ACTIVE ──complete──▶ COMPLETED
 *      │                    │  │
 *      └──cancel──▶ CANCELLED ◀┘  └──no-show──▶ NO_SHOW
 * </pre>
 *
 * Every transition reads the booking with a row lock, so two concurrent
 * requests on the same booking serialise and the second one sees the
 * first one's status. Terminal states accept no transition.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BookingService {

    private final BookingRepository bookingRepository;
    private final VehicleRepository vehicleRepository;
    private final BookingAddOnRepository addOnRepository;
    private final UserRepository userRepository;
    private final UserAccessService userAccessService;
    private final IdentifierService identifierService;
    private final PricingService pricingService;
    private final PromotionService promotionService;
    private final LoyaltyService loyaltyService;
    private final PenaltyService penaltyService;
    private final NotificationService notificationService;
    private final Clock clock;

    /**
     * Creates a PENDING booking for the caller.
     *
     * Steps:
     * 1. Check the customer may book
     * 2. Lock the vehicle row so concurrent requests for it queue up
     * 3. Validate dates, availability and overlap with live bookings
     * 4. Generate the reference, price, apply any promotion, re-price
     */
    @Transactional
    public BookingResponse create(Long customerId, BookingRequest request) {
        LocalDateTime now = LocalDateTime.now(clock);

        // Step 1
        User customer = userAccessService.requireUser(customerId);
        if (!customer.isActive() || customer.isSuspended()) {
            throw new BusinessRuleException("Account is not allowed to make bookings");
        }

        // Step 2
        Vehicle vehicle = vehicleRepository.findByIdForUpdate(request.getVehicleId())
                .orElseThrow(() -> new ResourceNotFoundException("Vehicle", request.getVehicleId()));

        // Step 3
        if (!request.getReturnDate().isAfter(request.getPickupDate())) {
            throw new BusinessRuleException("Return date must be after pickup date");
        }
        if (request.getPickupDate().isBefore(now)) {
            throw new BusinessRuleException("Pickup date cannot be in the past");
        }
        if (!vehicle.isAvailableForBooking()) {
            throw new BusinessRuleException("Vehicle " + vehicle.getLicensePlate() + " is not available for booking");
        }
        long overlapping = bookingRepository.countOverlapping(vehicle.getId(),
                request.getPickupDate(), request.getReturnDate(), BookingStatus.BLOCKING);
        if (overlapping > 0) {
            throw new BusinessRuleException("Vehicle is already booked for the selected dates");
        }

        // Step 4
        Booking booking = Booking.builder()
                .bookingReference(identifierService.nextBookingReference())
                .customer(customer)
                .vehicle(vehicle)
                .pickupDate(request.getPickupDate())
                .returnDate(request.getReturnDate())
                .pickupLocation(request.getPickupLocation())
                .returnLocation(request.getReturnLocation())
                .dailyRate(vehicle.getDailyRate())
                .securityDeposit(vehicle.getSecurityDeposit())
                .insuranceSelected(request.isInsuranceSelected())
                .insuranceType(request.getInsuranceType())
                .insuranceCost(request.getInsuranceCost() != null ? request.getInsuranceCost() : BigDecimal.ZERO)
                .specialRequests(request.getSpecialRequests())
                .build();
        booking.setCreatedAt(now);
        pricingService.recalculate(booking);

        if (request.getPromotionCode() != null && !request.getPromotionCode().isBlank()) {
            promotionService.redeem(request.getPromotionCode(), booking);
            pricingService.recalculate(booking);
        }

        Booking saved = bookingRepository.save(booking);
        log.info("Booking {} created for customer #{}, vehicle {}, {} day(s), total {}",
                saved.getBookingReference(), customerId, vehicle.getLicensePlate(),
                saved.getTotalDays(), saved.getTotalAmount());
        notificationService.bookingStatusChanged(saved.getId(), saved.getBookingReference(),
                customerId, saved.getStatus());
        return BookingResponse.from(saved);
    }

    @Transactional
    public BookingResponse confirm(Long staffId, Long bookingId) {
        User staff = userAccessService.requireStaff(staffId);
        Booking booking = lock(bookingId);
        requireStatus(booking, BookingStatus.PENDING, "confirm");

        booking.setStatus(BookingStatus.CONFIRMED);
        booking.setConfirmedAt(LocalDateTime.now(clock));
        booking.setConfirmationSent(true);
        if (booking.getAssignedStaff() == null) {
            booking.setAssignedStaff(staff);
        }
        return transitioned(booking);
    }

    /** Vehicle handed over: CONFIRMED → ACTIVE, vehicle becomes RENTED. */
    @Transactional
    public BookingResponse start(Long staffId, Long bookingId, RentalHandoverRequest handover) {
        User staff = userAccessService.requireStaff(staffId);
        Booking booking = lock(bookingId);
        requireStatus(booking, BookingStatus.CONFIRMED, "start");

        Vehicle vehicle = booking.getVehicle();
        booking.setStatus(BookingStatus.ACTIVE);
        booking.setActualPickupDate(LocalDateTime.now(clock));
        booking.setPickupStaff(staff);
        booking.setPickupMileage(handover.getMileage() != null ? handover.getMileage() : vehicle.getCurrentMileage());
        booking.setPickupFuelLevel(handover.getFuelLevel());
        appendStaffNote(booking, handover.getNotes());

        vehicle.setStatus(VehicleStatus.RENTED);
        vehicleRepository.save(vehicle);
        return transitioned(booking);
    }

    /**
     * Vehicle returned: ACTIVE → COMPLETED. Releases the vehicle, accrues
     * loyalty points, raises late/fuel penalties and opens the booking for
     * review.
     */
    @Transactional
    public BookingResponse complete(Long staffId, Long bookingId, RentalHandoverRequest handover) {
        User staff = userAccessService.requireStaff(staffId);
        Booking booking = lock(bookingId);
        requireStatus(booking, BookingStatus.ACTIVE, "complete");

        Vehicle vehicle = booking.getVehicle();
        Integer returnMileage = handover.getMileage() != null ? handover.getMileage() : booking.getPickupMileage();
        if (returnMileage != null && booking.getPickupMileage() != null && returnMileage < booking.getPickupMileage()) {
            throw new BusinessRuleException("Return mileage " + returnMileage
                    + " is below pickup mileage " + booking.getPickupMileage());
        }

        booking.setStatus(BookingStatus.COMPLETED);
        booking.setActualReturnDate(LocalDateTime.now(clock));
        booking.setReturnStaff(staff);
        booking.setReturnMileage(returnMileage);
        booking.setReturnFuelLevel(handover.getFuelLevel());
        booking.setReviewEligible(true);
        appendStaffNote(booking, handover.getNotes());

        vehicle.setStatus(VehicleStatus.AVAILABLE);
        if (returnMileage != null && returnMileage > vehicle.getCurrentMileage()) {
            vehicle.setCurrentMileage(returnMileage);
        }
        vehicleRepository.save(vehicle);

        loyaltyService.accrue(booking);
        penaltyService.assessReturn(booking);
        return transitioned(booking);
    }

    /** Owner or staff; only while PENDING/CONFIRMED and before pickup. */
    @Transactional
    public BookingResponse cancel(Long actorId, Long bookingId, String reason) {
        Booking booking = lock(bookingId);
        userAccessService.requireOwnerOrStaff(actorId, booking.getCustomer());

        LocalDateTime now = LocalDateTime.now(clock);
        if (!booking.canBeCancelled(now)) {
            throw new InvalidTransitionException("Cannot cancel booking " + booking.getBookingReference()
                    + " in status " + booking.getStatus()
                    + (booking.isModifiable() ? " after its pickup time" : ""));
        }
        booking.setStatus(BookingStatus.CANCELLED);
        booking.setCancelledAt(now);
        booking.setCancellationReason(reason);
        return transitioned(booking);
    }

    @Transactional
    public BookingResponse markNoShow(Long staffId, Long bookingId) {
        userAccessService.requireStaff(staffId);
        Booking booking = lock(bookingId);
        requireStatus(booking, BookingStatus.CONFIRMED, "mark no-show");
        booking.setStatus(BookingStatus.NO_SHOW);
        return transitioned(booking);
    }

    @Transactional
    public BookingResponse addAddOn(Long actorId, Long bookingId, AddOnRequest request) {
        Booking booking = lock(bookingId);
        userAccessService.requireOwnerOrStaff(actorId, booking.getCustomer());
        requireModifiable(booking);

        BookingAddOn addOn = addOnRepository.findById(request.getAddOnId())
                .filter(BookingAddOn::isActive)
                .orElseThrow(() -> new ResourceNotFoundException("Add-on", request.getAddOnId()));
        boolean present = booking.getAddOns().stream()
                .anyMatch(line -> line.getAddOn().getId().equals(addOn.getId()));
        if (present) {
            throw new DuplicateResourceException("Add-on " + addOn.getName() + " is already on this booking");
        }

        booking.getAddOns().add(BookingAddOnAssignment.builder()
                .booking(booking)
                .addOn(addOn)
                .quantity(request.getQuantity())
                .unitPrice(addOn.getPrice())
                .build());
        pricingService.recalculate(booking);
        log.info("Add-on {} x{} added to booking {}", addOn.getName(), request.getQuantity(),
                booking.getBookingReference());
        return BookingResponse.from(bookingRepository.save(booking));
    }

    @Transactional
    public BookingResponse removeAddOn(Long actorId, Long bookingId, Long addOnId) {
        Booking booking = lock(bookingId);
        userAccessService.requireOwnerOrStaff(actorId, booking.getCustomer());
        requireModifiable(booking);

        boolean removed = booking.getAddOns().removeIf(line -> line.getAddOn().getId().equals(addOnId));
        if (!removed) {
            throw new ResourceNotFoundException("Add-on " + addOnId + " is not on booking " + booking.getBookingReference());
        }
        pricingService.recalculate(booking);
        return BookingResponse.from(bookingRepository.save(booking));
    }

    @Transactional
    public BookingResponse addAdditionalDriver(Long actorId, Long bookingId, AdditionalDriverRequest request) {
        Booking booking = lock(bookingId);
        User actor = userAccessService.requireOwnerOrStaff(actorId, booking.getCustomer());
        requireModifiable(booking);

        User driver = userRepository.findById(request.getDriverId())
                .orElseThrow(() -> new ResourceNotFoundException("User", request.getDriverId()));
        if (driver.getId().equals(booking.getCustomer().getId())) {
            throw new BusinessRuleException("The booking customer is already the main driver");
        }
        if (driver.getDriversLicenseNumber() == null) {
            throw new BusinessRuleException("Additional driver has no driver's licence on file");
        }
        boolean present = booking.getAdditionalDrivers().stream()
                .anyMatch(d -> d.getDriver().getId().equals(driver.getId()));
        if (present) {
            throw new DuplicateResourceException("Driver is already on this booking");
        }

        booking.getAdditionalDrivers().add(BookingAdditionalDriver.builder()
                .booking(booking)
                .driver(driver)
                .additionalFee(request.getAdditionalFee() != null ? request.getAdditionalFee() : BigDecimal.ZERO)
                .approved(actor.isStaff())
                .addedAt(LocalDateTime.now(clock))
                .build());
        pricingService.recalculate(booking);
        return BookingResponse.from(bookingRepository.save(booking));
    }

    /** Re-derives the booking's money fields from its current inputs. */
    @Transactional
    public BookingResponse recalculate(Long staffId, Long bookingId) {
        userAccessService.requireStaff(staffId);
        Booking booking = lock(bookingId);
        pricingService.recalculate(booking);
        return BookingResponse.from(bookingRepository.save(booking));
    }

    @Transactional(readOnly = true)
    public BookingResponse get(Long actorId, Long bookingId) {
        Booking booking = find(bookingId);
        userAccessService.requireOwnerOrStaff(actorId, booking.getCustomer());
        return BookingResponse.from(booking);
    }

    @Transactional(readOnly = true)
    public BookingResponse getByReference(Long actorId, String reference) {
        Booking booking = bookingRepository.findByBookingReference(reference)
                .orElseThrow(() -> new ResourceNotFoundException("Booking not found with reference: " + reference));
        userAccessService.requireOwnerOrStaff(actorId, booking.getCustomer());
        return BookingResponse.from(booking);
    }

    /** Staff see every booking, customers their own. */
    @Transactional(readOnly = true)
    public List<BookingResponse> list(Long actorId) {
        User actor = userAccessService.requireUser(actorId);
        List<Booking> bookings = actor.isStaff()
                ? bookingRepository.findAllByOrderByCreatedAtDesc()
                : bookingRepository.findByCustomerIdOrderByCreatedAtDesc(actorId);
        return bookings.stream().map(BookingResponse::from).collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public boolean isOverdue(Long actorId, Long bookingId) {
        Booking booking = find(bookingId);
        userAccessService.requireOwnerOrStaff(actorId, booking.getCustomer());
        return booking.isOverdue(LocalDateTime.now(clock));
    }

    Booking find(Long bookingId) {
        return bookingRepository.findById(bookingId)
                .orElseThrow(() -> new ResourceNotFoundException("Booking", bookingId));
    }

    private Booking lock(Long bookingId) {
        return bookingRepository.findByIdForUpdate(bookingId)
                .orElseThrow(() -> new ResourceNotFoundException("Booking", bookingId));
    }

    private void requireStatus(Booking booking, BookingStatus expected, String action) {
        if (booking.getStatus() != expected) {
            throw new InvalidTransitionException("booking " + booking.getBookingReference(),
                    booking.getStatus(), action);
        }
    }

    private void requireModifiable(Booking booking) {
        if (!booking.isModifiable()) {
            throw new InvalidTransitionException("booking " + booking.getBookingReference(),
                    booking.getStatus(), "modify");
        }
    }

    private void appendStaffNote(Booking booking, String note) {
        if (note == null || note.isBlank()) {
            return;
        }
        booking.setStaffNotes(booking.getStaffNotes() == null ? note : booking.getStaffNotes() + "\n" + note);
    }

    private BookingResponse transitioned(Booking booking) {
        Booking saved = bookingRepository.save(booking);
        log.info("Booking {} → {}", saved.getBookingReference(), saved.getStatus());
        notificationService.bookingStatusChanged(saved.getId(), saved.getBookingReference(),
                saved.getCustomer().getId(), saved.getStatus());
        return BookingResponse.from(saved);
    }
}
