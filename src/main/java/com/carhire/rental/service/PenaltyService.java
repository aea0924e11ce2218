package com.carhire.rental.service;

import com.carhire.rental.dto.PenaltyRequest;
import com.carhire.rental.dto.PenaltyResponse;
import com.carhire.rental.entity.Booking;
import com.carhire.rental.entity.Penalty;
import com.carhire.rental.entity.PenaltyStatus;
import com.carhire.rental.entity.PenaltyType;
import com.carhire.rental.entity.User;
import com.carhire.rental.exception.AccessDeniedException;
import com.carhire.rental.exception.InvalidTransitionException;
import com.carhire.rental.exception.ResourceNotFoundException;
import com.carhire.rental.repository.BookingRepository;
import com.carhire.rental.repository.PenaltyRepository;
import com.carhire.rental.util.PricingUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Charges raised against a booking, plus the automatic late-return and
 * fuel-shortage assessment run when a rental is completed.
 *
 * Lifecycle: PENDING → APPROVED → PAID, with DISPUTED reachable from
 * PENDING/APPROVED and WAIVED from anything not yet PAID.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PenaltyService {

    private final PenaltyRepository penaltyRepository;
    private final BookingRepository bookingRepository;
    private final UserAccessService userAccessService;
    private final Clock clock;

    @Value("${app.penalty.fuel-charge-per-unit:20.00}")
    private BigDecimal fuelChargePerUnit;

    @Value("${app.penalty.late-grace-minutes:60}")
    private long lateGraceMinutes;

    @Transactional
    public PenaltyResponse create(Long actorId, PenaltyRequest request) {
        userAccessService.requireStaff(actorId);
        Booking booking = bookingRepository.findById(request.getBookingId())
                .orElseThrow(() -> new ResourceNotFoundException("Booking", request.getBookingId()));
        Penalty penalty = penaltyRepository.save(newPenalty(booking, request.getPenaltyType(),
                request.getDescription(), PricingUtil.money(request.getAmount())));
        log.info("Penalty {} of {} raised on booking {}", penalty.getPenaltyType(), penalty.getAmount(),
                booking.getBookingReference());
        return PenaltyResponse.from(penalty);
    }

    @Transactional(readOnly = true)
    public PenaltyResponse get(Long actorId, Long id) {
        Penalty penalty = find(id);
        userAccessService.requireOwnerOrStaff(actorId, penalty.getCustomer());
        return PenaltyResponse.from(penalty);
    }

    @Transactional(readOnly = true)
    public List<PenaltyResponse> forBooking(Long actorId, Long bookingId) {
        Booking booking = bookingRepository.findById(bookingId)
                .orElseThrow(() -> new ResourceNotFoundException("Booking", bookingId));
        userAccessService.requireOwnerOrStaff(actorId, booking.getCustomer());
        return penaltyRepository.findByBookingIdOrderByCreatedAtDesc(bookingId).stream()
                .map(PenaltyResponse::from)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public List<PenaltyResponse> mine(Long actorId) {
        return penaltyRepository.findByCustomerIdOrderByCreatedAtDesc(actorId).stream()
                .map(PenaltyResponse::from)
                .collect(Collectors.toList());
    }

    /** Customer contests a charge. */
    @Transactional
    public PenaltyResponse dispute(Long actorId, Long id, String reason) {
        Penalty penalty = find(id);
        User actor = userAccessService.requireUser(actorId);
        if (!actor.getId().equals(penalty.getCustomer().getId())) {
            throw new AccessDeniedException("Only the charged customer can dispute a penalty");
        }
        if (penalty.getStatus() != PenaltyStatus.PENDING && penalty.getStatus() != PenaltyStatus.APPROVED) {
            throw new InvalidTransitionException("penalty", penalty.getStatus(), "dispute");
        }
        penalty.setStatus(PenaltyStatus.DISPUTED);
        penalty.setDisputed(true);
        penalty.setDisputeReason(reason);
        penalty.setDisputeDate(LocalDateTime.now(clock));
        log.info("Penalty #{} disputed by customer #{}", id, actorId);
        return PenaltyResponse.from(penaltyRepository.save(penalty));
    }

    @Transactional
    public PenaltyResponse approve(Long actorId, Long id, String resolution) {
        User staff = userAccessService.requireStaff(actorId);
        Penalty penalty = find(id);
        if (penalty.getStatus() != PenaltyStatus.PENDING && penalty.getStatus() != PenaltyStatus.DISPUTED) {
            throw new InvalidTransitionException("penalty", penalty.getStatus(), "approve");
        }
        if (penalty.getStatus() == PenaltyStatus.DISPUTED) {
            penalty.setDisputeResolution(resolution);
        }
        penalty.setStatus(PenaltyStatus.APPROVED);
        penalty.setApprovedBy(staff);
        return PenaltyResponse.from(penaltyRepository.save(penalty));
    }

    @Transactional
    public PenaltyResponse waive(Long actorId, Long id, String resolution) {
        userAccessService.requireStaff(actorId);
        Penalty penalty = find(id);
        if (penalty.getStatus() == PenaltyStatus.PAID || penalty.getStatus() == PenaltyStatus.WAIVED) {
            throw new InvalidTransitionException("penalty", penalty.getStatus(), "waive");
        }
        penalty.setStatus(PenaltyStatus.WAIVED);
        penalty.setDisputeResolution(resolution);
        log.info("Penalty #{} waived", id);
        return PenaltyResponse.from(penaltyRepository.save(penalty));
    }

    @Transactional
    public PenaltyResponse markPaid(Long actorId, Long id) {
        userAccessService.requireStaff(actorId);
        Penalty penalty = find(id);
        if (penalty.getStatus() != PenaltyStatus.APPROVED) {
            throw new InvalidTransitionException("penalty", penalty.getStatus(), "mark paid");
        }
        penalty.setStatus(PenaltyStatus.PAID);
        return PenaltyResponse.from(penaltyRepository.save(penalty));
    }

    /**
     * Raises late-return and fuel-shortage penalties for a booking that has
     * just been returned. Late days are billed per started 24 hours past the
     * grace period at the booking's daily rate; missing fuel is billed per
     * litre of tank capacity.
     */
    @Transactional
    public List<Penalty> assessReturn(Booking booking) {
        List<Penalty> raised = new ArrayList<>();

        LocalDateTime returnedAt = booking.getActualReturnDate();
        if (returnedAt != null) {
            long minutesLate = Duration.between(booking.getReturnDate(), returnedAt).toMinutes();
            if (minutesLate > lateGraceMinutes) {
                long lateDays = (minutesLate + 24 * 60 - 1) / (24 * 60);
                BigDecimal amount = PricingUtil.subtotal(booking.getDailyRate(), (int) lateDays);
                raised.add(newPenalty(booking, PenaltyType.LATE_RETURN,
                        "Returned " + lateDays + " day(s) late", amount));
            }
        }

        BigDecimal tank = booking.getVehicle().getFuelTankCapacity();
        if (tank != null && booking.getPickupFuelLevel() != null && booking.getReturnFuelLevel() != null
                && booking.getReturnFuelLevel().compareTo(booking.getPickupFuelLevel()) < 0) {
            BigDecimal shortage = booking.getPickupFuelLevel().subtract(booking.getReturnFuelLevel());
            BigDecimal amount = PricingUtil.money(shortage.multiply(tank).multiply(fuelChargePerUnit));
            if (amount.signum() > 0) {
                raised.add(newPenalty(booking, PenaltyType.FUEL_SHORTAGE,
                        "Fuel returned at " + booking.getReturnFuelLevel() + " of tank, collected at "
                                + booking.getPickupFuelLevel(), amount));
            }
        }

        if (!raised.isEmpty()) {
            penaltyRepository.saveAll(raised);
            log.info("Raised {} return penalt{} on booking {}", raised.size(),
                    raised.size() == 1 ? "y" : "ies", booking.getBookingReference());
        }
        return raised;
    }

    private Penalty newPenalty(Booking booking, PenaltyType type, String description, BigDecimal amount) {
        return Penalty.builder()
                .booking(booking)
                .customer(booking.getCustomer())
                .penaltyType(type)
                .description(description)
                .amount(amount)
                .build();
    }

    private Penalty find(Long id) {
        return penaltyRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Penalty", id));
    }
}
