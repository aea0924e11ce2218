package com.carhire.rental.service;

import com.carhire.rental.dto.PromotionRequest;
import com.carhire.rental.entity.Booking;
import com.carhire.rental.entity.BookingStatus;
import com.carhire.rental.entity.DiscountType;
import com.carhire.rental.entity.Promotion;
import com.carhire.rental.exception.BusinessRuleException;
import com.carhire.rental.exception.DuplicateResourceException;
import com.carhire.rental.exception.ResourceNotFoundException;
import com.carhire.rental.repository.BookingRepository;
import com.carhire.rental.repository.PromotionRepository;
import com.carhire.rental.util.PricingUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Service
@RequiredArgsConstructor
@Slf4j
public class PromotionService {

    private final PromotionRepository promotionRepository;
    private final BookingRepository bookingRepository;
    private final UserAccessService userAccessService;
    private final Clock clock;

    public List<Promotion> currentPublic() {
        return promotionRepository.findCurrentPublic(LocalDateTime.now(clock));
    }

    public List<Promotion> list(Long actorId) {
        userAccessService.requireStaff(actorId);
        return promotionRepository.findAll();
    }

    public Promotion get(Long id) {
        return promotionRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Promotion", id));
    }

    @Transactional
    public Promotion create(Long actorId, PromotionRequest request) {
        userAccessService.requireStaff(actorId);
        String code = normalise(request.getCode());
        if (promotionRepository.existsByCodeIgnoreCase(code)) {
            throw new DuplicateResourceException("Promotion code already exists: " + code);
        }
        Promotion promotion = new Promotion();
        promotion.setCode(code);
        apply(promotion, request);
        Promotion saved = promotionRepository.save(promotion);
        log.info("Created promotion {} ({} {})", saved.getCode(), saved.getDiscountType(), saved.getDiscountValue());
        return saved;
    }

    @Transactional
    public Promotion update(Long actorId, Long id, PromotionRequest request) {
        userAccessService.requireStaff(actorId);
        Promotion promotion = get(id);
        String code = normalise(request.getCode());
        if (!promotion.getCode().equalsIgnoreCase(code) && promotionRepository.existsByCodeIgnoreCase(code)) {
            throw new DuplicateResourceException("Promotion code already exists: " + code);
        }
        promotion.setCode(code);
        apply(promotion, request);
        return promotionRepository.save(promotion);
    }

    @Transactional
    public Promotion setActive(Long actorId, Long id, boolean active) {
        userAccessService.requireStaff(actorId);
        Promotion promotion = get(id);
        promotion.setActive(active);
        return promotionRepository.save(promotion);
    }

    /**
     * Discount {@code code} would give on {@code booking}, without redeeming
     * it. The booking must already be priced.
     *
     * @throws BusinessRuleException when the code is unknown or not applicable
     */
    public BigDecimal validate(String code, Booking booking) {
        Promotion promotion = promotionRepository.findByCodeIgnoreCase(code.trim())
                .orElseThrow(() -> new BusinessRuleException("Unknown promotion code: " + code));
        checkApplicable(promotion, booking);
        return discountFor(promotion, booking);
    }

    /**
     * Applies {@code code} to {@code booking}: sets the discount and code on
     * the booking and counts the use. Runs under a lock on the promotion row
     * so the usage limit cannot be overrun. The caller reprices afterwards.
     */
    @Transactional
    public BigDecimal redeem(String code, Booking booking) {
        Promotion promotion = promotionRepository.findByCodeForUpdate(code.trim())
                .orElseThrow(() -> new BusinessRuleException("Unknown promotion code: " + code));
        checkApplicable(promotion, booking);

        BigDecimal discount = discountFor(promotion, booking);
        booking.setDiscountAmount(discount);
        booking.setPromotionCode(promotion.getCode());
        promotion.setUsageCount(promotion.getUsageCount() + 1);
        promotionRepository.save(promotion);

        log.info("Promotion {} redeemed on booking {} for {}", promotion.getCode(),
                booking.getBookingReference(), discount);
        return discount;
    }

    /** Checks {@code code} against one of the caller's bookings without redeeming it. */
    @Transactional(readOnly = true)
    public Map<String, Object> preview(Long actorId, String code, Long bookingId) {
        Booking booking = bookingRepository.findById(bookingId)
                .orElseThrow(() -> new ResourceNotFoundException("Booking", bookingId));
        userAccessService.requireOwnerOrStaff(actorId, booking.getCustomer());
        BigDecimal discount = validate(code, booking);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("code", normalise(code));
        result.put("bookingId", bookingId);
        result.put("discountAmount", discount);
        return result;
    }

    BigDecimal discountFor(Promotion promotion, Booking booking) {
        BigDecimal subtotal = booking.getSubtotal();
        BigDecimal discount;
        if (promotion.getDiscountType() == DiscountType.PERCENTAGE) {
            discount = PricingUtil.percentOf(subtotal, promotion.getDiscountValue());
            if (promotion.getMaxDiscountAmount() != null) {
                discount = discount.min(promotion.getMaxDiscountAmount());
            }
        } else if (promotion.getDiscountType() == DiscountType.FREE_DAYS) {
            int freeDays = Math.min(promotion.getDiscountValue().intValue(), booking.getTotalDays());
            discount = PricingUtil.subtotal(booking.getDailyRate(), freeDays);
        } else {
            discount = promotion.getDiscountValue();
        }
        return PricingUtil.money(discount.min(subtotal).max(BigDecimal.ZERO));
    }

    private void checkApplicable(Promotion promotion, Booking booking) {
        LocalDateTime now = LocalDateTime.now(clock);
        if (!promotion.isActive() || !promotion.isWithinWindow(now)) {
            throw new BusinessRuleException("Promotion " + promotion.getCode() + " is not currently valid");
        }
        if (promotion.isExhausted()) {
            throw new BusinessRuleException("Promotion " + promotion.getCode() + " has reached its usage limit");
        }
        if (booking.getCustomer() != null && booking.getCustomer().getId() != null) {
            long used = bookingRepository.countByCustomerIdAndPromotionCodeIgnoreCaseAndStatusNot(
                    booking.getCustomer().getId(), promotion.getCode(), BookingStatus.CANCELLED);
            if (used >= promotion.getPerCustomerLimit()) {
                throw new BusinessRuleException("Promotion " + promotion.getCode() + " already used");
            }
        }
        if (promotion.getMinBookingAmount() != null
                && booking.getSubtotal().compareTo(promotion.getMinBookingAmount()) < 0) {
            throw new BusinessRuleException("Booking amount is below the promotion minimum of "
                    + promotion.getMinBookingAmount());
        }
        if (promotion.getMinRentalDays() != null && booking.getTotalDays() < promotion.getMinRentalDays()) {
            throw new BusinessRuleException("Promotion requires at least " + promotion.getMinRentalDays()
                    + " rental days");
        }
    }

    private void apply(Promotion promotion, PromotionRequest request) {
        if (!request.getEndDate().isAfter(request.getStartDate())) {
            throw new BusinessRuleException("Promotion end date must be after start date");
        }
        if (request.getDiscountType() == DiscountType.PERCENTAGE
                && request.getDiscountValue().compareTo(BigDecimal.valueOf(100)) > 0) {
            throw new BusinessRuleException("Percentage discount cannot exceed 100");
        }
        promotion.setName(request.getName());
        promotion.setDescription(request.getDescription());
        promotion.setDiscountType(request.getDiscountType());
        promotion.setDiscountValue(request.getDiscountValue());
        promotion.setMaxDiscountAmount(request.getMaxDiscountAmount());
        promotion.setStartDate(request.getStartDate());
        promotion.setEndDate(request.getEndDate());
        promotion.setUsageLimit(request.getUsageLimit());
        promotion.setPerCustomerLimit(request.getPerCustomerLimit() != null ? request.getPerCustomerLimit() : 1);
        promotion.setMinBookingAmount(request.getMinBookingAmount());
        promotion.setMinRentalDays(request.getMinRentalDays());
        promotion.setPublicPromotion(request.isPublicPromotion());
    }

    private String normalise(String code) {
        return code.trim().toUpperCase(Locale.ROOT);
    }
}
