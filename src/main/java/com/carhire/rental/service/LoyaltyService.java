package com.carhire.rental.service;

import com.carhire.rental.entity.Booking;
import com.carhire.rental.entity.LoyaltyProgram;
import com.carhire.rental.entity.LoyaltyTier;
import com.carhire.rental.entity.User;
import com.carhire.rental.repository.LoyaltyProgramRepository;
import com.carhire.rental.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Points accrual on completed rentals and tier placement.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LoyaltyService {

    private final LoyaltyProgramRepository loyaltyProgramRepository;
    private final UserRepository userRepository;

    /**
     * Credits floor(total × points-per-unit of the customer's tier) to the
     * customer, records it on the booking and re-places the customer's tier.
     *
     * @return points credited
     */
    public int accrue(Booking booking) {
        User customer = booking.getCustomer();
        BigDecimal rate = loyaltyProgramRepository.findByTierAndActiveTrue(customer.getLoyaltyTier())
                .map(LoyaltyProgram::getPointsPerUnit)
                .orElse(BigDecimal.ONE);

        int points = booking.getTotalAmount().multiply(rate).setScale(0, RoundingMode.FLOOR).intValue();
        if (points <= 0) {
            return 0;
        }

        LoyaltyTier before = customer.getLoyaltyTier();
        customer.setLoyaltyPoints(customer.getLoyaltyPoints() + points);
        customer.setLoyaltyTier(tierFor(customer.getLoyaltyPoints()));
        booking.setLoyaltyPointsEarned(booking.getLoyaltyPointsEarned() + points);
        userRepository.save(customer);

        log.info("Customer #{} earned {} loyalty points on booking {} (balance {})",
                customer.getId(), points, booking.getBookingReference(), customer.getLoyaltyPoints());
        if (before != customer.getLoyaltyTier()) {
            log.info("Customer #{} moved from {} to {}", customer.getId(), before, customer.getLoyaltyTier());
        }
        return points;
    }

    /** Highest active tier whose threshold the balance reaches; BRONZE otherwise. */
    public LoyaltyTier tierFor(int points) {
        for (LoyaltyProgram program : loyaltyProgramRepository.findByActiveTrueOrderByMinPointsRequiredDesc()) {
            if (points >= program.getMinPointsRequired()) {
                return program.getTier();
            }
        }
        return LoyaltyTier.BRONZE;
    }

    public List<LoyaltyProgram> programs() {
        return loyaltyProgramRepository.findByActiveTrueOrderByMinPointsRequiredDesc();
    }
}
