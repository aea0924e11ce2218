package com.carhire.rental.service;

import com.carhire.rental.dto.ReviewRequest;
import com.carhire.rental.dto.ReviewResponse;
import com.carhire.rental.entity.Booking;
import com.carhire.rental.entity.BookingStatus;
import com.carhire.rental.entity.Review;
import com.carhire.rental.entity.User;
import com.carhire.rental.exception.AccessDeniedException;
import com.carhire.rental.exception.BusinessRuleException;
import com.carhire.rental.exception.DuplicateResourceException;
import com.carhire.rental.exception.ResourceNotFoundException;
import com.carhire.rental.repository.BookingRepository;
import com.carhire.rental.repository.ReviewRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Customer reviews of completed rentals. New reviews wait for moderation
 * and only approved ones are shown publicly.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReviewService {

    private final ReviewRepository reviewRepository;
    private final BookingRepository bookingRepository;
    private final UserAccessService userAccessService;
    private final Clock clock;

    /** One review per booking, by its customer, once the rental is completed. */
    @Transactional
    public ReviewResponse create(Long customerId, ReviewRequest request) {
        Booking booking = bookingRepository.findById(request.getBookingId())
                .orElseThrow(() -> new ResourceNotFoundException("Booking", request.getBookingId()));
        if (!booking.getCustomer().getId().equals(customerId)) {
            throw new AccessDeniedException("Only the booking customer can review it");
        }
        if (booking.getStatus() != BookingStatus.COMPLETED || !booking.isReviewEligible()) {
            throw new BusinessRuleException("Only completed rentals can be reviewed");
        }
        if (reviewRepository.existsByBookingId(booking.getId())) {
            throw new DuplicateResourceException("Booking " + booking.getBookingReference() + " has already been reviewed");
        }

        Review review = reviewRepository.save(Review.builder()
                .customer(booking.getCustomer())
                .booking(booking)
                .vehicle(booking.getVehicle())
                .overallRating(request.getOverallRating())
                .vehicleConditionRating(request.getVehicleConditionRating())
                .serviceRating(request.getServiceRating())
                .valueForMoneyRating(request.getValueForMoneyRating())
                .title(request.getTitle())
                .comment(request.getComment())
                .build());
        log.info("Review #{} ({}/5) submitted for booking {}", review.getId(), review.getOverallRating(),
                booking.getBookingReference());
        return ReviewResponse.from(review);
    }

    @Transactional(readOnly = true)
    public Map<String, Object> forVehicle(Long vehicleId) {
        List<ReviewResponse> reviews = reviewRepository.findByVehicleIdAndApprovedTrueOrderByCreatedAtDesc(vehicleId)
                .stream()
                .map(ReviewResponse::from)
                .collect(Collectors.toList());
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("vehicleId", vehicleId);
        result.put("averageRating", reviewRepository.averageRatingForVehicle(vehicleId));
        result.put("count", reviews.size());
        result.put("reviews", reviews);
        return result;
    }

    @Transactional(readOnly = true)
    public List<ReviewResponse> featured() {
        return reviewRepository.findByFeaturedTrueAndApprovedTrueOrderByCreatedAtDesc().stream()
                .map(ReviewResponse::from)
                .collect(Collectors.toList());
    }

    @Transactional
    public ReviewResponse respond(Long staffId, Long reviewId, String response) {
        User staff = userAccessService.requireStaff(staffId);
        Review review = find(reviewId);
        review.setCompanyResponse(response);
        review.setResponseDate(LocalDateTime.now(clock));
        review.setRespondedBy(staff);
        return ReviewResponse.from(reviewRepository.save(review));
    }

    @Transactional
    public ReviewResponse moderate(Long staffId, Long reviewId, boolean approved) {
        userAccessService.requireStaff(staffId);
        Review review = find(reviewId);
        review.setApproved(approved);
        return ReviewResponse.from(reviewRepository.save(review));
    }

    @Transactional
    public ReviewResponse vote(Long reviewId, boolean helpful) {
        Review review = find(reviewId);
        review.setTotalVotes(review.getTotalVotes() + 1);
        if (helpful) {
            review.setHelpfulVotes(review.getHelpfulVotes() + 1);
        }
        return ReviewResponse.from(reviewRepository.save(review));
    }

    private Review find(Long reviewId) {
        return reviewRepository.findById(reviewId)
                .orElseThrow(() -> new ResourceNotFoundException("Review", reviewId));
    }
}
