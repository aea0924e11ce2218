package com.carhire.rental.service;

import com.carhire.rental.config.AsyncConfig;
import com.carhire.rental.entity.BookingStatus;
import com.carhire.rental.entity.PaymentStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Publishes booking and payment events to staff consoles over STOMP.
 *
 * Runs on the notification pool; a failed publish is logged and never
 * reaches the request that triggered it. Email/SMS delivery would hook in
 * here as well.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationService {

    public static final String BOOKINGS_TOPIC = "/topic/bookings";
    public static final String PAYMENTS_TOPIC = "/topic/payments";

    private final SimpMessagingTemplate messagingTemplate;

    /**
     * Booking created or moved to a new status. Confirmation is the event
     * customers get notified about.
     */
    @Async(AsyncConfig.NOTIFICATION_EXECUTOR)
    public void bookingStatusChanged(Long bookingId, String bookingReference, Long customerId, BookingStatus status) {
        if (status == BookingStatus.CONFIRMED) {
            log.info("[NOTIFY] Booking {} confirmed, sending confirmation to customer #{}", bookingReference, customerId);
        } else {
            log.info("[NOTIFY] Booking {} is now {}", bookingReference, status);
        }

        Map<String, Object> event = new LinkedHashMap<>();
        event.put("bookingId", bookingId);
        event.put("bookingReference", bookingReference);
        event.put("customerId", customerId);
        event.put("status", status);
        publish(BOOKINGS_TOPIC, event);
    }

    @Async(AsyncConfig.NOTIFICATION_EXECUTOR)
    public void paymentStatusChanged(Long paymentId, String transactionId, Long bookingId,
                                     PaymentStatus status, BigDecimal amount) {
        log.info("[NOTIFY] Payment {} for booking #{} is now {} ({})", transactionId, bookingId, status, amount);

        Map<String, Object> event = new LinkedHashMap<>();
        event.put("paymentId", paymentId);
        event.put("transactionId", transactionId);
        event.put("bookingId", bookingId);
        event.put("status", status);
        event.put("amount", amount);
        publish(PAYMENTS_TOPIC, event);
    }

    private void publish(String destination, Map<String, Object> event) {
        try {
            messagingTemplate.convertAndSend(destination, event);
        } catch (MessagingException e) {
            log.warn("[NOTIFY] Could not publish to {}: {}", destination, e.getMessage());
        }
    }
}
