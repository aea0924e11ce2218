package com.carhire.rental.service;

import com.carhire.rental.dto.PaymentRequest;
import com.carhire.rental.dto.PaymentResponse;
import com.carhire.rental.entity.*;
import com.carhire.rental.exception.BusinessRuleException;
import com.carhire.rental.exception.InvalidTransitionException;
import com.carhire.rental.exception.ResourceNotFoundException;
import com.carhire.rental.repository.BookingRepository;
import com.carhire.rental.repository.PaymentMethodRepository;
import com.carhire.rental.repository.PaymentRepository;
import com.carhire.rental.util.PricingUtil;
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
 * Payment lifecycle:
 * PENDING → PROCESSING → COMPLETED → PARTIALLY_REFUNDED / REFUNDED,
 * and PENDING/PROCESSING → FAILED / CANCELLED.
 *
 * Status changes read the payment with a row lock. Every settled change
 * refreshes the booking's payment status.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentService {

    private final PaymentRepository paymentRepository;
    private final PaymentMethodRepository paymentMethodRepository;
    private final BookingRepository bookingRepository;
    private final IdentifierService identifierService;
    private final BillingDocumentService billingDocumentService;
    private final UserAccessService userAccessService;
    private final NotificationService notificationService;
    private final Clock clock;

    @Transactional
    public PaymentResponse create(Long actorId, PaymentRequest request) {
        Booking booking = bookingRepository.findById(request.getBookingId())
                .orElseThrow(() -> new ResourceNotFoundException("Booking", request.getBookingId()));
        userAccessService.requireOwnerOrStaff(actorId, booking.getCustomer());
        if (booking.getStatus() == BookingStatus.CANCELLED || booking.getStatus() == BookingStatus.NO_SHOW) {
            throw new BusinessRuleException("Cannot take payment for a " + booking.getStatus() + " booking");
        }

        PaymentMethod method = null;
        BigDecimal gatewayFee = BigDecimal.ZERO;
        if (request.getPaymentMethodId() != null) {
            method = paymentMethodRepository.findById(request.getPaymentMethodId())
                    .filter(PaymentMethod::isActive)
                    .orElseThrow(() -> new ResourceNotFoundException("Payment method", request.getPaymentMethodId()));
            gatewayFee = PricingUtil.percentOf(request.getAmount(), method.getProcessingFeePercentage())
                    .add(method.getProcessingFeeFixed());
        }

        Payment payment = Payment.builder()
                .transactionId(identifierService.nextTransactionId())
                .booking(booking)
                .customer(booking.getCustomer())
                .paymentType(request.getPaymentType() != null ? request.getPaymentType() : PaymentType.BOOKING_PAYMENT)
                .paymentMethod(method)
                .amount(PricingUtil.money(request.getAmount()))
                .currency(request.getCurrency() != null ? request.getCurrency() : "ZAR")
                .gatewayFee(PricingUtil.money(gatewayFee))
                .cardLastFour(request.getCardLastFour())
                .cardType(request.getCardType())
                .description(request.getDescription())
                .build();
        Payment saved = paymentRepository.save(payment);
        log.info("Payment {} of {} {} created for booking {}", saved.getTransactionId(), saved.getAmount(),
                saved.getCurrency(), booking.getBookingReference());
        return PaymentResponse.from(saved);
    }

    @Transactional
    public PaymentResponse process(Long staffId, Long paymentId, String gatewayTransactionId) {
        userAccessService.requireStaff(staffId);
        Payment payment = lock(paymentId);
        if (payment.getStatus() != PaymentStatus.PENDING) {
            throw new InvalidTransitionException("payment " + payment.getTransactionId(), payment.getStatus(), "process");
        }
        payment.setStatus(PaymentStatus.PROCESSING);
        if (gatewayTransactionId != null) {
            payment.setGatewayTransactionId(gatewayTransactionId);
        }
        return changed(payment);
    }

    /**
     * Settles the payment, then issues its receipt, applies it to open
     * invoices and refreshes the booking's payment status.
     */
    @Transactional
    public PaymentResponse complete(Long staffId, Long paymentId, String gatewayTransactionId) {
        userAccessService.requireStaff(staffId);
        Payment payment = lock(paymentId);
        if (payment.getStatus() != PaymentStatus.PENDING && payment.getStatus() != PaymentStatus.PROCESSING) {
            throw new InvalidTransitionException("payment " + payment.getTransactionId(), payment.getStatus(), "complete");
        }
        payment.setStatus(PaymentStatus.COMPLETED);
        payment.setPaymentDate(LocalDateTime.now(clock));
        if (gatewayTransactionId != null) {
            payment.setGatewayTransactionId(gatewayTransactionId);
        }
        paymentRepository.save(payment);

        billingDocumentService.issueReceipt(payment);
        billingDocumentService.applyPayment(payment);
        refreshBookingPaymentStatus(payment.getBooking(), false);
        return changed(payment);
    }

    @Transactional
    public PaymentResponse fail(Long staffId, Long paymentId, String reason) {
        userAccessService.requireStaff(staffId);
        Payment payment = lock(paymentId);
        if (payment.getStatus() != PaymentStatus.PENDING && payment.getStatus() != PaymentStatus.PROCESSING) {
            throw new InvalidTransitionException("payment " + payment.getTransactionId(), payment.getStatus(), "fail");
        }
        payment.setStatus(PaymentStatus.FAILED);
        payment.setFailureReason(reason);

        Booking booking = payment.getBooking();
        if (booking.getPaymentStatus() == BookingPaymentStatus.PENDING) {
            booking.setPaymentStatus(BookingPaymentStatus.FAILED);
            bookingRepository.save(booking);
        }
        log.warn("Payment {} failed: {}", payment.getTransactionId(), reason);
        return changed(payment);
    }

    @Transactional
    public PaymentResponse cancel(Long actorId, Long paymentId) {
        Payment payment = lock(paymentId);
        userAccessService.requireOwnerOrStaff(actorId, payment.getCustomer());
        if (payment.getStatus() != PaymentStatus.PENDING && payment.getStatus() != PaymentStatus.PROCESSING) {
            throw new InvalidTransitionException("payment " + payment.getTransactionId(), payment.getStatus(), "cancel");
        }
        payment.setStatus(PaymentStatus.CANCELLED);
        return changed(payment);
    }

    /**
     * Refunds {@code amount} of a COMPLETED payment. The cumulative refund
     * never exceeds the paid amount; reaching it makes the payment REFUNDED,
     * otherwise PARTIALLY_REFUNDED.
     */
    @Transactional
    public PaymentResponse refund(Long staffId, Long paymentId, BigDecimal amount, String reason) {
        User staff = userAccessService.requireStaff(staffId);
        Payment payment = lock(paymentId);
        if (payment.getStatus() != PaymentStatus.COMPLETED) {
            throw new InvalidTransitionException("payment " + payment.getTransactionId(), payment.getStatus(), "refund");
        }
        if (amount == null || amount.signum() <= 0) {
            throw new BusinessRuleException("Refund amount must be positive");
        }
        BigDecimal refunded = payment.getRefundAmount().add(amount);
        if (refunded.compareTo(payment.getAmount()) > 0) {
            throw new BusinessRuleException("Refund of " + amount + " exceeds the refundable balance "
                    + payment.getNetAmount());
        }

        payment.setRefundAmount(PricingUtil.money(refunded));
        payment.setRefundDate(LocalDateTime.now(clock));
        payment.setRefundReason(reason);
        payment.setRefundedBy(staff);
        payment.setStatus(refunded.compareTo(payment.getAmount()) == 0
                ? PaymentStatus.REFUNDED : PaymentStatus.PARTIALLY_REFUNDED);
        paymentRepository.save(payment);

        refreshBookingPaymentStatus(payment.getBooking(), true);
        log.info("Refunded {} on payment {} ({} of {} now refunded)", amount, payment.getTransactionId(),
                payment.getRefundAmount(), payment.getAmount());
        return changed(payment);
    }

    @Transactional(readOnly = true)
    public PaymentResponse get(Long actorId, Long paymentId) {
        Payment payment = find(paymentId);
        userAccessService.requireOwnerOrStaff(actorId, payment.getCustomer());
        return PaymentResponse.from(payment);
    }

    @Transactional(readOnly = true)
    public PaymentResponse getByTransactionId(Long actorId, String transactionId) {
        Payment payment = paymentRepository.findByTransactionId(transactionId)
                .orElseThrow(() -> new ResourceNotFoundException("Payment not found with transaction id: " + transactionId));
        userAccessService.requireOwnerOrStaff(actorId, payment.getCustomer());
        return PaymentResponse.from(payment);
    }

    @Transactional(readOnly = true)
    public List<PaymentResponse> forBooking(Long actorId, Long bookingId) {
        Booking booking = bookingRepository.findById(bookingId)
                .orElseThrow(() -> new ResourceNotFoundException("Booking", bookingId));
        userAccessService.requireOwnerOrStaff(actorId, booking.getCustomer());
        return paymentRepository.findByBookingIdOrderByCreatedAtDesc(bookingId).stream()
                .map(PaymentResponse::from)
                .collect(Collectors.toList());
    }

    /**
     * Derives the booking's payment status from the net of its settled
     * payments against its total.
     */
    void refreshBookingPaymentStatus(Booking booking, boolean afterRefund) {
        BigDecimal net = paymentRepository.sumNetAmountByBooking(booking.getId(), BillingDocumentService.SETTLED);
        BookingPaymentStatus status;
        if (net.compareTo(booking.getTotalAmount()) >= 0 && net.signum() > 0) {
            status = BookingPaymentStatus.PAID;
        } else if (net.signum() > 0) {
            status = BookingPaymentStatus.PARTIAL;
        } else {
            status = afterRefund ? BookingPaymentStatus.REFUNDED : BookingPaymentStatus.PENDING;
        }
        if (booking.getPaymentStatus() != status) {
            log.info("Booking {} payment status {} → {}", booking.getBookingReference(), booking.getPaymentStatus(), status);
            booking.setPaymentStatus(status);
            bookingRepository.save(booking);
        }
    }

    private PaymentResponse changed(Payment payment) {
        Payment saved = paymentRepository.save(payment);
        notificationService.paymentStatusChanged(saved.getId(), saved.getTransactionId(),
                saved.getBooking().getId(), saved.getStatus(), saved.getAmount());
        return PaymentResponse.from(saved);
    }

    private Payment lock(Long paymentId) {
        return paymentRepository.findByIdForUpdate(paymentId)
                .orElseThrow(() -> new ResourceNotFoundException("Payment", paymentId));
    }

    private Payment find(Long paymentId) {
        return paymentRepository.findById(paymentId)
                .orElseThrow(() -> new ResourceNotFoundException("Payment", paymentId));
    }
}
