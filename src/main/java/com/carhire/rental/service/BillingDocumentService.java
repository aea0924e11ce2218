package com.carhire.rental.service;

import com.carhire.rental.dto.InvoiceResponse;
import com.carhire.rental.dto.ReceiptResponse;
import com.carhire.rental.entity.*;
import com.carhire.rental.exception.BusinessRuleException;
import com.carhire.rental.exception.InvalidTransitionException;
import com.carhire.rental.exception.ResourceNotFoundException;
import com.carhire.rental.repository.BookingRepository;
import com.carhire.rental.repository.InvoiceRepository;
import com.carhire.rental.repository.PaymentRepository;
import com.carhire.rental.repository.ReceiptRepository;
import com.carhire.rental.util.PricingUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Receipts (one per completed payment) and invoices (rollups of a booking).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BillingDocumentService {

    static final Set<PaymentStatus> SETTLED = EnumSet.of(
            PaymentStatus.COMPLETED, PaymentStatus.PARTIALLY_REFUNDED, PaymentStatus.REFUNDED);

    private static final Set<InvoiceStatus> OPEN = EnumSet.of(
            InvoiceStatus.DRAFT, InvoiceStatus.SENT, InvoiceStatus.OVERDUE);

    private final InvoiceRepository invoiceRepository;
    private final ReceiptRepository receiptRepository;
    private final BookingRepository bookingRepository;
    private final PaymentRepository paymentRepository;
    private final IdentifierService identifierService;
    private final PricingService pricingService;
    private final UserAccessService userAccessService;
    private final Clock clock;

    @Value("${app.billing.invoice-due-days:7}")
    private int invoiceDueDays;

    // ── Receipts ──

    /**
     * Returns the receipt of a completed payment, creating it on first call.
     * Calling it again for the same payment returns the existing receipt;
     * the unique payment_id column backs this up.
     */
    @Transactional
    public Receipt issueReceipt(Payment payment) {
        if (payment.getStatus() != PaymentStatus.COMPLETED) {
            throw new InvalidTransitionException("payment " + payment.getTransactionId(),
                    payment.getStatus(), "issue receipt for");
        }
        return receiptRepository.findByPaymentId(payment.getId()).orElseGet(() -> {
            Booking booking = payment.getBooking();
            List<LineItem> lines = new ArrayList<>();
            lines.add(new LineItem(describe(payment.getPaymentType(), booking), 1,
                    payment.getAmount(), payment.getAmount()));

            Receipt receipt = Receipt.builder()
                    .receiptNumber(identifierService.nextReceiptNumber())
                    .payment(payment)
                    .customer(payment.getCustomer())
                    .amount(payment.getAmount())
                    .currency(payment.getCurrency())
                    .paymentMethodUsed(payment.getPaymentMethod() != null
                            ? payment.getPaymentMethod().getName() : "Unspecified")
                    .lineItems(lines)
                    .issueDate(LocalDateTime.now(clock))
                    .build();
            Receipt saved = receiptRepository.save(receipt);
            log.info("Receipt {} issued for payment {}", saved.getReceiptNumber(), payment.getTransactionId());
            return saved;
        });
    }

    @Transactional(readOnly = true)
    public ReceiptResponse receiptForPayment(Long actorId, Long paymentId) {
        Receipt receipt = receiptRepository.findByPaymentId(paymentId)
                .orElseThrow(() -> new ResourceNotFoundException("No receipt for payment " + paymentId));
        userAccessService.requireOwnerOrStaff(actorId, receipt.getCustomer());
        return ReceiptResponse.from(receipt);
    }

    // ── Invoices ──

    /**
     * Builds an invoice from the booking's current pricing, with one line
     * per charge. Paid amount starts at what has been settled against the
     * booking, less what earlier paid invoices already absorbed. A booking
     * has at most one open invoice.
     */
    @Transactional
    public InvoiceResponse generateInvoice(Long staffId, Long bookingId) {
        User staff = userAccessService.requireStaff(staffId);
        Booking booking = bookingRepository.findById(bookingId)
                .orElseThrow(() -> new ResourceNotFoundException("Booking", bookingId));
        LocalDate today = LocalDate.now(clock);

        BigDecimal invoiced = BigDecimal.ZERO;
        for (Invoice existing : invoiceRepository.findByBookingIdOrderByCreatedAtDesc(bookingId)) {
            if (OPEN.contains(existing.getStatus())) {
                throw new BusinessRuleException("Booking " + booking.getBookingReference()
                        + " already has open invoice " + existing.getInvoiceNumber());
            }
            if (existing.getStatus() == InvoiceStatus.PAID) {
                invoiced = invoiced.add(existing.getPaidAmount());
            }
        }

        List<LineItem> lines = new ArrayList<>();
        lines.add(new LineItem("Vehicle rental " + booking.getVehicle().getLicensePlate(),
                booking.getTotalDays(), booking.getDailyRate(), booking.getSubtotal()));
        for (BookingAddOnAssignment addOn : booking.getAddOns()) {
            lines.add(new LineItem(addOn.getAddOn().getName(), addOn.getQuantity(),
                    addOn.getUnitPrice(), addOn.getTotalPrice()));
        }
        for (BookingAdditionalDriver driver : booking.getAdditionalDrivers()) {
            lines.add(new LineItem("Additional driver " + driver.getDriver().getFullName(), 1,
                    driver.getAdditionalFee(), driver.getAdditionalFee()));
        }
        BigDecimal insurance = BigDecimal.ZERO;
        if (booking.isInsuranceSelected() && booking.getInsuranceCost() != null
                && booking.getInsuranceCost().signum() > 0) {
            insurance = booking.getInsuranceCost();
            lines.add(new LineItem("Insurance" + (booking.getInsuranceType() != null
                    ? " (" + booking.getInsuranceType() + ")" : ""), 1, insurance, insurance));
        }

        BigDecimal settled = paymentRepository.sumNetAmountByBooking(bookingId, SETTLED)
                .subtract(invoiced).max(BigDecimal.ZERO);
        BigDecimal total = booking.getTotalAmount();

        Invoice invoice = Invoice.builder()
                .invoiceNumber(identifierService.nextInvoiceNumber())
                .booking(booking)
                .customer(booking.getCustomer())
                .issueDate(today)
                .dueDate(today.plusDays(invoiceDueDays))
                .subtotal(PricingUtil.money(booking.getSubtotal().add(booking.getAdditionalFees()).add(insurance)))
                .taxRate(pricingService.getTaxRate())
                .taxAmount(booking.getTaxAmount())
                .discountAmount(booking.getDiscountAmount())
                .totalAmount(total)
                .paidAmount(PricingUtil.money(settled.min(total)))
                .lineItems(lines)
                .createdBy(staff)
                .build();
        if (invoice.getPaidAmount().compareTo(total) >= 0) {
            invoice.setStatus(InvoiceStatus.PAID);
        }
        Invoice saved = invoiceRepository.save(invoice);
        log.info("Invoice {} generated for booking {}: total {}, balance {}",
                saved.getInvoiceNumber(), booking.getBookingReference(), total, saved.getBalanceDue());
        return InvoiceResponse.from(saved);
    }

    @Transactional(readOnly = true)
    public InvoiceResponse get(Long actorId, Long invoiceId) {
        Invoice invoice = find(invoiceId);
        userAccessService.requireOwnerOrStaff(actorId, invoice.getCustomer());
        return InvoiceResponse.from(invoice);
    }

    @Transactional(readOnly = true)
    public List<InvoiceResponse> forBooking(Long actorId, Long bookingId) {
        Booking booking = bookingRepository.findById(bookingId)
                .orElseThrow(() -> new ResourceNotFoundException("Booking", bookingId));
        userAccessService.requireOwnerOrStaff(actorId, booking.getCustomer());
        return invoiceRepository.findByBookingIdOrderByCreatedAtDesc(bookingId).stream()
                .map(InvoiceResponse::from)
                .collect(Collectors.toList());
    }

    /** DRAFT → SENT; re-sending a SENT/OVERDUE invoice counts as a reminder. */
    @Transactional
    public InvoiceResponse markSent(Long staffId, Long invoiceId, String email) {
        userAccessService.requireStaff(staffId);
        Invoice invoice = find(invoiceId);
        if (invoice.getStatus() == InvoiceStatus.PAID || invoice.getStatus() == InvoiceStatus.CANCELLED) {
            throw new InvalidTransitionException("invoice " + invoice.getInvoiceNumber(), invoice.getStatus(), "send");
        }
        if (invoice.getStatus() == InvoiceStatus.DRAFT) {
            invoice.setStatus(InvoiceStatus.SENT);
        } else {
            invoice.setReminderCount(invoice.getReminderCount() + 1);
        }
        invoice.setSentDate(LocalDateTime.now(clock));
        invoice.setSentToEmail(email != null && !email.isBlank() ? email : invoice.getCustomer().getEmail());
        log.info("Invoice {} sent to {}", invoice.getInvoiceNumber(), invoice.getSentToEmail());
        return InvoiceResponse.from(invoiceRepository.save(invoice));
    }

    @Transactional
    public InvoiceResponse markPaid(Long staffId, Long invoiceId) {
        userAccessService.requireStaff(staffId);
        Invoice invoice = find(invoiceId);
        if (invoice.getStatus() == InvoiceStatus.CANCELLED || invoice.getStatus() == InvoiceStatus.PAID) {
            throw new InvalidTransitionException("invoice " + invoice.getInvoiceNumber(), invoice.getStatus(), "mark paid");
        }
        invoice.setPaidAmount(invoice.getTotalAmount());
        invoice.setStatus(InvoiceStatus.PAID);
        return InvoiceResponse.from(invoiceRepository.save(invoice));
    }

    @Transactional
    public InvoiceResponse cancel(Long staffId, Long invoiceId) {
        userAccessService.requireStaff(staffId);
        Invoice invoice = find(invoiceId);
        if (invoice.getStatus() == InvoiceStatus.PAID || invoice.getStatus() == InvoiceStatus.CANCELLED) {
            throw new InvalidTransitionException("invoice " + invoice.getInvoiceNumber(), invoice.getStatus(), "cancel");
        }
        invoice.setStatus(InvoiceStatus.CANCELLED);
        return InvoiceResponse.from(invoiceRepository.save(invoice));
    }

    /**
     * Spreads a completed payment over the booking's open invoices, oldest
     * first. Fully covered invoices become PAID.
     */
    @Transactional
    public void applyPayment(Payment payment) {
        BigDecimal remaining = payment.getAmount();
        List<Invoice> open = new ArrayList<>(
                invoiceRepository.findByBookingIdAndStatusIn(payment.getBooking().getId(), OPEN));
        open.sort(Comparator.comparing(Invoice::getIssueDate).thenComparing(Invoice::getId));

        for (Invoice invoice : open) {
            if (remaining.signum() <= 0) {
                break;
            }
            BigDecimal applied = remaining.min(invoice.getBalanceDue());
            if (applied.signum() <= 0) {
                continue;
            }
            invoice.setPaidAmount(invoice.getPaidAmount().add(applied));
            if (invoice.getBalanceDue().signum() <= 0) {
                invoice.setStatus(InvoiceStatus.PAID);
            }
            remaining = remaining.subtract(applied);
            invoiceRepository.save(invoice);
            log.debug("Applied {} of payment {} to invoice {}", applied, payment.getTransactionId(),
                    invoice.getInvoiceNumber());
        }
    }

    /** Nightly: flags unpaid invoices past their due date. */
    @Scheduled(cron = "${app.billing.overdue-sweep-cron:0 15 0 * * *}")
    @Transactional
    public int sweepOverdue() {
        int updated = invoiceRepository.markAllOverdue(LocalDate.now(clock), LocalDateTime.now(clock));
        if (updated > 0) {
            log.info("Marked {} invoice(s) overdue", updated);
        }
        return updated;
    }

    private Invoice find(Long invoiceId) {
        return invoiceRepository.findById(invoiceId)
                .orElseThrow(() -> new ResourceNotFoundException("Invoice", invoiceId));
    }

    private String describe(PaymentType type, Booking booking) {
        String what;
        switch (type) {
            case SECURITY_DEPOSIT:
                what = "Security deposit";
                break;
            case ADDITIONAL_CHARGES:
                what = "Additional charges";
                break;
            case PENALTY:
                what = "Penalty payment";
                break;
            default:
                what = "Rental payment";
        }
        return what + " for booking " + booking.getBookingReference();
    }
}
