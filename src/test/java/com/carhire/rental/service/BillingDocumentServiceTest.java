package com.carhire.rental.service;

import com.carhire.rental.dto.InvoiceResponse;
import com.carhire.rental.entity.*;
import com.carhire.rental.exception.BusinessRuleException;
import com.carhire.rental.exception.InvalidTransitionException;
import com.carhire.rental.repository.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for BillingDocumentService: idempotent receipts, invoice
 * rollups and payment application.
 */
@ExtendWith(MockitoExtension.class)
class BillingDocumentServiceTest {

    // ── Mocks ────────────────────────────────────────────────────────────────

    @Mock private InvoiceRepository invoiceRepository;
    @Mock private ReceiptRepository receiptRepository;
    @Mock private BookingRepository bookingRepository;
    @Mock private PaymentRepository paymentRepository;
    @Mock private IdentifierService identifierService;
    @Mock private PricingService    pricingService;
    @Mock private UserAccessService userAccessService;

    private BillingDocumentService billingService;

    // ── Test fixtures ─────────────────────────────────────────────────────────

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 10, 19, 10, 0);
    private static final Long STAFF_ID = 1L;

    private User customer;
    private Booking booking;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        billingService = new BillingDocumentService(invoiceRepository, receiptRepository, bookingRepository,
                paymentRepository, identifierService, pricingService, userAccessService, clock);
        ReflectionTestUtils.setField(billingService, "invoiceDueDays", 7);

        customer = User.builder().id(10L).email("chikondi@example.com").build();
        booking = Booking.builder()
                .id(100L)
                .bookingReference("BK2610190001")
                .customer(customer)
                .vehicle(Vehicle.builder().id(5L).licensePlate("LL 4521").build())
                .totalDays(3)
                .dailyRate(new BigDecimal("50.00"))
                .subtotal(new BigDecimal("150.00"))
                .additionalFees(BigDecimal.ZERO)
                .taxAmount(new BigDecimal("22.50"))
                .totalAmount(new BigDecimal("172.50"))
                .build();
    }

    private Payment completedPayment(String amount) {
        return Payment.builder()
                .id(50L)
                .transactionId("TXN26101910000001")
                .booking(booking)
                .customer(customer)
                .status(PaymentStatus.COMPLETED)
                .amount(new BigDecimal(amount))
                .build();
    }

    private Invoice openInvoice(Long id, String total, LocalDate issued) {
        return Invoice.builder()
                .id(id)
                .invoiceNumber("INV2026000" + id)
                .booking(booking)
                .customer(customer)
                .status(InvoiceStatus.SENT)
                .issueDate(issued)
                .totalAmount(new BigDecimal(total))
                .build();
    }

    @Test
    @DisplayName("First receipt request creates the receipt")
    void issueReceipt_firstCall_createsReceipt() {
        Payment payment = completedPayment("172.50");
        when(receiptRepository.findByPaymentId(50L)).thenReturn(Optional.empty());
        when(identifierService.nextReceiptNumber()).thenReturn("RCP2610190001");
        when(receiptRepository.save(any(Receipt.class))).thenAnswer(inv -> inv.getArgument(0));

        Receipt receipt = billingService.issueReceipt(payment);

        assertThat(receipt.getReceiptNumber()).isEqualTo("RCP2610190001");
        assertThat(receipt.getAmount()).isEqualByComparingTo("172.50");
        assertThat(receipt.getPaymentMethodUsed()).isEqualTo("Unspecified");
        assertThat(receipt.getLineItems()).singleElement()
                .satisfies(line -> assertThat(line.getDescription())
                        .isEqualTo("Rental payment for booking BK2610190001"));
    }

    @Test
    @DisplayName("Issuing a receipt twice returns the existing one")
    void issueReceipt_isIdempotent() {
        Payment payment = completedPayment("172.50");
        Receipt existing = Receipt.builder().id(3L).receiptNumber("RCP2610190001").payment(payment).build();
        when(receiptRepository.findByPaymentId(50L)).thenReturn(Optional.of(existing));

        assertThat(billingService.issueReceipt(payment)).isSameAs(existing);
        verify(identifierService, never()).nextReceiptNumber();
        verify(receiptRepository, never()).save(any());
    }

    @Test
    @DisplayName("Pending payments get no receipt")
    void issueReceipt_pendingPayment_throws() {
        Payment payment = completedPayment("10.00");
        payment.setStatus(PaymentStatus.PENDING);

        assertThatThrownBy(() -> billingService.issueReceipt(payment))
                .isInstanceOf(InvalidTransitionException.class);
        verifyNoInteractions(receiptRepository);
    }

    @Test
    @DisplayName("Invoice mirrors booking pricing and starts with what was already settled")
    void generateInvoice_rollsUpBooking() {
        when(userAccessService.requireStaff(STAFF_ID)).thenReturn(User.builder().id(STAFF_ID).userType(UserType.STAFF).build());
        when(bookingRepository.findById(100L)).thenReturn(Optional.of(booking));
        when(paymentRepository.sumNetAmountByBooking(100L, BillingDocumentService.SETTLED))
                .thenReturn(new BigDecimal("100.00"));
        when(identifierService.nextInvoiceNumber()).thenReturn("INV20260001");
        when(pricingService.getTaxRate()).thenReturn(new BigDecimal("15.00"));
        when(invoiceRepository.save(any(Invoice.class))).thenAnswer(inv -> inv.getArgument(0));

        InvoiceResponse invoice = billingService.generateInvoice(STAFF_ID, 100L);

        assertThat(invoice.getInvoiceNumber()).isEqualTo("INV20260001");
        assertThat(invoice.getSubtotal()).isEqualByComparingTo("150.00");
        assertThat(invoice.getTotalAmount()).isEqualByComparingTo("172.50");
        assertThat(invoice.getPaidAmount()).isEqualByComparingTo("100.00");
        assertThat(invoice.getBalanceDue()).isEqualByComparingTo("72.50");
        assertThat(invoice.getStatus()).isEqualTo(InvoiceStatus.DRAFT);
        assertThat(invoice.getDueDate()).isEqualTo(NOW.toLocalDate().plusDays(7));
        assertThat(invoice.getLineItems()).hasSize(1);
    }

    @Test
    @DisplayName("A payment is applied to the oldest open invoice first")
    void applyPayment_oldestFirst() {
        Invoice older = openInvoice(1L, "100.00", NOW.toLocalDate().minusDays(10));
        Invoice newer = openInvoice(2L, "100.00", NOW.toLocalDate().minusDays(1));
        when(invoiceRepository.findByBookingIdAndStatusIn(eq(100L), anyCollection()))
                .thenReturn(List.of(newer, older));

        billingService.applyPayment(completedPayment("130.00"));

        assertThat(older.getStatus()).isEqualTo(InvoiceStatus.PAID);
        assertThat(older.getPaidAmount()).isEqualByComparingTo("100.00");
        assertThat(newer.getStatus()).isEqualTo(InvoiceStatus.SENT);
        assertThat(newer.getPaidAmount()).isEqualByComparingTo("30.00");
    }

    @Test
    @DisplayName("Sending a draft defaults to the customer's email")
    void markSent_draft_defaultsToCustomerEmail() {
        Invoice invoice = openInvoice(1L, "172.50", NOW.toLocalDate());
        invoice.setStatus(InvoiceStatus.DRAFT);
        when(userAccessService.requireStaff(STAFF_ID)).thenReturn(User.builder().id(STAFF_ID).userType(UserType.STAFF).build());
        when(invoiceRepository.findById(1L)).thenReturn(Optional.of(invoice));
        when(invoiceRepository.save(invoice)).thenReturn(invoice);

        billingService.markSent(STAFF_ID, 1L, null);

        assertThat(invoice.getStatus()).isEqualTo(InvoiceStatus.SENT);
        assertThat(invoice.getSentToEmail()).isEqualTo("chikondi@example.com");
        assertThat(invoice.getReminderCount()).isZero();
    }

    @Test
    @DisplayName("A paid invoice cannot be cancelled")
    void cancel_paidInvoice_throws() {
        Invoice invoice = openInvoice(1L, "172.50", NOW.toLocalDate());
        invoice.setStatus(InvoiceStatus.PAID);
        when(userAccessService.requireStaff(STAFF_ID)).thenReturn(User.builder().id(STAFF_ID).userType(UserType.STAFF).build());
        when(invoiceRepository.findById(1L)).thenReturn(Optional.of(invoice));

        assertThatThrownBy(() -> billingService.cancel(STAFF_ID, 1L))
                .isInstanceOf(InvalidTransitionException.class);
    }

    @Test
    @DisplayName("A booking with an open invoice cannot be invoiced again")
    void generateInvoice_withOpenInvoice_throws() {
        when(userAccessService.requireStaff(STAFF_ID)).thenReturn(User.builder().id(STAFF_ID).userType(UserType.STAFF).build());
        when(bookingRepository.findById(100L)).thenReturn(Optional.of(booking));
        when(invoiceRepository.findByBookingIdOrderByCreatedAtDesc(100L))
                .thenReturn(List.of(openInvoice(1L, "172.50", NOW.toLocalDate().minusDays(2))));

        assertThatThrownBy(() -> billingService.generateInvoice(STAFF_ID, 100L))
                .isInstanceOf(BusinessRuleException.class)
                .hasMessageContaining("INV20260001");
        verify(identifierService, never()).nextInvoiceNumber();
        verify(invoiceRepository, never()).save(any());
    }

    @Test
    @DisplayName("Money already counted on a paid invoice is not counted again")
    void generateInvoice_afterPaidInvoice_excludesItsPayments() {
        Invoice earlier = openInvoice(1L, "100.00", NOW.toLocalDate().minusDays(5));
        earlier.setStatus(InvoiceStatus.PAID);
        earlier.setPaidAmount(new BigDecimal("100.00"));
        when(userAccessService.requireStaff(STAFF_ID)).thenReturn(User.builder().id(STAFF_ID).userType(UserType.STAFF).build());
        when(bookingRepository.findById(100L)).thenReturn(Optional.of(booking));
        when(invoiceRepository.findByBookingIdOrderByCreatedAtDesc(100L)).thenReturn(List.of(earlier));
        when(paymentRepository.sumNetAmountByBooking(100L, BillingDocumentService.SETTLED))
                .thenReturn(new BigDecimal("130.00"));
        when(identifierService.nextInvoiceNumber()).thenReturn("INV20260002");
        when(pricingService.getTaxRate()).thenReturn(new BigDecimal("15.00"));
        when(invoiceRepository.save(any(Invoice.class))).thenAnswer(inv -> inv.getArgument(0));

        InvoiceResponse invoice = billingService.generateInvoice(STAFF_ID, 100L);

        assertThat(invoice.getPaidAmount()).isEqualByComparingTo("30.00");
        assertThat(invoice.getBalanceDue()).isEqualByComparingTo("142.50");
        assertThat(invoice.getStatus()).isEqualTo(InvoiceStatus.DRAFT);
    }
}
