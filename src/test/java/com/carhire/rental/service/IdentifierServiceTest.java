package com.carhire.rental.service;

import com.carhire.rental.entity.ReferenceSequence;
import com.carhire.rental.exception.DuplicateIdentifierException;
import com.carhire.rental.repository.BookingRepository;
import com.carhire.rental.repository.PaymentRepository;
import com.carhire.rental.repository.ReferenceSequenceRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntSupplier;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for IdentifierService.
 *
 * Random references: a collision is redrawn, and after max-attempts
 * collisions the caller gets DuplicateIdentifierException.
 * Sequential numbers: the counter row is incremented, never re-read as max+1.
 */
@ExtendWith(MockitoExtension.class)
class IdentifierServiceTest {

    // ── Mocks ────────────────────────────────────────────────────────────────

    @Mock private BookingRepository           bookingRepository;
    @Mock private PaymentRepository           paymentRepository;
    @Mock private ReferenceSequenceRepository sequenceRepository;
    @Mock private PlatformTransactionManager  transactionManager;

    private IdentifierService identifierService;

    // ── Test fixtures ─────────────────────────────────────────────────────────

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 10, 19, 9, 30);

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        identifierService = new IdentifierService(bookingRepository, paymentRepository,
                sequenceRepository, clock, transactionManager);
        ReflectionTestUtils.setField(identifierService, "maxAttempts", 3);
    }

    @Test
    @DisplayName("Booking reference uses the business date and drawn suffix")
    void bookingReference_usesDateAndSuffix() {
        ReflectionTestUtils.setField(identifierService, "suffixSource", (IntSupplier) () -> 1234);
        when(bookingRepository.existsByBookingReference("BK2610191234")).thenReturn(false);

        assertThat(identifierService.nextBookingReference()).isEqualTo("BK2610191234");
    }

    @Test
    @DisplayName("A colliding reference is redrawn")
    void bookingReference_collision_isRedrawn() {
        AtomicInteger suffix = new AtomicInteger(10);
        ReflectionTestUtils.setField(identifierService, "suffixSource",
                (IntSupplier) suffix::getAndIncrement);
        when(bookingRepository.existsByBookingReference("BK2610190010")).thenReturn(true);
        when(bookingRepository.existsByBookingReference("BK2610190011")).thenReturn(false);

        assertThat(identifierService.nextBookingReference()).isEqualTo("BK2610190011");
        verify(bookingRepository, times(2)).existsByBookingReference(anyString());
    }

    @Test
    @DisplayName("Persistent collisions fail after max-attempts instead of looping")
    void transactionId_exhausted_throws() {
        when(paymentRepository.existsByTransactionId(anyString())).thenReturn(true);

        assertThatThrownBy(() -> identifierService.nextTransactionId())
                .isInstanceOf(DuplicateIdentifierException.class)
                .hasMessageContaining("3 attempts");
        verify(paymentRepository, times(3)).existsByTransactionId(anyString());
    }

    @Test
    @DisplayName("Invoice number increments the yearly counter")
    void invoiceNumber_incrementsExistingCounter() {
        ReferenceSequence row = ReferenceSequence.builder().scopeKey("INV2026").lastValue(41).build();
        when(sequenceRepository.findByScopeKeyForUpdate("INV2026")).thenReturn(Optional.of(row));

        assertThat(identifierService.nextInvoiceNumber()).isEqualTo("INV20260042");
        assertThat(row.getLastValue()).isEqualTo(42);
        verify(sequenceRepository).save(row);
    }

    @Test
    @DisplayName("Successive receipt numbers in one day are strictly increasing")
    void receiptNumbers_areSequential() {
        ReferenceSequence row = ReferenceSequence.builder().scopeKey("RCP261019").lastValue(0).build();
        when(sequenceRepository.findByScopeKeyForUpdate("RCP261019")).thenReturn(Optional.of(row));

        assertThat(identifierService.nextReceiptNumber()).isEqualTo("RCP2610190001");
        assertThat(identifierService.nextReceiptNumber()).isEqualTo("RCP2610190002");
    }

    @Test
    @DisplayName("First number of a new scope creates the counter row")
    void ticketNumber_missingScope_createsRow() {
        ReferenceSequence created = ReferenceSequence.builder().scopeKey("TKT261019").lastValue(0).build();
        when(sequenceRepository.findByScopeKeyForUpdate("TKT261019"))
                .thenReturn(Optional.empty())
                .thenReturn(Optional.of(created));

        assertThat(identifierService.nextTicketNumber()).isEqualTo("TKT2610190001");
        verify(sequenceRepository).saveAndFlush(argThat(s -> "TKT261019".equals(s.getScopeKey())));
    }
}
