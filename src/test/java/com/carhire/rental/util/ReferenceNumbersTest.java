package com.carhire.rental.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.*;

class ReferenceNumbersTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 10, 19, 14, 35);

    @Test
    @DisplayName("Booking reference is BK, the date and four digits")
    void bookingReference_hasPrefixDateAndFourDigits() {
        assertThat(ReferenceNumbers.bookingReference(NOW, 42)).isEqualTo("BK2610190042");
    }

    @Test
    @DisplayName("Transaction id carries the time down to the minute")
    void transactionId_includesMinute() {
        assertThat(ReferenceNumbers.transactionId(NOW, 7)).isEqualTo("TXN26101914350007");
    }

    @Test
    @DisplayName("Invoice numbers are scoped per year, receipts per day")
    void scopes() {
        assertThat(ReferenceNumbers.sequential(ReferenceNumbers.invoiceScope(NOW), 1)).isEqualTo("INV20260001");
        assertThat(ReferenceNumbers.sequential(ReferenceNumbers.receiptScope(NOW), 12)).isEqualTo("RCP2610190012");
        assertThat(ReferenceNumbers.sequential(ReferenceNumbers.ticketScope(NOW), 3)).isEqualTo("TKT2610190003");
    }

    @Test
    @DisplayName("Sequential numbers grow past four digits")
    void sequential_growsPastFourDigits() {
        assertThat(ReferenceNumbers.sequential("INV2026", 10_000)).isEqualTo("INV202610000");
    }

    @Test
    @DisplayName("Sequential numbers start at one")
    void sequential_rejectsZero() {
        assertThatThrownBy(() -> ReferenceNumbers.sequential("INV2026", 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Random suffix outside four digits is rejected")
    void suffixOutOfRange_isRejected() {
        assertThatThrownBy(() -> ReferenceNumbers.bookingReference(NOW, 10_000))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Random suffix stays within four digits")
    void randomSuffix_staysWithinFourDigits() {
        for (int i = 0; i < 200; i++) {
            assertThat(ReferenceNumbers.randomSuffix()).isBetween(0, 9999);
        }
    }
}
