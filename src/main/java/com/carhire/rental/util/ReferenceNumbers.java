package com.carhire.rental.util;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Formatting of human-readable references.
 *
 * <pre>
 *   BK  + yyMMdd     + 4 random digits   booking reference
 *   TXN + yyMMddHHmm + 4 random digits   payment transaction id
 *   INV + yyyy       + 4-digit sequence  invoice number (per year)
 *   RCP + yyMMdd     + 4-digit sequence  receipt number (per day)
 *   TKT + yyMMdd     + 4-digit sequence  issue ticket (per day)
 * </pre>
 *
 * Uniqueness is not decided here; IdentifierService owns retries and counters.
 */
public final class ReferenceNumbers {

    public static final String BOOKING_PREFIX     = "BK";
    public static final String TRANSACTION_PREFIX = "TXN";
    public static final String INVOICE_PREFIX     = "INV";
    public static final String RECEIPT_PREFIX     = "RCP";
    public static final String TICKET_PREFIX      = "TKT";

    private static final DateTimeFormatter DAY    = DateTimeFormatter.ofPattern("yyMMdd");
    private static final DateTimeFormatter MINUTE = DateTimeFormatter.ofPattern("yyMMddHHmm");
    private static final DateTimeFormatter YEAR   = DateTimeFormatter.ofPattern("yyyy");

    private ReferenceNumbers() {}

    public static String bookingReference(LocalDateTime now, int suffix) {
        return BOOKING_PREFIX + DAY.format(now) + fourDigits(suffix);
    }

    public static String transactionId(LocalDateTime now, int suffix) {
        return TRANSACTION_PREFIX + MINUTE.format(now) + fourDigits(suffix);
    }

    /** Counter scope for invoices, e.g. {@code INV2026}. */
    public static String invoiceScope(LocalDateTime now) {
        return INVOICE_PREFIX + YEAR.format(now);
    }

    /** Counter scope for receipts, e.g. {@code RCP261019}. */
    public static String receiptScope(LocalDateTime now) {
        return RECEIPT_PREFIX + DAY.format(now);
    }

    public static String ticketScope(LocalDateTime now) {
        return TICKET_PREFIX + DAY.format(now);
    }

    /** Appends the sequence, zero-padded to at least four digits, to a scope key. */
    public static String sequential(String scope, long sequence) {
        if (sequence < 1) {
            throw new IllegalArgumentException("Sequence out of range for " + scope + ": " + sequence);
        }
        return scope + String.format("%04d", sequence);
    }

    public static int randomSuffix() {
        return ThreadLocalRandom.current().nextInt(10_000);
    }

    private static String fourDigits(int value) {
        if (value < 0 || value > 9999) {
            throw new IllegalArgumentException("Suffix must be 0..9999: " + value);
        }
        return String.format("%04d", value);
    }
}
