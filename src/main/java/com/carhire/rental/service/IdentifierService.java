package com.carhire.rental.service;

import com.carhire.rental.entity.ReferenceSequence;
import com.carhire.rental.exception.DuplicateIdentifierException;
import com.carhire.rental.repository.BookingRepository;
import com.carhire.rental.repository.PaymentRepository;
import com.carhire.rental.repository.ReferenceSequenceRepository;
import com.carhire.rental.util.ReferenceNumbers;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.function.IntSupplier;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Generates booking references, transaction ids, invoice/receipt numbers
 * and ticket numbers.
 *
 * Random-suffix references are checked against the store and redrawn on
 * collision, up to {@code app.identifiers.max-attempts} times. The unique
 * column remains the final guard for a race between check and insert.
 *
 * Sequential numbers come from a per-scope counter row that is read with
 * SELECT ... FOR UPDATE inside the caller's transaction, so concurrent
 * callers queue on the row instead of reading the same maximum.
 */
@Service
@Slf4j
public class IdentifierService {

    private final BookingRepository bookingRepository;
    private final PaymentRepository paymentRepository;
    private final ReferenceSequenceRepository sequenceRepository;
    private final Clock clock;
    private final TransactionTemplate newTransaction;

    @Value("${app.identifiers.max-attempts:5}")
    private int maxAttempts;

    /** Source of the 4-digit random suffix. */
    private IntSupplier suffixSource = ReferenceNumbers::randomSuffix;

    public IdentifierService(BookingRepository bookingRepository,
                             PaymentRepository paymentRepository,
                             ReferenceSequenceRepository sequenceRepository,
                             Clock clock,
                             PlatformTransactionManager transactionManager) {
        this.bookingRepository = bookingRepository;
        this.paymentRepository = paymentRepository;
        this.sequenceRepository = sequenceRepository;
        this.clock = clock;
        this.newTransaction = new TransactionTemplate(transactionManager);
        this.newTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    public String nextBookingReference() {
        return uniqueRandom("booking reference",
                () -> ReferenceNumbers.bookingReference(now(), suffixSource.getAsInt()),
                bookingRepository::existsByBookingReference);
    }

    public String nextTransactionId() {
        return uniqueRandom("transaction id",
                () -> ReferenceNumbers.transactionId(now(), suffixSource.getAsInt()),
                paymentRepository::existsByTransactionId);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public String nextInvoiceNumber() {
        String scope = ReferenceNumbers.invoiceScope(now());
        return ReferenceNumbers.sequential(scope, nextInScope(scope));
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public String nextReceiptNumber() {
        String scope = ReferenceNumbers.receiptScope(now());
        return ReferenceNumbers.sequential(scope, nextInScope(scope));
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public String nextTicketNumber() {
        String scope = ReferenceNumbers.ticketScope(now());
        return ReferenceNumbers.sequential(scope, nextInScope(scope));
    }

    private String uniqueRandom(String kind, Supplier<String> generator, Predicate<String> exists) {
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            String candidate = generator.get();
            if (!exists.test(candidate)) {
                return candidate;
            }
            log.warn("Generated {} {} already exists (attempt {}/{})", kind, candidate, attempt, maxAttempts);
        }
        throw new DuplicateIdentifierException(
                "Could not generate a unique " + kind + " after " + maxAttempts + " attempts, please retry");
    }

    /**
     * Increments and returns the counter of {@code scope} under a row lock.
     * A missing row is created in its own transaction first; losing that
     * insert race to another caller is fine, the row exists either way.
     */
    private long nextInScope(String scope) {
        ReferenceSequence sequence = sequenceRepository.findByScopeKeyForUpdate(scope)
                .orElseGet(() -> {
                    createScope(scope);
                    return sequenceRepository.findByScopeKeyForUpdate(scope)
                            .orElseThrow(() -> new IllegalStateException("Sequence row missing for " + scope));
                });
        sequence.setLastValue(sequence.getLastValue() + 1);
        sequenceRepository.save(sequence);
        log.debug("Sequence {} advanced to {}", scope, sequence.getLastValue());
        return sequence.getLastValue();
    }

    private void createScope(String scope) {
        try {
            newTransaction.executeWithoutResult(status ->
                    sequenceRepository.saveAndFlush(ReferenceSequence.builder().scopeKey(scope).lastValue(0).build()));
            log.info("Started reference sequence {}", scope);
        } catch (DataIntegrityViolationException e) {
            log.debug("Sequence {} was created concurrently", scope);
        }
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
