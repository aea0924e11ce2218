package com.carhire.rental.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Immutable snapshot of a completed payment. At most one per payment,
 * enforced by the unique payment_id column.
 */
@Entity
@Table(name = "receipts")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Receipt {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "receipt_number", nullable = false, unique = true, length = 50, updatable = false)
    private String receiptNumber;

    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "payment_id", nullable = false, unique = true, updatable = false)
    private Payment payment;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "customer_id", nullable = false, updatable = false)
    private User customer;

    @Column(nullable = false, precision = 10, scale = 2, updatable = false)
    private BigDecimal amount;

    @Column(nullable = false, length = 3, updatable = false)
    private String currency;

    @Column(nullable = false, length = 100, updatable = false)
    private String paymentMethodUsed;

    @ElementCollection
    @CollectionTable(name = "receipt_line_items", joinColumns = @JoinColumn(name = "receipt_id"))
    @OrderColumn(name = "line_no")
    @Builder.Default
    private List<LineItem> lineItems = new ArrayList<>();

    @Column(nullable = false, updatable = false)
    private LocalDateTime issueDate;
}
