package com.carhire.rental.dto;

import com.carhire.rental.entity.LineItem;
import com.carhire.rental.entity.Receipt;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ReceiptResponse {

    private Long id;
    private String receiptNumber;
    private Long paymentId;
    private String transactionId;
    private Long customerId;
    private BigDecimal amount;
    private String currency;
    private String paymentMethodUsed;
    private List<LineItem> lineItems;
    private LocalDateTime issueDate;

    public static ReceiptResponse from(Receipt r) {
        return ReceiptResponse.builder()
                .id(r.getId())
                .receiptNumber(r.getReceiptNumber())
                .paymentId(r.getPayment().getId())
                .transactionId(r.getPayment().getTransactionId())
                .customerId(r.getCustomer().getId())
                .amount(r.getAmount())
                .currency(r.getCurrency())
                .paymentMethodUsed(r.getPaymentMethodUsed())
                .lineItems(new ArrayList<>(r.getLineItems()))
                .issueDate(r.getIssueDate())
                .build();
    }
}
