package com.carhire.rental.dto;

import com.carhire.rental.entity.Payment;
import com.carhire.rental.entity.PaymentStatus;
import com.carhire.rental.entity.PaymentType;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PaymentResponse {

    private Long id;
    private String transactionId;
    private Long bookingId;
    private String bookingReference;
    private Long customerId;
    private PaymentType paymentType;
    private String paymentMethod;
    private BigDecimal amount;
    private String currency;
    private PaymentStatus status;
    private BigDecimal gatewayFee;
    private String gatewayTransactionId;
    private String cardLastFour;
    private String cardType;
    private BigDecimal refundAmount;
    private LocalDateTime refundDate;
    private String refundReason;
    private boolean refundable;
    private String failureReason;
    private LocalDateTime paymentDate;
    private LocalDateTime createdAt;

    public static PaymentResponse from(Payment p) {
        return PaymentResponse.builder()
                .id(p.getId())
                .transactionId(p.getTransactionId())
                .bookingId(p.getBooking().getId())
                .bookingReference(p.getBooking().getBookingReference())
                .customerId(p.getCustomer().getId())
                .paymentType(p.getPaymentType())
                .paymentMethod(p.getPaymentMethod() != null ? p.getPaymentMethod().getName() : null)
                .amount(p.getAmount())
                .currency(p.getCurrency())
                .status(p.getStatus())
                .gatewayFee(p.getGatewayFee())
                .gatewayTransactionId(p.getGatewayTransactionId())
                .cardLastFour(p.getCardLastFour())
                .cardType(p.getCardType())
                .refundAmount(p.getRefundAmount())
                .refundDate(p.getRefundDate())
                .refundReason(p.getRefundReason())
                .refundable(p.isRefundable())
                .failureReason(p.getFailureReason())
                .paymentDate(p.getPaymentDate())
                .createdAt(p.getCreatedAt())
                .build();
    }
}
