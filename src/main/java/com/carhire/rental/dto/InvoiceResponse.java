package com.carhire.rental.dto;

import com.carhire.rental.entity.Invoice;
import com.carhire.rental.entity.InvoiceStatus;
import com.carhire.rental.entity.LineItem;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class InvoiceResponse {

    private Long id;
    private String invoiceNumber;
    private Long bookingId;
    private String bookingReference;
    private Long customerId;
    private LocalDate issueDate;
    private LocalDate dueDate;
    private InvoiceStatus status;
    private BigDecimal subtotal;
    private BigDecimal taxRate;
    private BigDecimal taxAmount;
    private BigDecimal discountAmount;
    private BigDecimal totalAmount;
    private BigDecimal paidAmount;
    private BigDecimal balanceDue;
    private List<LineItem> lineItems;
    private String notes;
    private LocalDateTime sentDate;

    public static InvoiceResponse from(Invoice i) {
        return InvoiceResponse.builder()
                .id(i.getId())
                .invoiceNumber(i.getInvoiceNumber())
                .bookingId(i.getBooking().getId())
                .bookingReference(i.getBooking().getBookingReference())
                .customerId(i.getCustomer().getId())
                .issueDate(i.getIssueDate())
                .dueDate(i.getDueDate())
                .status(i.getStatus())
                .subtotal(i.getSubtotal())
                .taxRate(i.getTaxRate())
                .taxAmount(i.getTaxAmount())
                .discountAmount(i.getDiscountAmount())
                .totalAmount(i.getTotalAmount())
                .paidAmount(i.getPaidAmount())
                .balanceDue(i.getBalanceDue())
                .lineItems(new ArrayList<>(i.getLineItems()))
                .notes(i.getNotes())
                .sentDate(i.getSentDate())
                .build();
    }
}
