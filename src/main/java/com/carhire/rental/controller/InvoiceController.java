package com.carhire.rental.controller;

import com.carhire.rental.config.AuthInterceptor;
import com.carhire.rental.dto.ApiResponse;
import com.carhire.rental.dto.InvoiceSendRequest;
import com.carhire.rental.service.BillingDocumentService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Invoice reads and status changes. Invoices are generated from a booking,
 * see {@code POST /api/bookings/{id}/invoices}.
 */
@RestController
@RequestMapping("/api/invoices")
@RequiredArgsConstructor
public class InvoiceController {

    private final BillingDocumentService billingDocumentService;

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse> get(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                           @PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(billingDocumentService.get(userId, id), "Invoice retrieved"));
    }

    @PostMapping("/{id}/send")
    public ResponseEntity<ApiResponse> send(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                            @PathVariable Long id,
                                            @Valid @RequestBody(required = false) InvoiceSendRequest request) {
        String email = request != null ? request.getEmail() : null;
        return ResponseEntity.ok(ApiResponse.success(billingDocumentService.markSent(userId, id, email), "Invoice sent"));
    }

    @PostMapping("/{id}/mark-paid")
    public ResponseEntity<ApiResponse> markPaid(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                                @PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(billingDocumentService.markPaid(userId, id), "Invoice marked paid"));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<ApiResponse> cancel(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                              @PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(billingDocumentService.cancel(userId, id), "Invoice cancelled"));
    }
}
