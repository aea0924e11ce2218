package com.carhire.rental.controller;

import com.carhire.rental.config.AuthInterceptor;
import com.carhire.rental.dto.*;
import com.carhire.rental.service.BillingDocumentService;
import com.carhire.rental.service.PaymentService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/payments")
@RequiredArgsConstructor
public class PaymentController {

    private final PaymentService paymentService;
    private final BillingDocumentService billingDocumentService;

    @PostMapping
    public ResponseEntity<ApiResponse> create(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                              @Valid @RequestBody PaymentRequest request) {
        PaymentResponse payment = paymentService.create(userId, request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(payment, "Payment " + payment.getTransactionId() + " created"));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse> get(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                           @PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(paymentService.get(userId, id), "Payment retrieved"));
    }

    @GetMapping("/transaction/{transactionId}")
    public ResponseEntity<ApiResponse> byTransaction(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                                     @PathVariable String transactionId) {
        return ResponseEntity.ok(ApiResponse.success(
                paymentService.getByTransactionId(userId, transactionId), "Payment retrieved"));
    }

    @PostMapping("/{id}/process")
    public ResponseEntity<ApiResponse> process(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                               @PathVariable Long id,
                                               @RequestBody(required = false) PaymentUpdateRequest request) {
        return ResponseEntity.ok(ApiResponse.success(
                paymentService.process(userId, id, gatewayId(request)), "Payment processing"));
    }

    @PostMapping("/{id}/complete")
    public ResponseEntity<ApiResponse> complete(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                                @PathVariable Long id,
                                                @RequestBody(required = false) PaymentUpdateRequest request) {
        return ResponseEntity.ok(ApiResponse.success(
                paymentService.complete(userId, id, gatewayId(request)), "Payment completed"));
    }

    @PostMapping("/{id}/fail")
    public ResponseEntity<ApiResponse> fail(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                            @PathVariable Long id,
                                            @RequestBody(required = false) PaymentUpdateRequest request) {
        String reason = request != null ? request.getReason() : null;
        return ResponseEntity.ok(ApiResponse.success(paymentService.fail(userId, id, reason), "Payment marked failed"));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<ApiResponse> cancel(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                              @PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(paymentService.cancel(userId, id), "Payment cancelled"));
    }

    @PostMapping("/{id}/refund")
    public ResponseEntity<ApiResponse> refund(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                              @PathVariable Long id,
                                              @Valid @RequestBody RefundRequest request) {
        return ResponseEntity.ok(ApiResponse.success(
                paymentService.refund(userId, id, request.getAmount(), request.getReason()), "Refund recorded"));
    }

    @GetMapping("/{id}/receipt")
    public ResponseEntity<ApiResponse> receipt(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                               @PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(
                billingDocumentService.receiptForPayment(userId, id), "Receipt retrieved"));
    }

    private String gatewayId(PaymentUpdateRequest request) {
        return request != null ? request.getGatewayTransactionId() : null;
    }
}
