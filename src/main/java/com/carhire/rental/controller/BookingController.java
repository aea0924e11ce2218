package com.carhire.rental.controller;

import com.carhire.rental.config.AuthInterceptor;
import com.carhire.rental.dto.*;
import com.carhire.rental.service.BookingService;
import com.carhire.rental.service.BillingDocumentService;
import com.carhire.rental.service.PaymentService;
import com.carhire.rental.service.PenaltyService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Bookings and their lifecycle transitions.
 *
 * Customers create, view, extend with add-ons/drivers and cancel their own
 * bookings; confirm/start/complete/no-show are staff operations.
 * Invalid transitions come back as 409.
 */
@RestController
@RequestMapping("/api/bookings")
@RequiredArgsConstructor
@Slf4j
public class BookingController {

    private final BookingService bookingService;
    private final PaymentService paymentService;
    private final BillingDocumentService billingDocumentService;
    private final PenaltyService penaltyService;

    @PostMapping
    public ResponseEntity<ApiResponse> create(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                              @Valid @RequestBody BookingRequest request) {
        BookingResponse booking = bookingService.create(userId, request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(booking, "Booking " + booking.getBookingReference() + " created"));
    }

    @GetMapping
    public ResponseEntity<ApiResponse> list(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId) {
        return ResponseEntity.ok(ApiResponse.success(bookingService.list(userId), "Bookings retrieved"));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse> get(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                           @PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(bookingService.get(userId, id), "Booking retrieved"));
    }

    @GetMapping("/reference/{reference}")
    public ResponseEntity<ApiResponse> getByReference(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                                      @PathVariable String reference) {
        return ResponseEntity.ok(ApiResponse.success(bookingService.getByReference(userId, reference), "Booking retrieved"));
    }

    @GetMapping("/{id}/overdue")
    public ResponseEntity<ApiResponse> overdue(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                               @PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(
                Map.of("bookingId", id, "overdue", bookingService.isOverdue(userId, id)), "Checked"));
    }

    // ── Transitions ──

    @PostMapping("/{id}/confirm")
    public ResponseEntity<ApiResponse> confirm(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                               @PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(bookingService.confirm(userId, id), "Booking confirmed"));
    }

    @PostMapping("/{id}/start")
    public ResponseEntity<ApiResponse> start(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                             @PathVariable Long id,
                                             @Valid @RequestBody(required = false) RentalHandoverRequest request) {
        return ResponseEntity.ok(ApiResponse.success(
                bookingService.start(userId, id, orEmpty(request)), "Rental started"));
    }

    @PostMapping("/{id}/complete")
    public ResponseEntity<ApiResponse> complete(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                                @PathVariable Long id,
                                                @Valid @RequestBody(required = false) RentalHandoverRequest request) {
        return ResponseEntity.ok(ApiResponse.success(
                bookingService.complete(userId, id, orEmpty(request)), "Rental completed"));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<ApiResponse> cancel(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                              @PathVariable Long id,
                                              @RequestBody(required = false) CancelBookingRequest request) {
        String reason = request != null ? request.getReason() : null;
        return ResponseEntity.ok(ApiResponse.success(bookingService.cancel(userId, id, reason), "Booking cancelled"));
    }

    @PostMapping("/{id}/no-show")
    public ResponseEntity<ApiResponse> noShow(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                              @PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(bookingService.markNoShow(userId, id), "Booking marked as no-show"));
    }

    @PostMapping("/{id}/recalculate")
    public ResponseEntity<ApiResponse> recalculate(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                                   @PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(bookingService.recalculate(userId, id), "Booking repriced"));
    }

    // ── Extras ──

    @PostMapping("/{id}/add-ons")
    public ResponseEntity<ApiResponse> addAddOn(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                                @PathVariable Long id,
                                                @Valid @RequestBody AddOnRequest request) {
        return ResponseEntity.ok(ApiResponse.success(bookingService.addAddOn(userId, id, request), "Add-on added"));
    }

    @DeleteMapping("/{id}/add-ons/{addOnId}")
    public ResponseEntity<ApiResponse> removeAddOn(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                                   @PathVariable Long id,
                                                   @PathVariable Long addOnId) {
        return ResponseEntity.ok(ApiResponse.success(bookingService.removeAddOn(userId, id, addOnId), "Add-on removed"));
    }

    @PostMapping("/{id}/drivers")
    public ResponseEntity<ApiResponse> addDriver(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                                 @PathVariable Long id,
                                                 @Valid @RequestBody AdditionalDriverRequest request) {
        return ResponseEntity.ok(ApiResponse.success(
                bookingService.addAdditionalDriver(userId, id, request), "Additional driver added"));
    }

    // ── Related records ──

    @GetMapping("/{id}/payments")
    public ResponseEntity<ApiResponse> payments(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                                @PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(paymentService.forBooking(userId, id), "Payments retrieved"));
    }

    @GetMapping("/{id}/invoices")
    public ResponseEntity<ApiResponse> invoices(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                                @PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(billingDocumentService.forBooking(userId, id), "Invoices retrieved"));
    }

    @PostMapping("/{id}/invoices")
    public ResponseEntity<ApiResponse> generateInvoice(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                                       @PathVariable Long id) {
        InvoiceResponse invoice = billingDocumentService.generateInvoice(userId, id);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(invoice, "Invoice " + invoice.getInvoiceNumber() + " generated"));
    }

    @GetMapping("/{id}/penalties")
    public ResponseEntity<ApiResponse> penalties(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                                 @PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(penaltyService.forBooking(userId, id), "Penalties retrieved"));
    }

    private RentalHandoverRequest orEmpty(RentalHandoverRequest request) {
        return request != null ? request : new RentalHandoverRequest();
    }
}
