package com.carhire.rental.controller;

import com.carhire.rental.config.AuthInterceptor;
import com.carhire.rental.dto.*;
import com.carhire.rental.service.CatalogService;
import com.carhire.rental.service.LoyaltyService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Reference data: public reads, staff writes.
 */
@RestController
@RequestMapping("/api/catalog")
@RequiredArgsConstructor
public class CatalogController {

    private final CatalogService catalogService;
    private final LoyaltyService loyaltyService;

    @GetMapping("/categories")
    public ResponseEntity<ApiResponse> categories() {
        return ResponseEntity.ok(ApiResponse.success(catalogService.categories(), "Categories retrieved"));
    }

    @GetMapping("/brands")
    public ResponseEntity<ApiResponse> brands() {
        return ResponseEntity.ok(ApiResponse.success(catalogService.brands(), "Brands retrieved"));
    }

    @GetMapping("/models")
    public ResponseEntity<ApiResponse> models() {
        return ResponseEntity.ok(ApiResponse.success(catalogService.models(), "Models retrieved"));
    }

    @GetMapping("/features")
    public ResponseEntity<ApiResponse> features() {
        return ResponseEntity.ok(ApiResponse.success(catalogService.features(), "Features retrieved"));
    }

    @GetMapping("/add-ons")
    public ResponseEntity<ApiResponse> addOns() {
        return ResponseEntity.ok(ApiResponse.success(catalogService.addOns(), "Add-ons retrieved"));
    }

    @GetMapping("/payment-methods")
    public ResponseEntity<ApiResponse> paymentMethods() {
        return ResponseEntity.ok(ApiResponse.success(catalogService.paymentMethods(), "Payment methods retrieved"));
    }

    @GetMapping("/loyalty-programs")
    public ResponseEntity<ApiResponse> loyaltyPrograms() {
        return ResponseEntity.ok(ApiResponse.success(loyaltyService.programs(), "Loyalty programs retrieved"));
    }

    @PostMapping("/categories")
    public ResponseEntity<ApiResponse> createCategory(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                                      @Valid @RequestBody CatalogEntryRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(catalogService.createCategory(userId, request), "Category created"));
    }

    @PostMapping("/brands")
    public ResponseEntity<ApiResponse> createBrand(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                                   @Valid @RequestBody CatalogEntryRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(catalogService.createBrand(userId, request), "Brand created"));
    }

    @PostMapping("/models")
    public ResponseEntity<ApiResponse> createModel(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                                   @Valid @RequestBody VehicleModelRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(catalogService.createModel(userId, request), "Model created"));
    }

    @PostMapping("/features")
    public ResponseEntity<ApiResponse> createFeature(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                                     @Valid @RequestBody CatalogEntryRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(catalogService.createFeature(userId, request), "Feature created"));
    }

    @PostMapping("/add-ons")
    public ResponseEntity<ApiResponse> createAddOn(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                                   @Valid @RequestBody AddOnCatalogRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(catalogService.createAddOn(userId, request), "Add-on created"));
    }

    @PutMapping("/add-ons/{id}/active")
    public ResponseEntity<ApiResponse> setAddOnActive(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                                      @PathVariable Long id,
                                                      @RequestParam boolean active) {
        return ResponseEntity.ok(ApiResponse.success(catalogService.setAddOnActive(userId, id, active), "Add-on updated"));
    }

    @PostMapping("/payment-methods")
    public ResponseEntity<ApiResponse> createPaymentMethod(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                                           @Valid @RequestBody PaymentMethodRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(catalogService.createPaymentMethod(userId, request), "Payment method created"));
    }
}
