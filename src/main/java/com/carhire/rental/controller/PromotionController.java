package com.carhire.rental.controller;

import com.carhire.rental.config.AuthInterceptor;
import com.carhire.rental.dto.ApiResponse;
import com.carhire.rental.dto.PromotionRequest;
import com.carhire.rental.service.PromotionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/promotions")
@RequiredArgsConstructor
public class PromotionController {

    private final PromotionService promotionService;

    /** Public, currently running promotions. */
    @GetMapping("/current")
    public ResponseEntity<ApiResponse> current() {
        return ResponseEntity.ok(ApiResponse.success(promotionService.currentPublic(), "Current promotions"));
    }

    @GetMapping("/validate")
    public ResponseEntity<ApiResponse> validate(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                                @RequestParam String code,
                                                @RequestParam Long bookingId) {
        return ResponseEntity.ok(ApiResponse.success(promotionService.preview(userId, code, bookingId), "Promotion is valid"));
    }

    @GetMapping
    public ResponseEntity<ApiResponse> list(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId) {
        return ResponseEntity.ok(ApiResponse.success(promotionService.list(userId), "Promotions retrieved"));
    }

    @PostMapping
    public ResponseEntity<ApiResponse> create(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                              @Valid @RequestBody PromotionRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(promotionService.create(userId, request), "Promotion created"));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse> update(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                              @PathVariable Long id,
                                              @Valid @RequestBody PromotionRequest request) {
        return ResponseEntity.ok(ApiResponse.success(promotionService.update(userId, id, request), "Promotion updated"));
    }

    @PutMapping("/{id}/active")
    public ResponseEntity<ApiResponse> setActive(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                                 @PathVariable Long id,
                                                 @RequestParam boolean active) {
        return ResponseEntity.ok(ApiResponse.success(promotionService.setActive(userId, id, active), "Promotion updated"));
    }
}
