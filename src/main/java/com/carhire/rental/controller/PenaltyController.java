package com.carhire.rental.controller;

import com.carhire.rental.config.AuthInterceptor;
import com.carhire.rental.dto.ApiResponse;
import com.carhire.rental.dto.PenaltyRequest;
import com.carhire.rental.dto.TextRequest;
import com.carhire.rental.service.PenaltyService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/penalties")
@RequiredArgsConstructor
public class PenaltyController {

    private final PenaltyService penaltyService;

    @PostMapping
    public ResponseEntity<ApiResponse> create(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                              @Valid @RequestBody PenaltyRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(penaltyService.create(userId, request), "Penalty raised"));
    }

    @GetMapping("/mine")
    public ResponseEntity<ApiResponse> mine(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId) {
        return ResponseEntity.ok(ApiResponse.success(penaltyService.mine(userId), "Penalties retrieved"));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse> get(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                           @PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(penaltyService.get(userId, id), "Penalty retrieved"));
    }

    @PostMapping("/{id}/dispute")
    public ResponseEntity<ApiResponse> dispute(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                               @PathVariable Long id,
                                               @Valid @RequestBody TextRequest request) {
        return ResponseEntity.ok(ApiResponse.success(penaltyService.dispute(userId, id, request.getText()), "Penalty disputed"));
    }

    @PostMapping("/{id}/approve")
    public ResponseEntity<ApiResponse> approve(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                               @PathVariable Long id,
                                               @RequestBody(required = false) TextRequest request) {
        return ResponseEntity.ok(ApiResponse.success(penaltyService.approve(userId, id, text(request)), "Penalty approved"));
    }

    @PostMapping("/{id}/waive")
    public ResponseEntity<ApiResponse> waive(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                             @PathVariable Long id,
                                             @RequestBody(required = false) TextRequest request) {
        return ResponseEntity.ok(ApiResponse.success(penaltyService.waive(userId, id, text(request)), "Penalty waived"));
    }

    @PostMapping("/{id}/mark-paid")
    public ResponseEntity<ApiResponse> markPaid(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                                @PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(penaltyService.markPaid(userId, id), "Penalty paid"));
    }

    private String text(TextRequest request) {
        return request != null ? request.getText() : null;
    }
}
