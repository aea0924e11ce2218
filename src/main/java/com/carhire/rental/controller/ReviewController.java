package com.carhire.rental.controller;

import com.carhire.rental.config.AuthInterceptor;
import com.carhire.rental.dto.ApiResponse;
import com.carhire.rental.dto.ReviewRequest;
import com.carhire.rental.dto.TextRequest;
import com.carhire.rental.service.ReviewService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/reviews")
@RequiredArgsConstructor
public class ReviewController {

    private final ReviewService reviewService;

    @GetMapping("/vehicle/{vehicleId}")
    public ResponseEntity<ApiResponse> forVehicle(@PathVariable Long vehicleId) {
        return ResponseEntity.ok(ApiResponse.success(reviewService.forVehicle(vehicleId), "Reviews retrieved"));
    }

    @GetMapping("/featured")
    public ResponseEntity<ApiResponse> featured() {
        return ResponseEntity.ok(ApiResponse.success(reviewService.featured(), "Featured reviews retrieved"));
    }

    @PostMapping
    public ResponseEntity<ApiResponse> create(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                              @Valid @RequestBody ReviewRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(reviewService.create(userId, request), "Review submitted for moderation"));
    }

    @PostMapping("/{id}/respond")
    public ResponseEntity<ApiResponse> respond(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                               @PathVariable Long id,
                                               @Valid @RequestBody TextRequest request) {
        return ResponseEntity.ok(ApiResponse.success(reviewService.respond(userId, id, request.getText()), "Response saved"));
    }

    @PutMapping("/{id}/moderate")
    public ResponseEntity<ApiResponse> moderate(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                                @PathVariable Long id,
                                                @RequestParam boolean approved) {
        return ResponseEntity.ok(ApiResponse.success(reviewService.moderate(userId, id, approved), "Review moderated"));
    }

    @PostMapping("/{id}/vote")
    public ResponseEntity<ApiResponse> vote(@PathVariable Long id, @RequestParam boolean helpful) {
        return ResponseEntity.ok(ApiResponse.success(reviewService.vote(id, helpful), "Vote recorded"));
    }
}
