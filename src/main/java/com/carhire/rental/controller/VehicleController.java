package com.carhire.rental.controller;

import com.carhire.rental.config.AuthInterceptor;
import com.carhire.rental.dto.*;
import com.carhire.rental.entity.VehicleStatus;
import com.carhire.rental.service.ReviewService;
import com.carhire.rental.service.VehicleService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fleet endpoints. GETs under /api/vehicles are public; writes and the
 * staff-only reads under /api/admin/vehicles need a staff token.
 */
@RestController
@RequiredArgsConstructor
public class VehicleController {

    private final VehicleService vehicleService;
    private final ReviewService reviewService;

    // ── Public ──

    @GetMapping("/api/vehicles")
    public ResponseEntity<ApiResponse> list(@RequestParam(required = false) VehicleStatus status,
                                            @RequestParam(required = false) Long categoryId) {
        return ResponseEntity.ok(ApiResponse.success(vehicleService.list(status, categoryId), "Vehicles retrieved"));
    }

    @GetMapping("/api/vehicles/{id}")
    public ResponseEntity<ApiResponse> get(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(vehicleService.get(id), "Vehicle retrieved"));
    }

    @GetMapping("/api/vehicles/{id}/availability")
    public ResponseEntity<ApiResponse> availability(
            @PathVariable Long id,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime to) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("vehicleId", id);
        body.put("from", from);
        body.put("to", to);
        body.put("available", vehicleService.isAvailable(id, from, to));
        return ResponseEntity.ok(ApiResponse.success(body, "Availability checked"));
    }

    @GetMapping("/api/vehicles/{id}/quote")
    public ResponseEntity<ApiResponse> quote(
            @PathVariable Long id,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime to) {
        return ResponseEntity.ok(ApiResponse.success(vehicleService.quote(id, from, to), "Quote calculated"));
    }

    @GetMapping("/api/vehicles/{id}/features")
    public ResponseEntity<ApiResponse> features(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(vehicleService.features(id), "Features retrieved"));
    }

    @GetMapping("/api/vehicles/{id}/images")
    public ResponseEntity<ApiResponse> images(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(vehicleService.images(id), "Images retrieved"));
    }

    @GetMapping("/api/vehicles/{id}/reviews")
    public ResponseEntity<ApiResponse> reviews(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(reviewService.forVehicle(id), "Reviews retrieved"));
    }

    // ── Staff ──

    @PostMapping("/api/vehicles")
    public ResponseEntity<ApiResponse> create(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                              @Valid @RequestBody VehicleRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(vehicleService.create(userId, request), "Vehicle created"));
    }

    @PutMapping("/api/vehicles/{id}")
    public ResponseEntity<ApiResponse> update(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                              @PathVariable Long id,
                                              @Valid @RequestBody VehicleRequest request) {
        return ResponseEntity.ok(ApiResponse.success(vehicleService.update(userId, id, request), "Vehicle updated"));
    }

    @DeleteMapping("/api/vehicles/{id}")
    public ResponseEntity<ApiResponse> retire(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                              @PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(vehicleService.retire(userId, id), "Vehicle retired"));
    }

    @PostMapping("/api/vehicles/{id}/features")
    public ResponseEntity<ApiResponse> assignFeature(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                                     @PathVariable Long id,
                                                     @Valid @RequestBody FeatureAssignmentRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(vehicleService.assignFeature(userId, id, request), "Feature assigned"));
    }

    @PostMapping("/api/vehicles/{id}/images")
    public ResponseEntity<ApiResponse> addImage(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                                @PathVariable Long id,
                                                @Valid @RequestBody VehicleImageRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(vehicleService.addImage(userId, id, request), "Image added"));
    }

    @GetMapping("/api/admin/vehicles/{id}/maintenance")
    public ResponseEntity<ApiResponse> maintenance(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                                   @PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(
                vehicleService.maintenanceHistory(userId, id), "Maintenance history retrieved"));
    }

    @PostMapping("/api/admin/vehicles/{id}/maintenance")
    public ResponseEntity<ApiResponse> scheduleMaintenance(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                                           @PathVariable Long id,
                                                           @Valid @RequestBody MaintenanceRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(vehicleService.scheduleMaintenance(userId, id, request), "Maintenance scheduled"));
    }

    @PostMapping("/api/admin/maintenance/{recordId}/start")
    public ResponseEntity<ApiResponse> startMaintenance(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                                        @PathVariable Long recordId) {
        return ResponseEntity.ok(ApiResponse.success(
                vehicleService.startMaintenance(userId, recordId), "Maintenance started"));
    }

    @PostMapping("/api/admin/maintenance/{recordId}/complete")
    public ResponseEntity<ApiResponse> completeMaintenance(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                                           @PathVariable Long recordId,
                                                           @Valid @RequestBody MaintenanceCompletionRequest request) {
        return ResponseEntity.ok(ApiResponse.success(
                vehicleService.completeMaintenance(userId, recordId, request), "Maintenance completed"));
    }

    @GetMapping("/api/admin/vehicles/{id}/safety-equipment")
    public ResponseEntity<ApiResponse> safetyEquipment(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                                       @PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(
                vehicleService.safetyEquipment(userId, id), "Safety equipment retrieved"));
    }

    @PutMapping("/api/admin/vehicles/{id}/safety-equipment")
    public ResponseEntity<ApiResponse> recordSafetyEquipment(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                                             @PathVariable Long id,
                                                             @Valid @RequestBody SafetyEquipmentRequest request) {
        return ResponseEntity.ok(ApiResponse.success(
                vehicleService.recordSafetyEquipment(userId, id, request), "Safety equipment recorded"));
    }
}
