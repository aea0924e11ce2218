package com.carhire.rental.controller;

import com.carhire.rental.config.AuthInterceptor;
import com.carhire.rental.dto.AdminActionRequest;
import com.carhire.rental.dto.ApiResponse;
import com.carhire.rental.service.AdminActionService;
import com.carhire.rental.service.CatalogService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * POST /api/admin/actions/{action} - bulk update by id list.
 * GET  /api/admin/actions          - available action names.
 */
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
@Slf4j
public class AdminActionController {

    private final AdminActionService adminActionService;
    private final CatalogService catalogService;

    @GetMapping("/actions")
    public ResponseEntity<ApiResponse> actions() {
        return ResponseEntity.ok(ApiResponse.success(adminActionService.actionNames(), "Available actions"));
    }

    @PostMapping("/actions/{action}")
    public ResponseEntity<ApiResponse> execute(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                               @PathVariable String action,
                                               @Valid @RequestBody AdminActionRequest request) {
        Map<String, Object> result = adminActionService.execute(userId, action, request.getIds());
        return ResponseEntity.ok(ApiResponse.success(result, result.get("updated") + " record(s) updated"));
    }

    @PostMapping("/cache/evict")
    public ResponseEntity<ApiResponse> evictCaches() {
        catalogService.evictAll();
        return ResponseEntity.ok(ApiResponse.success("Catalogue caches cleared"));
    }
}
