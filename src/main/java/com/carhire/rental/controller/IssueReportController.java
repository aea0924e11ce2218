package com.carhire.rental.controller;

import com.carhire.rental.config.AuthInterceptor;
import com.carhire.rental.dto.ApiResponse;
import com.carhire.rental.dto.IssueReportRequest;
import com.carhire.rental.dto.IssueUpdateRequest;
import com.carhire.rental.exception.BusinessRuleException;
import com.carhire.rental.service.IssueReportService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/issues")
@RequiredArgsConstructor
public class IssueReportController {

    private final IssueReportService issueReportService;

    @PostMapping
    public ResponseEntity<ApiResponse> create(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                              @Valid @RequestBody IssueReportRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(issueReportService.create(userId, request), "Issue reported"));
    }

    @GetMapping
    public ResponseEntity<ApiResponse> list(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId) {
        return ResponseEntity.ok(ApiResponse.success(issueReportService.list(userId), "Issues retrieved"));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse> get(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                           @PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(issueReportService.get(userId, id), "Issue retrieved"));
    }

    @PostMapping("/{id}/assign")
    public ResponseEntity<ApiResponse> assign(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                              @PathVariable Long id,
                                              @RequestBody IssueUpdateRequest request) {
        if (request.getAssigneeId() == null) {
            throw new BusinessRuleException("assigneeId is required");
        }
        return ResponseEntity.ok(ApiResponse.success(
                issueReportService.assign(userId, id, request.getAssigneeId()), "Issue assigned"));
    }

    @PutMapping("/{id}/status")
    public ResponseEntity<ApiResponse> updateStatus(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                                    @PathVariable Long id,
                                                    @Valid @RequestBody IssueUpdateRequest request) {
        return ResponseEntity.ok(ApiResponse.success(issueReportService.updateStatus(userId, id, request), "Issue updated"));
    }

    @PostMapping("/{id}/escalate")
    public ResponseEntity<ApiResponse> escalate(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                                @PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(issueReportService.escalate(userId, id), "Issue escalated"));
    }

    @PostMapping("/{id}/resolve")
    public ResponseEntity<ApiResponse> resolve(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                               @PathVariable Long id,
                                               @RequestBody IssueUpdateRequest request) {
        return ResponseEntity.ok(ApiResponse.success(
                issueReportService.resolve(userId, id, request.getResolution()), "Issue resolved"));
    }

    @PostMapping("/{id}/feedback")
    public ResponseEntity<ApiResponse> feedback(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                                @PathVariable Long id,
                                                @Valid @RequestBody IssueUpdateRequest request) {
        return ResponseEntity.ok(ApiResponse.success(
                issueReportService.feedback(userId, id, request.getSatisfaction(), request.getFeedback()),
                "Feedback recorded"));
    }
}
