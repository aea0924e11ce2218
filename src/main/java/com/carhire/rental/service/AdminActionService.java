package com.carhire.rental.service;

import com.carhire.rental.entity.Promotion;
import com.carhire.rental.entity.User;
import com.carhire.rental.entity.VehicleStatus;
import com.carhire.rental.exception.BusinessRuleException;
import com.carhire.rental.repository.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Back-office bulk actions, looked up by name.
 *
 * Each action is a single batched UPDATE whose WHERE clause carries the
 * status filter; rows that do not match are skipped and not reported as
 * errors. Per-row side effects of the normal transitions (notifications,
 * loyalty, receipts) do not run here.
 */
@Service
@Slf4j
public class AdminActionService {

    /** A batched update over {@code ids}; returns the number of rows changed. */
    @FunctionalInterface
    interface AdminAction {
        int apply(List<Long> ids, User staff, LocalDateTime now);
    }

    static final int PROMOTION_EXTENSION_DAYS = 30;

    private final Map<String, AdminAction> actions = new LinkedHashMap<>();
    private final UserAccessService userAccessService;
    private final PromotionRepository promotionRepository;
    private final Clock clock;

    public AdminActionService(BookingRepository bookingRepository,
                              PaymentRepository paymentRepository,
                              InvoiceRepository invoiceRepository,
                              UserRepository userRepository,
                              VehicleRepository vehicleRepository,
                              ReviewRepository reviewRepository,
                              PromotionRepository promotionRepository,
                              IssueReportRepository issueRepository,
                              UserAccessService userAccessService,
                              Clock clock) {
        this.userAccessService = userAccessService;
        this.promotionRepository = promotionRepository;
        this.clock = clock;

        // Bookings
        actions.put("confirm_bookings", (ids, staff, now) -> bookingRepository.bulkConfirm(ids, now));
        actions.put("start_rentals", (ids, staff, now) -> bookingRepository.bulkStart(ids, now));
        actions.put("complete_rentals", (ids, staff, now) -> bookingRepository.bulkComplete(ids, now));
        actions.put("cancel_bookings", (ids, staff, now) -> bookingRepository.bulkCancel(ids, now));

        // Payments & invoices
        actions.put("process_payments", (ids, staff, now) -> paymentRepository.bulkProcess(ids, now));
        actions.put("mark_payments_failed", (ids, staff, now) -> paymentRepository.bulkFail(ids, now));
        actions.put("mark_invoices_paid", (ids, staff, now) -> invoiceRepository.bulkMarkPaid(ids, now));
        actions.put("mark_invoices_overdue",
                (ids, staff, now) -> invoiceRepository.bulkMarkOverdue(ids, now.toLocalDate(), now));

        // Users
        actions.put("verify_users", (ids, staff, now) -> userRepository.bulkVerify(ids, now));
        actions.put("suspend_users", (ids, staff, now) -> userRepository.bulkSuspend(ids, now));
        actions.put("activate_users", (ids, staff, now) -> userRepository.bulkActivate(ids, now));

        // Vehicles
        actions.put("mark_vehicles_available",
                (ids, staff, now) -> vehicleRepository.bulkUpdateStatus(ids, VehicleStatus.AVAILABLE, now));
        actions.put("mark_vehicles_maintenance",
                (ids, staff, now) -> vehicleRepository.bulkUpdateStatus(ids, VehicleStatus.MAINTENANCE, now));
        actions.put("feature_vehicles", (ids, staff, now) -> vehicleRepository.bulkUpdateFeatured(ids, true, now));
        actions.put("unfeature_vehicles", (ids, staff, now) -> vehicleRepository.bulkUpdateFeatured(ids, false, now));

        // Reviews
        actions.put("approve_reviews", (ids, staff, now) -> reviewRepository.bulkUpdateApproved(ids, true, now));
        actions.put("unapprove_reviews", (ids, staff, now) -> reviewRepository.bulkUpdateApproved(ids, false, now));
        actions.put("verify_reviews", (ids, staff, now) -> reviewRepository.bulkVerify(ids, now));
        actions.put("feature_reviews", (ids, staff, now) -> reviewRepository.bulkFeature(ids, now));

        // Promotions
        actions.put("activate_promotions", (ids, staff, now) -> promotionRepository.bulkUpdateActive(ids, true));
        actions.put("deactivate_promotions", (ids, staff, now) -> promotionRepository.bulkUpdateActive(ids, false));
        actions.put("extend_promotions", (ids, staff, now) -> extendPromotions(ids));

        // Issues
        actions.put("mark_issues_in_progress", (ids, staff, now) -> issueRepository.bulkMarkInProgress(ids, now));
        actions.put("mark_issues_resolved", (ids, staff, now) -> issueRepository.bulkMarkResolved(ids, staff, now));
    }

    public Set<String> actionNames() {
        return Collections.unmodifiableSet(actions.keySet());
    }

    /**
     * Runs {@code action} over {@code ids} as the given staff member.
     *
     * @return {@code {action, updated}}
     * @throws BusinessRuleException for an unknown action name
     */
    @Transactional
    public Map<String, Object> execute(Long staffId, String action, List<Long> ids) {
        User staff = userAccessService.requireStaff(staffId);
        AdminAction command = actions.get(action);
        if (command == null) {
            throw new BusinessRuleException("Unknown admin action: " + action);
        }

        int updated = command.apply(ids, staff, LocalDateTime.now(clock));
        log.info("Admin action '{}' by {} updated {}/{} record(s)", action, staff.getUsername(), updated, ids.size());

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("action", action);
        result.put("updated", updated);
        return result;
    }

    private int extendPromotions(List<Long> ids) {
        List<Promotion> promotions = promotionRepository.findAllById(ids);
        for (Promotion promotion : promotions) {
            promotion.setEndDate(promotion.getEndDate().plusDays(PROMOTION_EXTENSION_DAYS));
        }
        promotionRepository.saveAll(promotions);
        return promotions.size();
    }
}
