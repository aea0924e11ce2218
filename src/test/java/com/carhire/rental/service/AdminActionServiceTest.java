package com.carhire.rental.service;

import com.carhire.rental.entity.Promotion;
import com.carhire.rental.entity.User;
import com.carhire.rental.entity.UserType;
import com.carhire.rental.entity.VehicleStatus;
import com.carhire.rental.exception.AccessDeniedException;
import com.carhire.rental.exception.BusinessRuleException;
import com.carhire.rental.repository.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AdminActionServiceTest {

    // ── Mocks ────────────────────────────────────────────────────────────────

    @Mock private BookingRepository     bookingRepository;
    @Mock private PaymentRepository     paymentRepository;
    @Mock private InvoiceRepository     invoiceRepository;
    @Mock private UserRepository        userRepository;
    @Mock private VehicleRepository     vehicleRepository;
    @Mock private ReviewRepository      reviewRepository;
    @Mock private PromotionRepository   promotionRepository;
    @Mock private IssueReportRepository issueRepository;
    @Mock private UserAccessService     userAccessService;

    private AdminActionService adminActionService;

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 10, 19, 11, 0);
    private static final Long STAFF_ID = 1L;

    private final User staff = User.builder().id(STAFF_ID).username("admin").userType(UserType.ADMIN).build();

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        adminActionService = new AdminActionService(bookingRepository, paymentRepository, invoiceRepository,
                userRepository, vehicleRepository, reviewRepository, promotionRepository, issueRepository,
                userAccessService, clock);
    }

    @Test
    @DisplayName("Bulk confirm reports only the rows the status filter let through")
    void confirmBookings_reportsUpdatedCount() {
        List<Long> ids = List.of(1L, 2L, 3L);
        when(userAccessService.requireStaff(STAFF_ID)).thenReturn(staff);
        when(bookingRepository.bulkConfirm(ids, NOW)).thenReturn(2);

        Map<String, Object> result = adminActionService.execute(STAFF_ID, "confirm_bookings", ids);

        assertThat(result).containsEntry("action", "confirm_bookings").containsEntry("updated", 2);
    }

    @Test
    @DisplayName("Maintenance action passes the target vehicle status")
    void markVehiclesMaintenance_passesTargetStatus() {
        List<Long> ids = List.of(7L);
        when(userAccessService.requireStaff(STAFF_ID)).thenReturn(staff);
        when(vehicleRepository.bulkUpdateStatus(ids, VehicleStatus.MAINTENANCE, NOW)).thenReturn(1);

        assertThat(adminActionService.execute(STAFF_ID, "mark_vehicles_maintenance", ids))
                .containsEntry("updated", 1);
    }

    @Test
    @DisplayName("Bulk resolve records the acting staff member")
    void resolveIssues_recordsResolvingStaff() {
        List<Long> ids = List.of(4L, 5L);
        when(userAccessService.requireStaff(STAFF_ID)).thenReturn(staff);
        when(issueRepository.bulkMarkResolved(ids, staff, NOW)).thenReturn(2);

        assertThat(adminActionService.execute(STAFF_ID, "mark_issues_resolved", ids))
                .containsEntry("updated", 2);
    }

    @Test
    @DisplayName("Extending promotions pushes the end date by the extension window")
    void extendPromotions_pushesEndDate() {
        Promotion promotion = Promotion.builder().id(9L).code("SPRING").endDate(NOW.plusDays(2)).build();
        when(userAccessService.requireStaff(STAFF_ID)).thenReturn(staff);
        when(promotionRepository.findAllById(List.of(9L))).thenReturn(List.of(promotion));

        adminActionService.execute(STAFF_ID, "extend_promotions", List.of(9L));

        assertThat(promotion.getEndDate())
                .isEqualTo(NOW.plusDays(2 + AdminActionService.PROMOTION_EXTENSION_DAYS));
        verify(promotionRepository).saveAll(List.of(promotion));
    }

    @Test
    @DisplayName("An unknown action name is rejected")
    void unknownAction_throws() {
        when(userAccessService.requireStaff(STAFF_ID)).thenReturn(staff);

        assertThatThrownBy(() -> adminActionService.execute(STAFF_ID, "delete_everything", List.of(1L)))
                .isInstanceOf(BusinessRuleException.class)
                .hasMessageContaining("delete_everything");
    }

    @Test
    @DisplayName("Customers cannot run admin actions")
    void customer_isDenied() {
        when(userAccessService.requireStaff(10L)).thenThrow(new AccessDeniedException("Staff access required"));

        assertThatThrownBy(() -> adminActionService.execute(10L, "confirm_bookings", List.of(1L)))
                .isInstanceOf(AccessDeniedException.class);
        verifyNoInteractions(bookingRepository);
    }

    @Test
    @DisplayName("Action table registers exactly the documented commands")
    void actionNames_listsEveryCommand() {
        assertThat(adminActionService.actionNames()).containsExactlyInAnyOrder(
                "confirm_bookings", "start_rentals", "complete_rentals", "cancel_bookings",
                "process_payments", "mark_payments_failed",
                "mark_invoices_paid", "mark_invoices_overdue",
                "mark_vehicles_available", "mark_vehicles_maintenance",
                "feature_vehicles", "unfeature_vehicles",
                "verify_users", "suspend_users", "activate_users",
                "approve_reviews", "unapprove_reviews", "verify_reviews", "feature_reviews",
                "activate_promotions", "deactivate_promotions", "extend_promotions",
                "mark_issues_in_progress", "mark_issues_resolved");
    }

    @Test
    @DisplayName("start_rentals and mark_payments_failed reach their bulk updates")
    void renamedActions_dispatchToRepositories() {
        List<Long> ids = List.of(3L);
        when(userAccessService.requireStaff(STAFF_ID)).thenReturn(staff);
        when(bookingRepository.bulkStart(ids, NOW)).thenReturn(1);
        when(paymentRepository.bulkFail(ids, NOW)).thenReturn(1);

        assertThat(adminActionService.execute(STAFF_ID, "start_rentals", ids)).containsEntry("updated", 1);
        assertThat(adminActionService.execute(STAFF_ID, "mark_payments_failed", ids)).containsEntry("updated", 1);
    }
}
