package com.carhire.rental.service;

import com.carhire.rental.dto.IssueReportRequest;
import com.carhire.rental.dto.IssueReportResponse;
import com.carhire.rental.entity.*;
import com.carhire.rental.exception.AccessDeniedException;
import com.carhire.rental.exception.BusinessRuleException;
import com.carhire.rental.exception.InvalidTransitionException;
import com.carhire.rental.repository.BookingRepository;
import com.carhire.rental.repository.IssueReportRepository;
import com.carhire.rental.repository.UserRepository;
import com.carhire.rental.repository.VehicleRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class IssueReportServiceTest {

    // ── Mocks ────────────────────────────────────────────────────────────────

    @Mock private IssueReportRepository issueRepository;
    @Mock private BookingRepository     bookingRepository;
    @Mock private VehicleRepository     vehicleRepository;
    @Mock private UserRepository        userRepository;
    @Mock private IdentifierService     identifierService;
    @Mock private UserAccessService     userAccessService;

    private IssueReportService issueReportService;

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 10, 19, 13, 20);

    private User customer;
    private User staff;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        issueReportService = new IssueReportService(issueRepository, bookingRepository, vehicleRepository,
                userRepository, identifierService, userAccessService, clock);
        customer = User.builder().id(10L).username("chikondi").build();
        staff = User.builder().id(1L).username("admin").userType(UserType.STAFF).build();
    }

    private IssueReport issue(IssueStatus status) {
        return IssueReport.builder()
                .id(7L)
                .ticketNumber("TKT2610190001")
                .customer(customer)
                .issueType(IssueType.BREAKDOWN)
                .subject("Flat tyre")
                .description("Flat tyre near Dedza")
                .status(status)
                .build();
    }

    @Test
    @DisplayName("A report on a booking takes its vehicle and a sequential ticket number")
    void create_forOwnBooking() {
        Vehicle vehicle = Vehicle.builder().id(5L).build();
        Booking booking = Booking.builder().id(100L).customer(customer).vehicle(vehicle).build();
        when(userAccessService.requireUser(10L)).thenReturn(customer);
        when(bookingRepository.findById(100L)).thenReturn(Optional.of(booking));
        when(identifierService.nextTicketNumber()).thenReturn("TKT2610190003");
        when(issueRepository.save(any(IssueReport.class))).thenAnswer(inv -> inv.getArgument(0));

        IssueReportResponse response = issueReportService.create(10L, IssueReportRequest.builder()
                .bookingId(100L)
                .issueType(IssueType.BREAKDOWN)
                .subject("Flat tyre")
                .description("Flat tyre near Dedza")
                .build());

        assertThat(response.getTicketNumber()).isEqualTo("TKT2610190003");
        assertThat(response.getVehicleId()).isEqualTo(5L);
        assertThat(response.getStatus()).isEqualTo(IssueStatus.OPEN);
        assertThat(response.getPriority()).isEqualTo(IssuePriority.MEDIUM);
    }

    @Test
    @DisplayName("Reporting on another customer's booking is denied")
    void create_onSomeoneElsesBooking_isDenied() {
        Booking booking = Booking.builder().id(100L).customer(User.builder().id(99L).build()).build();
        when(userAccessService.requireUser(10L)).thenReturn(customer);
        when(bookingRepository.findById(100L)).thenReturn(Optional.of(booking));

        assertThatThrownBy(() -> issueReportService.create(10L, IssueReportRequest.builder()
                .bookingId(100L).issueType(IssueType.OTHER).subject("x").description("y").build()))
                .isInstanceOf(AccessDeniedException.class);
        verifyNoInteractions(identifierService);
    }

    @Test
    @DisplayName("Escalation raises the priority one step")
    void escalate_raisesPriority() {
        IssueReport issue = issue(IssueStatus.IN_PROGRESS);
        when(userAccessService.requireStaff(1L)).thenReturn(staff);
        when(issueRepository.findById(7L)).thenReturn(Optional.of(issue));
        when(issueRepository.save(issue)).thenReturn(issue);

        issueReportService.escalate(1L, 7L);

        assertThat(issue.getPriority()).isEqualTo(IssuePriority.HIGH);
        assertThat(issue.getStatus()).isEqualTo(IssueStatus.ESCALATED);
    }

    @Test
    @DisplayName("Resolving records the date and the resolver")
    void resolve_recordsResolver() {
        IssueReport issue = issue(IssueStatus.IN_PROGRESS);
        when(userAccessService.requireStaff(1L)).thenReturn(staff);
        when(issueRepository.findById(7L)).thenReturn(Optional.of(issue));
        when(issueRepository.save(issue)).thenReturn(issue);

        issueReportService.resolve(1L, 7L, "Replacement vehicle delivered");

        assertThat(issue.getStatus()).isEqualTo(IssueStatus.RESOLVED);
        assertThat(issue.getResolutionDate()).isEqualTo(NOW);
        assertThat(issue.getResolvedBy()).isSameAs(staff);
    }

    @Test
    @DisplayName("A resolution text is required")
    void resolve_withoutResolution_throws() {
        when(userAccessService.requireStaff(1L)).thenReturn(staff);
        when(issueRepository.findById(7L)).thenReturn(Optional.of(issue(IssueStatus.OPEN)));

        assertThatThrownBy(() -> issueReportService.resolve(1L, 7L, " "))
                .isInstanceOf(BusinessRuleException.class);
    }

    @Test
    @DisplayName("A closed ticket accepts no further changes")
    void closedIssue_cannotBeEscalated() {
        when(userAccessService.requireStaff(1L)).thenReturn(staff);
        when(issueRepository.findById(7L)).thenReturn(Optional.of(issue(IssueStatus.CLOSED)));

        assertThatThrownBy(() -> issueReportService.escalate(1L, 7L))
                .isInstanceOf(InvalidTransitionException.class);
    }

    @Test
    @DisplayName("Feedback waits until the issue is resolved")
    void feedback_onOpenIssue_throws() {
        when(issueRepository.findById(7L)).thenReturn(Optional.of(issue(IssueStatus.OPEN)));

        assertThatThrownBy(() -> issueReportService.feedback(10L, 7L, 5, "Great"))
                .isInstanceOf(InvalidTransitionException.class);
    }
}
