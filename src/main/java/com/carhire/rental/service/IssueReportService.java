package com.carhire.rental.service;

import com.carhire.rental.dto.IssueReportRequest;
import com.carhire.rental.dto.IssueReportResponse;
import com.carhire.rental.dto.IssueUpdateRequest;
import com.carhire.rental.entity.*;
import com.carhire.rental.exception.AccessDeniedException;
import com.carhire.rental.exception.BusinessRuleException;
import com.carhire.rental.exception.InvalidTransitionException;
import com.carhire.rental.exception.ResourceNotFoundException;
import com.carhire.rental.repository.BookingRepository;
import com.carhire.rental.repository.IssueReportRepository;
import com.carhire.rental.repository.UserRepository;
import com.carhire.rental.repository.VehicleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Support tickets raised by customers, optionally tied to a booking or
 * vehicle. CLOSED is final.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IssueReportService {

    private final IssueReportRepository issueRepository;
    private final BookingRepository bookingRepository;
    private final VehicleRepository vehicleRepository;
    private final UserRepository userRepository;
    private final IdentifierService identifierService;
    private final UserAccessService userAccessService;
    private final Clock clock;

    @Transactional
    public IssueReportResponse create(Long customerId, IssueReportRequest request) {
        User customer = userAccessService.requireUser(customerId);

        Booking booking = null;
        Vehicle vehicle = null;
        if (request.getBookingId() != null) {
            booking = bookingRepository.findById(request.getBookingId())
                    .orElseThrow(() -> new ResourceNotFoundException("Booking", request.getBookingId()));
            if (!customer.isStaff() && !booking.getCustomer().getId().equals(customerId)) {
                throw new AccessDeniedException("Not allowed to report on this booking");
            }
            vehicle = booking.getVehicle();
        }
        if (request.getVehicleId() != null) {
            vehicle = vehicleRepository.findById(request.getVehicleId())
                    .orElseThrow(() -> new ResourceNotFoundException("Vehicle", request.getVehicleId()));
        }

        IssueReport issue = IssueReport.builder()
                .ticketNumber(identifierService.nextTicketNumber())
                .customer(customer)
                .booking(booking)
                .vehicle(vehicle)
                .issueType(request.getIssueType())
                .subject(request.getSubject())
                .description(request.getDescription())
                .location(request.getLocation())
                .build();
        if (request.getPriority() != null) {
            issue.setPriority(request.getPriority());
        }
        IssueReport saved = issueRepository.save(issue);
        log.info("Issue {} opened by customer #{}: {} / {}", saved.getTicketNumber(), customerId,
                saved.getIssueType(), saved.getPriority());
        return IssueReportResponse.from(saved);
    }

    @Transactional(readOnly = true)
    public IssueReportResponse get(Long actorId, Long issueId) {
        IssueReport issue = find(issueId);
        userAccessService.requireOwnerOrStaff(actorId, issue.getCustomer());
        return IssueReportResponse.from(issue);
    }

    /** Staff see every ticket, customers their own. */
    @Transactional(readOnly = true)
    public List<IssueReportResponse> list(Long actorId) {
        User actor = userAccessService.requireUser(actorId);
        List<IssueReport> issues = actor.isStaff()
                ? issueRepository.findAllByOrderByCreatedAtDesc()
                : issueRepository.findByCustomerIdOrderByCreatedAtDesc(actorId);
        return issues.stream().map(IssueReportResponse::from).collect(Collectors.toList());
    }

    /** Hands the ticket to a staff member; an OPEN ticket moves to IN_PROGRESS. */
    @Transactional
    public IssueReportResponse assign(Long staffId, Long issueId, Long assigneeId) {
        userAccessService.requireStaff(staffId);
        IssueReport issue = find(issueId);
        requireNotClosed(issue, "assign");
        User assignee = userRepository.findById(assigneeId)
                .orElseThrow(() -> new ResourceNotFoundException("User", assigneeId));
        if (!assignee.isStaff()) {
            throw new BusinessRuleException("Issues can only be assigned to staff");
        }
        issue.setAssignedTo(assignee);
        if (issue.getStatus() == IssueStatus.OPEN) {
            issue.setStatus(IssueStatus.IN_PROGRESS);
        }
        return IssueReportResponse.from(issueRepository.save(issue));
    }

    @Transactional
    public IssueReportResponse updateStatus(Long staffId, Long issueId, IssueUpdateRequest request) {
        User staff = userAccessService.requireStaff(staffId);
        IssueReport issue = find(issueId);
        requireNotClosed(issue, "update");
        if (request.getStatus() == null) {
            throw new BusinessRuleException("Status is required");
        }
        if (request.getStatus() == IssueStatus.RESOLVED) {
            return resolve(staff, issue, request.getResolution());
        }
        if (request.getStatus() == IssueStatus.ESCALATED) {
            return escalate(issue);
        }
        issue.setStatus(request.getStatus());
        if (request.getResolution() != null) {
            issue.setResolution(request.getResolution());
        }
        return IssueReportResponse.from(issueRepository.save(issue));
    }

    @Transactional
    public IssueReportResponse escalate(Long staffId, Long issueId) {
        userAccessService.requireStaff(staffId);
        IssueReport issue = find(issueId);
        requireNotClosed(issue, "escalate");
        return escalate(issue);
    }

    @Transactional
    public IssueReportResponse resolve(Long staffId, Long issueId, String resolution) {
        User staff = userAccessService.requireStaff(staffId);
        IssueReport issue = find(issueId);
        requireNotClosed(issue, "resolve");
        return resolve(staff, issue, resolution);
    }

    /** Customer rates the handling of their own resolved ticket. */
    @Transactional
    public IssueReportResponse feedback(Long customerId, Long issueId, Integer satisfaction, String feedback) {
        IssueReport issue = find(issueId);
        if (!issue.getCustomer().getId().equals(customerId)) {
            throw new AccessDeniedException("Only the reporting customer can give feedback");
        }
        if (issue.getStatus() != IssueStatus.RESOLVED && issue.getStatus() != IssueStatus.CLOSED) {
            throw new InvalidTransitionException("issue " + issue.getTicketNumber(), issue.getStatus(), "give feedback on");
        }
        issue.setCustomerSatisfaction(satisfaction);
        issue.setCustomerFeedback(feedback);
        return IssueReportResponse.from(issueRepository.save(issue));
    }

    private IssueReportResponse escalate(IssueReport issue) {
        issue.setPriority(issue.getPriority().escalate());
        issue.setStatus(IssueStatus.ESCALATED);
        log.warn("Issue {} escalated to {}", issue.getTicketNumber(), issue.getPriority());
        return IssueReportResponse.from(issueRepository.save(issue));
    }

    private IssueReportResponse resolve(User staff, IssueReport issue, String resolution) {
        if (resolution == null || resolution.isBlank()) {
            throw new BusinessRuleException("A resolution is required");
        }
        issue.setStatus(IssueStatus.RESOLVED);
        issue.setResolution(resolution);
        issue.setResolutionDate(LocalDateTime.now(clock));
        issue.setResolvedBy(staff);
        log.info("Issue {} resolved by {}", issue.getTicketNumber(), staff.getUsername());
        return IssueReportResponse.from(issueRepository.save(issue));
    }

    private void requireNotClosed(IssueReport issue, String action) {
        if (issue.getStatus() == IssueStatus.CLOSED) {
            throw new InvalidTransitionException("issue " + issue.getTicketNumber(), issue.getStatus(), action);
        }
    }

    private IssueReport find(Long issueId) {
        return issueRepository.findById(issueId)
                .orElseThrow(() -> new ResourceNotFoundException("Issue report", issueId));
    }
}
