package com.carhire.rental.controller;

import com.carhire.rental.config.AuthInterceptor;
import com.carhire.rental.dto.BookingResponse;
import com.carhire.rental.entity.BookingStatus;
import com.carhire.rental.exception.AccessDeniedException;
import com.carhire.rental.exception.GlobalExceptionHandler;
import com.carhire.rental.exception.InvalidTransitionException;
import com.carhire.rental.exception.ResourceNotFoundException;
import com.carhire.rental.service.BillingDocumentService;
import com.carhire.rental.service.BookingService;
import com.carhire.rental.service.PaymentService;
import com.carhire.rental.service.PenaltyService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * BookingController over MockMvc: envelope shape and the mapping of domain
 * exceptions onto status codes.
 */
@ExtendWith(MockitoExtension.class)
class BookingControllerTest {

    // ── Mocks ────────────────────────────────────────────────────────────────

    @Mock private BookingService         bookingService;
    @Mock private PaymentService         paymentService;
    @Mock private BillingDocumentService billingDocumentService;
    @Mock private PenaltyService         penaltyService;

    @InjectMocks
    private BookingController bookingController;

    private MockMvc mockMvc;

    private static final Long CUSTOMER_ID = 10L;
    private static final Long STAFF_ID    = 1L;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(bookingController)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("Confirm returns the booking in the response envelope")
    void confirm_returnsEnvelopeWithBooking() throws Exception {
        BookingResponse confirmed = BookingResponse.builder()
                .id(100L)
                .bookingReference("BK2610190001")
                .status(BookingStatus.CONFIRMED)
                .build();
        when(bookingService.confirm(STAFF_ID, 100L)).thenReturn(confirmed);

        mockMvc.perform(post("/api/bookings/100/confirm")
                        .requestAttr(AuthInterceptor.USER_ID_ATTRIBUTE, STAFF_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.message").value("Booking confirmed"))
                .andExpect(jsonPath("$.data.bookingReference").value("BK2610190001"))
                .andExpect(jsonPath("$.data.status").value("CONFIRMED"));
    }

    @Test
    @DisplayName("Invalid lifecycle transition maps to 409 Conflict")
    void cancel_completedBooking_returnsConflict() throws Exception {
        when(bookingService.cancel(eq(CUSTOMER_ID), eq(100L), any()))
                .thenThrow(new InvalidTransitionException("Cannot cancel booking BK2610190001 in status COMPLETED"));

        mockMvc.perform(post("/api/bookings/100/cancel")
                        .requestAttr(AuthInterceptor.USER_ID_ATTRIBUTE, CUSTOMER_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\":\"Changed my mind\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.message").value("Cannot cancel booking BK2610190001 in status COMPLETED"));
    }

    @Test
    @DisplayName("Another customer's booking returns 403")
    void get_otherCustomersBooking_returnsForbidden() throws Exception {
        when(bookingService.get(CUSTOMER_ID, 200L))
                .thenThrow(new AccessDeniedException("Not allowed to access this record"));

        mockMvc.perform(get("/api/bookings/200")
                        .requestAttr(AuthInterceptor.USER_ID_ATTRIBUTE, CUSTOMER_ID))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    @DisplayName("An unknown booking returns 404")
    void get_unknownBooking_returnsNotFound() throws Exception {
        when(bookingService.get(CUSTOMER_ID, 999L)).thenThrow(new ResourceNotFoundException("Booking", 999L));

        mockMvc.perform(get("/api/bookings/999")
                        .requestAttr(AuthInterceptor.USER_ID_ATTRIBUTE, CUSTOMER_ID))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Booking not found: 999"));
    }

    @Test
    @DisplayName("Missing required fields are reported per field with 400")
    void create_missingFields_returnsValidationErrors() throws Exception {
        mockMvc.perform(post("/api/bookings")
                        .requestAttr(AuthInterceptor.USER_ID_ATTRIBUTE, CUSTOMER_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Validation failed"))
                .andExpect(jsonPath("$.data.vehicleId").value("Vehicle ID is required"));
        verifyNoInteractions(bookingService);
    }
}
