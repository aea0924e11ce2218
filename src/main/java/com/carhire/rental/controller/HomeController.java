package com.carhire.rental.controller;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Home controller that shows API info at the root URL
 */
@RestController
public class HomeController {

    @GetMapping("/")
    public Map<String, Object> home() {
        Map<String, Object> endpoints = new LinkedHashMap<>();
        endpoints.put("POST /api/auth/register", "Create a customer account");
        endpoints.put("POST /api/auth/login", "Obtain access and refresh tokens");
        endpoints.put("GET /api/vehicles", "Browse the fleet");
        endpoints.put("GET /api/vehicles/{id}/quote", "Price a rental");
        endpoints.put("POST /api/bookings", "Book a vehicle");
        endpoints.put("POST /api/payments", "Pay for a booking");
        endpoints.put("POST /api/admin/actions/{action}", "Staff bulk actions");
        endpoints.put("GET /swagger-ui.html", "API documentation");
        endpoints.put("GET /h2-console", "H2 Database Console");

        Map<String, Object> info = new LinkedHashMap<>();
        info.put("application", "Car Hire Rental API");
        info.put("status", "Running");
        info.put("endpoints", endpoints);
        info.put("sampleRequest", Map.of(
                "url", "POST /api/bookings",
                "body", Map.of(
                        "vehicleId", 1,
                        "pickupDate", "2026-11-02T09:00:00",
                        "returnDate", "2026-11-05T09:00:00",
                        "pickupLocation", "Blantyre Airport",
                        "returnLocation", "Blantyre Airport"
                )
        ));
        return info;
    }

}
