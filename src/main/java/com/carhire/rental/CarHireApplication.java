package com.carhire.rental;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main Spring Boot Application Class
 * Car Hire Rental Management Backend
 */
@SpringBootApplication
public class CarHireApplication {

    public static void main(String[] args) {
        SpringApplication.run(CarHireApplication.class, args);
    }

}
