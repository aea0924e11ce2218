package com.carhire.rental.dto;

import com.carhire.rental.entity.*;
import lombok.*;

import java.math.BigDecimal;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class VehicleResponse {

    private Long id;
    private Long modelId;
    private String brand;
    private String model;
    private String category;
    private int year;
    private String color;
    private String licensePlate;
    private String vinNumber;
    private FuelType fuelType;
    private TransmissionType transmission;
    private int seatingCapacity;
    private int doors;
    private BigDecimal fuelTankCapacity;
    private VehicleStatus status;
    private VehicleCondition condition;
    private int currentMileage;
    private int lastServiceMileage;
    private BigDecimal dailyRate;
    private BigDecimal weeklyRate;
    private BigDecimal monthlyRate;
    private BigDecimal securityDeposit;
    private String currentLocation;
    private boolean featured;
    private boolean availableForBooking;

    public static VehicleResponse from(Vehicle v) {
        VehicleModel m = v.getModel();
        return VehicleResponse.builder()
                .id(v.getId())
                .modelId(m.getId())
                .brand(m.getBrand().getName())
                .model(m.getName())
                .category(m.getCategory().getName())
                .year(v.getYear())
                .color(v.getColor())
                .licensePlate(v.getLicensePlate())
                .vinNumber(v.getVinNumber())
                .fuelType(v.getFuelType())
                .transmission(v.getTransmission())
                .seatingCapacity(v.getSeatingCapacity())
                .doors(v.getDoors())
                .fuelTankCapacity(v.getFuelTankCapacity())
                .status(v.getStatus())
                .condition(v.getCondition())
                .currentMileage(v.getCurrentMileage())
                .lastServiceMileage(v.getLastServiceMileage())
                .dailyRate(v.getDailyRate())
                .weeklyRate(v.getEffectiveWeeklyRate())
                .monthlyRate(v.getEffectiveMonthlyRate())
                .securityDeposit(v.getSecurityDeposit())
                .currentLocation(v.getCurrentLocation())
                .featured(v.isFeatured())
                .availableForBooking(v.isAvailableForBooking())
                .build();
    }
}
