package com.carhire.rental.service;

import com.carhire.rental.dto.*;
import com.carhire.rental.entity.*;
import com.carhire.rental.exception.BusinessRuleException;
import com.carhire.rental.exception.DuplicateResourceException;
import com.carhire.rental.exception.InvalidTransitionException;
import com.carhire.rental.exception.ResourceNotFoundException;
import com.carhire.rental.repository.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Fleet records and everything hanging off a vehicle: features, images,
 * maintenance history and safety equipment.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VehicleService {

    private final VehicleRepository vehicleRepository;
    private final VehicleModelRepository modelRepository;
    private final VehicleFeatureRepository featureRepository;
    private final VehicleFeatureAssignmentRepository featureAssignmentRepository;
    private final VehicleImageRepository imageRepository;
    private final VehicleMaintenanceRecordRepository maintenanceRepository;
    private final VehicleSafetyEquipmentRepository safetyEquipmentRepository;
    private final BookingRepository bookingRepository;
    private final PricingService pricingService;
    private final UserAccessService userAccessService;
    private final Clock clock;

    // ── Fleet ──

    /** Active vehicles, optionally narrowed to a status and/or category. */
    @Transactional(readOnly = true)
    public List<VehicleResponse> list(VehicleStatus status, Long categoryId) {
        List<Vehicle> vehicles = status != null
                ? vehicleRepository.findByStatusAndActiveTrueOrderByIdAsc(status)
                : vehicleRepository.findByActiveTrueOrderByIdAsc();
        return vehicles.stream()
                .filter(v -> categoryId == null || categoryId.equals(v.getModel().getCategory().getId()))
                .map(VehicleResponse::from)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public VehicleResponse get(Long vehicleId) {
        return VehicleResponse.from(find(vehicleId));
    }

    @Transactional
    public VehicleResponse create(Long staffId, VehicleRequest request) {
        userAccessService.requireStaff(staffId);
        if (vehicleRepository.existsByLicensePlate(request.getLicensePlate())) {
            throw new DuplicateResourceException("License plate already registered: " + request.getLicensePlate());
        }
        if (vehicleRepository.existsByVinNumber(request.getVinNumber())) {
            throw new DuplicateResourceException("VIN already registered: " + request.getVinNumber());
        }
        Vehicle vehicle = new Vehicle();
        apply(vehicle, request);
        Vehicle saved = vehicleRepository.save(vehicle);
        log.info("Vehicle #{} {} added to fleet ({})", saved.getId(), saved.getLicensePlate(),
                saved.getModel().getDisplayName());
        return VehicleResponse.from(saved);
    }

    @Transactional
    public VehicleResponse update(Long staffId, Long vehicleId, VehicleRequest request) {
        userAccessService.requireStaff(staffId);
        Vehicle vehicle = find(vehicleId);
        if (vehicleRepository.existsByLicensePlateAndIdNot(request.getLicensePlate(), vehicleId)) {
            throw new DuplicateResourceException("License plate already registered: " + request.getLicensePlate());
        }
        if (vehicleRepository.existsByVinNumberAndIdNot(request.getVinNumber(), vehicleId)) {
            throw new DuplicateResourceException("VIN already registered: " + request.getVinNumber());
        }
        apply(vehicle, request);
        return VehicleResponse.from(vehicleRepository.save(vehicle));
    }

    /** Takes a vehicle out of the fleet. Rented vehicles must be returned first. */
    @Transactional
    public VehicleResponse retire(Long staffId, Long vehicleId) {
        userAccessService.requireStaff(staffId);
        Vehicle vehicle = vehicleRepository.findByIdForUpdate(vehicleId)
                .orElseThrow(() -> new ResourceNotFoundException("Vehicle", vehicleId));
        if (vehicle.getStatus() == VehicleStatus.RENTED) {
            throw new InvalidTransitionException("vehicle " + vehicle.getLicensePlate(), vehicle.getStatus(), "retire");
        }
        vehicle.setStatus(VehicleStatus.RETIRED);
        vehicle.setActive(false);
        log.info("Vehicle {} retired", vehicle.getLicensePlate());
        return VehicleResponse.from(vehicleRepository.save(vehicle));
    }

    @Transactional(readOnly = true)
    public boolean isAvailable(Long vehicleId, LocalDateTime pickup, LocalDateTime dropOff) {
        return isAvailable(find(vehicleId), pickup, dropOff);
    }

    @Transactional(readOnly = true)
    public PriceQuote quote(Long vehicleId, LocalDateTime pickup, LocalDateTime dropOff) {
        Vehicle vehicle = find(vehicleId);
        PriceQuote quote = pricingService.quote(vehicle, pickup, dropOff);
        quote.setAvailable(isAvailable(vehicle, pickup, dropOff));
        return quote;
    }

    // ── Features ──

    @Transactional(readOnly = true)
    public List<VehicleFeature> features(Long vehicleId) {
        find(vehicleId);
        return featureAssignmentRepository.findByVehicleId(vehicleId).stream()
                .map(VehicleFeatureAssignment::getFeature)
                .collect(Collectors.toList());
    }

    @Transactional
    public VehicleFeatureAssignment assignFeature(Long staffId, Long vehicleId, FeatureAssignmentRequest request) {
        userAccessService.requireStaff(staffId);
        Vehicle vehicle = find(vehicleId);
        VehicleFeature feature = featureRepository.findById(request.getFeatureId())
                .orElseThrow(() -> new ResourceNotFoundException("Feature", request.getFeatureId()));
        if (featureAssignmentRepository.existsByVehicleIdAndFeatureId(vehicleId, feature.getId())) {
            throw new DuplicateResourceException("Vehicle already has feature " + feature.getName());
        }
        return featureAssignmentRepository.save(VehicleFeatureAssignment.builder()
                .vehicle(vehicle)
                .feature(feature)
                .notes(request.getNotes())
                .build());
    }

    // ── Images ──

    @Transactional(readOnly = true)
    public List<VehicleImage> images(Long vehicleId) {
        return imageRepository.findByVehicleIdOrderBySortOrderAsc(vehicleId);
    }

    /** A new primary image demotes the previous one. */
    @Transactional
    public VehicleImage addImage(Long staffId, Long vehicleId, VehicleImageRequest request) {
        userAccessService.requireStaff(staffId);
        if (!vehicleRepository.existsById(vehicleId)) {
            throw new ResourceNotFoundException("Vehicle", vehicleId);
        }
        if (request.isPrimaryImage()) {
            imageRepository.clearPrimary(vehicleId);
        }
        VehicleImage image = VehicleImage.builder()
                .vehicle(find(vehicleId))
                .imagePath(request.getImagePath())
                .caption(request.getCaption())
                .primaryImage(request.isPrimaryImage())
                .sortOrder(request.getSortOrder())
                .uploadedAt(LocalDateTime.now(clock))
                .build();
        if (request.getImageType() != null) {
            image.setImageType(request.getImageType());
        }
        return imageRepository.save(image);
    }

    // ── Maintenance ──

    @Transactional(readOnly = true)
    public List<VehicleMaintenanceRecord> maintenanceHistory(Long staffId, Long vehicleId) {
        userAccessService.requireStaff(staffId);
        return maintenanceRepository.findByVehicleIdOrderByScheduledDateDesc(vehicleId);
    }

    @Transactional
    public VehicleMaintenanceRecord scheduleMaintenance(Long staffId, Long vehicleId, MaintenanceRequest request) {
        userAccessService.requireStaff(staffId);
        Vehicle vehicle = find(vehicleId);
        VehicleMaintenanceRecord record = maintenanceRepository.save(VehicleMaintenanceRecord.builder()
                .vehicle(vehicle)
                .maintenanceType(request.getMaintenanceType())
                .description(request.getDescription())
                .scheduledDate(request.getScheduledDate())
                .estimatedCost(request.getEstimatedCost())
                .serviceProvider(request.getServiceProvider())
                .createdAt(LocalDateTime.now(clock))
                .build());
        log.info("Maintenance '{}' scheduled for {} on {}", record.getMaintenanceType(),
                vehicle.getLicensePlate(), record.getScheduledDate());
        return record;
    }

    /** Work begins: the vehicle leaves the bookable pool. */
    @Transactional
    public VehicleMaintenanceRecord startMaintenance(Long staffId, Long recordId) {
        userAccessService.requireStaff(staffId);
        VehicleMaintenanceRecord record = findRecord(recordId);
        if (record.getStatus() != MaintenanceStatus.SCHEDULED) {
            throw new InvalidTransitionException("maintenance record", record.getStatus(), "start");
        }
        Vehicle vehicle = record.getVehicle();
        if (vehicle.getStatus() == VehicleStatus.RENTED) {
            throw new BusinessRuleException("Vehicle " + vehicle.getLicensePlate() + " is currently rented");
        }
        record.setStatus(MaintenanceStatus.IN_PROGRESS);
        vehicle.setStatus(VehicleStatus.MAINTENANCE);
        vehicleRepository.save(vehicle);
        return maintenanceRepository.save(record);
    }

    @Transactional
    public VehicleMaintenanceRecord completeMaintenance(Long staffId, Long recordId, MaintenanceCompletionRequest request) {
        userAccessService.requireStaff(staffId);
        VehicleMaintenanceRecord record = findRecord(recordId);
        if (record.getStatus() == MaintenanceStatus.COMPLETED || record.getStatus() == MaintenanceStatus.CANCELLED) {
            throw new InvalidTransitionException("maintenance record", record.getStatus(), "complete");
        }
        Vehicle vehicle = record.getVehicle();
        int mileage = request.getMileageAtService() != null ? request.getMileageAtService() : vehicle.getCurrentMileage();

        record.setStatus(MaintenanceStatus.COMPLETED);
        record.setCompletedDate(LocalDate.now(clock));
        record.setMileageAtService(mileage);
        record.setActualCost(request.getActualCost());

        vehicle.setLastServiceMileage(mileage);
        if (mileage > vehicle.getCurrentMileage()) {
            vehicle.setCurrentMileage(mileage);
        }
        if (vehicle.getStatus() == VehicleStatus.MAINTENANCE) {
            vehicle.setStatus(VehicleStatus.AVAILABLE);
        }
        vehicleRepository.save(vehicle);
        log.info("Maintenance #{} on {} completed at {} km", recordId, vehicle.getLicensePlate(), mileage);
        return maintenanceRepository.save(record);
    }

    // ── Safety equipment ──

    @Transactional(readOnly = true)
    public List<VehicleSafetyEquipment> safetyEquipment(Long staffId, Long vehicleId) {
        userAccessService.requireStaff(staffId);
        return safetyEquipmentRepository.findByVehicleId(vehicleId);
    }

    /** One row per equipment type; recording the same type again updates it. */
    @Transactional
    public VehicleSafetyEquipment recordSafetyEquipment(Long staffId, Long vehicleId, SafetyEquipmentRequest request) {
        userAccessService.requireStaff(staffId);
        Vehicle vehicle = find(vehicleId);
        VehicleSafetyEquipment equipment = safetyEquipmentRepository
                .findByVehicleIdAndEquipmentType(vehicleId, request.getEquipmentType())
                .orElseGet(() -> VehicleSafetyEquipment.builder()
                        .vehicle(vehicle)
                        .equipmentType(request.getEquipmentType())
                        .build());
        if (request.getStatus() != null) {
            equipment.setStatus(request.getStatus());
        }
        equipment.setExpiryDate(request.getExpiryDate());
        equipment.setLastInspectionDate(request.getLastInspectionDate());
        equipment.setNotes(request.getNotes());
        if (equipment.isExpired(LocalDate.now(clock))) {
            equipment.setStatus(SafetyEquipmentStatus.EXPIRED);
        }
        return safetyEquipmentRepository.save(equipment);
    }

    private boolean isAvailable(Vehicle vehicle, LocalDateTime pickup, LocalDateTime dropOff) {
        if (!dropOff.isAfter(pickup)) {
            throw new BusinessRuleException("Return date must be after pickup date");
        }
        return vehicle.isAvailableForBooking()
                && bookingRepository.countOverlapping(vehicle.getId(), pickup, dropOff, BookingStatus.BLOCKING) == 0;
    }

    private void apply(Vehicle vehicle, VehicleRequest request) {
        VehicleModel model = modelRepository.findById(request.getModelId())
                .orElseThrow(() -> new ResourceNotFoundException("Model", request.getModelId()));
        vehicle.setModel(model);
        vehicle.setYear(request.getYear());
        vehicle.setColor(request.getColor());
        vehicle.setLicensePlate(request.getLicensePlate());
        vehicle.setVinNumber(request.getVinNumber());
        if (request.getFuelType() != null) vehicle.setFuelType(request.getFuelType());
        if (request.getTransmission() != null) vehicle.setTransmission(request.getTransmission());
        if (request.getCondition() != null) vehicle.setCondition(request.getCondition());
        if (request.getSeatingCapacity() != null) vehicle.setSeatingCapacity(request.getSeatingCapacity());
        if (request.getDoors() != null) vehicle.setDoors(request.getDoors());
        if (request.getCurrentMileage() != null) vehicle.setCurrentMileage(request.getCurrentMileage());
        if (request.getSecurityDeposit() != null) vehicle.setSecurityDeposit(request.getSecurityDeposit());
        vehicle.setFuelTankCapacity(request.getFuelTankCapacity());
        vehicle.setDailyRate(request.getDailyRate());
        vehicle.setWeeklyRate(request.getWeeklyRate());
        vehicle.setMonthlyRate(request.getMonthlyRate());
        vehicle.setCurrentLocation(request.getCurrentLocation());
        vehicle.setFeatured(request.isFeatured());
    }

    private Vehicle find(Long vehicleId) {
        return vehicleRepository.findById(vehicleId)
                .orElseThrow(() -> new ResourceNotFoundException("Vehicle", vehicleId));
    }

    private VehicleMaintenanceRecord findRecord(Long recordId) {
        return maintenanceRepository.findById(recordId)
                .orElseThrow(() -> new ResourceNotFoundException("Maintenance record", recordId));
    }
}
