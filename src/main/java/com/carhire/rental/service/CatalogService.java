package com.carhire.rental.service;

import com.carhire.rental.config.CacheConfig;
import com.carhire.rental.dto.AddOnCatalogRequest;
import com.carhire.rental.dto.CatalogEntryRequest;
import com.carhire.rental.dto.PaymentMethodRequest;
import com.carhire.rental.dto.VehicleModelRequest;
import com.carhire.rental.entity.*;
import com.carhire.rental.exception.DuplicateResourceException;
import com.carhire.rental.exception.ResourceNotFoundException;
import com.carhire.rental.repository.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.function.Supplier;

/**
 * Reference data behind the fleet and the booking form: categories,
 * brands, models and features in {@code vehicleCatalog}; add-ons and
 * payment methods in {@code bookingExtras}.
 *
 * Reads go through the Caffeine caches. Every write evicts the whole cache
 * it belongs to, so the next read reloads from the DB.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CatalogService {

    private final VehicleCategoryRepository categoryRepository;
    private final VehicleBrandRepository brandRepository;
    private final VehicleModelRepository modelRepository;
    private final VehicleFeatureRepository featureRepository;
    private final BookingAddOnRepository addOnRepository;
    private final PaymentMethodRepository paymentMethodRepository;
    private final UserAccessService userAccessService;

    // ────────────────────────────────────────────────────────────────────────
    // READ methods
    // ────────────────────────────────────────────────────────────────────────

    @Cacheable(value = CacheConfig.CACHE_VEHICLE_CATALOG, key = "'categories'")
    public List<VehicleCategory> categories() {
        log.debug("[CACHE MISS] categories, loading from DB");
        return categoryRepository.findByActiveTrueOrderByName();
    }

    @Cacheable(value = CacheConfig.CACHE_VEHICLE_CATALOG, key = "'brands'")
    public List<VehicleBrand> brands() {
        log.debug("[CACHE MISS] brands, loading from DB");
        return brandRepository.findByActiveTrueOrderByName();
    }

    @Cacheable(value = CacheConfig.CACHE_VEHICLE_CATALOG, key = "'models'")
    public List<VehicleModel> models() {
        log.debug("[CACHE MISS] models, loading from DB");
        return modelRepository.findAll();
    }

    @Cacheable(value = CacheConfig.CACHE_VEHICLE_CATALOG, key = "'features'")
    public List<VehicleFeature> features() {
        log.debug("[CACHE MISS] features, loading from DB");
        return featureRepository.findByActiveTrueOrderByName();
    }

    @Cacheable(value = CacheConfig.CACHE_BOOKING_EXTRAS, key = "'addOns'")
    public List<BookingAddOn> addOns() {
        log.debug("[CACHE MISS] add-ons, loading from DB");
        return addOnRepository.findByActiveTrueOrderByName();
    }

    @Cacheable(value = CacheConfig.CACHE_BOOKING_EXTRAS, key = "'paymentMethods'")
    public List<PaymentMethod> paymentMethods() {
        log.debug("[CACHE MISS] payment methods, loading from DB");
        return paymentMethodRepository.findByActiveTrueOrderByName();
    }

    // ────────────────────────────────────────────────────────────────────────
    // WRITE methods (staff only, evict on success)
    // ────────────────────────────────────────────────────────────────────────

    @Transactional
    @CacheEvict(value = CacheConfig.CACHE_VEHICLE_CATALOG, allEntries = true)
    public VehicleCategory createCategory(Long staffId, CatalogEntryRequest request) {
        userAccessService.requireStaff(staffId);
        return unique(() -> categoryRepository.saveAndFlush(VehicleCategory.builder()
                .name(request.getName())
                .description(request.getDescription())
                .build()), "Category", request.getName());
    }

    @Transactional
    @CacheEvict(value = CacheConfig.CACHE_VEHICLE_CATALOG, allEntries = true)
    public VehicleBrand createBrand(Long staffId, CatalogEntryRequest request) {
        userAccessService.requireStaff(staffId);
        return unique(() -> brandRepository.saveAndFlush(VehicleBrand.builder()
                .name(request.getName())
                .countryOfOrigin(request.getDescription())
                .build()), "Brand", request.getName());
    }

    @Transactional
    @CacheEvict(value = CacheConfig.CACHE_VEHICLE_CATALOG, allEntries = true)
    public VehicleModel createModel(Long staffId, VehicleModelRequest request) {
        userAccessService.requireStaff(staffId);
        VehicleBrand brand = brandRepository.findById(request.getBrandId())
                .orElseThrow(() -> new ResourceNotFoundException("Brand", request.getBrandId()));
        VehicleCategory category = categoryRepository.findById(request.getCategoryId())
                .orElseThrow(() -> new ResourceNotFoundException("Category", request.getCategoryId()));
        return unique(() -> modelRepository.saveAndFlush(VehicleModel.builder()
                .brand(brand)
                .category(category)
                .name(request.getName())
                .build()), "Model", brand.getName() + " " + request.getName());
    }

    @Transactional
    @CacheEvict(value = CacheConfig.CACHE_VEHICLE_CATALOG, allEntries = true)
    public VehicleFeature createFeature(Long staffId, CatalogEntryRequest request) {
        userAccessService.requireStaff(staffId);
        return unique(() -> featureRepository.saveAndFlush(VehicleFeature.builder()
                .name(request.getName())
                .description(request.getDescription())
                .build()), "Feature", request.getName());
    }

    @Transactional
    @CacheEvict(value = CacheConfig.CACHE_BOOKING_EXTRAS, allEntries = true)
    public BookingAddOn createAddOn(Long staffId, AddOnCatalogRequest request) {
        userAccessService.requireStaff(staffId);
        BookingAddOn addOn = BookingAddOn.builder()
                .name(request.getName())
                .addOnType(request.getAddOnType())
                .description(request.getDescription())
                .price(request.getPrice())
                .build();
        if (request.getPricingType() != null) {
            addOn.setPricingType(request.getPricingType());
        }
        return addOnRepository.save(addOn);
    }

    @Transactional
    @CacheEvict(value = CacheConfig.CACHE_BOOKING_EXTRAS, allEntries = true)
    public BookingAddOn setAddOnActive(Long staffId, Long addOnId, boolean active) {
        userAccessService.requireStaff(staffId);
        BookingAddOn addOn = addOnRepository.findById(addOnId)
                .orElseThrow(() -> new ResourceNotFoundException("Add-on", addOnId));
        addOn.setActive(active);
        return addOnRepository.save(addOn);
    }

    @Transactional
    @CacheEvict(value = CacheConfig.CACHE_BOOKING_EXTRAS, allEntries = true)
    public PaymentMethod createPaymentMethod(Long staffId, PaymentMethodRequest request) {
        userAccessService.requireStaff(staffId);
        return unique(() -> paymentMethodRepository.saveAndFlush(PaymentMethod.builder()
                .name(request.getName())
                .methodType(request.getMethodType())
                .processingFeePercentage(orZero(request.getProcessingFeePercentage()))
                .processingFeeFixed(orZero(request.getProcessingFeeFixed()))
                .requiresVerification(request.isRequiresVerification())
                .build()), "Payment method", request.getName());
    }

    /**
     * Evicts both catalogue caches. Used after admin bulk updates that
     * bypass the write methods above.
     */
    @CacheEvict(value = {CacheConfig.CACHE_VEHICLE_CATALOG, CacheConfig.CACHE_BOOKING_EXTRAS}, allEntries = true)
    public void evictAll() {
        log.info("[CACHE EVICT] Catalogue caches cleared");
    }

    private <T> T unique(Supplier<T> save, String kind, String name) {
        try {
            return save.get();
        } catch (DataIntegrityViolationException e) {
            throw new DuplicateResourceException(kind + " already exists: " + name);
        }
    }

    private BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
