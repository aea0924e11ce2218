package com.carhire.rental.config;

import com.carhire.rental.entity.*;
import com.carhire.rental.repository.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Data loader that runs on application startup.
 * Inserts a small sample fleet, the booking extras and two accounts so the
 * API can be exercised straight away.
 *
 * Disable with app.seed-data.enabled=false.
 */
@Component
@ConditionalOnProperty(name = "app.seed-data.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class DataLoader implements CommandLineRunner {

    private final UserRepository userRepository;
    private final VehicleCategoryRepository categoryRepository;
    private final VehicleBrandRepository brandRepository;
    private final VehicleModelRepository modelRepository;
    private final VehicleRepository vehicleRepository;
    private final BookingAddOnRepository addOnRepository;
    private final PaymentMethodRepository paymentMethodRepository;
    private final LoyaltyProgramRepository loyaltyProgramRepository;
    private final PromotionRepository promotionRepository;
    private final PasswordEncoder passwordEncoder;
    private final Clock clock;

    @Override
    public void run(String... args) throws Exception {
        log.info("Starting data initialization...");

        // Check if data already exists to avoid duplicates
        if (vehicleRepository.count() > 0) {
            log.info("Data already exists, skipping initialization");
            return;
        }

        // Accounts: one back-office admin and one verified customer
        User admin = userRepository.save(User.builder()
                .username("admin")
                .email("admin@carhire.local")
                .passwordHash(passwordEncoder.encode("Admin#2024"))
                .firstName("Fleet")
                .lastName("Admin")
                .userType(UserType.ADMIN)
                .verified(true)
                .verificationLevel(VerificationLevel.VERIFIED)
                .build());
        User customer = userRepository.save(User.builder()
                .username("chikondi")
                .email("chikondi@example.com")
                .passwordHash(passwordEncoder.encode("Customer#2024"))
                .firstName("Chikondi")
                .lastName("Banda")
                .phoneNumber("+265-999-123456")
                .city("Lilongwe")
                .driversLicenseNumber("MW-DL-2019-00451")
                .licenseExpiryDate(LocalDate.now(clock).plusYears(3))
                .licenseClass("B")
                .verified(true)
                .verificationLevel(VerificationLevel.VERIFIED)
                .build());
        log.info("Users created: {} ({}), {} ({})",
                admin.getUsername(), admin.getUserType(), customer.getUsername(), customer.getUserType());

        // Catalogue
        VehicleCategory economy = categoryRepository.save(VehicleCategory.builder()
                .name("Economy").description("Small, fuel efficient city cars").build());
        VehicleCategory suv = categoryRepository.save(VehicleCategory.builder()
                .name("SUV").description("Sport utility vehicles for rough roads").build());

        VehicleBrand toyota = brandRepository.save(VehicleBrand.builder()
                .name("Toyota").countryOfOrigin("Japan").build());
        VehicleBrand nissan = brandRepository.save(VehicleBrand.builder()
                .name("Nissan").countryOfOrigin("Japan").build());

        VehicleModel vitz = modelRepository.save(VehicleModel.builder()
                .brand(toyota).category(economy).name("Vitz").build());
        VehicleModel xTrail = modelRepository.save(VehicleModel.builder()
                .brand(nissan).category(suv).name("X-Trail").build());
        VehicleModel fortuner = modelRepository.save(VehicleModel.builder()
                .brand(toyota).category(suv).name("Fortuner").build());

        // Fleet
        vehicleRepository.save(vehicle(vitz, 2021, "Silver", "LL 4521", "JTDBT923X01234567",
                FuelType.PETROL, TransmissionType.AUTOMATIC, "42.00", "45.00", "280.00", 18200));
        vehicleRepository.save(vehicle(xTrail, 2020, "White", "BT 8830", "JN1TANT31U0012345",
                FuelType.PETROL, TransmissionType.AUTOMATIC, "60.00", "85.00", "520.00", 40110));
        Vehicle featured = vehicle(fortuner, 2022, "Black", "LL 7712", "AHTFR22G700987654",
                FuelType.DIESEL, TransmissionType.MANUAL, "80.00", "110.00", "690.00", 9650);
        featured.setFeatured(true);
        vehicleRepository.save(featured);
        log.info("Fleet created: {} vehicles", vehicleRepository.count());

        // Booking extras
        addOnRepository.save(BookingAddOn.builder()
                .name("GPS Navigator").addOnType(AddOnType.GPS)
                .pricingType(AddOnPricingType.PER_DAY).price(new BigDecimal("5.00")).build());
        addOnRepository.save(BookingAddOn.builder()
                .name("Child Seat").addOnType(AddOnType.CHILD_SEAT)
                .pricingType(AddOnPricingType.PER_BOOKING).price(new BigDecimal("15.00")).build());
        addOnRepository.save(BookingAddOn.builder()
                .name("Roadside Assistance").addOnType(AddOnType.ROADSIDE_ASSISTANCE)
                .pricingType(AddOnPricingType.PERCENTAGE).price(new BigDecimal("5.00")).build());

        paymentMethodRepository.save(PaymentMethod.builder()
                .name("Visa / Mastercard").methodType(PaymentMethodType.CREDIT_CARD)
                .processingFeePercentage(new BigDecimal("2.50")).processingFeeFixed(new BigDecimal("0.30"))
                .build());
        paymentMethodRepository.save(PaymentMethod.builder()
                .name("Airtel Money").methodType(PaymentMethodType.MOBILE_PAYMENT)
                .processingFeePercentage(new BigDecimal("1.50")).build());
        paymentMethodRepository.save(PaymentMethod.builder()
                .name("Cash at counter").methodType(PaymentMethodType.CASH).build());

        // Loyalty tiers
        loyaltyProgramRepository.save(tier(LoyaltyTier.BRONZE, 0, "1.00", "0.00", "Earn 1 point per unit spent"));
        loyaltyProgramRepository.save(tier(LoyaltyTier.SILVER, 1000, "1.25", "5.00", "5% off and priority pickup"));
        loyaltyProgramRepository.save(tier(LoyaltyTier.GOLD, 5000, "1.50", "10.00", "10% off and free upgrades"));
        loyaltyProgramRepository.save(tier(LoyaltyTier.PLATINUM, 15000, "2.00", "15.00", "15% off and a dedicated agent"));

        LocalDateTime now = LocalDateTime.now(clock);
        promotionRepository.save(Promotion.builder()
                .name("Welcome offer")
                .code("WELCOME10")
                .description("10% off your first rental")
                .discountType(DiscountType.PERCENTAGE)
                .discountValue(new BigDecimal("10.00"))
                .maxDiscountAmount(new BigDecimal("50.00"))
                .startDate(now.minusDays(1))
                .endDate(now.plusMonths(6))
                .usageLimit(500)
                .build());

        log.info("Data initialization completed successfully!");
        log.info("Sample login: admin / Admin#2024, chikondi / Customer#2024");
    }

    private Vehicle vehicle(VehicleModel model, int year, String color, String plate, String vin,
                            FuelType fuelType, TransmissionType transmission,
                            String tank, String dailyRate, String weeklyRate, int mileage) {
        return Vehicle.builder()
                .model(model)
                .year(year)
                .color(color)
                .licensePlate(plate)
                .vinNumber(vin)
                .fuelType(fuelType)
                .transmission(transmission)
                .fuelTankCapacity(new BigDecimal(tank))
                .dailyRate(new BigDecimal(dailyRate))
                .weeklyRate(new BigDecimal(weeklyRate))
                .securityDeposit(new BigDecimal("200.00"))
                .currentMileage(mileage)
                .lastServiceMileage(mileage)
                .currentLocation("Lilongwe Airport")
                .build();
    }

    private LoyaltyProgram tier(LoyaltyTier tier, int minPoints, String rate, String discount, String benefits) {
        return LoyaltyProgram.builder()
                .tier(tier)
                .minPointsRequired(minPoints)
                .pointsPerUnit(new BigDecimal(rate))
                .discountPercentage(new BigDecimal(discount))
                .benefits(benefits)
                .build();
    }
}
