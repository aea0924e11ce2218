package com.carhire.rental.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.*;

/**
 * Per-user communication, booking and display preferences. Created
 * together with the account.
 */
@Entity
@Table(name = "user_preferences")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UserPreference {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @JsonIgnore
    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false, unique = true)
    private User user;

    @Builder.Default
    private boolean emailNotifications = true;

    @Builder.Default
    private boolean smsNotifications = false;

    @Builder.Default
    private boolean pushNotifications = true;

    @Builder.Default
    private boolean marketingEmails = false;

    @Builder.Default
    private boolean autoInsurance = true;

    @Builder.Default
    private String preferredFuelPolicy = "full_to_full";

    @Column(length = 3)
    @Builder.Default
    private String currency = "ZAR";

    @Builder.Default
    private String dateFormat = "DD/MM/YYYY";

    @Builder.Default
    private String timeFormat = "24h";

    @Builder.Default
    private String language = "en";
}
