package com.perpradar.registry;

import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Wallet registry limits. Documented in application.yml under perpradar.registry.
 */
@ConfigurationProperties(prefix = "perpradar.registry")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class RegistryProperties {

    /** Cap on active wallet links per subscriber; the oldest is evicted on overflow. */
    @Min(1)
    private int maxWalletsPerSubscriber = 5;

    /** Linked automatically for a brand-new subscriber with no wallets. Blank disables it. */
    private String defaultWalletAddress = "";
}
