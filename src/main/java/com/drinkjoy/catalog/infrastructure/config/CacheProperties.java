package com.drinkjoy.catalog.infrastructure.config;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Sizing of the in-process cache tiers
 */
@Component
@Validated
@ConfigurationProperties(prefix = "drinkjoy.cache")
public class CacheProperties {

    private Duration defaultTtl = Duration.ofSeconds(300);
    @Min(1)
    private int menuCapacity = 50;
    private Duration menuTtl = Duration.ofMinutes(5);

    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    public void setDefaultTtl(Duration defaultTtl) {
        this.defaultTtl = defaultTtl;
    }

    public int getMenuCapacity() {
        return menuCapacity;
    }

    public void setMenuCapacity(int menuCapacity) {
        this.menuCapacity = menuCapacity;
    }

    public Duration getMenuTtl() {
        return menuTtl;
    }

    public void setMenuTtl(Duration menuTtl) {
        this.menuTtl = menuTtl;
    }
}
