package com.familyledger.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Account credential settings. Define under 'familyledger.security' in application.yml.
 */
@Configuration
@ConfigurationProperties(prefix = "familyledger.security")
public class AccountSecurityConfig {

    private int minPasswordLength = 6;

    /** BCrypt log rounds. */
    private int bcryptStrength = 10;

    public int getMinPasswordLength() {
        return minPasswordLength;
    }

    public void setMinPasswordLength(int minPasswordLength) {
        this.minPasswordLength = minPasswordLength;
    }

    public int getBcryptStrength() {
        return bcryptStrength;
    }

    public void setBcryptStrength(int bcryptStrength) {
        this.bcryptStrength = bcryptStrength;
    }
}
