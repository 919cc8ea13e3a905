package com.flagship.account_ledger.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

/**
 * Credential hashing for the identity directory.
 */
@Configuration
public class CredentialConfig {

    @Bean
    public PasswordEncoder passwordEncoder(@Value("${identity.bcrypt.strength:10}") int strength) {
        return new BCryptPasswordEncoder(strength);
    }
}
