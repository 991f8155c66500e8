package com.kpi.drivertree.config;

import jakarta.persistence.EntityManagerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.orm.jpa.JpaTransactionManager;
import org.springframework.transaction.PlatformTransactionManager;

/**
 * JPA Configuration
 * Declares the transaction manager used by tree generation.
 */
@Configuration
public class JpaConfig {

    /**
     * Primary transaction manager for JPA.
     * A generation batch that outlives the configured timeout is rolled back as a whole.
     */
    @Primary
    @Bean(name = "transactionManager")
    public PlatformTransactionManager transactionManager(EntityManagerFactory entityManagerFactory,
                                                         DriverTreeProperties properties) {
        JpaTransactionManager transactionManager = new JpaTransactionManager(entityManagerFactory);
        if (properties.getGenerationTimeoutSeconds() > 0) {
            transactionManager.setDefaultTimeout(properties.getGenerationTimeoutSeconds());
        }
        return transactionManager;
    }
}
