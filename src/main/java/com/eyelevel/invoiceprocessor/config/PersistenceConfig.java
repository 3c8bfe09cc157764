package com.eyelevel.invoiceprocessor.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * JPA repository scanning. Kept off the application class; web-layer test slices start without a datasource.
 */
@Configuration
@EnableJpaRepositories(basePackages = "com.eyelevel.invoiceprocessor.repository")
public class PersistenceConfig {
}
