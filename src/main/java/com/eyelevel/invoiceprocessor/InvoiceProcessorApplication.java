package com.eyelevel.invoiceprocessor;

import com.eyelevel.invoiceprocessor.config.InvoiceProcessingConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.env.Environment;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Entry point for the Invoice Processor service.
 * <p>
 * Besides bootstrapping the context, this enables the two periodic passes that drive the
 * analysis pipeline (status polling and the stuck-job janitor), asynchronous post-commit job
 * starts, and in-process retries of throttled calls to the analysis provider.
 */
@Slf4j
@EnableAsync
@EnableScheduling
@SpringBootApplication
@EnableConfigurationProperties(value = InvoiceProcessingConfig.class)
@EnableRetry
public class InvoiceProcessorApplication {

    public static void main(final String[] args) {
        log.info("Starting InvoiceProcessorApplication...");

        final ConfigurableApplicationContext context = SpringApplication.run(InvoiceProcessorApplication.class, args);
        final Environment env = context.getEnvironment();

        log.info("------------------------------------------------------------------");
        log.info("Application '{}' is now running!", env.getProperty("spring.application.name", "InvoiceProcessor"));
        log.info("  - Local:      http://localhost:{}", env.getProperty("server.port", "8080"));
        log.info("  - Profile(s): {}", String.join(", ", env.getActiveProfiles().length > 0
                ? env.getActiveProfiles()
                : new String[]{"default"}));
        log.info("------------------------------------------------------------------");
    }
}
