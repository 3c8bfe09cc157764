package com.eyelevel.invoiceprocessor.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.util.StringUtils;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.retry.RetryMode;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3AsyncClient;
import software.amazon.awssdk.services.s3.crt.S3CrtRetryConfiguration;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.textract.TextractClient;
import software.amazon.awssdk.transfer.s3.S3TransferManager;

import java.time.Duration;

/**
 * Configures the AWS SDK clients for S3 (object storage) and Textract (document analysis).
 * The credential strategy is selected from the active Spring profile.
 */
@Slf4j
@Configuration
public class AwsConfig {

    @Value("${aws.region}")
    private String awsRegion;

    @Value("${aws.access-key:}")
    private String accessKey;

    @Value("${aws.secret-key:}")
    private String secretKey;

    @Value("${aws.s3.retry-count}")
    private int s3RetryCount;

    @Value("${aws.textract.api-call-timeout-seconds:30}")
    private long textractCallTimeoutSeconds;

    /**
     * Static keys under the {@code local} profile, the default provider chain (IAM role) otherwise.
     */
    @Bean
    public AwsCredentialsProvider awsCredentialsProvider(Environment environment) {
        if (environment.acceptsProfiles(Profiles.of("local"))) {
            log.info("Local profile active. Using StaticCredentialsProvider.");
            if (!StringUtils.hasText(accessKey) || !StringUtils.hasText(secretKey)) {
                throw new IllegalArgumentException(
                        "aws.access-key and aws.secret-key must be set for the 'local' profile.");
            }
            return StaticCredentialsProvider.create(AwsBasicCredentials.create(accessKey, secretKey));
        }
        log.info("Non-local profile active. Using DefaultCredentialsProvider (for IAM role).");
        return DefaultCredentialsProvider.create();
    }

    /**
     * Creates the CRT-based async S3 client backing the transfer manager.
     * The CRT client has its own retry configuration.
     */
    @Bean
    public S3AsyncClient s3AsyncClient(AwsCredentialsProvider credentialsProvider) {
        log.info("Configuring AWS S3AsyncClient (CRT) for region: {}", awsRegion);
        S3CrtRetryConfiguration crtRetryConfiguration = S3CrtRetryConfiguration.builder()
                                                                               .numRetries(s3RetryCount)
                                                                               .build();

        return S3AsyncClient.crtBuilder().credentialsProvider(credentialsProvider)
                            .region(Region.of(awsRegion))
                            .retryConfiguration(crtRetryConfiguration).build();
    }

    @Bean
    public S3TransferManager s3TransferManager(S3AsyncClient s3AsyncClient) {
        return S3TransferManager.builder().s3Client(s3AsyncClient).build();
    }

    @Bean
    public S3Presigner s3Presigner(AwsCredentialsProvider credentialsProvider) {
        log.info("Configuring AWS S3Presigner for region: {}", awsRegion);
        return S3Presigner.builder().region(Region.of(awsRegion)).credentialsProvider(credentialsProvider).build();
    }

    /**
     * Creates the Textract client. The SDK's own retries use the standard policy; throttling that
     * survives them is retried again around the job-start call.
     */
    @Bean
    public TextractClient textractClient(AwsCredentialsProvider credentialsProvider) {
        log.info("Configuring AWS TextractClient for region: {}", awsRegion);
        ClientOverrideConfiguration overrideConfiguration = ClientOverrideConfiguration.builder()
                .retryPolicy(RetryPolicy.forRetryMode(RetryMode.STANDARD))
                .apiCallTimeout(Duration.ofSeconds(textractCallTimeoutSeconds))
                .build();
        return TextractClient.builder()
                             .region(Region.of(awsRegion))
                             .credentialsProvider(credentialsProvider)
                             .overrideConfiguration(overrideConfiguration)
                             .build();
    }
}
