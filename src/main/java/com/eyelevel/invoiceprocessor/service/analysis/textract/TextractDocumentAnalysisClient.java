package com.eyelevel.invoiceprocessor.service.analysis.textract;

import com.eyelevel.invoiceprocessor.exception.AnalysisProviderException;
import com.eyelevel.invoiceprocessor.exception.TransientProviderException;
import com.eyelevel.invoiceprocessor.service.analysis.AnalysisJobState;
import com.eyelevel.invoiceprocessor.service.analysis.AnalysisJobStatus;
import com.eyelevel.invoiceprocessor.service.analysis.DocumentAnalysisClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.textract.TextractClient;
import software.amazon.awssdk.services.textract.model.DocumentLocation;
import software.amazon.awssdk.services.textract.model.ExpenseDocument;
import software.amazon.awssdk.services.textract.model.GetExpenseAnalysisRequest;
import software.amazon.awssdk.services.textract.model.GetExpenseAnalysisResponse;
import software.amazon.awssdk.services.textract.model.S3Object;
import software.amazon.awssdk.services.textract.model.StartExpenseAnalysisRequest;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link DocumentAnalysisClient} backed by Textract expense analysis
 * ({@code StartExpenseAnalysis} / {@code GetExpenseAnalysis}).
 */
@Slf4j
@Service
public class TextractDocumentAnalysisClient implements DocumentAnalysisClient {

    private final TextractClient textractClient;
    private final ExpenseAnalysisParser expenseAnalysisParser;
    private final String bucketName;

    public TextractDocumentAnalysisClient(final TextractClient textractClient,
                                          final ExpenseAnalysisParser expenseAnalysisParser,
                                          @Value("${aws.s3.bucket}") final String bucketName) {
        this.textractClient = textractClient;
        this.expenseAnalysisParser = expenseAnalysisParser;
        this.bucketName = bucketName;
    }

    /**
     * Starts an expense analysis. Throttling and network errors are retried in-process before
     * they reach the caller.
     */
    @Override
    @Retryable(retryFor = TransientProviderException.class,
            maxAttemptsExpression = "#{${app.processing.analysis.retry.attempts} + 1}",
            backoff = @Backoff(delayExpression = "#{${app.processing.analysis.retry.delay-ms}}", multiplier = 2),
            listeners = {"analysisRetryListener"})
    public String startJob(final String storageKey) {
        log.info("Starting Textract expense analysis for s3://{}/{}", bucketName, storageKey);
        final StartExpenseAnalysisRequest request = StartExpenseAnalysisRequest.builder()
                .documentLocation(DocumentLocation.builder()
                                                  .s3Object(S3Object.builder()
                                                                    .bucket(bucketName)
                                                                    .name(storageKey)
                                                                    .build())
                                                  .build())
                .build();
        try {
            final String jobId = textractClient.startExpenseAnalysis(request).jobId();
            log.info("Textract job {} started for {}", jobId, storageKey);
            return jobId;
        } catch (SdkException e) {
            throw translate("StartExpenseAnalysis", e);
        }
    }

    @Override
    public AnalysisJobStatus getJobStatus(final String jobHandle) {
        try {
            GetExpenseAnalysisResponse response = textractClient.getExpenseAnalysis(
                    GetExpenseAnalysisRequest.builder().jobId(jobHandle).build());
            final String providerStatus = response.jobStatusAsString();
            final AnalysisJobState state = AnalysisJobState.fromProviderStatus(providerStatus);
            log.debug("Textract job {} reported status {} ({})", jobHandle, providerStatus, state);

            switch (state) {
                case RUNNING:
                    return AnalysisJobStatus.running(providerStatus);
                case FAILED:
                    return AnalysisJobStatus.failed(providerStatus, response.statusMessage());
                case UNKNOWN:
                    return AnalysisJobStatus.unknown(providerStatus);
                default:
                    break;
            }

            final List<ExpenseDocument> documents = new ArrayList<>(response.expenseDocuments());
            String nextToken = response.nextToken();
            while (nextToken != null) {
                response = textractClient.getExpenseAnalysis(
                        GetExpenseAnalysisRequest.builder().jobId(jobHandle).nextToken(nextToken).build());
                documents.addAll(response.expenseDocuments());
                nextToken = response.nextToken();
            }
            return AnalysisJobStatus.succeeded(providerStatus, expenseAnalysisParser.parse(documents),
                                               expenseAnalysisParser.snapshot(documents));
        } catch (SdkException e) {
            throw translate("GetExpenseAnalysis", e);
        }
    }

    private AnalysisProviderException translate(final String operation, final SdkException e) {
        if (e instanceof AwsServiceException serviceException) {
            final String errorCode = serviceException.awsErrorDetails() != null
                    ? serviceException.awsErrorDetails().errorCode()
                    : null;
            final String message = operation + " failed: " + serviceException.getMessage();
            if (serviceException.isThrottlingException() || serviceException.statusCode() >= 500) {
                return new TransientProviderException(message, errorCode, e);
            }
            return new AnalysisProviderException(message, errorCode, e);
        }
        // client-side: connection, timeout or credentials resolution
        return new TransientProviderException(operation + " failed: " + e.getMessage(), null, e);
    }
}
