package com.eyelevel.invoiceprocessor.exception.handler;

import com.eyelevel.invoiceprocessor.dto.common.ApiResponse;
import com.eyelevel.invoiceprocessor.exception.ErrorCode;
import com.eyelevel.invoiceprocessor.exception.InvalidStateException;
import com.eyelevel.invoiceprocessor.exception.InvoiceProcessingException;
import com.eyelevel.invoiceprocessor.exception.NotFoundException;
import com.eyelevel.invoiceprocessor.exception.PipelineStageException;
import com.eyelevel.invoiceprocessor.exception.RetryExhaustedException;
import com.eyelevel.invoiceprocessor.exception.StorageException;
import com.eyelevel.invoiceprocessor.exception.TransientProviderException;
import com.eyelevel.invoiceprocessor.exception.ValidationException;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Converts exceptions thrown from controllers into the standard {@link ApiResponse} envelope with
 * the matching HTTP status. Pipeline errors keep their {@link ErrorCode} in the payload.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    // --- 4xx Client Error Handlers ---

    /**
     * Rejected input, illegal transitions and exhausted retry budgets. (400 Bad Request)
     */
    @ExceptionHandler({ValidationException.class, InvalidStateException.class, RetryExhaustedException.class})
    public ResponseEntity<ApiResponse<Object>> handleBadRequest(InvoiceProcessingException ex) {
        log.warn("Rejected request [{}]: {}", ex.getErrorCode(), ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage(), ex.getErrorCode().name(), null);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ApiResponse<Object>> handleNotFound(NotFoundException ex) {
        log.warn("Resource Not Found Exception: {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, ex.getMessage(), ex.getErrorCode().name(), null);
    }

    /**
     * Another writer changed the document between our read and our write. (409 Conflict)
     */
    @ExceptionHandler(OptimisticLockingFailureException.class)
    public ResponseEntity<ApiResponse<Object>> handleConcurrentUpdate(OptimisticLockingFailureException ex) {
        log.warn("Concurrent modification detected: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, "The document was modified concurrently. Please retry.",
                       ErrorCode.INVALID_STATE.name(), null);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Object>> handleHttpMessageNotReadable(HttpMessageNotReadableException ex) {
        log.warn("Handling HttpMessageNotReadableException: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Malformed request body.", null,
                       "The request body is missing or could not be parsed.");
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, MissingServletRequestPartException.class})
    public ResponseEntity<ApiResponse<Object>> handleMissingParameter(Exception ex) {
        log.warn("Handling missing request parameter: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Required parameter is missing.", null, ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Object>> handleValidationExceptions(MethodArgumentNotValidException ex) {
        String errors = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> String.format("'%s': %s", error.getField(), error.getDefaultMessage()))
                .collect(Collectors.joining(", "));
        String errorMessage = "Validation failed: " + errors;
        log.warn("Handling validation exception: {}", errorMessage);
        return respond(HttpStatus.BAD_REQUEST, "Invalid input provided.", null, errorMessage);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiResponse<Object>> handleConstraintViolation(ConstraintViolationException ex) {
        String errors = ex.getConstraintViolations().stream()
                .map(violation -> {
                    String path = violation.getPropertyPath().toString();
                    return String.format("'%s': %s", path.substring(path.lastIndexOf('.') + 1),
                                         violation.getMessage());
                })
                .collect(Collectors.joining(", "));
        String errorMessage = "Validation failed: " + errors;
        log.warn("Handling constraint violation exception: {}", errorMessage);
        return respond(HttpStatus.BAD_REQUEST, "Invalid input provided.", null, errorMessage);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiResponse<Object>> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        String errorMessage = String.format("Invalid value '%s' for parameter '%s'. Expected type '%s'.",
                                            ex.getValue(), ex.getName(), ex.getRequiredType() != null
                                                    ? ex.getRequiredType().getSimpleName()
                                                    : "unknown");
        log.warn("Handling type mismatch exception: {}", errorMessage);
        return respond(HttpStatus.BAD_REQUEST, "Invalid parameter type provided.", null, errorMessage);
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ApiResponse<Object>> handleMaxUploadSize(MaxUploadSizeExceededException ex) {
        log.warn("Upload exceeds multipart limit: {}", ex.getMessage());
        return respond(HttpStatus.PAYLOAD_TOO_LARGE, "The uploaded file is too large.",
                       ErrorCode.FILE_TOO_LARGE.name(), null);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ApiResponse<Object>> handleHttpRequestMethodNotSupported(
            HttpRequestMethodNotSupportedException ex) {
        String supportedMethods = String.join(", ", Objects.requireNonNull(ex.getSupportedMethods()));
        String errorMessage = String.format("Request method '%s' not supported. Supported methods are: %s",
                                            ex.getMethod(), supportedMethods);
        log.warn("Handling HttpRequestMethodNotSupportedException: {}", errorMessage);
        return respond(HttpStatus.METHOD_NOT_ALLOWED, "Method not allowed.", null, errorMessage);
    }

    // --- 5xx Server Error Handlers ---

    /**
     * A direct submission failed at a named stage. (502 Bad Gateway)
     */
    @ExceptionHandler(PipelineStageException.class)
    public ResponseEntity<ApiResponse<Object>> handlePipelineStage(PipelineStageException ex) {
        log.error("Submission failed at stage {} (document: {}, provider code: {}): {}", ex.getStage(),
                  ex.getDocumentId(), ex.getProviderErrorCode(), ex.getMessage());
        String detail = "stage=" + ex.getStage().name()
                + (ex.getProviderErrorCode() != null ? ", providerErrorCode=" + ex.getProviderErrorCode() : "");
        return respond(HttpStatus.BAD_GATEWAY, ex.getMessage(), ex.getErrorCode().name(), detail);
    }

    @ExceptionHandler(StorageException.class)
    public ResponseEntity<ApiResponse<Object>> handleStorage(StorageException ex) {
        log.error("Storage Exception: {}", ex.getMessage(), ex);
        return respond(HttpStatus.BAD_GATEWAY, ex.getMessage(), ex.getErrorCode().name(), null);
    }

    @ExceptionHandler(TransientProviderException.class)
    public ResponseEntity<ApiResponse<Object>> handleProviderUnavailable(TransientProviderException ex) {
        log.error("Analysis provider unavailable (code: {}): {}", ex.getProviderErrorCode(), ex.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "The analysis provider is temporarily unavailable.",
                       ErrorCode.PROVIDER_UNAVAILABLE.name(), ex.getProviderErrorCode());
    }

    /**
     * A final catch-all handler for any other unexpected exceptions. (500 Internal Server Error)
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Object>> handleGenericException(Exception ex) {
        log.error("An unexpected internal server error occurred", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR,
                       "An unexpected internal error occurred. Please contact support.", null,
                       ex.getClass().getSimpleName());
    }

    private ResponseEntity<ApiResponse<Object>> respond(HttpStatus status, String message, String errorCode,
                                                        String detail) {
        return new ResponseEntity<>(ApiResponse.error(message, errorCode, detail, status.value()), status);
    }
}
