package com.eyelevel.invoiceprocessor.dto.common;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;

/**
 * A standardized, generic wrapper for all API responses.
 * It provides a consistent structure for both successful and failed responses.
 **/
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {
    /**
     * A message to display to the user.
     */
    private final String displayMessage;

    /**
     * The response data.
     */
    private final T response;

    /**
     * A flag indicating whether to show the display message.
     */
    private final Boolean showMessage;

    /**
     * The HTTP status code of the response.
     */
    private final Integer statusCode;

    /**
     * Stable machine-readable error code; only present on failures.
     */
    private final String errorCode;

    /**
     * Additional technical detail about a failure.
     */
    private final String errorDetail;

    public static <T> ApiResponse<T> success(T response, String displayMessage, int statusCode) {
        return ApiResponse.<T>builder()
                          .response(response)
                          .displayMessage(displayMessage)
                          .showMessage(true)
                          .statusCode(statusCode)
                          .build();
    }

    public static <T> ApiResponse<T> error(String displayMessage, String errorCode, String errorDetail,
                                           int statusCode) {
        return ApiResponse.<T>builder()
                          .displayMessage(displayMessage)
                          .showMessage(true)
                          .errorCode(errorCode)
                          .errorDetail(errorDetail)
                          .statusCode(statusCode)
                          .build();
    }
}
