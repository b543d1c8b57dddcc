package com.cgi.schemasense.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Envelope for every classification endpoint.
 *
 * @param <T> Type of data contained in the response
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {
    /**
     * Whether the request was successful.
     */
    private boolean success;

    /**
     * Response data.
     */
    private T data;

    /**
     * Set on a successful but degraded answer, for example a scan cut short by its time budget.
     */
    private String warning;

    /**
     * Error message in case of failure.
     */
    private String error;

    /**
     * Error code in case of failure.
     */
    private String errorCode;

    /**
     * Creates a successful response.
     *
     * @param data Response data
     * @param <T> Type of data
     * @return Successful API response
     */
    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(true, data, null, null, null);
    }

    /**
     * Creates a successful response that carries a warning about degraded results.
     *
     * @param data Response data
     * @param warning What was degraded
     * @param <T> Type of data
     * @return Successful API response with a warning
     */
    public static <T> ApiResponse<T> partial(T data, String warning) {
        return new ApiResponse<>(true, data, warning, null, null);
    }

    /**
     * Creates an error response with a message and code.
     *
     * @param errorMessage Error message
     * @param errorCode Error code
     * @param <T> Type of data
     * @return Error API response
     */
    public static <T> ApiResponse<T> error(String errorMessage, String errorCode) {
        return new ApiResponse<>(false, null, null, errorMessage, errorCode);
    }
}
