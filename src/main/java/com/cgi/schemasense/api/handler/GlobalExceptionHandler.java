package com.cgi.schemasense.api.handler;

import com.cgi.schemasense.api.dto.ApiResponse;
import com.cgi.schemasense.exception.BaseException;
import com.cgi.schemasense.exception.ClassificationInputException;
import com.cgi.schemasense.exception.PatternLoadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

/**
 * Global exception handler for the application.
 * Maps input errors to 400 and everything else to 500.
 */
@ControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Handles ClassificationInputException.
     *
     * @param e ClassificationInputException
     * @return API response with error message
     */
    @ExceptionHandler(ClassificationInputException.class)
    public ResponseEntity<ApiResponse<String>> handleInputException(ClassificationInputException e) {
        logger.warn("Rejected classification request: {}", e.getMessage());
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.error(e.getMessage(), e.getErrorCode()));
    }

    /**
     * Handles PatternLoadException, raised when submitted alias records are invalid.
     *
     * @param e PatternLoadException
     * @return API response with error message
     */
    @ExceptionHandler(PatternLoadException.class)
    public ResponseEntity<ApiResponse<String>> handlePatternLoadException(PatternLoadException e) {
        logger.warn("Invalid pattern records: {}", e.getMessage());
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.error(e.getMessage(), e.getErrorCode()));
    }

    @ExceptionHandler(BaseException.class)
    public ResponseEntity<ApiResponse<String>> handleBaseException(BaseException e) {
        if (e.isTransientFailure()) {
            logger.warn("Transient classification failure [{}]: {}", e.getErrorCode(), e.getMessage());
            return ResponseEntity
                    .status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(ApiResponse.error(e.getMessage(), e.getErrorCode()));
        }
        logger.error("Classification error: {}", e.getMessage(), e);
        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.error(e.getMessage(), e.getErrorCode()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<String>> handleUnreadableBody(HttpMessageNotReadableException e) {
        logger.warn("Unreadable request body: {}", e.getMessage());
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.error("Malformed request body", "INVALID_REQUEST"));
    }

    /**
     * Handles IllegalArgumentException.
     *
     * @param e IllegalArgumentException
     * @return API response with error message
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<String>> handleIllegalArgumentException(IllegalArgumentException e) {
        logger.error("Invalid argument: {}", e.getMessage(), e);
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.error("Invalid argument: " + e.getMessage(), "INVALID_ARGUMENT"));
    }

    /**
     * Handles all other exceptions.
     *
     * @param e Exception
     * @return API response with error message
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<String>> handleGenericException(Exception e) {
        logger.error("Unexpected error: {}", e.getMessage(), e);
        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.error("An unexpected error occurred: " + e.getMessage(), "GENERAL_ERROR"));
    }
}
