package com.tribunal.records.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Envelope for successful API calls.
 * @param <T> the type of the data payload
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {
    private boolean success;
    private T data;
    private String message;
    /** Present only on paginated listings. */
    private Pagination pagination;
    private LocalDateTime timestamp;

    public static <T> ApiResponse<T> of(T data, String message) {
        return new ApiResponse<>(true, data, message, null, LocalDateTime.now());
    }

    public static <T> ApiResponse<T> paginated(T data, Pagination pagination, String message) {
        return new ApiResponse<>(true, data, message, pagination, LocalDateTime.now());
    }
}
