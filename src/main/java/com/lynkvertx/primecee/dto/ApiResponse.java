package com.lynkvertx.primecee.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.http.HttpStatus;

import java.time.Instant;

/**
 * Envelope shared by every endpoint of the valorisation API
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    /** HTTP status code mirrored in the body */
    private int code;

    private String message;

    private T data;

    /** ISO 8601 instant the response was produced */
    private String timestamp;

    public static <T> ApiResponse<T> success(T data) {
        return of(HttpStatus.OK, "success", data);
    }

    public static <T> ApiResponse<T> success(String message, T data) {
        return of(HttpStatus.OK, message, data);
    }

    public static <T> ApiResponse<T> error(HttpStatus status, String message) {
        return of(status, message, null);
    }

    /**
     * Error carrying a payload, e.g. the field → message map of a validation failure
     */
    public static <T> ApiResponse<T> error(HttpStatus status, String message, T data) {
        return of(status, message, data);
    }

    private static <T> ApiResponse<T> of(HttpStatus status, String message, T data) {
        return ApiResponse.<T>builder()
            .code(status.value())
            .message(message)
            .data(data)
            .timestamp(Instant.now().toString())
            .build();
    }
}
