package com.flagship.gl_posting.error;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * A single structured failure with enough detail for the caller to fix the request
 * (line index, account id, balance delta and so on).
 */
@Value
@Builder(toBuilder = true)
public class PostingError {
    ErrorKind kind;
    String code;
    String message;
    @Singular
    Map<String, Object> details;

    public static PostingError of(ErrorKind kind, String code, String message) {
        return PostingError.builder().kind(kind).code(code).message(message).build();
    }

    public static PostingError validation(String code, String message) {
        return of(ErrorKind.VALIDATION_ERROR, code, message);
    }

    /**
     * Validation error tied to one input line. Line numbers in messages are 1-based,
     * the {@code lineIndex} detail is 0-based.
     */
    public static PostingError line(int lineIndex, String code, String message) {
        return PostingError.builder()
            .kind(ErrorKind.VALIDATION_ERROR)
            .code(code)
            .message(String.format("Line %d: %s", lineIndex + 1, message))
            .detail("lineIndex", lineIndex)
            .build();
    }
}
