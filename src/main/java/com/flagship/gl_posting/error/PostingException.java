package com.flagship.gl_posting.error;

import lombok.Getter;

import java.util.Comparator;
import java.util.List;

/**
 * Typed failure of a posting-engine operation.
 *
 * Carries every collected {@link PostingError}. The exception's {@link #getKind() kind}
 * is the most severe kind among them, so a COA problem is reported as a COA error even
 * when the entry is also unbalanced.
 */
@Getter
public class PostingException extends RuntimeException {

    private static final List<ErrorKind> SEVERITY = List.of(
        ErrorKind.POLICY_CONFIGURATION_ERROR,
        ErrorKind.UPSTREAM_UNAVAILABLE,
        ErrorKind.IDEMPOTENCY_CONFLICT,
        ErrorKind.SOD_VIOLATION,
        ErrorKind.INVALID_STATE_TRANSITION,
        ErrorKind.COA_ERROR,
        ErrorKind.VALIDATION_ERROR
    );

    private final ErrorKind kind;
    private final transient List<PostingError> errors;

    public PostingException(List<PostingError> errors) {
        super(summarize(errors));
        if (errors.isEmpty()) {
            throw new IllegalArgumentException("PostingException requires at least one error");
        }
        this.errors = List.copyOf(errors);
        this.kind = dominantKind(errors);
    }

    public PostingException(PostingError error) {
        this(List.of(error));
    }

    public PostingException(PostingError error, Throwable cause) {
        super(summarize(List.of(error)), cause);
        this.errors = List.of(error);
        this.kind = error.getKind();
    }

    /**
     * Codes of all carried errors, in reporting order.
     */
    public List<String> getCodes() {
        return errors.stream().map(PostingError::getCode).toList();
    }

    public boolean hasCode(String code) {
        return errors.stream().anyMatch(e -> e.getCode().equals(code));
    }

    private static ErrorKind dominantKind(List<PostingError> errors) {
        return errors.stream()
            .map(PostingError::getKind)
            .min(Comparator.comparingInt(SEVERITY::indexOf))
            .orElseThrow();
    }

    private static String summarize(List<PostingError> errors) {
        if (errors.isEmpty()) {
            return "Posting failed";
        }
        if (errors.size() == 1) {
            return errors.get(0).getMessage();
        }
        return errors.get(0).getMessage() + " (and " + (errors.size() - 1) + " more)";
    }
}
