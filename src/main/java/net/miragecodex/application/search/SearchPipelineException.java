package net.miragecodex.application.search;

import java.util.Objects;

/**
 * Failure of a search request, classified for the HTTP surface.
 */
public class SearchPipelineException extends RuntimeException {

    /**
     * Canonical failure categories of the search pipeline.
     */
    public enum ErrorCode {
        INVALID_REQUEST(400),
        AUTHENTICATION_REQUIRED(401),
        INSUFFICIENT_CREDITS(402),
        GENERATION_FAILED(500),
        PERSISTENCE_FAILED(500);

        private final int httpStatus;

        ErrorCode(int httpStatus) {
            this.httpStatus = httpStatus;
        }

        public int httpStatus() {
            return httpStatus;
        }
    }

    private final ErrorCode errorCode;

    public SearchPipelineException(ErrorCode errorCode, String message) {
        this(errorCode, message, null);
    }

    public SearchPipelineException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode must not be null");
    }

    public ErrorCode errorCode() {
        return errorCode;
    }

    static SearchPipelineException invalid(String message) {
        return new SearchPipelineException(ErrorCode.INVALID_REQUEST, message);
    }
}
