package net.miragecodex.application.page;

import java.util.Objects;

/**
 * Failure of a book page request, classified for the HTTP surface.
 */
public class BookPageException extends RuntimeException {

    public enum ErrorCode {
        INVALID_REQUEST(400),
        AUTHENTICATION_REQUIRED(401),
        INSUFFICIENT_CREDITS(402),
        NOT_FOUND(404),
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

    public BookPageException(ErrorCode errorCode, String message) {
        this(errorCode, message, null);
    }

    public BookPageException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode must not be null");
    }

    public ErrorCode errorCode() {
        return errorCode;
    }
}
