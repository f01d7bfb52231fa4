package net.miragecodex.application.generation;

import com.openai.errors.OpenAIException;
import com.openai.errors.OpenAIIoException;
import com.openai.errors.OpenAIServiceException;
import java.util.Objects;

/**
 * Thrown when structured generation fails in transport, parsing, or validation.
 *
 * <p>Wraps the underlying SDK or parsing exception with the generation kind
 * so callers receive a typed contract instead of raw exceptions.</p>
 */
public class ContentGenerationException extends RuntimeException {

    /**
     * Canonical failure categories emitted by the generator gateway.
     */
    public enum ErrorCode {
        NOT_CONFIGURED(false),
        TRANSPORT_FAILED(true),
        SCHEMA_VIOLATION(true),
        SECTION_PARTITION_VIOLATION(true),
        RETRIES_EXHAUSTED(false);

        private final boolean retryable;

        ErrorCode(boolean retryable) {
            this.retryable = retryable;
        }

        public boolean retryable() {
            return retryable;
        }
    }

    private final ErrorCode errorCode;

    public ContentGenerationException(ErrorCode errorCode, String message) {
        this(errorCode, message, null);
    }

    public ContentGenerationException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode must not be null");
    }

    /**
     * Returns the canonical classification for this failure.
     */
    public ErrorCode errorCode() {
        return errorCode;
    }

    /**
     * Whether another attempt with the same input may succeed.
     */
    public boolean isRetryable() {
        return errorCode.retryable();
    }

    static boolean retryable(RuntimeException exception) {
        return exception instanceof ContentGenerationException generationException
            && generationException.isRetryable();
    }

    /**
     * Formats an OpenAI SDK exception into a concise description with HTTP status
     * code and human-readable explanation when available.
     */
    public static String describeApiError(OpenAIException ex) {
        if (ex instanceof OpenAIServiceException serviceException) {
            int status = serviceException.statusCode();
            String explanation = switch (status) {
                case 400 -> "bad request";
                case 401 -> "unauthorized, check API key";
                case 403 -> "access denied";
                case 404 -> "not found, check base URL and model name";
                case 408 -> "request timeout";
                case 422 -> "unprocessable request";
                case 429 -> "rate limited";
                case 500, 502, 503, 504 -> "server error";
                default -> "unexpected status";
            };
            return "HTTP %d %s".formatted(status, explanation);
        }
        if (ex instanceof OpenAIIoException) {
            return "network error: " + ex.getMessage();
        }
        return ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
    }
}
