package net.miragecodex.controller.support;

import java.util.HashMap;
import java.util.Map;
import net.miragecodex.application.page.BookPageException;
import net.miragecodex.application.search.SearchPipelineException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Small helper for producing consistent error payloads across controllers.
 */
public final class ErrorResponseUtils {

    private ErrorResponseUtils() {
        // Utility class
    }

    public static Map<String, String> errorBody(String message, String detail) {
        Map<String, String> body = new HashMap<>();
        body.put("error", message);
        if (detail != null && !detail.isBlank()) {
            body.put("message", detail);
        }
        return body;
    }

    public static ResponseEntity<Map<String, String>> error(HttpStatus status, String message, String detail) {
        return ResponseEntity.status(status).body(errorBody(message, detail));
    }

    /**
     * Maps a pipeline failure onto its HTTP status. Server-side failures carry a
     * generic detail so internal messages do not leak to callers.
     */
    public static ResponseEntity<Map<String, String>> fromPipelineException(SearchPipelineException exception) {
        HttpStatus status = HttpStatus.valueOf(exception.errorCode().httpStatus());
        String detail = status.is5xxServerError() ? "The search could not be completed" : exception.getMessage();
        return error(status, exception.errorCode().name(), detail);
    }

    public static ResponseEntity<Map<String, String>> fromPageException(BookPageException exception) {
        HttpStatus status = HttpStatus.valueOf(exception.errorCode().httpStatus());
        String detail = status.is5xxServerError() ? "The page could not be written" : exception.getMessage();
        return error(status, exception.errorCode().name(), detail);
    }

    public static ResponseEntity<Map<String, String>> unauthorized(String detail) {
        return error(HttpStatus.UNAUTHORIZED, "AUTHENTICATION_REQUIRED", detail);
    }

    public static ResponseEntity<Map<String, String>> notFound(String detail) {
        return error(HttpStatus.NOT_FOUND, "NOT_FOUND", detail);
    }
}
