package net.miragecodex.controller.support;

import jakarta.servlet.http.HttpServletRequest;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Reads the caller identity that the upstream gateway puts on each request
 * after authenticating the session. Absent means anonymous.
 */
@Component
public class CurrentUserResolver {

    private final String userHeader;

    public CurrentUserResolver(@Value("${miragecodex.auth.user-header:X-User-Id}") String userHeader) {
        this.userHeader = userHeader;
    }

    public Optional<String> currentUser(HttpServletRequest request) {
        String userId = request.getHeader(userHeader);
        return StringUtils.hasText(userId) ? Optional.of(userId.trim()) : Optional.empty();
    }
}
