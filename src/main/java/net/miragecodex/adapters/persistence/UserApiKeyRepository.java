package net.miragecodex.adapters.persistence;

import java.util.Optional;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.util.StringUtils;

/**
 * Looks up personal provider credentials stored per user and provider domain.
 */
@Repository
public class UserApiKeyRepository {

    private final JdbcTemplate jdbcTemplate;

    public UserApiKeyRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<String> findApiKey(String userId, String domainCode) {
        if (!StringUtils.hasText(userId) || !StringUtils.hasText(domainCode)) {
            return Optional.empty();
        }
        String apiKey = jdbcTemplate.query(
            "SELECT api_key FROM user_api_keys WHERE user_id = ? AND domain_code = ?",
            rs -> rs.next() ? rs.getString("api_key") : null,
            userId,
            domainCode
        );
        return StringUtils.hasText(apiKey) ? Optional.of(apiKey.trim()) : Optional.empty();
    }
}
