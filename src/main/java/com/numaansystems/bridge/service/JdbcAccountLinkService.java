package com.numaansystems.bridge.service;

import com.numaansystems.bridge.federation.model.AccountProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

/**
 * Stores the federated account id and name on the local user row.
 *
 * <p><strong>DISABLED BY DEFAULT:</strong> enable with
 * {@code bridge.account-link.enabled=true} and {@code bridge.account-link.url}.
 * Links are only made for WebSocket connections opened with a bearer token.</p>
 *
 * <h2>Database Schema</h2>
 * <pre>
 * ALTER TABLE users
 *     ADD COLUMN federated_account_id VARCHAR(64) UNIQUE,
 *     ADD COLUMN federated_account_name VARCHAR(32);
 * </pre>
 *
 * <p>A federated account may be linked to one local user only. Relinking the
 * same user to the same account is accepted.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@Service
@ConditionalOnProperty(prefix = "bridge.account-link", name = "enabled", havingValue = "true")
public class JdbcAccountLinkService implements AccountLinkService {

    private static final Logger logger = LoggerFactory.getLogger(JdbcAccountLinkService.class);

    static final String FIND_OTHER_OWNER_SQL = """
            SELECT COUNT(*) FROM users
            WHERE federated_account_id = ? AND username <> ?
            """;

    static final String LINK_SQL = """
            UPDATE users
            SET federated_account_id = ?, federated_account_name = ?
            WHERE username = ?
            """;

    private final JdbcTemplate jdbcTemplate;

    public JdbcAccountLinkService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void linkAccount(String username, AccountProfile profile) {
        logger.debug("Linking account {} to user {}", profile.getId(), username);

        try {
            Integer others = jdbcTemplate.queryForObject(FIND_OTHER_OWNER_SQL, Integer.class,
                    profile.getId(), username);
            if (others != null && others > 0) {
                logger.warn("Account {} is already linked to another user", profile.getId());
                throw new AccountLinkException("account_already_linked",
                        "This account is already linked to another user.");
            }

            int updated = jdbcTemplate.update(LINK_SQL, profile.getId(), profile.getName(), username);
            if (updated == 0) {
                logger.warn("No local user {} to link account {} to", username, profile.getId());
                throw new AccountLinkException("account_link_failed", "No local user to link the account to.");
            }
            logger.info("Linked account {} ({}) to user {}", profile.getId(), profile.getName(), username);
        } catch (DataAccessException e) {
            logger.error("Error linking account {} to user {}: {}", profile.getId(), username, e.getMessage(), e);
            throw new AccountLinkException("account_link_failed", "The account could not be linked.", e);
        }
    }
}
