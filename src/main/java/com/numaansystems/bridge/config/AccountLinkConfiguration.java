package com.numaansystems.bridge.config;

import com.numaansystems.bridge.service.BridgeConfigurationException;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;

/**
 * Database access for account linking, built from {@code bridge.account-link.*}.
 *
 * <p>Only active with {@code bridge.account-link.enabled=true}. The bridge has no
 * other use for a database, so nothing is created otherwise.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@Configuration(proxyBeanMethods = false)
@ConditionalOnProperty(prefix = "bridge.account-link", name = "enabled", havingValue = "true")
public class AccountLinkConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(AccountLinkConfiguration.class);

    /**
     * Connection pool for the database holding the {@code users} table.
     *
     * @param properties bridge configuration
     * @return the pooled DataSource
     * @throws BridgeConfigurationException if no JDBC URL is configured
     */
    @Bean
    public DataSource accountLinkDataSource(BridgeProperties properties) {
        BridgeProperties.AccountLink accountLink = properties.accountLink();
        if (accountLink.url() == null || accountLink.url().isBlank()) {
            throw new BridgeConfigurationException(
                    "bridge.account-link.url must be set when account linking is enabled");
        }

        logger.info("Account linking enabled against {}", accountLink.url());
        HikariDataSource dataSource = DataSourceBuilder.create()
                .type(HikariDataSource.class)
                .url(accountLink.url())
                .username(accountLink.username())
                .password(accountLink.password())
                .build();
        dataSource.setPoolName("account-link");
        return dataSource;
    }

    @Bean
    public JdbcTemplate accountLinkJdbcTemplate(DataSource accountLinkDataSource) {
        return new JdbcTemplate(accountLinkDataSource);
    }
}
