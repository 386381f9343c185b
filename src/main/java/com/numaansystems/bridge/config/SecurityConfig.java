package com.numaansystems.bridge.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

import java.util.Arrays;
import java.util.List;

/**
 * Security configuration for the login bridge.
 * The bridge routes are public: the correlation id is the only capability a
 * caller needs. CORS origins come from {@code bridge.allowed-origins}.
 *
 * <h2>Bearer Tokens</h2>
 * <p>When a {@link JwtDecoder} is available, for example from
 * {@code spring.security.oauth2.resourceserver.jwt.issuer-uri}, requests may carry
 * {@code Authorization: Bearer <jwt>}. A launcher that opens {@code /bridge/ws} with a
 * valid token becomes the owner of its session and the JWT subject is used as the
 * local username for account linking. Connections without a token stay anonymous,
 * an invalid token is rejected with 401.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@Configuration
@EnableWebSecurity
public class SecurityConfig {

    private static final Logger logger = LoggerFactory.getLogger(SecurityConfig.class);

    private final BridgeProperties properties;
    private final ObjectProvider<JwtDecoder> jwtDecoder;

    public SecurityConfig(BridgeProperties properties, ObjectProvider<JwtDecoder> jwtDecoder) {
        this.properties = properties;
        this.jwtDecoder = jwtDecoder;
    }

    /**
     * Configures the security filter chain with CORS support and authorization rules.
     *
     * @param http the HttpSecurity to configure
     * @return the configured SecurityFilterChain
     * @throws Exception if an error occurs during configuration
     */
    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        http
            .cors(cors -> cors.configurationSource(corsConfigurationSource()))
            .authorizeHttpRequests(authorize -> authorize
                .requestMatchers("/bridge/**", "/error").permitAll()
                .requestMatchers("/v3/api-docs/**", "/swagger-ui/**", "/swagger-ui.html").permitAll()
                .anyRequest().authenticated()
            )
            .csrf(csrf -> csrf.disable());

        if (jwtDecoder.getIfAvailable() != null) {
            http.oauth2ResourceServer(oauth2 -> oauth2.jwt(Customizer.withDefaults()));
            logger.info("Bearer token authentication enabled, authenticated connections can link accounts");
        } else {
            logger.info("No JWT decoder configured, all connections are anonymous");
        }

        return http.build();
    }

    /**
     * Configures CORS for the launcher and any web front end calling the bridge.
     *
     * @return the configured CorsConfigurationSource
     */
    @Bean
    public CorsConfigurationSource corsConfigurationSource() {
        CorsConfiguration configuration = new CorsConfiguration();

        configuration.setAllowedOriginPatterns(properties.allowedOrigins());
        configuration.setAllowedMethods(Arrays.asList("GET", "OPTIONS", "HEAD"));
        configuration.setAllowedHeaders(List.of("*"));

        // Set max age for preflight requests (in seconds)
        configuration.setMaxAge(3600L);

        configuration.setExposedHeaders(List.of("Location"));

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/bridge/**", configuration);

        return source;
    }
}
