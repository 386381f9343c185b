package com.numaansystems.bridge.service;

import com.numaansystems.bridge.config.BridgeProperties;
import com.numaansystems.bridge.registry.ConnectionRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically evicts sessions whose callback never arrived.
 *
 * <p>Eviction closes the client connection, so abandoned logins do not hold a
 * WebSocket open forever. The session TTL has to cover the whole browser
 * round trip plus five federation stages; a shorter TTL is reported at startup.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@Component
public class SessionExpirySweeper {

    private static final Logger logger = LoggerFactory.getLogger(SessionExpirySweeper.class);

    private static final Duration BROWSER_ROUND_TRIP = Duration.ofMinutes(5);
    private static final int STAGE_COUNT = 5;

    private final ConnectionRegistry registry;
    private final Duration sessionTtl;
    private final Duration sweepInterval;
    private final Duration minimumTtl;
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
        Thread thread = new Thread(runnable, "session-sweeper");
        thread.setDaemon(true);
        return thread;
    });

    public SessionExpirySweeper(ConnectionRegistry registry, BridgeProperties properties) {
        this.registry = registry;
        this.sessionTtl = properties.sessionTtl();
        this.sweepInterval = properties.sweepInterval();
        BridgeProperties.Federation federation = properties.federation();
        this.minimumTtl = federation.connectTimeout().plus(federation.responseTimeout())
                .multipliedBy(STAGE_COUNT)
                .plus(BROWSER_ROUND_TRIP);
    }

    @PostConstruct
    public void start() {
        if (sessionTtl.compareTo(minimumTtl) < 0) {
            logger.warn("Session TTL {} is shorter than {}, slow logins may be evicted before they complete",
                    sessionTtl, minimumTtl);
        }
        long intervalMillis = sweepInterval.toMillis();
        scheduler.scheduleWithFixedDelay(this::sweep, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
        logger.info("Session sweeper started: ttl {}, interval {}", sessionTtl, sweepInterval);
    }

    @PreDestroy
    public void stop() {
        scheduler.shutdownNow();
        logger.info("Session sweeper stopped");
    }

    /**
     * Evicts every session older than the TTL.
     *
     * @return number of sessions evicted
     */
    public int sweep() {
        try {
            int evicted = registry.sweep(sessionTtl);
            if (evicted > 0) {
                logger.info("Evicted {} expired sessions, {} still waiting", evicted, registry.size());
            }
            return evicted;
        } catch (RuntimeException e) {
            // an exception escaping a scheduled task cancels every later run
            logger.error("Session sweep failed: {}", e.getMessage(), e);
            return 0;
        }
    }

    Duration getMinimumTtl() {
        return minimumTtl;
    }
}
