package com.numaansystems.bridge.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory registry correlating an opaque correlation id with the live client
 * connection waiting for its login result.
 *
 * <p>This map is the only shared mutable state of the bridge. Every operation
 * is atomic for a single id and never takes a lock spanning unrelated ids.</p>
 *
 * <h2>Entry Lifecycle</h2>
 * <ol>
 *   <li>Entry registered when the client's WebSocket is accepted</li>
 *   <li>A callback may claim the entry before running the federation pipeline</li>
 *   <li>Terminal delivery removes the entry, then sends the result and the close signal</li>
 *   <li>Entries never claimed are evicted by the sweeper after the session TTL</li>
 *   <li>Entries are dropped when the client connection is observed closed</li>
 * </ol>
 *
 * <h2>Delivery Guarantees</h2>
 * <ul>
 *   <li>Removal happens before the send, so at most one caller ever gets to
 *       deliver a terminal message for an id</li>
 *   <li>Delivering to an unknown id is a no-op returning {@link DeliveryResult#NOT_FOUND}</li>
 *   <li>A channel that refuses a message counts as {@link DeliveryResult#NOT_FOUND}</li>
 * </ul>
 *
 * <p>Entries live in process memory only. A WebSocket and its callback have to
 * reach the same instance when several instances are deployed.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@Component
public class ConnectionRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final ConcurrentHashMap<String, ConnectionEntry> connections = new ConcurrentHashMap<>();
    private final Clock clock;

    public ConnectionRegistry(Clock clock) {
        this.clock = clock;
    }

    /**
     * Registers an anonymous connection.
     *
     * @see #register(String, OutboundChannel, String)
     */
    public RegisterResult register(String id, OutboundChannel sender) {
        return register(id, sender, null);
    }

    /**
     * Registers a connection under a correlation id.
     *
     * <p>An existing entry is never overwritten: a second registration would
     * otherwise steal delivery for an in-flight login.</p>
     *
     * @param id the correlation id
     * @param sender the sending half of the client connection
     * @param owner principal that opened the connection, or null
     * @return {@link RegisterResult#ALREADY_REGISTERED} if the id is taken
     */
    public RegisterResult register(String id, OutboundChannel sender, String owner) {
        ConnectionEntry entry = new ConnectionEntry(id, sender, clock.instant(), owner);
        ConnectionEntry existing = connections.putIfAbsent(id, entry);
        if (existing != null) {
            logger.warn("Rejected duplicate registration for session {}", id);
            return RegisterResult.ALREADY_REGISTERED;
        }
        logger.debug("Registered session {}", id);
        return RegisterResult.REGISTERED;
    }

    /**
     * Marks the login attempt for an id as taken by the calling callback.
     *
     * <p>Only the first claim succeeds. The entry stays registered so the
     * claimer can still deliver to it once its pipeline finishes.</p>
     *
     * @param id the correlation id
     * @return the claim outcome, with the connection owner when claimed
     */
    public ClaimResult claim(String id) {
        ConnectionEntry entry = connections.get(id);
        if (entry == null) {
            return ClaimResult.notFound();
        }
        if (!entry.tryClaim()) {
            logger.warn("Session {} was already claimed by another callback", id);
            return ClaimResult.alreadyClaimed();
        }
        return ClaimResult.claimed(entry.getOwner());
    }

    /**
     * Sends a message to the connection registered under an id.
     *
     * <p>A {@link BridgeMessage.Kind#CLOSE} message is terminal: the entry is
     * removed before the close is sent. A text message leaves the entry in place.</p>
     *
     * @param id the correlation id
     * @param message the message to send
     * @return {@link DeliveryResult#NOT_FOUND} if there is no live connection for the id
     */
    public DeliveryResult deliver(String id, BridgeMessage message) {
        if (message.isClose()) {
            ConnectionEntry entry = connections.remove(id);
            if (entry == null) {
                return DeliveryResult.NOT_FOUND;
            }
            return entry.getSender().offer(message) ? DeliveryResult.DELIVERED : DeliveryResult.NOT_FOUND;
        }

        ConnectionEntry entry = connections.get(id);
        if (entry == null) {
            return DeliveryResult.NOT_FOUND;
        }
        if (!entry.getSender().offer(message)) {
            // channel is gone, the entry can never be delivered to
            connections.remove(id, entry);
            logger.debug("Dropped session {} after a refused send", id);
            return DeliveryResult.NOT_FOUND;
        }
        return DeliveryResult.DELIVERED;
    }

    /**
     * Delivers a terminal result: removes the entry, sends the payload, then the close signal.
     *
     * <p>Because removal comes first, concurrent callers for the same id cannot
     * both deliver. Exactly one of them observes the entry.</p>
     *
     * @param id the correlation id
     * @param payload the serialized result
     * @return {@link DeliveryResult#DELIVERED} if the payload was accepted by the channel
     */
    public DeliveryResult deliverTerminal(String id, String payload) {
        ConnectionEntry entry = connections.remove(id);
        if (entry == null) {
            logger.debug("No session {} to deliver to", id);
            return DeliveryResult.NOT_FOUND;
        }

        OutboundChannel sender = entry.getSender();
        boolean accepted = sender.offer(BridgeMessage.text(payload));
        if (!sender.offer(BridgeMessage.close())) {
            sender.close();
        }
        if (!accepted) {
            logger.info("Session {} refused its result, the client is gone", id);
            return DeliveryResult.NOT_FOUND;
        }
        logger.debug("Delivered result to session {}", id);
        return DeliveryResult.DELIVERED;
    }

    /**
     * Removes the entry for an id if it still belongs to the given sender.
     *
     * <p>Called when the owning connection is observed closed.</p>
     *
     * @param id the correlation id
     * @param sender the sender registered by that connection
     * @return true if an entry was removed
     */
    public boolean unregister(String id, OutboundChannel sender) {
        ConnectionEntry entry = connections.get(id);
        if (entry == null || entry.getSender() != sender) {
            return false;
        }
        boolean removed = connections.remove(id, entry);
        if (removed) {
            logger.debug("Unregistered closed session {}", id);
        }
        return removed;
    }

    /**
     * Evicts every entry older than the given age and closes its channel.
     *
     * @param olderThan maximum age of an entry
     * @return number of entries evicted
     */
    public int sweep(Duration olderThan) {
        Instant cutoff = clock.instant().minus(olderThan);
        int evicted = 0;

        for (Map.Entry<String, ConnectionEntry> mapEntry : connections.entrySet()) {
            ConnectionEntry entry = mapEntry.getValue();
            if (entry.getCreatedAt().isBefore(cutoff) && connections.remove(mapEntry.getKey(), entry)) {
                entry.getSender().close();
                evicted++;
                logger.debug("Evicted expired session {}", entry.getId());
            }
        }
        return evicted;
    }

    public boolean contains(String id) {
        return connections.containsKey(id);
    }

    /**
     * Returns the number of sessions waiting for a result.
     *
     * <p>Useful for monitoring and health checks.</p>
     *
     * @return the number of registered connections
     */
    public int size() {
        return connections.size();
    }
}
