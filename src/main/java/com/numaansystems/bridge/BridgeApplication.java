package com.numaansystems.bridge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Federated Login Bridge Application
 * 
 * <p>This Spring Boot application lets launcher-style clients, which have no
 * browser session of their own, sign in through a federated identity chain.
 * The browser-based OAuth round trip is delegated to this server and the
 * result is pushed back over a WebSocket the client already holds open.</p>
 * 
 * <h2>Flow</h2>
 * <ol>
 *   <li>Client opens a WebSocket at /bridge/ws and receives a correlation id</li>
 *   <li>Client opens the user's browser at /bridge/init?id=&lt;correlation id&gt;</li>
 *   <li>Bridge redirects the browser to the identity provider's authorize page</li>
 *   <li>Provider redirects back to /bridge/callback with code and state</li>
 *   <li>Bridge runs the five stage federation pipeline</li>
 *   <li>Result (profile or stage-attributed error) is delivered once over the
 *       client's WebSocket, which is then closed</li>
 * </ol>
 * 
 * <h2>Limitations</h2>
 * <ul>
 *   <li>Pending sessions live in process memory only</li>
 *   <li>The WebSocket and the callback must reach the same instance</li>
 * </ul>
 *
 * <p>The only database is the optional account link store, configured under
 * {@code bridge.account-link}, so the default DataSource setup is excluded.</p>
 * 
 * @author Numaan Systems
 * @version 0.1.0
 */
@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
@ConfigurationPropertiesScan
public class BridgeApplication {

    /**
     * Main entry point for the bridge application.
     * 
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication.run(BridgeApplication.class, args);
    }
}
