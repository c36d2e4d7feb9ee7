package io.github.yok.phiguard.db;

/**
 * Lifecycle state of a {@link ConnectionManager}.
 *
 * @author Yasuharu.Okawauchi
 */
public enum ConnectionState {
    // No live handle; connect() is allowed
    DISCONNECTED,
    // Exactly one live handle; queries are allowed
    CONNECTED
}
