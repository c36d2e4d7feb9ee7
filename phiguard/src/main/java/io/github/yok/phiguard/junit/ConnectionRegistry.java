package io.github.yok.phiguard.junit;

import com.google.common.collect.ImmutableMap;
import io.github.yok.phiguard.db.ConnectionManager;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * A simple static registry for handing over test-owned {@link ConnectionManager} instances to
 * {@link TestDataCleanupExtension} at test execution time.
 *
 * <h2>How to use</h2>
 * <ol>
 * <li>In suite setup, connect a {@link ConnectionManager} and call
 * {@link #register(String, ConnectionManager)}.</li>
 * <li>The extension looks the manager up via {@link #find(String)} using
 * {@link CleanupTestData#connection()}.</li>
 * <li>In suite teardown, call {@link #unregister(String)} or {@link #clear()}. The registry never
 * closes managers; the registering code owns them.</li>
 * </ol>
 *
 * <p>
 * Internally backed by a {@link ConcurrentHashMap}, so concurrent access is supported.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class ConnectionRegistry {

    // Logical connection name to its manager
    private static final ConcurrentHashMap<String, ConnectionManager> REGISTRY =
            new ConcurrentHashMap<>();

    /**
     * Registers a single {@link ConnectionManager}, replacing any previous mapping.
     *
     * @param name logical connection name
     * @param manager manager to register
     * @throws NullPointerException if any argument is {@code null}
     */
    public static void register(String name, ConnectionManager manager) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(manager, "manager");
        REGISTRY.put(name, manager);
        log.info("register: name={}, state={}", name, manager.getState());
    }

    /**
     * Finds the {@link ConnectionManager} registered under {@code name}.
     *
     * @param name logical connection name
     * @return registered manager, or empty if none
     */
    public static Optional<ConnectionManager> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(REGISTRY.get(name));
    }

    /**
     * Returns an immutable snapshot of all currently registered entries.
     *
     * @return an immutable copy of the current registry
     */
    public static Map<String, ConnectionManager> snapshot() {
        return ImmutableMap.copyOf(REGISTRY);
    }

    /**
     * Unregisters a single mapping.
     *
     * @param name logical connection name
     */
    public static void unregister(String name) {
        if (name == null) {
            return;
        }
        REGISTRY.remove(name);
        log.info("unregister: name={}", name);
    }

    /**
     * Clears all registered entries.
     */
    public static void clear() {
        REGISTRY.clear();
        log.info("clear");
    }
}
