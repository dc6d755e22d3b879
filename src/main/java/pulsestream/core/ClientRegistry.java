package pulsestream.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Membership of live connections, one set per {@link ClientKind}.
 * Fan-out iterates over {@link #snapshot(ClientKind)} copies so the lock is never held during a send.
 */
public class ClientRegistry {
    private static final Logger logger = LoggerFactory.getLogger(ClientRegistry.class);

    private final Object lock = new Object();
    private final Map<ClientKind, Set<ClientConnection>> members = new EnumMap<>(ClientKind.class);

    public ClientRegistry() {
        for (ClientKind kind : ClientKind.values()) {
            members.put(kind, new LinkedHashSet<>());
        }
    }

    /**
     * @return true if the connection was not registered yet
     */
    public boolean register(ClientConnection connection) {
        Objects.requireNonNull(connection, "connection cannot be null");
        int count;
        synchronized (lock) {
            Set<ClientConnection> set = members.get(connection.kind());
            if (!set.add(connection)) {
                return false;
            }
            count = set.size();
        }
        logger.info("{} client registered: {} (Total connections: {})", connection.kind(), connection.id(), count);
        return true;
    }

    /**
     * @return true if the connection was registered
     */
    public boolean unregister(ClientConnection connection) {
        if (connection == null) {
            return false;
        }
        int count;
        synchronized (lock) {
            Set<ClientConnection> set = members.get(connection.kind());
            if (!set.remove(connection)) {
                return false;
            }
            count = set.size();
        }
        logger.info("{} client unregistered: {} (Total connections: {})", connection.kind(), connection.id(), count);
        return true;
    }

    /**
     * @return a copy of the current members of one kind, in registration order
     */
    public List<ClientConnection> snapshot(ClientKind kind) {
        synchronized (lock) {
            return List.copyOf(members.get(kind));
        }
    }

    public boolean contains(ClientConnection connection) {
        synchronized (lock) {
            return members.get(connection.kind()).contains(connection);
        }
    }

    public int size(ClientKind kind) {
        synchronized (lock) {
            return members.get(kind).size();
        }
    }

    public int size() {
        synchronized (lock) {
            int total = 0;
            for (Set<ClientConnection> set : members.values()) {
                total += set.size();
            }
            return total;
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }
}
