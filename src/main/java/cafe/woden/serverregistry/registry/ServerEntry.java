package cafe.woden.serverregistry.registry;

import cafe.woden.serverregistry.connection.ServerConnection;
import cafe.woden.serverregistry.model.ServerConfiguration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runtime object for one configured server: its configuration plus its live connection.
 *
 * <p>Created and destroyed only by {@link ServerRegistry}. Remains readable after it has been
 * removed from the registry, until the registry is torn down.
 */
public final class ServerEntry {
  private static final Logger log = LoggerFactory.getLogger(ServerEntry.class);

  private final ServerHandle handle;
  private final AtomicBoolean destroyed = new AtomicBoolean(false);
  private volatile ServerConfiguration configuration;
  private volatile ServerConnection connection;

  ServerEntry(ServerHandle handle, ServerConfiguration configuration, ServerConnection connection) {
    this.handle = Objects.requireNonNull(handle, "handle");
    this.configuration = Objects.requireNonNull(configuration, "configuration");
    this.connection = Objects.requireNonNull(connection, "connection");
  }

  public ServerHandle handle() {
    return handle;
  }

  public String name() {
    return configuration.name();
  }

  public ServerConfiguration configuration() {
    return configuration;
  }

  public ServerConnection connection() {
    return connection;
  }

  public boolean isDestroyed() {
    return destroyed.get();
  }

  /**
   * Swaps in a new configuration together with the connection built from it.
   *
   * @return the previous connection, now owned by the caller
   */
  ServerConnection replace(ServerConfiguration configuration, ServerConnection connection) {
    ServerConnection previous = this.connection;
    this.configuration = Objects.requireNonNull(configuration, "configuration");
    this.connection = Objects.requireNonNull(connection, "connection");
    return previous;
  }

  /** Disposes the connection. Only the first call has any effect. */
  boolean destroy() {
    if (!destroyed.compareAndSet(false, true)) return false;
    try {
      connection.dispose();
    } catch (RuntimeException e) {
      log.warn("[server-registry] Error disposing connection for {}", name(), e);
    }
    return true;
  }

  @Override
  public String toString() {
    return "ServerEntry{" + handle + ", " + name() + "}";
  }
}
