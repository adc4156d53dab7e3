package cafe.woden.serverregistry.connection;

import cafe.woden.serverregistry.model.ServerConfiguration;
import io.reactivex.rxjava3.core.Completable;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Connection that records lifecycle transitions without doing any transport work.
 *
 * <p>Used when the host application has not supplied a transport-specific {@link
 * ServerConnectionFactory}.
 */
public class TrackingServerConnection implements ServerConnection {

  private static final Logger log = LoggerFactory.getLogger(TrackingServerConnection.class);

  private final ServerConfiguration configuration;
  private final AtomicReference<ConnectionState> state =
      new AtomicReference<>(ConnectionState.DISCONNECTED);

  public TrackingServerConnection(ServerConfiguration configuration) {
    this.configuration = Objects.requireNonNull(configuration, "configuration");
  }

  @Override
  public ConnectionState state() {
    return state.get();
  }

  @Override
  public Completable open() {
    return Completable.fromAction(
        () -> {
          ConnectionState current = state.get();
          if (current == ConnectionState.DISPOSED) {
            throw new IllegalStateException("Connection disposed: " + configuration.name());
          }
          if (current == ConnectionState.CONNECTED) return;
          state.set(ConnectionState.CONNECTING);
          log.info(
              "[server-registry] opening {} ({} {}:{})",
              configuration.name(),
              configuration.connection().key(),
              configuration.hostAddress(),
              configuration.port());
          state.set(ConnectionState.CONNECTED);
        });
  }

  @Override
  public Completable close() {
    return Completable.fromAction(
        () -> {
          ConnectionState current = state.get();
          if (current != ConnectionState.CONNECTED && current != ConnectionState.CONNECTING) return;
          state.set(ConnectionState.DISCONNECTING);
          log.info("[server-registry] closing {}", configuration.name());
          state.set(ConnectionState.DISCONNECTED);
        });
  }

  @Override
  public void dispose() {
    ConnectionState previous = state.getAndSet(ConnectionState.DISPOSED);
    if (previous != ConnectionState.DISPOSED) {
      log.debug("[server-registry] disposed connection for {}", configuration.name());
    }
  }
}
