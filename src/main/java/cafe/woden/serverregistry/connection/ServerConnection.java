package cafe.woden.serverregistry.connection;

import io.reactivex.rxjava3.core.Completable;

/**
 * Live connection to one configured server.
 *
 * <p>Owned by the registry entry it belongs to; {@link #dispose()} is called exactly once, when
 * that entry is destroyed.
 */
public interface ServerConnection {

  ConnectionState state();

  Completable open();

  Completable close();

  /** Releases everything held by this connection. Further opens fail. */
  void dispose();
}
