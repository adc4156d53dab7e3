package cafe.woden.serverregistry.connection;

import static org.junit.jupiter.api.Assertions.assertEquals;

import cafe.woden.serverregistry.model.ServerConfiguration;
import org.junit.jupiter.api.Test;

class TrackingServerConnectionTest {

  @Test
  void openAndCloseTrackState() {
    TrackingServerConnection conn = new TrackingServerConnection(ServerConfiguration.named("a"));
    assertEquals(ConnectionState.DISCONNECTED, conn.state());

    conn.open().blockingAwait();
    assertEquals(ConnectionState.CONNECTED, conn.state());

    conn.close().blockingAwait();
    assertEquals(ConnectionState.DISCONNECTED, conn.state());
  }

  @Test
  void nothingHappensUntilSubscribed() {
    TrackingServerConnection conn = new TrackingServerConnection(ServerConfiguration.named("a"));

    conn.open();

    assertEquals(ConnectionState.DISCONNECTED, conn.state());
  }

  @Test
  void openAfterDisposeFails() {
    TrackingServerConnection conn = new TrackingServerConnection(ServerConfiguration.named("a"));
    conn.dispose();

    conn.open().test().assertError(IllegalStateException.class);
    assertEquals(ConnectionState.DISPOSED, conn.state());

    conn.close().test().assertComplete();
    assertEquals(ConnectionState.DISPOSED, conn.state());
  }
}
