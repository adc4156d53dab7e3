package cafe.woden.serverregistry.connection;

/**
 * Lifecycle state of a server connection.
 */
public enum ConnectionState {
  DISCONNECTED,
  CONNECTING,
  CONNECTED,
  DISCONNECTING,
  DISPOSED
}
