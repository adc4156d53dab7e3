package cafe.woden.serverregistry.connection;

import cafe.woden.serverregistry.model.ServerConfiguration;

/** Creates the connection object for a newly registered server. */
@FunctionalInterface
public interface ServerConnectionFactory {
  ServerConnection create(ServerConfiguration configuration);
}
