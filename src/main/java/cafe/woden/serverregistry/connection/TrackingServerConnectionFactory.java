package cafe.woden.serverregistry.connection;

import cafe.woden.serverregistry.model.ServerConfiguration;
import org.springframework.stereotype.Component;

@Component
public class TrackingServerConnectionFactory implements ServerConnectionFactory {

  @Override
  public ServerConnection create(ServerConfiguration configuration) {
    return new TrackingServerConnection(configuration);
  }
}
