package cafe.woden.serverregistry;

import cafe.woden.serverregistry.config.RegistryProperties;
import cafe.woden.serverregistry.registry.ServerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@SpringBootApplication
@EnableConfigurationProperties(RegistryProperties.class)
public class ServerRegistryApp {
  private static final Logger log = LoggerFactory.getLogger(ServerRegistryApp.class);

  public static void main(String[] args) {
    // The registry is torn down by the context's shutdown hook.
    new SpringApplicationBuilder(ServerRegistryApp.class).headless(true).run(args);
  }

  @Bean
  public ApplicationRunner run(ObjectProvider<ServerRegistry> registryProvider, RegistryProperties props) {
    return args -> {
      // First use of the registry: this is where it loads.
      ServerRegistry registry = registryProvider.getObject();
      log.info("[server-registry] Available servers: {}", registry.listNames());

      if (!props.connectOnStart().isEmpty()) {
        log.info("[server-registry] Connecting on start: {}", props.connectOnStart());
        registry.connectServers(props.connectOnStart());
      }
    };
  }
}
