package cafe.woden.serverregistry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import cafe.woden.serverregistry.connection.ConnectionState;
import cafe.woden.serverregistry.registry.LoadSource;
import cafe.woden.serverregistry.registry.ServerRegistry;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(
    properties = {
      "spring.main.headless=true",
      "registry.preferences-file=target/app-tests/${random.uuid}/preferences.yml",
      "registry.server-directory=target/app-tests/${random.uuid}/servers",
      "registry.connect-on-start=Local,missing"
    })
class ServerRegistryAppTest {

  @Autowired ServerRegistry registry;

  @Test
  void bootsWithBuiltInDefaultAndConnectsOnStart() {
    assertEquals(List.of("Local"), registry.listNames());
    assertEquals(LoadSource.BUILT_IN_DEFAULT, registry.loadSource());

    var handle = registry.find("Local").orElseThrow();
    assertEquals(
        ConnectionState.CONNECTED, registry.entry(handle).orElseThrow().connection().state());
    assertFalse(registry.isTornDown());
  }
}
