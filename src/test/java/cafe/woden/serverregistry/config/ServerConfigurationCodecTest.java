package cafe.woden.serverregistry.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cafe.woden.serverregistry.model.ConnectionKind;
import cafe.woden.serverregistry.model.InvalidConfigurationException;
import cafe.woden.serverregistry.model.ServerConfiguration;
import cafe.woden.serverregistry.model.ServerField;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ServerConfigurationCodecTest {

  @Test
  void encodeWritesEnumsAsConfigurationKeys() {
    ServerConfiguration config =
        ServerConfiguration.named("cluster")
            .withValue(ServerField.CONNECTION, ConnectionKind.SFTP)
            .withValue(ServerField.PORT, 2222);

    Map<String, Object> encoded = ServerConfigurationCodec.encode(config);

    assertEquals(Map.of("ServerName", "cluster", "Connection", "SFTP", "Port", 2222), encoded);
  }

  @Test
  void decodeRejectsNonMappings() {
    InvalidConfigurationException ex =
        assertThrows(InvalidConfigurationException.class, () -> ServerConfigurationCodec.decode("x"));
    assertTrue(ex.getMessage().contains("String"));
    assertThrows(InvalidConfigurationException.class, () -> ServerConfigurationCodec.decode(null));
  }

  @Test
  void decodeAllKeepsOrderAndNamesOffendingEntry() {
    List<ServerConfiguration> ok =
        ServerConfigurationCodec.decodeAll(
            List.of(Map.of("ServerName", "b"), Map.of("ServerName", "a")));
    assertEquals("b", ok.get(0).name());
    assertEquals("a", ok.get(1).name());

    RestoreException ex =
        assertThrows(
            RestoreException.class,
            () ->
                ServerConfigurationCodec.decodeAll(
                    Arrays.asList(Map.of("ServerName", "a"), Map.of("Port", 1))));
    assertTrue(ex.getMessage().startsWith("Server entry 2:"), ex.getMessage());
  }

  @Test
  void encodeAllSkipsNullRows() {
    List<Map<String, Object>> out =
        ServerConfigurationCodec.encodeAll(
            Arrays.asList(ServerConfiguration.named("a"), null, ServerConfiguration.named("b")));

    assertEquals(List.of(Map.of("ServerName", "a"), Map.of("ServerName", "b")), out);
  }
}
