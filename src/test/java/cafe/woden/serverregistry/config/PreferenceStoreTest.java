package cafe.woden.serverregistry.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PreferenceStoreTest {

  @TempDir Path tempDir;

  @Test
  void missingFileReadsAsEmptyList() {
    PreferenceStore store = new PreferenceStore(tempDir.resolve("nope.yml").toString());

    assertEquals(List.of(), store.readServerConfigurations());
  }

  @Test
  void writtenServersReadBackInOrder() throws Exception {
    Path cfg = tempDir.resolve("nested/prefs.yml");
    PreferenceStore store = new PreferenceStore(cfg.toString());

    assertTrue(
        store.writeServerConfigurations(
            List.of(
                Map.of("ServerName", "b", "Port", 22),
                Map.of("ServerName", "a"))));

    assertEquals(
        List.of(Map.of("ServerName", "b", "Port", 22), Map.of("ServerName", "a")),
        store.readServerConfigurations());
    String yaml = Files.readString(cfg);
    assertTrue(yaml.contains("registry:"));
    assertTrue(yaml.contains("servers:"));
  }

  @Test
  void rewritingServersKeepsOtherKeys() throws Exception {
    Path cfg = tempDir.resolve("prefs.yml");
    Files.writeString(cfg, "ui:\n  theme: dark\nregistry:\n  servers: []\n  lastUsed: a\n");
    PreferenceStore store = new PreferenceStore(cfg.toString());

    store.writeServerConfigurations(List.of(Map.of("ServerName", "a")));

    String yaml = Files.readString(cfg);
    assertTrue(yaml.contains("theme: dark"));
    assertTrue(yaml.contains("lastUsed: a"));
    assertEquals(List.of(Map.of("ServerName", "a")), store.readServerConfigurations());
  }

  @Test
  void slotOfWrongShapeOrUnparseableFileFailsRestore() throws Exception {
    Path wrongShape = tempDir.resolve("shape.yml");
    Files.writeString(wrongShape, "registry:\n  servers: nope\n");
    assertThrows(
        RestoreException.class,
        () -> new PreferenceStore(wrongShape.toString()).readServerConfigurations());

    Path broken = tempDir.resolve("broken.yml");
    Files.writeString(broken, "registry: [unclosed\n");
    assertThrows(
        RestoreException.class,
        () -> new PreferenceStore(broken.toString()).readServerConfigurations());
  }

  @Test
  void writeFailureIsReportedAsFalse() {
    // A directory cannot be written as a file.
    PreferenceStore store = new PreferenceStore(tempDir.toString());

    assertFalse(store.writeServerConfigurations(List.of(Map.of("ServerName", "a"))));
  }
}
