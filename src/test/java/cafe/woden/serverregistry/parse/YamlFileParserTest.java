package cafe.woden.serverregistry.parse;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cafe.woden.serverregistry.util.NamedThreads;
import io.reactivex.rxjava3.schedulers.Schedulers;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlFileParserTest {

  @TempDir Path tempDir;

  private final YamlFileParser parser = new YamlFileParser(Schedulers.trampoline());

  @Test
  void mappingDocumentBecomesYamlNode() throws Exception {
    Path file = tempDir.resolve("a.cfg");
    Files.writeString(file, "ServerName: A\nPort: 22\n");

    ParsedDocument doc = parser.parse(file).blockingGet();

    assertFalse(doc.hasErrors());
    List<YamlNode> nodes = doc.findData(YamlNode.class);
    assertEquals(1, nodes.size());
    assertEquals(Map.of("ServerName", "A", "Port", 22), nodes.get(0).values());
  }

  @Test
  void multipleDocumentsKeepOrderAndKind() throws Exception {
    Path file = tempDir.resolve("multi.cfg");
    Files.writeString(file, "just a string\n---\nServerName: first\n---\nServerName: second\n");

    ParsedDocument doc = parser.parse(file).blockingGet();

    assertEquals(3, doc.nodes().size());
    assertEquals(List.of(new ScalarNode("just a string")), doc.findData(ScalarNode.class));
    assertEquals("first", doc.findData(YamlNode.class).get(0).values().get("ServerName"));
    assertEquals("second", doc.findData(YamlNode.class).get(1).values().get("ServerName"));
  }

  @Test
  void syntaxErrorIsReportedAndEarlierDocumentsKept() throws Exception {
    Path file = tempDir.resolve("b.cfg");
    Files.writeString(file, "ServerName: ok\n---\nServerName: [broken\n");

    ParsedDocument doc = parser.parse(file).blockingGet();

    assertTrue(doc.hasErrors());
    assertTrue(doc.errors().get(0).startsWith("b.cfg: "));
    assertEquals(1, doc.findData(YamlNode.class).size());
  }

  @Test
  void missingFileIsAnErrorNotAFailure() {
    ParsedDocument doc = parser.parse(tempDir.resolve("missing.cfg")).blockingGet();

    assertTrue(doc.hasErrors());
    assertTrue(doc.nodes().isEmpty());
  }

  @Test
  void parsesOnTheParserScheduler() throws Exception {
    Path file = tempDir.resolve("a.cfg");
    Files.writeString(file, "ServerName: A\n");
    ExecutorService executor = NamedThreads.newSingleThreadExecutor("parser-test");
    try {
      YamlFileParser threaded = new YamlFileParser(Schedulers.from(executor));

      String thread =
          threaded.parse(file).map(doc -> Thread.currentThread().getName()).blockingGet();

      assertTrue(thread.startsWith("parser-test-"), thread);
    } finally {
      executor.shutdownNow();
    }
  }
}
