package cafe.woden.serverregistry.registry;

import cafe.woden.serverregistry.config.ServerConfigurationCodec;
import cafe.woden.serverregistry.model.InvalidConfigurationException;
import cafe.woden.serverregistry.model.ServerConfiguration;
import cafe.woden.serverregistry.parse.ParsedDocument;
import cafe.woden.serverregistry.parse.StructuredFileParser;
import cafe.woden.serverregistry.parse.YamlNode;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads a single server configuration file.
 *
 * <p>{@link #load(Path)} blocks the calling thread until the parser has finished; this is the
 * only suspension point in registry loading. There is no timeout.
 */
@Component
public class ConfigFileLoader {

  private static final Logger log = LoggerFactory.getLogger(ConfigFileLoader.class);

  private final StructuredFileParser parser;

  public ConfigFileLoader(StructuredFileParser parser) {
    this.parser = Objects.requireNonNull(parser, "parser");
  }

  public FileLoadResult load(Path file) {
    Objects.requireNonNull(file, "file");

    try (InputStream in = Files.newInputStream(file)) {
      log.trace("[server-registry] Opened {} ({} byte(s) available)", file, in.available());
    } catch (IOException e) {
      log.error("[server-registry] Server configuration file cannot be read: {}", file, e);
      return FileLoadResult.failure(
          file, FileLoadResult.Failure.FILE_UNREADABLE, Objects.toString(e.getMessage(), "unreadable"));
    }

    ParsedDocument doc;
    try {
      doc = parser.parse(file).blockingGet();
    } catch (RuntimeException e) {
      log.error("[server-registry] Parser failed on {}", file, e);
      return FileLoadResult.failure(
          file, FileLoadResult.Failure.PARSE_FAILURE, Objects.toString(e.getMessage(), "parser failed"));
    }

    if (doc.hasErrors()) {
      log.error("[server-registry] Errors parsing {}:\n{}", file, String.join("\n", doc.errors()));
    }

    List<YamlNode> yaml = doc.findData(YamlNode.class);
    if (yaml.isEmpty()) {
      String detail =
          doc.hasErrors() ? String.join("; ", doc.errors()) : "no configuration mapping found";
      return FileLoadResult.failure(file, FileLoadResult.Failure.PARSE_FAILURE, detail);
    }

    try {
      ServerConfiguration config = ServerConfigurationCodec.decode(yaml.get(0).values());
      log.debug("[server-registry] Read {} from {}", config, file);
      return FileLoadResult.success(file, config);
    } catch (InvalidConfigurationException e) {
      log.error("[server-registry] Invalid server configuration in {}: {}", file, e.getMessage());
      return FileLoadResult.failure(
          file, FileLoadResult.Failure.INVALID_CONFIGURATION, e.getMessage());
    }
  }
}
