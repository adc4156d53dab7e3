package cafe.woden.serverregistry.parse;

import cafe.woden.serverregistry.config.ExecutorConfig;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.core.Single;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * SnakeYAML-backed parser. Multi-document files yield one node per document.
 *
 * <p>Work runs on the parser scheduler, never on the subscriber's thread.
 */
@Component
public class YamlFileParser implements StructuredFileParser {

  private static final Logger log = LoggerFactory.getLogger(YamlFileParser.class);

  private final Scheduler scheduler;

  public YamlFileParser(@Qualifier(ExecutorConfig.PARSER_SCHEDULER) Scheduler scheduler) {
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
  }

  @Override
  public Single<ParsedDocument> parse(Path file) {
    Objects.requireNonNull(file, "file");
    return Single.fromCallable(() -> parseNow(file)).subscribeOn(scheduler);
  }

  private ParsedDocument parseNow(Path file) {
    List<DataNode> nodes = new ArrayList<>();
    List<String> errors = new ArrayList<>();

    // Yaml instances are not thread-safe.
    Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
    try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      for (Object doc : yaml.loadAll(r)) {
        if (doc == null) continue;
        if (doc instanceof Map<?, ?> m) {
          nodes.add(YamlNode.of(m));
        } else {
          nodes.add(new ScalarNode(doc));
        }
      }
    } catch (YAMLException e) {
      errors.add(file.getFileName() + ": " + e.getMessage());
    } catch (IOException e) {
      errors.add(file.getFileName() + ": could not read file: " + e.getMessage());
    }

    log.debug(
        "[server-registry] parsed {} ({} node(s), {} error(s))", file, nodes.size(), errors.size());
    return new ParsedDocument(file, nodes, errors);
  }
}
