package cafe.woden.serverregistry.config;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * YAML-backed user preferences.
 *
 * <p>The server list lives in a single list-valued slot, {@code registry.servers}. Everything else
 * in the file is left as found when the slot is rewritten.
 */
@Component
public class PreferenceStore {

  private static final Logger log = LoggerFactory.getLogger(PreferenceStore.class);

  static final String ROOT_KEY = "registry";
  static final String SERVERS_KEY = "servers";

  private final Path file;
  private final Yaml yaml;

  public PreferenceStore(
      @Value("${registry.preferences-file:${user.home}/.config/server-registry/preferences.yml}")
          String filePath) {
    this.file = Paths.get(Objects.requireNonNullElse(filePath, "").trim());

    DumperOptions opts = new DumperOptions();
    opts.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
    opts.setPrettyFlow(true);
    opts.setIndent(2);
    // SnakeYAML requires indicatorIndent < indent.
    opts.setIndicatorIndent(1);
    opts.setDefaultScalarStyle(DumperOptions.ScalarStyle.PLAIN);
    this.yaml = new Yaml(opts);
  }

  public Path preferencesPath() {
    return file;
  }

  /**
   * Reads the saved server list, one raw attribute map per server, in saved order.
   *
   * <p>A missing file or missing slot is an empty list.
   *
   * @throws RestoreException if the file exists but cannot be read or parsed, or the slot is not
   *     a list
   */
  public synchronized List<Object> readServerConfigurations() {
    if (file.toString().isBlank() || !Files.exists(file)) return List.of();

    Map<String, Object> doc;
    try {
      doc = loadFile();
    } catch (IOException | YAMLException e) {
      throw new RestoreException("Could not read " + file + ": " + e.getMessage(), e);
    }

    Object root = doc.get(ROOT_KEY);
    if (root == null) return List.of();
    if (!(root instanceof Map<?, ?> registry)) {
      throw new RestoreException("'" + ROOT_KEY + "' in " + file + " is not a mapping");
    }

    Object servers = registry.get(SERVERS_KEY);
    if (servers == null) return List.of();
    if (!(servers instanceof List<?> list)) {
      throw new RestoreException(
          "'" + ROOT_KEY + "." + SERVERS_KEY + "' in " + file + " is not a list");
    }
    return new ArrayList<>(list);
  }

  /**
   * Overwrites the saved server list.
   *
   * @return false if the file could not be written; the failure is logged
   */
  public synchronized boolean writeServerConfigurations(List<Map<String, Object>> servers) {
    try {
      if (file.toString().isBlank()) return false;

      Map<String, Object> doc = readForUpdate();
      Map<String, Object> registry = getOrCreateMap(doc, ROOT_KEY);

      List<Map<String, Object>> out = new ArrayList<>();
      if (servers != null) {
        for (Map<String, Object> s : servers) {
          if (s == null) continue;
          out.add(new LinkedHashMap<>(s));
        }
      }

      registry.put(SERVERS_KEY, out);
      writeFile(doc);
      return true;
    } catch (Exception e) {
      log.warn("[server-registry] Could not persist servers list to '{}'", file, e);
      return false;
    }
  }

  private Map<String, Object> readForUpdate() throws IOException {
    if (!Files.exists(file)) return new LinkedHashMap<>();
    try {
      return loadFile();
    } catch (YAMLException e) {
      // The server list is about to be replaced anyway; start from an empty document.
      log.warn("[server-registry] Replacing unparseable preferences file '{}'", file, e);
      return new LinkedHashMap<>();
    }
  }

  @SuppressWarnings("unchecked")
  private Map<String, Object> loadFile() throws IOException {
    try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      Object o = yaml.load(r);
      if (o instanceof Map<?, ?> m) {
        return (Map<String, Object>) m;
      }
      return new LinkedHashMap<>();
    }
  }

  private void writeFile(Map<String, Object> doc) throws IOException {
    Path parent = file.getParent();
    if (parent != null && !Files.exists(parent)) {
      Files.createDirectories(parent);
    }
    try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
      yaml.dump(doc, w);
    }
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> getOrCreateMap(Map<String, Object> parent, String key) {
    Object o = parent.get(key);
    if (o instanceof Map<?, ?> m) return (Map<String, Object>) m;
    Map<String, Object> created = new LinkedHashMap<>();
    parent.put(key, created);
    return created;
  }
}
