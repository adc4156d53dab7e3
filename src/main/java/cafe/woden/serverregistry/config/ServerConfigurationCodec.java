package cafe.woden.serverregistry.config;

import cafe.woden.serverregistry.model.InvalidConfigurationException;
import cafe.woden.serverregistry.model.ServerConfiguration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Converts {@link ServerConfiguration}s to and from the plain maps stored under {@code
 * registry.servers} and found in {@code *.cfg} files.
 */
public final class ServerConfigurationCodec {

  private ServerConfigurationCodec() {}

  public static Map<String, Object> encode(ServerConfiguration config) {
    Objects.requireNonNull(config, "config");
    return new LinkedHashMap<>(config.toAttributes());
  }

  public static List<Map<String, Object>> encodeAll(List<ServerConfiguration> configs) {
    List<Map<String, Object>> out = new ArrayList<>();
    if (configs == null) return out;
    for (ServerConfiguration c : configs) {
      if (c == null) continue;
      out.add(encode(c));
    }
    return out;
  }

  /**
   * Decodes one raw YAML value.
   *
   * @throws InvalidConfigurationException if {@code raw} is not a mapping or does not describe a
   *     valid configuration
   */
  public static ServerConfiguration decode(Object raw) {
    if (!(raw instanceof Map<?, ?> m)) {
      String kind = raw == null ? "null" : raw.getClass().getSimpleName();
      throw new InvalidConfigurationException("Expected a mapping of attributes but found " + kind);
    }
    Map<String, Object> attrs = new LinkedHashMap<>();
    for (Map.Entry<?, ?> e : m.entrySet()) {
      attrs.put(Objects.toString(e.getKey(), ""), e.getValue());
    }
    return ServerConfiguration.fromAttributes(attrs);
  }

  /**
   * Decodes a saved list in order.
   *
   * @throws RestoreException naming the offending position if any element fails to decode
   */
  public static List<ServerConfiguration> decodeAll(List<?> raw) {
    List<ServerConfiguration> out = new ArrayList<>();
    if (raw == null) return out;
    for (int i = 0; i < raw.size(); i++) {
      try {
        out.add(decode(raw.get(i)));
      } catch (InvalidConfigurationException e) {
        throw new RestoreException("Server entry " + (i + 1) + ": " + e.getMessage(), e);
      }
    }
    return out;
  }
}
