package cafe.woden.serverregistry.parse;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** A YAML document whose root is a mapping. Keys are stringified; values are left as parsed. */
public record YamlNode(Map<String, Object> values) implements DataNode {

  public YamlNode {
    Map<String, Object> copy = new LinkedHashMap<>();
    if (values != null) {
      for (Map.Entry<String, Object> e : values.entrySet()) {
        copy.put(Objects.toString(e.getKey(), ""), e.getValue());
      }
    }
    values = Collections.unmodifiableMap(copy);
  }

  public static YamlNode of(Map<?, ?> raw) {
    Map<String, Object> m = new LinkedHashMap<>();
    for (Map.Entry<?, ?> e : raw.entrySet()) {
      m.put(Objects.toString(e.getKey(), ""), e.getValue());
    }
    return new YamlNode(m);
  }
}
