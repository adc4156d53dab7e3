package cafe.woden.serverregistry.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Named attribute set describing one remote execution server.
 *
 * <p>Immutable. Known attributes ({@link ServerField}) are stored in their typed form; attributes
 * this version does not know about are kept verbatim so they survive a load/save cycle. Attributes
 * that were never set report their default.
 */
public final class ServerConfiguration {

  public static final String DEFAULT_NAME = "Local";

  private final Map<String, Object> values;

  private ServerConfiguration(Map<String, Object> values) {
    this.values = Collections.unmodifiableMap(values);
  }

  /** A configuration with only a name; everything else is defaulted. */
  public static ServerConfiguration named(String name) {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put(ServerField.SERVER_NAME.key(), Objects.toString(name, "").trim());
    return new ServerConfiguration(m);
  }

  /** The built-in server used when nothing else is configured. */
  public static ServerConfiguration defaults() {
    return named(DEFAULT_NAME)
        .withValue(ServerField.CONNECTION, ConnectionKind.LOCAL)
        .withValue(ServerField.HOST_ADDRESS, "localhost")
        .withValue(ServerField.QUEUE_SYSTEM, QueueSystem.BASIC);
  }

  /**
   * Builds a configuration from raw attributes, as read from a configuration file or the
   * preference store.
   *
   * @throws InvalidConfigurationException if {@code ServerName} is missing or blank, or a known
   *     attribute has a value of the wrong shape
   */
  public static ServerConfiguration fromAttributes(Map<String, ?> attributes) {
    if (attributes == null) {
      throw new InvalidConfigurationException("No attributes");
    }
    Map<String, Object> m = new LinkedHashMap<>();
    for (Map.Entry<String, ?> e : attributes.entrySet()) {
      String key = Objects.toString(e.getKey(), "").trim();
      if (key.isEmpty()) continue;
      ServerField field = ServerField.forKey(key).orElse(null);
      if (field == null) {
        m.put(key, e.getValue());
      } else {
        m.put(field.key(), field.coerce(e.getValue()));
      }
    }

    Object name = m.get(ServerField.SERVER_NAME.key());
    if (name == null || name.toString().isBlank()) {
      throw new InvalidConfigurationException(ServerField.SERVER_NAME.key() + " is required");
    }
    return new ServerConfiguration(m);
  }

  /** Serializable form: known attributes with enums written as their keys, then extras. */
  public Map<String, Object> toAttributes() {
    Map<String, Object> out = new LinkedHashMap<>();
    for (Map.Entry<String, Object> e : values.entrySet()) {
      Object v = ServerField.forKey(e.getKey()).map(f -> f.encode(e.getValue())).orElse(e.getValue());
      out.put(e.getKey(), v);
    }
    return out;
  }

  public String name() {
    return Objects.toString(values.get(ServerField.SERVER_NAME.key()), "");
  }

  public boolean isSet(ServerField field) {
    return values.containsKey(field.key());
  }

  /** Typed value of {@code field}, or its default when not set. */
  public Object value(ServerField field) {
    Object v = values.get(field.key());
    return v != null ? v : defaultValue(field);
  }

  public ConnectionKind connection() {
    return (ConnectionKind) value(ServerField.CONNECTION);
  }

  public QueueSystem queueSystem() {
    return (QueueSystem) value(ServerField.QUEUE_SYSTEM);
  }

  public Authentication authentication() {
    return (Authentication) value(ServerField.AUTHENTICATION);
  }

  public String hostAddress() {
    return (String) value(ServerField.HOST_ADDRESS);
  }

  public int port() {
    return (Integer) value(ServerField.PORT);
  }

  public String userName() {
    return (String) value(ServerField.USER_NAME);
  }

  public String workingDirectory() {
    return (String) value(ServerField.WORKING_DIRECTORY);
  }

  public int jobLimit() {
    return (Integer) value(ServerField.JOB_LIMIT);
  }

  public int updateIntervalSeconds() {
    return (Integer) value(ServerField.UPDATE_INTERVAL);
  }

  /** Attributes that are not {@link ServerField}s. */
  public Map<String, Object> extras() {
    Map<String, Object> out = new LinkedHashMap<>();
    for (Map.Entry<String, Object> e : values.entrySet()) {
      if (ServerField.forKey(e.getKey()).isEmpty()) out.put(e.getKey(), e.getValue());
    }
    return Collections.unmodifiableMap(out);
  }

  public ServerConfiguration withValue(ServerField field, Object value) {
    Objects.requireNonNull(field, "field");
    Map<String, Object> m = new LinkedHashMap<>(values);
    m.put(field.key(), field.coerce(value));
    return new ServerConfiguration(m);
  }

  public ServerConfiguration withName(String name) {
    Map<String, Object> m = new LinkedHashMap<>(values);
    m.put(ServerField.SERVER_NAME.key(), Objects.toString(name, "").trim());
    return new ServerConfiguration(m);
  }

  private Object defaultValue(ServerField field) {
    return switch (field) {
      case SERVER_NAME, USER_NAME -> "";
      case CONNECTION -> ConnectionKind.LOCAL;
      case QUEUE_SYSTEM -> QueueSystem.BASIC;
      case HOST_ADDRESS -> "localhost";
      case PORT -> connection().defaultPort();
      case AUTHENTICATION -> Authentication.NONE;
      case WORKING_DIRECTORY -> "~/";
      case JOB_LIMIT -> 1024;
      case UPDATE_INTERVAL -> 20;
    };
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof ServerConfiguration other)) return false;
    return values.equals(other.values);
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return "ServerConfiguration" + toAttributes();
  }
}
