package cafe.woden.serverregistry.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Known attributes of a {@link ServerConfiguration}.
 *
 * <p>Each field knows its configuration-file key, its value type and how to coerce a raw value
 * (as read from YAML) into that type.
 */
public enum ServerField {
  SERVER_NAME("ServerName", String.class, 0, 0),
  CONNECTION("Connection", ConnectionKind.class, 0, 0),
  QUEUE_SYSTEM("QueueSystem", QueueSystem.class, 0, 0),
  HOST_ADDRESS("HostAddress", String.class, 0, 0),
  PORT("Port", Integer.class, 0, 65535),
  AUTHENTICATION("Authentication", Authentication.class, 0, 0),
  USER_NAME("UserName", String.class, 0, 0),
  WORKING_DIRECTORY("WorkingDirectory", String.class, 0, 0),
  // 0 means "no limit"
  JOB_LIMIT("JobLimit", Integer.class, 0, Integer.MAX_VALUE),
  UPDATE_INTERVAL("UpdateInterval", Integer.class, 1, Integer.MAX_VALUE);

  private final String key;
  private final Class<?> type;
  private final int min;
  private final int max;

  ServerField(String key, Class<?> type, int min, int max) {
    this.key = key;
    this.type = type;
    this.min = min;
    this.max = max;
  }

  public String key() {
    return key;
  }

  public static Optional<ServerField> forKey(String key) {
    String k = Objects.toString(key, "").trim();
    for (ServerField f : values()) {
      if (f.key.equalsIgnoreCase(k)) return Optional.of(f);
    }
    return Optional.empty();
  }

  /**
   * Converts a raw attribute value into this field's type.
   *
   * @throws InvalidConfigurationException if the value cannot be represented
   */
  public Object coerce(Object raw) {
    if (raw == null) {
      throw new InvalidConfigurationException(key + " has no value");
    }
    if (type == String.class) {
      return raw.toString().trim();
    }
    if (type == Integer.class) {
      return coerceInt(raw);
    }
    if (type.isInstance(raw)) {
      return raw;
    }

    String s = raw.toString();
    Optional<?> parsed;
    if (type == ConnectionKind.class) {
      parsed = ConnectionKind.parse(s);
    } else if (type == QueueSystem.class) {
      parsed = QueueSystem.parse(s);
    } else {
      parsed = Authentication.parse(s);
    }
    return parsed.orElseThrow(
        () -> new InvalidConfigurationException("Unrecognized " + key + ": '" + s + "'"));
  }

  /** Converts a typed value back into the form written to configuration files. */
  public Object encode(Object value) {
    if (value instanceof ConnectionKind c) return c.key();
    if (value instanceof QueueSystem q) return q.key();
    if (value instanceof Authentication a) return a.key();
    return value;
  }

  private Integer coerceInt(Object raw) {
    long v;
    if (raw instanceof BigInteger || raw instanceof BigDecimal) {
      // SnakeYAML yields BigInteger for literals beyond the long range.
      BigDecimal d = new BigDecimal(raw.toString());
      if (d.signum() != 0 && d.stripTrailingZeros().scale() > 0) {
        throw new InvalidConfigurationException(key + " must be a whole number: " + raw);
      }
      if (d.compareTo(BigDecimal.valueOf(min)) < 0 || d.compareTo(BigDecimal.valueOf(max)) > 0) {
        throw new InvalidConfigurationException(
            String.format(Locale.ROOT, "%s out of range [%d, %d]: %s", key, min, max, raw));
      }
      return d.intValueExact();
    } else if (raw instanceof Number n) {
      if (n.doubleValue() != Math.rint(n.doubleValue())) {
        throw new InvalidConfigurationException(key + " must be a whole number: " + raw);
      }
      v = n.longValue();
    } else {
      String s = raw.toString().trim();
      try {
        v = Long.parseLong(s);
      } catch (NumberFormatException e) {
        throw new InvalidConfigurationException(key + " must be a number: '" + s + "'", e);
      }
    }
    if (v < min || v > max) {
      throw new InvalidConfigurationException(
          String.format(Locale.ROOT, "%s out of range [%d, %d]: %d", key, min, max, v));
    }
    return (int) v;
  }
}
