package cafe.woden.serverregistry.model;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/** Transport used to reach a remote execution server. */
public enum ConnectionKind {
  LOCAL("Local", 0),
  SSH("SSH", 22),
  SFTP("SFTP", 22),
  HTTP("HTTP", 80),
  HTTPS("HTTPS", 443);

  private final String key;
  private final int defaultPort;

  ConnectionKind(String key, int defaultPort) {
    this.key = key;
    this.defaultPort = defaultPort;
  }

  /** Spelling used in configuration files. */
  public String key() {
    return key;
  }

  public int defaultPort() {
    return defaultPort;
  }

  public static Optional<ConnectionKind> parse(String raw) {
    String s = Objects.toString(raw, "").trim().toLowerCase(Locale.ROOT);
    if (s.isEmpty()) return Optional.empty();
    for (ConnectionKind kind : values()) {
      if (kind.key.toLowerCase(Locale.ROOT).equals(s)) return Optional.of(kind);
    }
    return Optional.empty();
  }
}
