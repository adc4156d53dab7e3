package cafe.woden.serverregistry.model;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * How credentials for a server are obtained.
 *
 * <p>Only the kind is stored. Secrets themselves never pass through the registry.
 */
public enum Authentication {
  NONE("None"),
  AGENT("Agent"),
  PUBLIC_KEY("PublicKey"),
  HOST_BASED("HostBased"),
  KEYBOARD_INTERACTIVE("KeyboardInteractive"),
  PASSWORD("Password");

  private final String key;

  Authentication(String key) {
    this.key = key;
  }

  public String key() {
    return key;
  }

  public static Optional<Authentication> parse(String raw) {
    String s = Objects.toString(raw, "").trim().toLowerCase(Locale.ROOT);
    if (s.isEmpty()) return Optional.empty();
    for (Authentication a : values()) {
      if (a.key.toLowerCase(Locale.ROOT).equals(s)) return Optional.of(a);
    }
    return Optional.empty();
  }
}
