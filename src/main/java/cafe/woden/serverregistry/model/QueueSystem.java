package cafe.woden.serverregistry.model;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/** Batch queue system running on the server. */
public enum QueueSystem {
  BASIC("Basic"),
  PBS("PBS"),
  SGE("SGE"),
  SLURM("SLURM"),
  WEB("Web");

  private final String key;

  QueueSystem(String key) {
    this.key = key;
  }

  public String key() {
    return key;
  }

  public static Optional<QueueSystem> parse(String raw) {
    String s = Objects.toString(raw, "").trim().toLowerCase(Locale.ROOT);
    if (s.isEmpty()) return Optional.empty();
    for (QueueSystem q : values()) {
      if (q.key.toLowerCase(Locale.ROOT).equals(s)) return Optional.of(q);
    }
    return Optional.empty();
  }
}
