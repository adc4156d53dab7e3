package cafe.woden.serverregistry.registry;

import java.util.Objects;

/** Outcome of one load tier. A failed tier contributed no entries. */
record TierResult(LoadSource source, int count, String failure) {

  TierResult {
    Objects.requireNonNull(source, "source");
  }

  static TierResult success(LoadSource source, int count) {
    return new TierResult(source, count, null);
  }

  static TierResult failure(LoadSource source, String reason) {
    return new TierResult(source, 0, Objects.toString(reason, "unknown error"));
  }

  boolean failed() {
    return failure != null;
  }

  boolean produced() {
    return count > 0;
  }
}
