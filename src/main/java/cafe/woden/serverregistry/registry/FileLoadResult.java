package cafe.woden.serverregistry.registry;

import cafe.woden.serverregistry.model.ServerConfiguration;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/** Outcome of reading one server configuration file. */
public record FileLoadResult(
    Path file, ServerConfiguration configuration, Failure failure, String detail) {

  public enum Failure {
    /** The file could not be opened; the parser was not run. */
    FILE_UNREADABLE,
    /** The parser produced no mapping document. */
    PARSE_FAILURE,
    /** A mapping was found but it is not a valid server configuration. */
    INVALID_CONFIGURATION
  }

  public FileLoadResult {
    Objects.requireNonNull(file, "file");
    if ((configuration == null) == (failure == null)) {
      throw new IllegalArgumentException("exactly one of configuration or failure is required");
    }
  }

  public static FileLoadResult success(Path file, ServerConfiguration configuration) {
    return new FileLoadResult(file, Objects.requireNonNull(configuration, "configuration"), null, null);
  }

  public static FileLoadResult failure(Path file, Failure failure, String detail) {
    return new FileLoadResult(file, null, Objects.requireNonNull(failure, "failure"), detail);
  }

  public boolean succeeded() {
    return configuration != null;
  }

  public Optional<ServerConfiguration> config() {
    return Optional.ofNullable(configuration);
  }
}
