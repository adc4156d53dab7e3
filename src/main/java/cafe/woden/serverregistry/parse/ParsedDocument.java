package cafe.woden.serverregistry.parse;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Result of parsing one file.
 *
 * <p>Errors do not imply an empty document: a parser keeps whatever it read before the first
 * error.
 */
public record ParsedDocument(Path source, List<DataNode> nodes, List<String> errors) {

  public ParsedDocument {
    Objects.requireNonNull(source, "source");
    nodes = nodes == null ? List.of() : List.copyOf(nodes);
    errors = errors == null ? List.of() : List.copyOf(errors);
  }

  public boolean hasErrors() {
    return !errors.isEmpty();
  }

  /** All nodes of the given kind, in document order. */
  public <T extends DataNode> List<T> findData(Class<T> kind) {
    List<T> out = new ArrayList<>();
    for (DataNode n : nodes) {
      if (kind.isInstance(n)) out.add(kind.cast(n));
    }
    return out;
  }
}
