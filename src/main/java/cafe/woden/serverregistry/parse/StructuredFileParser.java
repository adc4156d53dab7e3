package cafe.woden.serverregistry.parse;

import io.reactivex.rxjava3.core.Single;
import java.nio.file.Path;

/**
 * Parses a structured file into a {@link ParsedDocument}.
 *
 * <p>Parsing is asynchronous. Problems in the file are reported through {@link
 * ParsedDocument#errors()}; the returned {@link Single} only fails on unexpected errors.
 */
public interface StructuredFileParser {
  Single<ParsedDocument> parse(Path file);
}
