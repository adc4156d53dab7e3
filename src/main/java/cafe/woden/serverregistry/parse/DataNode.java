package cafe.woden.serverregistry.parse;

/** One top-level item produced by a {@link StructuredFileParser}. */
public interface DataNode {}
