package cafe.woden.serverregistry.parse;

/** A YAML document whose root is a scalar or a sequence. */
public record ScalarNode(Object value) implements DataNode {}
