package cafe.woden.serverregistry.registry;

/** Where the registry's initial entries came from. */
public enum LoadSource {
  PREFERENCES,
  SERVER_DIRECTORY,
  BUILT_IN_DEFAULT
}
