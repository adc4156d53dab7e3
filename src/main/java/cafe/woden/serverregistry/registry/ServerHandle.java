package cafe.woden.serverregistry.registry;

/**
 * Non-owning reference to a registry entry.
 *
 * <p>Holding a handle never keeps an entry alive and never lets the holder destroy it. Look the
 * entry up through {@link ServerRegistry#entry(ServerHandle)} each time it is needed.
 */
public record ServerHandle(long id) {

  @Override
  public String toString() {
    return "server#" + id;
  }
}
