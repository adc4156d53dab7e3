package cafe.woden.serverregistry.model;

/** Raised when a set of attributes cannot be turned into a {@link ServerConfiguration}. */
public class InvalidConfigurationException extends RuntimeException {

  public InvalidConfigurationException(String message) {
    super(message);
  }

  public InvalidConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
