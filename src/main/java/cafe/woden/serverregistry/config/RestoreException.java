package cafe.woden.serverregistry.config;

/** Saved server configurations could not be read back from the preference store. */
public class RestoreException extends RuntimeException {

  public RestoreException(String message) {
    super(message);
  }

  public RestoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
