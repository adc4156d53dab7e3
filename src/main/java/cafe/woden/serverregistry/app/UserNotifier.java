package cafe.woden.serverregistry.app;

/**
 * User-visible error surface.
 *
 * <p>Implementations decide how to present messages (dialog, status bar, log). Calls may come
 * from any thread.
 */
public interface UserNotifier {

  void warning(String title, String message);
}
