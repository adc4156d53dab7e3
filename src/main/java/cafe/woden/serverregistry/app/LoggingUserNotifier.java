package cafe.woden.serverregistry.app;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Headless {@link UserNotifier}: user-facing warnings go to the log. */
@Component
public class LoggingUserNotifier implements UserNotifier {
  private static final Logger log = LoggerFactory.getLogger(LoggingUserNotifier.class);

  @Override
  public void warning(String title, String message) {
    log.warn("[server-registry] {}: {}", title, message);
  }
}
