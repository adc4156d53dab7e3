package cafe.woden.serverregistry.util;

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/** Daemon thread factories with readable names, so stack dumps show who owns a thread. */
public final class NamedThreads {

  private NamedThreads() {}

  public static ThreadFactory namedFactory(String baseName) {
    String base = normalize(baseName);
    AtomicInteger counter = new AtomicInteger(1);
    return task -> {
      Thread t = new Thread(task, base + "-" + counter.getAndIncrement());
      t.setDaemon(true);
      return t;
    };
  }

  public static ExecutorService newSingleThreadExecutor(String baseName) {
    return Executors.newSingleThreadExecutor(namedFactory(baseName));
  }

  private static String normalize(String name) {
    String s = Objects.toString(name, "").trim();
    return s.isEmpty() ? "server-registry" : s;
  }
}
