package cafe.woden.serverregistry.registry;

import cafe.woden.serverregistry.app.UserNotifier;
import cafe.woden.serverregistry.config.PreferenceStore;
import cafe.woden.serverregistry.config.RegistryProperties;
import cafe.woden.serverregistry.config.RestoreException;
import cafe.woden.serverregistry.config.ServerConfigurationCodec;
import cafe.woden.serverregistry.connection.ServerConnection;
import cafe.woden.serverregistry.connection.ServerConnectionFactory;
import cafe.woden.serverregistry.model.ServerConfiguration;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.processors.BehaviorProcessor;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.PatternSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Component;

/**
 * Process-wide registry of configured remote execution servers.
 *
 * <p>This is the single source of truth for the ordered server list. Server names are unique
 * among active entries at all times. Every mutation rewrites the saved list in the {@link
 * PreferenceStore}.
 *
 * <p>The bean is created on first use. Its constructor loads the initial list from, in order of
 * preference: the preference store, the {@code *.cfg} files in the server directory, or the
 * built-in default. {@link #teardown()} runs when the application context closes.
 *
 * <p>Entries live in an arena keyed by {@link ServerHandle}. Removing a server only retires its
 * handle, so entries stay readable through handles callers already hold; they are destroyed at
 * teardown.
 */
@Component
@Lazy
public class ServerRegistry {

  private static final Logger log = LoggerFactory.getLogger(ServerRegistry.class);

  static final String NOTIFY_TITLE = "Server Registry";
  static final String BLANK_NAME_REPLACEMENT = "Server";

  private final PreferenceStore preferences;
  private final ConfigFileLoader fileLoader;
  private final ServerConnectionFactory connectionFactory;
  private final UserNotifier notifier;
  private final Path serverDirectory;
  private final String filePattern;

  private final Map<ServerHandle, ServerEntry> arena = new HashMap<>();
  private final List<ServerHandle> active = new ArrayList<>();
  private final Set<ServerHandle> retired = new LinkedHashSet<>();
  private final BehaviorProcessor<List<String>> updates = BehaviorProcessor.create();

  private long nextHandleId = 1;
  private LoadSource loadSource;
  private boolean tornDown;
  private boolean saveFailureReported;

  public ServerRegistry(
      RegistryProperties props,
      PreferenceStore preferences,
      ConfigFileLoader fileLoader,
      ServerConnectionFactory connectionFactory,
      UserNotifier notifier) {
    Objects.requireNonNull(props, "props");
    this.preferences = Objects.requireNonNull(preferences, "preferences");
    this.fileLoader = Objects.requireNonNull(fileLoader, "fileLoader");
    this.connectionFactory = Objects.requireNonNull(connectionFactory, "connectionFactory");
    this.notifier = Objects.requireNonNull(notifier, "notifier");
    this.serverDirectory = Paths.get(props.serverDirectory());
    this.filePattern = props.filePattern();

    load();
    updates.onNext(namesSnapshot());
  }

  // ==================== Queries ====================

  /** Active server names in display order. */
  public synchronized List<String> listNames() {
    return namesSnapshot();
  }

  /** Active configurations in display order. */
  public synchronized List<ServerConfiguration> servers() {
    List<ServerConfiguration> out = new ArrayList<>(active.size());
    for (ServerHandle h : active) {
      out.add(arena.get(h).configuration());
    }
    return List.copyOf(out);
  }

  public synchronized int size() {
    return active.size();
  }

  /** Exact (whitespace-trimmed) name lookup among active entries. */
  public synchronized Optional<ServerHandle> find(String name) {
    int index = indexOf(name);
    return index >= 0 ? Optional.of(active.get(index)) : Optional.empty();
  }

  /**
   * Resolves a handle, whether its entry is active or retired.
   *
   * <p>Empty once the registry has been torn down.
   */
  public synchronized Optional<ServerEntry> entry(ServerHandle handle) {
    if (handle == null) return Optional.empty();
    return Optional.ofNullable(arena.get(handle));
  }

  public synchronized Optional<ServerConfiguration> configuration(ServerHandle handle) {
    return entry(handle).map(ServerEntry::configuration);
  }

  public synchronized boolean isActive(ServerHandle handle) {
    return handle != null && active.contains(handle);
  }

  public synchronized LoadSource loadSource() {
    return loadSource;
  }

  /** Active-name snapshots, emitted after loading and after every mutation. */
  public Flowable<List<String>> updates() {
    return updates.onBackpressureLatest();
  }

  // ==================== Mutations ====================

  /**
   * Registers a server.
   *
   * <p>A name already in use gets the lowest free numeric suffix: {@code name_1}, {@code name_2},
   * and so on. A blank name is replaced with {@value #BLANK_NAME_REPLACEMENT} first.
   *
   * @return handle of the new entry
   */
  public synchronized ServerHandle add(ServerConfiguration config) {
    checkOpen();
    Objects.requireNonNull(config, "config");

    String name = uniqueName(baseName(config), null);
    ServerHandle handle = append(config.withName(name));
    persistAndEmit();
    log.debug("[server-registry] Added server {} as {}", name, handle);
    return handle;
  }

  /**
   * Replaces the configuration of an active entry. The new name is made unique among the other
   * active entries.
   *
   * <p>A changed configuration gets a fresh connection. The previous one is closed and disposed,
   * and is not reopened.
   *
   * @return false if {@code handle} is not active
   */
  public synchronized boolean update(ServerHandle handle, ServerConfiguration config) {
    checkOpen();
    Objects.requireNonNull(config, "config");
    if (!isActive(handle)) return false;

    ServerEntry entry = arena.get(handle);
    ServerConfiguration updated = config.withName(uniqueName(baseName(config), handle));
    if (!updated.equals(entry.configuration())) {
      ServerConnection previous = entry.replace(updated, connectionFactory.create(updated));
      release(entry.name(), previous);
    }
    persistAndEmit();
    return true;
  }

  /**
   * Retires the active entry with this name. The entry stays readable through existing handles.
   *
   * @return false if no active entry has this name
   */
  public synchronized boolean remove(String name) {
    checkOpen();
    int index = indexOf(name);
    if (index >= 0) retire(index);
    persistAndEmit();
    return index >= 0;
  }

  /**
   * Retires the entry behind {@code handle}.
   *
   * @return false if the handle is not active
   */
  public synchronized boolean remove(ServerHandle handle) {
    checkOpen();
    int index = handle == null ? -1 : active.indexOf(handle);
    if (index >= 0) retire(index);
    persistAndEmit();
    return index >= 0;
  }

  /** @return true if the entry moved; false at the top of the list or for an unknown name */
  public synchronized boolean moveUp(String name) {
    checkOpen();
    int index = indexOf(name);
    boolean moved = index > 0;
    if (moved) Collections.swap(active, index, index - 1);
    persistAndEmit();
    return moved;
  }

  /** @return true if the entry moved; false at the bottom of the list or for an unknown name */
  public synchronized boolean moveDown(String name) {
    checkOpen();
    int index = indexOf(name);
    boolean moved = index >= 0 && index < active.size() - 1;
    if (moved) Collections.swap(active, index, index + 1);
    persistAndEmit();
    return moved;
  }

  // ==================== Connections ====================

  /** Closes every active connection. Failures are logged, never thrown. */
  public synchronized void closeAllConnections() {
    for (ServerHandle h : active) {
      ServerEntry entry = arena.get(h);
      try {
        entry
            .connection()
            .close()
            .subscribe(
                () -> log.debug("[server-registry] Closed connection to {}", entry.name()),
                err ->
                    log.warn(
                        "[server-registry] Error closing connection to {}", entry.name(), err));
      } catch (RuntimeException e) {
        log.warn("[server-registry] Error closing connection to {}", entry.name(), e);
      }
    }
  }

  /** Opens the named servers. Names that are not active are skipped. */
  public synchronized void connectServers(Collection<String> names) {
    if (names == null) return;
    for (String name : names) {
      int index = indexOf(name);
      if (index < 0) {
        log.debug("[server-registry] Not connecting unknown server '{}'", name);
        continue;
      }
      ServerEntry entry = arena.get(active.get(index));
      try {
        entry
            .connection()
            .open()
            .subscribe(
                () -> log.debug("[server-registry] Opened connection to {}", entry.name()),
                err ->
                    log.warn(
                        "[server-registry] Could not open connection to {}", entry.name(), err));
      } catch (RuntimeException e) {
        log.warn("[server-registry] Could not open connection to {}", entry.name(), e);
      }
    }
  }

  private void release(String name, ServerConnection connection) {
    try {
      connection
          .close()
          .subscribe(
              () -> disposeReplaced(name, connection),
              err -> {
                log.warn("[server-registry] Error closing replaced connection to {}", name, err);
                disposeReplaced(name, connection);
              });
    } catch (RuntimeException e) {
      log.warn("[server-registry] Error closing replaced connection to {}", name, e);
      disposeReplaced(name, connection);
    }
  }

  private static void disposeReplaced(String name, ServerConnection connection) {
    try {
      connection.dispose();
      log.debug("[server-registry] Disposed replaced connection to {}", name);
    } catch (RuntimeException e) {
      log.warn("[server-registry] Error disposing replaced connection to {}", name, e);
    }
  }

  // ==================== Lifecycle ====================

  /**
   * Destroys every active and retired entry exactly once and completes {@link #updates()}.
   *
   * <p>Safe to call more than once. Mutations afterwards throw {@link IllegalStateException}.
   */
  @PreDestroy
  public synchronized void teardown() {
    if (tornDown) return;
    tornDown = true;

    int destroyed = 0;
    for (ServerHandle h : active) {
      if (arena.get(h).destroy()) destroyed++;
    }
    for (ServerHandle h : retired) {
      if (arena.get(h).destroy()) destroyed++;
    }
    arena.clear();
    active.clear();
    retired.clear();
    updates.onComplete();

    log.info("[server-registry] Torn down; destroyed {} server entr(ies)", destroyed);
  }

  public synchronized boolean isTornDown() {
    return tornDown;
  }

  // ==================== Load pipeline ====================

  private void load() {
    TierResult restored = restoreFromPreferences();
    if (restored.failed()) {
      notifier.warning(
          NOTIFY_TITLE, "Problem loading servers from preferences file:\n" + restored.failure());
    }
    if (restored.produced()) {
      finishLoad(restored);
      return;
    }

    TierResult scanned = scanServerDirectory();
    if (scanned.produced()) {
      finishLoad(scanned);
      return;
    }

    finishLoad(appendBuiltInDefault());
  }

  private void finishLoad(TierResult result) {
    loadSource = result.source();
    log.info(
        "[server-registry] Loaded {} server(s) from {}: {}",
        result.count(),
        result.source(),
        namesSnapshot());
  }

  private TierResult restoreFromPreferences() {
    List<ServerConfiguration> saved;
    try {
      saved = ServerConfigurationCodec.decodeAll(preferences.readServerConfigurations());
    } catch (RestoreException e) {
      log.warn(
          "[server-registry] Could not restore servers from '{}'",
          preferences.preferencesPath(),
          e);
      return TierResult.failure(LoadSource.PREFERENCES, e.getMessage());
    }

    boolean repaired = false;
    for (ServerConfiguration config : saved) {
      String name = uniqueName(config.name(), null);
      if (!name.equals(config.name())) {
        log.warn(
            "[server-registry] Saved server list contains duplicate name '{}'; renamed to '{}'",
            config.name(),
            name);
        config = config.withName(name);
        repaired = true;
      }
      append(config);
    }
    if (repaired) save();
    return TierResult.success(LoadSource.PREFERENCES, saved.size());
  }

  private TierResult scanServerDirectory() {
    log.debug("[server-registry] Server directory set to: {}", serverDirectory.toAbsolutePath());

    List<Path> files;
    try {
      files = listConfigurationFiles();
    } catch (IOException e) {
      log.warn("[server-registry] Could not list server directory '{}'", serverDirectory, e);
      return TierResult.failure(LoadSource.SERVER_DIRECTORY, e.getMessage());
    } catch (DirectoryIteratorException e) {
      log.warn("[server-registry] Could not list server directory '{}'", serverDirectory, e);
      return TierResult.failure(LoadSource.SERVER_DIRECTORY, e.getCause().getMessage());
    } catch (PatternSyntaxException e) {
      log.warn("[server-registry] Invalid server file pattern '{}'", filePattern, e);
      return TierResult.failure(LoadSource.SERVER_DIRECTORY, e.getMessage());
    }

    int added = 0;
    for (Path file : files) {
      log.debug("[server-registry] Reading server configuration from: {}", file);
      FileLoadResult result = fileLoader.load(file);
      if (!result.succeeded()) {
        log.warn(
            "[server-registry] Skipping {}: {} ({})", file, result.failure(), result.detail());
        continue;
      }
      add(result.configuration());
      added++;
    }
    return TierResult.success(LoadSource.SERVER_DIRECTORY, added);
  }

  private List<Path> listConfigurationFiles() throws IOException {
    if (!Files.isDirectory(serverDirectory)) return List.of();

    List<Path> out = new ArrayList<>();
    try (DirectoryStream<Path> stream = Files.newDirectoryStream(serverDirectory, filePattern)) {
      for (Path p : stream) {
        if (Files.isRegularFile(p)) out.add(p);
      }
    }
    out.sort(Comparator.comparing(p -> p.getFileName().toString()));
    return out;
  }

  private TierResult appendBuiltInDefault() {
    // Not saved, so a later start still picks up newly added configuration files.
    append(ServerConfiguration.defaults());
    return TierResult.success(LoadSource.BUILT_IN_DEFAULT, 1);
  }

  // ==================== Internals ====================

  private ServerHandle append(ServerConfiguration config) {
    ServerHandle handle = new ServerHandle(nextHandleId++);
    arena.put(handle, new ServerEntry(handle, config, connectionFactory.create(config)));
    active.add(handle);
    return handle;
  }

  private void retire(int index) {
    ServerHandle handle = active.remove(index);
    retired.add(handle);
    log.debug("[server-registry] Retired {} ({})", arena.get(handle).name(), handle);
  }

  private int indexOf(String name) {
    String n = Objects.toString(name, "").trim();
    if (n.isEmpty()) return -1;
    return indexOf(n, null);
  }

  private int indexOf(String name, ServerHandle exclude) {
    for (int i = 0; i < active.size(); i++) {
      ServerHandle h = active.get(i);
      if (h.equals(exclude)) continue;
      if (arena.get(h).name().equals(name)) return i;
    }
    return -1;
  }

  private String uniqueName(String base, ServerHandle exclude) {
    String name = base;
    int count = 0;
    while (indexOf(name, exclude) >= 0) {
      count++;
      name = base + "_" + count;
    }
    return name;
  }

  private static String baseName(ServerConfiguration config) {
    String name = config.name().trim();
    return name.isEmpty() ? BLANK_NAME_REPLACEMENT : name;
  }

  private List<String> namesSnapshot() {
    List<String> out = new ArrayList<>(active.size());
    for (ServerHandle h : active) {
      out.add(arena.get(h).name());
    }
    return List.copyOf(out);
  }

  private void persistAndEmit() {
    save();
    updates.onNext(namesSnapshot());
  }

  private void save() {
    List<ServerConfiguration> snapshot = new ArrayList<>(active.size());
    for (ServerHandle h : active) {
      snapshot.add(arena.get(h).configuration());
    }

    if (preferences.writeServerConfigurations(ServerConfigurationCodec.encodeAll(snapshot))) {
      saveFailureReported = false;
      return;
    }
    // One warning per run of failed writes.
    if (!saveFailureReported) {
      saveFailureReported = true;
      notifier.warning(
          NOTIFY_TITLE,
          "Could not save the server list to "
              + preferences.preferencesPath()
              + ". Changes will be lost when the application exits.");
    }
  }

  private void checkOpen() {
    if (tornDown) {
      throw new IllegalStateException("Server registry has been torn down");
    }
  }
}
