package cafe.woden.serverregistry.config;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Server registry configuration.
 *
 * <p>Example YAML:
 * <pre>
 * registry:
 *   server-directory: /opt/servers
 *   file-pattern: "*.cfg"
 *   connect-on-start: [cluster, workstation]
 * </pre>
 */
@ConfigurationProperties(prefix = "registry")
public record RegistryProperties(
    String serverDirectory, String filePattern, List<String> connectOnStart) {

  public static final String DEFAULT_FILE_PATTERN = "*.cfg";

  public RegistryProperties {
    if (serverDirectory == null || serverDirectory.isBlank()) {
      serverDirectory = System.getProperty("user.home") + "/.config/server-registry/servers";
    }
    if (filePattern == null || filePattern.isBlank()) {
      filePattern = DEFAULT_FILE_PATTERN;
    }
    if (connectOnStart == null) {
      connectOnStart = List.of();
    }
  }
}
