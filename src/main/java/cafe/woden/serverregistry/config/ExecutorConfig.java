package cafe.woden.serverregistry.config;

import cafe.woden.serverregistry.util.NamedThreads;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.schedulers.Schedulers;
import java.util.concurrent.ExecutorService;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * App-owned executors.
 *
 * <p>Spring owns creation and shutdown.
 */
@Configuration
public class ExecutorConfig {
  public static final String PARSER_EXECUTOR = "registryParserExecutor";
  public static final String PARSER_SCHEDULER = "registryParserScheduler";

  @Bean(name = PARSER_EXECUTOR, destroyMethod = "shutdown")
  public ExecutorService registryParserExecutor() {
    return NamedThreads.newSingleThreadExecutor("server-registry-parser");
  }

  @Bean(name = PARSER_SCHEDULER)
  public Scheduler registryParserScheduler(@Qualifier(PARSER_EXECUTOR) ExecutorService executor) {
    return Schedulers.from(executor);
  }
}
