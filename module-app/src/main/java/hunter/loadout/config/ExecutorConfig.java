package hunter.loadout.config;

import hunter.loadout.infrastructure.executor.DefaultLogicExecutor;
import hunter.loadout.infrastructure.executor.LogicExecutor;
import hunter.loadout.infrastructure.executor.policy.LoggingPolicy;
import hunter.loadout.infrastructure.executor.strategy.ExceptionTranslator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ExecutorConfig {

  @Bean
  public LoggingPolicy loggingPolicy(OptimizerProperties properties) {
    return new LoggingPolicy(properties.getSlowThreshold());
  }

  @Bean
  public LogicExecutor logicExecutor(LoggingPolicy loggingPolicy) {
    return new DefaultLogicExecutor(ExceptionTranslator.defaultTranslator(), loggingPolicy);
  }
}
