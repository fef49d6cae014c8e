package com.flamingo.ai.rapiddocs.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Executors used by the generation pipeline. */
@Configuration
public class AsyncConfig {

  /** Bounded pool for concurrent illustration requests within a batch. */
  @Bean(name = "illustrationExecutor")
  public Executor illustrationExecutor(GenerationConfig generationConfig) {
    int batchSize = Math.max(1, generationConfig.getIllustrations().getBatchSize());
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(batchSize);
    executor.setMaxPoolSize(batchSize * 2);
    executor.setQueueCapacity(50);
    executor.setThreadNamePrefix("illustration-");
    executor.initialize();
    return executor;
  }

  /** Runs the chart and illustration stages of a job side by side. */
  @Bean(name = "visualStageExecutor")
  public Executor visualStageExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(2);
    executor.setMaxPoolSize(8);
    executor.setQueueCapacity(100);
    executor.setThreadNamePrefix("visual-stage-");
    executor.initialize();
    return executor;
  }
}
