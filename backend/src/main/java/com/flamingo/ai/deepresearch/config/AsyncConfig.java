package com.flamingo.ai.deepresearch.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for async operations. */
@Configuration
@EnableAsync
public class AsyncConfig {

  /** One logical task per research session run. */
  @Bean(name = "researchSessionExecutor")
  public ThreadPoolTaskExecutor researchSessionExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(2);
    executor.setMaxPoolSize(8);
    executor.setQueueCapacity(100);
    executor.setThreadNamePrefix("research-");
    executor.initialize();
    return executor;
  }

  @Bean(name = "searchFanOutExecutor")
  public ThreadPoolTaskExecutor searchFanOutExecutor(ResearchConfig researchConfig) {
    int parallelism = Math.max(1, researchConfig.getSearch().getMaxParallelism());
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(parallelism);
    executor.setMaxPoolSize(parallelism);
    executor.setQueueCapacity(500);
    executor.setThreadNamePrefix("fanout-");
    executor.initialize();
    return executor;
  }

  @Bean(name = "providerCallExecutor")
  public ThreadPoolTaskExecutor providerCallExecutor(ResearchConfig researchConfig) {
    int parallelism = Math.max(1, researchConfig.getSearch().getMaxParallelism());
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(parallelism);
    executor.setMaxPoolSize(parallelism * 2);
    executor.setQueueCapacity(200);
    executor.setThreadNamePrefix("provider-");
    executor.initialize();
    return executor;
  }
}
