package com.ospicorp.capacityforecast.config;

import com.ospicorp.capacityforecast.estimator.ModelRegistry;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class EngineConfig {

  @Bean
  ModelRegistry modelRegistry(ForecastProperties properties) {
    return ModelRegistry.baselines(properties.seasonLength());
  }

  @Bean
  ThreadPoolTaskExecutor forecastExecutor(ForecastProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.worker().corePoolSize());
    executor.setMaxPoolSize(properties.worker().maxPoolSize());
    executor.setQueueCapacity(properties.worker().queueCapacity());
    executor.setThreadNamePrefix("forecast-");
    // a saturated pool runs the unit on the request thread instead of rejecting it
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.initialize();
    return executor;
  }
}
