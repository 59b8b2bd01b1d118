package com.ospicorp.sgs.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ospicorp.sgs.series.cache.CachePolicy;
import com.ospicorp.sgs.series.cache.SeriesCache;
import com.ospicorp.sgs.series.catalog.SeriesCatalog;
import com.ospicorp.sgs.series.client.RetryPolicy;
import com.ospicorp.sgs.series.client.Sleeper;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestTemplate;

@Configuration
public class SgsClientConfig {

  @Bean
  RestTemplate restTemplate(RestTemplateBuilder builder,
      @Value("${sgs.request-timeout:30s}") Duration requestTimeout) {
    return builder
        .setConnectTimeout(requestTimeout)
        .setReadTimeout(requestTimeout)
        .build();
  }

  @Bean
  RetryPolicy retryPolicy(@Value("${sgs.retry.max-attempts:3}") int maxAttempts,
      @Value("${sgs.retry.backoff:1s,2s,5s}") List<Duration> backoff) {
    return new RetryPolicy(maxAttempts, backoff);
  }

  @Bean
  Sleeper sleeper() {
    return Sleeper.threadSleep();
  }

  @Bean
  Clock clock() {
    return Clock.systemDefaultZone();
  }

  @Bean
  ThreadPoolTaskExecutor sgsFetchExecutor(@Value("${sgs.fetch.worker-threads:16}") int threads) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(threads);
    executor.setThreadNamePrefix("sgs-fetch-");
    executor.setWaitForTasksToCompleteOnShutdown(false);
    return executor;
  }

  @Bean
  SeriesCatalog seriesCatalog(ObjectMapper mapper) {
    return SeriesCatalog.load(mapper, SeriesCatalog.DEFAULT_RESOURCE);
  }

  @Bean
  CachePolicy cachePolicy(SeriesCatalog catalog) {
    return new CachePolicy(catalog::periodicityOf);
  }

  @Bean(destroyMethod = "deactivate")
  SeriesCache seriesCache(ObjectMapper mapper, CachePolicy cachePolicy, Clock clock) {
    return new SeriesCache(mapper, cachePolicy, clock);
  }
}
