package com.ospicorp.sgs.config;

import com.ospicorp.sgs.series.cache.SeriesCache;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Component
public class CacheInitializer implements CommandLineRunner {

  private static final Logger log = LoggerFactory.getLogger(CacheInitializer.class);

  private final SeriesCache cache;
  private final boolean enabled;
  private final String path;

  public CacheInitializer(SeriesCache cache,
      @Value("${sgs.cache.enabled:false}") boolean enabled,
      @Value("${sgs.cache.path:}") String path) {
    this.cache = cache;
    this.enabled = enabled;
    this.path = path;
  }

  @Override
  public void run(String... args) {
    if (!enabled) {
      log.info("Local cache disabled via property sgs.cache.enabled=false");
      return;
    }
    cache.activate(StringUtils.hasText(path) ? Path.of(path) : null);
    int removed = cache.purgeExpired();
    log.info("Local cache ready; {} expired entries purged at startup", removed);
  }
}
