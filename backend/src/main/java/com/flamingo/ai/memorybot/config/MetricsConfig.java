package com.flamingo.ai.memorybot.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for application metrics and the shared clock. */
@Configuration
public class MetricsConfig {

  /**
   * Enables the @Timed annotation on media and reminder services.
   *
   * @param registry the meter registry
   * @return the timed aspect bean
   */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  @Bean
  public MeterRegistryCustomizer<MeterRegistry> commonTags() {
    return registry -> registry.config().commonTags("service", "memorybot");
  }

  /** UTC clock used for every "now" in the core, replaceable in tests. */
  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
