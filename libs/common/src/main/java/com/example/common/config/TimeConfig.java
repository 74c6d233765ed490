/*
 * Where: Common configuration
 * What: Exposes the Clock used for every timestamp the service writes
 * Why: Audit lines and archive names must follow one injectable clock
 */
package com.example.common.config;

import java.time.Clock;
import java.time.ZoneId;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock(@Value("${app.clock.zone:}") String zone) {
    if (zone == null || zone.isBlank()) {
      return Clock.systemDefaultZone();
    }
    return Clock.system(ZoneId.of(zone));
  }
}
