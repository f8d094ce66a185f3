package org.chucc.vbranch.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the wall clock used for branch timestamps.
 */
@Configuration
public class ClockConfig {

  /**
   * System UTC clock.
   *
   * @return the clock
   */
  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
