/*
 * Where: shared configuration
 * What: exposes a UTC Clock bean
 * Why: every time-dependent component takes the same injectable clock
 */
package com.example.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
