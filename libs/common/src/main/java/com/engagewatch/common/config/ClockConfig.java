/*
 * Where: common configuration
 * What: exposes the UTC Clock and the worker identity as beans
 * Why: services read time and lock ownership through injection so tests can pin both
 */
package com.engagewatch.common.config;

import com.engagewatch.common.WorkerIdentity;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ClockConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public WorkerIdentity workerIdentity() {
    return WorkerIdentity.fromEnvironment();
  }
}
