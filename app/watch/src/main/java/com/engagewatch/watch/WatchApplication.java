/*
 * Where: Watch application entry point
 * What: Boots Spring, binds configuration and enables the scheduled workers
 */
package com.engagewatch.watch;

import com.engagewatch.common.config.ClockConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
@Import(ClockConfig.class)
public class WatchApplication {

  public static void main(String[] args) {
    SpringApplication.run(WatchApplication.class, args);
  }
}
