package com.delta.synctracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SyncTrackerApplication {

  public static void main(String[] args) {
    SpringApplication.run(SyncTrackerApplication.class, args);
  }
}
