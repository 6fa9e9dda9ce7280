package com.leakmonitor.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class LeakMonitorApplication {

  public static void main(String[] args) {
    SpringApplication.run(LeakMonitorApplication.class, args);
  }
}
