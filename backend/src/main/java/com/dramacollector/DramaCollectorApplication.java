package com.dramacollector;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class DramaCollectorApplication {

  public static void main(String[] args) {
    SpringApplication.run(DramaCollectorApplication.class, args);
  }
}
