package com.delta.harvester;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class DeltaHarvesterApplication {

  public static void main(String[] args) {
    SpringApplication.run(DeltaHarvesterApplication.class, args);
  }
}
