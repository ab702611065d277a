package com.ospicorp.capacityforecast;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CapacityForecastApplication {

  public static void main(String[] args) {
    SpringApplication.run(CapacityForecastApplication.class, args);
  }
}
