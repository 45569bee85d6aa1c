package com.ospicorp.forecastengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ForecastEngineApplication {

  public static void main(String[] args) {
    SpringApplication.run(ForecastEngineApplication.class, args);
  }
}
