package com.flamingo.ai.adaptiverag;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class AdaptiveRagApplication {

  public static void main(String[] args) {
    SpringApplication.run(AdaptiveRagApplication.class, args);
  }
}
