package com.dtinsight;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class DtInsightApplication {

  public static void main(String[] args) {
    SpringApplication.run(DtInsightApplication.class, args);
  }
}
