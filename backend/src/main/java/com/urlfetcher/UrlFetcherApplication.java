package com.urlfetcher;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class UrlFetcherApplication {

  public static void main(String[] args) {
    SpringApplication.run(UrlFetcherApplication.class, args);
  }
}
