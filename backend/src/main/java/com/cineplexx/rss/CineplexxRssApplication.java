package com.cineplexx.rss;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CineplexxRssApplication {

  public static void main(String[] args) {
    SpringApplication.run(CineplexxRssApplication.class, args);
  }
}
