package com.sitescope.crawler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SiteScopeCrawlerApplication {

  public static void main(String[] args) {
    SpringApplication.run(SiteScopeCrawlerApplication.class, args);
  }
}
