package com.ospicorp.sgs;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

// The cache opens its own H2 pool on activation; no application-wide DataSource.
@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
public class SgsApplication {

  public static void main(String[] args) {
    SpringApplication.run(SgsApplication.class, args);
  }
}
