package io.intellixity.flatdoc.examples;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

@SpringBootApplication(exclude = {DataSourceAutoConfiguration.class})
public class FlatdocExamplesApplication {
  public static void main(String[] args) {
    SpringApplication.run(FlatdocExamplesApplication.class, args);
  }
}
