package com.scholary.captions;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CaptionGeneratorApplication {

  public static void main(String[] args) {
    SpringApplication.run(CaptionGeneratorApplication.class, args);
  }
}
