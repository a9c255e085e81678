package com.flamingo.ai.legalrag;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point of the legal paragraph locator service. */
@SpringBootApplication
public class LegalRagApplication {

  public static void main(String[] args) {
    SpringApplication.run(LegalRagApplication.class, args);
  }
}
