package com.flamingo.ai.slidedeck;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the guided slide deck service. */
@SpringBootApplication
public class SlideDeckApplication {

  public static void main(String[] args) {
    SpringApplication.run(SlideDeckApplication.class, args);
  }
}
