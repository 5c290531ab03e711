package com.flamingo.ai.memorybot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the memory bot backend. */
@SpringBootApplication
public class MemoryBotApplication {

  public static void main(String[] args) {
    SpringApplication.run(MemoryBotApplication.class, args);
  }
}
