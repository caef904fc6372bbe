package com.flamingo.ai.mindmap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point of the mindmap generation backend. */
@SpringBootApplication
public class MindmapApplication {

  public static void main(String[] args) {
    SpringApplication.run(MindmapApplication.class, args);
  }
}
