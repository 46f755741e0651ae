package com.mk.fx.qa.load.ramp;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.mongo.MongoAutoConfiguration;

/**
 * Command-line entry point. Runs the ramp described by {@code --config <file>} and exits; the
 * external metrics sampler manages its own MongoDB client, so Spring's is switched off.
 */
@SpringBootApplication(exclude = MongoAutoConfiguration.class)
public class LoadRampApplication {

  public static void main(String[] args) {
    System.exit(SpringApplication.exit(SpringApplication.run(LoadRampApplication.class, args)));
  }
}
