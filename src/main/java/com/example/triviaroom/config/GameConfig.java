package com.example.triviaroom.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class GameConfig {

  // Single time source for question deadlines, scoring and timestamps
  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
