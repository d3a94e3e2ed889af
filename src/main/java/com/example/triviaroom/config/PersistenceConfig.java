package com.example.triviaroom.config;

import com.example.triviaroom.persistence.GameSettlementService;
import com.example.triviaroom.persistence.JpaGameSettlementService;
import com.example.triviaroom.persistence.NoOpGameSettlementService;
import com.example.triviaroom.repository.GameResultRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PersistenceConfig {

  // Results table only when explicitly switched on
  @Bean
  @ConditionalOnProperty(prefix = "features.game-results", name = "enabled", havingValue = "true")
  public GameSettlementService jpaGameSettlement(GameResultRepository repo, GameProperties props) {
    return new JpaGameSettlementService(repo, props.getSettlementMaxAttempts());
  }

  // Always available fallback
  @Bean
  @ConditionalOnMissingBean(GameSettlementService.class)
  public GameSettlementService gameSettlementNoOp() {
    return new NoOpGameSettlementService();
  }
}
