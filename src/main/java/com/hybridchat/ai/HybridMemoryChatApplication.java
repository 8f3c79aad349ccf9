package com.hybridchat.ai;

import com.hybridchat.ai.config.MemoryProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

@SpringBootApplication
public class HybridMemoryChatApplication {

  private static final Logger log = LoggerFactory.getLogger(HybridMemoryChatApplication.class);

  public static void main(String[] args) {
    SpringApplication.run(HybridMemoryChatApplication.class, args);
  }

  @Bean
  CommandLineRunner logMemorySettings(MemoryProperties properties) {
    return args -> log.info(
        "Hybrid memory ready maxPairs={} evictionBatchSize={} summarizerTimeout={} condenseThreshold={}",
        properties.maxPairs(),
        properties.evictionBatchSize(),
        properties.summarizerTimeout(),
        properties.summaryCondenseThreshold());
  }
}
