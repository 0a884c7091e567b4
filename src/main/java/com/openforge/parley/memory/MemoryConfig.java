package com.openforge.parley.memory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.parley.semantic.SemanticMatcher;
import com.openforge.parley.storage.PersistenceBackend;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class MemoryConfig {

    @Bean
    public LongTermMemory longTermMemory(SemanticMatcher matcher,
                                         PersistenceBackend backend,
                                         ObjectMapper objectMapper,
                                         Clock clock) {
        return new LongTermMemory(matcher, backend, objectMapper, clock);
    }
}
