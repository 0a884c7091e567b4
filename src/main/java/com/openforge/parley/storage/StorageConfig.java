package com.openforge.parley.storage;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** In-memory persistence unless Milvus is switched on. */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "parley.milvus.enabled", havingValue = "false", matchIfMissing = true)
public class StorageConfig {

    @Bean
    public PersistenceBackend persistenceBackend() {
        log.info("[Storage] Using in-memory persistence (parley.milvus.enabled=false).");
        return new InMemoryPersistenceBackend();
    }
}
