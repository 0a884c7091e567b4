package com.openforge.parley;

import com.openforge.parley.config.ParleyProperties;
import com.openforge.parley.semantic.EmbeddingProperties;
import com.openforge.parley.storage.MilvusProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

// Register ConfigurationProperties globally so they are available
// regardless of whether the conditional Milvus / HTTP embedding beans are loaded.
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties({ParleyProperties.class, EmbeddingProperties.class, MilvusProperties.class})
public class ParleyApplication {

    public static void main(String[] args) {
        SpringApplication.run(ParleyApplication.class, args);
    }
}
