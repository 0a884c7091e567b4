package com.openforge.parley.storage;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Connection parameters for the Milvus vector database.
 *
 * application.yml:
 *
 * parley:
 *   milvus:
 *     enabled: false
 *     host: localhost
 *     port: 19530
 *     collection-name: parley_store
 *     vector-dimensions: 512
 *
 * vector-dimensions must equal the embedding provider's output size.
 */
@ConfigurationProperties(prefix = "parley.milvus")
public record MilvusProperties(
        @DefaultValue("false")        boolean enabled,
        @DefaultValue("localhost")    String  host,
        @DefaultValue("19530")        int     port,
        @DefaultValue("parley_store") String  collectionName,
        @DefaultValue("512")          int     vectorDimensions
) {}
