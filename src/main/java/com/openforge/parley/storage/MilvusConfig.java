package com.openforge.parley.storage;

import io.milvus.v2.client.ConnectConfig;
import io.milvus.v2.client.MilvusClientV2;
import io.milvus.v2.common.DataType;
import io.milvus.v2.common.IndexParam;
import io.milvus.v2.service.collection.request.AddFieldReq;
import io.milvus.v2.service.collection.request.CreateCollectionReq;
import io.milvus.v2.service.collection.request.HasCollectionReq;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.Map;

/**
 * Milvus-backed persistence, active with {@code parley.milvus.enabled=true}.
 *
 * On startup:
 *   1. Connects a MilvusClientV2 to host:port
 *   2. Creates the collection (schema + HNSW index) if it does not exist
 *
 * If Milvus cannot be reached the in-memory backend is used instead and a
 * warning is logged; the application still starts.
 *
 * Collection schema (parley_store):
 * ┌────────────┬───────────────┬──────────────────────────────────────┐
 * │ Field      │ Type          │ Notes                                │
 * ├────────────┼───────────────┼──────────────────────────────────────┤
 * │ key        │ VARCHAR(256)  │ primary key, caller-assigned         │
 * │ value      │ VARCHAR(16384)│ serialized payload                   │
 * │ searchable │ BOOL          │ false for values saved without vector│
 * │ embedding  │ FLOAT_VECTOR  │ dim = vectorDimensions               │
 * └────────────┴───────────────┴──────────────────────────────────────┘
 *
 * Index: HNSW on embedding, metric = IP (inner product equals cosine for the
 * L2-normalised vectors both embedding providers produce).
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "parley.milvus.enabled", havingValue = "true")
public class MilvusConfig {

    @Bean
    public PersistenceBackend persistenceBackend(MilvusProperties props) {
        log.info("[Milvus] Connecting to {}:{}...", props.host(), props.port());
        try {
            MilvusClientV2 client = new MilvusClientV2(
                    ConnectConfig.builder()
                            .uri("http://%s:%d".formatted(props.host(), props.port()))
                            .connectTimeoutMs(15_000)
                            .build()
            );
            log.info("[Milvus] Connected successfully.");
            ensureCollectionExists(client, props);
            return new MilvusPersistenceBackend(client, props);
        } catch (Exception e) {
            log.warn("[Milvus] Connection failed, falling back to in-memory persistence. Cause: {}. "
                    + "Set parley.milvus.enabled=false to suppress this warning.", e.getMessage());
            return new InMemoryPersistenceBackend();
        }
    }

    // ── Collection bootstrap ─────────────────────────────────────────────────

    private void ensureCollectionExists(MilvusClientV2 client, MilvusProperties props) {
        String name = props.collectionName();
        if (client.hasCollection(HasCollectionReq.builder().collectionName(name).build())) {
            log.info("[Milvus] Collection '{}' already exists, skipping creation.", name);
            return;
        }

        log.info("[Milvus] Creating collection '{}' (dim={})...", name, props.vectorDimensions());

        CreateCollectionReq.CollectionSchema schema =
                CreateCollectionReq.CollectionSchema.builder().build();
        schema.addField(AddFieldReq.builder().fieldName("key")
                .dataType(DataType.VarChar).maxLength(256).isPrimaryKey(true).autoID(false).build());
        schema.addField(AddFieldReq.builder().fieldName("value")
                .dataType(DataType.VarChar).maxLength(MilvusPersistenceBackend.MAX_VALUE_LENGTH).build());
        schema.addField(AddFieldReq.builder().fieldName("searchable")
                .dataType(DataType.Bool).build());
        schema.addField(AddFieldReq.builder().fieldName("embedding")
                .dataType(DataType.FloatVector).dimension(props.vectorDimensions()).build());

        IndexParam vectorIndex = IndexParam.builder()
                .fieldName("embedding")
                .indexType(IndexParam.IndexType.HNSW)
                .metricType(IndexParam.MetricType.IP)
                .extraParams(Map.of("M", 16, "efConstruction", 256))
                .build();

        client.createCollection(CreateCollectionReq.builder()
                .collectionName(name)
                .collectionSchema(schema)
                .indexParams(List.of(vectorIndex))
                .build());

        log.info("[Milvus] Collection '{}' created successfully.", name);
    }
}
