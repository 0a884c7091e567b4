package com.openforge.parley.storage;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import io.milvus.v2.client.MilvusClientV2;
import io.milvus.v2.common.ConsistencyLevel;
import io.milvus.v2.service.vector.request.DeleteReq;
import io.milvus.v2.service.vector.request.QueryReq;
import io.milvus.v2.service.vector.request.SearchReq;
import io.milvus.v2.service.vector.request.UpsertReq;
import io.milvus.v2.service.vector.request.data.FloatVec;
import io.milvus.v2.service.vector.response.DeleteResp;
import io.milvus.v2.service.vector.response.QueryResp;
import io.milvus.v2.service.vector.response.SearchResp;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Milvus-backed store. One row per key:
 *
 *   key         VARCHAR PK   caller-chosen key ("ltm:…", "prefs:…")
 *   value       VARCHAR      serialized payload
 *   searchable  BOOL         false when saved without an embedding
 *   embedding   FLOAT_VECTOR zero vector when not searchable
 *
 * Reads use strong consistency so a save is visible to the next load.
 */
@Slf4j
public class MilvusPersistenceBackend implements PersistenceBackend, AutoCloseable {

    static final int MAX_VALUE_LENGTH = 16_384;

    private static final List<String> OUTPUT_FIELDS = List.of("key", "value");
    private static final List<String> SCAN_FIELDS   = List.of("key", "value", "searchable", "embedding");

    private final MilvusClientV2   milvusClient;
    private final MilvusProperties props;

    public MilvusPersistenceBackend(MilvusClientV2 milvusClient, MilvusProperties props) {
        this.milvusClient = milvusClient;
        this.props        = props;
    }

    // ── Write ────────────────────────────────────────────────────────────────

    @Override
    public void save(String key, String value, List<Float> embedding) {
        boolean searchable = embedding != null && !embedding.isEmpty();
        List<Float> vector = searchable ? embedding : zeroVector();
        if (vector.size() != props.vectorDimensions()) {
            throw new IllegalArgumentException("Embedding has %d dimensions, collection '%s' expects %d"
                    .formatted(vector.size(), props.collectionName(), props.vectorDimensions()));
        }
        if (value.length() > MAX_VALUE_LENGTH) {
            throw new IllegalArgumentException("Value for key " + key + " exceeds " + MAX_VALUE_LENGTH + " characters");
        }

        JsonObject row = new JsonObject();
        row.addProperty("key",        key);
        row.addProperty("value",      value);
        row.addProperty("searchable", searchable);
        JsonArray embeddingArray = new JsonArray();
        for (Float f : vector) embeddingArray.add(f);
        row.add("embedding", embeddingArray);

        milvusClient.upsert(UpsertReq.builder()
                .collectionName(props.collectionName())
                .data(List.of(row))
                .build());
        log.debug("[Milvus] Saved {} (searchable={})", key, searchable);
    }

    @Override
    public boolean delete(String key) {
        DeleteResp resp = milvusClient.delete(DeleteReq.builder()
                .collectionName(props.collectionName())
                .ids(List.of(key))
                .build());
        return resp != null && resp.getDeleteCnt() > 0;
    }

    // ── Read ─────────────────────────────────────────────────────────────────

    @Override
    public Optional<String> load(String key) {
        QueryResp resp = milvusClient.query(QueryReq.builder()
                .collectionName(props.collectionName())
                .filter("key == \"%s\"".formatted(escape(key)))
                .outputFields(OUTPUT_FIELDS)
                .consistencyLevel(ConsistencyLevel.STRONG)
                .limit(1)
                .build());
        if (resp == null || resp.getQueryResults() == null || resp.getQueryResults().isEmpty()) {
            return Optional.empty();
        }
        Object value = resp.getQueryResults().get(0).getEntity().get("value");
        return Optional.ofNullable(value).map(String::valueOf);
    }

    @Override
    public List<StoredHit> query(List<Float> embedding, int topK) {
        if (embedding == null || embedding.isEmpty() || topK <= 0) {
            return List.of();
        }
        SearchResp resp = milvusClient.search(SearchReq.builder()
                .collectionName(props.collectionName())
                .data(List.of(new FloatVec(embedding)))
                .annsField("embedding")
                .topK(topK)
                .filter("searchable == true")
                .outputFields(OUTPUT_FIELDS)
                .consistencyLevel(ConsistencyLevel.STRONG)
                .build());

        List<StoredHit> hits = new ArrayList<>();
        if (resp == null || resp.getSearchResults() == null) return hits;
        for (List<SearchResp.SearchResult> row : resp.getSearchResults()) {
            for (SearchResp.SearchResult hit : row) {
                Map<String, Object> e = hit.getEntity();
                Float score = hit.getScore();
                hits.add(new StoredHit(String.valueOf(hit.getId()),
                        String.valueOf(e.getOrDefault("value", "")),
                        score == null ? 0.0 : Math.max(0.0, Math.min(1.0, score))));
            }
        }
        return hits;
    }

    @Override
    public List<StoredValue> scan(String keyPrefix) {
        QueryResp resp = milvusClient.query(QueryReq.builder()
                .collectionName(props.collectionName())
                .filter("key like \"%s%%\"".formatted(escape(keyPrefix)))
                .outputFields(SCAN_FIELDS)
                .consistencyLevel(ConsistencyLevel.STRONG)
                .build());

        List<StoredValue> values = new ArrayList<>();
        if (resp == null || resp.getQueryResults() == null) return values;
        for (QueryResp.QueryResult row : resp.getQueryResults()) {
            Map<String, Object> e = row.getEntity();
            String key = String.valueOf(e.get("key"));
            // "_" and "%" in the prefix are wildcards to Milvus
            if (!key.startsWith(keyPrefix)) continue;
            List<Float> embedding = Boolean.TRUE.equals(e.get("searchable")) ? toFloats(e.get("embedding")) : List.of();
            values.add(new StoredValue(key,
                    String.valueOf(e.getOrDefault("value", "")), embedding));
        }
        log.debug("[Milvus] Scanned {} row(s) with prefix {}", values.size(), keyPrefix);
        return values;
    }

    @Override
    public String name() {
        return "milvus:" + props.collectionName();
    }

    /** Invoked by Spring on shutdown. */
    @Override
    public void close() throws Exception {
        milvusClient.close();
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private List<Float> zeroVector() {
        return Collections.nCopies(props.vectorDimensions(), 0.0f);
    }

    private static List<Float> toFloats(Object raw) {
        if (!(raw instanceof List)) return List.of();
        List<?> list = (List<?>) raw;
        List<Float> out = new ArrayList<>(list.size());
        for (Object o : list) {
            out.add(o instanceof Number ? ((Number) o).floatValue() : 0.0f);
        }
        return out;
    }

    private static String escape(String s) {
        return s.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
