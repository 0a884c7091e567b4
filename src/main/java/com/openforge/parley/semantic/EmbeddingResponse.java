package com.openforge.parley.semantic;

import java.util.List;

/**
 * Response from POST /v1/embeddings.
 *
 * Wire format:
 * {
 *   "object": "list",
 *   "data": [
 *     { "object": "embedding", "index": 0, "embedding": [0.1, -0.2, ...] }
 *   ],
 *   "model": "text-embedding-3-small"
 * }
 */
record EmbeddingResponse(
        String object,
        List<EmbeddingData> data,
        String model
) {

    /** Extract the embedding vector from the first (and typically only) result. */
    List<Float> firstEmbedding() {
        if (data == null || data.isEmpty() || data.get(0).embedding() == null) {
            throw new EmbeddingException("Embedding response contained no data");
        }
        return data.get(0).embedding();
    }

    record EmbeddingData(
            String object,
            int index,
            List<Float> embedding
    ) {}
}
