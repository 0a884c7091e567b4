package com.openforge.parley.config;

import com.openforge.parley.router.IntentRouter;
import com.openforge.parley.semantic.EmbeddingProperties;
import com.openforge.parley.semantic.SemanticMatcher;
import com.openforge.parley.storage.MilvusProperties;
import com.openforge.parley.storage.PersistenceBackend;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Prints a structured startup summary after the application context is fully ready.
 *
 * Reported:
 *   - Embedding: active provider and model (API key masked)
 *   - Storage: active persistence backend; Milvus address when enabled
 *   - Classifier, memory and router thresholds
 *   - Registered handler chain
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupInfoRunner implements ApplicationRunner {

    private final ParleyProperties    properties;
    private final EmbeddingProperties embeddingProperties;
    private final MilvusProperties    milvusProperties;
    private final SemanticMatcher     semanticMatcher;
    private final PersistenceBackend  backend;
    private final IntentRouter        router;

    @Override
    public void run(ApplicationArguments args) {
        ParleyProperties.ClassifierProperties classifier = properties.classifier();
        ParleyProperties.MemoryProperties     memory     = properties.memory();

        log.info("""

                ╔══════════════════════════════════════════════════════════╗
                ║              Parley  ·  Startup Summary                  ║
                ╠══════════════════════════════════════════════════════════╣
                ║  Runtime                                                 ║
                ║    Java Version   : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Embedding                                               ║
                ║    Provider       : {}
                ║    Model          : {}  key={}
                ╠══════════════════════════════════════════════════════════╣
                ║  Storage                                                 ║
                ║    Backend        : {}
                ║    Milvus         : {}  {}:{}  collection={}
                ╠══════════════════════════════════════════════════════════╣
                ║  Classifier                                              ║
                ║    Pattern        : full={}  partial={}  slot={}
                ║    Semantic       : trigger={}  threshold={}
                ║    Context boost  : {}   floor={}
                ╠══════════════════════════════════════════════════════════╣
                ║  Memory                                                  ║
                ║    Short-term     : {} turns   promotion after {}
                ║    Session timeout: {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Router                                                  ║
                ║    Clarify below  : {}
                ║    Chain          : {}
                ╚══════════════════════════════════════════════════════════╝
                """,
                System.getProperty("java.version"),

                semanticMatcher.providerName(),
                embeddingProperties.model(),
                maskKey(embeddingProperties.apiKey()),

                backend.name(),
                milvusProperties.enabled() ? "✔ enabled" : "✘ disabled",
                milvusProperties.host(), milvusProperties.port(), milvusProperties.collectionName(),

                classifier.patternConfidence(), classifier.partialPatternConfidence(), classifier.slotConfidence(),
                classifier.semanticTrigger(), classifier.semanticThreshold(),
                classifier.contextBoost(), classifier.confidenceFloor(),

                memory.shortTermCapacity(), memory.promotionThreshold(),
                memory.sessionTimeout(),

                properties.router().clarificationThreshold(),
                String.join(" → ", router.handlerNames())
        );
    }

    /**
     * Masks an API key: shows first 6 chars + "..." + last 4 chars.
     * Returns "(not set)" if the key looks like a placeholder.
     */
    private static String maskKey(String key) {
        if (key == null || key.isBlank() || key.startsWith("sk-placeholder")) {
            return "(not set)";
        }
        if (key.length() <= 10) return "***";
        return key.substring(0, 6) + "..." + key.substring(key.length() - 4);
    }
}
