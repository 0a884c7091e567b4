package com.openforge.parley.nlu;

import com.openforge.parley.config.ParleyProperties;
import com.openforge.parley.semantic.SemanticMatcher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Read-only grammar and example banks plus the shared classifier.
 */
@Configuration
public class NluConfig {

    @Bean
    public IntentPatternBank intentPatternBank() {
        return IntentPatternBank.defaults();
    }

    @Bean
    public ExampleBank exampleBank() {
        return ExampleBank.defaults();
    }

    @Bean
    public IntentClassifier intentClassifier(EntityExtractor extractor,
                                             SemanticMatcher matcher,
                                             IntentPatternBank patterns,
                                             ExampleBank examples,
                                             ParleyProperties properties) {
        return new IntentClassifier(extractor, matcher, patterns, examples, properties.classifier());
    }
}
