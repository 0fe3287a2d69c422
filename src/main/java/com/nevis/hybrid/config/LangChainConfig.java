package com.nevis.hybrid.config;

import com.nevis.hybrid.infra.EmbeddingProvider;
import com.nevis.hybrid.infra.LangChainEmbeddingProvider;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.googleai.GoogleAiEmbeddingModel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Gemini embedding model. Without {@code app.gemini.api-key} no model is created and the store
 * only accepts documents and queries that carry their own vectors.
 */
@Configuration
@ConditionalOnProperty(prefix = "app.gemini", name = "api-key")
public class LangChainConfig {

    @Value("${app.gemini.api-key}")
    private String apiKey;

    @Value("${app.gemini.model-name:gemini-embedding-001}")
    private String modelName;

    @Bean
    public EmbeddingModel embeddingModel(HybridStoreProperties properties) {
        return GoogleAiEmbeddingModel.builder()
            .apiKey(apiKey)
            .modelName(modelName)
            .outputDimensionality(properties.dimensions())
            .timeout(properties.embedding().timeout())
            .maxRetries(0)
            .build();
    }

    @Bean
    public EmbeddingProvider embeddingProvider(EmbeddingModel embeddingModel, HybridStoreProperties properties) {
        return new LangChainEmbeddingProvider(embeddingModel, modelName, properties.dimensions());
    }
}
