package com.nevis.hybrid.config;

import com.nevis.hybrid.infra.EmbeddingProvider;
import com.nevis.hybrid.model.StoreConfig;
import com.nevis.hybrid.repository.StorageBackend;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.stereotype.Component;

/**
 * Checks the embedding provider against the configured dimensions and prepares the backend schema
 * once all singletons exist, before lifecycle beans such as the web server start.
 */
@Slf4j
@Component
public class StoreInitializer implements SmartInitializingSingleton {

    private final HybridStoreProperties properties;
    private final StorageBackend storageBackend;
    private final ObjectProvider<EmbeddingProvider> embeddingProvider;

    public StoreInitializer(
        HybridStoreProperties properties,
        StorageBackend storageBackend,
        ObjectProvider<EmbeddingProvider> embeddingProvider
    ) {
        this.properties = properties;
        this.storageBackend = storageBackend;
        this.embeddingProvider = embeddingProvider;
    }

    @Override
    public void afterSingletonsInstantiated() {
        StoreConfig config = properties.storeConfig();

        EmbeddingProvider provider = embeddingProvider.getIfAvailable();
        if (provider == null) {
            log.warn("No embedding provider configured; documents and queries must carry their own vectors");
        } else if (provider.getDimensions() != config.dimensions()) {
            throw new IllegalStateException("Embedding provider '" + provider.id() + "' produces "
                + provider.getDimensions() + " dimensions, store is configured for " + config.dimensions());
        }

        if (properties.initializeSchema()) {
            storageBackend.createSchema(config);
        }
        log.info("Hybrid store started: backend={}, dimensions={}, metric={}",
            storageBackend.name(), config.dimensions(), config.distanceMetric());
    }
}
