package com.nevis.hybrid.infra;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;

import java.util.List;

public class LangChainEmbeddingProvider implements EmbeddingProvider {

    private final EmbeddingModel embeddingModel;
    private final String modelName;
    private final int dimensions;

    public LangChainEmbeddingProvider(EmbeddingModel embeddingModel, String modelName, int dimensions) {
        this.embeddingModel = embeddingModel;
        this.modelName = modelName;
        this.dimensions = dimensions;
    }

    @Override
    public String id() {
        return modelName + "/" + dimensions;
    }

    @Override
    public int getDimensions() {
        return dimensions;
    }

    @Override
    public List<float[]> embed(List<String> texts) {
        Response<List<Embedding>> response = embeddingModel.embedAll(texts.stream().map(TextSegment::from).toList());
        return response.content().stream().map(Embedding::vector).toList();
    }
}
