package com.nevis.hybrid.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nevis.hybrid.exception.DimensionMismatchException;
import com.nevis.hybrid.exception.DocumentNotFoundException;
import com.nevis.hybrid.exception.FilterException;
import com.nevis.hybrid.model.DistanceMetric;
import com.nevis.hybrid.model.Document;
import com.nevis.hybrid.model.DocumentUpdate;
import com.nevis.hybrid.model.MetadataFilter;
import com.nevis.hybrid.model.MetadataValue;
import com.nevis.hybrid.model.NewDocument;
import com.nevis.hybrid.model.StoreStats;
import com.nevis.hybrid.service.HybridStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.RequestBuilder;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(DocumentController.class)
class DocumentControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockitoBean
    private HybridStore hybridStore;

    private MvcResult dispatch(RequestBuilder builder) throws Exception {
        MvcResult started = mockMvc.perform(builder)
            .andExpect(request().asyncStarted())
            .andReturn();
        return mockMvc.perform(asyncDispatch(started)).andReturn();
    }

    @SuppressWarnings("unchecked")
    @Test
    @DisplayName("POST /documents should insert the batch and return 201 with ids")
    void insertDocuments_ShouldReturn201() throws Exception {
        when(hybridStore.insert(anyList())).thenReturn(CompletableFuture.completedFuture(List.of("a", "generated")));

        String body = """
            {"documents": [
              {"id": "a", "content": "cat", "metadata": {"tags": ["pet"], "author": {"name": "Ann"}}, "embedding": [1, 0, 0]},
              {"content": "dog"}
            ]}
            """;

        MvcResult started = mockMvc.perform(post("/documents").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(request().asyncStarted())
            .andReturn();
        mockMvc.perform(asyncDispatch(started))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.ids[0]").value("a"))
            .andExpect(jsonPath("$.ids[1]").value("generated"));

        ArgumentCaptor<List<NewDocument>> captor = ArgumentCaptor.forClass(List.class);
        verify(hybridStore).insert(captor.capture());
        NewDocument first = captor.getValue().get(0);
        assertThat(first.metadata()).containsEntry("tags", MetadataValue.list(MetadataValue.of("pet")));
        assertThat(first.embedding()).containsExactly(1, 0, 0);
        assertThat(captor.getValue().get(1).hasEmbedding()).isFalse();
    }

    @Test
    @DisplayName("POST /documents should reject blank content before reaching the store")
    void insertDocuments_ShouldReturn400_WhenContentBlank() throws Exception {
        mockMvc.perform(post("/documents")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"documents\": [{\"content\": \" \"}]}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.errorCode").value("VALIDATION"));

        verify(hybridStore, never()).insert(anyList());
    }

    @Test
    @DisplayName("POST /documents should map a dimension mismatch to 400")
    void insertDocuments_ShouldReturn400_OnDimensionMismatch() throws Exception {
        when(hybridStore.insert(anyList())).thenReturn(CompletableFuture.failedFuture(new DimensionMismatchException(3, 2)));

        MvcResult result = mockMvc.perform(post("/documents")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"documents\": [{\"content\": \"cat\", \"embedding\": [1, 0]}]}"))
            .andExpect(request().asyncStarted())
            .andReturn();

        mockMvc.perform(asyncDispatch(result))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.errorCode").value("DIMENSION_MISMATCH"))
            .andExpect(jsonPath("$.message").value("Dimension mismatch: expected 3, got 2"));
    }

    @Test
    @DisplayName("GET /documents/{id} should return the document")
    void getDocument_ShouldReturnDetails() throws Exception {
        Document document = new Document("a", "cat", Map.of("k", MetadataValue.of("v")), new float[]{1, 0, 0},
            OffsetDateTime.now(), OffsetDateTime.now());
        when(hybridStore.get("a")).thenReturn(CompletableFuture.completedFuture(Optional.of(document)));

        MvcResult result = mockMvc.perform(get("/documents/{id}", "a"))
            .andExpect(request().asyncStarted())
            .andReturn();

        mockMvc.perform(asyncDispatch(result))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.content").value("cat"))
            .andExpect(jsonPath("$.metadata.k").value("v"))
            .andExpect(jsonPath("$.embedding.length()").value(3));
    }

    @Test
    @DisplayName("GET /documents/{id} should return 404 when document does not exist")
    void getDocument_ShouldReturn404_WhenNotFound() throws Exception {
        when(hybridStore.get("missing")).thenReturn(CompletableFuture.completedFuture(Optional.empty()));

        MvcResult result = dispatch(get("/documents/{id}", "missing"));

        assertThat(result.getResponse().getStatus()).isEqualTo(404);
        assertThat(result.getResponse().getContentAsString())
            .contains("Document not found: missing")
            .contains("NOT_FOUND");
    }

    @Test
    @DisplayName("PATCH /documents/{id} should pass only the given fields")
    void updateDocument_ShouldReturnUpdated() throws Exception {
        Document updated = new Document("a", "dog", Map.of(), new float[]{0, 1, 0}, null, null);
        when(hybridStore.update(eq("a"), any())).thenReturn(CompletableFuture.completedFuture(updated));

        MvcResult result = mockMvc.perform(patch("/documents/{id}", "a")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"content\": \"dog\"}"))
            .andExpect(request().asyncStarted())
            .andReturn();

        mockMvc.perform(asyncDispatch(result))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.content").value("dog"));

        verify(hybridStore).update("a", new DocumentUpdate("dog", null, null));
    }

    @Test
    @DisplayName("DELETE /documents/{id} should return 204, and 404 for an unknown id")
    void deleteDocument() throws Exception {
        when(hybridStore.delete("a")).thenReturn(CompletableFuture.completedFuture(null));
        when(hybridStore.delete("missing")).thenReturn(CompletableFuture.failedFuture(new DocumentNotFoundException("missing")));

        assertThat(dispatch(delete("/documents/{id}", "a")).getResponse().getStatus()).isEqualTo(204);
        assertThat(dispatch(delete("/documents/{id}", "missing")).getResponse().getStatus()).isEqualTo(404);
    }

    @Test
    @DisplayName("POST /documents/delete-by-filter should translate the filter body")
    void deleteByFilter() throws Exception {
        MetadataFilter expected = MetadataFilter.builder()
            .equalTo("author.name", MetadataValue.of("Ann"))
            .contains("tags", MetadataValue.of("pet"))
            .build();
        when(hybridStore.deleteByFilter(expected)).thenReturn(CompletableFuture.completedFuture(2));

        MvcResult result = mockMvc.perform(post("/documents/delete-by-filter")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"equals\": {\"author.name\": \"Ann\"}, \"contains\": {\"tags\": \"pet\"}}"))
            .andExpect(request().asyncStarted())
            .andReturn();

        mockMvc.perform(asyncDispatch(result))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.deleted").value(2));
    }

    @Test
    @DisplayName("POST /documents/delete-by-filter should return 400 for an empty filter")
    void deleteByFilter_ShouldReturn400_WhenEmpty() throws Exception {
        when(hybridStore.deleteByFilter(MetadataFilter.none()))
            .thenReturn(CompletableFuture.failedFuture(new FilterException("deleteByFilter needs at least one condition")));

        MvcResult result = dispatch(post("/documents/delete-by-filter")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{}"));

        assertThat(result.getResponse().getStatus()).isEqualTo(400);
        assertThat(result.getResponse().getContentAsString()).contains("FILTER");
    }

    @Test
    @DisplayName("GET /stats should report totals and configuration")
    void stats() throws Exception {
        when(hybridStore.stats()).thenReturn(CompletableFuture.completedFuture(
            new StoreStats(5, 768, DistanceMetric.COSINE, "jdbc", "documents")));

        MvcResult result = mockMvc.perform(get("/stats"))
            .andExpect(request().asyncStarted())
            .andReturn();

        mockMvc.perform(asyncDispatch(result))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.totalDocuments").value(5))
            .andExpect(jsonPath("$.dimensions").value(768))
            .andExpect(jsonPath("$.distanceMetric").value("COSINE"))
            .andExpect(jsonPath("$.backend").value("jdbc"))
            .andExpect(jsonPath("$.tableName").value("documents"));
    }

    @Test
    @DisplayName("DELETE /documents should clear the store")
    void clear() throws Exception {
        when(hybridStore.clear()).thenReturn(CompletableFuture.completedFuture(null));

        assertThat(dispatch(delete("/documents")).getResponse().getStatus()).isEqualTo(204);
        verify(hybridStore).clear();
    }
}
