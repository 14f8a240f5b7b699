package com.contractdocs.rag.controller;

import com.contractdocs.rag.config.SecurityConfig;
import com.contractdocs.rag.exception.GenerationFailedException;
import com.contractdocs.rag.exception.MissingCredentialException;
import com.contractdocs.rag.exception.RetrievalFailedException;
import com.contractdocs.rag.exception.StoreUnavailableException;
import com.contractdocs.rag.exception.UnknownCollectionException;
import com.contractdocs.rag.model.Chunk;
import com.contractdocs.rag.model.CollectionInfo;
import com.contractdocs.rag.model.CollectionRegistration;
import com.contractdocs.rag.model.CollectionStats;
import com.contractdocs.rag.model.RagAnswer;
import com.contractdocs.rag.model.RetrievalHit;
import com.contractdocs.rag.model.RetrievalResult;
import com.contractdocs.rag.model.ScoringMode;
import com.contractdocs.rag.service.CollectionService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.test.context.support.WithAnonymousUser;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(CollectionController.class)
@Import(SecurityConfig.class)
@WithMockUser(username = "contracts_admin")
class CollectionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private CollectionService collectionService;

    @Test
    @DisplayName("Should list registered collections in order")
    void listCollections_ShouldReturnRegistrations() throws Exception {
        when(collectionService.listRegistered()).thenReturn(List.of(
            new CollectionRegistration("Sample", "sample.pdf"),
            new CollectionRegistration("Construction_Agreement", "Construction_Agreement.pdf")));

        mockMvc.perform(get("/collections"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].name").value("Sample"))
            .andExpect(jsonPath("$[0].source_document").value("sample.pdf"))
            .andExpect(jsonPath("$[1].name").value("Construction_Agreement"));
    }

    @Test
    void stats_ShouldIncludeDegradedCollections() throws Exception {
        when(collectionService.listAllStats()).thenReturn(List.of(
            CollectionStats.degraded("Broken", "Cannot read chunk metadata"),
            CollectionStats.healthy("Sample", 42, Set.of("sample.pdf"))));

        mockMvc.perform(get("/collections/stats"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].degraded").value(true))
            .andExpect(jsonPath("$[0].count").value(0))
            .andExpect(jsonPath("$[1].count").value(42))
            .andExpect(jsonPath("$[1].sampleSources[0]").value("sample.pdf"));
    }

    @Test
    void describe_ShouldReturnInfo() throws Exception {
        when(collectionService.describe("Sample")).thenReturn(new CollectionInfo(
            "Sample", "sample.pdf", 42, 2048, "sentence-transformers/all-MiniLM-L6-v2", "/data/store", Map.of()));

        mockMvc.perform(get("/collections/Sample"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.count").value(42))
            .andExpect(jsonPath("$.embeddingModel").value("sentence-transformers/all-MiniLM-L6-v2"));
    }

    @Test
    @DisplayName("Should return ranked results with scores")
    void search_ShouldReturnRankedResults() throws Exception {
        Chunk chunk = new Chunk("Sample-7", "Either party may terminate...", Map.of("source", "sample.pdf"));
        when(collectionService.retrieve("Sample", "termination clause", Optional.of(3)))
            .thenReturn(new RetrievalResult("Sample", "termination clause", 3, ScoringMode.SCORED,
                List.of(new RetrievalHit(chunk, 0.87))));

        mockMvc.perform(get("/collections/Sample/search")
                .param("q", "termination clause")
                .param("k", "3"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.top_k").value(3))
            .andExpect(jsonPath("$.scoring").value("SCORED"))
            .andExpect(jsonPath("$.results[0].rank").value(1))
            .andExpect(jsonPath("$.results[0].source").value("sample.pdf"))
            .andExpect(jsonPath("$.results[0].score").value(0.87));
    }

    @Test
    void search_ShouldOmitScoresWhenUnscored() throws Exception {
        Chunk chunk = new Chunk("Sample-1", "text", Map.of());
        when(collectionService.retrieve("Sample", "q", Optional.empty()))
            .thenReturn(new RetrievalResult("Sample", "q", 5, ScoringMode.UNSCORED, List.of(new RetrievalHit(chunk, null))));

        mockMvc.perform(get("/collections/Sample/search").param("q", "q"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.scoring").value("UNSCORED"))
            .andExpect(jsonPath("$.results[0].score").doesNotExist());
    }

    @Test
    @DisplayName("Should return 404 for an unregistered collection")
    void search_ShouldReturn404_WhenCollectionUnknown() throws Exception {
        when(collectionService.retrieve(eq("Lease"), anyString(), any()))
            .thenThrow(new UnknownCollectionException("Lease"));

        mockMvc.perform(get("/collections/Lease/search").param("q", "rent"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.status").value(404));
    }

    @Test
    void search_ShouldReturn400_WhenQueryIsMissing() throws Exception {
        mockMvc.perform(get("/collections/Sample/search"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("Parameter 'q' is missing"));
    }

    @Test
    void search_ShouldReturn400_WhenTopKOutOfRange() throws Exception {
        mockMvc.perform(get("/collections/Sample/search").param("q", "x").param("k", "-1"))
            .andExpect(status().isBadRequest());

        verifyNoInteractions(collectionService);
    }

    @Test
    void search_ShouldReturn500_WhenRetrievalFails() throws Exception {
        when(collectionService.retrieve(anyString(), anyString(), any()))
            .thenThrow(new RetrievalFailedException("Sample", new IOException("EIO")));

        mockMvc.perform(get("/collections/Sample/search").param("q", "x"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.message").value(org.hamcrest.Matchers.containsString("Sample")));
    }

    @Test
    void stats_ShouldReturn503_WhenStoreUnavailable() throws Exception {
        when(collectionService.listAllStats())
            .thenThrow(new StoreUnavailableException(Path.of("/data/store"), "directory not found"));

        mockMvc.perform(get("/collections/stats"))
            .andExpect(status().isServiceUnavailable());
    }

    @Test
    void ask_ShouldReturnAnswer() throws Exception {
        when(collectionService.ask("Sample", "Who signs?", Optional.of(4)))
            .thenReturn(new RagAnswer("Who signs?", "Both parties.", List.of("sample.pdf")));

        mockMvc.perform(post("/collections/Sample/ask")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"question\":\"Who signs?\",\"top_k\":4}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.answer").value("Both parties."))
            .andExpect(jsonPath("$.sources[0]").value("sample.pdf"));
    }

    @Test
    @DisplayName("Should return 503 when the model credential is not configured")
    void ask_ShouldReturn503_WhenCredentialMissing() throws Exception {
        when(collectionService.ask(anyString(), anyString(), any()))
            .thenThrow(new MissingCredentialException("GROQ_API_KEY"));

        mockMvc.perform(post("/collections/Sample/ask")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"question\":\"Who signs?\"}"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.message").value("Cannot build RAG chain: GROQ_API_KEY is not set"));
    }

    @Test
    void ask_ShouldReturn502_WhenGenerationFails() throws Exception {
        when(collectionService.ask(anyString(), anyString(), any()))
            .thenThrow(new GenerationFailedException("llama-3.1-8b-instant", new RuntimeException("timeout")));

        mockMvc.perform(post("/collections/Sample/ask")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"question\":\"Who signs?\"}"))
            .andExpect(status().isBadGateway());
    }

    @Test
    void ask_ShouldReturn400_WhenQuestionBlank() throws Exception {
        mockMvc.perform(post("/collections/Sample/ask")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"question\":\" \"}"))
            .andExpect(status().isBadRequest());

        verifyNoInteractions(collectionService);
    }

    @Test
    @WithAnonymousUser
    void listCollections_ShouldReturn401_WhenNotAuthenticated() throws Exception {
        mockMvc.perform(get("/collections"))
            .andExpect(status().isUnauthorized());
    }
}
