package io.agentkeep.embedding;

import org.junit.jupiter.api.Test;
import org.springframework.ai.embedding.EmbeddingModel;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class SpringAiEmbeddingProviderTest {

    private final EmbeddingModel embeddingModel = mock(EmbeddingModel.class);
    private final SpringAiEmbeddingProvider provider = new SpringAiEmbeddingProvider(embeddingModel);

    @Test
    void shouldDelegateToEmbeddingModel() {
        when(embeddingModel.embed("deploy checklist")).thenReturn(new float[]{0.1f, 0.2f, 0.3f});

        float[] vector = provider.embed("deploy checklist");

        assertArrayEquals(new float[]{0.1f, 0.2f, 0.3f}, vector);
        verify(embeddingModel).embed("deploy checklist");
    }

    @Test
    void shouldPropagateModelFailures() {
        when(embeddingModel.embed(anyString())).thenThrow(new IllegalStateException("rate limited"));

        var e = assertThrows(IllegalStateException.class, () -> provider.embed("anything"));
        assertEquals("rate limited", e.getMessage());
    }
}
