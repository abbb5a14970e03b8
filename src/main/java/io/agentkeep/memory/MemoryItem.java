package io.agentkeep.memory;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.Arrays;
import java.util.Map;
import java.util.Objects;

/**
 * A unit of session memory living in exactly one tier.
 *
 * @param id             generated identifier ({@code mem_...})
 * @param sessionId      owning session
 * @param content        the remembered text
 * @param type           kind of content
 * @param tier           current tier
 * @param accessCount    number of times the item was returned by a recall
 * @param lastAccessedAt last recall (or creation) time
 * @param createdAt      insertion time
 * @param relevanceScore 0..1, running average of recall relevance; reset to 1.0 on promotion
 * @param tokenCount     estimated tokens of {@code content}
 * @param metadata       free-form metadata
 * @param embedding      stored embedding, null when no provider was configured
 */
public record MemoryItem(
        String id,
        String sessionId,
        String content,
        MemoryItemType type,
        MemoryTier tier,
        int accessCount,
        Instant lastAccessedAt,
        Instant createdAt,
        double relevanceScore,
        int tokenCount,
        Map<String, Object> metadata,
        @JsonIgnore float[] embedding
) {
    public boolean hasEmbedding() {
        return embedding != null && embedding.length > 0;
    }

    /** Score used to rank cold items for pruning. */
    public double retentionScore() {
        return relevanceScore + accessCount * 0.1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MemoryItem other)) return false;
        return accessCount == other.accessCount
                && Double.compare(relevanceScore, other.relevanceScore) == 0
                && tokenCount == other.tokenCount
                && Objects.equals(id, other.id)
                && Objects.equals(sessionId, other.sessionId)
                && Objects.equals(content, other.content)
                && type == other.type
                && tier == other.tier
                && Objects.equals(lastAccessedAt, other.lastAccessedAt)
                && Objects.equals(createdAt, other.createdAt)
                && Objects.equals(metadata, other.metadata)
                && Arrays.equals(embedding, other.embedding);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(id, sessionId, content, type, tier, accessCount, lastAccessedAt, createdAt,
                relevanceScore, tokenCount, metadata);
        return 31 * result + Arrays.hashCode(embedding);
    }

    @Override
    public String toString() {
        return "MemoryItem[id=" + id + ", sessionId=" + sessionId + ", type=" + type + ", tier=" + tier
                + ", accessCount=" + accessCount + ", relevanceScore=" + relevanceScore
                + ", tokenCount=" + tokenCount + ", embedding="
                + (embedding != null ? embedding.length + " dims" : "none") + "]";
    }
}
