package io.agentkeep.memory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.agentkeep.db.Ids;
import io.agentkeep.db.ProjectSchema;
import io.agentkeep.db.SqlDatabase;
import io.agentkeep.db.StoreException;
import io.agentkeep.db.Timestamps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * Hot/warm/cold working memory of one project, scoped per session.
 *
 * <p>New items enter the hot tier, which is held under a token budget. When an insert or a
 * promotion would exceed the budget, the least relevant and oldest hot items are spilled:
 * to warm if they were accessed at least {@code warmAccessThreshold} times, to cold
 * otherwise. Warm and cold items come back through {@link #recall}, scored by embedding
 * similarity when an {@link EmbeddingProvider} is configured and by keyword overlap
 * otherwise. Cold storage is capped per session by {@link #pruneCold}.</p>
 *
 * <p>Multi-statement changes (spill then insert, spill then promote, select then prune)
 * run in a single transaction. Calls for the same session are not coordinated beyond
 * that; callers drive one session from one agent at a time.</p>
 */
public class MemoryTierCache {

    private static final Logger log = LoggerFactory.getLogger(MemoryTierCache.class);

    static final int PROMOTE_SPILL_COUNT = 2;

    private static final String COLUMNS = "id, session_id, content, type, tier, access_count, last_accessed_at, "
            + "created_at, relevance_score, token_count, metadata_json, embedding_json";

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

    private final SqlDatabase db;
    private final String projectId;
    private final String table;
    private final ObjectMapper objectMapper;
    private final EmbeddingProvider embeddingProvider;
    private final MemoryConfig config;

    public MemoryTierCache(SqlDatabase db, String projectId, ObjectMapper objectMapper) {
        this(db, projectId, objectMapper, null, MemoryConfig.defaults());
    }

    public MemoryTierCache(SqlDatabase db, String projectId, ObjectMapper objectMapper,
                           EmbeddingProvider embeddingProvider, MemoryConfig config) {
        this.db = db;
        this.projectId = projectId;
        this.table = ProjectSchema.memoryItemsTable(projectId);
        this.objectMapper = objectMapper;
        this.embeddingProvider = embeddingProvider;
        this.config = config != null ? config : MemoryConfig.defaults();
    }

    public MemoryConfig config() {
        return config;
    }

    public String projectId() {
        return projectId;
    }

    public boolean hasEmbeddingProvider() {
        return embeddingProvider != null;
    }

    /**
     * Adds an item to the hot tier, spilling first if auto-spill is on and the item would not
     * fit in the budget. An item larger than the whole budget is still inserted once hot is empty.
     */
    public MemoryItem addToHot(String sessionId, String content, MemoryItemType type, AddMemoryOptions options) {
        AddMemoryOptions opts = options != null ? options : AddMemoryOptions.defaults();
        int tokenCount = Relevance.estimateTokens(content);
        float[] embedding = embeddingProvider != null ? embeddingProvider.embed(content) : null;

        Instant now = Timestamps.now();
        MemoryItem item = new MemoryItem(
                Ids.generate("mem"),
                sessionId,
                content,
                type != null ? type : MemoryItemType.CONTEXT,
                MemoryTier.HOT,
                0,
                now,
                now,
                opts.relevanceScore() != null ? opts.relevanceScore() : 1.0,
                tokenCount,
                opts.metadata(),
                embedding
        );

        db.inTransaction(() -> {
            if (config.autoSpillEnabled()) {
                makeRoom(sessionId, tokenCount);
            }
            db.execute("INSERT INTO " + table + " (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                    item.id(),
                    item.sessionId(),
                    item.content(),
                    item.type().value(),
                    item.tier().value(),
                    item.accessCount(),
                    item.lastAccessedAt(),
                    item.createdAt(),
                    item.relevanceScore(),
                    item.tokenCount(),
                    toJson(item.metadata()),
                    embedding != null ? toJson(embedding) : null);
        });

        log.debug("Added {} item {} to hot memory of session '{}' ({} tokens)", item.type().value(),
                item.id(), sessionId, tokenCount);
        return item;
    }

    public MemoryItem addToHot(String sessionId, String content, MemoryItemType type) {
        return addToHot(sessionId, content, type, AddMemoryOptions.defaults());
    }

    public List<MemoryItem> getHot(String sessionId) {
        return getByTier(sessionId, MemoryTier.HOT);
    }

    /**
     * Items of a tier, newest first.
     */
    public List<MemoryItem> getByTier(String sessionId, MemoryTier tier) {
        return db.fetchMany("""
                        SELECT %s FROM %s
                        WHERE session_id = ? AND tier = ?
                        ORDER BY created_at DESC, rowid DESC
                        """.formatted(COLUMNS, table),
                this::toItem, sessionId, tier.value());
    }

    public Optional<MemoryItem> getItem(String itemId) {
        return db.fetchOne("SELECT " + COLUMNS + " FROM " + table + " WHERE id = ?", this::toItem, itemId);
    }

    /**
     * Moves items out of the hot tier: the named items, or else the {@code count} hot items
     * with the lowest {@code (relevance, created_at)}. Named items that are not hot or belong
     * to another session are ignored.
     */
    public SpillResult spillToWarm(String sessionId, SpillOptions options) {
        SpillOptions opts = options != null ? options : SpillOptions.defaults();
        SpillResult result = db.inTransaction(() -> {
            List<MemoryItem> selected = opts.itemIds() != null
                    ? hotItemsByIds(sessionId, opts.itemIds())
                    : selectForSpill(sessionId, opts.resolvedCount());
            return spill(selected);
        });
        if (result.spilledCount() > 0) {
            log.debug("Spilled {} items ({} tokens) from hot memory of session '{}'", result.spilledCount(),
                    result.tokensFreed(), sessionId);
        }
        return result;
    }

    public SpillResult spillToWarm(String sessionId) {
        return spillToWarm(sessionId, SpillOptions.defaults());
    }

    /**
     * Finds the warm and cold items most relevant to a query.
     *
     * <p>Each returned item has its access count incremented, its access time refreshed and
     * its relevance replaced by the average of the old value and this query's relevance.
     * Items scoring at least {@code promoteThreshold} are promoted when auto-promotion applies.</p>
     */
    public RecallResult recall(String sessionId, String query, RecallOptions options) {
        RecallOptions opts = options != null ? options : RecallOptions.defaults();
        List<MemoryItem> candidates = recallCandidates(sessionId, opts.types());

        float[] queryEmbedding = null;
        if (embeddingProvider != null && !candidates.isEmpty() && query != null && !query.isBlank()) {
            try {
                queryEmbedding = embeddingProvider.embed(query);
            } catch (RuntimeException e) {
                log.warn("Query embedding failed, falling back to keyword relevance: {}", e.getMessage());
            }
        }

        Map<String, Double> scores = new LinkedHashMap<>();
        for (MemoryItem item : candidates) {
            double score = queryEmbedding != null && item.hasEmbedding()
                    ? Relevance.cosineSimilarity(queryEmbedding, item.embedding())
                    : Relevance.keywordRelevance(query, item.content());
            scores.put(item.id(), score);
        }

        List<MemoryItem> ranked = candidates.stream()
                .filter(item -> scores.get(item.id()) >= opts.minRelevance())
                .sorted(Comparator.comparingDouble((MemoryItem item) -> scores.get(item.id())).reversed())
                .limit(opts.limit())
                .toList();

        boolean autoPromote = opts.autoPromote() != null ? opts.autoPromote() : config.autoPromoteEnabled();
        List<String> promoted = new ArrayList<>();
        Instant now = Timestamps.now();

        for (MemoryItem item : ranked) {
            double relevance = scores.get(item.id());
            db.execute("""
                            UPDATE %s
                            SET access_count = access_count + 1,
                                last_accessed_at = ?,
                                relevance_score = (relevance_score + ?) / 2
                            WHERE id = ?
                            """.formatted(table),
                    now, clamp(relevance), item.id());

            if (autoPromote && relevance >= config.promoteThreshold() && promoteToHot(item.id())) {
                promoted.add(item.id());
            }
        }

        List<MemoryItem> recalled = new ArrayList<>();
        for (MemoryItem item : ranked) {
            getItem(item.id()).ifPresent(recalled::add);
        }

        log.debug("Recall in session '{}' scanned {} items, returned {}, promoted {}", sessionId,
                candidates.size(), recalled.size(), promoted.size());
        return new RecallResult(List.copyOf(recalled), List.copyOf(promoted), Collections.unmodifiableMap(scores));
    }

    public RecallResult recall(String sessionId, String query) {
        return recall(sessionId, query, RecallOptions.defaults());
    }

    /**
     * Moves an item back to hot and resets its relevance to 1.0, spilling two hot items first
     * when auto-spill is on and the item would not fit.
     *
     * @return false when the item does not exist or is already hot
     */
    public boolean promoteToHot(String itemId) {
        Optional<MemoryItem> found = getItem(itemId);
        if (found.isEmpty() || found.get().tier() == MemoryTier.HOT) {
            return false;
        }
        MemoryItem item = found.get();

        db.inTransaction(() -> {
            if (config.autoSpillEnabled()
                    && hotTokens(item.sessionId()) + item.tokenCount() > config.hotTokenLimit()) {
                spill(selectForSpill(item.sessionId(), PROMOTE_SPILL_COUNT));
            }
            db.execute("UPDATE " + table + " SET tier = ?, relevance_score = 1.0 WHERE id = ?",
                    MemoryTier.HOT.value(), itemId);
        });

        log.debug("Promoted item {} from {} to hot", itemId, item.tier().value());
        return true;
    }

    /**
     * Moves an item to another tier (warm by default) without any eligibility check or
     * budget accounting.
     *
     * @return false when the item does not exist
     */
    public boolean demote(String itemId, MemoryTier targetTier) {
        MemoryTier target = targetTier != null ? targetTier : MemoryTier.WARM;
        int updated = db.execute("UPDATE " + table + " SET tier = ? WHERE id = ?", target.value(), itemId);
        if (updated > 0) {
            log.debug("Demoted item {} to {}", itemId, target.value());
        }
        return updated > 0;
    }

    public boolean demote(String itemId) {
        return demote(itemId, MemoryTier.WARM);
    }

    /**
     * Tier usage of a session with advisory suggestions.
     */
    public MemoryStatus getStatus(String sessionId) {
        Map<MemoryTier, TierStats> stats = tierStats("WHERE session_id = ?", sessionId);
        return toStatus(sessionId, stats);
    }

    /**
     * Tier usage summed over every session of the project.
     */
    public MemoryStatus getStatusAll() {
        return toStatus(null, tierStats(""));
    }

    public boolean delete(String itemId) {
        return db.execute("DELETE FROM " + table + " WHERE id = ?", itemId) > 0;
    }

    public int clearSession(String sessionId) {
        int deleted = db.execute("DELETE FROM " + table + " WHERE session_id = ?", sessionId);
        log.info("Cleared {} memory items for session '{}'", deleted, sessionId);
        return deleted;
    }

    /**
     * Trims cold storage of a session to {@code maxColdItems}, deleting the items with the lowest
     * {@code relevance + accessCount * 0.1}.
     *
     * @return number of deleted items
     */
    public int pruneCold(String sessionId) {
        int deleted = db.inTransaction(() -> {
            List<MemoryItem> cold = new ArrayList<>(getByTier(sessionId, MemoryTier.COLD));
            int excess = cold.size() - config.maxColdItems();
            if (excess <= 0) {
                return 0;
            }

            cold.sort(Comparator.comparingDouble(MemoryItem::retentionScore)
                    .thenComparing(MemoryItem::createdAt));
            List<String> doomed = cold.subList(0, excess).stream().map(MemoryItem::id).toList();

            StringJoiner placeholders = new StringJoiner(",");
            doomed.forEach(id -> placeholders.add("?"));
            return db.execute("DELETE FROM " + table + " WHERE id IN (" + placeholders + ")", doomed.toArray());
        });
        if (deleted > 0) {
            log.info("Pruned {} cold memory items for session '{}'", deleted, sessionId);
        }
        return deleted;
    }

    private void makeRoom(String sessionId, int incomingTokens) {
        int hotTokens = hotTokens(sessionId);
        while (hotTokens + incomingTokens > config.hotTokenLimit()) {
            SpillResult result = spill(selectForSpill(sessionId, SpillOptions.DEFAULT_COUNT));
            if (result.spilledCount() == 0) {
                break;
            }
            hotTokens -= result.tokensFreed();
        }
    }

    private SpillResult spill(List<MemoryItem> items) {
        if (items.isEmpty()) {
            return SpillResult.empty();
        }
        List<String> ids = new ArrayList<>();
        Map<String, MemoryTier> destinations = new LinkedHashMap<>();
        int tokensFreed = 0;

        for (MemoryItem item : items) {
            MemoryTier target = item.accessCount() >= config.warmAccessThreshold() ? MemoryTier.WARM : MemoryTier.COLD;
            db.execute("UPDATE " + table + " SET tier = ? WHERE id = ?", target.value(), item.id());
            ids.add(item.id());
            destinations.put(item.id(), target);
            tokensFreed += item.tokenCount();
        }
        return new SpillResult(ids.size(), List.copyOf(ids), Collections.unmodifiableMap(destinations), tokensFreed);
    }

    private List<MemoryItem> selectForSpill(String sessionId, int count) {
        return db.fetchMany("""
                        SELECT %s FROM %s
                        WHERE session_id = ? AND tier = 'hot'
                        ORDER BY relevance_score ASC, created_at ASC, rowid ASC
                        LIMIT ?
                        """.formatted(COLUMNS, table),
                this::toItem, sessionId, count);
    }

    private List<MemoryItem> hotItemsByIds(String sessionId, List<String> ids) {
        if (ids.isEmpty()) {
            return List.of();
        }
        StringJoiner placeholders = new StringJoiner(",");
        List<Object> params = new ArrayList<>();
        params.add(sessionId);
        for (String id : ids) {
            placeholders.add("?");
            params.add(id);
        }
        return db.fetchMany("SELECT " + COLUMNS + " FROM " + table
                        + " WHERE session_id = ? AND tier = 'hot' AND id IN (" + placeholders + ")",
                this::toItem, params.toArray());
    }

    private List<MemoryItem> recallCandidates(String sessionId, List<MemoryItemType> types) {
        StringBuilder sql = new StringBuilder("SELECT " + COLUMNS + " FROM " + table
                + " WHERE session_id = ? AND tier IN ('warm', 'cold')");
        List<Object> params = new ArrayList<>();
        params.add(sessionId);
        if (!types.isEmpty()) {
            StringJoiner placeholders = new StringJoiner(",");
            for (MemoryItemType type : types) {
                placeholders.add("?");
                params.add(type.value());
            }
            sql.append(" AND type IN (").append(placeholders).append(")");
        }
        sql.append(" ORDER BY created_at DESC, rowid DESC");
        return db.fetchMany(sql.toString(), this::toItem, params.toArray());
    }

    private int hotTokens(String sessionId) {
        return db.fetchOne("SELECT COALESCE(SUM(token_count), 0) FROM " + table
                        + " WHERE session_id = ? AND tier = 'hot'",
                rs -> rs.getInt(1), sessionId).orElse(0);
    }

    private Map<MemoryTier, TierStats> tierStats(String where, Object... params) {
        Map<MemoryTier, TierStats> stats = new EnumMap<>(MemoryTier.class);
        for (MemoryTier tier : MemoryTier.values()) {
            stats.put(tier, TierStats.EMPTY);
        }
        db.fetchMany("SELECT tier, COUNT(*) AS items, COALESCE(SUM(token_count), 0) AS tokens FROM " + table
                        + " " + where + " GROUP BY tier",
                rs -> {
                    stats.put(MemoryTier.fromString(rs.getString("tier")),
                            new TierStats(rs.getInt("items"), rs.getInt("tokens")));
                    return null;
                },
                params);
        return stats;
    }

    private MemoryStatus toStatus(String sessionId, Map<MemoryTier, TierStats> stats) {
        TierStats hot = stats.get(MemoryTier.HOT);
        TierStats cold = stats.get(MemoryTier.COLD);

        List<MemorySuggestion> suggestions = new ArrayList<>();
        if (hot.tokens() > config.hotTokenLimit() * 0.9) {
            suggestions.add(new MemorySuggestion(MemorySuggestion.Type.SPILL, "Hot memory near capacity (>90%)"));
        }
        if (cold.items() > config.maxColdItems()) {
            suggestions.add(new MemorySuggestion(MemorySuggestion.Type.PRUNE,
                    "Cold storage exceeds %d items".formatted(config.maxColdItems())));
        }

        double utilization = (double) hot.tokens() / config.hotTokenLimit() * 100;
        return new MemoryStatus(sessionId, hot, config.hotTokenLimit(), utilization,
                stats.get(MemoryTier.WARM), cold, List.copyOf(suggestions));
    }

    private MemoryItem toItem(ResultSet rs) throws SQLException {
        String metadataJson = rs.getString("metadata_json");
        String embeddingJson = rs.getString("embedding_json");
        return new MemoryItem(
                rs.getString("id"),
                rs.getString("session_id"),
                rs.getString("content"),
                MemoryItemType.fromString(rs.getString("type")),
                MemoryTier.fromString(rs.getString("tier")),
                rs.getInt("access_count"),
                Timestamps.parse(rs.getString("last_accessed_at")),
                Timestamps.parse(rs.getString("created_at")),
                rs.getDouble("relevance_score"),
                rs.getInt("token_count"),
                metadataJson != null ? fromJson(metadataJson, METADATA_TYPE) : Map.of(),
                embeddingJson != null ? fromJson(embeddingJson, new TypeReference<float[]>() {}) : null
        );
    }

    private static double clamp(double score) {
        return Math.max(0, Math.min(1, score));
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to serialize memory item field", e);
        }
    }

    private <T> T fromJson(String json, TypeReference<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to deserialize memory item field", e);
        }
    }
}
