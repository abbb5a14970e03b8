package io.agentkeep.memory;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.agentkeep.db.ProjectSchema;
import io.agentkeep.db.SQLiteDatabase;
import io.agentkeep.state.StateJson;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class MemoryTierCacheTest {

    private static final String SESSION = "s1";

    @TempDir
    Path tempDir;

    private SQLiteDatabase db;
    private ObjectMapper mapper;
    private MemoryTierCache cache;

    @BeforeEach
    void setUp() {
        db = new SQLiteDatabase(tempDir.resolve("memory.db").toString());
        db.init();
        ProjectSchema.ensureTables(db, "acme");
        mapper = StateJson.newMapper();
        cache = cache(MemoryConfig.defaults());
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    @Test
    void shouldAddItemToHotWithDefaults() {
        MemoryItem item = cache.addToHot(SESSION, "User prefers dark mode", MemoryItemType.FACT,
                new AddMemoryOptions(null, Map.of("source", "chat")));

        assertTrue(item.id().startsWith("mem_"));
        assertEquals(MemoryTier.HOT, item.tier());
        assertEquals(0, item.accessCount());
        assertEquals(1.0, item.relevanceScore());
        assertEquals(6, item.tokenCount());

        MemoryItem stored = cache.getItem(item.id()).orElseThrow();
        assertEquals(item.content(), stored.content());
        assertEquals(MemoryItemType.FACT, stored.type());
        assertEquals(Map.of("source", "chat"), stored.metadata());
        assertEquals(item.createdAt(), stored.createdAt());
        assertFalse(stored.hasEmbedding());
    }

    @Test
    void shouldStoreNullMetadataValues() {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("source", null);
        metadata.put("channel", "cli");

        MemoryItem item = cache.addToHot(SESSION, "content here", MemoryItemType.FACT,
                new AddMemoryOptions(null, metadata));

        Map<String, Object> stored = cache.getItem(item.id()).orElseThrow().metadata();
        assertTrue(stored.containsKey("source"));
        assertNull(stored.get("source"));
        assertEquals("cli", stored.get("channel"));
    }

    @Test
    void shouldCompareItemsWithEmbeddingsByValue() {
        MemoryTierCache semantic = cache(MemoryConfig.defaults(), new TopicEmbeddings(Set.of()));
        MemoryItem item = semantic.addToHot(SESSION, "feline nutrition notes", MemoryItemType.FACT);

        MemoryItem first = semantic.getItem(item.id()).orElseThrow();
        MemoryItem second = semantic.getItem(item.id()).orElseThrow();

        assertNotSame(first.embedding(), second.embedding());
        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertEquals(item, first);
    }

    @Test
    void shouldKeepHotTokensWithinBudgetForExampleScenario() {
        MemoryTierCache small = cache(MemoryConfig.builder().hotTokenLimit(100).build());

        for (int i = 0; i < 3; i++) {
            small.addToHot(SESSION, String.valueOf(i).repeat(50), MemoryItemType.MESSAGE);
            assertTrue(small.getStatus(SESSION).hot().tokens() <= 100);
        }
        assertEquals(39, small.getStatus(SESSION).hot().tokens());
    }

    @Test
    void shouldSpillBeforeInsertWhenBudgetWouldBeExceeded() {
        MemoryTierCache small = cache(MemoryConfig.builder().hotTokenLimit(30).build());

        MemoryItem first = small.addToHot(SESSION, "a".repeat(50), MemoryItemType.MESSAGE);
        MemoryItem second = small.addToHot(SESSION, "b".repeat(50), MemoryItemType.MESSAGE);
        MemoryItem third = small.addToHot(SESSION, "c".repeat(50), MemoryItemType.MESSAGE);

        assertEquals(List.of(third.id()), ids(small.getHot(SESSION)));
        assertEquals(MemoryTier.COLD, small.getItem(first.id()).orElseThrow().tier());
        assertEquals(MemoryTier.COLD, small.getItem(second.id()).orElseThrow().tier());
    }

    @Test
    void shouldHoldBudgetInvariantAcrossManyInserts() {
        MemoryTierCache small = cache(MemoryConfig.builder().hotTokenLimit(50).build());
        int[] lengths = {40, 120, 8, 200, 60, 16, 180, 4, 90, 150, 30, 70};

        for (int length : lengths) {
            small.addToHot(SESSION, "m".repeat(length), MemoryItemType.MESSAGE);
            assertTrue(small.getStatus(SESSION).hot().tokens() <= 50,
                    "hot tokens exceeded the limit after inserting " + length + " chars");
        }
    }

    @Test
    void shouldInsertOversizedItemOnceHotIsEmpty() {
        MemoryTierCache tiny = cache(MemoryConfig.builder().hotTokenLimit(10).build());
        tiny.addToHot(SESSION, "small", MemoryItemType.MESSAGE);

        MemoryItem big = tiny.addToHot(SESSION, "x".repeat(80), MemoryItemType.MESSAGE);

        assertEquals(List.of(big.id()), ids(tiny.getHot(SESSION)));
        assertEquals(20, tiny.getStatus(SESSION).hot().tokens());
    }

    @Test
    void shouldNotSpillWhenAutoSpillDisabled() {
        MemoryTierCache manual = cache(MemoryConfig.builder().hotTokenLimit(20).autoSpillEnabled(false).build());

        manual.addToHot(SESSION, "a".repeat(50), MemoryItemType.MESSAGE);
        manual.addToHot(SESSION, "b".repeat(50), MemoryItemType.MESSAGE);

        assertEquals(26, manual.getStatus(SESSION).hot().tokens());
        assertTrue(manual.getStatus(SESSION).suggests(MemorySuggestion.Type.SPILL));
    }

    @Test
    void shouldSpillLowestRelevanceThenOldestFirst() {
        MemoryItem high = add("high value", 0.9);
        MemoryItem lowOld = add("low old", 0.2);
        MemoryItem mid = add("middle", 0.5);
        MemoryItem lowNew = add("low new", 0.2);

        SpillResult result = cache.spillToWarm(SESSION, SpillOptions.count(2));

        assertEquals(2, result.spilledCount());
        assertEquals(List.of(lowOld.id(), lowNew.id()), result.spilledIds());
        assertEquals(lowOld.tokenCount() + lowNew.tokenCount(), result.tokensFreed());
        assertEquals(Set.of(high.id(), mid.id()), new HashSet<>(ids(cache.getHot(SESSION))));
    }

    @Test
    void shouldRouteSpilledItemsByAccessCount() {
        MemoryItem frequent = add("frequently used", 0.1);
        MemoryItem rare = add("rarely used", 0.1);
        db.execute("UPDATE p_acme_memory_items SET access_count = 3 WHERE id = ?", frequent.id());

        SpillResult result = cache.spillToWarm(SESSION);

        assertEquals(MemoryTier.WARM, result.destinations().get(frequent.id()));
        assertEquals(MemoryTier.COLD, result.destinations().get(rare.id()));
        assertEquals(1, cache.getByTier(SESSION, MemoryTier.WARM).size());
        assertEquals(1, cache.getByTier(SESSION, MemoryTier.COLD).size());
    }

    @Test
    void shouldSpillOnlyNamedHotItems() {
        MemoryItem keep = add("keep me", 0.1);
        MemoryItem drop = add("drop me", 0.9);
        MemoryItem otherSession = cache.addToHot("s2", "other", MemoryItemType.MESSAGE);

        SpillResult result = cache.spillToWarm(SESSION, SpillOptions.items(List.of(drop.id(), otherSession.id())));

        assertEquals(List.of(drop.id()), result.spilledIds());
        assertEquals(List.of(keep.id()), ids(cache.getHot(SESSION)));
        assertEquals(MemoryTier.HOT, cache.getItem(otherSession.id()).orElseThrow().tier());
    }

    @Test
    void shouldReturnEmptySpillWhenNothingIsHot() {
        SpillResult result = cache.spillToWarm(SESSION);

        assertEquals(0, result.spilledCount());
        assertTrue(result.spilledIds().isEmpty());
    }

    @Test
    void shouldRecallByKeywordAndUpdateAccessStats() {
        MemoryItem pipeline = cold("The deployment pipeline uses GitHub Actions", 0.5);
        cold("User prefers dark mode", 0.5);
        cold("Database migrations run with Flyway", 0.5);

        RecallResult result = cache.recall(SESSION, "deployment pipeline",
                RecallOptions.limit(1).withAutoPromote(false));

        assertEquals(1, result.items().size());
        MemoryItem recalled = result.items().get(0);
        assertEquals(pipeline.id(), recalled.id());
        assertEquals(1, recalled.accessCount());
        assertEquals(0.75, recalled.relevanceScore(), 1e-9);
        assertEquals(MemoryTier.COLD, recalled.tier());
        assertTrue(result.promoted().isEmpty());
        assertEquals(1.0, result.relevanceScores().get(pipeline.id()));
        assertEquals(3, result.relevanceScores().size());
        assertFalse(recalled.lastAccessedAt().isBefore(pipeline.lastAccessedAt()));
    }

    @Test
    void shouldNotTouchItemsThatWereNotReturned() {
        cold("The deployment pipeline uses GitHub Actions", 0.5);
        MemoryItem other = cold("User prefers dark mode", 0.5);

        cache.recall(SESSION, "deployment", RecallOptions.limit(1).withAutoPromote(false));

        MemoryItem untouched = cache.getItem(other.id()).orElseThrow();
        assertEquals(0, untouched.accessCount());
        assertEquals(0.5, untouched.relevanceScore());
    }

    @Test
    void shouldFilterRecallByMinRelevanceAndType() {
        cold("User prefers dark mode", 0.5);
        MemoryItem decision = cache.addToHot(SESSION, "Decided to use dark theme", MemoryItemType.DECISION);
        cache.demote(decision.id(), MemoryTier.WARM);

        RecallResult relevant = cache.recall(SESSION, "dark mode",
                RecallOptions.defaults().withMinRelevance(0.9).withAutoPromote(false));
        assertEquals(1, relevant.items().size());
        assertEquals(MemoryItemType.FACT, relevant.items().get(0).type());

        RecallResult decisions = cache.recall(SESSION, "dark",
                RecallOptions.defaults().withTypes(List.of(MemoryItemType.DECISION)).withAutoPromote(false));
        assertEquals(List.of(decision.id()), ids(decisions.items()));
    }

    @Test
    void shouldNeverRecallHotItems() {
        add("deployment pipeline notes", 1.0);

        RecallResult result = cache.recall(SESSION, "deployment pipeline");

        assertTrue(result.items().isEmpty());
        assertTrue(result.relevanceScores().isEmpty());
    }

    @Test
    void shouldPromoteHighlyRelevantRecallResults() {
        MemoryItem pipeline = cold("The deployment pipeline uses GitHub Actions", 0.3);
        MemoryItem partial = cold("The pipeline for data is nightly", 0.3);

        RecallResult result = cache.recall(SESSION, "deployment pipeline");

        assertEquals(List.of(pipeline.id()), result.promoted());
        MemoryItem promoted = cache.getItem(pipeline.id()).orElseThrow();
        assertEquals(MemoryTier.HOT, promoted.tier());
        assertEquals(1.0, promoted.relevanceScore());
        assertEquals(MemoryTier.COLD, cache.getItem(partial.id()).orElseThrow().tier());
    }

    @Test
    void shouldRecallByEmbeddingSimilarityWhenProviderConfigured() {
        MemoryTierCache semantic = cache(MemoryConfig.defaults(), new TopicEmbeddings(Set.of()));
        MemoryItem cat = semantic.addToHot(SESSION, "feline nutrition notes", MemoryItemType.FACT);
        MemoryItem weather = semantic.addToHot(SESSION, "weather report for Lisbon", MemoryItemType.FACT);
        semantic.demote(cat.id(), MemoryTier.COLD);
        semantic.demote(weather.id(), MemoryTier.COLD);

        assertTrue(semantic.getItem(cat.id()).orElseThrow().hasEmbedding());

        RecallResult result = semantic.recall(SESSION, "what should my feline eat",
                RecallOptions.limit(1).withAutoPromote(false));

        assertEquals(List.of(cat.id()), ids(result.items()));
        assertEquals(1.0, result.relevanceScores().get(cat.id()), 1e-6);
        assertEquals(0.0, result.relevanceScores().get(weather.id()), 1e-6);
    }

    @Test
    void shouldFallBackToKeywordsWhenQueryEmbeddingFails() {
        MemoryTierCache semantic = cache(MemoryConfig.defaults(), new TopicEmbeddings(Set.of("weather report")));
        MemoryItem weather = semantic.addToHot(SESSION, "weather report for Lisbon", MemoryItemType.FACT);
        semantic.demote(weather.id(), MemoryTier.COLD);

        RecallResult result = semantic.recall(SESSION, "weather report", RecallOptions.defaults().withAutoPromote(false));

        assertEquals(List.of(weather.id()), ids(result.items()));
        assertEquals(1.0, result.relevanceScores().get(weather.id()));
    }

    @Test
    void shouldPropagateEmbeddingFailureOnAdd() {
        MemoryTierCache semantic = cache(MemoryConfig.defaults(), new TopicEmbeddings(Set.of("broken")));

        assertThrows(IllegalStateException.class, () -> semantic.addToHot(SESSION, "broken", MemoryItemType.FACT));
        assertTrue(semantic.getHot(SESSION).isEmpty());
    }

    @Test
    void shouldTreatPromotingHotOrMissingItemAsNoOp() {
        MemoryItem hot = add("already hot", 0.4);

        assertFalse(cache.promoteToHot(hot.id()));
        assertFalse(cache.promoteToHot("mem_missing"));
        assertEquals(0.4, cache.getItem(hot.id()).orElseThrow().relevanceScore());
    }

    @Test
    void shouldSpillTwoItemsToMakeRoomForPromotion() {
        MemoryTierCache small = cache(MemoryConfig.builder().hotTokenLimit(30).build());
        MemoryItem archived = small.addToHot(SESSION, "a".repeat(50), MemoryItemType.MESSAGE);
        MemoryItem second = small.addToHot(SESSION, "b".repeat(50), MemoryItemType.MESSAGE);
        small.demote(archived.id(), MemoryTier.COLD);
        MemoryItem third = small.addToHot(SESSION, "c".repeat(50), MemoryItemType.MESSAGE);

        assertTrue(small.promoteToHot(archived.id()));

        assertEquals(List.of(archived.id()), ids(small.getHot(SESSION)));
        assertNotEquals(MemoryTier.HOT, small.getItem(second.id()).orElseThrow().tier());
        assertNotEquals(MemoryTier.HOT, small.getItem(third.id()).orElseThrow().tier());
    }

    @Test
    void shouldPromoteWithoutSpillingWhenAutoSpillDisabled() {
        MemoryTierCache manual = cache(MemoryConfig.builder().hotTokenLimit(20).autoSpillEnabled(false).build());
        MemoryItem archived = manual.addToHot(SESSION, "a".repeat(50), MemoryItemType.MESSAGE);
        manual.demote(archived.id(), MemoryTier.COLD);
        manual.addToHot(SESSION, "b".repeat(50), MemoryItemType.MESSAGE);

        assertTrue(manual.promoteToHot(archived.id()));

        assertEquals(2, manual.getHot(SESSION).size());
    }

    @Test
    void shouldDemoteDirectly() {
        MemoryItem item = add("note", 1.0);

        assertTrue(cache.demote(item.id()));
        assertEquals(MemoryTier.WARM, cache.getItem(item.id()).orElseThrow().tier());
        assertTrue(cache.demote(item.id(), MemoryTier.COLD));
        assertEquals(MemoryTier.COLD, cache.getItem(item.id()).orElseThrow().tier());
        assertFalse(cache.demote("mem_missing"));
    }

    @Test
    void shouldReportStatusWithSuggestions() {
        MemoryTierCache small = cache(MemoryConfig.builder().hotTokenLimit(100).maxColdItems(2).build());
        small.addToHot(SESSION, "h".repeat(368), MemoryItemType.CONTEXT);
        for (int i = 0; i < 3; i++) {
            MemoryItem item = small.addToHot("archive", "cold " + i, MemoryItemType.MESSAGE);
            small.demote(item.id(), MemoryTier.COLD);
        }

        MemoryStatus status = small.getStatus(SESSION);
        assertEquals(1, status.hot().items());
        assertEquals(92, status.hot().tokens());
        assertEquals(92.0, status.utilizationPercent(), 1e-9);
        assertEquals(100, status.hotLimit());
        assertTrue(status.suggests(MemorySuggestion.Type.SPILL));
        assertFalse(status.suggests(MemorySuggestion.Type.PRUNE));

        MemoryStatus archive = small.getStatus("archive");
        assertEquals(3, archive.cold().items());
        assertEquals(TierStats.EMPTY, archive.hot());
        assertTrue(archive.suggests(MemorySuggestion.Type.PRUNE));
        assertFalse(archive.suggests(MemorySuggestion.Type.SPILL));
    }

    @Test
    void shouldAggregateStatusAcrossSessions() {
        add("one", 1.0);
        cache.addToHot("s2", "two", MemoryItemType.MESSAGE);
        MemoryItem warm = cache.addToHot("s3", "three", MemoryItemType.MESSAGE);
        cache.demote(warm.id());

        MemoryStatus all = cache.getStatusAll();

        assertNull(all.sessionId());
        assertEquals(2, all.hot().items());
        assertEquals(1, all.warm().items());
        assertEquals(0, all.cold().items());
    }

    @Test
    void shouldPruneLowestRetentionScoresFromCold() {
        MemoryTierCache capped = cache(MemoryConfig.builder().maxColdItems(2).build());
        MemoryItem relevant = coldIn(capped, "relevant", 0.9);
        MemoryItem popular = coldIn(capped, "popular", 0.1);
        MemoryItem weak = coldIn(capped, "weak", 0.5);
        db.execute("UPDATE p_acme_memory_items SET access_count = 10 WHERE id = ?", popular.id());

        assertEquals(1, capped.pruneCold(SESSION));

        assertEquals(Set.of(relevant.id(), popular.id()),
                new HashSet<>(ids(capped.getByTier(SESSION, MemoryTier.COLD))));
        assertTrue(capped.getItem(weak.id()).isEmpty());
        assertEquals(0, capped.pruneCold(SESSION));
    }

    @Test
    void shouldDeleteAndClearSession() {
        MemoryItem item = add("to delete", 1.0);
        add("to clear", 1.0);
        cache.addToHot("s2", "survivor", MemoryItemType.MESSAGE);

        assertTrue(cache.delete(item.id()));
        assertFalse(cache.delete(item.id()));
        assertEquals(1, cache.clearSession(SESSION));
        assertTrue(cache.getHot(SESSION).isEmpty());
        assertEquals(1, cache.getHot("s2").size());
    }

    private MemoryTierCache cache(MemoryConfig config) {
        return cache(config, null);
    }

    private MemoryTierCache cache(MemoryConfig config, EmbeddingProvider provider) {
        return new MemoryTierCache(db, "acme", mapper, provider, config);
    }

    private MemoryItem add(String content, double relevance) {
        return cache.addToHot(SESSION, content, MemoryItemType.FACT, AddMemoryOptions.withRelevance(relevance));
    }

    private MemoryItem cold(String content, double relevance) {
        return coldIn(cache, content, relevance);
    }

    private static MemoryItem coldIn(MemoryTierCache target, String content, double relevance) {
        MemoryItem item = target.addToHot(SESSION, content, MemoryItemType.FACT, AddMemoryOptions.withRelevance(relevance));
        target.demote(item.id(), MemoryTier.COLD);
        return item;
    }

    private static List<String> ids(List<MemoryItem> items) {
        return items.stream().map(MemoryItem::id).toList();
    }

    /**
     * Two-topic embeddings: texts mentioning "feline" point one way, everything else the other.
     */
    private static final class TopicEmbeddings implements EmbeddingProvider {

        private final Set<String> failOn;

        TopicEmbeddings(Set<String> failOn) {
            this.failOn = failOn;
        }

        @Override
        public float[] embed(String text) {
            if (failOn.contains(text)) {
                throw new IllegalStateException("embedding service unavailable");
            }
            return text.contains("feline") ? new float[]{1, 0} : new float[]{0, 1};
        }
    }
}
