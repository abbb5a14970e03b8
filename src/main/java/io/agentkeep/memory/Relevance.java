package io.agentkeep.memory;

/**
 * Scoring helpers for recall and token budgeting.
 */
public final class Relevance {

    private Relevance() {
    }

    /**
     * Estimated token count of a text, about four characters per token.
     */
    public static int estimateTokens(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return (text.length() + 3) / 4;
    }

    /**
     * Cosine similarity; 0 for vectors of different length or with zero magnitude.
     */
    public static double cosineSimilarity(float[] a, float[] b) {
        if (a == null || b == null || a.length != b.length || a.length == 0) {
            return 0;
        }

        double dot = 0;
        double normA = 0;
        double normB = 0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }

        if (normA == 0 || normB == 0) {
            return 0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    /**
     * Share of query words found in the content. Words of two characters or fewer never
     * match but still count towards the total.
     */
    public static double keywordRelevance(String query, String content) {
        if (query == null || query.isBlank() || content == null) {
            return 0;
        }
        String[] words = query.toLowerCase().trim().split("\\s+");
        String haystack = content.toLowerCase();

        int matches = 0;
        for (String word : words) {
            if (word.length() > 2 && haystack.contains(word)) {
                matches++;
            }
        }
        return (double) matches / words.length;
    }
}
