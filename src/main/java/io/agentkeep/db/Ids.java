package io.agentkeep.db;

import java.util.UUID;

/**
 * Prefixed random identifiers, e.g. {@code ckpt_3f1c...}.
 */
public final class Ids {

    private Ids() {
    }

    public static String generate(String prefix) {
        String id = UUID.randomUUID().toString();
        return prefix == null || prefix.isEmpty() ? id : prefix + "_" + id;
    }
}
