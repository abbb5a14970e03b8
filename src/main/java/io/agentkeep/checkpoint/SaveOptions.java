package io.agentkeep.checkpoint;

/**
 * Options for {@link CheckpointStore#save}. A null trigger type means {@code auto}.
 */
public record SaveOptions(
        String description,
        TriggerType triggerType,
        long durationMs,
        Integer tokenUsage
) {
    public static SaveOptions defaults() {
        return new SaveOptions(null, TriggerType.AUTO, 0, null);
    }

    public static SaveOptions auto(long durationMs) {
        return new SaveOptions(null, TriggerType.AUTO, durationMs, null);
    }

    public static SaveOptions of(TriggerType triggerType, String description, long durationMs) {
        return new SaveOptions(description, triggerType, durationMs, null);
    }

    public TriggerType resolvedTriggerType() {
        return triggerType != null ? triggerType : TriggerType.AUTO;
    }
}
