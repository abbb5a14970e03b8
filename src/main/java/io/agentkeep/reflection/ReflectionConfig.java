package io.agentkeep.reflection;

/**
 * Count limits applied after every {@link ReflectionStore#store}; the oldest reflections go first.
 *
 * @param maxPerSession reflections kept per session
 * @param maxPerProject reflections kept across all sessions of a project
 */
public record ReflectionConfig(int maxPerSession, int maxPerProject) {

    public static final int DEFAULT_MAX_PER_SESSION = 20;
    public static final int DEFAULT_MAX_PER_PROJECT = 100;

    public ReflectionConfig {
        if (maxPerSession <= 0 || maxPerProject <= 0) {
            throw new IllegalArgumentException("Reflection limits must be positive");
        }
    }

    public static ReflectionConfig defaults() {
        return new ReflectionConfig(DEFAULT_MAX_PER_SESSION, DEFAULT_MAX_PER_PROJECT);
    }
}
