package io.agentkeep.reflection;

/**
 * Thrown when a reflection id does not exist in the project.
 */
public class ReflectionNotFoundException extends RuntimeException {

    private final String reflectionId;

    public ReflectionNotFoundException(String reflectionId) {
        super("Reflection not found: " + reflectionId);
        this.reflectionId = reflectionId;
    }

    public String getReflectionId() {
        return reflectionId;
    }
}
