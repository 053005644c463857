package net.kairos.core.definition;

public class NoSuchDefinitionException extends RuntimeException {
    public NoSuchDefinitionException(String jobName) {
        super("Undefined job: " + jobName);
    }
}
