package com.pie.scheduler.store;

/**
 * Upstream output requested for a dependency that has not completed. Only ready nodes are
 * dispatched, so this indicates a broken node lifecycle in the scheduler.
 */
public final class MissingDependencyException extends IllegalStateException {

    private final String dependencyId;

    public MissingDependencyException(String dependencyId) {
        super("Dependency '" + dependencyId + "' has not been executed yet");
        this.dependencyId = dependencyId;
    }

    public String getDependencyId() {
        return dependencyId;
    }
}
