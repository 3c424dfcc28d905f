package com.assetloom.asset;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when the registry is built from a dependency graph containing a cycle.
 */
public class CircularDependencyException extends AssetException {

    private final List<Long> cycle;

    public CircularDependencyException(List<Long> cycle) {
        super(cycle.get(0), "Circular dependency detected: "
            + cycle.stream().map(String::valueOf).collect(Collectors.joining(" -> ")));
        this.cycle = List.copyOf(cycle);
    }

    /**
     * Gets the ids along the cycle, starting and ending with the same id.
     *
     * @return the cycle path
     */
    public List<Long> getCycle() {
        return cycle;
    }
}
