package com.appspec.generator.codegen.artifact;

import java.util.Set;
import java.util.stream.Collectors;

import com.appspec.generator.codegen.exception.ConfigurationException;

/**
 * Read access to the artifact registry restricted to the keys one unit declared in its
 * {@code requires}. Reading anything else is a configuration error of that unit.
 */
public class ArtifactView {

    private final ArtifactRegistry registry;
    private final String unitId;
    private final Set<String> readable;

    public ArtifactView(ArtifactRegistry registry, String unitId, Set<ArtifactKey<?>> requires) {
        this.registry = registry;
        this.unitId = unitId;
        this.readable = requires.stream().map(ArtifactKey::getName).collect(Collectors.toUnmodifiableSet());
    }

    public <T> T get(ArtifactKey<T> key) {
        if (!readable.contains(key.getName())) {
            throw new ConfigurationException(unitId,
                    "'" + unitId + "' reads artifact '" + key + "' without declaring it in requires");
        }
        try {
            return registry.get(key);
        } catch (ConfigurationException e) {
            throw new ConfigurationException(unitId, "'" + unitId + "' requires " + key + ": " + e.getMessage());
        }
    }
}
