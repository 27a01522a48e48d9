package webscan.http;

import webscan.model.ParameterLocation;

import java.util.Objects;

/**
 * Name and origin of the parameter a probe request carries its payload in.
 *
 * @param name parameter name, or the path segment index for path injection
 * @param location where the parameter lives
 */
public record TargetParameter(String name, ParameterLocation location) {
    public TargetParameter {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(location, "location cannot be null");
    }
}
