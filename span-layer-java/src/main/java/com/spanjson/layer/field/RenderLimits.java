package com.spanjson.layer.field;

/**
 * Bounds on how much of an object graph {@link DebugRenderer} walks, taken from
 * {@code depth} and {@code max_elements} in the layer configuration.
 *
 * @param depthLimit            nesting level at which only the type name is rendered
 * @param maxCollectionElements elements shown per array, collection or map
 */
public record RenderLimits(int depthLimit, int maxCollectionElements) {

    public static RenderLimits defaults() {
        return new RenderLimits(2, 3);
    }
}
