package com.spanjson.layer.config;

import com.spanjson.layer.field.RenderLimits;

/**
 * Settings of a {@link com.spanjson.layer.JsonLayer}.
 *
 * Parsed from key=value pairs separated by commas, e.g.
 * {@code name=cats,spans=false,depth=3}:
 *   name        : service name emitted as source.name (default: "app")
 *   spans       : "true"/"false" : emit start/end records for spans (default: true)
 *   elapsed     : "true"/"false" : add elapsed to end records (default: true)
 *   depth       : debug rendering depth limit (default: 2)
 *   max_elements: max collection elements rendered (default: 3)
 */
public record LayerConfig(
    String name,
    boolean spansEnabled,
    boolean elapsedEnabled,
    int depthLimit,
    int maxCollectionElements
) {

    /** System property read by {@link #fromSystemProperties()}. */
    public static final String PROPERTY = "spanjson.config";

    public static LayerConfig defaults() {
        return parse(null);
    }

    public static LayerConfig fromSystemProperties() {
        return parse(System.getProperty(PROPERTY));
    }

    public static LayerConfig parse(String args) {
        String name = "app";
        boolean spansEnabled = true;
        boolean elapsedEnabled = true;
        int depthLimit = 2;
        int maxCollectionElements = 3;

        if (args != null && !args.isBlank()) {
            for (String part : args.split(",")) {
                String[] kv = part.split("=", 2);
                if (kv.length == 2) {
                    switch (kv[0].trim()) {
                        case "name"         -> name           = kv[1].trim();
                        case "spans"        -> spansEnabled   = !"false".equalsIgnoreCase(kv[1].trim());
                        case "elapsed"      -> elapsedEnabled = !"false".equalsIgnoreCase(kv[1].trim());
                        case "depth"        -> depthLimit     = parseInt(kv[1], depthLimit);
                        case "max_elements" -> maxCollectionElements = parseInt(kv[1], maxCollectionElements);
                        default -> { }
                    }
                }
            }
        }
        return new LayerConfig(name, spansEnabled, elapsedEnabled, depthLimit, maxCollectionElements);
    }

    public LayerConfig withName(String name) {
        return new LayerConfig(name, spansEnabled, elapsedEnabled, depthLimit, maxCollectionElements);
    }

    public RenderLimits renderLimits() {
        return new RenderLimits(depthLimit, maxCollectionElements);
    }

    private static int parseInt(String raw, int fallback) {
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}
