package net.homeroute.domain.registry;

import java.util.List;

/**
 * Values used when the persisted document is missing or lacks a top-level field.
 */
public final class RegistryDefaults {

    public static final String PRODUCTION_ID = "prod";

    private RegistryDefaults() {
    }

    public static List<Environment> environments() {
        return List.of(
            new Environment(PRODUCTION_ID, "Production", "", "api", true),
            new Environment("dev", "Development", "dev", "api.dev", false)
        );
    }

    public static Registry emptyRegistry(int schemaVersion) {
        return new Registry(schemaVersion, 0L, "", environments(), List.of(), List.of(), CloudflareSettings.DISABLED, null);
    }
}
