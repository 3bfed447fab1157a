package com.ryuqq.unifiedstate.core.exception;

/**
 * Raised when no chain of registered transformers leads from one schema version to another.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class NoMigrationPathException extends StateException {

    public static final String ERROR_CODE = "STATE-005";

    private final String fromVersion;
    private final String toVersion;

    public NoMigrationPathException(String fromVersion, String toVersion) {
        super(ERROR_CODE, "No migration path from " + fromVersion + " to " + toVersion);
        this.fromVersion = fromVersion;
        this.toVersion = toVersion;
    }

    public String fromVersion() {
        return fromVersion;
    }

    public String toVersion() {
        return toVersion;
    }
}
