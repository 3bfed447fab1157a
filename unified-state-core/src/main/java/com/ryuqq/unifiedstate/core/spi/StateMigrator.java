package com.ryuqq.unifiedstate.core.spi;

/**
 * Transforms a stored value between schema versions.
 *
 * @param <T> migrated value type
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface StateMigrator<T> {

    /**
     * Returns the class of values this migrator understands.
     *
     * @return value class
     */
    Class<T> valueType();

    /**
     * Migrates {@code value} from {@code fromVersion} to {@code toVersion}.
     *
     * @param fromVersion current schema version
     * @param toVersion requested schema version
     * @param value current value
     * @return migrated value
     * @throws com.ryuqq.unifiedstate.core.exception.NoMigrationPathException if the versions are not connected
     * @throws com.ryuqq.unifiedstate.core.exception.StateMigrationException if a transformation step fails
     */
    T migrateState(String fromVersion, String toVersion, T value);
}
