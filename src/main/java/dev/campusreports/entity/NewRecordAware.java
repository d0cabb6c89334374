package dev.campusreports.entity;

/**
 * Marker interface for entities that track their persistence state
 * via a {@code newRecord} flag. Entities with pre-assigned Snowflake IDs
 * implement this so {@link dev.campusreports.config.PersistableEntityCallback}
 * can mark loaded rows as existing without reflection.
 */
public interface NewRecordAware {
    void setNewRecord(boolean newRecord);
}
