package com.queryforge.schema;

import com.queryforge.model.StoredSchema;

import java.util.List;
import java.util.Optional;

/**
 * Persistence of schema definitions referenced by generation requests.
 */
public interface SchemaStore {

    /**
     * Look up a schema by id.
     *
     * @param id schema id
     * @return schema, empty when unknown or unreadable
     */
    Optional<StoredSchema> lookup(String id);

    /**
     * Create or replace a schema. Assigns an id when missing and refreshes the update timestamp.
     *
     * @param schema schema to save
     * @return saved schema
     */
    StoredSchema save(StoredSchema schema);

    /**
     * @return all schemas, most recently updated first
     */
    List<StoredSchema> list();

    /**
     * @param id schema id
     * @return whether a schema was removed
     */
    boolean delete(String id);
}
