package com.queryforge.schema;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.queryforge.model.StoredSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Stores each schema as {@code <storage>/schemas/<id>.json}.
 */
public class FileSchemaStore implements SchemaStore {

    private static final Logger log = LoggerFactory.getLogger(FileSchemaStore.class);

    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9_-]+");
    private static final String EXTENSION = ".json";

    private final ObjectMapper objectMapper;
    private final Path schemasDir;

    /**
     * Create a store rooted at the given storage directory, creating it if needed.
     *
     * @param objectMapper Jackson object mapper
     * @param storageDir storage root
     */
    public FileSchemaStore(ObjectMapper objectMapper, Path storageDir) {
        this.objectMapper = objectMapper;
        this.schemasDir = storageDir.resolve("schemas");
        try {
            Files.createDirectories(schemasDir);
        } catch (IOException e) {
            throw new SchemaStoreException("Cannot create schema directory: " + schemasDir, e);
        }
        log.info("Schema store initialized (dir={})", schemasDir.toAbsolutePath());
    }

    @Override
    public Optional<StoredSchema> lookup(String id) {
        if (!isSafeId(id)) {
            return Optional.empty();
        }
        Path file = fileFor(id);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        return read(file);
    }

    @Override
    public StoredSchema save(StoredSchema schema) {
        if (schema.getId() == null || schema.getId().isBlank()) {
            schema.setId(UUID.randomUUID().toString());
        } else if (!isSafeId(schema.getId())) {
            throw new IllegalArgumentException("Invalid schema id: " + schema.getId());
        }

        OffsetDateTime now = OffsetDateTime.now();
        if (schema.getCreatedAt() == null) {
            schema.setCreatedAt(now);
        }
        schema.setUpdatedAt(now);

        Path file = fileFor(schema.getId());
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), schema);
        } catch (IOException e) {
            throw new SchemaStoreException("Failed to save schema " + schema.getId(), e);
        }
        log.debug("Saved schema {} ({})", schema.getId(), schema.getName());
        return schema;
    }

    @Override
    public List<StoredSchema> list() {
        List<StoredSchema> schemas = new ArrayList<>();
        try (Stream<Path> files = Files.list(schemasDir)) {
            files.filter(p -> p.getFileName().toString().endsWith(EXTENSION))
                    .forEach(p -> read(p).ifPresent(schemas::add));
        } catch (IOException e) {
            log.error("Failed to list schemas in {}", schemasDir, e);
            return List.of();
        }

        schemas.sort(Comparator.comparing(
                StoredSchema::getUpdatedAt,
                Comparator.nullsLast(Comparator.reverseOrder())));
        return schemas;
    }

    @Override
    public boolean delete(String id) {
        if (!isSafeId(id)) {
            return false;
        }
        try {
            return Files.deleteIfExists(fileFor(id));
        } catch (IOException e) {
            throw new SchemaStoreException("Failed to delete schema " + id, e);
        }
    }

    private Optional<StoredSchema> read(Path file) {
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), StoredSchema.class));
        } catch (IOException e) {
            log.warn("Skipping unreadable schema file {}: {}", file.getFileName(), e.getMessage());
            return Optional.empty();
        }
    }

    private Path fileFor(String id) {
        return schemasDir.resolve(id + EXTENSION);
    }

    private boolean isSafeId(String id) {
        return id != null && SAFE_ID.matcher(id).matches();
    }
}
