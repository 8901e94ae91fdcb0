package com.queryforge.safety;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.queryforge.model.DialectFamily;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Rules for MongoDB-style aggregation pipelines.
 *
 * Operator names are matched as plain substrings, so an operator quoted inside a string value still counts.
 */
public class DocumentStoreRules implements FamilyRules {

    static final String INVALID_FORMAT_VIOLATION = "Invalid MongoDB query format";
    static final String WRITE_OPERATION_VIOLATION = "MongoDB write operations not allowed in strict mode";

    static final List<String> UNSAFE_OPERATIONS = List.of(
            "$out", "$merge", "$addFields", "$set", "$unset",
            "$replaceRoot", "$replaceWith", "insertOne", "insertMany",
            "updateOne", "updateMany", "deleteOne", "deleteMany",
            "replaceOne", "findOneAndUpdate", "findOneAndDelete",
            "findOneAndReplace", "bulkWrite", "createIndex", "dropIndex"
    );

    // Upper-cased for a case-insensitive scan of shell-style (non-JSON) queries.
    private static final List<String> WRITE_METHODS = List.of(
            "INSERTONE", "INSERTMANY", "UPDATEONE", "UPDATEMANY", "DELETEONE", "DELETEMANY"
    );

    private final ObjectReader jsonReader;

    public DocumentStoreRules(ObjectMapper objectMapper) {
        this.jsonReader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    @Override
    public DialectFamily family() {
        return DialectFamily.DOCUMENT;
    }

    @Override
    public List<String> check(String query, boolean strict) {
        List<String> violations = new ArrayList<>();
        String trimmed = query.trim();

        if (trimmed.startsWith("[") || trimmed.startsWith("{")) {
            if (!isParsableJson(trimmed)) {
                violations.add(INVALID_FORMAT_VIOLATION);
            }
        } else {
            String upper = trimmed.toUpperCase(Locale.ROOT);
            for (String method : WRITE_METHODS) {
                if (upper.contains(method)) {
                    violations.add(WRITE_OPERATION_VIOLATION);
                    break;
                }
            }
        }

        for (String operation : UNSAFE_OPERATIONS) {
            if (query.contains(operation)) {
                violations.add("Unsafe MongoDB operation detected: " + operation);
            }
        }
        return violations;
    }

    private boolean isParsableJson(String text) {
        try {
            jsonReader.readTree(text);
            return true;
        } catch (JsonProcessingException e) {
            return false;
        }
    }
}
