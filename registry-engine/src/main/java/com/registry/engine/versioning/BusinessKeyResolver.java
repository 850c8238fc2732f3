package com.registry.engine.versioning;

import com.fasterxml.jackson.databind.JsonNode;
import com.registry.core.model.BusinessKey;
import com.registry.core.model.EntityDefinition;
import com.registry.core.schema.JsonValues;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Derives a record's business key from the definition's required fields.
 * The key is recomputed on every lookup, never cached on the record.
 */
public class BusinessKeyResolver {

    public BusinessKey resolve(EntityDefinition definition, JsonNode data) {
        Map<String, JsonNode> fields = new LinkedHashMap<>();
        if (data != null) {
            for (String name : definition.schemaDefinition().required()) {
                JsonNode value = data.get(name);
                if (JsonValues.isPresent(value)) {
                    fields.put(name, value);
                }
            }
        }
        return new BusinessKey(fields);
    }
}
