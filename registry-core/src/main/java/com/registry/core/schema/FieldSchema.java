package com.registry.core.schema;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Declaration of one field in a definition's schema: its kind plus the constraints for that kind.
 *
 * Applicability:
 * - minLength/maxLength: string (characters) and array (items)
 * - pattern/format: string
 * - minimum/maximum: number and integer
 * - items: array
 * - properties/required: object
 * - enum/default: any kind
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record FieldSchema(
    FieldType type,
    
    // Length and text constraints
    Integer minLength,
    Integer maxLength,
    String pattern,
    StringFormat format,
    
    // Numeric range
    BigDecimal minimum,
    BigDecimal maximum,
    
    // Value constraints
    @JsonProperty("enum") List<JsonNode> enumValues,
    @JsonProperty("default") JsonNode defaultValue,
    
    // Nested structure
    FieldSchema items,
    Map<String, FieldSchema> properties,
    List<String> required,
    
    String description
) {
    public FieldSchema {
        enumValues = enumValues != null ? Collections.unmodifiableList(new ArrayList<>(enumValues)) : null;
        properties = properties != null ? Collections.unmodifiableMap(new LinkedHashMap<>(properties)) : null;
        required = required != null ? List.copyOf(new LinkedHashSet<>(required)) : null;
    }

    /**
     * Check whether a usable default is declared. JSON {@code null} does not count.
     */
    @JsonIgnore
    public boolean hasDefault() {
        return JsonValues.isPresent(defaultValue);
    }

    @JsonIgnore
    public Map<String, FieldSchema> propertiesOrEmpty() {
        return properties != null ? properties : Map.of();
    }

    @JsonIgnore
    public List<String> requiredOrEmpty() {
        return required != null ? required : List.of();
    }

    public static Builder builder(FieldType type) {
        return new Builder(type);
    }

    public static FieldSchema of(FieldType type) {
        return builder(type).build();
    }

    public static class Builder {
        private final FieldType type;
        private Integer minLength;
        private Integer maxLength;
        private String pattern;
        private StringFormat format;
        private BigDecimal minimum;
        private BigDecimal maximum;
        private List<JsonNode> enumValues;
        private JsonNode defaultValue;
        private FieldSchema items;
        private Map<String, FieldSchema> properties;
        private List<String> required;
        private String description;

        private Builder(FieldType type) {
            this.type = type;
        }

        public Builder minLength(int minLength) {
            this.minLength = minLength;
            return this;
        }

        public Builder maxLength(int maxLength) {
            this.maxLength = maxLength;
            return this;
        }

        public Builder pattern(String pattern) {
            this.pattern = pattern;
            return this;
        }

        public Builder format(StringFormat format) {
            this.format = format;
            return this;
        }

        public Builder minimum(Number minimum) {
            this.minimum = new BigDecimal(minimum.toString());
            return this;
        }

        public Builder maximum(Number maximum) {
            this.maximum = new BigDecimal(maximum.toString());
            return this;
        }

        public Builder enumValues(List<JsonNode> enumValues) {
            this.enumValues = enumValues;
            return this;
        }

        public Builder defaultValue(JsonNode defaultValue) {
            this.defaultValue = defaultValue;
            return this;
        }

        public Builder items(FieldSchema items) {
            this.items = items;
            return this;
        }

        public Builder properties(Map<String, FieldSchema> properties) {
            this.properties = properties;
            return this;
        }

        public Builder required(List<String> required) {
            this.required = required;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public FieldSchema build() {
            return new FieldSchema(
                type, minLength, maxLength, pattern, format, minimum, maximum,
                enumValues, defaultValue, items, properties, required, description
            );
        }
    }
}
