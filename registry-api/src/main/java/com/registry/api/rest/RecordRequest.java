package com.registry.api.rest;

import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.registry.core.model.RecordDraft;
import com.registry.core.model.RecordPatch;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Body of record create and update requests.
 *
 * The parent may be sent as {@code parent} or under the definition's configured
 * link attribute, so the attribute name is only known once the definition is.
 * An explicit JSON null clears the link on update.
 */
public class RecordRequest {

    @JsonProperty("definitionCode")
    private String definitionCode;

    @JsonProperty("data")
    private ObjectNode data;

    @JsonProperty("isActive")
    private Boolean isActive;

    @JsonProperty("effectiveFrom")
    private String effectiveFrom;

    @JsonProperty("effectiveTo")
    private String effectiveTo;

    private final Map<String, JsonNode> otherAttributes = new LinkedHashMap<>();

    @JsonAnySetter
    public void setOtherAttribute(String name, JsonNode value) {
        otherAttributes.put(name, value);
    }

    public RecordDraft toDraft(String parentLinkField) {
        return new RecordDraft(
            data,
            isActive,
            TemporalParser.parse("effectiveFrom", effectiveFrom),
            TemporalParser.parse("effectiveTo", effectiveTo),
            parent(parentLinkField)
        );
    }

    public RecordPatch toPatch(String parentLinkField) {
        return new RecordPatch(
            definitionCode,
            data,
            isActive,
            TemporalParser.parse("effectiveFrom", effectiveFrom),
            TemporalParser.parse("effectiveTo", effectiveTo),
            parent(parentLinkField)
        );
    }

    /**
     * Absent yields null (keep); JSON null yields blank (clear).
     */
    String parent(String parentLinkField) {
        String key = otherAttributes.containsKey("parent") ? "parent" : parentLinkField;
        if (!otherAttributes.containsKey(key)) {
            return null;
        }
        JsonNode value = otherAttributes.get(key);
        return value == null || value.isNull() ? "" : value.asText();
    }
}
