package com.registry.api.rest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasItem;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * REST tests for definitions over the in-memory store.
 */
@SpringBootTest(properties = {
    "registry.security.grants.viewer=view_entities,view_entity_records"
})
@AutoConfigureMockMvc
class DefinitionControllerTest {

    private static final String BASE = "/api/v1/definitions";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private JsonNode createDefinition(String body) throws Exception {
        MvcResult result = mockMvc.perform(post(BASE)
                .header("X-Actor-Id", "alice")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isCreated())
            .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    @Test
    @DisplayName("Create returns the normalized definition with default config")
    void createDefinition() throws Exception {
        JsonNode created = createDefinition("""
            {"code": "invoice", "name": "Invoice",
             "schemaDefinition": {"type": "object",
               "properties": {"number": {"type": "string"}}, "required": ["number"]}}
            """);

        assertThat(created.get("code").asText()).isEqualTo("INVOICE");
        assertThat(created.get("createdBy").asText()).isEqualTo("alice");
        assertThat(created.at("/derivedRecordConfig/activation/enabled").asBoolean()).isTrue();
        assertThat(created.at("/derivedRecordConfig/hierarchy/linkType").asText()).isEqualTo("id");
        assertThat(created.get("createdAt").isTextual()).isTrue();

        mockMvc.perform(get(BASE + "/code/invoice").header("X-Actor-Id", "viewer"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.id").value(created.get("id").asText()));
        mockMvc.perform(get(BASE + "/" + created.get("id").asText() + "/schema").header("X-Actor-Id", "viewer"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.required[0]").value("number"));
    }

    @Test
    @DisplayName("Requests without an actor are unauthenticated")
    void missingActor() throws Exception {
        mockMvc.perform(get(BASE))
            .andExpect(status().isUnauthorized())
            .andExpect(jsonPath("$.error").value("UNAUTHENTICATED"))
            .andExpect(header().exists("X-Trace-Id"));
    }

    @Test
    @DisplayName("Actors without the capability are forbidden")
    void capabilityDenied() throws Exception {
        mockMvc.perform(post(BASE)
                .header("X-Actor-Id", "viewer")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"code\": \"DENIED\", \"name\": \"Denied\"}"))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.error").value("CAPABILITY_DENIED"));

        mockMvc.perform(get(BASE + "/code/DENIED").header("X-Actor-Id", "viewer"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("NOT_FOUND"));
    }

    @Test
    @DisplayName("A taken code is a conflict")
    void duplicateCode() throws Exception {
        createDefinition("{\"code\": \"DUPLICATE\", \"name\": \"First\"}");

        mockMvc.perform(post(BASE)
                .header("X-Actor-Id", "alice")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"code\": \"duplicate\", \"name\": \"Second\"}"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("DUPLICATE_CODE"));
    }

    @Test
    @DisplayName("Schema problems come back as violations")
    void invalidSchema() throws Exception {
        mockMvc.perform(post(BASE)
                .header("X-Actor-Id", "alice")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"code": "BROKEN", "name": "Broken",
                     "schemaDefinition": {"properties": {"n": {"type": "string", "minimum": 1}}}}
                    """))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("INVALID_SCHEMA"))
            .andExpect(jsonPath("$.violations[0].field").value("schemaDefinition.properties.n"))
            .andExpect(jsonPath("$.violations[0].constraint").value("applicability"));

        mockMvc.perform(post(BASE)
                .header("X-Actor-Id", "alice")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"code": "BROKEN", "name": "Broken",
                     "schemaDefinition": {"properties": {"n": {"type": "decimal"}}}}
                    """))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("BAD_REQUEST"));
    }

    @Test
    @DisplayName("Update ignores the code and rejects turning versioning off")
    void updateDefinition() throws Exception {
        JsonNode created = createDefinition("""
            {"code": "CONTRACT", "name": "Contract",
             "derivedRecordConfig": {"versioning": {"enabled": true}}}
            """);
        String id = created.get("id").asText();

        mockMvc.perform(put(BASE + "/" + id)
                .header("X-Actor-Id", "bob")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"code\": \"AGREEMENT\", \"description\": \"Signed contracts\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.code").value("CONTRACT"))
            .andExpect(jsonPath("$.description").value("Signed contracts"))
            .andExpect(jsonPath("$.updatedBy").value("bob"))
            .andExpect(jsonPath("$.sequenceNumber").value(1));

        mockMvc.perform(put(BASE + "/" + id)
                .header("X-Actor-Id", "bob")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"derivedRecordConfig\": {\"versioning\": {\"enabled\": false}}}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("MONOTONIC_CONFIG_VIOLATION"));
    }

    @Test
    @DisplayName("Toggle and list reflect the usable flag")
    void toggleAndList() throws Exception {
        JsonNode created = createDefinition("{\"code\": \"SEASONAL\", \"name\": \"Seasonal\"}");

        mockMvc.perform(patch(BASE + "/" + created.get("id").asText() + "/toggle-activation")
                .header("X-Actor-Id", "alice"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.derivedRecordConfig.activation.entityActive").value(false));

        mockMvc.perform(get(BASE).param("active", "false").param("limit", "500")
                .header("X-Actor-Id", "viewer"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.items[*].code", hasItem("SEASONAL")))
            .andExpect(jsonPath("$.limit").value(100));
    }

    @Test
    @DisplayName("A definition with records cannot be deleted")
    void deleteDefinition() throws Exception {
        JsonNode created = createDefinition("{\"code\": \"TICKET\", \"name\": \"Ticket\"}");
        String id = created.get("id").asText();

        MvcResult record = mockMvc.perform(post("/api/v1/records/TICKET")
                .header("X-Actor-Id", "alice")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"data\": {\"subject\": \"Printer\"}}"))
            .andExpect(status().isCreated())
            .andReturn();
        String recordId = objectMapper.readTree(record.getResponse().getContentAsString()).get("id").asText();

        mockMvc.perform(delete(BASE + "/" + id).header("X-Actor-Id", "alice"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("DEFINITION_IN_USE"));

        mockMvc.perform(delete("/api/v1/records/TICKET/" + recordId).header("X-Actor-Id", "alice"))
            .andExpect(status().isNoContent());
        mockMvc.perform(delete(BASE + "/" + id).header("X-Actor-Id", "alice"))
            .andExpect(status().isNoContent());
        mockMvc.perform(get(BASE + "/" + id).header("X-Actor-Id", "alice"))
            .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("A malformed id is a bad request")
    void malformedId() throws Exception {
        mockMvc.perform(get(BASE + "/not-a-uuid").header("X-Actor-Id", "alice"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("BAD_REQUEST"));
    }
}
