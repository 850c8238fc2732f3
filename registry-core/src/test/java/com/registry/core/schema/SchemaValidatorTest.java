package com.registry.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SchemaValidatorTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final SchemaValidator validator = new SchemaValidator();

    private ObjectNode json(String text) throws Exception {
        return (ObjectNode) mapper.readTree(text);
    }

    private SchemaDefinition customerSchema() {
        Map<String, FieldSchema> properties = new LinkedHashMap<>();
        properties.put("email", FieldSchema.builder(FieldType.STRING).format(StringFormat.EMAIL).build());
        properties.put("name", FieldSchema.builder(FieldType.STRING).minLength(1).maxLength(20).build());
        properties.put("tier", FieldSchema.builder(FieldType.STRING)
            .enumValues(List.of(TextNode.valueOf("basic"), TextNode.valueOf("gold")))
            .defaultValue(TextNode.valueOf("basic"))
            .build());
        properties.put("age", FieldSchema.builder(FieldType.INTEGER).minimum(0).maximum(150).build());
        return SchemaDefinition.of(properties, List.of("email"));
    }

    @Test
    void validate_validPayload_shouldPassAndApplyDefaults() throws Exception {
        ObjectNode payload = json("{\"email\":\"a@x.io\",\"name\":\"Ann\"}");

        ValidationResult result = validator.validate(customerSchema(), payload);

        assertTrue(result.isValid());
        assertEquals("basic", result.payload().get("tier").asText());
        assertFalse(payload.has("tier"), "input payload must not be mutated");
    }

    @Test
    void validate_nullOptionalField_shouldReceiveDefault() throws Exception {
        ValidationResult result = validator.validate(customerSchema(), json("{\"email\":\"a@x.io\",\"tier\":null}"));

        assertTrue(result.isValid());
        assertEquals("basic", result.payload().get("tier").asText());
    }

    @Test
    void validate_missingRequiredField_shouldReportRequired() throws Exception {
        ValidationResult result = validator.validate(customerSchema(), json("{\"name\":\"Ann\"}"));

        assertFalse(result.isValid());
        assertEquals(List.of(new SchemaViolation("email", "required", "is required")), result.violations());
    }

    @Test
    void validate_nullRequiredField_shouldReportRequired() throws Exception {
        ValidationResult result = validator.validate(customerSchema(), json("{\"email\":null}"));

        assertEquals("required", result.violations().get(0).constraint());
    }

    @Test
    void validate_shouldCollectEveryViolation() throws Exception {
        ObjectNode payload = json("{\"email\":\"nope\",\"name\":\"\",\"tier\":\"platinum\",\"age\":200}");

        List<SchemaViolation> violations = validator.validate(customerSchema(), payload).violations();

        assertEquals(List.of("format", "minLength", "enum", "maximum"),
            violations.stream().map(SchemaViolation::constraint).toList());
        assertEquals(List.of("email", "name", "tier", "age"),
            violations.stream().map(SchemaViolation::field).toList());
    }

    @Test
    void validate_wrongKind_shouldReportTypeOnly() throws Exception {
        List<SchemaViolation> violations = validator.validate(customerSchema(),
            json("{\"email\":\"a@x.io\",\"age\":\"old\"}")).violations();

        assertEquals(1, violations.size());
        assertEquals("type", violations.get(0).constraint());
        assertEquals("age", violations.get(0).field());
    }

    @Test
    void validate_integer_shouldAcceptWholeValuedDecimals() throws Exception {
        assertTrue(validator.validate(customerSchema(), json("{\"email\":\"a@x.io\",\"age\":30.0}")).isValid());

        List<SchemaViolation> violations = validator.validate(customerSchema(),
            json("{\"email\":\"a@x.io\",\"age\":30.5}")).violations();
        assertEquals("type", violations.get(0).constraint());
    }

    @Test
    void validate_numberBounds_shouldUseExactDecimals() throws Exception {
        SchemaDefinition schema = SchemaDefinition.of(
            Map.of("price", FieldSchema.builder(FieldType.NUMBER).minimum(0.1).maximum(0.3).build()),
            List.of());

        assertTrue(validator.validate(schema, json("{\"price\":0.3}")).isValid());
        assertTrue(validator.validate(schema, json("{\"price\":0.1}")).isValid());
        assertFalse(validator.validate(schema, json("{\"price\":0.30000000000000004}")).isValid());
    }

    @Test
    void validate_numberBeyondDoubleRange_shouldReportTypeForEveryKind() throws Exception {
        for (FieldType type : List.of(FieldType.NUMBER, FieldType.INTEGER, FieldType.STRING)) {
            SchemaDefinition schema = SchemaDefinition.of(Map.of("v", FieldSchema.builder(type).build()), List.of());

            List<SchemaViolation> violations = validator.validate(schema, json("{\"v\": 1e400}")).violations();

            assertEquals(1, violations.size(), type.wireName());
            assertEquals("type", violations.get(0).constraint());
            assertEquals("v", violations.get(0).field());
        }
    }

    @Test
    void validate_enum_shouldCompareNumbersByValue() throws Exception {
        SchemaDefinition schema = SchemaDefinition.of(
            Map.of("level", FieldSchema.builder(FieldType.NUMBER)
                .enumValues(List.of(mapper.readTree("1"), mapper.readTree("2.5")))
                .build()),
            List.of());

        assertTrue(validator.validate(schema, json("{\"level\":1.0}")).isValid());
        assertTrue(validator.validate(schema, json("{\"level\":2.50}")).isValid());
        assertFalse(validator.validate(schema, json("{\"level\":3}")).isValid());
    }

    @Test
    void validate_pattern_shouldMatchAnywhereUnlessAnchored() throws Exception {
        SchemaDefinition schema = SchemaDefinition.of(Map.of(
            "loose", FieldSchema.builder(FieldType.STRING).pattern("[0-9]+").build(),
            "strict", FieldSchema.builder(FieldType.STRING).pattern("^[0-9]+$").build()
        ), List.of());

        assertTrue(validator.validate(schema, json("{\"loose\":\"ab12\"}")).isValid());
        assertFalse(validator.validate(schema, json("{\"strict\":\"ab12\"}")).isValid());
    }

    @Test
    void validate_stringLength_shouldCountCodePoints() throws Exception {
        SchemaDefinition schema = SchemaDefinition.of(
            Map.of("emoji", FieldSchema.builder(FieldType.STRING).maxLength(2).build()), List.of());

        assertTrue(validator.validate(schema, json("{\"emoji\":\"\\uD83D\\uDE00\\uD83D\\uDE00\"}")).isValid());
    }

    @Test
    void validate_nestedStructures_shouldReportPaths() throws Exception {
        FieldSchema address = FieldSchema.builder(FieldType.OBJECT)
            .properties(Map.of("zip", FieldSchema.builder(FieldType.STRING).pattern("^\\d{5}$").build()))
            .required(List.of("zip"))
            .build();
        FieldSchema tags = FieldSchema.builder(FieldType.ARRAY)
            .maxLength(3)
            .items(FieldSchema.builder(FieldType.STRING).minLength(2).build())
            .build();
        SchemaDefinition schema = SchemaDefinition.of(Map.of("address", address, "tags", tags), List.of());

        List<SchemaViolation> violations = validator.validate(schema,
            json("{\"address\":{\"zip\":\"12\"},\"tags\":[\"ok\",\"fine\",\"x\",\"yy\"]}")).violations();

        assertTrue(violations.contains(new SchemaViolation("address.zip", "pattern", "must match pattern ^\\d{5}$")));
        assertTrue(violations.stream().anyMatch(v -> v.field().equals("tags") && v.constraint().equals("maxLength")));
        assertTrue(violations.stream().anyMatch(v -> v.field().equals("tags[2]") && v.constraint().equals("minLength")));
    }

    @Test
    void validate_undeclaredFields_shouldPassThrough() throws Exception {
        ValidationResult result = validator.validate(customerSchema(),
            json("{\"email\":\"a@x.io\",\"nickname\":{\"any\":[1,2]}}"));

        assertTrue(result.isValid());
        assertEquals(2, result.payload().get("nickname").get("any").size());
    }

    @Test
    void validate_shouldBeIdempotentOnValidOutput() throws Exception {
        ValidationResult first = validator.validate(customerSchema(), json("{\"email\":\"a@x.io\"}"));
        ValidationResult second = validator.validate(customerSchema(), first.payload());

        assertTrue(second.isValid());
        assertEquals(first.payload(), second.payload());
    }

    @Test
    void validate_nonObjectPayload_shouldFail() {
        JsonNode array = mapper.createArrayNode();

        ValidationResult result = validator.validate(customerSchema(), array);

        assertFalse(result.isValid());
        assertEquals("data", result.violations().get(0).field());
    }

    @Test
    void formats_shouldRecognizeSupportedShapes() {
        assertTrue(StringFormat.DATE_TIME.matches("2024-03-01T10:15:30Z"));
        assertFalse(StringFormat.DATE_TIME.matches("2024-03-01"));
        assertTrue(StringFormat.DATE.matches("2024-03-01"));
        assertTrue(StringFormat.UUID_FORMAT.matches("123e4567-e89b-12d3-a456-426614174000"));
        assertFalse(StringFormat.URI_FORMAT.matches("relative/path"));
        assertTrue(StringFormat.EMAIL.matches("first.last@example.org"));
    }
}
