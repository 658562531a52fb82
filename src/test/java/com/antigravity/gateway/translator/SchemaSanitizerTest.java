package com.antigravity.gateway.translator;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SchemaSanitizerTest {

    @Test
    void sanitizeParameters_missingSchemaBecomesEmptyObject() {
        JSONObject result = SchemaSanitizer.sanitizeParameters(null);

        assertEquals("object", result.getString("type"));
        assertTrue(result.getJSONObject("properties").isEmpty());
    }

    @Test
    void sanitize_dropsUnsupportedKeywords() {
        JSONObject schema = JSONObject.parseObject("""
                {"type": "string", "minLength": 1, "maxLength": 10, "pattern": "^a", "format": "email",
                 "default": "x", "examples": ["a"], "additionalProperties": false, "$ref": "#/defs/x"}
                """);

        assertEquals(JSONObject.of("type", "string"), SchemaSanitizer.sanitize(schema));
    }

    @Test
    void sanitize_constBecomesEnum() {
        JSONObject result = SchemaSanitizer.sanitize(JSONObject.of("const", "fixed"));

        assertEquals(JSONArray.of("fixed"), result.getJSONArray("enum"));
        assertEquals("string", result.getString("type"));
    }

    @Test
    void sanitize_anyOfCollapsesToFirstNonNullBranch() {
        JSONObject schema = JSONObject.parseObject("""
                {"anyOf": [{"type": "null"}, {"type": "integer", "description": "count"}, {"type": "string"}]}
                """);

        JSONObject result = SchemaSanitizer.sanitize(schema);
        assertEquals("integer", result.getString("type"));
        assertEquals("count", result.getString("description"));
        assertTrue(result.getBooleanValue("nullable"));
    }

    @Test
    void sanitize_allOfMergesPropertiesAndRequired() {
        JSONObject schema = JSONObject.parseObject("""
                {"allOf": [
                  {"type": "object", "properties": {"a": {"type": "string"}}, "required": ["a"]},
                  {"properties": {"b": {"type": "number"}}, "required": ["b"]}
                ]}
                """);

        JSONObject result = SchemaSanitizer.sanitize(schema);
        assertEquals("object", result.getString("type"));
        assertEquals(2, result.getJSONObject("properties").size());
        assertEquals(JSONArray.of("a", "b"), result.getJSONArray("required"));
    }

    @Test
    void sanitize_nestedArraysGetItemsAndInferredTypes() {
        JSONObject schema = JSONObject.parseObject("""
                {"type": "object", "properties": {
                  "tags": {"type": "array"},
                  "matrix": {"items": {"items": {"type": "number", "minimum": 0}}},
                  "opts": {"properties": {"flag": {"type": ["boolean", "null"]}}}
                }}
                """);

        JSONObject props = SchemaSanitizer.sanitize(schema).getJSONObject("properties");
        assertEquals(JSONObject.of("type", "string"), props.getJSONObject("tags").getJSONObject("items"));
        assertEquals("array", props.getJSONObject("matrix").getString("type"));
        assertEquals(JSONObject.of("type", "number"),
                props.getJSONObject("matrix").getJSONObject("items").getJSONObject("items"));
        JSONObject flag = props.getJSONObject("opts").getJSONObject("properties").getJSONObject("flag");
        assertEquals("object", props.getJSONObject("opts").getString("type"));
        assertEquals("boolean", flag.getString("type"));
        assertTrue(flag.getBooleanValue("nullable"));
    }

    @Test
    void sanitize_enumValuesBecomeStringsAndNullMarksNullable() {
        JSONObject schema = JSONObject.of("type", "integer", "enum", JSONArray.of(1, 2, null));

        JSONObject result = SchemaSanitizer.sanitize(schema);
        assertEquals(JSONArray.of("1", "2"), result.getJSONArray("enum"));
        assertTrue(result.getBooleanValue("nullable"));
    }
}
