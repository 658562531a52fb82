package com.antigravity.gateway.translator;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * 工具参数 JSON Schema 清洗
 * <p>
 * 上游只接受 OpenAPI 子集：保留白名单关键字，归一化类型联合、const、anyOf/oneOf/allOf，
 * 丢弃 $ref 与校验类关键字。只做有损转换，不拒绝任何输入
 */
public final class SchemaSanitizer {

    private static final Set<String> ALLOWED = Set.of(
            "type", "description", "properties", "required", "items", "enum", "nullable");

    private SchemaSanitizer() {
    }

    /**
     * 清洗顶层参数 schema，结果总是 object 类型
     */
    public static JSONObject sanitizeParameters(JSONObject schema) {
        if (schema == null || schema.isEmpty()) {
            return JSONObject.of("type", "object", "properties", new JSONObject());
        }
        JSONObject result = sanitize(schema);
        if (!"object".equals(result.getString("type"))) {
            result.put("type", "object");
        }
        if (!result.containsKey("properties")) {
            result.put("properties", new JSONObject());
        }
        return result;
    }

    public static JSONObject sanitize(JSONObject schema) {
        if (schema == null) {
            return JSONObject.of("type", "string");
        }

        JSONObject source = flattenCombinators(schema);
        JSONObject out = new JSONObject();
        boolean nullable = Boolean.TRUE.equals(source.getBoolean("nullable"));

        // type 联合：["string","null"] → string + nullable
        Object type = source.get("type");
        if (type instanceof JSONArray types) {
            String chosen = null;
            for (int i = 0; i < types.size(); i++) {
                String t = types.getString(i);
                if ("null".equals(t)) {
                    nullable = true;
                } else if (chosen == null) {
                    chosen = t;
                }
            }
            if (chosen != null) {
                out.put("type", chosen);
            }
        } else if (type instanceof String t && !"null".equals(t)) {
            out.put("type", t);
        } else if ("null".equals(type)) {
            nullable = true;
        }

        String description = source.getString("description");
        if (description != null) {
            out.put("description", description);
        }

        if (source.containsKey("const")) {
            out.put("enum", JSONArray.of(String.valueOf(source.get("const"))));
        } else if (source.get("enum") instanceof JSONArray values) {
            JSONArray normalized = new JSONArray();
            for (Object v : values) {
                if (v == null) {
                    nullable = true;
                } else {
                    normalized.add(String.valueOf(v));
                }
            }
            if (!normalized.isEmpty()) {
                out.put("enum", normalized);
            }
        }

        JSONObject properties = source.getJSONObject("properties");
        if (properties != null) {
            JSONObject cleanProps = new JSONObject();
            for (String key : properties.keySet()) {
                Object prop = properties.get(key);
                cleanProps.put(key, prop instanceof JSONObject p ? sanitize(p) : JSONObject.of("type", "string"));
            }
            out.put("properties", cleanProps);

            JSONArray required = source.getJSONArray("required");
            if (required != null) {
                JSONArray filtered = new JSONArray();
                for (int i = 0; i < required.size(); i++) {
                    String name = required.getString(i);
                    if (cleanProps.containsKey(name) && !filtered.contains(name)) {
                        filtered.add(name);
                    }
                }
                if (!filtered.isEmpty()) {
                    out.put("required", filtered);
                }
            }
        }

        Object items = source.get("items");
        if (items instanceof JSONObject itemSchema) {
            out.put("items", sanitize(itemSchema));
        } else if (items instanceof JSONArray tuple && !tuple.isEmpty() && tuple.get(0) instanceof JSONObject first) {
            // 元组只保留第一个元素类型
            out.put("items", sanitize(first));
        }

        if (!out.containsKey("type")) {
            out.put("type", inferType(out));
        }
        if ("array".equals(out.getString("type")) && !out.containsKey("items")) {
            out.put("items", JSONObject.of("type", "string"));
        }
        if (nullable) {
            out.put("nullable", true);
        }

        out.keySet().retainAll(ALLOWED);
        return out;
    }

    // ==================== 辅助方法 ====================

    /**
     * anyOf/oneOf 取第一个非 null 分支，allOf 合并所有分支
     */
    private static JSONObject flattenCombinators(JSONObject schema) {
        JSONObject merged = new JSONObject(schema);
        merged.remove("$ref");

        for (String key : List.of("anyOf", "oneOf")) {
            JSONArray branches = merged.getJSONArray(key);
            merged.remove(key);
            if (branches == null) {
                continue;
            }
            JSONObject chosen = null;
            for (int i = 0; i < branches.size(); i++) {
                JSONObject branch = branches.getJSONObject(i);
                if (branch == null) {
                    continue;
                }
                if ("null".equals(branch.get("type"))) {
                    merged.put("nullable", true);
                } else if (chosen == null) {
                    chosen = branch;
                }
            }
            if (chosen != null) {
                mergeInto(merged, flattenCombinators(chosen));
            }
        }

        JSONArray allOf = merged.getJSONArray("allOf");
        merged.remove("allOf");
        if (allOf != null) {
            for (int i = 0; i < allOf.size(); i++) {
                JSONObject branch = allOf.getJSONObject(i);
                if (branch != null) {
                    mergeInto(merged, flattenCombinators(branch));
                }
            }
        }
        return merged;
    }

    private static void mergeInto(JSONObject target, JSONObject branch) {
        for (String key : branch.keySet()) {
            Object value = branch.get(key);
            if ("properties".equals(key) && value instanceof JSONObject props) {
                JSONObject existing = target.getJSONObject("properties");
                if (existing == null) {
                    target.put("properties", new JSONObject(props));
                } else {
                    existing.putAll(props);
                }
            } else if ("required".equals(key) && value instanceof JSONArray req) {
                JSONArray existing = target.getJSONArray("required");
                List<Object> all = new ArrayList<>(existing != null ? existing : List.of());
                all.addAll(req);
                target.put("required", new JSONArray(all));
            } else if (!target.containsKey(key)) {
                target.put(key, value);
            }
        }
    }

    private static String inferType(JSONObject schema) {
        if (schema.containsKey("properties")) {
            return "object";
        }
        if (schema.containsKey("items")) {
            return "array";
        }
        return "string";
    }
}
