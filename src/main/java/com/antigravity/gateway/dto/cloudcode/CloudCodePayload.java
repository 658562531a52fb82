package com.antigravity.gateway.dto.cloudcode;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;

import java.util.UUID;

/**
 * Cloud Code 请求载荷构建器
 * <p>
 * 构建 {project, model, request, userAgent, requestType, requestId} 信封
 */
public class CloudCodePayload {

    private final String model;
    private final JSONObject request = new JSONObject();
    private final JSONArray contents = new JSONArray();
    private String project;

    public CloudCodePayload(String model) {
        this.model = model;
        request.put("contents", contents);
    }

    public CloudCodePayload project(String project) {
        this.project = project;
        return this;
    }

    /**
     * 追加一个回合，与上一回合角色相同时合并 parts
     *
     * @param role  user / model
     * @param parts 非空 parts
     */
    public CloudCodePayload addContent(String role, JSONArray parts) {
        if (parts == null || parts.isEmpty()) {
            return this;
        }
        if (!contents.isEmpty()) {
            JSONObject last = contents.getJSONObject(contents.size() - 1);
            if (role.equals(last.getString("role"))) {
                last.getJSONArray("parts").addAll(parts);
                return this;
            }
        }
        contents.add(JSONObject.of("role", role, "parts", parts));
        return this;
    }

    public CloudCodePayload systemInstruction(String text) {
        if (text != null && !text.isEmpty()) {
            request.put("systemInstruction", JSONObject.of(
                    "role", "user", //
                    "parts", JSONArray.of(JSONObject.of("text", text)) //
            ));
        }
        return this;
    }

    public CloudCodePayload generationConfig(JSONObject config) {
        if (config != null && !config.isEmpty()) {
            request.put("generationConfig", config);
        }
        return this;
    }

    public CloudCodePayload tools(JSONArray functionDeclarations) {
        if (functionDeclarations != null && !functionDeclarations.isEmpty()) {
            request.put("tools", JSONArray.of(JSONObject.of("functionDeclarations", functionDeclarations)));
        }
        return this;
    }

    public CloudCodePayload toolConfig(JSONObject toolConfig) {
        if (toolConfig != null) {
            request.put("toolConfig", toolConfig);
        }
        return this;
    }

    public CloudCodePayload sessionId(String sessionId) {
        if (sessionId != null) {
            request.put("sessionId", sessionId);
        }
        return this;
    }

    public JSONArray contents() {
        return contents;
    }

    public String model() {
        return model;
    }

    /**
     * 构建最终 JSON
     */
    public JSONObject build() {
        JSONObject root = new JSONObject();
        root.put("project", project);
        root.put("model", model);
        root.put("request", request);
        root.put("userAgent", "antigravity");
        root.put("requestType", "agent");
        root.put("requestId", "agent-" + UUID.randomUUID());
        return root;
    }
}
