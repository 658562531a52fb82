package com.antigravity.gateway.translator;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.antigravity.gateway.dto.cloudcode.CloudCodePayload;
import com.antigravity.gateway.exception.TranslationException;
import com.antigravity.gateway.model.ModelCatalog;
import com.antigravity.gateway.signature.ModelFamily;
import com.antigravity.gateway.signature.SignatureCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Anthropic Messages → Cloud Code 请求转换
 * <p>
 * 保持内容块顺序，合并相邻同角色回合；思考块只在签名属于目标家族时保留
 */
@Component
public class RequestTranslator {

    private static final Logger log = LoggerFactory.getLogger(RequestTranslator.class);

    // Gemini 要求工具调用携带签名，没有同家族签名时用它跳过校验
    static final String SKIP_SIGNATURE = "skip_thought_signature_validator";
    static final int DEFAULT_GEMINI_THINKING_BUDGET = 16000;
    // Claude 思考预算之外给正文留的输出空间
    static final int CLAUDE_OUTPUT_HEADROOM = 8192;

    private final SignatureCache signatureCache;

    public RequestTranslator(SignatureCache signatureCache) {
        this.signatureCache = signatureCache;
    }

    /**
     * 转换 Anthropic 请求
     *
     * @param request Anthropic Messages 请求体
     * @param model   目标模型（可能是回退模型）
     * @throws TranslationException 消息为空、角色未知或 tool_result 找不到对应 tool_use
     */
    public Translation translate(JSONObject request, String model) {
        JSONArray messages = request.getJSONArray("messages");
        if (messages == null || messages.isEmpty()) {
            throw new TranslationException("messages 不能为空");
        }

        ModelFamily family = ModelCatalog.familyOf(model);
        boolean thinking = ModelCatalog.isThinkingModel(model);
        String sessionId = SessionIds.derive(messages);

        CloudCodePayload payload = new CloudCodePayload(model)
                .systemInstruction(extractSystem(request.get("system")))
                .sessionId(sessionId);

        ToolLoopState loop = ToolLoopState.analyze(messages);
        Map<String, String> toolNames = new HashMap<>();
        int dropped = 0;

        for (int i = 0; i < messages.size(); i++) {
            JSONObject msg = messages.getJSONObject(i);
            String role = msg.getString("role");
            String upstreamRole;
            if ("user".equals(role)) {
                upstreamRole = "user";
            } else if ("assistant".equals(role)) {
                upstreamRole = "model";
            } else {
                throw new TranslationException("未知的消息角色: " + role);
            }

            MessageParts converted = convertContent(msg.get("content"), family, toolNames);
            dropped += converted.droppedThinking;
            payload.addContent(upstreamRole, converted.parts);

            if (i == loop.lastAssistantIdx && family == ModelFamily.CLAUDE && thinking
                    && loop.interrupted && !converted.hasValidThinking) {
                payload.addContent("model", textParts("[Tool call was interrupted.]"));
            }
            if (i == loop.lastAssistantIdx) {
                loop.lastAssistantHasValidThinking = converted.hasValidThinking;
            }
        }

        // 严格家族：工具循环中丢弃了思考块时，补一轮合成对话闭合循环
        if (family == ModelFamily.CLAUDE && thinking && loop.inToolLoop && !loop.lastAssistantHasValidThinking) {
            String text = loop.toolResultCount == 1
                    ? "[Tool execution completed.]"
                    : "[" + loop.toolResultCount + " tool executions completed.]";
            payload.addContent("model", textParts(text));
            payload.addContent("user", textParts("[Continue]"));
            log.debug("工具循环已合成闭合: {} 个结果", loop.toolResultCount);
        }

        if (dropped > 0) {
            log.debug("丢弃 {} 个跨家族或无效签名的思考块, target={}", dropped, family);
        }

        payload.generationConfig(buildGenerationConfig(request, family, thinking))
                .tools(convertTools(request.getJSONArray("tools")))
                .toolConfig(convertToolChoice(request.getJSONObject("tool_choice")));

        return new Translation(payload, model, family, sessionId, thinking);
    }

    // ==================== 内容块 ====================

    private MessageParts convertContent(Object content, ModelFamily family, Map<String, String> toolNames) {
        MessageParts result = new MessageParts();
        if (content instanceof String text) {
            if (!text.isEmpty()) {
                result.parts.add(JSONObject.of("text", text));
            }
            return result;
        }
        if (!(content instanceof JSONArray blocks)) {
            return result;
        }

        for (int i = 0; i < blocks.size(); i++) {
            JSONObject block = blocks.getJSONObject(i);
            if (block == null) {
                continue;
            }
            String type = block.getString("type");
            switch (type == null ? "" : type) {
                case "text" -> {
                    String text = block.getString("text");
                    if (text != null && !text.isEmpty()) {
                        result.parts.add(JSONObject.of("text", text));
                    }
                }
                case "image", "document" -> {
                    JSONObject media = convertMedia(block.getJSONObject("source"));
                    if (media != null) {
                        result.parts.add(media);
                    }
                }
                case "tool_use" -> result.parts.add(convertToolUse(block, family, toolNames));
                case "tool_result" -> convertToolResult(block, toolNames, result.parts);
                case "thinking" -> {
                    String signature = block.getString("signature");
                    if (signatureCache.isValidFor(signature, family)) {
                        result.parts.add(JSONObject.of(
                                "thought", true, //
                                "text", block.getString("thinking"), //
                                "thoughtSignature", signature //
                        ));
                        result.hasValidThinking = true;
                    } else {
                        result.droppedThinking++;
                    }
                }
                // 不透明内容，无法判断来源家族
                case "redacted_thinking" -> result.droppedThinking++;
                default -> log.debug("忽略未知内容块类型: {}", type);
            }
        }
        return result;
    }

    private JSONObject convertMedia(JSONObject source) {
        if (source == null) {
            return null;
        }
        String sourceType = source.getString("type");
        if ("base64".equals(sourceType)) {
            return JSONObject.of("inlineData", JSONObject.of(
                    "mimeType", source.getString("media_type"), //
                    "data", source.getString("data") //
            ));
        }
        if ("url".equals(sourceType)) {
            String mimeType = source.getString("media_type");
            return JSONObject.of("fileData", JSONObject.of(
                    "mimeType", mimeType != null ? mimeType : guessMimeType(source.getString("url")), //
                    "fileUri", source.getString("url") //
            ));
        }
        log.debug("忽略不支持的媒体来源: {}", sourceType);
        return null;
    }

    private JSONObject convertToolUse(JSONObject block, ModelFamily family, Map<String, String> toolNames) {
        String id = block.getString("id");
        String name = block.getString("name");
        toolNames.put(id, name);

        JSONObject input = block.getJSONObject("input");
        JSONObject functionCall = JSONObject.of(
                "name", name, //
                "args", input != null ? input : new JSONObject(), //
                "id", id //
        );
        JSONObject part = JSONObject.of("functionCall", functionCall);

        if (family == ModelFamily.GEMINI) {
            SignatureCache.Entry cached = signatureCache.getToolSignature(id);
            part.put("thoughtSignature", cached != null && cached.family() == ModelFamily.GEMINI
                    ? cached.signature()
                    : SKIP_SIGNATURE);
        }
        return part;
    }

    private void convertToolResult(JSONObject block, Map<String, String> toolNames, JSONArray parts) {
        String toolUseId = block.getString("tool_use_id");
        String name = toolNames.get(toolUseId);
        if (name == null) {
            throw new TranslationException("tool_result 引用了不存在的 tool_use: " + toolUseId);
        }

        StringBuilder text = new StringBuilder();
        JSONArray media = new JSONArray();
        Object content = block.get("content");
        if (content instanceof String s) {
            text.append(s);
        } else if (content instanceof JSONArray items) {
            for (int i = 0; i < items.size(); i++) {
                JSONObject item = items.getJSONObject(i);
                if ("text".equals(item.getString("type"))) {
                    if (text.length() > 0) {
                        text.append('\n');
                    }
                    text.append(item.getString("text"));
                } else if ("image".equals(item.getString("type"))) {
                    JSONObject converted = convertMedia(item.getJSONObject("source"));
                    if (converted != null) {
                        media.add(converted);
                    }
                }
            }
        }

        JSONObject response = Boolean.TRUE.equals(block.getBoolean("is_error"))
                ? JSONObject.of("error", text.toString())
                : JSONObject.of("result", text.toString());
        parts.add(JSONObject.of("functionResponse", JSONObject.of(
                "name", name, //
                "response", response, //
                "id", toolUseId //
        )));
        parts.addAll(media);
    }

    // ==================== 配置 ====================

    private JSONObject buildGenerationConfig(JSONObject request, ModelFamily family, boolean thinking) {
        JSONObject config = new JSONObject();
        Integer maxTokens = request.getInteger("max_tokens");
        if (maxTokens != null) {
            config.put("maxOutputTokens", maxTokens);
        }
        putIfPresent(config, "temperature", request.get("temperature"));
        putIfPresent(config, "topP", request.get("top_p"));
        putIfPresent(config, "topK", request.get("top_k"));
        JSONArray stop = request.getJSONArray("stop_sequences");
        if (stop != null && !stop.isEmpty()) {
            config.put("stopSequences", stop);
        }

        if (thinking) {
            JSONObject thinkingRequest = request.getJSONObject("thinking");
            Integer budget = thinkingRequest != null ? thinkingRequest.getInteger("budget_tokens") : null;
            if (family == ModelFamily.CLAUDE) {
                JSONObject thinkingConfig = JSONObject.of("include_thoughts", true);
                if (budget != null) {
                    thinkingConfig.put("thinking_budget", budget);
                    if (maxTokens == null || maxTokens <= budget) {
                        config.put("maxOutputTokens", budget + CLAUDE_OUTPUT_HEADROOM);
                    }
                }
                config.put("thinkingConfig", thinkingConfig);
            } else {
                config.put("thinkingConfig", JSONObject.of(
                        "includeThoughts", true, //
                        "thinkingBudget", budget != null ? budget : DEFAULT_GEMINI_THINKING_BUDGET //
                ));
            }
        }
        return config;
    }

    private JSONArray convertTools(JSONArray tools) {
        if (tools == null || tools.isEmpty()) {
            return null;
        }
        JSONArray declarations = new JSONArray();
        for (int i = 0; i < tools.size(); i++) {
            JSONObject tool = tools.getJSONObject(i);
            String name = tool.getString("name");
            if (name == null) {
                continue;
            }
            JSONObject declaration = JSONObject.of("name", name);
            String description = tool.getString("description");
            if (description != null) {
                declaration.put("description", description);
            }
            declaration.put("parameters", SchemaSanitizer.sanitizeParameters(tool.getJSONObject("input_schema")));
            declarations.add(declaration);
        }
        return declarations;
    }

    private JSONObject convertToolChoice(JSONObject toolChoice) {
        if (toolChoice == null) {
            return null;
        }
        JSONObject callingConfig = new JSONObject();
        switch (String.valueOf(toolChoice.getString("type"))) {
            case "any" -> callingConfig.put("mode", "ANY");
            case "none" -> callingConfig.put("mode", "NONE");
            case "tool" -> {
                callingConfig.put("mode", "ANY");
                callingConfig.put("allowedFunctionNames", JSONArray.of(toolChoice.getString("name")));
            }
            default -> callingConfig.put("mode", "AUTO");
        }
        return JSONObject.of("functionCallingConfig", callingConfig);
    }

    // ==================== 辅助方法 ====================

    private static String extractSystem(Object system) {
        if (system instanceof String s) {
            return s;
        }
        if (system instanceof JSONArray blocks) {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < blocks.size(); i++) {
                JSONObject block = blocks.getJSONObject(i);
                if ("text".equals(block.getString("type"))) {
                    if (sb.length() > 0) {
                        sb.append("\n\n");
                    }
                    sb.append(block.getString("text"));
                }
            }
            return sb.toString();
        }
        return null;
    }

    private static JSONArray textParts(String text) {
        return JSONArray.of(JSONObject.of("text", text));
    }

    private static void putIfPresent(JSONObject target, String key, Object value) {
        if (value != null) {
            target.put(key, value);
        }
    }

    private static String guessMimeType(String url) {
        if (url == null) {
            return "application/octet-stream";
        }
        String lower = url.toLowerCase();
        if (lower.endsWith(".png")) return "image/png";
        if (lower.endsWith(".jpg") || lower.endsWith(".jpeg")) return "image/jpeg";
        if (lower.endsWith(".gif")) return "image/gif";
        if (lower.endsWith(".webp")) return "image/webp";
        if (lower.endsWith(".pdf")) return "application/pdf";
        return "application/octet-stream";
    }

    // 单条消息的转换结果
    private static class MessageParts {
        final JSONArray parts = new JSONArray();
        boolean hasValidThinking;
        int droppedThinking;
    }

    /**
     * 会话尾部的工具循环状态
     * <p>
     * inToolLoop：最后一条 assistant 发起了工具调用，其后只有 tool_result；
     * interrupted：最后一条 assistant 发起了工具调用，其后的 user 消息没有 tool_result
     */
    private static class ToolLoopState {
        int lastAssistantIdx = -1;
        boolean inToolLoop;
        boolean interrupted;
        int toolResultCount;
        boolean lastAssistantHasValidThinking;

        static ToolLoopState analyze(JSONArray messages) {
            ToolLoopState state = new ToolLoopState();
            for (int i = messages.size() - 1; i >= 0; i--) {
                if ("assistant".equals(messages.getJSONObject(i).getString("role"))) {
                    state.lastAssistantIdx = i;
                    break;
                }
            }
            if (state.lastAssistantIdx < 0
                    || !hasBlock(messages.getJSONObject(state.lastAssistantIdx).get("content"), "tool_use")) {
                return state;
            }

            boolean onlyResults = true;
            boolean anyAfter = false;
            for (int i = state.lastAssistantIdx + 1; i < messages.size(); i++) {
                anyAfter = true;
                Object content = messages.getJSONObject(i).get("content");
                int results = countBlocks(content, "tool_result");
                state.toolResultCount += results;
                if (results == 0) {
                    onlyResults = false;
                }
            }
            state.inToolLoop = anyAfter && onlyResults && state.toolResultCount > 0;
            state.interrupted = anyAfter && state.toolResultCount == 0;
            return state;
        }

        private static boolean hasBlock(Object content, String type) {
            return countBlocks(content, type) > 0;
        }

        private static int countBlocks(Object content, String type) {
            if (!(content instanceof JSONArray blocks)) {
                return 0;
            }
            int count = 0;
            for (int i = 0; i < blocks.size(); i++) {
                JSONObject block = blocks.getJSONObject(i);
                if (block != null && type.equals(block.getString("type"))) {
                    count++;
                }
            }
            return count;
        }
    }
}
