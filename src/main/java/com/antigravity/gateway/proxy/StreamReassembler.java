package com.antigravity.gateway.proxy;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import com.antigravity.gateway.exception.EmptyResponseException;
import com.antigravity.gateway.model.ModelCatalog;
import com.antigravity.gateway.signature.ModelFamily;
import com.antigravity.gateway.signature.SignatureCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 上游响应 → Anthropic 事件序列
 * <p>
 * 一个块就是完整的非流式响应，多个块就是 SSE data 负载；两种情况走同一条路径。
 * 输出保证：恰好一个 message_start（首个有内容的 part 时才发出），同一时刻最多一个打开的内容块，
 * 恰好一个 message_delta 与 message_stop
 */
@Component
public class StreamReassembler {

    private static final Logger log = LoggerFactory.getLogger(StreamReassembler.class);

    private final SignatureCache signatureCache;

    public StreamReassembler(SignatureCache signatureCache) {
        this.signatureCache = signatureCache;
    }

    /**
     * 重组事件流
     * <p>
     * 没有任何内容时以 {@link EmptyResponseException} 结束，此时不会发出任何事件
     *
     * @param chunks 上游 JSON 块
     * @param model  请求的模型（写入 message_start，并决定签名的家族）
     */
    public Flux<JSONObject> reassemble(Flux<String> chunks, String model) {
        return Flux.defer(() -> {
            State state = new State(model);
            return chunks.concatMapIterable(state::onChunk)
                    .concatWith(Flux.defer(() -> Flux.fromIterable(state.finish())));
        });
    }

    /**
     * 多次重试后仍为空时返回给客户端的兜底消息
     */
    public static List<JSONObject> emptyResponseFallback(String model) {
        List<JSONObject> events = new ArrayList<>();
        events.add(messageStart(newMessageId(), model, JSONObject.of("input_tokens", 0, "output_tokens", 0)));
        events.add(JSONObject.of("type", "content_block_start", //
                "index", 0, //
                "content_block", JSONObject.of("type", "text", "text", "")));
        events.add(JSONObject.of("type", "content_block_delta", //
                "index", 0, //
                "delta", JSONObject.of("type", "text_delta", "text", "[No response after retries - please try again]")));
        events.add(JSONObject.of("type", "content_block_stop", "index", 0));
        JSONObject delta = new JSONObject();
        delta.put("stop_reason", "end_turn");
        delta.put("stop_sequence", null);
        events.add(JSONObject.of("type", "message_delta", //
                "delta", delta, //
                "usage", JSONObject.of("output_tokens", 0)));
        events.add(JSONObject.of("type", "message_stop"));
        return events;
    }

    static String newMessageId() {
        byte[] bytes = new byte[16];
        ThreadLocalRandom.current().nextBytes(bytes);
        return "msg_" + HexFormat.of().formatHex(bytes);
    }

    private static JSONObject messageStart(String id, String model, JSONObject usage) {
        JSONObject message = new JSONObject();
        message.put("id", id);
        message.put("type", "message");
        message.put("role", "assistant");
        message.put("content", new JSONArray());
        message.put("model", model);
        message.put("stop_reason", null);
        message.put("stop_sequence", null);
        message.put("usage", usage);
        return JSONObject.of("type", "message_start", "message", message);
    }

    /**
     * 单次重组的状态
     */
    private class State {

        private final String model;
        private final ModelFamily family;
        private final String messageId = newMessageId();

        private boolean started;
        private int blockIndex = -1;
        // thinking / text / null
        private String openBlock;
        private String pendingSignature;
        private boolean hasToolCall;
        private String finishReason;
        private int promptTokens;
        private int outputTokens;
        private int cachedTokens;

        State(String model) {
            this.model = model;
            this.family = ModelCatalog.familyOf(model);
        }

        List<JSONObject> onChunk(String chunk) {
            JSONObject json;
            try {
                json = JSONObject.parseObject(chunk);
            } catch (JSONException e) {
                log.debug("跳过无法解析的上游块: {}", e.getMessage());
                return List.of();
            }
            if (json == null) {
                return List.of();
            }
            JSONObject response = json.containsKey("response") ? json.getJSONObject("response") : json;

            JSONObject usage = response.getJSONObject("usageMetadata");
            if (usage != null) {
                promptTokens = usage.getIntValue("promptTokenCount", promptTokens);
                outputTokens = usage.getIntValue("candidatesTokenCount", outputTokens);
                cachedTokens = usage.getIntValue("cachedContentTokenCount", cachedTokens);
            }

            List<JSONObject> events = new ArrayList<>();
            JSONArray candidates = response.getJSONArray("candidates");
            if (candidates == null || candidates.isEmpty()) {
                return events;
            }
            JSONObject candidate = candidates.getJSONObject(0);
            String reason = candidate.getString("finishReason");
            if (reason != null) {
                finishReason = reason;
            }

            JSONObject content = candidate.getJSONObject("content");
            JSONArray parts = content != null ? content.getJSONArray("parts") : null;
            if (parts != null) {
                for (int i = 0; i < parts.size(); i++) {
                    onPart(parts.getJSONObject(i), events);
                }
            }
            return events;
        }

        private void onPart(JSONObject part, List<JSONObject> events) {
            if (part == null) {
                return;
            }
            String signature = part.getString("thoughtSignature");

            if (part.containsKey("functionCall")) {
                onFunctionCall(part.getJSONObject("functionCall"), signature, events);
                return;
            }

            if (part.containsKey("inlineData")) {
                JSONObject inline = part.getJSONObject("inlineData");
                ensureStarted(events);
                closeOpenBlock(events);
                blockIndex++;
                events.add(JSONObject.of("type", "content_block_start", //
                        "index", blockIndex, //
                        "content_block", JSONObject.of("type", "image", //
                                "source", JSONObject.of( //
                                        "type", "base64", //
                                        "media_type", inline.getString("mimeType"), //
                                        "data", inline.getString("data")))));
                events.add(JSONObject.of("type", "content_block_stop", "index", blockIndex));
                return;
            }

            String text = part.getString("text");
            if (Boolean.TRUE.equals(part.getBoolean("thought"))) {
                if ((text == null || text.isEmpty()) && signature == null) {
                    return;
                }
                ensureStarted(events);
                openBlock("thinking", events);
                if (text != null && !text.isEmpty()) {
                    events.add(delta(JSONObject.of("type", "thinking_delta", "thinking", text)));
                }
                if (signature != null) {
                    signatureCache.cacheThinkingSignature(signature, family);
                    pendingSignature = signature;
                }
                return;
            }

            if (text != null && !text.isEmpty()) {
                ensureStarted(events);
                openBlock("text", events);
                events.add(delta(JSONObject.of("type", "text_delta", "text", text)));
            }
            if (signature != null) {
                // Gemini 有时把签名挂在正文 part 上
                signatureCache.cacheThinkingSignature(signature, family);
            }
        }

        private void onFunctionCall(JSONObject call, String signature, List<JSONObject> events) {
            ensureStarted(events);
            closeOpenBlock(events);

            String id = call.getString("id");
            if (id == null || id.isEmpty()) {
                byte[] bytes = new byte[12];
                ThreadLocalRandom.current().nextBytes(bytes);
                id = "toolu_" + HexFormat.of().formatHex(bytes);
            }
            if (signature != null) {
                signatureCache.cacheToolSignature(id, signature, family);
                signatureCache.cacheThinkingSignature(signature, family);
            }

            JSONObject args = call.getJSONObject("args");
            blockIndex++;
            events.add(JSONObject.of("type", "content_block_start", //
                    "index", blockIndex, //
                    "content_block", JSONObject.of( //
                            "type", "tool_use", //
                            "id", id, //
                            "name", call.getString("name"), //
                            "input", new JSONObject())));
            events.add(delta(JSONObject.of("type", "input_json_delta", //
                    "partial_json", (args != null ? args : new JSONObject()).toJSONString())));
            events.add(JSONObject.of("type", "content_block_stop", "index", blockIndex));
            hasToolCall = true;
        }

        List<JSONObject> finish() {
            if (!started) {
                throw new EmptyResponseException(model);
            }
            List<JSONObject> events = new ArrayList<>();
            closeOpenBlock(events);

            String stopReason;
            if (hasToolCall) {
                stopReason = "tool_use";
            } else if ("MAX_TOKENS".equals(finishReason)) {
                stopReason = "max_tokens";
            } else {
                stopReason = "end_turn";
            }

            JSONObject delta = new JSONObject();
            delta.put("stop_reason", stopReason);
            delta.put("stop_sequence", null);
            events.add(JSONObject.of("type", "message_delta", //
                    "delta", delta, //
                    "usage", usage(outputTokens)));
            events.add(JSONObject.of("type", "message_stop"));
            log.debug("重组完成: model={}, blocks={}, stop={}", model, blockIndex + 1, stopReason);
            return events;
        }

        // ==================== 块管理 ====================

        private void ensureStarted(List<JSONObject> events) {
            if (!started) {
                started = true;
                events.add(messageStart(messageId, model, usage(0)));
            }
        }

        private void openBlock(String type, List<JSONObject> events) {
            if (type.equals(openBlock)) {
                return;
            }
            closeOpenBlock(events);
            blockIndex++;
            openBlock = type;
            JSONObject block = "thinking".equals(type)
                    ? JSONObject.of("type", "thinking", "thinking", "")
                    : JSONObject.of("type", "text", "text", "");
            events.add(JSONObject.of("type", "content_block_start", //
                    "index", blockIndex, //
                    "content_block", block));
        }

        private void closeOpenBlock(List<JSONObject> events) {
            if (openBlock == null) {
                return;
            }
            if ("thinking".equals(openBlock) && pendingSignature != null) {
                events.add(delta(JSONObject.of("type", "signature_delta", "signature", pendingSignature)));
                pendingSignature = null;
            }
            events.add(JSONObject.of("type", "content_block_stop", "index", blockIndex));
            openBlock = null;
        }

        private JSONObject delta(JSONObject delta) {
            return JSONObject.of("type", "content_block_delta", //
                    "index", blockIndex, //
                    "delta", delta);
        }

        private JSONObject usage(int output) {
            JSONObject usage = new JSONObject();
            usage.put("input_tokens", Math.max(0, promptTokens - cachedTokens));
            usage.put("output_tokens", output);
            if (cachedTokens > 0) {
                usage.put("cache_read_input_tokens", cachedTokens);
            }
            return usage;
        }
    }
}
