package com.antigravity.gateway.translator;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.Map;

/**
 * 把 Anthropic 事件序列折叠为非流式 Messages 响应
 */
public class ResponseAccumulator {

    private final JSONObject message = new JSONObject();
    private final JSONArray content = new JSONArray();
    // index -> 累积中的 tool_use 参数
    private final Map<Integer, StringBuilder> toolInputs = new HashMap<>();

    public ResponseAccumulator() {
        message.put("type", "message");
        message.put("role", "assistant");
        message.put("content", content);
        message.put("stop_reason", null);
        message.put("stop_sequence", null);
    }

    public static Mono<JSONObject> collect(Flux<JSONObject> events) {
        return Mono.defer(() -> {
            ResponseAccumulator accumulator = new ResponseAccumulator();
            return events.doOnNext(accumulator::accept).then(Mono.fromSupplier(accumulator::result));
        });
    }

    public void accept(JSONObject event) {
        switch (event.getString("type")) {
            case "message_start" -> {
                JSONObject start = event.getJSONObject("message");
                message.put("id", start.getString("id"));
                message.put("model", start.getString("model"));
                message.put("usage", new JSONObject(start.getJSONObject("usage")));
            }
            case "content_block_start" -> {
                JSONObject block = new JSONObject(event.getJSONObject("content_block"));
                content.add(block);
                if ("tool_use".equals(block.getString("type"))) {
                    toolInputs.put(event.getIntValue("index"), new StringBuilder());
                }
            }
            case "content_block_delta" -> applyDelta(event.getIntValue("index"), event.getJSONObject("delta"));
            case "content_block_stop" -> finishBlock(event.getIntValue("index"));
            case "message_delta" -> {
                JSONObject delta = event.getJSONObject("delta");
                message.put("stop_reason", delta.getString("stop_reason"));
                message.put("stop_sequence", delta.get("stop_sequence"));
                JSONObject usage = event.getJSONObject("usage");
                if (usage != null) {
                    JSONObject merged = message.getJSONObject("usage");
                    if (merged == null) {
                        message.put("usage", new JSONObject(usage));
                    } else {
                        merged.putAll(usage);
                    }
                }
            }
            default -> {
                // message_stop / ping 无需处理
            }
        }
    }

    public JSONObject result() {
        return message;
    }

    private void applyDelta(int index, JSONObject delta) {
        if (index < 0 || index >= content.size()) {
            return;
        }
        JSONObject block = content.getJSONObject(index);
        switch (delta.getString("type")) {
            case "text_delta" -> block.put("text", block.getString("text") + delta.getString("text"));
            case "thinking_delta" -> block.put("thinking", block.getString("thinking") + delta.getString("thinking"));
            case "signature_delta" -> block.put("signature", delta.getString("signature"));
            case "input_json_delta" -> {
                StringBuilder input = toolInputs.get(index);
                if (input != null) {
                    input.append(delta.getString("partial_json"));
                }
            }
            default -> {
                // 未知增量类型忽略
            }
        }
    }

    private void finishBlock(int index) {
        StringBuilder input = toolInputs.remove(index);
        if (input == null) {
            return;
        }
        JSONObject block = content.getJSONObject(index);
        if (input.length() == 0) {
            block.put("input", new JSONObject());
            return;
        }
        try {
            block.put("input", JSONObject.parseObject(input.toString()));
        } catch (JSONException e) {
            block.put("input", JSONObject.of("raw", input.toString()));
        }
    }
}
