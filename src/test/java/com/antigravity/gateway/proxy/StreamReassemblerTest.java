package com.antigravity.gateway.proxy;

import com.alibaba.fastjson2.JSONObject;
import com.antigravity.gateway.config.AppProperties;
import com.antigravity.gateway.exception.EmptyResponseException;
import com.antigravity.gateway.signature.ModelFamily;
import com.antigravity.gateway.signature.SignatureCache;
import com.antigravity.gateway.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StreamReassemblerTest {

    private static final String SIG = "s".repeat(80);

    private SignatureCache signatureCache;
    private StreamReassembler reassembler;

    @BeforeEach
    void setUp() {
        signatureCache = new SignatureCache(new AppProperties(), new MutableClock(0));
        reassembler = new StreamReassembler(signatureCache);
    }

    private static String chunk(String partsJson, String finishReason) {
        String finish = finishReason != null ? ",\"finishReason\":\"" + finishReason + "\"" : "";
        return "{\"response\":{\"candidates\":[{\"content\":{\"role\":\"model\",\"parts\":" + partsJson + "}"
                + finish + "}]}}";
    }

    private List<JSONObject> collect(String model, String... chunks) {
        List<JSONObject> events = reassembler.reassemble(Flux.just(chunks), model).collectList().block();
        assertNotNull(events);
        assertWellFormed(events);
        return events;
    }

    private static List<String> types(List<JSONObject> events) {
        return events.stream().map(e -> e.getString("type")).toList();
    }

    /**
     * 一个 message_start 开头、块不重叠且索引连续、message_delta + message_stop 结尾
     */
    static void assertWellFormed(List<JSONObject> events) {
        assertEquals("message_start", events.get(0).getString("type"));
        assertEquals("message_stop", events.get(events.size() - 1).getString("type"));
        assertEquals("message_delta", events.get(events.size() - 2).getString("type"));
        Integer open = null;
        int expectedNext = 0;
        for (JSONObject event : events.subList(1, events.size() - 2)) {
            switch (event.getString("type")) {
                case "content_block_start" -> {
                    assertNull(open, "block opened while another is open");
                    assertEquals(expectedNext, event.getIntValue("index"));
                    open = expectedNext++;
                }
                case "content_block_delta" -> assertEquals(open, event.getInteger("index"));
                case "content_block_stop" -> {
                    assertEquals(open, event.getInteger("index"));
                    open = null;
                }
                default -> fail("unexpected event " + event.getString("type"));
            }
        }
        assertNull(open);
    }

    @Test
    void textAcrossChunks_formsSingleBlock() {
        List<JSONObject> events = collect("claude-sonnet-4-5",
                chunk("[{\"text\":\"Hel\"}]", null),
                chunk("[{\"text\":\"lo\"}]", "STOP"));

        assertEquals(List.of("message_start", "content_block_start", "content_block_delta", "content_block_delta",
                "content_block_stop", "message_delta", "message_stop"), types(events));
        JSONObject start = events.get(0).getJSONObject("message");
        assertTrue(start.getString("id").startsWith("msg_"));
        assertEquals("claude-sonnet-4-5", start.getString("model"));
        assertEquals("end_turn", events.get(5).getJSONObject("delta").getString("stop_reason"));
    }

    @Test
    void thinkingThenText_emitsSignatureAndCachesFamily() {
        List<JSONObject> events = collect("claude-sonnet-4-5-thinking",
                chunk("[{\"thought\":true,\"text\":\"Let me think\"}]", null),
                chunk("[{\"thought\":true,\"text\":\"\",\"thoughtSignature\":\"" + SIG + "\"}]", null),
                chunk("[{\"text\":\"Answer\"}]", "STOP"));

        JSONObject thinkingStart = events.get(1);
        assertEquals("thinking", thinkingStart.getJSONObject("content_block").getString("type"));
        assertEquals("thinking_delta", events.get(2).getJSONObject("delta").getString("type"));
        JSONObject signatureDelta = events.get(3).getJSONObject("delta");
        assertEquals("signature_delta", signatureDelta.getString("type"));
        assertEquals(SIG, signatureDelta.getString("signature"));
        assertEquals("content_block_stop", events.get(4).getString("type"));
        assertEquals("text", events.get(5).getJSONObject("content_block").getString("type"));

        assertEquals(ModelFamily.CLAUDE, signatureCache.getSignatureFamily(SIG));
    }

    @Test
    void functionCall_emitsToolUseAndCachesToolSignature() {
        List<JSONObject> events = collect("gemini-3-flash",
                chunk("[{\"text\":\"Checking\"},{\"functionCall\":{\"name\":\"ls\",\"args\":{\"path\":\"/\"},\"id\":\"call_1\"},"
                        + "\"thoughtSignature\":\"" + SIG + "\"}]", "STOP"));

        JSONObject toolStart = events.stream()
                .filter(e -> "content_block_start".equals(e.getString("type")))
                .map(e -> e.getJSONObject("content_block"))
                .filter(b -> "tool_use".equals(b.getString("type")))
                .findFirst().orElseThrow();
        assertEquals("call_1", toolStart.getString("id"));
        assertEquals("ls", toolStart.getString("name"));

        JSONObject inputDelta = events.stream()
                .filter(e -> "content_block_delta".equals(e.getString("type")))
                .map(e -> e.getJSONObject("delta"))
                .filter(d -> "input_json_delta".equals(d.getString("type")))
                .findFirst().orElseThrow();
        assertEquals("/", JSONObject.parseObject(inputDelta.getString("partial_json")).getString("path"));

        assertEquals("tool_use", events.get(events.size() - 2).getJSONObject("delta").getString("stop_reason"));
        assertEquals(ModelFamily.GEMINI, signatureCache.getToolSignature("call_1").family());
    }

    @Test
    void functionCallWithoutId_getsGeneratedId() {
        List<JSONObject> events = collect("gemini-3-flash",
                chunk("[{\"functionCall\":{\"name\":\"ls\",\"args\":{}}}]", "STOP"));

        assertTrue(events.get(1).getJSONObject("content_block").getString("id").startsWith("toolu_"));
    }

    @Test
    void maxTokensFinishReason() {
        List<JSONObject> events = collect("gemini-3-flash", chunk("[{\"text\":\"cut\"}]", "MAX_TOKENS"));

        assertEquals("max_tokens", events.get(events.size() - 2).getJSONObject("delta").getString("stop_reason"));
    }

    @Test
    void usage_subtractsCachedTokens() {
        String last = "{\"response\":{\"candidates\":[{\"content\":{\"parts\":[{\"text\":\"hi\"}]},\"finishReason\":\"STOP\"}],"
                + "\"usageMetadata\":{\"promptTokenCount\":100,\"candidatesTokenCount\":7,\"cachedContentTokenCount\":40}}}";

        List<JSONObject> events = collect("claude-sonnet-4-5", last);

        JSONObject usage = events.get(events.size() - 2).getJSONObject("usage");
        assertEquals(60, usage.getIntValue("input_tokens"));
        assertEquals(7, usage.getIntValue("output_tokens"));
        assertEquals(40, usage.getIntValue("cache_read_input_tokens"));
    }

    @Test
    void usage_omitsCacheReadWhenNothingCached() {
        String last = "{\"response\":{\"candidates\":[{\"content\":{\"parts\":[{\"text\":\"hi\"}]}}],"
                + "\"usageMetadata\":{\"promptTokenCount\":10,\"candidatesTokenCount\":2}}}";

        JSONObject usage = collect("claude-sonnet-4-5", last).get(4).getJSONObject("usage");
        assertEquals(10, usage.getIntValue("input_tokens"));
        assertFalse(usage.containsKey("cache_read_input_tokens"));
    }

    @Test
    void nonStreamingPayloadWithoutEnvelope_isAccepted() {
        List<JSONObject> events = collect("claude-sonnet-4-5",
                "{\"candidates\":[{\"content\":{\"parts\":[{\"text\":\"plain\"}]},\"finishReason\":\"STOP\"}]}");

        assertEquals("plain", events.get(2).getJSONObject("delta").getString("text"));
    }

    @Test
    void unparseableChunksAreSkipped() {
        List<JSONObject> events = collect("claude-sonnet-4-5",
                "not json {",
                chunk("[{\"text\":\"ok\"}]", "STOP"));

        assertEquals(7, events.size());
        assertEquals("ok", events.get(2).getJSONObject("delta").getString("text"));
    }

    @Test
    void noContent_failsWithEmptyResponseAndEmitsNothing() {
        Flux<JSONObject> events = reassembler.reassemble(Flux.just(
                chunk("[]", null),
                chunk("[{\"text\":\"\"}]", "STOP")), "gemini-3-flash");

        StepVerifier.create(events)
                .expectError(EmptyResponseException.class)
                .verify();
    }

    @Test
    void emptyResponseFallback_isWellFormed() {
        List<JSONObject> events = StreamReassembler.emptyResponseFallback("gemini-3-flash");

        assertWellFormed(events);
        assertEquals("[No response after retries - please try again]",
                events.get(2).getJSONObject("delta").getString("text"));
        assertEquals("end_turn", events.get(4).getJSONObject("delta").getString("stop_reason"));
    }
}
