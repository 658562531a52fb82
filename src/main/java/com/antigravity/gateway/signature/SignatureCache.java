package com.antigravity.gateway.signature;

import com.antigravity.gateway.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 思考签名缓存
 * <p>
 * 记录每个签名产生时的模型家族。跨家族的签名不会被当作有效签名，
 * 工具调用签名按 tool_use id 单独记录
 */
@Component
public class SignatureCache {

    private static final Logger log = LoggerFactory.getLogger(SignatureCache.class);

    private final Clock clock;
    private final long ttlMs;
    private final int minLength;

    // signature -> 条目
    private final Map<String, Entry> thinkingSignatures = new ConcurrentHashMap<>();
    // toolUseId -> 条目
    private final Map<String, Entry> toolSignatures = new ConcurrentHashMap<>();

    public SignatureCache(AppProperties properties, Clock clock) {
        this.clock = clock;
        this.ttlMs = properties.getSignature().getTtlMs();
        this.minLength = properties.getSignature().getMinLength();
    }

    public void cacheThinkingSignature(String signature, ModelFamily family) {
        if (!isWellFormed(signature)) {
            return;
        }
        thinkingSignatures.put(signature, new Entry(signature, family, clock.millis()));
    }

    /**
     * 签名来源家族，未知或过期时返回 null
     */
    public ModelFamily getSignatureFamily(String signature) {
        if (signature == null) {
            return null;
        }
        return live(thinkingSignatures, signature);
    }

    /**
     * 签名对目标家族是否有效
     */
    public boolean isValidFor(String signature, ModelFamily target) {
        return isWellFormed(signature) && getSignatureFamily(signature) == target;
    }

    public void cacheToolSignature(String toolUseId, String signature, ModelFamily family) {
        if (toolUseId == null || !isWellFormed(signature)) {
            return;
        }
        toolSignatures.put(toolUseId, new Entry(signature, family, clock.millis()));
    }

    /**
     * 工具调用签名，未知或过期时返回 null
     */
    public Entry getToolSignature(String toolUseId) {
        if (toolUseId == null) {
            return null;
        }
        Entry entry = toolSignatures.get(toolUseId);
        if (entry == null || expired(entry)) {
            return null;
        }
        return entry;
    }

    /**
     * 清理过期条目
     *
     * @return 清理数量
     */
    public int cleanup() {
        int before = thinkingSignatures.size() + toolSignatures.size();
        thinkingSignatures.values().removeIf(this::expired);
        toolSignatures.values().removeIf(this::expired);
        int removed = before - thinkingSignatures.size() - toolSignatures.size();
        if (removed > 0) {
            log.debug("签名缓存清理: {} 条", removed);
        }
        return removed;
    }

    public int size() {
        return thinkingSignatures.size() + toolSignatures.size();
    }

    private boolean isWellFormed(String signature) {
        return signature != null && signature.length() >= minLength;
    }

    private ModelFamily live(Map<String, Entry> map, String key) {
        Entry entry = map.get(key);
        if (entry == null) {
            return null;
        }
        if (expired(entry)) {
            map.remove(key);
            return null;
        }
        return entry.family();
    }

    private boolean expired(Entry entry) {
        return clock.millis() - entry.observedAt() > ttlMs;
    }

    /**
     * 缓存条目
     */
    public record Entry(String signature, ModelFamily family, long observedAt) {}
}
