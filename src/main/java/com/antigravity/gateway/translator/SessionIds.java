package com.antigravity.gateway.translator;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * 会话 ID 派生
 * <p>
 * 取第一条 role=user 消息的文本内容做 SHA-256，取前 16 字节的十六进制
 */
public final class SessionIds {

    private SessionIds() {
    }

    /**
     * @return 会话 ID，没有 user 消息时返回 null
     */
    public static String derive(JSONArray messages) {
        if (messages == null) {
            return null;
        }
        for (int i = 0; i < messages.size(); i++) {
            JSONObject msg = messages.getJSONObject(i);
            if ("user".equals(msg.getString("role"))) {
                return hash(textOf(msg.get("content")));
            }
        }
        return null;
    }

    private static String textOf(Object content) {
        if (content instanceof String s) {
            return s;
        }
        if (content instanceof JSONArray blocks) {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < blocks.size(); i++) {
                JSONObject block = blocks.getJSONObject(i);
                if (block != null && "text".equals(block.getString("type"))) {
                    sb.append(block.getString("text"));
                }
            }
            // 没有文本块时退化为整段内容
            return sb.length() > 0 ? sb.toString() : blocks.toJSONString();
        }
        return content == null ? "" : content.toString();
    }

    private static String hash(String seed) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] digest = md.digest(seed.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < 16; i++) {
                sb.append(String.format("%02x", digest[i]));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 不可用", e);
        }
    }
}
