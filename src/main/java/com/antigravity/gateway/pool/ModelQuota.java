package com.antigravity.gateway.pool;

/**
 * 单个模型的上游配额快照（仅作参考）
 *
 * @param remainingFraction 剩余比例 [0,1]，未知为 null
 * @param resetTime         上游给出的重置时间（ISO-8601），可能为 null
 */
public record ModelQuota(Double remainingFraction, String resetTime) {}
