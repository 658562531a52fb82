package com.antigravity.gateway.auth;

/**
 * loadCodeAssist 发现的项目与订阅等级
 *
 * @param projectId 项目 ID，未发现时为 null
 * @param tier      free / pro / ultra / unknown
 */
public record ProjectInfo(String projectId, String tier) {}
