package com.antigravity.gateway.proxy;

import java.util.Map;

/**
 * Cloud Code 上游请求的固定头
 */
public final class UpstreamHeaders {

    public static final String USER_AGENT = "antigravity/1.11.5 windows/amd64";
    public static final String API_CLIENT = "google-cloud-sdk vscode_cloudshelleditor/0.1";
    public static final String CLIENT_METADATA =
            "{\"ideType\":\"IDE_UNSPECIFIED\",\"platform\":\"PLATFORM_UNSPECIFIED\",\"pluginType\":\"GEMINI\"}";

    private UpstreamHeaders() {
    }

    public static Map<String, String> common(String accessToken) {
        return Map.of(
                "Authorization", "Bearer " + accessToken,
                "Content-Type", "application/json",
                "User-Agent", USER_AGENT,
                "X-Goog-Api-Client", API_CLIENT,
                "Client-Metadata", CLIENT_METADATA
        );
    }
}
