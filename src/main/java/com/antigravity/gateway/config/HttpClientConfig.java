package com.antigravity.gateway.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.JdkClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;

import java.net.InetSocketAddress;
import java.net.ProxySelector;
import java.net.URI;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;

/**
 * HttpClient 配置
 * <p>
 * 连接超时、代理设置；WebClient 复用同一个 JDK HttpClient
 */
@Configuration
public class HttpClientConfig {

    private static final Logger log = LoggerFactory.getLogger(HttpClientConfig.class);

    @Bean
    public HttpClient upstreamHttpClient(AppProperties properties) {
        HttpClient.Builder builder = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(30))
                .version(HttpClient.Version.HTTP_1_1);

        // 代理配置
        AppProperties.ProxyConfig proxy = properties.getProxy();
        if (proxy.isEnabled() && proxy.getUrl() != null && !proxy.getUrl().isEmpty()) {
            try {
                URI uri = URI.create(proxy.getUrl());
                int port = uri.getPort() > 0 ? uri.getPort() : 8080;
                builder.proxy(ProxySelector.of(new InetSocketAddress(uri.getHost(), port)));
                log.info("HTTP 代理已配置: {}:{}", uri.getHost(), port);
            } catch (IllegalArgumentException e) {
                log.warn("代理 URL 解析失败: {}, 将不使用代理", proxy.getUrl());
            }
        }

        return builder.build();
    }

    @Bean
    public WebClient upstreamWebClient(HttpClient upstreamHttpClient) {
        return WebClient.builder()
                .clientConnector(new JdkClientHttpConnector(upstreamHttpClient))
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
