package com.antigravity.gateway.controller;

import com.alibaba.fastjson2.JSONObject;
import com.antigravity.gateway.exception.GatewayException;
import com.antigravity.gateway.exception.GlobalExceptionHandler;
import com.antigravity.gateway.exception.TranslationException;
import com.antigravity.gateway.orchestrator.MessageOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferFactory;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Anthropic Messages 兼容端点
 * <p>
 * POST /v1/messages，流式 + 非流式
 */
@RestController
@RequestMapping("/v1")
public class MessagesController {

    private static final Logger log = LoggerFactory.getLogger(MessagesController.class);

    private final MessageOrchestrator orchestrator;

    public MessagesController(MessageOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping(value = "/messages")
    public Mono<Void> messages(@RequestBody String body, ServerWebExchange exchange) {
        JSONObject request = JSONObject.parseObject(body);
        if (request == null) {
            return Mono.error(new TranslationException("请求体为空"));
        }
        if (request.getString("model") == null || request.getString("model").isBlank()) {
            return Mono.error(new TranslationException("缺少 model 字段"));
        }
        boolean stream = request.getBooleanValue("stream", false);
        log.info("收到请求: model={}, stream={}, messages={}", request.getString("model"), stream,
                request.getJSONArray("messages") == null ? 0 : request.getJSONArray("messages").size());

        DataBufferFactory bufferFactory = exchange.getResponse().bufferFactory();

        if (stream) {
            exchange.getResponse().getHeaders().setContentType(MediaType.TEXT_EVENT_STREAM);
            exchange.getResponse().getHeaders().setCacheControl("no-cache");
            Flux<String> sseFlux = streamEvents(orchestrator.stream(request));
            return exchange.getResponse().writeAndFlushWith(
                    sseFlux.map(s -> Mono.just(bufferFactory.wrap(s.getBytes(StandardCharsets.UTF_8))))
            );
        }

        // 非流式：直接写 JSON 字节
        return orchestrator.complete(request).flatMap(response -> {
            exchange.getResponse().getHeaders().setContentType(MediaType.APPLICATION_JSON);
            byte[] bytes = response.toJSONString().getBytes(StandardCharsets.UTF_8);
            exchange.getResponse().getHeaders().setContentLength(bytes.length);
            DataBuffer buffer = bufferFactory.wrap(bytes);
            return exchange.getResponse().writeWith(Mono.just(buffer));
        });
    }

    // ==================== 流式响应 ====================

    /**
     * 事件转 SSE 帧
     * <p>
     * 首个事件之前的错误原样抛出，由全局异常处理器返回带状态码的 JSON；之后的错误写成 error 事件
     */
    static Flux<String> streamEvents(Flux<JSONObject> events) {
        return Flux.defer(() -> {
            AtomicBoolean started = new AtomicBoolean(false);
            return events
                    .doOnNext(event -> started.set(true))
                    .map(MessagesController::toSse)
                    .onErrorResume(e -> started.get(), e -> {
                        log.error("流式响应中途失败: {}", e.getMessage());
                        return Flux.just(toSse(errorEvent(e)));
                    });
        });
    }

    static String toSse(JSONObject event) {
        return "event: " + event.getString("type") + "\ndata: " + event.toJSONString() + "\n\n";
    }

    private static JSONObject errorEvent(Throwable e) {
        if (e instanceof GatewayException ge) {
            return GlobalExceptionHandler.errorBody(GlobalExceptionHandler.errorType(ge), ge.getMessage());
        }
        return GlobalExceptionHandler.errorBody("api_error", e.getMessage() == null ? "服务器内部错误" : e.getMessage());
    }
}
