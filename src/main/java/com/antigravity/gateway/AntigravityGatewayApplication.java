package com.antigravity.gateway;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class AntigravityGatewayApplication {

    private static final Logger log = LoggerFactory.getLogger(AntigravityGatewayApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(AntigravityGatewayApplication.class, args);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        log.info("╔═══════════════════════════════════════════════════╗");
        log.info("║          Antigravity Gateway v1.0.0               ║");
        log.info("║   Anthropic Messages → Cloud Code Gateway         ║");
        log.info("╚═══════════════════════════════════════════════════╝");
        log.info("API 端点:");
        log.info("  POST /v1/messages          (Anthropic)");
        log.info("  GET  /v1/models");
        log.info("  GET  /health");
        log.info("  GET  /metrics");
    }
}
