package com.antigravity.gateway.controller;

import com.antigravity.gateway.model.ModelCatalog;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * 模型列表端点
 */
@RestController
@RequestMapping("/v1")
public class ModelsController {

    private final ModelCatalog modelCatalog;

    public ModelsController(ModelCatalog modelCatalog) {
        this.modelCatalog = modelCatalog;
    }

    @GetMapping(value = "/models", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<String> models() {
        return modelCatalog.listModels().map(list -> list.toJSONString());
    }
}
