package com.autonomous.gateway.controller;

import com.autonomous.gateway.model.AIModel;
import com.autonomous.gateway.service.ModelCatalogService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
public class ProviderController {

    private final ModelCatalogService modelCatalogService;

    public ProviderController(ModelCatalogService modelCatalogService) {
        this.modelCatalogService = modelCatalogService;
    }

    @GetMapping("/providers/{id}/models")
    public ResponseEntity<List<AIModel>> models(@PathVariable String id) {
        return ResponseEntity.ok(modelCatalogService.getModels(ChatController.parseProvider(id)).getOrThrow());
    }

    @GetMapping("/health")
    public ResponseEntity<?> health() {
        return ResponseEntity.ok(Map.of("status", "ok"));
    }
}
