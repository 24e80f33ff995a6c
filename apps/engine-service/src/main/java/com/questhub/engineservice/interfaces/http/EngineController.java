package com.questhub.engineservice.interfaces.http;

import com.questhub.engineservice.service.GameEngine;
import com.questhub.engineservice.service.metrics.MetricsSnapshot;
import com.questhub.web.common.ApiResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 引擎运行指标。
 */
@RestController
@RequestMapping("/api/engine")
@RequiredArgsConstructor
public class EngineController {

    private final GameEngine engine;

    @GetMapping("/metrics")
    public ResponseEntity<ApiResponse<MetricsSnapshot>> metrics() {
        return ResponseEntity.ok(ApiResponse.success(engine.getMetrics()));
    }
}
