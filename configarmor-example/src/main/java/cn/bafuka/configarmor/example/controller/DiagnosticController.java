package cn.bafuka.configarmor.example.controller;

import cn.bafuka.configarmor.connection.CircuitBreaker;
import cn.bafuka.configarmor.service.ConfigAccessService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 诊断控制器
 * 用于查看缓存命中情况与熔断器状态
 */
@Slf4j
@RestController
@RequestMapping("/api/diagnostic")
public class DiagnosticController {

    @Autowired
    private List<ConfigAccessService<?, ?>> accessServices;

    @Autowired
    private CircuitBreaker circuitBreaker;

    /**
     * 各资源的缓存统计
     */
    @GetMapping("/cache")
    public Map<String, Object> getCacheStats() {
        Map<String, Object> stats = new HashMap<>();
        for (ConfigAccessService<?, ?> service : accessServices) {
            stats.put(service.getResource(), service.getCacheStats());
        }

        Map<String, Object> result = new HashMap<>();
        result.put("success", true);
        result.put("total", stats.size());
        result.put("caches", stats);
        return result;
    }

    /**
     * 熔断器状态
     */
    @GetMapping("/circuit-breaker")
    public Map<String, Object> getCircuitBreaker() {
        Map<String, Object> result = new HashMap<>();
        result.put("success", true);
        result.put("data", circuitBreaker.snapshot());
        return result;
    }
}
