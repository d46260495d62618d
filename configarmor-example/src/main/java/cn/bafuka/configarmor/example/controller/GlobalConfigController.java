package cn.bafuka.configarmor.example.controller;

import cn.bafuka.configarmor.example.dto.GlobalConfigRequest;
import cn.bafuka.configarmor.service.GlobalConfigService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * 全局配置控制器
 */
@Slf4j
@RestController
@RequestMapping("/api/global-config")
public class GlobalConfigController {

    @Autowired
    private GlobalConfigService globalConfigService;

    @GetMapping
    public CompletableFuture<Map<String, Object>> getConfig() {
        return globalConfigService.getGlobalConfig().thenApply(ApiResults::ok);
    }

    @PutMapping
    public CompletableFuture<Map<String, Object>> updateConfig(@RequestBody GlobalConfigRequest request) {
        return done(globalConfigService.updateGlobalConfig(request.toConfig()), "全局配置更新成功");
    }

    @PutMapping("/language")
    public CompletableFuture<Map<String, Object>> updateLanguage(@RequestParam String code) {
        return done(globalConfigService.updateLanguagePreference(code), "语言更新成功");
    }

    @PutMapping("/last-used-profile")
    public CompletableFuture<Map<String, Object>> updateLastUsedProfile(@RequestParam int profileId) {
        return done(globalConfigService.updateLastUsedProfile(profileId), "最近使用档案更新成功");
    }

    /**
     * 保存窗口状态
     */
    @PutMapping("/window")
    public CompletableFuture<Map<String, Object>> updateWindow(@RequestParam int width,
                                                               @RequestParam int height,
                                                               @RequestParam(required = false) Integer x,
                                                               @RequestParam(required = false) Integer y,
                                                               @RequestParam(defaultValue = "false") boolean maximized) {
        return done(globalConfigService.updateWindowState(width, height, x, y, maximized), "窗口状态已保存");
    }

    private CompletableFuture<Map<String, Object>> done(CompletableFuture<Void> write, String message) {
        return write.thenApply(v -> ApiResults.message(message))
                .exceptionally(e -> {
                    log.error("全局配置写入失败", e);
                    return ApiResults.failure(e);
                });
    }
}
