package cn.bafuka.configarmor.example.controller;

import cn.bafuka.configarmor.example.dto.ProfileConfigRequest;
import cn.bafuka.configarmor.service.ProfileConfigurationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * 档案配置控制器
 */
@Slf4j
@RestController
@RequestMapping("/api/profiles/{profileId}/config")
public class ProfileConfigController {

    @Autowired
    private ProfileConfigurationService profileConfigurationService;

    /**
     * 查询档案配置
     */
    @GetMapping
    public CompletableFuture<Map<String, Object>> getConfig(@PathVariable int profileId) {
        return profileConfigurationService.getProfileConfig(profileId).thenApply(ApiResults::ok);
    }

    /**
     * 整体更新档案配置
     */
    @PutMapping
    public CompletableFuture<Map<String, Object>> updateConfig(@PathVariable int profileId,
                                                               @RequestBody ProfileConfigRequest request) {
        CompletableFuture<Void> write = profileConfigurationService.getProfileConfig(profileId)
                .thenCompose(existing -> profileConfigurationService.updateProfileConfig(request.toConfig(existing)));
        return done(write, "档案配置更新成功");
    }

    @PutMapping("/volume")
    public CompletableFuture<Map<String, Object>> updateVolume(@PathVariable int profileId,
                                                               @RequestParam int volume) {
        return done(profileConfigurationService.updateVolume(profileId, volume), "音量更新成功");
    }

    @PutMapping("/theme")
    public CompletableFuture<Map<String, Object>> updateTheme(@PathVariable int profileId,
                                                              @RequestBody String themeJson) {
        return done(profileConfigurationService.updateTheme(profileId, themeJson), "主题更新成功");
    }

    /**
     * 查询黑名单目录
     */
    @GetMapping("/blacklist")
    public CompletableFuture<Map<String, Object>> getBlacklist(@PathVariable int profileId) {
        return profileConfigurationService.getBlacklistedDirectories(profileId).thenApply(ApiResults::ok);
    }

    @PostMapping("/blacklist")
    public CompletableFuture<Map<String, Object>> addBlacklist(@PathVariable int profileId,
                                                               @RequestParam String path) {
        return done(profileConfigurationService.addBlacklistDirectory(profileId, path), "黑名单目录已添加");
    }

    @DeleteMapping("/blacklist")
    public CompletableFuture<Map<String, Object>> removeBlacklist(@PathVariable int profileId,
                                                                  @RequestParam String path) {
        return done(profileConfigurationService.removeBlacklistDirectory(profileId, path), "黑名单目录已移除");
    }

    /**
     * 重置为默认配置
     */
    @PostMapping("/reset")
    public CompletableFuture<Map<String, Object>> reset(@PathVariable int profileId) {
        return done(profileConfigurationService.resetProfileToDefaults(profileId), "档案配置已重置");
    }

    /**
     * 手动失效本地缓存
     */
    @DeleteMapping("/cache")
    public Map<String, Object> invalidate(@PathVariable int profileId) {
        profileConfigurationService.invalidateCache(profileId);
        return ApiResults.message("缓存已失效");
    }

    private CompletableFuture<Map<String, Object>> done(CompletableFuture<Void> write, String message) {
        return write.thenApply(v -> ApiResults.message(message))
                .exceptionally(e -> {
                    log.error("档案配置写入失败", e);
                    return ApiResults.failure(e);
                });
    }
}
