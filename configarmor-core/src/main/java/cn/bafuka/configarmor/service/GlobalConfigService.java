package cn.bafuka.configarmor.service;

import cn.bafuka.configarmor.model.GlobalConfig;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.function.UnaryOperator;

/**
 * 全局配置服务（单行，id 固定为 1）
 */
@Slf4j
public class GlobalConfigService {

    public static final String RESOURCE = "global-config";

    private final ConfigAccessService<Integer, GlobalConfig> accessService;

    public GlobalConfigService(ConfigAccessService<Integer, GlobalConfig> accessService) {
        this.accessService = accessService;
    }

    public CompletableFuture<GlobalConfig> getGlobalConfig() {
        return accessService.getConfig(GlobalConfig.SINGLETON_ID);
    }

    public CompletableFuture<Void> updateGlobalConfig(GlobalConfig config) {
        return accessService.updateConfig(config.toBuilder().id(GlobalConfig.SINGLETON_ID).build());
    }

    public CompletableFuture<Void> updateLastUsedProfile(int profileId) {
        return modify(current -> current.toBuilder().lastUsedProfile(profileId).build());
    }

    /**
     * @throws IllegalArgumentException 语言代码为空
     */
    public CompletableFuture<Void> updateLanguagePreference(String languageCode) {
        if (languageCode == null || languageCode.trim().isEmpty()) {
            throw new IllegalArgumentException("语言代码不能为空");
        }
        return modify(current -> current.toBuilder().languagePreference(languageCode.trim()).build());
    }

    public CompletableFuture<Void> updateWindowState(int width, int height, Integer x, Integer y, boolean maximized) {
        log.debug("更新窗口状态: {}x{}, x={}, y={}, maximized={}", width, height, x, y, maximized);
        return modify(current -> current.toBuilder()
                .windowWidth(width)
                .windowHeight(height)
                .windowX(x)
                .windowY(y)
                .windowMaximized(maximized)
                .build());
    }

    public void invalidateCache() {
        accessService.invalidateCache(GlobalConfig.SINGLETON_ID);
    }

    private CompletableFuture<Void> modify(UnaryOperator<GlobalConfig> change) {
        return getGlobalConfig().thenCompose(current -> accessService.updateConfig(change.apply(current)));
    }
}
