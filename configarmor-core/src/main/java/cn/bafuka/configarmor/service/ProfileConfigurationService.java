package cn.bafuka.configarmor.service;

import cn.bafuka.configarmor.model.ProfileConfig;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.InvalidPathException;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.function.UnaryOperator;

/**
 * 档案配置服务
 * 负数 profileId 表示紧急档案：只返回内存默认值，任何写操作都直接跳过
 */
@Slf4j
public class ProfileConfigurationService {

    public static final String RESOURCE = "profile-config";

    private final ConfigAccessService<Integer, ProfileConfig> accessService;

    public ProfileConfigurationService(ConfigAccessService<Integer, ProfileConfig> accessService) {
        this.accessService = accessService;
    }

    public CompletableFuture<ProfileConfig> getProfileConfig(int profileId) {
        if (isEmergencyProfile(profileId)) {
            log.debug("紧急档案，返回内存默认配置: profileId={}", profileId);
            return CompletableFuture.completedFuture(ProfileConfig.defaults(profileId));
        }
        return accessService.getConfig(profileId);
    }

    public CompletableFuture<Void> updateProfileConfig(ProfileConfig config) {
        if (isEmergencyProfile(config.getProfileId())) {
            log.warn("紧急档案不允许写入: profileId={}", config.getProfileId());
            return CompletableFuture.completedFuture(null);
        }
        return accessService.updateConfig(config);
    }

    /**
     * 更新音量，与当前值相差不超过 1 时不写入
     */
    public CompletableFuture<Void> updateVolume(int profileId, int volume) {
        if (isEmergencyProfile(profileId)) {
            return CompletableFuture.completedFuture(null);
        }
        return accessService.getConfig(profileId).thenCompose(current -> {
            if (Math.abs(current.getLastVolume() - volume) <= 1) {
                return CompletableFuture.<Void>completedFuture(null);
            }
            return accessService.updateConfig(current.toBuilder().lastVolume(volume).build());
        });
    }

    public CompletableFuture<Void> updatePlaybackSettings(int profileId, boolean dynamicPause) {
        return modify(profileId, current -> current.toBuilder().dynamicPause(dynamicPause).build());
    }

    public CompletableFuture<Void> updateTheme(int profileId, String themeJson) {
        return modify(profileId, current -> current.toBuilder().theme(themeJson).build());
    }

    public CompletableFuture<Void> updateEqualizer(int profileId, String presets) {
        return modify(profileId, current -> current.toBuilder().equalizerPresets(presets).build());
    }

    public CompletableFuture<Void> updateViewState(int profileId, String viewState) {
        return modify(profileId, current -> current.toBuilder().viewState(viewState).build());
    }

    public CompletableFuture<Void> updateSortState(int profileId, String sortingState) {
        return modify(profileId, current -> current.toBuilder().sortingState(sortingState).build());
    }

    public CompletableFuture<Void> updateNavigationExpanded(int profileId, boolean expanded) {
        return modify(profileId, current -> current.toBuilder().navigationExpanded(expanded).build());
    }

    /**
     * 添加黑名单目录，已存在（忽略大小写）时不写入
     *
     * @throws IllegalArgumentException 路径为空
     */
    public CompletableFuture<Void> addBlacklistDirectory(int profileId, String path) {
        if (isEmergencyProfile(profileId)) {
            return CompletableFuture.completedFuture(null);
        }
        String normalized = normalizePath(requireNonBlank(path));

        return accessService.getConfig(profileId).thenCompose(current -> {
            List<String> blacklist = copyOf(current.getBlacklistDirectory());
            boolean exists = blacklist.stream().anyMatch(p -> p.equalsIgnoreCase(normalized));
            if (exists) {
                log.debug("黑名单目录已存在: profileId={}, path={}", profileId, normalized);
                return CompletableFuture.<Void>completedFuture(null);
            }

            blacklist.add(normalized);
            log.info("添加黑名单目录: profileId={}, path={}", profileId, normalized);
            return accessService.updateConfig(current.toBuilder().blacklistDirectory(blacklist).build());
        });
    }

    /**
     * 移除黑名单目录（忽略大小写），不存在时不写入
     *
     * @throws IllegalArgumentException 路径为空
     */
    public CompletableFuture<Void> removeBlacklistDirectory(int profileId, String path) {
        if (isEmergencyProfile(profileId)) {
            return CompletableFuture.completedFuture(null);
        }
        String normalized = normalizePath(requireNonBlank(path));

        return accessService.getConfig(profileId).thenCompose(current -> {
            List<String> blacklist = copyOf(current.getBlacklistDirectory());
            if (!blacklist.removeIf(p -> p.equalsIgnoreCase(normalized))) {
                return CompletableFuture.<Void>completedFuture(null);
            }

            log.info("移除黑名单目录: profileId={}, path={}", profileId, normalized);
            return accessService.updateConfig(current.toBuilder().blacklistDirectory(blacklist).build());
        });
    }

    /**
     * 获取规范化、去重（忽略大小写）后的黑名单目录
     */
    public CompletableFuture<List<String>> getBlacklistedDirectories(int profileId) {
        return getProfileConfig(profileId).thenApply(config -> {
            Set<String> seen = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
            List<String> result = new ArrayList<>();
            for (String path : copyOf(config.getBlacklistDirectory())) {
                if (path == null || path.trim().isEmpty()) {
                    continue;
                }
                String normalized = normalizePath(path);
                if (!normalized.isEmpty() && seen.add(normalized)) {
                    result.add(normalized);
                }
            }
            return result;
        });
    }

    /**
     * 重置为默认配置，保留记录主键
     */
    public CompletableFuture<Void> resetProfileToDefaults(int profileId) {
        return modify(profileId, current -> {
            log.warn("档案配置重置为默认值: profileId={}", profileId);
            return ProfileConfig.defaults(profileId).toBuilder().id(current.getId()).build();
        });
    }

    private CompletableFuture<Void> modify(int profileId, UnaryOperator<ProfileConfig> change) {
        if (isEmergencyProfile(profileId)) {
            return CompletableFuture.completedFuture(null);
        }
        return accessService.getConfig(profileId)
                .thenCompose(current -> accessService.updateConfig(change.apply(current)));
    }

    public void invalidateCache(Integer profileId) {
        accessService.invalidateCache(profileId);
    }

    static boolean isEmergencyProfile(int profileId) {
        return profileId < 0;
    }

    /**
     * 路径规范化：转为绝对路径并去掉末尾分隔符；无法解析时只去掉末尾分隔符
     */
    static String normalizePath(String path) {
        if (path == null || path.trim().isEmpty()) {
            return "";
        }
        String resolved;
        try {
            resolved = Paths.get(path.trim()).toAbsolutePath().normalize().toString();
        } catch (InvalidPathException e) {
            log.warn("无法规范化路径，仅去除末尾分隔符: path={}, error={}", path, e.getMessage());
            resolved = path.trim();
        }
        return trimTrailingSeparators(resolved);
    }

    private static String trimTrailingSeparators(String path) {
        int end = path.length();
        while (end > 1 && (path.charAt(end - 1) == '/' || path.charAt(end - 1) == '\\')) {
            end--;
        }
        return path.substring(0, end);
    }

    private static String requireNonBlank(String path) {
        if (path == null || path.trim().isEmpty()) {
            throw new IllegalArgumentException("黑名单路径不能为空");
        }
        return path;
    }

    private static List<String> copyOf(List<String> list) {
        return list != null ? new ArrayList<>(list) : new ArrayList<>();
    }
}
