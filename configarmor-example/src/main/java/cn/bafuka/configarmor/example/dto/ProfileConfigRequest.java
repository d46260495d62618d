package cn.bafuka.configarmor.example.dto;

import cn.bafuka.configarmor.model.ProfileConfig;
import lombok.Data;

import java.util.List;

/**
 * 档案配置整体更新请求体
 * 未提交的字段取默认值，主键沿用已有记录
 */
@Data
public class ProfileConfigRequest {

    private String equalizerPresets;

    private Integer lastVolume;

    private String theme;

    private Boolean dynamicPause;

    private List<String> blacklistDirectory;

    private String viewState;

    private String sortingState;

    private Boolean navigationExpanded;

    public ProfileConfig toConfig(ProfileConfig existing) {
        ProfileConfig.ProfileConfigBuilder builder = ProfileConfig.defaults(existing.getProfileId()).toBuilder()
                .id(existing.getId());
        if (equalizerPresets != null) {
            builder.equalizerPresets(equalizerPresets);
        }
        if (lastVolume != null) {
            builder.lastVolume(lastVolume);
        }
        if (theme != null) {
            builder.theme(theme);
        }
        if (dynamicPause != null) {
            builder.dynamicPause(dynamicPause);
        }
        if (blacklistDirectory != null) {
            builder.blacklistDirectory(blacklistDirectory);
        }
        if (viewState != null) {
            builder.viewState(viewState);
        }
        if (sortingState != null) {
            builder.sortingState(sortingState);
        }
        if (navigationExpanded != null) {
            builder.navigationExpanded(navigationExpanded);
        }
        return builder.build();
    }
}
