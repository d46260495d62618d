package cn.bafuka.configarmor.example.dto;

import cn.bafuka.configarmor.model.GlobalConfig;
import lombok.Data;

/**
 * 全局配置整体更新请求体
 */
@Data
public class GlobalConfigRequest {

    private Integer lastUsedProfile;

    private String languagePreference;

    private Boolean enableArtistApi;

    private Integer windowWidth;

    private Integer windowHeight;

    private Integer windowX;

    private Integer windowY;

    private Boolean windowMaximized;

    public GlobalConfig toConfig() {
        GlobalConfig.GlobalConfigBuilder builder = GlobalConfig.defaults(GlobalConfig.SINGLETON_ID).toBuilder()
                .lastUsedProfile(lastUsedProfile)
                .windowX(windowX)
                .windowY(windowY);
        if (languagePreference != null) {
            builder.languagePreference(languagePreference);
        }
        if (enableArtistApi != null) {
            builder.enableArtistApi(enableArtistApi);
        }
        if (windowWidth != null) {
            builder.windowWidth(windowWidth);
        }
        if (windowHeight != null) {
            builder.windowHeight(windowHeight);
        }
        if (windowMaximized != null) {
            builder.windowMaximized(windowMaximized);
        }
        return builder.build();
    }
}
