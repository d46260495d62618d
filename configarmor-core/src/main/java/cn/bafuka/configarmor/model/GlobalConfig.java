package cn.bafuka.configarmor.model;

import lombok.Builder;
import lombok.Value;

/**
 * 全局配置（单行，不可变）
 */
@Value
@Builder(toBuilder = true)
public class GlobalConfig {

    /**
     * 全局配置固定使用的行 ID
     */
    public static final int SINGLETON_ID = 1;

    private int id;

    /**
     * 上次使用的档案，可能为空
     */
    private Integer lastUsedProfile;

    @Builder.Default
    private String languagePreference = "en";

    @Builder.Default
    private boolean enableArtistApi = true;

    @Builder.Default
    private int windowWidth = 1440;

    @Builder.Default
    private int windowHeight = 760;

    private Integer windowX;

    private Integer windowY;

    private boolean windowMaximized;

    /**
     * 构造默认全局配置
     *
     * @param id 行 ID
     * @return 默认配置
     */
    public static GlobalConfig defaults(int id) {
        return GlobalConfig.builder()
                .id(id)
                .build();
    }
}
