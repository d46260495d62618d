package cn.bafuka.configarmor.model;

import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 用户档案配置（不可变）
 * 缓存中的实例会被多个调用方共享，修改一律通过 toBuilder() 生成新对象。
 * 主题、视图状态等字段以 JSON 文本保存，本层不解析其内容
 */
@Value
@Builder(toBuilder = true)
public class ProfileConfig {

    /**
     * 内存默认配置使用的 id，表示该配置从未持久化
     */
    public static final int TRANSIENT_ID = -1;

    public static final String DEFAULT_THEME = "{\"themeType\": \"DarkNeon\"}";

    public static final String DEFAULT_VIEW_STATE = "{\"tracks\": \"grid\"}";

    public static final String DEFAULT_SORTING_STATE = "{\"library\": {\"field\": \"title\", \"order\": \"asc\"}}";

    private int id;

    private int profileId;

    @Builder.Default
    private String equalizerPresets = "{}";

    @Builder.Default
    private int lastVolume = 50;

    @Builder.Default
    private String theme = DEFAULT_THEME;

    private boolean dynamicPause;

    /**
     * 不参与扫描的目录
     */
    @Builder.Default
    private List<String> blacklistDirectory = Collections.emptyList();

    @Builder.Default
    private String viewState = DEFAULT_VIEW_STATE;

    @Builder.Default
    private String sortingState = DEFAULT_SORTING_STATE;

    @Builder.Default
    private boolean navigationExpanded = true;

    /**
     * 构造默认配置（尚未持久化）
     *
     * @param profileId 档案 ID
     * @return 默认配置
     */
    public static ProfileConfig defaults(int profileId) {
        return ProfileConfig.builder()
                .id(TRANSIENT_ID)
                .profileId(profileId)
                .build();
    }

    /**
     * 黑名单目录的只读快照
     */
    public List<String> getBlacklistDirectory() {
        if (blacklistDirectory == null) {
            return Collections.emptyList();
        }
        return Collections.unmodifiableList(new ArrayList<>(blacklistDirectory));
    }

    /**
     * 是否是从未持久化的内存配置
     */
    public boolean isTransient() {
        return id == TRANSIENT_ID;
    }
}
