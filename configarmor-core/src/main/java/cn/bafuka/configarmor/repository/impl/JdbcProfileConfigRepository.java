package cn.bafuka.configarmor.repository.impl;

import cn.bafuka.configarmor.connection.ConnectionManager;
import cn.bafuka.configarmor.exception.RepositoryException;
import cn.bafuka.configarmor.exception.WriteConflictException;
import cn.bafuka.configarmor.model.ProfileConfig;
import cn.bafuka.configarmor.repository.ConfigRepository;
import cn.bafuka.configarmor.repository.FetchResult;
import com.alibaba.fastjson.JSON;
import lombok.extern.slf4j.Slf4j;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * 档案配置仓储（JDBC）
 * 黑名单目录以 JSON 数组文本存放
 */
@Slf4j
public class JdbcProfileConfigRepository extends AbstractJdbcRepository
        implements ConfigRepository<Integer, ProfileConfig> {

    static final String SELECT_SQL =
            "SELECT id, profile_id, equalizer_presets, last_volume, theme, dynamic_pause, blacklist_directory, "
                    + "view_state, sorting_state, navigation_expanded FROM profile_config WHERE profile_id = ?";

    static final String INSERT_SQL =
            "INSERT INTO profile_config (profile_id, equalizer_presets, last_volume, theme, dynamic_pause, "
                    + "blacklist_directory, view_state, sorting_state, navigation_expanded) "
                    + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)";

    static final String UPDATE_SQL =
            "UPDATE profile_config SET equalizer_presets = ?, last_volume = ?, theme = ?, dynamic_pause = ?, "
                    + "blacklist_directory = ?, view_state = ?, sorting_state = ?, navigation_expanded = ? "
                    + "WHERE profile_id = ?";

    public JdbcProfileConfigRepository(ConnectionManager connectionManager) {
        super(connectionManager);
    }

    @Override
    public FetchResult<ProfileConfig> fetchByKey(Integer profileId) {
        return execute("查询档案配置", profileId, connection -> {
            try (PreparedStatement ps = connection.prepareStatement(SELECT_SQL)) {
                ps.setInt(1, profileId);
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) {
                        log.debug("档案配置不存在: profileId={}", profileId);
                        return FetchResult.notFound();
                    }
                    return FetchResult.found(mapRow(rs));
                }
            }
        });
    }

    @Override
    public ProfileConfig create(Integer profileId) {
        ProfileConfig config = ProfileConfig.builder()
                .profileId(profileId)
                .build();

        return execute("创建档案配置", profileId, connection -> {
            try (PreparedStatement ps = connection.prepareStatement(INSERT_SQL, Statement.RETURN_GENERATED_KEYS)) {
                ps.setInt(1, profileId);
                ps.setString(2, config.getEqualizerPresets());
                ps.setInt(3, config.getLastVolume());
                ps.setString(4, config.getTheme());
                ps.setBoolean(5, config.isDynamicPause());
                ps.setString(6, JSON.toJSONString(config.getBlacklistDirectory()));
                ps.setString(7, config.getViewState());
                ps.setString(8, config.getSortingState());
                ps.setBoolean(9, config.isNavigationExpanded());
                ps.executeUpdate();

                try (ResultSet keys = ps.getGeneratedKeys()) {
                    if (!keys.next()) {
                        throw new RepositoryException("创建档案配置失败：未返回主键", null, profileId);
                    }
                    ProfileConfig created = config.toBuilder().id(keys.getInt(1)).build();
                    log.info("档案配置已创建: profileId={}, id={}", profileId, created.getId());
                    return created;
                }
            }
        });
    }

    @Override
    public void update(ProfileConfig config) {
        int profileId = config.getProfileId();
        execute("更新档案配置", profileId, connection -> {
            try (PreparedStatement ps = connection.prepareStatement(UPDATE_SQL)) {
                ps.setString(1, config.getEqualizerPresets() != null ? config.getEqualizerPresets() : "{}");
                ps.setInt(2, config.getLastVolume());
                ps.setString(3, config.getTheme() != null ? config.getTheme() : "{}");
                ps.setBoolean(4, config.isDynamicPause());
                ps.setString(5, JSON.toJSONString(config.getBlacklistDirectory()));
                ps.setString(6, config.getViewState() != null ? config.getViewState() : "{}");
                ps.setString(7, config.getSortingState() != null ? config.getSortingState() : "{}");
                ps.setBoolean(8, config.isNavigationExpanded());
                ps.setInt(9, profileId);

                if (ps.executeUpdate() == 0) {
                    throw new WriteConflictException("档案配置不存在，无法更新: profileId=" + profileId, profileId);
                }
            }
            log.debug("档案配置已更新: profileId={}", profileId);
            return null;
        });
    }

    private ProfileConfig mapRow(ResultSet rs) throws SQLException {
        return ProfileConfig.builder()
                .id(rs.getInt("id"))
                .profileId(rs.getInt("profile_id"))
                .equalizerPresets(getString(rs, "equalizer_presets", "{}"))
                .lastVolume(rs.getInt("last_volume"))
                .theme(getString(rs, "theme", "{}"))
                .dynamicPause(rs.getBoolean("dynamic_pause"))
                .blacklistDirectory(parseBlacklist(rs.getString("blacklist_directory")))
                .viewState(getString(rs, "view_state", ProfileConfig.DEFAULT_VIEW_STATE))
                .sortingState(getString(rs, "sorting_state", ProfileConfig.DEFAULT_SORTING_STATE))
                .navigationExpanded(rs.getBoolean("navigation_expanded"))
                .build();
    }

    static List<String> parseBlacklist(String json) {
        if (json == null || json.trim().isEmpty()) {
            return new ArrayList<>();
        }
        List<String> paths = JSON.parseArray(json, String.class);
        return paths != null ? paths : new ArrayList<>();
    }
}
