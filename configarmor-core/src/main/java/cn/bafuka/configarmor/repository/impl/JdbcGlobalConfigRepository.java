package cn.bafuka.configarmor.repository.impl;

import cn.bafuka.configarmor.connection.ConnectionManager;
import cn.bafuka.configarmor.exception.WriteConflictException;
import cn.bafuka.configarmor.model.GlobalConfig;
import cn.bafuka.configarmor.repository.ConfigRepository;
import cn.bafuka.configarmor.repository.FetchResult;
import lombok.extern.slf4j.Slf4j;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;

/**
 * 全局配置仓储（JDBC）
 */
@Slf4j
public class JdbcGlobalConfigRepository extends AbstractJdbcRepository
        implements ConfigRepository<Integer, GlobalConfig> {

    static final String SELECT_SQL =
            "SELECT id, last_used_profile, language_preference, enable_artist_api, window_width, window_height, "
                    + "window_x, window_y, is_window_maximized FROM global_config WHERE id = ?";

    static final String INSERT_SQL =
            "INSERT INTO global_config (id, last_used_profile, language_preference, enable_artist_api, "
                    + "window_width, window_height, window_x, window_y, is_window_maximized) "
                    + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)";

    static final String UPDATE_SQL =
            "UPDATE global_config SET last_used_profile = ?, language_preference = ?, enable_artist_api = ?, "
                    + "window_width = ?, window_height = ?, window_x = ?, window_y = ?, is_window_maximized = ? "
                    + "WHERE id = ?";

    public JdbcGlobalConfigRepository(ConnectionManager connectionManager) {
        super(connectionManager);
    }

    @Override
    public FetchResult<GlobalConfig> fetchByKey(Integer id) {
        return execute("查询全局配置", id, connection -> {
            try (PreparedStatement ps = connection.prepareStatement(SELECT_SQL)) {
                ps.setInt(1, id);
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) {
                        return FetchResult.notFound();
                    }
                    return FetchResult.found(mapRow(rs));
                }
            }
        });
    }

    @Override
    public GlobalConfig create(Integer id) {
        GlobalConfig config = GlobalConfig.defaults(id);

        return execute("创建全局配置", id, connection -> {
            try (PreparedStatement ps = connection.prepareStatement(INSERT_SQL)) {
                ps.setInt(1, id);
                bindColumns(ps, config, 2);
                ps.executeUpdate();
            }
            log.info("全局配置已创建: id={}", id);
            return config;
        });
    }

    @Override
    public void update(GlobalConfig config) {
        int id = config.getId();
        execute("更新全局配置", id, connection -> {
            try (PreparedStatement ps = connection.prepareStatement(UPDATE_SQL)) {
                int next = bindColumns(ps, config, 1);
                ps.setInt(next, id);

                if (ps.executeUpdate() == 0) {
                    throw new WriteConflictException("全局配置不存在，无法更新: id=" + id, id);
                }
            }
            return null;
        });
    }

    /**
     * 绑定除主键外的所有列
     *
     * @return 下一个参数下标
     */
    private int bindColumns(PreparedStatement ps, GlobalConfig config, int start) throws SQLException {
        int i = start;
        ps.setObject(i++, config.getLastUsedProfile(), Types.INTEGER);
        ps.setString(i++, config.getLanguagePreference() != null ? config.getLanguagePreference() : "en");
        ps.setBoolean(i++, config.isEnableArtistApi());
        ps.setInt(i++, config.getWindowWidth());
        ps.setInt(i++, config.getWindowHeight());
        ps.setObject(i++, config.getWindowX(), Types.INTEGER);
        ps.setObject(i++, config.getWindowY(), Types.INTEGER);
        ps.setBoolean(i++, config.isWindowMaximized());
        return i;
    }

    private GlobalConfig mapRow(ResultSet rs) throws SQLException {
        return GlobalConfig.builder()
                .id(rs.getInt("id"))
                .lastUsedProfile(getNullableInt(rs, "last_used_profile"))
                .languagePreference(getString(rs, "language_preference", "en"))
                .enableArtistApi(rs.getBoolean("enable_artist_api"))
                .windowWidth(rs.getInt("window_width"))
                .windowHeight(rs.getInt("window_height"))
                .windowX(getNullableInt(rs, "window_x"))
                .windowY(getNullableInt(rs, "window_y"))
                .windowMaximized(rs.getBoolean("is_window_maximized"))
                .build();
    }
}
