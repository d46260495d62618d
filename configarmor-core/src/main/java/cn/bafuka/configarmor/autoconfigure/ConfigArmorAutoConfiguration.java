package cn.bafuka.configarmor.autoconfigure;

import cn.bafuka.configarmor.config.ConfigArmorProperties;
import cn.bafuka.configarmor.connection.CircuitBreaker;
import cn.bafuka.configarmor.connection.ConnectionFactory;
import cn.bafuka.configarmor.connection.ConnectionManager;
import cn.bafuka.configarmor.connection.RetryPolicy;
import cn.bafuka.configarmor.connection.Sleeper;
import cn.bafuka.configarmor.connection.impl.JdbcConnectionManager;
import cn.bafuka.configarmor.consistency.ChangeNotificationBus;
import cn.bafuka.configarmor.consistency.impl.LocalChangeNotificationBus;
import cn.bafuka.configarmor.consistency.impl.RedisChangeNotificationBus;
import cn.bafuka.configarmor.dataplane.impl.CaffeineSingleFlightCache;
import cn.bafuka.configarmor.model.CacheConfig;
import cn.bafuka.configarmor.model.GlobalConfig;
import cn.bafuka.configarmor.model.ProfileConfig;
import cn.bafuka.configarmor.repository.impl.JdbcGlobalConfigRepository;
import cn.bafuka.configarmor.repository.impl.JdbcProfileConfigRepository;
import cn.bafuka.configarmor.service.GlobalConfigService;
import cn.bafuka.configarmor.service.ProfileConfigurationService;
import cn.bafuka.configarmor.service.impl.DefaultConfigAccessService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * ConfigArmor 自动配置类
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(ConfigArmorProperties.class)
@ConditionalOnProperty(prefix = "configarmor", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ConfigArmorAutoConfiguration {

    public ConfigArmorAutoConfiguration() {
        log.info("ConfigArmor auto-configuration initializing...");
    }

    /**
     * 异步回源与写入线程池
     */
    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean(name = "configArmorExecutor")
    public ExecutorService configArmorExecutor(ConfigArmorProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(properties.getExecutor().getThreads(), r -> {
            Thread thread = new Thread(r, "configarmor-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * 熔断器（一个后端存储一个实例）
     */
    @Bean
    @ConditionalOnMissingBean
    public CircuitBreaker configArmorCircuitBreaker(ConfigArmorProperties properties) {
        ConfigArmorProperties.CircuitBreaker config = properties.getCircuitBreaker();
        return new CircuitBreaker("config-db", config.getFailureThreshold(), config.getCoolDown());
    }

    /**
     * 重试策略
     */
    @Bean
    @ConditionalOnMissingBean
    public RetryPolicy configArmorRetryPolicy(ConfigArmorProperties properties) {
        ConfigArmorProperties.Retry retry = properties.getRetry();
        return new RetryPolicy(retry.getMaxAttempts(), retry.getInitialDelay(),
                retry.getBackoffFactor(), retry.getMaxJitter());
    }

    /**
     * 连接管理器，连接串从环境变量读取，缺失时启动失败
     */
    @Bean
    @ConditionalOnMissingBean
    public ConnectionManager configArmorConnectionManager(Environment environment,
                                                          ConfigArmorProperties properties,
                                                          CircuitBreaker circuitBreaker,
                                                          RetryPolicy retryPolicy) {
        ConfigArmorProperties.Connection connection = properties.getConnection();
        String connectionString = environment.getProperty(connection.getConnectionStringEnv());
        return new JdbcConnectionManager(
                connectionString,
                ConnectionFactory.driverManager(),
                retryPolicy,
                circuitBreaker,
                Sleeper.SYSTEM,
                connection.getValidationTimeoutSeconds()
        );
    }

    /**
     * 本地变更总线
     */
    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "configarmor.bus", name = "type", havingValue = "local", matchIfMissing = true)
    public ChangeNotificationBus localChangeNotificationBus() {
        return new LocalChangeNotificationBus();
    }

    @Bean
    @ConditionalOnMissingBean
    public JdbcProfileConfigRepository profileConfigRepository(ConnectionManager connectionManager) {
        return new JdbcProfileConfigRepository(connectionManager);
    }

    @Bean
    @ConditionalOnMissingBean
    public JdbcGlobalConfigRepository globalConfigRepository(ConnectionManager connectionManager) {
        return new JdbcGlobalConfigRepository(connectionManager);
    }

    /**
     * 档案配置访问服务
     */
    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean(name = "profileConfigAccessService")
    public DefaultConfigAccessService<Integer, ProfileConfig> profileConfigAccessService(
            ConfigArmorProperties properties,
            JdbcProfileConfigRepository repository,
            ChangeNotificationBus bus,
            ExecutorService configArmorExecutor) {
        CaffeineSingleFlightCache<Integer, ProfileConfig> cache = new CaffeineSingleFlightCache<>(
                ProfileConfigurationService.RESOURCE, cacheConfig(properties), configArmorExecutor);

        DefaultConfigAccessService<Integer, ProfileConfig> service = new DefaultConfigAccessService<>(
                ProfileConfigurationService.RESOURCE,
                cache,
                repository,
                bus,
                ProfileConfig::getProfileId,
                ProfileConfig::defaults,
                configArmorExecutor
        );
        service.initialize();
        return service;
    }

    /**
     * 全局配置访问服务
     */
    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean(name = "globalConfigAccessService")
    public DefaultConfigAccessService<Integer, GlobalConfig> globalConfigAccessService(
            ConfigArmorProperties properties,
            JdbcGlobalConfigRepository repository,
            ChangeNotificationBus bus,
            ExecutorService configArmorExecutor) {
        CaffeineSingleFlightCache<Integer, GlobalConfig> cache = new CaffeineSingleFlightCache<>(
                GlobalConfigService.RESOURCE, cacheConfig(properties), configArmorExecutor);

        DefaultConfigAccessService<Integer, GlobalConfig> service = new DefaultConfigAccessService<>(
                GlobalConfigService.RESOURCE,
                cache,
                repository,
                bus,
                GlobalConfig::getId,
                GlobalConfig::defaults,
                configArmorExecutor
        );
        service.initialize();
        return service;
    }

    @Bean
    @ConditionalOnMissingBean
    public ProfileConfigurationService profileConfigurationService(
            DefaultConfigAccessService<Integer, ProfileConfig> profileConfigAccessService) {
        return new ProfileConfigurationService(profileConfigAccessService);
    }

    @Bean
    @ConditionalOnMissingBean
    public GlobalConfigService globalConfigService(
            DefaultConfigAccessService<Integer, GlobalConfig> globalConfigAccessService) {
        return new GlobalConfigService(globalConfigAccessService);
    }

    private static CacheConfig cacheConfig(ConfigArmorProperties properties) {
        ConfigArmorProperties.Cache cache = properties.getCache();
        return CacheConfig.builder()
                .ttl(cache.getTtl())
                .maximumSize(cache.getMaximumSize())
                .staleRetention(cache.getStaleRetention())
                .build();
    }

    /**
     * Redis 变更总线（configarmor.bus.type=redis 时启用，需要应用提供 RedisTemplate 与监听容器）
     */
    @Configuration
    @ConditionalOnClass(name = "org.springframework.data.redis.core.RedisTemplate")
    @ConditionalOnProperty(prefix = "configarmor.bus", name = "type", havingValue = "redis")
    public static class RedisBusConfiguration {

        @Bean(destroyMethod = "shutdown")
        @ConditionalOnMissingBean
        public ChangeNotificationBus redisChangeNotificationBus(
                RedisTemplate<String, Object> redisTemplate,
                RedisMessageListenerContainer listenerContainer,
                ConfigArmorProperties properties) {
            return new RedisChangeNotificationBus(redisTemplate, listenerContainer, properties.getBus().getChannel());
        }
    }
}
