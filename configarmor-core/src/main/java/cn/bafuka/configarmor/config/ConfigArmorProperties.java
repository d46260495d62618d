package cn.bafuka.configarmor.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * ConfigArmor 配置属性
 * 从 application.yml 读取配置
 */
@Data
@ConfigurationProperties(prefix = "configarmor")
public class ConfigArmorProperties {

    /**
     * 是否启用 ConfigArmor
     */
    private boolean enabled = true;

    private Cache cache = new Cache();

    private Connection connection = new Connection();

    private Retry retry = new Retry();

    private CircuitBreaker circuitBreaker = new CircuitBreaker();

    private Bus bus = new Bus();

    private Executor executor = new Executor();

    @Data
    public static class Cache {

        /**
         * 条目新鲜期
         */
        private Duration ttl = Duration.ofMinutes(5);

        private long maximumSize = 10000;

        /**
         * 过期条目作为降级值保留的时长
         */
        private Duration staleRetention = Duration.ofHours(24);
    }

    @Data
    public static class Connection {

        /**
         * 保存连接串的环境变量名
         */
        private String connectionStringEnv = "DB_CONNECTION_STRING";

        private int validationTimeoutSeconds = 2;
    }

    @Data
    public static class Retry {

        /**
         * 最大尝试次数（含首次）
         */
        private int maxAttempts = 3;

        private Duration initialDelay = Duration.ofSeconds(1);

        private double backoffFactor = 2.0;

        private Duration maxJitter = Duration.ofMillis(500);
    }

    @Data
    public static class CircuitBreaker {

        private int failureThreshold = 5;

        private Duration coolDown = Duration.ofMinutes(2);
    }

    @Data
    public static class Bus {

        /**
         * local 或 redis
         */
        private String type = "local";

        /**
         * Redis 广播频道
         */
        private String channel = "configarmor:changed";
    }

    @Data
    public static class Executor {

        /**
         * 异步回源与写入的线程数
         */
        private int threads = 4;
    }
}
