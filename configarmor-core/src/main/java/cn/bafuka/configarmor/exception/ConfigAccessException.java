package cn.bafuka.configarmor.exception;

/**
 * ConfigArmor 访问异常基类
 * 连接、仓储、写入等各环节的失败都以其子类抛出
 *
 * @author ConfigArmor Team
 * @since 1.0
 */
public class ConfigAccessException extends RuntimeException {

    /**
     * 出错的键（可能为空）
     */
    private final Object key;

    /**
     * 失败原因
     */
    private final FailureReason reason;

    public ConfigAccessException(String message, Object key, FailureReason reason) {
        super(message);
        this.key = key;
        this.reason = reason;
    }

    public ConfigAccessException(String message, Throwable cause, Object key, FailureReason reason) {
        super(message, cause);
        this.key = key;
        this.reason = reason;
    }

    public Object getKey() {
        return key;
    }

    public FailureReason getReason() {
        return reason;
    }

    /**
     * 是否值得重试
     */
    public boolean isRetryable() {
        return reason == FailureReason.TRANSIENT_CONNECTIVITY;
    }

    /**
     * 失败原因枚举
     */
    public enum FailureReason {
        /**
         * 连接参数缺失或非法
         */
        CONFIGURATION("连接参数错误"),

        /**
         * 网络或超时等瞬时故障
         */
        TRANSIENT_CONNECTIVITY("瞬时连接故障"),

        /**
         * 重试次数耗尽
         */
        RETRIES_EXHAUSTED("重试耗尽"),

        /**
         * 熔断器已打开
         */
        CIRCUIT_OPEN("熔断中"),

        /**
         * 更新目标不存在
         */
        WRITE_CONFLICT("写入冲突"),

        /**
         * 数据库错误
         */
        DATABASE_ERROR("数据库错误");

        private final String description;

        FailureReason(String description) {
            this.description = description;
        }

        public String getDescription() {
            return description;
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
                "key=" + key +
                ", reason=" + reason +
                ", message=" + getMessage() +
                '}';
    }
}
