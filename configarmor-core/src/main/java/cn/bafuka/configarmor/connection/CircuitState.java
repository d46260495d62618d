package cn.bafuka.configarmor.connection;

/**
 * 熔断器状态
 */
public enum CircuitState {

    /**
     * 关闭：正常放行，失败累计
     */
    CLOSED,

    /**
     * 打开：冷却期内一律快速失败
     */
    OPEN,

    /**
     * 半开：冷却结束，仅放行一次探测
     */
    HALF_OPEN
}
