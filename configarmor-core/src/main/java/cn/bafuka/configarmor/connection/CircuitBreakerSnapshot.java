package cn.bafuka.configarmor.connection;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 熔断器状态快照（用于诊断）
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CircuitBreakerSnapshot {

    private String name;

    private CircuitState state;

    private int consecutiveFailures;

    private int failureThreshold;

    /**
     * 距冷却结束的毫秒数，未熔断时为 0
     */
    private long remainingCoolDownMs;

    /**
     * 累计熔断次数
     */
    private long tripCount;
}
