package cn.bafuka.configarmor.consistency;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * 配置变更事件
 * 以 资源名 + 实体主键 标识被修改的配置
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChangeEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    /**
     * 资源名称（如 profile-config）
     */
    private String resource;

    /**
     * 实体主键
     */
    private Object key;

    /**
     * 发布方标识，订阅方据此忽略自己发出的事件
     */
    private String sourceId;

    /**
     * 发布时间戳（毫秒）
     */
    private long timestamp;

    /**
     * 创建一条变更事件
     */
    public static ChangeEvent of(String resource, Object key, String sourceId) {
        return new ChangeEvent(resource, key, sourceId, System.currentTimeMillis());
    }
}
