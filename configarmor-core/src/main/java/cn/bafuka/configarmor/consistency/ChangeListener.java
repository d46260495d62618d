package cn.bafuka.configarmor.consistency;

/**
 * 配置变更监听器
 */
@FunctionalInterface
public interface ChangeListener {

    /**
     * 处理变更事件
     *
     * @param event 变更事件
     */
    void onChange(ChangeEvent event);
}
