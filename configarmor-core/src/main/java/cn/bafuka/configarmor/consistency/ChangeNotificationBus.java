package cn.bafuka.configarmor.consistency;

/**
 * 变更通知总线
 * 在配置写入后通知其他缓存持有方失效对应条目
 */
public interface ChangeNotificationBus {

    /**
     * 发布变更事件
     *
     * @param event 变更事件
     */
    void publish(ChangeEvent event);

    /**
     * 订阅变更事件
     *
     * @param listener 监听器
     */
    void subscribe(ChangeListener listener);

    /**
     * 取消订阅
     *
     * @param listener 监听器
     */
    void unsubscribe(ChangeListener listener);

    /**
     * 关闭总线，移除所有监听器
     */
    void shutdown();
}
