package cn.bafuka.configarmor.consistency.impl;

import cn.bafuka.configarmor.consistency.ChangeEvent;
import cn.bafuka.configarmor.consistency.ChangeListener;
import cn.bafuka.configarmor.consistency.ChangeNotificationBus;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 进程内变更通知总线
 * 在发布线程中同步分发，单个监听器失败不影响其他监听器和发布方
 */
@Slf4j
public class LocalChangeNotificationBus implements ChangeNotificationBus {

    private final List<ChangeListener> listeners = new CopyOnWriteArrayList<>();

    private volatile boolean shutdown;

    @Override
    public void publish(ChangeEvent event) {
        if (event == null || event.getResource() == null) {
            return;
        }
        if (shutdown) {
            log.warn("变更总线已关闭，丢弃事件: resource={}, key={}", event.getResource(), event.getKey());
            return;
        }

        log.debug("分发变更事件: resource={}, key={}, listeners={}",
                event.getResource(), event.getKey(), listeners.size());

        for (ChangeListener listener : listeners) {
            try {
                listener.onChange(event);
            } catch (Exception e) {
                log.error("变更监听器处理失败: resource={}, key={}", event.getResource(), event.getKey(), e);
            }
        }
    }

    @Override
    public void subscribe(ChangeListener listener) {
        if (listener == null) {
            log.warn("ChangeListener 为空，跳过订阅");
            return;
        }
        listeners.add(listener);
    }

    @Override
    public void unsubscribe(ChangeListener listener) {
        listeners.remove(listener);
    }

    @Override
    public void shutdown() {
        shutdown = true;
        listeners.clear();
        log.info("本地变更总线已关闭");
    }

    public int listenerCount() {
        return listeners.size();
    }
}
