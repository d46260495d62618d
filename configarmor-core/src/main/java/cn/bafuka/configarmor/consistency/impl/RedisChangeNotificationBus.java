package cn.bafuka.configarmor.consistency.impl;

import cn.bafuka.configarmor.consistency.ChangeEvent;
import cn.bafuka.configarmor.consistency.ChangeListener;
import cn.bafuka.configarmor.consistency.ChangeNotificationBus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.data.redis.serializer.RedisSerializer;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 变更通知总线实现
 * 基于 Redis Pub/Sub，把失效通知转发给其他进程
 */
@Slf4j
public class RedisChangeNotificationBus implements ChangeNotificationBus {

    /**
     * Redis 模板
     */
    private final RedisTemplate<String, Object> redisTemplate;

    /**
     * Redis 消息监听容器
     */
    private final RedisMessageListenerContainer listenerContainer;

    /**
     * 广播频道
     */
    private final String channel;

    private final List<ChangeListener> listeners = new CopyOnWriteArrayList<>();

    /**
     * 频道监听器，首次订阅时注册
     */
    private InternalMessageListener internalListener;

    public RedisChangeNotificationBus(RedisTemplate<String, Object> redisTemplate,
                                      RedisMessageListenerContainer listenerContainer,
                                      String channel) {
        this.redisTemplate = redisTemplate;
        this.listenerContainer = listenerContainer;
        this.channel = channel;
    }

    @Override
    public void publish(ChangeEvent event) {
        if (event == null || event.getResource() == null) {
            return;
        }

        try {
            redisTemplate.convertAndSend(channel, event);
            log.info("已发送配置变更广播: resource={}, key={}, channel={}",
                    event.getResource(), event.getKey(), channel);
        } catch (Exception e) {
            log.error("发送配置变更广播失败: resource={}, key={}", event.getResource(), event.getKey(), e);
        }
    }

    @Override
    public synchronized void subscribe(ChangeListener listener) {
        if (listener == null) {
            log.warn("ChangeListener 为空，跳过订阅");
            return;
        }

        listeners.add(listener);
        if (internalListener == null) {
            internalListener = new InternalMessageListener(listeners, redisTemplate.getValueSerializer());
            listenerContainer.addMessageListener(internalListener, new ChannelTopic(channel));
            log.info("已订阅配置变更广播频道: {}", channel);
        }
    }

    @Override
    public synchronized void unsubscribe(ChangeListener listener) {
        listeners.remove(listener);
        if (listeners.isEmpty()) {
            removeInternalListener();
        }
    }

    @Override
    public synchronized void shutdown() {
        listeners.clear();
        removeInternalListener();
    }

    private void removeInternalListener() {
        if (internalListener != null) {
            listenerContainer.removeMessageListener(internalListener);
            internalListener = null;
            log.info("已取消订阅配置变更广播频道: {}", channel);
        }
    }

    /**
     * 内部消息监听器
     */
    private static class InternalMessageListener implements MessageListener {

        private final List<ChangeListener> listeners;
        private final RedisSerializer<?> valueSerializer;

        InternalMessageListener(List<ChangeListener> listeners, RedisSerializer<?> valueSerializer) {
            this.listeners = listeners;
            this.valueSerializer = valueSerializer;
        }

        @Override
        public void onMessage(Message message, byte[] pattern) {
            Object obj;
            try {
                obj = valueSerializer.deserialize(message.getBody());
            } catch (Exception e) {
                log.error("反序列化配置变更广播失败", e);
                return;
            }

            if (!(obj instanceof ChangeEvent)) {
                log.warn("接收到非法的广播消息类型: {}", obj);
                return;
            }

            ChangeEvent event = (ChangeEvent) obj;
            log.debug("接收到配置变更广播: resource={}, key={}", event.getResource(), event.getKey());
            for (ChangeListener listener : listeners) {
                try {
                    listener.onChange(event);
                } catch (Exception e) {
                    log.error("变更监听器处理失败: resource={}, key={}", event.getResource(), event.getKey(), e);
                }
            }
        }
    }
}
