package me.golemcore.groupdesk.adapter.inbound.redis;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.groupdesk.domain.model.BridgeEvent;
import me.golemcore.groupdesk.infrastructure.config.GroupDeskProperties;
import me.golemcore.groupdesk.port.inbound.BridgeEventPort;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Subscribes to the bridge's Redis pub/sub channel and feeds decoded events
 * into the {@link BridgeEventPort}.
 *
 * <p>
 * Pub/sub delivery has no acknowledgment: an undecodable message is logged and
 * dropped. Channel name comes from {@code groupdesk.events.channel}.
 */
@Component
@ConditionalOnProperty(prefix = "groupdesk.events", name = "enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class RedisBridgeEventListener implements MessageListener {

    private final RedisMessageListenerContainer listenerContainer;
    private final BridgeEventPort bridgeEventPort;
    private final ObjectMapper objectMapper;
    private final GroupDeskProperties properties;

    private ChannelTopic topic;

    @PostConstruct
    public void subscribe() {
        topic = new ChannelTopic(properties.getEvents().getChannel());
        listenerContainer.addMessageListener(this, topic);
        log.info("[Events] Subscribed to Redis channel {}", topic.getTopic());
    }

    @PreDestroy
    public void unsubscribe() {
        if (topic != null) {
            listenerContainer.removeMessageListener(this, topic);
            log.info("[Events] Unsubscribed from Redis channel {}", topic.getTopic());
        }
    }

    @Override
    public void onMessage(Message message, byte[] pattern) {
        BridgeEvent event;
        try {
            event = objectMapper.readValue(message.getBody(), BridgeEvent.class);
        } catch (IOException e) {
            log.warn("[Events] Dropping undecodable message: {}",
                    new String(message.getBody(), StandardCharsets.UTF_8));
            return;
        }
        log.debug("[Events] Received {} for tenant {}", event.getType(), event.getTenantId());
        bridgeEventPort.handle(event);
    }
}
