package me.golemcore.groupdesk.infrastructure.redis;

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

import me.golemcore.groupdesk.infrastructure.config.GroupDeskProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Redis pub/sub wiring for bridge event ingestion.
 *
 * <p>
 * The listener container dispatches messages on a dedicated pool so that a
 * slow welcome send or agent call never blocks the Redis connection thread.
 * Events for different groups may therefore be processed concurrently.
 *
 * @since 1.0
 */
@Configuration
@ConditionalOnProperty(prefix = "groupdesk.events", name = "enabled", havingValue = "true", matchIfMissing = true)
public class RedisListenerConfig {

    @Bean
    public RedisMessageListenerContainer redisMessageListenerContainer(RedisConnectionFactory connectionFactory,
            Executor bridgeEventExecutor) {
        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(connectionFactory);
        container.setTaskExecutor(bridgeEventExecutor);
        return container;
    }

    @Bean
    public Executor bridgeEventExecutor(GroupDeskProperties properties) {
        int threads = Math.max(1, properties.getEvents().getListenerThreads());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads * 2);
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("bridge-events-");
        executor.initialize();
        return executor;
    }
}
