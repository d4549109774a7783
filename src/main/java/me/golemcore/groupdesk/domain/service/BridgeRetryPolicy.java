package me.golemcore.groupdesk.domain.service;

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

import me.golemcore.groupdesk.domain.model.BridgeResult;
import me.golemcore.groupdesk.infrastructure.config.GroupDeskProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.function.Supplier;

/**
 * Bounded retry for bridge sends.
 *
 * <p>
 * Only transient failures (timeouts) are retried, with the delays from
 * {@code groupdesk.dispatcher.retry-delays} and at most
 * {@code groupdesk.dispatcher.max-attempts} attempts in total. Any other
 * failure is returned immediately. The policy knows nothing about the call it
 * wraps.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BridgeRetryPolicy {

    private final GroupDeskProperties properties;
    private final Sleeper sleeper;

    public BridgeResult execute(String operation, Supplier<BridgeResult> action) throws InterruptedException {
        int maxAttempts = Math.max(1, properties.getDispatcher().getMaxAttempts());
        BridgeResult result = invoke(action);
        for (int attempt = 1; attempt < maxAttempts; attempt++) {
            if (result.isSuccess() || !result.isTransient()) {
                return result;
            }
            Duration delay = delayAfter(attempt);
            log.warn("[Task] {} attempt {}/{} failed ({}), retrying in {}s",
                    operation, attempt, maxAttempts, result.getError(), delay.toSeconds());
            sleeper.sleep(delay);
            result = invoke(action);
        }
        if (!result.isSuccess() && result.isTransient()) {
            log.warn("[Task] {} failed after {} attempts: {}", operation, maxAttempts, result.getError());
        }
        return result;
    }

    private Duration delayAfter(int attempt) {
        List<Duration> delays = properties.getDispatcher().getRetryDelays();
        if (delays == null || delays.isEmpty()) {
            return Duration.ZERO;
        }
        return delays.get(Math.min(attempt - 1, delays.size() - 1));
    }

    private static BridgeResult invoke(Supplier<BridgeResult> action) {
        BridgeResult result = action.get();
        return result != null ? result : BridgeResult.failed("No response from bridge");
    }
}
