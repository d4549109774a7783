package me.golemcore.groupdesk.infrastructure.http;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import feign.Feign;
import feign.Request;
import feign.Retryer;
import feign.jackson.JacksonDecoder;
import feign.jackson.JacksonEncoder;
import feign.okhttp.OkHttpClient;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Factory for creating Feign HTTP clients with OkHttp transport and Jackson
 * JSON encoding.
 *
 * <p>
 * Clients created by {@link #createWithoutRetry(Class, String, Duration, Duration)}
 * never retry on their own: retry decisions for remote sends belong to the
 * domain retry policy, which knows which failures are transient.
 *
 * <p>
 * Usage:
 *
 * <pre>{@code
 * BridgeApi client = factory.createWithoutRetry(BridgeApi.class, "http://bridge:3001",
 *         Duration.ofSeconds(10), Duration.ofSeconds(120));
 * }</pre>
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
public class FeignClientFactory {

    private final okhttp3.OkHttpClient okHttpClient;
    private final ObjectMapper objectMapper;

    /**
     * Create a Feign client with explicit timeouts and Feign's own retryer
     * disabled.
     */
    public <T> T createWithoutRetry(Class<T> apiType, String baseUrl, Duration connectTimeout,
            Duration readTimeout) {
        Feign.Builder builder = Feign.builder()
                .retryer(Retryer.NEVER_RETRY)
                .options(new Request.Options(
                        connectTimeout.toMillis(), TimeUnit.MILLISECONDS,
                        readTimeout.toMillis(), TimeUnit.MILLISECONDS,
                        true));
        return create(apiType, baseUrl, builder);
    }

    private <T> T create(Class<T> apiType, String baseUrl, Feign.Builder builder) {
        return builder
                .client(new OkHttpClient(okHttpClient))
                .encoder(new JacksonEncoder(objectMapper))
                .decoder(new JacksonDecoder(objectMapper))
                .target(apiType, baseUrl);
    }
}
