package me.golemcore.groupdesk.domain.model;

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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Locale;

/**
 * Uniform outcome of a bridge call: a success flag plus optional error text.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class BridgeResult {

    private boolean success;
    private String error;

    public static BridgeResult ok() {
        return BridgeResult.builder().success(true).build();
    }

    public static BridgeResult failed(String error) {
        return BridgeResult.builder().success(false).error(error).build();
    }

    /**
     * Whether the failure looks like a timeout and is worth retrying.
     */
    @JsonIgnore
    public boolean isTransient() {
        if (success || error == null) {
            return false;
        }
        String lower = error.toLowerCase(Locale.ROOT);
        return lower.contains("timed out") || lower.contains("timeout");
    }

    @JsonIgnore
    public String getErrorOrDefault() {
        return error != null ? error : "Unknown error";
    }
}
