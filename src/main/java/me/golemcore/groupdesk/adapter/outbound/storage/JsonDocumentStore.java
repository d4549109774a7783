package me.golemcore.groupdesk.adapter.outbound.storage;

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

import me.golemcore.groupdesk.port.outbound.StoragePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Base class for stores that keep one JSON document per entity under a
 * workspace directory.
 *
 * <p>
 * Read-modify-write sequences run under a striped {@link ReentrantLock} via
 * {@link #withLock(String, Supplier)}; this serializes updates to one key
 * within one process. Keys map onto a fixed set of stripes, so unrelated keys
 * may occasionally share a lock and callers must not nest {@code withLock}. Documents are always written atomically through
 * {@link StoragePort#putTextAtomic(String, String, String)}.
 *
 * @param <T>
 *            document type
 */
@Slf4j
public abstract class JsonDocumentStore<T> {

    private static final String JSON_SUFFIX = ".json";
    private static final int LOCK_STRIPES = 64;

    protected final StoragePort storagePort;
    protected final ObjectMapper objectMapper;
    private final Class<T> documentType;
    private final String directory;
    private final ReentrantLock[] locks = new ReentrantLock[LOCK_STRIPES];

    protected JsonDocumentStore(StoragePort storagePort, ObjectMapper objectMapper, Class<T> documentType,
            String directory) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.documentType = documentType;
        this.directory = directory;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            locks[i] = new ReentrantLock();
        }
    }

    protected Optional<T> read(String path) {
        String json = storagePort.getText(directory, path);
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, documentType));
        } catch (JsonProcessingException e) {
            throw new StorageException("Corrupted document: " + directory + "/" + path, e);
        }
    }

    protected void write(String path, T document) {
        try {
            storagePort.putTextAtomic(directory, path, objectMapper.writeValueAsString(document));
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to serialize document: " + directory + "/" + path, e);
        }
    }

    protected boolean exists(String path) {
        return storagePort.exists(directory, path);
    }

    /**
     * Read every document under {@code prefix}. Unreadable documents are
     * skipped so one bad file cannot stall a whole scan.
     */
    protected List<T> readAll(String prefix) {
        List<T> documents = new ArrayList<>();
        for (String path : storagePort.listObjects(directory, prefix)) {
            if (!path.endsWith(JSON_SUFFIX)) {
                continue;
            }
            try {
                read(path).ifPresent(documents::add);
            } catch (StorageException e) {
                log.warn("[Storage] Skipping unreadable document {}/{}: {}", directory, path, e.getMessage());
            }
        }
        return documents;
    }

    protected <R> R withLock(String key, Supplier<R> action) {
        ReentrantLock lock = lockFor(key);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    ReentrantLock lockFor(String key) {
        return locks[Math.floorMod(key.hashCode(), LOCK_STRIPES)];
    }

    /**
     * File-system safe form of an identifier.
     */
    protected static String encode(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Document key must not be blank");
        }
        return URLEncoder.encode(key, StandardCharsets.UTF_8);
    }

    protected static String fileName(String key) {
        return encode(key) + JSON_SUFFIX;
    }
}
