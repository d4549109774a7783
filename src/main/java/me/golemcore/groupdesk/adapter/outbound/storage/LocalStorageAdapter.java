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

import me.golemcore.groupdesk.infrastructure.config.GroupDeskProperties;
import me.golemcore.groupdesk.port.outbound.StoragePort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Collections;
import java.util.List;
import java.util.stream.Stream;

/**
 * Local filesystem implementation of StoragePort.
 *
 * <p>
 * Stores all data in a local workspace directory with one subdirectory per
 * entity:
 * <ul>
 * <li>tasks/ - scheduled tasks
 * <li>groups/ - monitored groups and welcome state
 * <li>sessions/ - per-tenant bridge session state
 * <li>messages/ - inbound messages, per tenant
 * <li>member-events/ - join/leave/certificate records, per tenant and day
 * <li>agents/ - autoresponder profiles, per tenant
 * </ul>
 *
 * <p>
 * Base path configured via {@code groupdesk.storage.local.base-path},
 * defaults to {@code ${user.home}/.groupdesk/workspace}.
 *
 * @see me.golemcore.groupdesk.port.outbound.StoragePort
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalStorageAdapter implements StoragePort {

    static final List<String> DIRECTORIES = List.of(
            "tasks", "groups", "sessions", "messages", "member-events", "agents");

    private final GroupDeskProperties properties;

    private Path basePath;

    @PostConstruct
    public void init() {
        String basePathStr = properties.getStorage().getLocal().getBasePath();
        this.basePath = Paths.get(basePathStr.replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();

        try {
            Files.createDirectories(basePath);
            for (String dir : DIRECTORIES) {
                Files.createDirectories(basePath.resolve(dir));
            }
            log.info("[Storage] Local storage initialized at: {}", basePath);
        } catch (IOException e) {
            throw new StorageException("Failed to create storage directory: " + basePath, e);
        }
    }

    @Override
    public String getText(String directory, String path) {
        Path filePath = resolvePath(directory, path);
        try {
            if (!Files.exists(filePath)) {
                return null;
            }
            return Files.readString(filePath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StorageException("Failed to read file: " + directory + "/" + path, e);
        }
    }

    @Override
    public boolean exists(String directory, String path) {
        return Files.exists(resolvePath(directory, path));
    }

    @Override
    public List<String> listObjects(String directory, String prefix) {
        Path dirPath = resolvePath(directory, "");
        Path prefixPath = prefix != null && !prefix.isEmpty()
                ? resolvePath(directory, prefix)
                : dirPath;
        if (!Files.isDirectory(prefixPath)) {
            return Collections.emptyList();
        }

        try (Stream<Path> paths = Files.walk(prefixPath)) {
            return paths
                    .filter(Files::isRegularFile)
                    .map(p -> dirPath.relativize(p).toString().replace('\\', '/'))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new StorageException("Failed to list files: " + directory + "/" + prefix, e);
        }
    }

    @Override
    public void putTextAtomic(String directory, String path, String content) {
        Path targetPath = resolvePath(directory, path);
        Path tempPath = targetPath.resolveSibling(targetPath.getFileName() + ".tmp");

        try {
            Path parent = targetPath.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }

            byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
            try (OutputStream os = Files.newOutputStream(tempPath,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING);
                    FileChannel channel = FileChannel.open(tempPath, StandardOpenOption.WRITE)) {
                os.write(bytes);
                os.flush();
                channel.force(true);
            }

            try {
                Files.move(tempPath, targetPath,
                        StandardCopyOption.REPLACE_EXISTING,
                        StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("[Storage] Atomic move not supported, using regular move");
                Files.move(tempPath, targetPath, StandardCopyOption.REPLACE_EXISTING);
            }
            log.trace("[Storage] Atomic write completed: {}/{}", directory, path);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tempPath);
            } catch (IOException cleanupEx) {
                log.warn("[Storage] Failed to cleanup temp file: {}", tempPath);
            }
            throw new StorageException("Atomic write failed: " + directory + "/" + path, e);
        }
    }

    private Path resolvePath(String directory, String path) {
        Path resolved = basePath.resolve(directory).resolve(path).normalize();
        if (!resolved.startsWith(basePath)) {
            throw new IllegalArgumentException("Path traversal blocked: " + directory + "/" + path);
        }
        return resolved;
    }
}
