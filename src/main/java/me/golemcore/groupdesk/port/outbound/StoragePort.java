package me.golemcore.groupdesk.port.outbound;

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

import java.util.List;

/**
 * Port for persistent storage operations within the local workspace.
 *
 * <p>
 * Operations are synchronous: the JSON stores perform read-modify-write
 * sequences under their own locks and need the write to be on disk before the
 * lock is released. I/O failures surface as
 * {@link me.golemcore.groupdesk.adapter.outbound.storage.StorageException}.
 */
public interface StoragePort {

    /**
     * Read text content from file.
     *
     * @return file content, or {@code null} if the file does not exist
     */
    String getText(String directory, String path);

    /**
     * Atomically write text content to file.
     *
     * <p>
     * Content goes to a {@code .tmp} sibling first, is fsynced, then renamed
     * over the target, so readers never observe a half-written document.
     *
     * @param directory
     *            subdirectory (e.g., "tasks", "groups")
     * @param path
     *            relative path within directory
     * @param content
     *            text content to write
     */
    void putTextAtomic(String directory, String path, String content);

    /**
     * Check if file exists.
     */
    boolean exists(String directory, String path);

    /**
     * List regular files under {@code directory/prefix}, relative to
     * {@code directory}.
     */
    List<String> listObjects(String directory, String prefix);

}
