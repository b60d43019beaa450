package me.golemcore.scraper.port.outbound;

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
import java.util.concurrent.CompletableFuture;

/**
 * Port for file persistence under the scraper workspace. Paths are relative to
 * a named directory (e.g. "scraping_plans").
 */
public interface StoragePort {

    /**
     * Read text content from a file; completes with null when it does not exist.
     */
    CompletableFuture<String> getText(String directory, String path);

    /**
     * Check if file exists.
     */
    CompletableFuture<Boolean> exists(String directory, String path);

    /**
     * Delete a file if present.
     */
    CompletableFuture<Void> deleteObject(String directory, String path);

    /**
     * List files under the prefix, relative to the directory.
     */
    CompletableFuture<List<String>> listObjects(String directory, String prefix);

    /**
     * Atomically write text content to file.
     *
     * <p>
     * The content goes to a {@code .tmp} sibling first, is fsynced, optionally
     * backs up the previous version as {@code .bak}, and is then renamed over the
     * target, so readers see either the old or the new file.
     */
    CompletableFuture<Void> putTextAtomic(String directory, String path, String content, boolean backup);

    /**
     * Ensure directory exists.
     */
    CompletableFuture<Void> ensureDirectory(String directory);
}
