package me.golemcore.tags.port.outbound;

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

import me.golemcore.tags.domain.model.Tag;

import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Port for durable storage of the whole tag namespace map as one document. The
 * map is keyed by namespace ({@code "generic"} or a guild id), then by tag name.
 */
public interface TagPersistencePort {

    /**
     * Load the namespace map.
     *
     * <p>
     * Completes with an empty map when the file does not exist. Completes
     * exceptionally with
     * {@link me.golemcore.tags.domain.model.TagStorageCorruptedException} when
     * the file exists but cannot be read or parsed.
     *
     * @param path
     *            document location
     */
    CompletableFuture<Map<String, Map<String, Tag>>> load(Path path);

    /**
     * Atomically replace the document with the complete namespace map.
     *
     * <p>
     * The map is written to a uniquely named temporary file next to the target,
     * flushed to disk and renamed over the target, so readers never see a
     * partial document and a failed write leaves the previous one intact.
     *
     * @param path
     *            document location
     * @param namespaces
     *            namespace map to write; must not be modified until the future
     *            completes
     */
    CompletableFuture<Void> save(Path path, Map<String, Map<String, Tag>> namespaces);
}
