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

package me.golemcore.tags.adapter.outbound.storage;

import me.golemcore.tags.domain.model.Tag;
import me.golemcore.tags.domain.model.TagStorageCorruptedException;
import me.golemcore.tags.infrastructure.config.TagsProperties;
import me.golemcore.tags.port.outbound.TagPersistencePort;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * JSON file implementation of {@link TagPersistencePort}.
 *
 * <p>
 * The document root maps namespace keys to objects mapping tag names to tag
 * records:
 *
 * <pre>
 * {"generic": {"welcome": {"name": "welcome", "content": "Hi!", "owner_id": 1,
 *   "uses": 0, "location": null, "created_at": "2026-10-19T10:00:00Z"}}}
 * </pre>
 *
 * <p>
 * Saves go through a temp file named {@code <uuid>-<file>.tmp} in the target
 * directory, fsync and an atomic rename. With {@code tags.storage.backup}
 * enabled the previous document is kept as {@code <file>.bak}.
 *
 * @see me.golemcore.tags.port.outbound.TagPersistencePort
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JsonFileTagStorageAdapter implements TagPersistencePort {

    private static final TypeReference<Map<String, Map<String, Tag>>> NAMESPACES_TYPE_REF = new TypeReference<>() {
    };

    /** Location value written for generic tags by older versions of the bot. */
    private static final String LEGACY_GENERIC_LOCATION = "generic";

    private final ObjectMapper objectMapper;
    private final TagsProperties properties;
    private final Clock clock;

    @Override
    public CompletableFuture<Map<String, Map<String, Tag>>> load(Path path) {
        return CompletableFuture.supplyAsync(() -> {
            byte[] bytes;
            try {
                bytes = Files.readAllBytes(path);
            } catch (NoSuchFileException e) {
                log.info("[TagStorage] No tag file at {}, starting with an empty store", path);
                return new HashMap<>();
            } catch (IOException e) {
                throw new TagStorageCorruptedException("Failed to read tag file: " + path, e);
            }

            Map<String, Map<String, Tag>> stored;
            try {
                stored = objectMapper.readValue(bytes, NAMESPACES_TYPE_REF);
            } catch (IOException e) {
                throw new TagStorageCorruptedException("Failed to parse tag file: " + path, e);
            }
            if (stored == null) {
                throw new TagStorageCorruptedException("Tag file has no namespace map: " + path);
            }

            Map<String, Map<String, Tag>> namespaces = normalize(stored, path);
            log.debug("[TagStorage] Loaded tags from: {}", path);
            return namespaces;
        });
    }

    @Override
    public CompletableFuture<Void> save(Path path, Map<String, Map<String, Tag>> namespaces) {
        return CompletableFuture.runAsync(() -> {
            Path targetPath = path.toAbsolutePath().normalize();
            Path parent = targetPath.getParent();
            Path tempPath = targetPath.resolveSibling(UUID.randomUUID() + "-" + targetPath.getFileName() + ".tmp");
            Path backupPath = targetPath.resolveSibling(targetPath.getFileName() + ".bak");

            try {
                if (parent != null) {
                    Files.createDirectories(parent);
                }

                // 1. Write to a fresh temp file with fsync
                byte[] bytes = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(namespaces);
                try (FileChannel channel = FileChannel.open(tempPath,
                        StandardOpenOption.CREATE_NEW,
                        StandardOpenOption.WRITE)) {
                    ByteBuffer buffer = ByteBuffer.wrap(bytes);
                    while (buffer.hasRemaining()) {
                        channel.write(buffer);
                    }
                    channel.force(true);
                }

                // 2. Backup existing file if requested
                if (properties.getStorage().isBackup() && Files.exists(targetPath)) {
                    Files.copy(targetPath, backupPath, StandardCopyOption.REPLACE_EXISTING);
                    log.debug("[TagStorage] Created backup: {}", backupPath);
                }

                // 3. Atomic rename
                try {
                    Files.move(tempPath, targetPath,
                            StandardCopyOption.REPLACE_EXISTING,
                            StandardCopyOption.ATOMIC_MOVE);
                } catch (AtomicMoveNotSupportedException e) {
                    log.warn("[TagStorage] Atomic move not supported, using regular move");
                    Files.move(tempPath, targetPath, StandardCopyOption.REPLACE_EXISTING);
                }

                log.trace("[TagStorage] Saved tags to: {}", targetPath);
            } catch (IOException e) {
                try {
                    Files.deleteIfExists(tempPath);
                } catch (IOException cleanupEx) {
                    log.warn("[TagStorage] Failed to cleanup temp file: {}", tempPath);
                }
                throw new UncheckedIOException("Atomic write failed: " + targetPath, e);
            }
        });
    }

    private Map<String, Map<String, Tag>> normalize(Map<String, Map<String, Tag>> stored, Path path) {
        Instant now = clock.instant();
        Map<String, Map<String, Tag>> namespaces = new HashMap<>();

        stored.forEach((namespace, bucket) -> {
            Map<String, Tag> tags = new HashMap<>();
            if (bucket != null) {
                bucket.forEach((name, tag) -> {
                    if (tag == null) {
                        throw new TagStorageCorruptedException(
                                "Tag file has an empty record for " + namespace + "/" + name + ": " + path);
                    }
                    if (tag.getName() == null) {
                        tag.setName(name);
                    }
                    if (LEGACY_GENERIC_LOCATION.equals(tag.getLocation())) {
                        tag.setLocation(null);
                    }
                    if (tag.getCreatedAt() == null) {
                        tag.setCreatedAt(now);
                    }
                    tags.put(name, tag);
                });
            }
            namespaces.put(namespace, tags);
        });
        return namespaces;
    }
}
