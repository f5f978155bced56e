package me.golemcore.tags.domain.service;

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

import me.golemcore.tags.domain.model.DuplicateTagException;
import me.golemcore.tags.domain.model.Tag;
import me.golemcore.tags.domain.model.TagNotFoundException;
import me.golemcore.tags.domain.model.TagPermissionException;
import me.golemcore.tags.domain.model.TagPersistenceException;
import me.golemcore.tags.domain.model.TagStorageCorruptedException;
import me.golemcore.tags.infrastructure.config.TagsProperties;
import me.golemcore.tags.port.outbound.TagPersistencePort;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;

/**
 * In-memory tag store backed by a single persisted document.
 *
 * <p>
 * Tags are kept per namespace: {@value #GENERIC_NAMESPACE} for tags visible
 * everywhere and the stringified guild id for guild tags. Inside a guild the
 * visible tags are the generic ones merged with the guild's own, the guild tag
 * winning on a name clash.
 *
 * <p>
 * Every operation runs under one lock, covering the whole
 * read-validate-mutate-save sequence. Each successful mutation rewrites the
 * complete document through {@link TagPersistencePort}. Failed validation,
 * ownership or lookup checks change nothing and do not save. A failed save
 * leaves the mutation applied in memory and is reported as
 * {@link TagPersistenceException}.
 *
 * <p>
 * Tag names passed in are normalized (trimmed, lowercased). Returned tags are
 * copies.
 */
@Service
@Slf4j
public class TagService {

    public static final String GENERIC_NAMESPACE = "generic";

    private final TagPersistencePort persistencePort;
    private final TagValidator validator;
    private final Clock clock;
    private final Path storagePath;

    private final Object lock = new Object();
    private final Map<String, Map<String, Tag>> namespaces = new HashMap<>();

    private boolean loaded = false;

    public TagService(TagPersistencePort persistencePort, TagValidator validator, TagsProperties properties,
            Clock clock) {
        this.persistencePort = persistencePort;
        this.validator = validator;
        this.clock = clock;
        this.storagePath = Paths.get(properties.getStorage().getPath()).toAbsolutePath().normalize();
    }

    /**
     * Load the persisted tags.
     *
     * @throws TagStorageCorruptedException
     *             if the document exists but cannot be read
     */
    @PostConstruct
    public void init() {
        synchronized (lock) {
            ensureLoadedLocked();
        }
    }

    /**
     * Namespace key for a guild context: the guild id, or
     * {@value #GENERIC_NAMESPACE} outside of guilds.
     */
    public static String namespaceOf(Long guildId) {
        return guildId == null ? GENERIC_NAMESPACE : guildId.toString();
    }

    /**
     * All tags visible in the given context, keyed by name.
     *
     * @param guildId
     *            guild context, or null for generic tags only
     */
    public Map<String, Tag> resolveVisibleTags(Long guildId) {
        synchronized (lock) {
            ensureLoadedLocked();
            Map<String, Tag> visible = new HashMap<>();
            resolveLocked(guildId).forEach((name, tag) -> visible.put(name, copyOf(tag)));
            return visible;
        }
    }

    /**
     * @throws TagNotFoundException
     *             if no visible tag has this name
     */
    public Tag getTag(Long guildId, String name) {
        String key = Tag.normalizeName(name);
        synchronized (lock) {
            ensureLoadedLocked();
            return copyOf(findLocked(guildId, key).tag());
        }
    }

    /**
     * Create a tag in the guild's namespace, or the generic namespace outside of
     * guilds.
     *
     * @throws me.golemcore.tags.domain.model.TagValidationException
     *             if the name or content is rejected
     * @throws DuplicateTagException
     *             if the target namespace already has a tag with this name
     * @throws TagPersistenceException
     *             if the tag was created but could not be saved
     */
    public Tag createTag(Long guildId, String name, String content, long ownerId) {
        String key = Tag.normalizeName(name);
        synchronized (lock) {
            ensureLoadedLocked();
            validator.validateName(key);
            validator.validateContent(content);

            String namespace = namespaceOf(guildId);
            Map<String, Tag> bucket = namespaces.get(namespace);
            if (bucket != null && bucket.containsKey(key)) {
                throw new DuplicateTagException(namespace, key);
            }

            Tag tag = Tag.builder()
                    .name(key)
                    .content(content)
                    .ownerId(ownerId)
                    .uses(0)
                    .location(guildId == null ? null : namespace)
                    .createdAt(clock.instant())
                    .build();
            namespaces.computeIfAbsent(namespace, ns -> new HashMap<>()).put(key, tag);
            log.info("[Tags] Created tag '{}' in {} for owner {}", key, namespace, ownerId);

            persistLocked(key);
            return copyOf(tag);
        }
    }

    /**
     * Replace the content of a tag owned by the requester.
     *
     * @throws TagNotFoundException
     *             if no visible tag has this name
     * @throws TagPermissionException
     *             if the requester does not own the tag
     * @throws me.golemcore.tags.domain.model.TagValidationException
     *             if the new content is empty
     * @throws TagPersistenceException
     *             if the edit could not be saved
     */
    public Tag editTag(Long guildId, String name, String newContent, long requesterId) {
        String key = Tag.normalizeName(name);
        synchronized (lock) {
            ensureLoadedLocked();
            Located located = findLocked(guildId, key);
            checkOwner(located.tag(), requesterId);
            validator.validateContent(newContent);

            located.tag().setContent(newContent);
            log.info("[Tags] Edited tag '{}' in {}", key, located.namespace());

            persistLocked(key);
            return copyOf(located.tag());
        }
    }

    /**
     * Delete a tag owned by the requester.
     *
     * @throws TagNotFoundException
     *             if no visible tag has this name
     * @throws TagPermissionException
     *             if the requester does not own the tag
     * @throws TagPersistenceException
     *             if the deletion could not be saved
     */
    public void deleteTag(Long guildId, String name, long requesterId) {
        String key = Tag.normalizeName(name);
        synchronized (lock) {
            ensureLoadedLocked();
            Located located = findLocked(guildId, key);
            checkOwner(located.tag(), requesterId);

            Map<String, Tag> bucket = namespaces.get(located.namespace());
            bucket.remove(key);
            if (bucket.isEmpty()) {
                namespaces.remove(located.namespace());
            }
            log.info("[Tags] Deleted tag '{}' from {}", key, located.namespace());

            persistLocked(key);
        }
    }

    /**
     * Count one invocation of a tag and return it with the updated counter.
     *
     * @throws TagNotFoundException
     *             if no visible tag has this name
     * @throws TagPersistenceException
     *             if the new counter could not be saved
     */
    public Tag incrementUse(Long guildId, String name) {
        String key = Tag.normalizeName(name);
        synchronized (lock) {
            ensureLoadedLocked();
            Located located = findLocked(guildId, key);
            Tag tag = located.tag();
            tag.setUses(tag.getUses() + 1);
            log.debug("[Tags] Tag '{}' in {} used {} times", key, located.namespace(), tag.getUses());

            persistLocked(key);
            return copyOf(tag);
        }
    }

    /**
     * Names of all tags visible in the given context, sorted ascending.
     */
    public List<String> listTags(Long guildId) {
        synchronized (lock) {
            ensureLoadedLocked();
            return resolveLocked(guildId).keySet().stream()
                    .sorted()
                    .toList();
        }
    }

    /**
     * Deep copy of the namespace map.
     */
    public Map<String, Map<String, Tag>> snapshot() {
        synchronized (lock) {
            ensureLoadedLocked();
            Map<String, Map<String, Tag>> copy = new HashMap<>();
            namespaces.forEach((namespace, bucket) -> {
                Map<String, Tag> bucketCopy = new HashMap<>();
                bucket.forEach((name, tag) -> bucketCopy.put(name, copyOf(tag)));
                copy.put(namespace, bucketCopy);
            });
            return copy;
        }
    }

    /**
     * Total number of tags across all namespaces.
     */
    public int size() {
        synchronized (lock) {
            ensureLoadedLocked();
            return namespaces.values().stream().mapToInt(Map::size).sum();
        }
    }

    public Path getStoragePath() {
        return storagePath;
    }

    private Map<String, Tag> resolveLocked(Long guildId) {
        Map<String, Tag> visible = new HashMap<>(namespaces.getOrDefault(GENERIC_NAMESPACE, Map.of()));
        if (guildId != null) {
            visible.putAll(namespaces.getOrDefault(namespaceOf(guildId), Map.of()));
        }
        return visible;
    }

    private Located findLocked(Long guildId, String key) {
        if (guildId != null) {
            String namespace = namespaceOf(guildId);
            Tag tag = namespaces.getOrDefault(namespace, Map.of()).get(key);
            if (tag != null) {
                return new Located(namespace, tag);
            }
        }
        Tag generic = namespaces.getOrDefault(GENERIC_NAMESPACE, Map.of()).get(key);
        if (generic != null) {
            return new Located(GENERIC_NAMESPACE, generic);
        }
        log.debug("[Tags] Tag '{}' not found in {}", key, namespaceOf(guildId));
        throw new TagNotFoundException(key);
    }

    private void checkOwner(Tag tag, long requesterId) {
        if (tag.getOwnerId() != requesterId) {
            log.debug("[Tags] User {} denied access to tag '{}' owned by {}",
                    requesterId, tag.getName(), tag.getOwnerId());
            throw new TagPermissionException(tag.getName(), requesterId);
        }
    }

    private void ensureLoadedLocked() {
        if (loaded) {
            return;
        }

        Map<String, Map<String, Tag>> stored;
        try {
            stored = persistencePort.load(storagePath).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof TagStorageCorruptedException corrupted) {
                throw corrupted;
            }
            throw new TagStorageCorruptedException("Failed to load tags from " + storagePath, cause);
        }

        namespaces.clear();
        stored.forEach((namespace, bucket) -> namespaces.put(namespace, new HashMap<>(bucket)));
        loaded = true;
        log.info("[Tags] Loaded {} tags in {} namespaces from {}",
                namespaces.values().stream().mapToInt(Map::size).sum(), namespaces.size(), storagePath);
    }

    private void persistLocked(String changedTag) {
        try {
            persistencePort.save(storagePath, namespaces).join();
        } catch (RuntimeException e) {
            Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
            log.error("[Tags] Failed to save tags after changing '{}', change is not durable yet",
                    changedTag, cause);
            throw new TagPersistenceException(changedTag, cause);
        }
    }

    private static Tag copyOf(Tag tag) {
        return tag.toBuilder().build();
    }

    private record Located(String namespace, Tag tag) {
    }
}
