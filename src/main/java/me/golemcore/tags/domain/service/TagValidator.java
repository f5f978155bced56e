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

import me.golemcore.tags.domain.model.TagValidationException;
import me.golemcore.tags.infrastructure.config.TagsProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Checks tag names and content before they reach the store.
 */
@Component
@RequiredArgsConstructor
public class TagValidator {

    private final TagsProperties properties;

    /**
     * Validate an already normalized tag name.
     *
     * @throws TagValidationException
     *             if the name is empty, too long or contains a blocked substring
     */
    public void validateName(String name) {
        if (name == null || name.isBlank()) {
            throw new TagValidationException(TagValidationException.NAME_EMPTY, "Tag name is empty");
        }

        String lowered = name.toLowerCase(Locale.ROOT);
        for (String blocked : properties.getValidation().getBlockedSubstrings()) {
            if (blocked != null && !blocked.isEmpty() && lowered.contains(blocked.toLowerCase(Locale.ROOT))) {
                throw new TagValidationException(TagValidationException.NAME_BLOCKED,
                        "Tag name contains blocked word: " + blocked);
            }
        }

        int maxLength = properties.getValidation().getMaxNameLength();
        if (name.codePointCount(0, name.length()) > maxLength) {
            throw new TagValidationException(TagValidationException.NAME_TOO_LONG,
                    "Tag name exceeds " + maxLength + " characters", String.valueOf(maxLength));
        }
    }

    /**
     * @throws TagValidationException
     *             if the content is null or blank
     */
    public void validateContent(String content) {
        if (content == null || content.isBlank()) {
            throw new TagValidationException(TagValidationException.CONTENT_EMPTY, "Tag content is empty");
        }
    }
}
