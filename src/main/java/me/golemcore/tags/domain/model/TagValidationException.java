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

package me.golemcore.tags.domain.model;

/**
 * Thrown when a tag name or content is rejected. No state is changed.
 */
public class TagValidationException extends TagException {

    private static final long serialVersionUID = 1L;

    public static final String NAME_EMPTY = "tag.error.name-empty";
    public static final String NAME_TOO_LONG = "tag.error.name-too-long";
    public static final String NAME_BLOCKED = "tag.error.name-blocked";
    public static final String CONTENT_EMPTY = "tag.error.content-empty";

    public TagValidationException(String messageKey, String message, Object... messageArgs) {
        super(ErrorKind.VALIDATION, messageKey, message, messageArgs);
    }
}
