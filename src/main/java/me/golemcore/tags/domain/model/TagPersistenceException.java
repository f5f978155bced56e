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
 * Thrown when a mutation was applied in memory but could not be written to
 * disk. The change stays applied and becomes durable with the next successful
 * save; callers must not report success to the user.
 */
public class TagPersistenceException extends TagException {

    private static final long serialVersionUID = 1L;

    public TagPersistenceException(String name, Throwable cause) {
        super(ErrorKind.PERSISTENCE, "tag.error.persistence",
                "Failed to persist tags after changing: " + name, cause, name);
    }
}
