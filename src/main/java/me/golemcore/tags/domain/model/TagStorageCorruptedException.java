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
 * The persisted tag document exists but cannot be read or parsed. Raised during
 * startup and never recovered from: starting with an empty store would silently
 * discard the stored tags.
 */
public class TagStorageCorruptedException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public TagStorageCorruptedException(String message) {
        super(message);
    }

    public TagStorageCorruptedException(String message, Throwable cause) {
        super(message, cause);
    }
}
