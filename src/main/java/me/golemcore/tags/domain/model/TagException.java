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

import lombok.Getter;

/**
 * Base class for tag store failures that are reported back to the caller.
 *
 * <p>
 * Every failure carries its {@link ErrorKind} and a message bundle key with
 * arguments, so the command layer can render a specific message for each kind.
 */
@Getter
public abstract class TagException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;
    private final String messageKey;
    private final transient Object[] messageArgs;

    protected TagException(ErrorKind kind, String messageKey, String message, Object... messageArgs) {
        this(kind, messageKey, message, null, messageArgs);
    }

    protected TagException(ErrorKind kind, String messageKey, String message, Throwable cause,
            Object... messageArgs) {
        super(message, cause);
        this.kind = kind;
        this.messageKey = messageKey;
        this.messageArgs = messageArgs != null ? messageArgs.clone() : new Object[0];
    }

    public Object[] getMessageArgs() {
        return messageArgs.clone();
    }

    /**
     * Failure categories exposed to the command layer.
     */
    public enum ErrorKind {
        VALIDATION, DUPLICATE, NOT_FOUND, PERMISSION, PERSISTENCE
    }
}
