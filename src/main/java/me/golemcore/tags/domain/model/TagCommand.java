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

import java.util.List;
import java.util.Locale;

/**
 * A parsed {@code tag} command.
 *
 * <p>
 * Arguments follow {@code tag <subcommand> [name] [content...]}. Any first word
 * that is not a known subcommand is treated as the name of a tag to invoke.
 * Names are normalized with {@link Tag#normalizeName(String)} and content words
 * are joined with single spaces.
 *
 * @param type
 *            the operation to run
 * @param name
 *            normalized tag name, or null for {@link Type#LIST}
 * @param content
 *            tag content for {@link Type#CREATE} and {@link Type#EDIT}, else
 *            null
 */
public record TagCommand(Type type, String name, String content) {

    /**
     * Operations understood by the tag command.
     */
    public enum Type {
        CREATE, INFO, LIST, EDIT, DELETE, INVOKE
    }

    /**
     * Parses raw command arguments.
     *
     * @throws UsageException
     *             if required arguments are missing
     */
    public static TagCommand parse(List<String> args) {
        if (args == null || args.isEmpty() || args.get(0).isBlank()) {
            throw new UsageException("tag.usage");
        }

        String first = args.get(0).trim();
        List<String> rest = args.subList(1, args.size());

        return switch (first.toLowerCase(Locale.ROOT)) {
        case "create" -> new TagCommand(Type.CREATE,
                requireName(rest, "tag.create.missing-name"),
                requireContent(rest, "tag.create.missing-content"));
        case "info" -> new TagCommand(Type.INFO, requireName(rest, "tag.info.missing-name"), null);
        case "list" -> new TagCommand(Type.LIST, null, null);
        case "edit" -> new TagCommand(Type.EDIT,
                requireName(rest, "tag.edit.missing-name"),
                requireContent(rest, "tag.edit.missing-content"));
        case "delete" -> new TagCommand(Type.DELETE, requireName(rest, "tag.delete.missing-name"), null);
        default -> new TagCommand(Type.INVOKE, Tag.normalizeName(first), null);
        };
    }

    private static String requireName(List<String> rest, String usageKey) {
        if (rest.isEmpty() || rest.get(0).isBlank()) {
            throw new UsageException(usageKey);
        }
        return Tag.normalizeName(rest.get(0));
    }

    private static String requireContent(List<String> rest, String usageKey) {
        if (rest.size() < 2) {
            throw new UsageException(usageKey);
        }
        String content = String.join(" ", rest.subList(1, rest.size())).trim();
        if (content.isEmpty()) {
            throw new UsageException(usageKey);
        }
        return content;
    }

    /**
     * Raised when the command is missing an argument. The message is a message
     * bundle key.
     */
    public static class UsageException extends IllegalArgumentException {

        private static final long serialVersionUID = 1L;

        public UsageException(String messageKey) {
            super(messageKey);
        }
    }
}
