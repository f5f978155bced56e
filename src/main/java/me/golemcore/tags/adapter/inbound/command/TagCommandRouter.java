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

package me.golemcore.tags.adapter.inbound.command;

import me.golemcore.tags.domain.model.Tag;
import me.golemcore.tags.domain.model.TagCommand;
import me.golemcore.tags.domain.model.TagException;
import me.golemcore.tags.domain.model.UserProfile;
import me.golemcore.tags.domain.service.TagService;
import me.golemcore.tags.infrastructure.i18n.MessageService;
import me.golemcore.tags.port.inbound.CommandPort;
import me.golemcore.tags.port.outbound.UserDirectoryPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Routes the {@code tag} command to the {@link TagService}.
 *
 * <ul>
 * <li>tag create &lt;name&gt; &lt;content&gt; - create a tag in the current
 * guild, or a generic tag outside of guilds
 * <li>tag info &lt;name&gt; - show owner, uses and creation time
 * <li>tag list - list the visible tags
 * <li>tag edit &lt;name&gt; &lt;content&gt; - replace the content (owner only)
 * <li>tag delete &lt;name&gt; - delete the tag (owner only)
 * <li>tag &lt;name&gt; - post the tag content and count the use
 * </ul>
 *
 * <p>
 * The context map carries the requester's {@code userId} and, inside a guild,
 * the {@code guildId}. Every store failure is turned into its own localized
 * message.
 *
 * @see me.golemcore.tags.port.inbound.CommandPort
 */
@Component
@Slf4j
public class TagCommandRouter implements CommandPort {

    public static final String CMD_TAG = "tag";
    public static final String CTX_GUILD_ID = "guildId";
    public static final String CTX_USER_ID = "userId";

    private static final String NEWLINE = "\n";

    private final TagService tagService;
    private final UserDirectoryPort userDirectory;
    private final MessageService messageService;

    public TagCommandRouter(TagService tagService, UserDirectoryPort userDirectory, MessageService messageService) {
        this.tagService = tagService;
        this.userDirectory = userDirectory;
        this.messageService = messageService;
        log.info("TagCommandRouter initialized with commands: {}", List.of(CMD_TAG));
    }

    @Override
    public CompletableFuture<CommandResult> execute(String command, List<String> args, Map<String, Object> context) {
        return CompletableFuture.supplyAsync(() -> {
            if (!hasCommand(command)) {
                return CommandResult.failure(msg("command.unknown", command));
            }

            Long guildId = resolveContextLong(context, CTX_GUILD_ID);
            Long userId = resolveContextLong(context, CTX_USER_ID);

            TagCommand tagCommand;
            try {
                tagCommand = TagCommand.parse(args);
            } catch (TagCommand.UsageException e) {
                return CommandResult.failure(msg(e.getMessage()));
            }
            log.debug("Executing tag {} '{}' (guild={}, user={})",
                    tagCommand.type(), tagCommand.name(), guildId, userId);

            try {
                return switch (tagCommand.type()) {
                case CREATE -> handleCreate(guildId, userId, tagCommand);
                case INFO -> handleInfo(guildId, tagCommand);
                case LIST -> handleList(guildId);
                case EDIT -> handleEdit(guildId, userId, tagCommand);
                case DELETE -> handleDelete(guildId, userId, tagCommand);
                case INVOKE -> handleInvoke(guildId, tagCommand);
                };
            } catch (TagException e) {
                log.debug("Tag {} '{}' failed: {}", tagCommand.type(), tagCommand.name(), e.getMessage());
                return CommandResult.failure(msg(e.getMessageKey(), e.getMessageArgs()));
            }
        });
    }

    @Override
    public boolean hasCommand(String command) {
        return CMD_TAG.equals(command);
    }

    @Override
    public List<CommandDefinition> listCommands() {
        return List.of(new CommandDefinition(CMD_TAG, "Create, show and manage tags",
                "tag [create|info|list|edit|delete] <name> [content] | tag <name>"));
    }

    private CommandResult handleCreate(Long guildId, Long userId, TagCommand command) {
        if (userId == null) {
            return CommandResult.failure(msg("tag.error.no-user"));
        }
        Tag tag = tagService.createTag(guildId, command.name(), command.content(), userId);
        return CommandResult.success(msg("tag.created", tag.getName()), tag);
    }

    private CommandResult handleInfo(Long guildId, TagCommand command) {
        Tag tag = tagService.getTag(guildId, command.name());
        return CommandResult.success(renderInfo(tag), tag);
    }

    private CommandResult handleList(Long guildId) {
        List<String> names = tagService.listTags(guildId);
        if (names.isEmpty()) {
            return CommandResult.success(msg("tag.list.empty"));
        }
        return CommandResult.success(msg("tag.list.title", String.join(", ", names)), names);
    }

    private CommandResult handleEdit(Long guildId, Long userId, TagCommand command) {
        if (userId == null) {
            return CommandResult.failure(msg("tag.error.no-user"));
        }
        Tag tag = tagService.editTag(guildId, command.name(), command.content(), userId);
        return CommandResult.success(msg("tag.updated", tag.getName()), tag);
    }

    private CommandResult handleDelete(Long guildId, Long userId, TagCommand command) {
        if (userId == null) {
            return CommandResult.failure(msg("tag.error.no-user"));
        }
        tagService.deleteTag(guildId, command.name(), userId);
        return CommandResult.success(msg("tag.deleted", command.name()));
    }

    private CommandResult handleInvoke(Long guildId, TagCommand command) {
        Tag tag = tagService.incrementUse(guildId, command.name());
        return CommandResult.success(tag.getContent(), tag);
    }

    String renderInfo(Tag tag) {
        StringBuilder sb = new StringBuilder();
        sb.append("**").append(tag.getName()).append("**").append(NEWLINE);

        resolveOwner(tag.getOwnerId()).ifPresent(owner -> {
            sb.append(msg("tag.info.author", owner.displayName()));
            if (owner.avatarUrl() != null) {
                sb.append(" (").append(owner.avatarUrl()).append(")");
            }
            sb.append(NEWLINE);
        });

        sb.append(msg("tag.info.owner", String.valueOf(tag.getOwnerId()))).append(NEWLINE);
        sb.append(msg("tag.info.uses", String.valueOf(tag.getUses()))).append(NEWLINE);
        if (tag.getCreatedAt() != null) {
            sb.append(msg("tag.info.created", DateTimeFormatter.ISO_INSTANT.format(tag.getCreatedAt())))
                    .append(NEWLINE);
        }
        sb.append("_").append(msg(tag.isGeneric() ? "tag.info.generic" : "tag.info.guild")).append("_");
        return sb.toString();
    }

    private Optional<UserProfile> resolveOwner(long ownerId) {
        try {
            return userDirectory.findUser(ownerId)
                    .filter(profile -> profile.displayName() != null && !profile.displayName().isBlank());
        } catch (RuntimeException e) { // NOSONAR - render without author when the lookup fails
            log.warn("Failed to resolve tag owner {}: {}", ownerId, e.getMessage());
            return Optional.empty();
        }
    }

    private Long resolveContextLong(Map<String, Object> context, String key) {
        if (context == null) {
            return null;
        }
        Object value = context.get(key);
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value instanceof String str && !str.isBlank()) {
            try {
                return Long.parseLong(str.trim());
            } catch (NumberFormatException e) {
                log.warn("Ignoring non-numeric {} in command context: {}", key, str);
            }
        }
        return null;
    }

    private String msg(String key, Object... args) {
        return messageService.getMessage(key, args);
    }
}
