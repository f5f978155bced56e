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

package me.golemcore.tags.adapter.outbound.user;

import me.golemcore.tags.domain.model.UserProfile;
import me.golemcore.tags.port.outbound.UserDirectoryPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * No-op user directory used when no chat platform client is wired in.
 *
 * <p>
 * Never resolves a user, so tag details are rendered without an author line.
 *
 * @see UserDirectoryPort
 */
@Component
@Slf4j
public class NoOpUserDirectoryAdapter implements UserDirectoryPort {

    @Override
    public Optional<UserProfile> findUser(long userId) {
        log.debug("NoOpUserDirectoryAdapter: findUser({}) called - no user directory configured", userId);
        return Optional.empty();
    }
}
