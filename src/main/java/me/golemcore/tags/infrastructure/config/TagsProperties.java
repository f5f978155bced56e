package me.golemcore.tags.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the tag store, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code tags.*} prefix:
 * <ul>
 * <li>{@link StorageProperties} - location of the persisted tag document</li>
 * <li>{@link ValidationProperties} - tag name rules</li>
 * <li>{@code tags.language} - reply language of the tag command</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "tags")
@Data
public class TagsProperties {

    private StorageProperties storage = new StorageProperties();
    private ValidationProperties validation = new ValidationProperties();
    private String language = "en";

    @Data
    public static class StorageProperties {
        private String path = "tags.json";

        /** Keep the previous document as {@code <file>.bak} on every save. */
        private boolean backup = false;
    }

    @Data
    public static class ValidationProperties {
        private int maxNameLength = 100;
        private List<String> blockedSubstrings = new ArrayList<>(List.of("@everyone", "@here"));
    }
}
