package me.golemcore.tags;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the GolemCore tag store.
 *
 * <p>
 * Tags are named text snippets that chat users create, edit, delete and invoke
 * by name. They are scoped either globally ("generic") or to a single guild.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Input Layer        → TagCommandRouter (CommandPort)
 * Domain Layer       → TagService (the store), TagValidator
 * Infrastructure     → JsonFileTagStorageAdapter, UserDirectoryPort adapters
 * </pre>
 *
 * <p>
 * The chat platform gateway is not part of this application; a channel adapter
 * feeds commands into {@link me.golemcore.tags.port.inbound.CommandPort}.
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under {@code tags.*}
 * prefix.
 *
 * @version 1.0
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class TagsApplication {

    public static void main(String[] args) {
        SpringApplication.run(TagsApplication.class, args);
    }

}
