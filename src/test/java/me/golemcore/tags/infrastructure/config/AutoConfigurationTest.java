package me.golemcore.tags.infrastructure.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.tags.domain.service.TagService;
import me.golemcore.tags.infrastructure.i18n.MessageService;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AutoConfigurationTest {

    @Test
    void shouldWriteInstantsAsIsoStrings() throws Exception {
        ObjectMapper mapper = AutoConfiguration.objectMapper();

        String json = mapper.writeValueAsString(Map.of("at", Instant.parse("2026-10-19T10:00:00Z")));

        assertEquals("{\"at\":\"2026-10-19T10:00:00Z\"}", json);
    }

    @Test
    void shouldIgnoreUnknownProperties() throws Exception {
        ObjectMapper mapper = AutoConfiguration.objectMapper();

        Probe probe = mapper.readValue("{\"value\":\"a\",\"extra\":1}", Probe.class);

        assertEquals("a", probe.value);
    }

    @Test
    void shouldProvideClock() {
        assertNotNull(AutoConfiguration.clock().instant());
    }

    @Test
    void shouldApplyConfiguredLanguageOnStartup() {
        TagsProperties properties = new TagsProperties();
        properties.setLanguage("ru");
        TagService tagService = mock(TagService.class);
        when(tagService.size()).thenReturn(3);
        MessageService messageService = mock(MessageService.class);

        new AutoConfiguration(properties, tagService, messageService).init();

        verify(messageService).setLanguage("ru");
        verify(tagService).size();
    }

    static class Probe {
        public String value;
    }
}
