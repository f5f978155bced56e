package me.golemcore.tags;

import me.golemcore.tags.adapter.inbound.command.TagCommandRouter;
import me.golemcore.tags.domain.service.TagService;
import me.golemcore.tags.port.inbound.CommandPort;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest(properties = {
        "tags.storage.path=target/context-test/tags.json",
        "tags.validation.max-name-length=20"
})
class TagsApplicationContextTest {

    @Autowired
    private CommandPort commandPort;

    @Autowired
    private TagService tagService;

    @Test
    void shouldWireTagCommandToStore() {
        assertTrue(commandPort instanceof TagCommandRouter);
        assertTrue(tagService.getStoragePath().endsWith("target/context-test/tags.json"));

        CommandPort.CommandResult result = commandPort
                .execute("tag", List.of("create", "a".repeat(21), "x"), Map.of("userId", 1L))
                .join();

        assertEquals("Tag name limit is 20 characters.", result.output());
    }
}
