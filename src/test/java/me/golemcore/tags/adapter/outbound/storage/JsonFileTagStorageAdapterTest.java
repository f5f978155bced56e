package me.golemcore.tags.adapter.outbound.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.tags.domain.model.Tag;
import me.golemcore.tags.domain.model.TagStorageCorruptedException;
import me.golemcore.tags.infrastructure.config.AutoConfiguration;
import me.golemcore.tags.infrastructure.config.TagsProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonFileTagStorageAdapterTest {

    private static final Instant FIXED_NOW = Instant.parse("2026-10-19T10:00:00Z");
    private static final String TAGS_FILE = "tags.json";

    @TempDir
    Path tempDir;

    private ObjectMapper objectMapper;
    private TagsProperties properties;
    private JsonFileTagStorageAdapter adapter;
    private Path tagsPath;

    @BeforeEach
    void setUp() {
        objectMapper = AutoConfiguration.objectMapper();
        properties = new TagsProperties();
        adapter = new JsonFileTagStorageAdapter(objectMapper, properties, Clock.fixed(FIXED_NOW, ZoneOffset.UTC));
        tagsPath = tempDir.resolve(TAGS_FILE);
    }

    @Test
    void shouldLoadEmptyMapWhenFileIsMissing() {
        assertTrue(adapter.load(tagsPath).join().isEmpty());
    }

    @Test
    void shouldRoundTripNamespaceMap() {
        Map<String, Map<String, Tag>> namespaces = sampleNamespaces();

        adapter.save(tagsPath, namespaces).join();

        assertEquals(namespaces, adapter.load(tagsPath).join());
    }

    @Test
    void shouldWriteDocumentLayout() throws Exception {
        adapter.save(tagsPath, sampleNamespaces()).join();

        JsonNode root = objectMapper.readTree(tagsPath.toFile());
        JsonNode welcome = root.get("generic").get("welcome");
        assertEquals("welcome", welcome.get("name").asText());
        assertEquals("Hi!", welcome.get("content").asText());
        assertEquals(1L, welcome.get("owner_id").asLong());
        assertEquals(4L, welcome.get("uses").asLong());
        assertTrue(welcome.get("location").isNull());
        assertEquals("2026-10-19T10:00:00Z", welcome.get("created_at").asText());
        assertEquals("42", root.get("42").get("rules").get("location").asText());
    }

    @Test
    void shouldLeaveOnlyTargetFileAfterSave() throws Exception {
        adapter.save(tagsPath, sampleNamespaces()).join();
        adapter.save(tagsPath, new HashMap<>()).join();

        try (Stream<Path> files = Files.list(tempDir)) {
            assertEquals(List.of(tagsPath), files.toList());
        }
        assertTrue(adapter.load(tagsPath).join().isEmpty());
    }

    @Test
    void shouldCreateMissingParentDirectories() {
        Path nested = tempDir.resolve("data/bot/tags.json");

        adapter.save(nested, sampleNamespaces()).join();

        assertTrue(Files.exists(nested));
    }

    @Test
    void shouldKeepBackupOfPreviousDocumentWhenEnabled() throws Exception {
        properties.getStorage().setBackup(true);
        adapter.save(tagsPath, sampleNamespaces()).join();
        String first = Files.readString(tagsPath);

        adapter.save(tagsPath, new HashMap<>()).join();

        assertEquals(first, Files.readString(tempDir.resolve(TAGS_FILE + ".bak")));
    }

    @Test
    void shouldLeavePreviousDocumentIntactWhenSaveFails() throws Exception {
        adapter.save(tagsPath, sampleNamespaces()).join();
        String before = Files.readString(tagsPath);

        Tag broken = new Tag() {
            @Override
            public String getContent() {
                throw new IllegalStateException("boom");
            }
        };
        broken.setName("broken");
        Map<String, Map<String, Tag>> namespaces = sampleNamespaces();
        namespaces.get("generic").put("broken", broken);

        CompletionException ex = assertThrows(CompletionException.class,
                () -> adapter.save(tagsPath, namespaces).join());

        assertTrue(ex.getCause() instanceof UncheckedIOException);
        assertEquals(before, Files.readString(tagsPath));
        try (Stream<Path> files = Files.list(tempDir)) {
            assertEquals(List.of(tagsPath), files.toList());
        }
    }

    @Test
    void shouldRemoveTempFileWhenRenameFails() throws Exception {
        Path occupied = tempDir.resolve(TAGS_FILE);
        Files.createDirectories(occupied);
        Files.writeString(occupied.resolve("keep.txt"), "occupied");

        CompletionException ex = assertThrows(CompletionException.class,
                () -> adapter.save(occupied, sampleNamespaces()).join());

        assertTrue(ex.getCause() instanceof UncheckedIOException);
        assertTrue(Files.isDirectory(occupied));
        assertEquals("occupied", Files.readString(occupied.resolve("keep.txt")));
        try (Stream<Path> files = Files.list(tempDir)) {
            assertTrue(files.noneMatch(file -> file.getFileName().toString().endsWith(".tmp")));
        }
    }

    @Test
    void shouldFailSaveWhenDirectoryCannotBeCreated() throws Exception {
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "not a directory");

        CompletionException ex = assertThrows(CompletionException.class,
                () -> adapter.save(blocker.resolve(TAGS_FILE), sampleNamespaces()).join());

        assertTrue(ex.getCause() instanceof UncheckedIOException);
    }

    @Test
    void shouldReportUnparsableFileAsCorrupted() throws Exception {
        Files.writeString(tagsPath, "{not json");

        assertCorrupted();
    }

    @Test
    void shouldReportUnreadableExistingFileAsCorrupted() throws Exception {
        Files.createSymbolicLink(tagsPath, tagsPath.getFileName());

        assertTrue(Files.exists(tagsPath, LinkOption.NOFOLLOW_LINKS));
        assertCorrupted();
    }

    @Test
    void shouldReportEmptyFileAsCorrupted() throws Exception {
        Files.writeString(tagsPath, "");

        assertCorrupted();
    }

    @Test
    void shouldReportNullDocumentAsCorrupted() throws Exception {
        Files.writeString(tagsPath, "null");

        assertCorrupted();
    }

    @Test
    void shouldReportNullTagRecordAsCorrupted() throws Exception {
        Files.writeString(tagsPath, "{\"generic\": {\"welcome\": null}}");

        assertCorrupted();
    }

    @Test
    void shouldReportWrongShapeAsCorrupted() throws Exception {
        Files.writeString(tagsPath, "[1, 2, 3]");

        assertCorrupted();
    }

    @Test
    void shouldNormalizeLegacyDocument() throws Exception {
        Files.writeString(tagsPath, """
                {
                  "generic": {
                    "welcome": {"name": "welcome", "content": "Hi!", "owner_id": 1,
                                "uses": 2, "location": "generic",
                                "created_at": "2016-12-01T08:30:00.123456789Z"}
                  },
                  "42": {
                    "rules": {"content": "Be nice", "owner_id": 3, "location": "42"}
                  },
                  "43": null
                }
                """);

        Map<String, Map<String, Tag>> loaded = adapter.load(tagsPath).join();

        Tag welcome = loaded.get("generic").get("welcome");
        assertNull(welcome.getLocation());
        assertEquals(2L, welcome.getUses());
        assertEquals(Instant.parse("2016-12-01T08:30:00.123456789Z"), welcome.getCreatedAt());

        Tag rules = loaded.get("42").get("rules");
        assertEquals("rules", rules.getName());
        assertEquals(0L, rules.getUses());
        assertEquals(FIXED_NOW, rules.getCreatedAt());
        assertEquals("42", rules.getLocation());

        assertTrue(loaded.get("43").isEmpty());
    }

    private void assertCorrupted() {
        CompletionException ex = assertThrows(CompletionException.class, () -> adapter.load(tagsPath).join());
        assertTrue(ex.getCause() instanceof TagStorageCorruptedException);
    }

    private Map<String, Map<String, Tag>> sampleNamespaces() {
        Map<String, Tag> generic = new HashMap<>();
        generic.put("welcome", Tag.builder().name("welcome").content("Hi!").ownerId(1L).uses(4)
                .createdAt(FIXED_NOW).build());
        Map<String, Tag> guild = new HashMap<>();
        guild.put("rules", Tag.builder().name("rules").content("Be nice").ownerId(3L).location("42")
                .createdAt(FIXED_NOW.minusSeconds(60)).build());

        Map<String, Map<String, Tag>> namespaces = new HashMap<>();
        namespaces.put("generic", generic);
        namespaces.put("42", guild);
        return namespaces;
    }
}
