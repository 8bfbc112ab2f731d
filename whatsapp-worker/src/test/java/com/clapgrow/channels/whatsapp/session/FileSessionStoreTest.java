package com.clapgrow.channels.whatsapp.session;

import com.clapgrow.channels.whatsapp.transport.SessionCredentials;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class FileSessionStoreTest {

    @TempDir
    Path baseDir;

    private FileSessionStore store;

    @BeforeEach
    void setUp() {
        store = new FileSessionStore(baseDir, new ObjectMapper());
    }

    @Test
    void testSaveThenLoad_ReturnsStoredCredentials() {
        // Arrange
        SessionCredentials credentials = new SessionCredentials("channel-1", "41276", "key", 1_700_000_000_000L);

        // Act
        store.save(credentials);

        // Assert
        assertEquals(Optional.of(credentials), store.load("channel-1"));
        assertTrue(Files.exists(baseDir.resolve("channel-1").resolve("creds.json")));
        assertEquals(List.of("channel-1"), store.channelIds());
    }

    @Test
    void testSave_Twice_KeepsLatestOnly() {
        store.save(new SessionCredentials("channel-1", "1", "old", 1L));
        store.save(new SessionCredentials("channel-1", "2", "new", 2L));

        assertEquals("2", store.load("channel-1").orElseThrow().providerSessionId());
    }

    @Test
    void testLoad_Missing_ReturnsEmpty() {
        assertTrue(store.load("unknown").isEmpty());
        assertTrue(store.channelIds().isEmpty());
    }

    @Test
    void testLoad_Corrupt_ThrowsSessionStoreException() throws Exception {
        Files.createDirectories(baseDir.resolve("channel-1"));
        Files.writeString(baseDir.resolve("channel-1").resolve("creds.json"), "{not json");

        assertThrows(SessionStoreException.class, () -> store.load("channel-1"));
        assertTrue(store.channelIds().isEmpty());
    }

    @Test
    void testDelete_IsIdempotent() {
        store.save(new SessionCredentials("channel-1", "1", "k", 1L));

        store.delete("channel-1");
        store.delete("channel-1");

        assertTrue(store.load("channel-1").isEmpty());
        assertFalse(Files.exists(baseDir.resolve("channel-1")));
    }

    @Test
    void testSafeName_PathCharacters_AreEscaped() {
        assertEquals("_2e_2e_2fetc", FileSessionStore.safeName("../etc"));
        assertEquals("a_2fb", FileSessionStore.safeName("a/b"));
        assertEquals("abc-1_5f2", FileSessionStore.safeName("abc-1_2"));
        assertEquals("caf_c3_a9", FileSessionStore.safeName("caf\u00e9"));
    }

    @Test
    void testSave_IdsDifferingOnlyInPunctuation_KeptApart() {
        // Arrange
        SessionCredentials slash = new SessionCredentials("a/b", "1", "k1", 1L);
        SessionCredentials underscore = new SessionCredentials("a_b", "2", "k2", 2L);

        // Act
        store.save(slash);
        store.save(underscore);

        // Assert
        assertEquals(Optional.of(slash), store.load("a/b"));
        assertEquals(Optional.of(underscore), store.load("a_b"));
        assertEquals(2, store.channelIds().size());
    }

    @Test
    void testLoad_CredentialsOfAnotherChannel_ReturnsEmpty() throws Exception {
        // Arrange
        ObjectMapper objectMapper = new ObjectMapper();
        Files.createDirectories(baseDir.resolve("channel-2"));
        Files.writeString(baseDir.resolve("channel-2").resolve("creds.json"),
            objectMapper.writeValueAsString(new SessionCredentials("channel-1", "41276", "key", 1L)));

        // Act
        Optional<SessionCredentials> loaded = store.load("channel-2");

        // Assert
        assertTrue(loaded.isEmpty());
    }
}
