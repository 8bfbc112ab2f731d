package com.clapgrow.channels.whatsapp.session;

import com.clapgrow.channels.whatsapp.config.WorkerProperties;
import com.clapgrow.channels.whatsapp.transport.SessionCredentials;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Keeps each channel's credentials in {@code <dir>/<channel>/creds.json}.
 *
 * <p>Writes go to a temporary file that is atomically moved into place, so a crash never
 * leaves a half-written credentials file behind.
 */
@Component
@Slf4j
public class FileSessionStore implements SessionStore {

    private static final String CREDENTIALS_FILE = "creds.json";

    private final Path baseDir;
    private final ObjectMapper objectMapper;

    @Autowired
    public FileSessionStore(WorkerProperties properties, ObjectMapper objectMapper) {
        this(Paths.get(properties.getSessions().getDir()), objectMapper);
    }

    public FileSessionStore(Path baseDir, ObjectMapper objectMapper) {
        this.baseDir = baseDir;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<SessionCredentials> load(String channelId) {
        Path file = credentialsFile(channelId);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            SessionCredentials credentials = objectMapper.readValue(file.toFile(), SessionCredentials.class);
            if (credentials.providerSessionId() == null || credentials.providerSessionId().isBlank()) {
                log.warn("Ignoring credentials without session id: channelId={}", channelId);
                return Optional.empty();
            }
            if (!channelId.equals(credentials.channelId())) {
                log.warn("Ignoring credentials stored for another channel: channelId={}, storedFor={}",
                    channelId, credentials.channelId());
                return Optional.empty();
            }
            return Optional.of(credentials);
        } catch (IOException e) {
            throw new SessionStoreException("Failed to read credentials for channel " + channelId, e);
        }
    }

    @Override
    public void save(SessionCredentials credentials) {
        Path dir = channelDir(credentials.channelId());
        try {
            Files.createDirectories(dir);
            Path tmp = Files.createTempFile(dir, "creds", ".tmp");
            objectMapper.writeValue(tmp.toFile(), credentials);
            Files.move(tmp, dir.resolve(CREDENTIALS_FILE),
                StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("Stored credentials: channelId={}", credentials.channelId());
        } catch (IOException e) {
            throw new SessionStoreException("Failed to store credentials for channel " + credentials.channelId(), e);
        }
    }

    @Override
    public void delete(String channelId) {
        Path dir = channelDir(channelId);
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(dir)) {
            List<Path> ordered = paths.sorted(Comparator.reverseOrder()).toList();
            for (Path path : ordered) {
                try {
                    Files.delete(path);
                } catch (NoSuchFileException e) {
                    log.debug("Already removed: {}", path);
                }
            }
            log.info("Deleted stored credentials: channelId={}", channelId);
        } catch (IOException e) {
            throw new SessionStoreException("Failed to delete credentials for channel " + channelId, e);
        }
    }

    @Override
    public List<String> channelIds() {
        if (!Files.isDirectory(baseDir)) {
            return List.of();
        }
        List<String> ids = new ArrayList<>();
        try (Stream<Path> dirs = Files.list(baseDir)) {
            for (Path dir : dirs.filter(Files::isDirectory).toList()) {
                Path file = dir.resolve(CREDENTIALS_FILE);
                if (!Files.exists(file)) {
                    continue;
                }
                try {
                    SessionCredentials credentials = objectMapper.readValue(file.toFile(), SessionCredentials.class);
                    if (credentials.channelId() != null) {
                        ids.add(credentials.channelId());
                    }
                } catch (IOException e) {
                    log.warn("Skipping unreadable credentials file {}: {}", file, e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new SessionStoreException("Failed to list stored sessions in " + baseDir, e);
        }
        return ids;
    }

    private Path channelDir(String channelId) {
        return baseDir.resolve(safeName(channelId));
    }

    private Path credentialsFile(String channelId) {
        return channelDir(channelId).resolve(CREDENTIALS_FILE);
    }

    /**
     * Directory name for a channel id. Letters, digits and '-' are kept; every other UTF-8 byte
     * becomes '_' plus two hex digits, so distinct ids never share a directory.
     */
    static String safeName(String channelId) {
        StringBuilder safe = new StringBuilder(channelId.length());
        for (byte b : channelId.getBytes(StandardCharsets.UTF_8)) {
            char c = (char) (b & 0xff);
            if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '-') {
                safe.append(c);
            } else {
                safe.append('_').append(String.format("%02x", b & 0xff));
            }
        }
        return safe.toString();
    }
}
