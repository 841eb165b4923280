package com.ourd.server.auth;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Token store keeping one JSON file per token under a directory:
 * {@code {"accessToken":"...","userInfoID":"...","issuedAt":"...","expiredAt":"..."}} with ISO-8601 times.
 */
public final class FileTokenStore implements TokenStore {

    private static final Logger log = LoggerFactory.getLogger(FileTokenStore.class);
    private static final Pattern TOKEN_NAME = Pattern.compile("[A-Za-z0-9_-]{1,128}");

    private final Path directory;
    private final ObjectMapper mapper;

    public FileTokenStore(Path directory, ObjectMapper mapper) {
        this.directory = directory;
        this.mapper = mapper;
    }

    /** Creates the token directory if needed. */
    public FileTokenStore init() {
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create token directory " + directory, e);
        }
        log.debug("Token store at {}", directory.toAbsolutePath());
        return this;
    }

    @Override
    public Optional<AccessToken> get(String accessToken) {
        if (!isValidName(accessToken)) {
            return Optional.empty();
        }
        Path file = directory.resolve(accessToken);
        JsonNode node;
        try {
            node = mapper.readTree(Files.readString(file));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (JsonProcessingException e) {
            log.warn("Ignoring corrupt token file {}: {}", file, e.getOriginalMessage());
            return Optional.empty();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read token file " + file, e);
        }
        if (node == null || node.path("userInfoID").asText("").isBlank()) {
            log.warn("Ignoring token file {} without a user", file);
            return Optional.empty();
        }
        try {
            return Optional.of(new AccessToken(
                    node.path("accessToken").asText(accessToken),
                    node.path("userInfoID").asText(),
                    Instant.parse(node.path("issuedAt").asText()),
                    node.hasNonNull("expiredAt") ? Instant.parse(node.get("expiredAt").asText()) : null));
        } catch (DateTimeParseException e) {
            log.warn("Ignoring corrupt token file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void put(AccessToken token) {
        if (!isValidName(token.accessToken())) {
            throw new IllegalArgumentException("Invalid access token value");
        }
        ObjectNode node = mapper.createObjectNode();
        node.put("accessToken", token.accessToken());
        node.put("userInfoID", token.userInfoID());
        node.put("issuedAt", token.issuedAt().toString());
        if (token.expiredAt() != null) {
            node.put("expiredAt", token.expiredAt().toString());
        }
        Path file = directory.resolve(token.accessToken());
        Path tmp = null;
        try {
            tmp = Files.createTempFile(directory, ".token", ".tmp");
            Files.writeString(tmp, mapper.writeValueAsString(node));
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            if (tmp != null) {
                try {
                    Files.deleteIfExists(tmp);
                } catch (IOException cleanup) {
                    e.addSuppressed(cleanup);
                }
            }
            throw new UncheckedIOException("Cannot write token file " + file, e);
        }
    }

    @Override
    public boolean delete(String accessToken) {
        if (!isValidName(accessToken)) {
            return false;
        }
        try {
            return Files.deleteIfExists(directory.resolve(accessToken));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot delete token " + accessToken, e);
        }
    }

    private static boolean isValidName(String accessToken) {
        return accessToken != null && TOKEN_NAME.matcher(accessToken).matches();
    }
}
