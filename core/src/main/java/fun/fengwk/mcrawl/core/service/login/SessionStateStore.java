package fun.fengwk.mcrawl.core.service.login;

import com.fasterxml.jackson.databind.ObjectMapper;
import fun.fengwk.mcrawl.core.configuration.LoginProperties;
import fun.fengwk.mcrawl.core.model.LoginType;
import fun.fengwk.mcrawl.core.model.Platform;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Persists session cookies per platform.
 *
 * @author fengwk
 */
@Slf4j
@RequiredArgsConstructor
public class SessionStateStore {

    private static final String STATE_FILE = "session.json";

    private final LoginProperties loginProperties;
    private final ObjectMapper objectMapper;

    public void save(SessionState session) {
        try {
            Path platformDir = resolvePlatformDir(session.getPlatform());
            Files.createDirectories(platformDir);
            StoredSession stored = new StoredSession();
            stored.setPlatform(session.getPlatform().getCode());
            stored.setSavedAt(Instant.now().toString());
            stored.setCookies(new LinkedHashMap<>(session.getCookies()));
            writeAtomically(platformDir.resolve(STATE_FILE), objectMapper.writeValueAsString(stored));
            log.info("session saved, platform={}, cookies={}", session.getPlatform(), stored.getCookies().size());
        } catch (Exception ex) {
            throw new IllegalStateException("failed to save session: " + ex.getMessage(), ex);
        }
    }

    /**
     * Restore saved cookies, the returned session still has to pass the liveness check.
     */
    public Optional<SessionState> load(Platform platform, LoginType loginType) {
        Path statePath = resolvePlatformDir(platform).resolve(STATE_FILE);
        if (!Files.exists(statePath)) {
            return Optional.empty();
        }
        try {
            StoredSession stored = objectMapper.readValue(Files.readString(statePath), StoredSession.class);
            SessionState session = new SessionState(platform, loginType);
            session.replaceCookies(stored.getCookies());
            return Optional.of(session);
        } catch (Exception ex) {
            log.warn("load session failed, platform={}, path={}, error={}", platform, statePath, ex.getMessage());
            return Optional.empty();
        }
    }

    public void clear(Platform platform) {
        try {
            Files.deleteIfExists(resolvePlatformDir(platform).resolve(STATE_FILE));
        } catch (Exception ex) {
            throw new IllegalStateException("failed to clear session: " + ex.getMessage(), ex);
        }
    }

    Path resolvePlatformDir(Platform platform) {
        Path root = Paths.get(loginProperties.getSessionRoot()).toAbsolutePath().normalize();
        return root.resolve(platform.getCode()).normalize();
    }

    private void writeAtomically(Path targetPath, String content) throws Exception {
        Path tmpPath = targetPath.resolveSibling(targetPath.getFileName() + "." + UUID.randomUUID() + ".tmp");
        Files.writeString(tmpPath, content, StandardCharsets.UTF_8, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        try {
            Files.move(tmpPath, targetPath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (Exception ex) {
            Files.move(tmpPath, targetPath, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    @Data
    public static class StoredSession {

        private String platform;

        private String savedAt;

        private Map<String, String> cookies = new LinkedHashMap<>();

    }

}
