package com.socialgenius.browseruse.backend.service;

import com.socialgenius.browseruse.backend.agent.BrowsingContext;
import com.socialgenius.browseruse.backend.config.AutomationProperties;
import com.socialgenius.browseruse.backend.dto.ScreenshotListing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Screenshots and page captures on local disk, laid out as
 * {@code <dir>/<business>/<task>/<name>}.
 * <p>
 * Capturing is best-effort: failures are logged and reported as an empty result.
 */
@Service
public class ScreenshotStorageService {

    private static final Logger log = LoggerFactory.getLogger(ScreenshotStorageService.class);

    private static final Pattern SAFE_SEGMENT = Pattern.compile("[A-Za-z0-9@._-]+");
    private static final DateTimeFormatter VALIDATION_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    static final String VALIDATION_DIR = "session_validation";

    private final Path root;
    private final Clock clock;

    @Autowired
    public ScreenshotStorageService(AutomationProperties properties, Clock clock) {
        this(Paths.get(properties.getScreenshots().getDir()), clock);
    }

    ScreenshotStorageService(Path root, Clock clock) {
        this.root = root;
        this.clock = clock;
    }

    /**
     * Directory holding a task's artifacts, relative to the working directory as configured.
     */
    public Path taskDirectory(String businessId, String taskId) {
        return root.resolve(businessId).resolve(taskId);
    }

    /**
     * Saves a PNG of the current page as {@code <name>.png}.
     *
     * @return the written path, or empty if the capture failed
     */
    public Optional<String> captureScreenshot(BrowsingContext context, String businessId, String taskId,
            String name) {
        if (!isSafe(businessId) || !isSafe(taskId) || !isSafe(name)) {
            log.warn("[SCREENSHOT] Refusing unsafe path {}/{}/{}", businessId, taskId, name);
            return Optional.empty();
        }
        Path target = taskDirectory(businessId, taskId).resolve(name + ".png");
        return write(target, context::screenshot);
    }

    /**
     * Saves the current page HTML as {@code page_structure.html}.
     */
    public Optional<String> capturePageHtml(BrowsingContext context, String businessId, String taskId) {
        if (!isSafe(businessId) || !isSafe(taskId)) {
            return Optional.empty();
        }
        Path target = taskDirectory(businessId, taskId).resolve("page_structure.html");
        return write(target, () -> context.pageContent().getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Saves a screenshot of a session check as
     * {@code <dir>/session_validation/<business>_<yyyyMMdd_HHmmss>.png}.
     */
    public Optional<String> captureValidationScreenshot(BrowsingContext context, String businessId) {
        if (!isSafe(businessId)) {
            return Optional.empty();
        }
        String stamp = VALIDATION_STAMP.format(clock.instant().atZone(ZoneId.systemDefault()));
        Path target = root.resolve(VALIDATION_DIR).resolve(businessId + "_" + stamp + ".png");
        return write(target, context::screenshot);
    }

    /**
     * Lists the PNG and HTML artifacts of a task, or empty if none were captured.
     */
    public Optional<ScreenshotListing> list(String businessId, String taskId) {
        if (!isSafe(businessId) || !isSafe(taskId)) {
            return Optional.empty();
        }
        Path dir = taskDirectory(businessId, taskId);
        if (!Files.isDirectory(dir)) {
            return Optional.empty();
        }
        try (Stream<Path> files = Files.list(dir)) {
            List<String> names = files
                    .filter(Files::isRegularFile)
                    .map(path -> path.getFileName().toString())
                    .sorted()
                    .toList();
            return Optional.of(ScreenshotListing.builder()
                    .businessId(businessId)
                    .taskId(taskId)
                    .screenshots(names.stream().filter(n -> n.endsWith(".png")).toList())
                    .htmlFiles(names.stream().filter(n -> n.endsWith(".html")).toList())
                    .directory(dir.toString())
                    .build());
        } catch (IOException e) {
            throw new IllegalStateException("Error listing screenshots: " + e.getMessage(), e);
        }
    }

    /**
     * Resolves one stored artifact, or empty if it does not exist.
     */
    public Optional<Path> find(String businessId, String taskId, String fileName) {
        if (!isSafe(businessId) || !isSafe(taskId) || !isSafe(fileName)) {
            return Optional.empty();
        }
        Path file = taskDirectory(businessId, taskId).resolve(fileName);
        return Files.isRegularFile(file) ? Optional.of(file) : Optional.empty();
    }

    static boolean isSafe(String segment) {
        return segment != null
                && SAFE_SEGMENT.matcher(segment).matches()
                && !segment.equals(".")
                && !segment.equals("..");
    }

    private Optional<String> write(Path target, ContentSource source) {
        try {
            byte[] content = source.read();
            Files.createDirectories(target.getParent());
            Files.write(target, content);
            log.info("[SCREENSHOT] Captured {}", target);
            return Optional.of(target.toString());
        } catch (IOException | RuntimeException e) {
            log.warn("[SCREENSHOT] Failed to capture {}: {}", target, e.getMessage());
            return Optional.empty();
        }
    }

    @FunctionalInterface
    private interface ContentSource {
        byte[] read();
    }
}
