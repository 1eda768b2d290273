package gsecars.tomoxrd.utilities;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.regex.Pattern;

/**
 * FileNameSanitizer
 *
 * <p>Cleans operator-entered file names and directories before they are written to the
 * detector. The detector server builds paths from these strings verbatim, so characters
 * that break either Windows or Linux paths are replaced with underscores.
 *
 * <p>Characters replaced in file names:
 * <ul>
 *   <li>Angle brackets: &lt; &gt;
 *   <li>Quote: "
 *   <li>Slashes: / \
 *   <li>Pipe: |
 *   <li>Question mark and asterisk: ? *
 *   <li>Hash and ampersand: # &amp;
 *   <li>Space
 * </ul>
 *
 * <p>Directories keep forward slashes and always end with one.
 */
public final class FileNameSanitizer {
    private static final Logger logger = LoggerFactory.getLogger(FileNameSanitizer.class);

    private static final Pattern ILLEGAL_NAME_CHARS = Pattern.compile("[<>\"/\\\\|?*#& ]");
    private static final Pattern ILLEGAL_PATH_CHARS = Pattern.compile("[<>\"\\\\|?*#& ]");

    private FileNameSanitizer() {
    }

    public static boolean isValidFileName(String name) {
        return name != null && !name.isEmpty() && !ILLEGAL_NAME_CHARS.matcher(name).find();
    }

    /**
     * Replaces illegal characters with underscores.
     */
    public static String sanitizeFileName(String name) {
        if (name == null) {
            return "";
        }
        String sanitized = ILLEGAL_NAME_CHARS.matcher(name).replaceAll("_");
        if (!sanitized.equals(name)) {
            logger.debug("Sanitized file name '{}' to '{}'", name, sanitized);
        }
        return sanitized;
    }

    /**
     * Replaces illegal characters with underscores and appends a trailing slash.
     */
    public static String sanitizeFilePath(String path) {
        if (path == null || path.isEmpty()) {
            return "/";
        }
        String sanitized = ILLEGAL_PATH_CHARS.matcher(path).replaceAll("_");
        if (!sanitized.endsWith("/")) {
            sanitized += "/";
        }
        if (!sanitized.equals(path)) {
            logger.debug("Sanitized file path '{}' to '{}'", path, sanitized);
        }
        return sanitized;
    }

    /**
     * Creates {@code directory} and any missing parents.
     *
     * @throws IOException if the directory cannot be created
     */
    public static Path ensureDirectory(String directory) throws IOException {
        Path dir = Paths.get(directory);
        if (!Files.isDirectory(dir)) {
            logger.info("Creating directory {}", dir);
            Files.createDirectories(dir);
        }
        return dir;
    }
}
