package gsecars.tomoxrd.utilities;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class FileNameSanitizerTest {

    @TempDir
    Path tempDir;

    @ParameterizedTest
    @CsvSource({
            "sample, sample",
            "my sample, my_sample",
            "a/b\\c, a_b_c",
            "x<y>z, x_y_z",
            "run#1&2, run_1_2",
            "what?*, what__"
    })
    void testSanitizeFileName(String input, String expected) {
        assertEquals(expected, FileNameSanitizer.sanitizeFileName(input));
    }

    @Test
    void testSanitizeFilePath() {
        assertEquals("/data/run_1/", FileNameSanitizer.sanitizeFilePath("/data/run 1"));
        assertEquals("/data/", FileNameSanitizer.sanitizeFilePath("/data/"));
        assertEquals("/", FileNameSanitizer.sanitizeFilePath(""));
        assertEquals("/", FileNameSanitizer.sanitizeFilePath(null));
    }

    @Test
    void testIsValidFileName() {
        assertTrue(FileNameSanitizer.isValidFileName("sample_01"));
        assertFalse(FileNameSanitizer.isValidFileName("sample 01"));
        assertFalse(FileNameSanitizer.isValidFileName(""));
        assertFalse(FileNameSanitizer.isValidFileName(null));
    }

    @Test
    void testEnsureDirectory() throws IOException {
        Path nested = tempDir.resolve("a").resolve("b");

        FileNameSanitizer.ensureDirectory(nested.toString());
        FileNameSanitizer.ensureDirectory(nested.toString());

        assertTrue(Files.isDirectory(nested));
    }
}
