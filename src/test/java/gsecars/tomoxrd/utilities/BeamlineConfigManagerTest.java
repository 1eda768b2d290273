package gsecars.tomoxrd.utilities;

import gsecars.tomoxrd.model.GeometryPositions;
import gsecars.tomoxrd.model.PvNames;
import gsecars.tomoxrd.model.TimingSettings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for loading the beamline YAML and building typed settings from it.
 */
class BeamlineConfigManagerTest {

    @TempDir
    Path tempDir;

    // ==================== Bundled configuration ====================

    @Test
    @DisplayName("Bundled configuration is complete and matches the built-in defaults")
    void testBundledConfiguration() {
        BeamlineConfigManager config = BeamlineConfigManager.fromClasspath();

        assertTrue(config.validateConfiguration().isEmpty());
        assertEquals(PvNames.defaults(), config.getPvNames());
        assertEquals(GeometryPositions.defaults(), config.getGeometryPositions());
        assertEquals(TimingSettings.defaults(), config.getTimingSettings());
        assertEquals("/DAC", config.getPathMapping().detectorBase());
        assertEquals("13-BM-D", config.getString("beamline", "name"));
    }

    // ==================== Partial configuration ====================

    @Test
    void testPartialConfigurationFallsBackToDefaults() {
        BeamlineConfigManager config = BeamlineConfigManager.fromClasspath("test_config.yml");

        PvNames names = config.getPvNames();
        assertEquals("TEST:cam1:", names.camPrefix());
        assertEquals("TEST:m1", names.rotationMotor());
        assertEquals(PvNames.defaults().focusMotor(), names.focusMotor());
        assertEquals(PvNames.defaults().allStop(), names.allStop());

        assertEquals(12.5, config.getGeometryPositions().xrdX());
        assertEquals(-127.0, config.getGeometryPositions().tomoX());

        TimingSettings timing = config.getTimingSettings();
        assertEquals(Duration.ofMillis(5), timing.settle());
        assertEquals(Duration.ofSeconds(10), timing.moveTimeout());
        assertEquals(Duration.ofSeconds(2), timing.geometrySettle());

        assertEquals("/unchanged/", config.getPathMapping().toDetectorPath("/unchanged/"));
    }

    @Test
    void testValidationReportsMissingSections() {
        BeamlineConfigManager config = BeamlineConfigManager.fromClasspath("test_config.yml");

        List<String> missing = config.validateConfiguration();

        assertTrue(missing.contains("pso"));
        assertTrue(missing.contains("shutter"));
        assertTrue(missing.contains("motors.focus"));
        assertFalse(missing.contains("detector"));
    }

    @Test
    void testMissingResourceGivesEmptyConfig() {
        BeamlineConfigManager config = BeamlineConfigManager.fromClasspath("does_not_exist.yml");
        assertTrue(config.getAllConfig().isEmpty());
        assertEquals(PvNames.defaults(), config.getPvNames());
    }

    // ==================== Getters ====================

    @Test
    void testTypedGetters() throws IOException {
        Path file = tempDir.resolve("config.yml");
        Files.writeString(file, String.join("\n",
                "section:",
                "  number: 42",
                "  text: '3.5'",
                "  flag: true",
                "  bad: abc",
                "  items: [a, b]",
                ""));
        BeamlineConfigManager config = BeamlineConfigManager.fromFile(file.toString());

        assertEquals(42, config.getInteger("section", "number"));
        assertEquals(3.5, config.getDouble("section", "text"));
        assertTrue(config.getBoolean("section", "flag"));
        assertNull(config.getInteger("section", "bad"));
        assertEquals(List.of("a", "b"), config.getList("section", "items"));
        assertNotNull(config.getSection("section"));
        assertNull(config.getConfigItem("section", "missing"));
        assertNull(config.getString("section", "number"));

        Set<String[]> missing = config.validateRequiredKeys(Set.of(
                new String[]{"section", "number"}, new String[]{"other"}));
        assertEquals(1, missing.size());
        assertEquals("other", missing.iterator().next()[0]);
    }

    @Test
    void testWriteMetadataAsJson() throws IOException {
        Path out = tempDir.resolve("meta.json");

        BeamlineConfigManager.writeMetadataAsJson(Map.of("numAngles", 160), out);

        String json = Files.readString(out);
        assertTrue(json.contains("\"numAngles\": 160"));
    }
}
