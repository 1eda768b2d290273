package gsecars.tomoxrd.utilities;

import com.google.gson.GsonBuilder;
import gsecars.tomoxrd.model.GeometryPositions;
import gsecars.tomoxrd.model.PathMapping;
import gsecars.tomoxrd.model.PvNames;
import gsecars.tomoxrd.model.TimingSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.FileWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.Writer;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * BeamlineConfigManager
 *
 * <p>Loads and queries the beamline YAML configuration:
 *   - Parses nested YAML into a Map<String,Object>.
 *   - Offers type safe getters (getDouble, getSection, getList, etc.).
 *   - Validates required keys and reports missing paths.
 *   - Builds the typed settings (PV names, geometry, timing, path mapping) used by the controllers.
 *
 * <p>Values missing from the file fall back to the 13-BM-D defaults.</p>
 */
public class BeamlineConfigManager {
    private static final Logger logger = LoggerFactory.getLogger(BeamlineConfigManager.class);

    /** Name of the configuration bundled on the classpath. */
    public static final String DEFAULT_RESOURCE = "tomoxrd_config.yml";

    private final Map<String, Object> configData;
    private final String source;

    private BeamlineConfigManager(Map<String, Object> configData, String source) {
        this.configData = configData;
        this.source = source;
    }

    /**
     * Loads a YAML file from disk.
     *
     * @param configPath Filesystem path to the beamline YAML configuration file.
     */
    public static BeamlineConfigManager fromFile(String configPath) {
        return new BeamlineConfigManager(loadConfig(configPath), configPath);
    }

    /**
     * Loads the bundled {@value #DEFAULT_RESOURCE}.
     */
    public static BeamlineConfigManager fromClasspath() {
        return fromClasspath(DEFAULT_RESOURCE);
    }

    @SuppressWarnings("unchecked")
    public static BeamlineConfigManager fromClasspath(String resource) {
        Map<String, Object> data = new LinkedHashMap<>();
        try (InputStream in = BeamlineConfigManager.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                logger.error("YAML resource not found on classpath: {}", resource);
            } else {
                Object loaded = new Yaml().load(in);
                if (loaded instanceof Map) {
                    data.putAll((Map<String, Object>) loaded);
                } else {
                    logger.error("YAML root is not a map: {}", resource);
                }
            }
        } catch (Exception e) {
            logger.error("Error parsing YAML resource: {}", resource, e);
        }
        return new BeamlineConfigManager(data, "classpath:" + resource);
    }

    /**
     * Loads a YAML file into a Map.
     *
     * @param path Filesystem path to the YAML file.
     * @return Map of YAML data, or empty map on error.
     */
    @SuppressWarnings("unchecked")
    private static Map<String, Object> loadConfig(String path) {
        Yaml yaml = new Yaml();
        try (InputStream in = new FileInputStream(path)) {
            Object loaded = yaml.load(in);
            if (loaded instanceof Map) {
                return new LinkedHashMap<>((Map<String, Object>) loaded);
            } else {
                logger.error("YAML root is not a map: {}", path);
            }
        } catch (FileNotFoundException e) {
            logger.error("YAML file not found: {}", path, e);
        } catch (Exception e) {
            logger.error("Error parsing YAML: {}", path, e);
        }
        return new LinkedHashMap<>();
    }

    public String getSource() {
        return source;
    }

    public Map<String, Object> getAllConfig() {
        return Collections.unmodifiableMap(configData);
    }

    /**
     * Retrieve a nested value.
     *
     * @param keys Sequence of keys (e.g., "motors", "rotation").
     * @return The value at the end of the key path, or null if not found.
     */
    public Object getConfigItem(String... keys) {
        Object current = configData;
        for (String key : keys) {
            if (current instanceof Map<?, ?> map && map.containsKey(key)) {
                current = map.get(key);
            } else {
                return null;
            }
        }
        return current;
    }

    public String getString(String... keys) {
        Object v = getConfigItem(keys);
        return (v instanceof String) ? (String) v : null;
    }

    public Integer getInteger(String... keys) {
        Object v = getConfigItem(keys);
        if (v instanceof Number n) return n.intValue();
        try {
            return (v != null) ? Integer.parseInt(v.toString()) : null;
        } catch (NumberFormatException e) {
            logger.warn("Expected int at {} but got {}", String.join("/", keys), v);
            return null;
        }
    }

    public Double getDouble(String... keys) {
        Object v = getConfigItem(keys);
        if (v instanceof Number n) return n.doubleValue();
        try {
            return (v != null) ? Double.parseDouble(v.toString()) : null;
        } catch (NumberFormatException e) {
            logger.warn("Expected double at {} but got {}", String.join("/", keys), v);
            return null;
        }
    }

    public Boolean getBoolean(String... keys) {
        Object v = getConfigItem(keys);
        if (v instanceof Boolean b) return b;
        return v != null && Boolean.parseBoolean(v.toString());
    }

    @SuppressWarnings("unchecked")
    public List<Object> getList(String... keys) {
        Object v = getConfigItem(keys);
        return (v instanceof List<?>) ? (List<Object>) v : null;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> getSection(String... keys) {
        Object v = getConfigItem(keys);
        return (v instanceof Map<?, ?>) ? (Map<String, Object>) v : null;
    }

    /**
     * Validates that each of the provided key paths exists.
     *
     * @param requiredPaths Set of String[] representing nested key paths.
     * @return Set of missing paths (empty if all are present).
     */
    public Set<String[]> validateRequiredKeys(Set<String[]> requiredPaths) {
        Set<String[]> missing = new LinkedHashSet<>();
        for (String[] path : requiredPaths) {
            if (getConfigItem(path) == null) missing.add(path);
        }
        if (!missing.isEmpty()) {
            logger.error("Missing required configuration keys: {}",
                    missing.stream()
                            .map(p -> String.join("/", p))
                            .collect(Collectors.toList())
            );
        }
        return missing;
    }

    /**
     * Validate that all required configuration sections exist.
     * Returns list of missing sections.
     */
    public List<String> validateConfiguration() {
        List<String> missing = new ArrayList<>();

        String[] required = {"detector", "pso", "motors", "geometry"};
        for (String section : required) {
            if (getSection(section) == null) {
                missing.add(section);
            }
        }
        if (getString("shutter") == null) {
            missing.add("shutter");
        }
        String[] motors = {"rotation", "horizontal", "vertical", "focus", "detector_x", "detector_z"};
        for (String motor : motors) {
            if (getSection("motors") != null && getString("motors", motor) == null) {
                missing.add("motors." + motor);
            }
        }

        if (!missing.isEmpty()) {
            logger.error("Configuration validation failed. Missing: {}", missing);
        } else {
            logger.info("Configuration validation passed");
        }
        return missing;
    }

    // ==================== Typed settings ====================

    public PvNames getPvNames() {
        PvNames d = PvNames.defaults();
        List<Object> allStop = getList("allstop");
        List<String> stops = allStop == null
                ? d.allStop()
                : allStop.stream().map(Object::toString).collect(Collectors.toList());
        return new PvNames(
                stringOr(d.camPrefix(), "detector", "cam_prefix"),
                stringOr(d.tiffPrefix(), "detector", "tiff_prefix"),
                stringOr(d.procPrefix(), "detector", "proc_prefix"),
                stringOr(d.psoPrefix(), "pso", "prefix"),
                stringOr(d.rotationMotor(), "motors", "rotation"),
                stringOr(d.horizontalMotor(), "motors", "horizontal"),
                stringOr(d.verticalMotor(), "motors", "vertical"),
                stringOr(d.focusMotor(), "motors", "focus"),
                stringOr(d.detectorXMotor(), "motors", "detector_x"),
                stringOr(d.detectorZMotor(), "motors", "detector_z"),
                stringOr(d.shutter(), "shutter"),
                stops);
    }

    public GeometryPositions getGeometryPositions() {
        GeometryPositions d = GeometryPositions.defaults();
        return new GeometryPositions(
                doubleOr(d.tomoX(), "geometry", "tomo_x"),
                doubleOr(d.tomoZ(), "geometry", "tomo_z"),
                doubleOr(d.xrdX(), "geometry", "xrd_x"),
                doubleOr(d.xrdZ(), "geometry", "xrd_z"),
                doubleOr(d.detectorOut(), "geometry", "detector_out"));
    }

    public TimingSettings getTimingSettings() {
        TimingSettings d = TimingSettings.defaults();
        return new TimingSettings(
                millisOr(d.settle(), "timing", "settle_ms"),
                millisOr(d.pollInterval(), "timing", "poll_interval_ms"),
                millisOr(d.elapsedInterval(), "timing", "elapsed_interval_ms"),
                millisOr(d.geometrySettle(), "timing", "geometry_settle_ms"),
                secondsOr(d.moveTimeout(), "timing", "move_timeout_s"),
                secondsOr(d.returnTimeout(), "timing", "return_timeout_s"),
                secondsOr(d.ackTimeout(), "timing", "ack_timeout_s"));
    }

    public PathMapping getPathMapping() {
        String userBase = getString("paths", "user_base");
        String detectorBase = getString("paths", "detector_base");
        if (userBase == null || detectorBase == null) {
            return PathMapping.identity();
        }
        return new PathMapping(userBase, detectorBase);
    }

    /**
     * Writes the provided metadata map out as pretty-printed JSON for record-keeping.
     *
     * @param metadata   Map of properties to serialize.
     * @param outputPath Target JSON file path.
     * @throws IOException On write error.
     */
    public static void writeMetadataAsJson(Object metadata, Path outputPath) throws IOException {
        try (Writer w = new FileWriter(outputPath.toFile())) {
            new GsonBuilder().setPrettyPrinting().create().toJson(metadata, w);
        }
    }

    private String stringOr(String fallback, String... keys) {
        String v = getString(keys);
        return v != null ? v : fallback;
    }

    private double doubleOr(double fallback, String... keys) {
        Double v = getDouble(keys);
        return v != null ? v : fallback;
    }

    private Duration millisOr(Duration fallback, String... keys) {
        Integer v = getInteger(keys);
        return v != null ? Duration.ofMillis(v) : fallback;
    }

    private Duration secondsOr(Duration fallback, String... keys) {
        Integer v = getInteger(keys);
        return v != null ? Duration.ofSeconds(v) : fallback;
    }
}
