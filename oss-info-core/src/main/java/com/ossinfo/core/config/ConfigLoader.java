package com.ossinfo.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Finds and reads {@code ossinfo.yaml}.
 *
 * <p>Without an explicit path the file is looked up next to the dependency report first, so a
 * report checked into a project directory picks up that project's repositories, then in the
 * working directory. Whatever goes wrong while reading, the result is a usable configuration:
 * absent values fall back to {@link OssInfoConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * OssInfoConfig config = ConfigLoader.load(null, Paths.get("build/dependencies.txt"));
 * int workers = config.http().concurrency();
 * }</pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    public static final String DEFAULT_FILE_NAME = "ossinfo.yaml";

    private ConfigLoader() {
    }

    /**
     * Loads the explicit configuration file, or the one found by {@link #locate(Path)}.
     *
     * @param explicitPath path given by the user, may be null
     * @param reportFile dependency report being read, null for standard input
     * @return loaded configuration or defaults if unavailable
     */
    public static OssInfoConfig load(Path explicitPath, Path reportFile) {
        return load(explicitPath != null ? explicitPath : locate(reportFile));
    }

    /**
     * Returns where the configuration is expected when none was given: {@code ossinfo.yaml}
     * in the report's directory if that file exists, otherwise in the working directory.
     *
     * @param reportFile dependency report being read, null for standard input
     * @return candidate configuration path, not necessarily existing
     */
    public static Path locate(Path reportFile) {
        if (reportFile != null) {
            Path directory = reportFile.toAbsolutePath().getParent();
            if (directory != null) {
                Path sibling = directory.resolve(DEFAULT_FILE_NAME);
                if (Files.isRegularFile(sibling)) {
                    log.debug("Using configuration next to report: {}", sibling);
                    return sibling;
                }
            }
        }
        return Paths.get(DEFAULT_FILE_NAME);
    }

    /**
     * Loads configuration from a YAML file.
     *
     * <p>A missing file is normal and yields defaults silently; an unreadable, empty or
     * invalid one yields defaults with a warning.
     *
     * @param configPath path to {@code ossinfo.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static OssInfoConfig load(Path configPath) {
        if (Files.notExists(configPath)) {
            log.debug("No {} at {}, using defaults", DEFAULT_FILE_NAME, configPath.toAbsolutePath());
            return OssInfoConfig.defaults();
        }
        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Cannot read configuration {}, using defaults", configPath);
            return OssInfoConfig.defaults();
        }

        OssInfoConfig config;
        try {
            config = YAML_MAPPER.readValue(configPath.toFile(), OssInfoConfig.class);
        } catch (IOException e) {
            log.warn("Invalid configuration {}, using defaults: {}", configPath, e.getMessage());
            return OssInfoConfig.defaults();
        }
        if (config == null) {
            log.warn("Configuration {} is empty, using defaults", configPath);
            return OssInfoConfig.defaults();
        }

        log.info("Loaded configuration from {}: central={}, google={}, concurrency={}",
            configPath, config.repositories().central(), config.repositories().google(),
            config.http().concurrency());
        return config;
    }
}
