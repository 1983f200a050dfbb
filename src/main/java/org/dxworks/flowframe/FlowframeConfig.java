package org.dxworks.flowframe;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class FlowframeConfig {

    private static final Logger log = LoggerFactory.getLogger(FlowframeConfig.class);

    static final String CONFIG_FILE_NAME = "flowframe-config.yml";
    private static final boolean DEFAULT_INCLUDE_LOCATIONS = true;
    private static final boolean DEFAULT_ASSUME_IMPORTED = false;
    private static final Detect DEFAULT_DETECT = Detect.ALL;

    private final boolean includeLocations;
    private final boolean assumeImported;
    private final Detect detect;

    private FlowframeConfig(boolean includeLocations, boolean assumeImported, Detect detect) {
        this.includeLocations = includeLocations;
        this.assumeImported = assumeImported;
        this.detect = detect;
    }

    public boolean isIncludeLocations() {
        return includeLocations;
    }

    public boolean isAssumeImported() {
        return assumeImported;
    }

    public Detect getDetect() {
        return detect;
    }

    public AnalyzerOptions toOptions() {
        return AnalyzerOptions.of(includeLocations, assumeImported, detect);
    }

    public static FlowframeConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static FlowframeConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                boolean effectiveIncludeLocations = yamlConfig.includeLocations != null
                        ? yamlConfig.includeLocations
                        : DEFAULT_INCLUDE_LOCATIONS;
                boolean effectiveAssumeImported = yamlConfig.assumeImported != null
                        ? yamlConfig.assumeImported
                        : DEFAULT_ASSUME_IMPORTED;
                Detect effectiveDetect = yamlConfig.detect != null
                        ? Detect.fromName(yamlConfig.detect)
                        : DEFAULT_DETECT;

                return new FlowframeConfig(effectiveIncludeLocations, effectiveAssumeImported, effectiveDetect);
            }
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Ignoring unreadable config {}: {}", configPath, e.getMessage());
        }

        return defaults();
    }

    public static FlowframeConfig defaults() {
        return new FlowframeConfig(DEFAULT_INCLUDE_LOCATIONS, DEFAULT_ASSUME_IMPORTED, DEFAULT_DETECT);
    }

    public static FlowframeConfig with(boolean includeLocations, boolean assumeImported, Detect detect) {
        return new FlowframeConfig(includeLocations, assumeImported, detect != null ? detect : DEFAULT_DETECT);
    }

    private static class YamlConfig {
        public Boolean includeLocations;
        public Boolean assumeImported;
        public String detect;
    }
}
