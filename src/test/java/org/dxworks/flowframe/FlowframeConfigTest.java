package org.dxworks.flowframe;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class FlowframeConfigTest {

    @Test
    void load_MissingFileGivesDefaults(@TempDir Path dir) {
        FlowframeConfig config = FlowframeConfig.load(dir.resolve(FlowframeConfig.CONFIG_FILE_NAME));

        assertTrue(config.isIncludeLocations());
        assertFalse(config.isAssumeImported());
        assertEquals(Detect.ALL, config.getDetect());
    }

    @Test
    void load_ReadsAllKeys(@TempDir Path dir) throws IOException {
        Path file = write(dir, "includeLocations: false\nassumeImported: true\ndetect: run\n");

        AnalyzerOptions options = FlowframeConfig.load(file).toOptions();

        assertFalse(options.isIncludeLocations());
        assertTrue(options.isAssumeImported());
        assertEquals(Detect.RUN, options.getDetect());
    }

    @Test
    void load_PartialFileKeepsOtherDefaults(@TempDir Path dir) throws IOException {
        FlowframeConfig config = FlowframeConfig.load(write(dir, "assumeImported: true\n"));

        assertTrue(config.isIncludeLocations());
        assertTrue(config.isAssumeImported());
        assertEquals(Detect.ALL, config.getDetect());
    }

    @Test
    void load_UnknownDetectModeFallsBackToDefaults(@TempDir Path dir) throws IOException {
        FlowframeConfig config = FlowframeConfig.load(write(dir, "assumeImported: true\ndetect: everything\n"));

        assertFalse(config.isAssumeImported());
        assertEquals(Detect.ALL, config.getDetect());
    }

    @Test
    void with_NullDetectMeansAll() {
        FlowframeConfig config = FlowframeConfig.with(false, true, null);

        assertEquals(Detect.ALL, config.getDetect());
        assertFalse(config.toOptions().isIncludeLocations());
    }

    @Test
    void detect_FromName() {
        assertEquals(Detect.CREATE_SAGA_WORKFLOW, Detect.fromName("createSagaWorkflow"));
        assertEquals(Detect.ALL, Detect.fromName(null));
        assertThrows(IllegalArgumentException.class, () -> Detect.fromName("saga"));
    }

    private static Path write(Path dir, String yaml) throws IOException {
        return Files.writeString(dir.resolve(FlowframeConfig.CONFIG_FILE_NAME), yaml, StandardCharsets.UTF_8);
    }
}
