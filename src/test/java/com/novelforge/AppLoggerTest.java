package com.novelforge;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class AppLoggerTest {

    @TempDir
    Path dir;

    @Test
    void smallLogIsKeptInPlace() throws Exception {
        Path log = dir.resolve("novel-forge.log");
        Files.writeString(log, "[INFO] started");

        AppLogger.rotateIfLarge(log);

        assertTrue(Files.exists(log));
        assertFalse(Files.exists(dir.resolve("novel-forge.log.1")));
    }

    @Test
    void oversizedLogMovesAside() throws Exception {
        Path log = dir.resolve("novel-forge.log");
        Files.write(log, new byte[(int) AppLogger.ROTATE_BYTES + 1]);

        AppLogger.rotateIfLarge(log);

        assertFalse(Files.exists(log));
        assertEquals(AppLogger.ROTATE_BYTES + 1, Files.size(dir.resolve("novel-forge.log.1")));
    }

    @Test
    void uninitializedLoggerStillLogs() {
        AppLogger logger = AppLogger.get();
        assertNotNull(logger);
        logger.debug("dropped unless debug is on");
        logger.info("console only");
    }
}
