package de.bsommerfeld.replyradar.core.util;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class StorageUtilsTest {

    @Test
    void getAppDataDir_shouldContainAppName() {
        Path dir = StorageUtils.getAppDataDir("test-app");
        assertTrue(dir.toString().contains("test-app"));
    }

    @Test
    void getLogsDir_shouldBeSubdirectoryOfAppData() {
        Path appDir = StorageUtils.getAppDataDir("test-app");
        assertEquals(appDir.resolve("logs"), StorageUtils.getLogsDir("test-app"));
    }

    @Test
    void getConfigFile_shouldBeTomlInAppData() {
        Path appDir = StorageUtils.getAppDataDir("test-app");
        assertEquals(appDir.resolve("config.toml"), StorageUtils.getConfigFile("test-app"));
    }
}
