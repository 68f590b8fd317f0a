package com.certledger;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class AppLoggerTest {

    @TempDir
    Path tempDir;

    @Test
    void loggingAfterCloseIsIgnored() throws Exception {
        AppLogger.initialize(tempDir.resolve("logs").resolve("ledger.log"), false);
        AppLogger logger = AppLogger.get();
        assertNotNull(logger);

        logger.info("before close");
        logger.close();

        assertDoesNotThrow(() -> {
            logger.info("late shutdown line");
            logger.warn("late warning");
            logger.error("late failure", new IllegalStateException("boom"));
            logger.console("late banner");
            logger.close();
        });
    }
}
