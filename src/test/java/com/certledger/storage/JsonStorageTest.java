package com.certledger.storage;

import com.certledger.models.Reservation;
import com.certledger.models.Tier;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class JsonStorageTest {

    @TempDir
    Path tempDir;

    @Test
    void missingFilesReadAsEmpty() throws Exception {
        Path missing = tempDir.resolve("nothing.json");
        assertTrue(JsonStorage.readJsonList(missing, Reservation[].class).isEmpty());
        assertNull(JsonStorage.readJson(missing, Reservation.class));
    }

    @Test
    void overwriteReplacesContentWithoutLeavingTempFiles() throws Exception {
        Path path = tempDir.resolve("nested").resolve("journal.json");
        JsonStorage.writeJsonList(path, List.of(new Reservation("c-1", 0, Tier.GOLD, 2_000, 1L)));
        JsonStorage.writeJsonList(path, List.of(
            new Reservation("c-2", 1, Tier.BRONZE, 50, 2L),
            new Reservation("c-3", 1, Tier.SILVER, 250, 3L)));

        List<Reservation> stored = JsonStorage.readJsonList(path, Reservation[].class);

        assertEquals(2, stored.size());
        assertEquals("c-2", stored.get(0).getContributionId());
        assertEquals(Tier.SILVER, stored.get(1).getTier());
        try (Stream<Path> files = Files.list(path.getParent())) {
            assertEquals(1, files.count());
        }
    }

    @Test
    void unknownPropertiesAreIgnored() throws Exception {
        Path path = tempDir.resolve("reservation.json");
        Files.writeString(path, "{\"contributionId\":\"c-9\",\"amount\":12,\"legacyField\":\"x\"}");

        Reservation reservation = JsonStorage.readJson(path, Reservation.class);

        assertEquals("c-9", reservation.getContributionId());
        assertEquals(12L, reservation.getAmount());
    }
}
