package com.patcharbiter.selector.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.patcharbiter.selector.TestFixtures;
import com.patcharbiter.selector.model.StatisticsRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResultStoreTest {

    @TempDir Path output;

    ResultStore store;

    @BeforeEach
    void setUp() {
        store = new ResultStore(TestFixtures.properties(output), new ObjectMapper());
    }

    @Test
    void savePatch_usesFirstFreeTrialIndex() throws Exception {
        Path first  = store.savePatch("x-1", 2, "+a");
        Path second = store.savePatch("x-1", 2, "+b");

        assertThat(first).isEqualTo(output.resolve("patches/group_2/x-1_1.patch"));
        assertThat(second).isEqualTo(output.resolve("patches/group_2/x-1_2.patch"));
        assertThat(Files.readString(second)).isEqualTo("+b");
    }

    @Test
    void saveStatistics_writesPrettySortedJson() throws Exception {
        Path file = store.saveStatistics(0, new StatisticsRecord("x-1", 3, 1, false, false));

        assertThat(file).isEqualTo(output.resolve("statistics/group_0/x-1.json"));
        String text = Files.readString(file);
        assertThat(text).contains("\n");
        assertThat(text.indexOf("\"instance_id\""))
                .isLessThan(text.indexOf("\"is_all_failed\""));
        assertThat(text.indexOf("\"is_all_failed\""))
                .isLessThan(text.indexOf("\"is_all_success\""));
        assertThat(text.indexOf("\"is_success\""))
                .isLessThan(text.indexOf("\"patch_id\""));
        assertThat(new ObjectMapper().readTree(text).path("patch_id").asInt()).isEqualTo(3);
        try (var leftovers = Files.list(file.getParent())) {
            assertThat(leftovers).containsExactly(file);
        }
    }

    @Test
    void saveResult_writesPatchAndCheckpoint() throws Exception {
        store.saveResult("x-1", 0, "+a", StatisticsRecord.allSuccess("x-1"));

        assertThat(Files.readString(output.resolve("patches/group_0/x-1_1.patch"))).isEqualTo("+a");
        assertThat(store.statisticsExist("x-1", 0)).isTrue();
    }

    @Test
    void saveResult_checkpointFails_removesPatchSoRetryReusesIndex() throws Exception {
        // A non-empty directory where the statistics file belongs makes the final move fail.
        Path blocker = output.resolve("statistics/group_0/x-1.json/blocker");
        Files.createDirectories(blocker);

        assertThatThrownBy(() -> store.saveResult("x-1", 0, "+a", StatisticsRecord.allSuccess("x-1")))
                .isInstanceOf(UncheckedIOException.class);
        assertThat(output.resolve("patches/group_0/x-1_1.patch")).doesNotExist();

        Files.delete(blocker);
        Files.delete(blocker.getParent());
        store.saveResult("x-1", 0, "+a", StatisticsRecord.allSuccess("x-1"));

        assertThat(output.resolve("patches/group_0/x-1_1.patch")).exists();
        assertThat(output.resolve("patches/group_0/x-1_2.patch")).doesNotExist();
    }

    @Test
    void statisticsExist_onlyForNonEmptyFile() throws Exception {
        assertThat(store.statisticsExist("x-1", 0)).isFalse();

        Path file = store.statisticsFile("x-1", 0);
        Files.createDirectories(file.getParent());
        Files.createFile(file);
        assertThat(store.statisticsExist("x-1", 0)).isFalse();

        store.saveStatistics(0, StatisticsRecord.allFailed("x-1"));
        assertThat(store.statisticsExist("x-1", 0)).isTrue();
        assertThat(store.statisticsExist("x-1", 1)).isFalse();
    }

    @Test
    void trajectoryFile_skipsExistingTrials() throws Exception {
        Path first = store.trajectoryFile("x-1", 1, 0);
        assertThat(first).isEqualTo(output.resolve("trajectories/group_1/x-1_voting_0_trail_1.json"));
        assertThat(first).doesNotExist();

        Files.writeString(first, "{}");
        assertThat(store.trajectoryFile("x-1", 1, 0).getFileName().toString())
                .isEqualTo("x-1_voting_0_trail_2.json");
        assertThat(store.trajectoryFile("x-1", 1, 1).getFileName().toString())
                .isEqualTo("x-1_voting_1_trail_1.json");
    }
}
