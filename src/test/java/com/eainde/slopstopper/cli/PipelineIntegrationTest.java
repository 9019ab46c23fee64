package com.eainde.slopstopper.cli;

import com.eainde.slopstopper.store.RecordStatus;
import com.eainde.slopstopper.store.RecordStore;
import com.eainde.slopstopper.store.VideoRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Whole application in mock provider mode against an in-memory store.
 */
@SpringBootTest(
        args = "status",
        properties = {
                "slopstopper.provider.mode=mock",
                "slopstopper.store.url=jdbc:h2:mem:pipeline-it;DB_CLOSE_DELAY=-1",
                "slopstopper.provider.initial-backoff=10ms"
        })
class PipelineIntegrationTest {

    private static final String HISTORY = """
            [
              {
                "header": "YouTube",
                "title": "Watched How rockets land",
                "titleUrl": "https://www.youtube.com/watch?v=aaaaaaaaaaa",
                "subtitles": [{"name": "Space Lab", "url": "https://www.youtube.com/channel/UCaaaaaaaaaaaaaaaaaaaaaa"}],
                "time": "2025-01-10T12:00:00.000Z"
              },
              {
                "header": "YouTube",
                "title": "Watched a video that has been removed",
                "time": "2025-01-09T08:00:00.000Z"
              }
            ]
            """;

    @Autowired
    private SlopStopperCommandLine commandLine;

    @Autowired
    private RecordStore recordStore;

    @Test
    void shouldIngestAnalyzeAndShowInMockMode(@TempDir Path dir) throws Exception {
        Path history = dir.resolve("watch-history.json");
        Files.writeString(history, HISTORY);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        commandLine.redirect(new PrintStream(out, true, StandardCharsets.UTF_8), System.err);

        assertThat(commandLine.execute("ingest", "--file", history.toString())).isZero();
        assertThat(commandLine.execute("analyze", "--all")).isZero();
        assertThat(commandLine.execute("show", "aaaaaaaaaaa")).isZero();

        VideoRecord record = recordStore.findById("aaaaaaaaaaa").orElseThrow();
        assertThat(record.status()).isEqualTo(RecordStatus.ANALYZED);
        assertThat(record.modelUsed()).isEqualTo("mock");
        assertThat(record.estimatedCost()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(record.primaryGenre()).isEqualTo("Education_STEM");
        assertThat(recordStore.countByStatus()).containsEntry(RecordStatus.SKIPPED, 1);
        assertThat(out.toString(StandardCharsets.UTF_8))
                .contains("inserted=1")
                .contains("ANALYZED")
                .contains("How rockets land");
    }
}
