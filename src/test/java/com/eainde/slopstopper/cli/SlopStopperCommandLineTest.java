package com.eainde.slopstopper.cli;

import com.eainde.slopstopper.analysis.AnalysisOrchestrator;
import com.eainde.slopstopper.analysis.BatchSummary;
import com.eainde.slopstopper.analysis.RecordOutcome;
import com.eainde.slopstopper.analysis.Resolution;
import com.eainde.slopstopper.analysis.SelectionPolicy;
import com.eainde.slopstopper.compare.ModelComparator;
import com.eainde.slopstopper.error.FatalPreconditionException;
import com.eainde.slopstopper.ingest.HistoryIngestor;
import com.eainde.slopstopper.ingest.IngestionReport;
import com.eainde.slopstopper.ingest.TakeoutHistoryReader;
import com.eainde.slopstopper.store.RecordStatus;
import com.eainde.slopstopper.store.RecordStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SlopStopperCommandLineTest {

    @Mock
    private TakeoutHistoryReader historyReader;

    @Mock
    private HistoryIngestor ingestor;

    @Mock
    private AnalysisOrchestrator orchestrator;

    @Mock
    private ModelComparator comparator;

    @Mock
    private RecordStore recordStore;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private SlopStopperCommandLine commandLine;

    @BeforeEach
    void setUp() {
        commandLine = new SlopStopperCommandLine(historyReader, ingestor, orchestrator, comparator, recordStore,
                new ObjectMapper(), "data/watch-history.json");
        commandLine.redirect(new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    void shouldIngestFromGivenFile() {
        when(historyReader.read(Path.of("takeout.json"))).thenReturn(List.of());
        when(ingestor.ingest(anyList())).thenReturn(new IngestionReport(3, 2, 0, 0, 1, 0));

        int code = commandLine.execute("ingest", "--file", "takeout.json");

        assertThat(code).isEqualTo(SlopStopperCommandLine.EXIT_OK);
        assertThat(stdout()).contains("inserted=2").contains("skipped=1");
    }

    @Test
    void shouldPassLimitAndWorkersToOrchestrator() {
        when(orchestrator.run(any(SelectionPolicy.class), eq(8))).thenReturn(BatchSummary.aggregate(List.of(
                RecordOutcome.of("aaaaaaaaaaa", Resolution.SCHEMA_VIOLATION, "gemini-2.5-flash",
                        "SchemaViolation: risk_assessment.safety_score value 150 is above maximum 100"))));

        int code = commandLine.execute("analyze", "--limit", "2", "--workers", "8");

        ArgumentCaptor<SelectionPolicy> policy = ArgumentCaptor.forClass(SelectionPolicy.class);
        verify(orchestrator).run(policy.capture(), eq(8));
        assertThat(policy.getValue().mode()).isEqualTo(SelectionPolicy.Mode.LIMIT);
        assertThat(policy.getValue().limit()).isEqualTo(2);
        // per-record errors do not fail the command
        assertThat(code).isEqualTo(SlopStopperCommandLine.EXIT_OK);
        assertThat(stdout()).contains("SCHEMA_VIOLATION").contains("above maximum 100");
    }

    @Test
    void shouldRejectConflictingSelectionWithUsageExitCode() {
        int code = commandLine.execute("analyze", "--limit", "2", "--all");

        assertThat(code).isEqualTo(SlopStopperCommandLine.EXIT_USAGE);
        assertThat(stderr()).contains("mutually exclusive").contains("Usage:");
        verifyNoInteractions(orchestrator);
    }

    @Test
    void shouldRejectZeroLimitWithUsageExitCode() {
        assertThat(commandLine.execute("analyze", "--limit", "0")).isEqualTo(SlopStopperCommandLine.EXIT_USAGE);
    }

    @Test
    void shouldRejectUnknownCommand() {
        assertThat(commandLine.execute("frobnicate")).isEqualTo(SlopStopperCommandLine.EXIT_USAGE);
        assertThat(commandLine.execute()).isEqualTo(SlopStopperCommandLine.EXIT_USAGE);
    }

    @Test
    void shouldExitWithFatalCodeOnPreconditionFailure() {
        when(orchestrator.run(any(SelectionPolicy.class), isNull()))
                .thenThrow(new FatalPreconditionException("GEMINI_API_KEY is not set"));

        int code = commandLine.execute("analyze", "--all");

        assertThat(code).isEqualTo(SlopStopperCommandLine.EXIT_FATAL);
        assertThat(stderr()).contains("FatalPrecondition: GEMINI_API_KEY is not set");
    }

    @Test
    void shouldResetErrors() {
        when(recordStore.resetAllErrors()).thenReturn(4);

        int code = commandLine.execute("reset", "--errors");

        assertThat(code).isEqualTo(SlopStopperCommandLine.EXIT_OK);
        assertThat(stdout()).contains("Reset 4 records to PENDING");
    }

    @Test
    void shouldResetGivenIds() {
        when(recordStore.resetToPending(List.of("aaaaaaaaaaa", "bbbbbbbbbbb"))).thenReturn(1);

        commandLine.execute("reset", "--ids", "aaaaaaaaaaa", "bbbbbbbbbbb");

        assertThat(stdout()).contains("Reset 1 records");
    }

    @Test
    void shouldFailShowForUnknownRecord() {
        when(recordStore.findById("zzzzzzzzzzz")).thenReturn(Optional.empty());

        assertThat(commandLine.execute("show", "zzzzzzzzzzz")).isEqualTo(SlopStopperCommandLine.EXIT_FATAL);
    }

    @Test
    void shouldPrintStatusCounts() {
        Map<RecordStatus, Integer> counts = new EnumMap<>(RecordStatus.class);
        counts.put(RecordStatus.PENDING, 7);
        counts.put(RecordStatus.ANALYZED, 3);
        when(recordStore.countByStatus()).thenReturn(counts);

        commandLine.execute("status");

        assertThat(stdout()).contains("PENDING").contains("7").contains("ANALYZED");
    }

    @Test
    void shouldRequireIdForCompare() {
        assertThat(commandLine.execute("compare")).isEqualTo(SlopStopperCommandLine.EXIT_USAGE);
        verifyNoInteractions(comparator);
    }
}
