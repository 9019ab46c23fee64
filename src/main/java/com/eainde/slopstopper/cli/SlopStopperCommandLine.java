package com.eainde.slopstopper.cli;

import com.eainde.slopstopper.analysis.AnalysisOrchestrator;
import com.eainde.slopstopper.analysis.BatchSummary;
import com.eainde.slopstopper.analysis.RecordOutcome;
import com.eainde.slopstopper.analysis.SelectionPolicy;
import com.eainde.slopstopper.compare.ComparisonReport;
import com.eainde.slopstopper.compare.ModelComparator;
import com.eainde.slopstopper.error.FatalPreconditionException;
import com.eainde.slopstopper.ingest.HistoryIngestor;
import com.eainde.slopstopper.ingest.IngestionReport;
import com.eainde.slopstopper.ingest.TakeoutHistoryReader;
import com.eainde.slopstopper.store.RecordStatus;
import com.eainde.slopstopper.store.RecordStore;
import com.eainde.slopstopper.store.VideoRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Operator entry point. Exit codes: 0 success (per-record errors included), 1 fatal precondition,
 * 2 usage error.
 */
@Slf4j
@Component
public class SlopStopperCommandLine implements CommandLineRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_FATAL = 1;
    static final int EXIT_USAGE = 2;

    static final String USAGE = """
            Usage:
              ingest [--file <watch-history.json>]
              analyze (--ids <id...> | --limit <N> | --all) [--workers <N>]
              reset (--ids <id...> | --errors)
              compare <id> [--model-a <model>] [--model-b <model>]
              show <id>
              status
            """;

    private final TakeoutHistoryReader historyReader;
    private final HistoryIngestor ingestor;
    private final AnalysisOrchestrator orchestrator;
    private final ModelComparator comparator;
    private final RecordStore recordStore;
    private final ObjectMapper objectMapper;
    private final String defaultHistoryFile;

    private PrintStream out = System.out;
    private PrintStream err = System.err;
    private int exitCode = EXIT_OK;

    public SlopStopperCommandLine(TakeoutHistoryReader historyReader,
                                  HistoryIngestor ingestor,
                                  AnalysisOrchestrator orchestrator,
                                  ModelComparator comparator,
                                  RecordStore recordStore,
                                  ObjectMapper objectMapper,
                                  @Value("${slopstopper.ingest.history-file:data/watch-history.json}") String defaultHistoryFile) {
        this.historyReader = historyReader;
        this.ingestor = ingestor;
        this.orchestrator = orchestrator;
        this.comparator = comparator;
        this.recordStore = recordStore;
        this.objectMapper = objectMapper;
        this.defaultHistoryFile = defaultHistoryFile;
    }

    void redirect(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    @Override
    public void run(String... args) {
        exitCode = execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    int execute(String... args) {
        try {
            CliArguments arguments = CliArguments.parse(args);
            String command = arguments.command()
                    .orElseThrow(() -> new CommandLineUsageException("no command given"));
            switch (command) {
                case "ingest" -> ingest(arguments);
                case "analyze" -> analyze(arguments);
                case "reset" -> reset(arguments);
                case "compare" -> compare(arguments);
                case "show" -> show(arguments);
                case "status" -> status();
                default -> throw new CommandLineUsageException("unknown command '" + command + "'");
            }
            return EXIT_OK;
        } catch (CommandLineUsageException | IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            err.print(USAGE);
            return EXIT_USAGE;
        } catch (FatalPreconditionException e) {
            log.error("Aborted: {}", e.getMessage());
            err.println(e.toErrorDetail());
            return EXIT_FATAL;
        } catch (UncheckedIOException | DataAccessException e) {
            log.error("Aborted", e);
            err.println("FatalPrecondition: " + e.getMessage());
            return EXIT_FATAL;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            err.println("Interrupted");
            return EXIT_FATAL;
        }
    }

    private void ingest(CliArguments arguments) {
        Path file = Path.of(arguments.value("file").orElse(defaultHistoryFile));
        IngestionReport report = ingestor.ingest(historyReader.read(file));
        out.printf("Ingested %d entries from %s: inserted=%d, updated=%d, unchanged=%d, skipped=%d, duplicates=%d%n",
                report.entries(), file, report.inserted(), report.updated(), report.unchanged(),
                report.skipped(), report.duplicates());
    }

    private void analyze(CliArguments arguments) {
        String mode = arguments.exactlyOneOf("ids", "limit", "all");
        SelectionPolicy policy = switch (mode) {
            case "ids" -> SelectionPolicy.ids(arguments.values("ids"));
            case "limit" -> SelectionPolicy.limit(arguments.intValue("limit").orElseThrow(
                    () -> new CommandLineUsageException("--limit takes exactly one value")));
            default -> SelectionPolicy.all();
        };
        Integer workers = arguments.intValue("workers").orElse(null);

        Thread cancelHook = new Thread(orchestrator::cancel, "analysis-cancel");
        Runtime.getRuntime().addShutdownHook(cancelHook);
        BatchSummary summary;
        try {
            summary = orchestrator.run(policy, workers);
        } finally {
            removeHook(cancelHook);
        }

        for (RecordOutcome outcome : summary.getOutcomes()) {
            out.printf("%-24s %-22s %s%n", outcome.videoId(), outcome.resolution(),
                    outcome.detail() != null ? outcome.detail() : describeCost(outcome));
        }
        out.printf("Processed %d records: %s; tokens in=%d out=%d; estimated cost $%s%n",
                summary.getTotalCount(), summary.getCounts(), summary.getTotalInputTokens(),
                summary.getTotalOutputTokens(), summary.getTotalCost().toPlainString());
    }

    private void reset(CliArguments arguments) {
        String mode = arguments.exactlyOneOf("ids", "errors");
        int count = mode.equals("ids")
                ? recordStore.resetToPending(arguments.values("ids"))
                : recordStore.resetAllErrors();
        out.printf("Reset %d records to PENDING%n", count);
    }

    private void compare(CliArguments arguments) throws InterruptedException {
        String videoId = arguments.requiredPositional("id");
        ComparisonReport report = comparator.compare(videoId,
                arguments.value("model-a").orElse(null),
                arguments.value("model-b").orElse(null));

        out.printf("Comparison for %s (%s)%n", report.videoId(), report.title());
        printSide(report.a());
        printSide(report.b());
        if (report.judge() != null) {
            out.printf("Judge (%s): winner=%s, action=%s%n  %s%n", report.judge().judgeModel(),
                    report.judge().winner(), report.judge().reconciledAction(), report.judge().reasoning());
        } else {
            out.printf("Judge: no verdict (%s)%n", report.judgeError());
        }
    }

    private void printSide(ComparisonReport.Side side) {
        if (!side.succeeded()) {
            out.printf("  %s [%s] failed: %s%n", side.label(), side.requestedModel(), side.error());
            return;
        }
        out.printf("  %s [%s] safety=%d genre=%s slop=%s brainrot=%s action=%s cost=%s%n",
                side.label(), side.pass().modelUsed(),
                side.pass().verdict().safetyScore(), side.pass().verdict().primaryGenre(),
                side.pass().verdict().slop(), side.pass().verdict().brainrot(),
                side.pass().verdict().verdictAction(),
                side.cost() != null ? side.cost().toPlainString() : "n/a");
    }

    private void show(CliArguments arguments) {
        String videoId = arguments.requiredPositional("id");
        VideoRecord record = recordStore.findById(videoId)
                .orElseThrow(() -> new FatalPreconditionException("no record with id '" + videoId + "'"));

        out.printf("%s  %s%n", record.id(), record.title());
        out.printf("  channel: %s (%s)%n", record.channelName(), record.channelId());
        out.printf("  url: %s, watched at %s%n", record.url(), record.watchedAt());
        out.printf("  status: %s%n", record.status());
        if (record.status() == RecordStatus.SKIPPED) {
            out.printf("  skip reason: %s%n", record.skipReason());
        }
        if (record.errorDetail() != null) {
            out.printf("  error: %s%n", record.errorDetail());
        }
        if (record.status() == RecordStatus.ANALYZED) {
            out.printf("  model %s, schema %s, tokens in=%d out=%d, cost $%s%n",
                    record.modelUsed(), record.schemaVersion(), record.inputTokens(), record.outputTokens(),
                    record.estimatedCost().toPlainString());
            out.printf("  safety=%d genre=%s slop=%s brainrot=%s short=%s action=%s%n",
                    record.safetyScore(), record.primaryGenre(), record.slop(), record.brainrot(),
                    record.isShort(), record.verdictAction());
            out.println(prettyPrint(record.analysisPayload()));
        }
    }

    private void status() {
        Map<RecordStatus, Integer> counts = recordStore.countByStatus();
        counts.forEach((status, count) -> out.printf("%-12s %d%n", status, count));
    }

    private String prettyPrint(String json) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            log.debug("Stored payload is not valid JSON, printing raw", e);
            return json;
        }
    }

    private static String describeCost(RecordOutcome outcome) {
        if (outcome.modelUsed() == null) {
            return "";
        }
        return outcome.modelUsed() + " in=" + outcome.inputTokens() + " out=" + outcome.outputTokens()
                + " $" + outcome.estimatedCost().toPlainString();
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // JVM is already shutting down; the hook has run
            log.debug("Shutdown in progress, cancel hook left registered");
        }
    }
}
