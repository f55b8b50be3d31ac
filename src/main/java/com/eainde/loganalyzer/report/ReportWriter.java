package com.eainde.loganalyzer.report;

import com.eainde.loganalyzer.model.Finding;
import com.eainde.loganalyzer.model.LogLevel;
import com.eainde.loganalyzer.model.Report;
import com.eainde.loganalyzer.model.ReportSummary;
import com.eainde.loganalyzer.model.RootCauseSummary;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.ToIntFunction;
import java.util.stream.Collectors;

/**
 * Builds the {@link Report} for a run and writes it as JSON and Markdown.
 *
 * <p>Both artifacts are first staged as temporary files in the output directory and then moved
 * onto their final names, atomically where the file system allows it. A failure at any point
 * removes the staged files and leaves the final paths untouched.</p>
 */
@Slf4j
public class ReportWriter {

    static final int TOP_SIGNATURES = 3;

    private final ObjectMapper objectMapper;
    private final Path outputDir;
    private final String jsonFileName;
    private final String markdownFileName;
    private final int topRootCauses;
    private final Clock clock;

    public ReportWriter(ObjectMapper objectMapper,
                        Path outputDir,
                        String jsonFileName,
                        String markdownFileName,
                        int topRootCauses,
                        Clock clock) {
        this.objectMapper = objectMapper;
        this.outputDir = outputDir;
        this.jsonFileName = jsonFileName;
        this.markdownFileName = markdownFileName;
        this.topRootCauses = topRootCauses;
        this.clock = clock;
    }

    public Path jsonPath() {
        return outputDir.resolve(jsonFileName);
    }

    public Path markdownPath() {
        return outputDir.resolve(markdownFileName);
    }

    /**
     * @throws ReportWriteException when either artifact cannot be written
     */
    public Report write(List<Finding> findings, List<String> sourceFiles) {
        Report report = new Report(Instant.now(clock), sourceFiles, findings, summarize(findings));

        Map<Path, String> artifacts = new LinkedHashMap<>();
        artifacts.put(jsonPath(), toJson(report));
        artifacts.put(markdownPath(), renderMarkdown(report));
        writeAtomically(artifacts);

        log.info("Wrote {} findings to {} and {}", findings.size(), jsonPath(), markdownPath());
        return report;
    }

    // =========================================================================
    //  Summary
    // =========================================================================

    ReportSummary summarize(List<Finding> findings) {
        int total = findings.stream().mapToInt(Finding::totalEvents).sum();
        int errors = sumLevel(findings, LogLevel.ERROR);
        int warns = sumLevel(findings, LogLevel.WARN);
        int infos = sumLevel(findings, LogLevel.INFO);
        double errorRate = total == 0 ? 0.0 : (double) errors / total;

        List<String> topSignatures = topSignatures(findings);
        StringBuilder narrative = new StringBuilder(String.format(Locale.ROOT,
                "%d events -> %d errors, %d warnings, %d info (error rate %.0f%%).",
                total, errors, warns, infos, errorRate * 100));
        if (errors > 0 && !topSignatures.isEmpty()) {
            narrative.append(" Top errors: ").append(String.join(", ", topSignatures)).append('.');
        }

        return new ReportSummary(total, errorRate, errors, warns, infos,
                topRootCauses(findings), topSignatures, narrative.toString());
    }

    private List<RootCauseSummary> topRootCauses(List<Finding> findings) {
        Map<String, List<Finding>> byCause = findings.stream()
                .collect(Collectors.groupingBy(Finding::probableRootCause, LinkedHashMap::new, Collectors.toList()));

        return byCause.entrySet().stream()
                .map(e -> new RootCauseSummary(
                        e.getKey(),
                        e.getValue().stream().mapToInt(Finding::totalEvents).sum(),
                        e.getValue().stream().map(Finding::signatureRef).collect(Collectors.toList())))
                .sorted(Comparator.comparingInt(RootCauseSummary::totalEvents).reversed()
                        .thenComparing(RootCauseSummary::probableRootCause))
                .limit(Math.max(0, topRootCauses))
                .collect(Collectors.toList());
    }

    /** Error-bearing signatures first, then warnings, then info, each by descending level count. */
    private static List<String> topSignatures(List<Finding> findings) {
        List<String> top = new ArrayList<>();
        for (LogLevel level : List.of(LogLevel.ERROR, LogLevel.WARN, LogLevel.INFO)) {
            ToIntFunction<Finding> byLevel = f -> f.levelCount(level);
            findings.stream()
                    .filter(f -> f.levelCount(level) > 0)
                    .sorted(Comparator.comparingInt(byLevel).reversed())
                    .map(Finding::signatureRef)
                    .filter(s -> !top.contains(s))
                    .forEach(top::add);
            if (top.size() >= TOP_SIGNATURES) {
                break;
            }
        }
        return top.size() > TOP_SIGNATURES ? new ArrayList<>(top.subList(0, TOP_SIGNATURES)) : top;
    }

    private static int sumLevel(List<Finding> findings, LogLevel level) {
        return findings.stream().mapToInt(f -> f.levelCount(level)).sum();
    }

    // =========================================================================
    //  Rendering
    // =========================================================================

    private String toJson(Report report) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new ReportWriteException(jsonPath(), e);
        }
    }

    String renderMarkdown(Report report) {
        ReportSummary summary = report.summary();
        StringBuilder md = new StringBuilder();
        md.append("# Log Analysis Summary\n\n");
        md.append("Generated at ").append(report.generatedAt())
                .append(" from ").append(report.sourceFiles().size()).append(" source file(s)");
        if (!report.sourceFiles().isEmpty()) {
            md.append(": ").append(String.join(", ", report.sourceFiles()));
        }
        md.append(".\n\n");
        md.append(String.format(Locale.ROOT, "**Total events:** %d | **Error rate:** %s | **Groups:** %d%n%n",
                summary.totalEvents(), percent(summary.overallErrorRate()), report.findings().size()));
        md.append(summary.shortSummary()).append("\n\n");

        md.append("| # | Signature | Count | Error rate | Severity | Probable root cause |\n");
        md.append("|---|-----------|------:|-----------:|----------|---------------------|\n");
        int row = 1;
        for (Finding f : report.findings()) {
            md.append("| ").append(row++)
                    .append(" | `").append(cell(f.signatureRef())).append('`')
                    .append(" | ").append(f.totalEvents())
                    .append(" | ").append(percent(f.errorRate()))
                    .append(" | ").append(f.severity() == null ? "-" : f.severity().name())
                    .append(" | ").append(cell(f.probableRootCause()))
                    .append(" |\n");
        }

        if (!summary.topRootCauses().isEmpty()) {
            md.append("\n## Top root causes\n\n");
            int rank = 1;
            for (RootCauseSummary cause : summary.topRootCauses()) {
                md.append(rank++).append(". ").append(cell(cause.probableRootCause()))
                        .append(" (").append(cause.totalEvents()).append(" events)\n");
            }
        }
        return md.toString();
    }

    private static String percent(double rate) {
        return String.format(Locale.ROOT, "%.1f%%", rate * 100);
    }

    private static String cell(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("\r", " ").replace("\n", " ").replace("|", "\\|").replace("`", "'");
    }

    // =========================================================================
    //  Atomic write
    // =========================================================================

    private void writeAtomically(Map<Path, String> artifacts) {
        Map<Path, Path> staged = new LinkedHashMap<>();
        Path current = outputDir;
        try {
            Files.createDirectories(outputDir);
            for (Map.Entry<Path, String> artifact : artifacts.entrySet()) {
                current = artifact.getKey();
                Path tmp = Files.createTempFile(outputDir, "." + current.getFileName() + "-", ".tmp");
                staged.put(current, tmp);
                Files.writeString(tmp, artifact.getValue(), StandardCharsets.UTF_8);
            }
            for (Map.Entry<Path, Path> entry : staged.entrySet()) {
                current = entry.getKey();
                move(entry.getValue(), current);
            }
        } catch (IOException e) {
            throw new ReportWriteException(current, e);
        } finally {
            for (Path tmp : staged.values()) {
                deleteQuietly(tmp);
            }
        }
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path tmp) {
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("Could not delete temporary file {}", tmp, e);
        }
    }
}
