package com.voterimport.voterimport.cli;

import com.voterimport.voterimport.VoterImportException;
import com.voterimport.voterimport.config.ConfigIncompleteException;
import com.voterimport.voterimport.config.StateConfig;
import com.voterimport.voterimport.config.VoterImportProperties;
import com.voterimport.voterimport.ingest.ImportSummary;
import com.voterimport.voterimport.ingest.RejectionKind;
import com.voterimport.voterimport.ingest.RowError;
import com.voterimport.voterimport.schema.CanonicalField;
import com.voterimport.voterimport.schema.DetectionResult;
import com.voterimport.voterimport.schema.FieldMapping;
import com.voterimport.voterimport.schema.MappingRequirement;
import com.voterimport.voterimport.service.AnalysisOutcome;
import com.voterimport.voterimport.service.ImportOutcome;
import com.voterimport.voterimport.service.ImportService;
import com.voterimport.voterimport.service.OnboardResult;
import com.voterimport.voterimport.service.RunOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Command line entry point. Commands are positional; options take {@code --name=value} or {@code --name value}:
 * <pre>
 * onboard &lt;STATE&gt; &lt;input&gt; [--config-dir=D] [--map=Column:field ...] [--verbose]
 * import &lt;STATE&gt; &lt;input&gt; [--config-dir=D] [--db=PATH] [--table=T] [--limit=N] [--force] [--verbose]
 * analyze-addresses &lt;STATE&gt; [--db=PATH] [--table=T] [--threshold=N] [--output=FILE]
 * </pre>
 * Exit codes: 0 success (row-level rejections included), 1 fatal error, 2 usage error.
 */
@Component
public class VoterImportRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(VoterImportRunner.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FATAL = 1;
    static final int EXIT_USAGE = 2;

    private static final int PRINTED_ERROR_LIMIT = 20;
    private static final String PROJECT_PACKAGE = "com.voterimport";

    private static final Set<String> VALUE_OPTIONS = Set.of(
            "config-dir", "db", "table", "limit", "threshold", "output", "map"
    );

    private static final String USAGE = String.join(System.lineSeparator(),
            "Usage:",
            "  onboard <STATE> <input> [--config-dir=D] [--map=Column:field ...] [--verbose]",
            "  import <STATE> <input> [--config-dir=D] [--db=PATH] [--table=T] [--limit=N] [--force] [--verbose]",
            "  analyze-addresses <STATE> [--db=PATH] [--table=T] [--threshold=N] [--output=FILE]");

    private final ImportService importService;
    private final VoterImportProperties properties;
    private int exitCode = EXIT_OK;

    public VoterImportRunner(ImportService importService, VoterImportProperties properties) {
        this.importService = importService;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        exitCode = execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    int execute(ApplicationArguments rawArgs) {
        ApplicationArguments args = new DefaultApplicationArguments(joinOptionValues(rawArgs.getSourceArgs()));
        List<String> positional = args.getNonOptionArgs();
        if (positional.isEmpty()) {
            System.out.println(USAGE);
            return EXIT_USAGE;
        }
        if (args.containsOption("verbose") || properties.isVerbose()) {
            LoggingSystem.get(getClass().getClassLoader()).setLogLevel(PROJECT_PACKAGE, LogLevel.DEBUG);
        }

        String command = positional.get(0);
        try {
            RunOptions options = toRunOptions(args);
            switch (command) {
                case "onboard" -> {
                    requireArguments(positional, 3);
                    printOnboard(importService.onboard(positional.get(1), Path.of(positional.get(2)), options));
                }
                case "import" -> {
                    requireArguments(positional, 3);
                    printImport(importService.importFile(positional.get(1), Path.of(positional.get(2)), options));
                }
                case "analyze-addresses" -> {
                    requireArguments(positional, 2);
                    printAnalysis(importService.analyzeAddresses(positional.get(1), options));
                }
                default -> throw new IllegalArgumentException("Unknown command: " + command);
            }
            return EXIT_OK;
        } catch (ConfigIncompleteException ex) {
            log.error("{} failed: {}", command, ex.getMessage());
            for (MappingRequirement requirement : ex.getUnmapped()) {
                System.err.printf("Missing mapping for %s; re-run onboard with --map=Column:%s%n",
                        requirement.description(), requirement.suggestedField().key());
            }
            return EXIT_FATAL;
        } catch (VoterImportException ex) {
            log.error("{} failed: {}", command, ex.getMessage());
            log.debug("Failure detail", ex);
            return EXIT_FATAL;
        } catch (IllegalArgumentException ex) {
            System.err.println(ex.getMessage());
            System.err.println(USAGE);
            return EXIT_USAGE;
        } catch (RuntimeException ex) {
            log.error("{} failed: {}", command, ex.getMessage(), ex);
            return EXIT_FATAL;
        }
    }

    private RunOptions toRunOptions(ApplicationArguments args) {
        RunOptions defaults = RunOptions.defaults(properties);
        String limit = single(args, "limit");
        String threshold = single(args, "threshold");
        String configDir = single(args, "config-dir");
        String db = single(args, "db");
        String output = single(args, "output");
        return new RunOptions(
                configDir == null ? defaults.configDir() : Path.of(configDir),
                db == null ? defaults.dbPath() : Path.of(db),
                single(args, "table"),
                limit == null ? null : Long.parseLong(limit),
                args.containsOption("force"),
                threshold == null ? defaults.threshold() : Integer.parseInt(threshold),
                output == null ? null : Path.of(output),
                parseManualMappings(args.getOptionValues("map"))
        );
    }

    /**
     * Rewrites {@code --name value} into {@code --name=value} for options that take a value, so both spellings
     * reach {@link ApplicationArguments} the same way.
     */
    static String[] joinOptionValues(String[] args) {
        List<String> joined = new ArrayList<>(args.length);
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            boolean bareValueOption = arg.startsWith("--") && !arg.contains("=")
                    && VALUE_OPTIONS.contains(arg.substring(2));
            if (bareValueOption && i + 1 < args.length && !args[i + 1].startsWith("--")) {
                joined.add(arg + "=" + args[i + 1]);
                i++;
            } else {
                joined.add(arg);
            }
        }
        return joined.toArray(new String[0]);
    }

    /**
     * Parses {@code Column:field} pairs; the last colon separates the field so column names may contain colons.
     */
    static Map<String, CanonicalField> parseManualMappings(List<String> values) {
        Map<String, CanonicalField> mappings = new LinkedHashMap<>();
        if (values == null) {
            return mappings;
        }
        for (String value : values) {
            int separator = value.lastIndexOf(':');
            if (separator <= 0 || separator == value.length() - 1) {
                throw new IllegalArgumentException("Expected --map=Column:field but got " + value);
            }
            mappings.put(value.substring(0, separator), CanonicalField.fromKey(value.substring(separator + 1)));
        }
        return mappings;
    }

    private static String single(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        return values.get(values.size() - 1);
    }

    private static void requireArguments(List<String> positional, int count) {
        if (positional.size() != count) {
            throw new IllegalArgumentException(positional.get(0) + " expects " + (count - 1) + " arguments");
        }
    }

    private void printOnboard(OnboardResult result) {
        StateConfig config = result.config();
        DetectionResult detection = result.detection();
        System.out.printf("Configuration for %s (version %d) saved to %s%n", config.stateCode(), config.version(), result.configPath());
        for (FieldMapping mapping : config.fieldMappings()) {
            System.out.printf("  %-24s -> %-22s %.2f %s%n", mapping.sourceColumn(), mapping.canonicalField().key(),
                    mapping.confidence(), mapping.method().key());
        }
        detection.warnings().forEach(warning -> System.out.println("Warning: " + warning));
        if (!detection.unmappedColumns().isEmpty()) {
            System.out.println("Unmapped columns: " + String.join(", ", detection.unmappedColumns()));
        }
        if (!config.needsConfirmation().isEmpty()) {
            System.out.println("Needs confirmation: " + config.needsConfirmation().stream().map(CanonicalField::key).toList());
        }
        List<MappingRequirement> missing = config.missingRequirements();
        if (!missing.isEmpty()) {
            System.out.println("Unmapped required fields: " + missing.stream().map(MappingRequirement::description).toList()
                    + ". Supply them with --map=Column:field.");
        }
    }

    private void printImport(ImportOutcome outcome) {
        ImportSummary summary = outcome.summary();
        System.out.printf("Import into %s (run %d)%s%n", outcome.scope(), outcome.runId(),
                summary.cancelled() ? " CANCELLED" : "");
        System.out.printf("  rows seen:            %d%n", summary.rowsSeen());
        System.out.printf("  inserted:             %d%n", summary.inserted());
        System.out.printf("  duplicates:           %d%n", summary.duplicates());
        System.out.printf("  validation errors:    %d%n", summary.validationErrors());
        System.out.printf("  normalization errors: %d%n", summary.normalizationErrors());
        System.out.printf("  field warnings:       %d%n", summary.fieldWarnings());
        System.out.printf("  voters in table:      %d%n", outcome.storedVoters());
        summary.errors().stream()
                .filter(error -> error.kind() != RejectionKind.DUPLICATE)
                .limit(PRINTED_ERROR_LIMIT)
                .forEach(this::printRowError);
    }

    private void printRowError(RowError error) {
        System.out.printf("  row %d %s: %s%n", error.rowNumber(), error.kind(), error.message());
    }

    private void printAnalysis(AnalysisOutcome outcome) {
        if (outcome.reportPath() == null) {
            System.out.print(outcome.markdown());
            return;
        }
        System.out.printf("Report saved to %s%n", outcome.reportPath());
        System.out.printf("Total unique addresses analyzed: %d%n", outcome.report().totalAddresses());
        System.out.printf("Addresses with multiple voters: %d%n", outcome.report().groups().size());
        System.out.printf("Total voters at duplicate addresses: %d%n", outcome.report().votersAtSharedAddresses());
    }
}
