package org.nullmask.cli;

import org.nullmask.cli.service.DatasetIoService;
import org.nullmask.config.ConfigException;
import org.nullmask.config.ConfigurationLoader;
import org.nullmask.config.InjectionConfig;
import org.nullmask.engine.InjectionResult;
import org.nullmask.engine.NullInjector;
import org.nullmask.model.Dataset;
import org.nullmask.model.InjectionSummary;
import org.nullmask.model.SchemaMismatchException;
import org.nullmask.options.NullMaskOptions;
import picocli.CommandLine;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * Main CLI entry point for nullmask.
 * Replaces values in a dataset with nulls based on probability and pattern matching.
 */
@CommandLine.Command(
        name = "nullmask",
        mixinStandardHelpOptions = true,
        version = "nullmask 1.0",
        description = "Replaces values in a dataset with null values based on probability or pattern matching."
)
public class NullMaskCli implements Callable<Integer> {

    @CommandLine.Parameters(index = "0", paramLabel = "INPUT", description = "Path to the input dataset (.csv or .json).")
    private Path inputFile;

    @CommandLine.Parameters(index = "1", paramLabel = "OUTPUT", description = "Path to the output dataset (.csv or .json).")
    private Path outputFile;

    @CommandLine.Option(names = "--probability",
            description = "Probability (0.0 to 1.0) of replacing a value with null. Default is 0.1.")
    private Double probability;

    @CommandLine.Option(names = "--pattern",
            description = "Regular expression a value must contain to be replaced. If not specified, all values are considered.")
    private String pattern;

    @CommandLine.Option(names = "--columns",
            description = "Comma-separated list of columns to apply the injection to. If not specified, all columns are considered.")
    private String columns;

    @CommandLine.Option(names = "--seed", description = "Seed for reproducible replacement decisions. Default is 0.")
    private Long seed;

    @CommandLine.Option(names = "--parallelism", description = "Number of workers rows are split across. Default is 1.")
    private Integer parallelism;

    @CommandLine.Option(names = "--profile", description = "Configuration profile to use from nullmask.yaml.")
    private String profile;

    @CommandLine.Option(names = "--config-dir", description = "Directory to start searching for nullmask.yaml from. Default is the working directory.")
    private Path configDir;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new NullMaskCli()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        try {
            DatasetIoService io = new DatasetIoService();
            io.checkWritable(outputFile);
            Dataset data = io.load(inputFile);

            InjectionConfig config = buildConfig(loadConfiguration(), data.schema());

            InjectionResult result = new NullInjector().inject(data, config);
            io.save(result.dataset(), outputFile);

            printSummary(result.summary());
            return 0;

        } catch (ConfigException e) {
            System.err.println("Invalid configuration:");
            e.getViolations().forEach(v -> System.err.println("   - " + v.message()));
            return 1;
        } catch (FileNotFoundException e) {
            System.err.println(e.getMessage());
            return 1;
        } catch (IOException | SchemaMismatchException | IllegalArgumentException e) {
            System.err.println("Null injection failed: " + e.getMessage());
            return 1;
        }
    }

    private Map<String, String> loadConfiguration() {
        Path start = configDir != null ? configDir : Paths.get("").toAbsolutePath();
        return new ConfigurationLoader(start).loadConfiguration(profile);
    }

    /**
     * Merges command-line options over profile values and validates the result against the dataset
     * schema, so every violation, unknown columns included, is reported in one go.
     */
    private InjectionConfig buildConfig(Map<String, String> settings, List<String> schema) {
        String columnSetting = columns != null ? columns : settings.get(NullMaskOptions.Injection.COLUMNS_KEY);
        return InjectionConfig.builder()
                .probability(probability != null ? probability
                        : parseDouble(settings.get(NullMaskOptions.Injection.PROBABILITY_KEY)))
                .pattern(pattern != null ? pattern : settings.get(NullMaskOptions.Injection.PATTERN_KEY))
                .columns(splitColumns(columnSetting))
                .seed(seed != null ? seed : parseLong(settings.get(NullMaskOptions.Injection.SEED_KEY)))
                .parallelism(parallelism != null ? parallelism
                        : parseInt(settings.get(NullMaskOptions.Injection.PARALLELISM_KEY)))
                .schema(schema)
                .build();
    }

    static List<String> splitColumns(String value) {
        if (value == null) {
            return null;
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    // Profile values come from typed YAML fields, so they always parse.
    private static Double parseDouble(String value) {
        return value == null ? null : Double.valueOf(value);
    }

    private static Long parseLong(String value) {
        return value == null ? null : Long.valueOf(value);
    }

    private static Integer parseInt(String value) {
        return value == null ? null : Integer.valueOf(value);
    }

    private void printSummary(InjectionSummary summary) {
        System.out.println("Masked data saved to: " + outputFile);
        System.out.println("Rows processed: " + summary.getRowsProcessed());
        System.out.println("Cells replaced: " + summary.getCellsReplaced());
        summary.getReplacedPerColumn().forEach((column, count) ->
                System.out.println("   " + column + ": " + count));
    }
}
