package com.premerge.resolver.cli;

import com.premerge.resolver.ProjectResolver;
import com.premerge.resolver.cli.exception.OptionsValidationException;
import com.premerge.resolver.cli.model.ComputeProjectsOptions;
import com.premerge.resolver.cli.model.ValidatedComputeOptions;
import com.premerge.resolver.cli.output.EnvironmentPrinter;
import com.premerge.resolver.cli.validation.ComputeProjectsOptionsValidator;
import com.premerge.resolver.config.ConfigurationException;
import com.premerge.resolver.config.DefaultProjectTables;
import com.premerge.resolver.config.ProjectConfigurationParser;
import com.premerge.resolver.model.ProjectConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.ExitCode;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.stream.Stream;

/**
 * CLI command computing which projects, runtimes and check targets a change needs.
 */
@Command(
        name = "compute-projects",
        mixinStandardHelpOptions = true,
        version = "compute-projects 1.0.0",
        description = "Reads changed file paths and prints the projects, runtimes and check targets to build and test as shell variables."
)
public class ComputeProjectsCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ComputeProjectsCommand.class);

    static final int EXIT_FAILURE = ExitCode.SOFTWARE;
    static final int EXIT_USAGE = ExitCode.USAGE;

    @Mixin
    private ComputeProjectsOptions options = new ComputeProjectsOptions();

    @Spec
    private CommandSpec spec;

    private final InputStream stdin;
    private final ComputeProjectsOptionsValidator validator = new ComputeProjectsOptionsValidator();
    private final EnvironmentPrinter printer = new EnvironmentPrinter();

    public ComputeProjectsCommand() {
        this(System.in);
    }

    public ComputeProjectsCommand(InputStream stdin) {
        this.stdin = stdin;
    }

    @Override
    public Integer call() {
        try {
            ValidatedComputeOptions validated = validator.validate(options);
            ProjectConfiguration configuration = loadConfiguration(validated);
            List<String> changedFiles = readChangedFiles(validated);

            printer.printBanner(validated, changedFiles.size());

            Map<String, String> env = new ProjectResolver(configuration)
                    .computeEnvironment(changedFiles, validated.getPlatform());
            printer.printEnvironment(env, spec.commandLine().getOut());
            return 0;

        } catch (OptionsValidationException e) {
            e.getErrors().forEach(error -> log.error("{}", error));
            return e.getExitCode();
        } catch (ConfigurationException e) {
            log.error("{}", e.getMessage());
            return EXIT_FAILURE;
        } catch (IOException | UncheckedIOException e) {
            log.error("Failed to read input", e);
            return EXIT_FAILURE;
        }
    }

    private ProjectConfiguration loadConfiguration(ValidatedComputeOptions validated) throws IOException {
        if (validated.isUsingBundledTables()) {
            return DefaultProjectTables.llvmMonorepo();
        }
        return new ProjectConfigurationParser().parse(validated.getConfigFile());
    }

    private List<String> readChangedFiles(ValidatedComputeOptions validated) throws IOException {
        if (validated.isReadingStandardInput()) {
            BufferedReader reader = new BufferedReader(new InputStreamReader(stdin, StandardCharsets.UTF_8));
            return cleanLines(reader.lines());
        }
        try (Stream<String> lines = Files.lines(validated.getChangedFiles(), StandardCharsets.UTF_8)) {
            return cleanLines(lines);
        }
    }

    private static List<String> cleanLines(Stream<String> lines) {
        return lines.map(String::trim)
                .filter(line -> !line.isEmpty())
                .toList();
    }
}
