package com.premerge.resolver.config;

import com.premerge.resolver.model.MetaProjectRule;
import com.premerge.resolver.model.PathPattern;
import com.premerge.resolver.model.Platform;
import com.premerge.resolver.model.ProjectConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Parser for project table files.
 *
 * Format:
 * - Universe:   projects llvm clang lld
 *               runtimes libcxx libc
 * - Tables:     depends clang = llvm
 *               dependents llvm = clang lld
 *               runtimes-to-build lldb = libcxx
 *               runtimes-to-test clang = compiler-rt
 *               runtimes-to-test-reconfig clang = libcxx
 *               check clang = check-clang
 * - Platforms:  exclude Windows = lldb bolt
 *               exclude-dependents Windows = flang
 * - Paths:      meta clang/lib/CIR = CIR   (segment * is a wildcard)
 * - Sets:       skip docs gn
 *               skip-build CIR
 *               cir-sentinel CIR
 * - Comments:   # comment
 *
 * Repeated directives accumulate. The parsed tables are validated before being returned.
 */
public class ProjectConfigurationParser {
    private static final Logger log = LoggerFactory.getLogger(ProjectConfigurationParser.class);

    // directive key = values
    private static final Pattern TABLE_PATTERN = Pattern.compile(
            "^([a-z][a-z\\-]*)\\s+(\\S+)\\s*=\\s*(.*)$"
    );

    // directive values
    private static final Pattern LIST_PATTERN = Pattern.compile(
            "^([a-z][a-z\\-]*)\\s+(.+)$"
    );

    private final ProjectConfigurationValidator validator;

    public ProjectConfigurationParser() {
        this(new ProjectConfigurationValidator());
    }

    public ProjectConfigurationParser(ProjectConfigurationValidator validator) {
        this.validator = validator;
    }

    public ProjectConfiguration parse(Path tablesFile) throws IOException {
        log.info("Loading project tables from {}", tablesFile.toAbsolutePath());
        return parse(Files.readAllLines(tablesFile, StandardCharsets.UTF_8), tablesFile.toString());
    }

    public ProjectConfiguration parse(InputStream in, String source) throws IOException {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            return parse(reader.lines().collect(Collectors.toList()), source);
        }
    }

    public ProjectConfiguration parse(List<String> lines, String source) {
        TableAccumulator tables = new TableAccumulator();
        List<String> errors = new ArrayList<>();

        int lineNum = 0;
        for (String line : lines) {
            lineNum++;

            String trimmed = stripComment(line).trim();
            if (trimmed.isEmpty()) {
                continue;
            }

            try {
                parseLine(trimmed, tables);
            } catch (IllegalArgumentException e) {
                errors.add("Line " + lineNum + ": " + e.getMessage());
                log.warn("Failed to parse table line {} of {}: {}", lineNum, source, e.getMessage());
            }
        }

        if (!errors.isEmpty()) {
            throw new ConfigurationException(source, errors);
        }

        ProjectConfiguration configuration = tables.build();
        validator.validate(configuration, source);
        log.debug("Loaded {} projects, {} runtimes and {} meta-project rules from {}",
                configuration.getProjects().size(), configuration.getRuntimes().size(),
                configuration.getMetaProjects().size(), source);
        return configuration;
    }

    private void parseLine(String line, TableAccumulator tables) {
        Matcher table = TABLE_PATTERN.matcher(line);
        if (table.matches()) {
            parseTableLine(table.group(1), table.group(2), words(table.group(3)), tables);
            return;
        }

        Matcher list = LIST_PATTERN.matcher(line);
        if (list.matches()) {
            parseListLine(list.group(1), words(list.group(2)), tables);
            return;
        }

        throw new IllegalArgumentException("Invalid table format: " + line);
    }

    private void parseTableLine(String directive, String key, List<String> values, TableAccumulator tables) {
        switch (directive) {
            case "depends" -> tables.add(tables.dependencies, key, values);
            case "dependents" -> tables.add(tables.dependents, key, values);
            case "runtimes-to-build" -> tables.add(tables.runtimesToBuild, key, values);
            case "runtimes-to-test" -> tables.add(tables.runtimesToTest, key, values);
            case "runtimes-to-test-reconfig" -> tables.add(tables.runtimesToTestNeedsReconfig, key, values);
            case "check" -> {
                if (values.size() != 1) {
                    throw new IllegalArgumentException("check expects exactly one target for " + key + ", got " + values);
                }
                String previous = tables.checkTargets.putIfAbsent(key, values.get(0));
                if (previous != null && !previous.equals(values.get(0))) {
                    throw new IllegalArgumentException("Check target for " + key + " already defined as " + previous);
                }
            }
            case "exclude" -> tables.add(tables.exclusions, platform(key), values);
            case "exclude-dependents" -> tables.add(tables.dependentExclusions, platform(key), values);
            case "meta" -> {
                if (values.size() != 1) {
                    throw new IllegalArgumentException("meta expects exactly one project for " + key + ", got " + values);
                }
                PathPattern pattern = PathPattern.parse(key);
                if (pattern.getSegments().isEmpty()) {
                    throw new IllegalArgumentException("meta pattern has no segments: " + key);
                }
                tables.metaProjects.add(new MetaProjectRule(pattern, values.get(0)));
            }
            default -> throw new IllegalArgumentException("Unknown table directive: " + directive);
        }
    }

    private void parseListLine(String directive, List<String> values, TableAccumulator tables) {
        switch (directive) {
            case "projects" -> tables.projects.addAll(values);
            case "runtimes" -> tables.runtimes.addAll(values);
            case "skip" -> tables.skipProjects.addAll(values);
            case "skip-build" -> tables.skipBuildProjects.addAll(values);
            case "cir-sentinel" -> {
                if (values.size() != 1) {
                    throw new IllegalArgumentException("cir-sentinel expects exactly one project, got " + values);
                }
                if (tables.cirSentinel != null && !tables.cirSentinel.equals(values.get(0))) {
                    throw new IllegalArgumentException("cir-sentinel already defined as " + tables.cirSentinel);
                }
                tables.cirSentinel = values.get(0);
            }
            default -> throw new IllegalArgumentException("Unknown list directive: " + directive);
        }
    }

    private static Platform platform(String name) {
        return Platform.fromName(name)
                .orElseThrow(() -> new IllegalArgumentException("Unknown platform: " + name
                        + " (expected Linux, Windows or Darwin)"));
    }

    private static List<String> words(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        return Arrays.stream(raw.trim().split("\\s+")).toList();
    }

    private static String stripComment(String line) {
        int hash = line.indexOf('#');
        return hash >= 0 ? line.substring(0, hash) : line;
    }

    /**
     * Mutable working state while reading a file; frozen by {@link #build()}.
     */
    private static final class TableAccumulator {
        final Set<String> projects = new LinkedHashSet<>();
        final Set<String> runtimes = new LinkedHashSet<>();
        final Map<String, Set<String>> dependencies = new LinkedHashMap<>();
        final Map<String, Set<String>> dependents = new LinkedHashMap<>();
        final Map<String, Set<String>> runtimesToBuild = new LinkedHashMap<>();
        final Map<String, Set<String>> runtimesToTest = new LinkedHashMap<>();
        final Map<String, Set<String>> runtimesToTestNeedsReconfig = new LinkedHashMap<>();
        final Map<String, String> checkTargets = new LinkedHashMap<>();
        final Map<Platform, Set<String>> exclusions = new HashMap<>();
        final Map<Platform, Set<String>> dependentExclusions = new HashMap<>();
        final List<MetaProjectRule> metaProjects = new ArrayList<>();
        final Set<String> skipProjects = new LinkedHashSet<>();
        final Set<String> skipBuildProjects = new LinkedHashSet<>();
        String cirSentinel;

        <K> void add(Map<K, Set<String>> table, K key, List<String> values) {
            table.computeIfAbsent(key, k -> new LinkedHashSet<>()).addAll(values);
        }

        ProjectConfiguration build() {
            return ProjectConfiguration.builder()
                    .projects(projects)
                    .runtimes(runtimes)
                    .dependencies(freeze(dependencies))
                    .dependents(freeze(dependents))
                    .runtimesToBuild(freeze(runtimesToBuild))
                    .runtimesToTest(freeze(runtimesToTest))
                    .runtimesToTestNeedsReconfig(freeze(runtimesToTestNeedsReconfig))
                    .checkTargets(checkTargets)
                    .exclusions(freeze(exclusions))
                    .dependentExclusions(freeze(dependentExclusions))
                    .metaProjects(metaProjects)
                    .skipProjects(skipProjects)
                    .skipBuildProjects(skipBuildProjects)
                    .cirSentinel(cirSentinel)
                    .build();
        }

        private static <K> Map<K, Set<String>> freeze(Map<K, Set<String>> table) {
            Map<K, Set<String>> frozen = new LinkedHashMap<>();
            table.forEach((key, values) -> frozen.put(key, Set.copyOf(values)));
            return frozen;
        }
    }
}
