package com.premerge.resolver.config;

import com.premerge.resolver.model.MetaProjectRule;
import com.premerge.resolver.model.Platform;
import com.premerge.resolver.model.ProjectConfiguration;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Load-time checks on the project tables. A configuration that fails here is never
 * used for resolution.
 */
public class ProjectConfigurationValidator {

    public void validate(ProjectConfiguration c, String source) {
        List<String> errors = new ArrayList<>();
        Set<String> known = c.knownNames();

        for (String runtime : c.getRuntimes()) {
            if (c.getProjects().contains(runtime)) {
                errors.add("Runtime is also declared as a project: " + runtime);
            }
        }

        checkGraph("depends", c.getDependencies(), known, errors);
        checkGraph("dependents", c.getDependents(), known, errors);
        checkRuntimeTable("runtimes-to-build", c.getRuntimesToBuild(), known, c.getRuntimes(), errors);
        checkRuntimeTable("runtimes-to-test", c.getRuntimesToTest(), known, c.getRuntimes(), errors);
        checkRuntimeTable("runtimes-to-test-reconfig", c.getRuntimesToTestNeedsReconfig(), known, c.getRuntimes(), errors);

        checkNames("check", c.getCheckTargets().keySet(), known, errors);

        for (Map.Entry<Platform, Set<String>> entry : c.getExclusions().entrySet()) {
            checkPlatform("exclude", entry.getKey(), errors);
            checkNames("exclude " + entry.getKey().getDisplayName(), entry.getValue(), known, errors);
        }
        for (Map.Entry<Platform, Set<String>> entry : c.getDependentExclusions().entrySet()) {
            checkPlatform("exclude-dependents", entry.getKey(), errors);
            checkNames("exclude-dependents " + entry.getKey().getDisplayName(), entry.getValue(), known, errors);
        }

        List<String> metaTargets = c.getMetaProjects().stream().map(MetaProjectRule::getProject).toList();
        for (String skipped : c.getSkipProjects()) {
            if (!metaTargets.contains(skipped)) {
                errors.add("skip: " + skipped + " is not the target of any meta rule");
            }
        }
        checkNames("skip-build", c.getSkipBuildProjects(), known, errors);

        c.findCirSentinel().ifPresent(sentinel -> {
            if (!known.contains(sentinel)) {
                errors.add("cir-sentinel: unknown project " + sentinel);
            }
        });

        if (!errors.isEmpty()) {
            throw new ConfigurationException(source, errors);
        }
    }

    private static void checkGraph(String table, Map<String, Set<String>> graph, Set<String> known, List<String> errors) {
        for (Map.Entry<String, Set<String>> entry : graph.entrySet()) {
            checkNames(table, List.of(entry.getKey()), known, errors);
            checkNames(table + " " + entry.getKey(), entry.getValue(), known, errors);
        }
    }

    private static void checkRuntimeTable(String table, Map<String, Set<String>> graph, Set<String> known,
                                          Set<String> runtimes, List<String> errors) {
        for (Map.Entry<String, Set<String>> entry : graph.entrySet()) {
            checkNames(table, List.of(entry.getKey()), known, errors);
            for (String value : entry.getValue()) {
                if (!runtimes.contains(value)) {
                    errors.add(table + " " + entry.getKey() + ": " + value + " is not a runtime");
                }
            }
        }
    }

    private static void checkNames(String table, Collection<String> names, Set<String> known, List<String> errors) {
        for (String name : names) {
            if (!known.contains(name)) {
                errors.add(table + ": unknown project " + name);
            }
        }
    }

    private static void checkPlatform(String table, Platform platform, List<String> errors) {
        if (platform == Platform.UNKNOWN) {
            errors.add(table + ": exclusions cannot be declared for the unknown platform");
        }
    }
}
