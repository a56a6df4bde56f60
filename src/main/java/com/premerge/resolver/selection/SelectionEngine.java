package com.premerge.resolver.selection;

import com.premerge.resolver.model.Platform;
import com.premerge.resolver.model.ProjectConfiguration;
import com.premerge.resolver.model.ProjectSelection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;
import java.util.function.Function;

/**
 * Derives what to test and what to build from a set of modified projects.
 *
 * Pure set algebra over the configuration tables: unknown names match nothing
 * and contribute nothing. Working sets live only for the duration of one call.
 */
public class SelectionEngine {
    private static final Logger log = LoggerFactory.getLogger(SelectionEngine.class);

    private final ProjectConfiguration configuration;

    public SelectionEngine(ProjectConfiguration configuration) {
        this.configuration = configuration;
    }

    public ProjectSelection select(Set<String> modifiedProjects, Platform platform) {
        Set<String> projectsToTest = projectsToTest(modifiedProjects, platform);
        Set<String> runtimesToTest = collect(modifiedProjects, configuration::runtimesToTestFor, platform);
        Set<String> runtimesToTestNeedsReconfig =
                collect(modifiedProjects, configuration::runtimesToTestNeedsReconfigFor, platform);
        Set<String> runtimesToBuild =
                runtimesToBuild(runtimesToTest, runtimesToTestNeedsReconfig, modifiedProjects, platform);

        Set<String> closure = dependencyClosure(projectsToTest, runtimesToBuild);
        boolean cirEnabled = configuration.findCirSentinel().map(closure::contains).orElse(false);
        closure.removeAll(configuration.getSkipBuildProjects());

        log.debug("Selection for {} on {}: test={}, build={}, runtimes={}, cir={}",
                modifiedProjects, platform, projectsToTest, closure, runtimesToBuild, cirEnabled);

        return ProjectSelection.builder()
                .projectsToTest(Set.copyOf(projectsToTest))
                .projectsToBuild(Set.copyOf(closure))
                .runtimesToTest(Set.copyOf(runtimesToTest))
                .runtimesToTestNeedsReconfig(Set.copyOf(runtimesToTestNeedsReconfig))
                .runtimesToBuild(Set.copyOf(runtimesToBuild))
                .cirEnabled(cirEnabled)
                .build();
    }

    Set<String> projectsToTest(Set<String> modifiedProjects, Platform platform) {
        Set<String> toTest = new HashSet<>();
        Set<String> dependentExclusions = configuration.dependentExclusionsFor(platform);

        for (String project : modifiedProjects) {
            if (configuration.isRuntime(project)) {
                continue;
            }
            if (configuration.checkTargetOf(project).isPresent()) {
                toTest.add(project);
            }
            for (String dependent : configuration.dependentsOf(project)) {
                if (!dependentExclusions.contains(dependent)) {
                    toTest.add(dependent);
                }
            }
        }
        return excludeForPlatform(toTest, platform);
    }

    Set<String> runtimesToBuild(Set<String> runtimesToTest, Set<String> runtimesToTestNeedsReconfig,
                                Set<String> modifiedProjects, Platform platform) {
        Set<String> toBuild = new HashSet<>(runtimesToTest);
        toBuild.addAll(runtimesToTestNeedsReconfig);
        for (String project : modifiedProjects) {
            toBuild.addAll(configuration.runtimesToBuildFor(project));
        }
        return excludeForPlatform(toBuild, platform);
    }

    /**
     * Transitive closure of {@code projects} under the dependency graph, plus the direct
     * dependencies of each runtime. Runtimes are not expanded transitively.
     */
    Set<String> dependencyClosure(Set<String> projects, Set<String> runtimes) {
        Set<String> closure = new HashSet<>(projects);
        Deque<String> frontier = new ArrayDeque<>(projects);

        while (!frontier.isEmpty()) {
            String project = frontier.pop();
            for (String dependency : configuration.dependenciesOf(project)) {
                if (closure.add(dependency)) {
                    frontier.push(dependency);
                }
            }
        }

        for (String runtime : runtimes) {
            closure.addAll(configuration.dependenciesOf(runtime));
        }
        return closure;
    }

    private Set<String> collect(Collection<String> modifiedProjects, Function<String, Set<String>> table,
                                Platform platform) {
        Set<String> result = new HashSet<>();
        for (String project : modifiedProjects) {
            result.addAll(table.apply(project));
        }
        return excludeForPlatform(result, platform);
    }

    private Set<String> excludeForPlatform(Set<String> projects, Platform platform) {
        projects.removeAll(configuration.exclusionsFor(platform));
        return projects;
    }
}
