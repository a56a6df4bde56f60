package com.premerge.resolver.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only tables describing the monorepo: its projects and runtimes, how they
 * depend on each other, what to test when one changes and what each platform excludes.
 *
 * Built once per process and handed to the matcher and the selection engine.
 * Lookups are total: a name missing from a table yields an empty set.
 */
@Value
@Builder(toBuilder = true)
public class ProjectConfiguration {

    /**
     * Ordinary projects, built through the projects build.
     */
    @NonNull
    @Singular
    Set<String> projects;

    /**
     * Projects built and tested through the runtimes build.
     */
    @NonNull
    @Singular
    Set<String> runtimes;

    /**
     * Build-time dependency graph: project -> projects it needs to build.
     */
    @NonNull
    @Singular("dependency")
    Map<String, Set<String>> dependencies;

    /**
     * Projects whose tests run when the key project changes.
     */
    @NonNull
    @Singular("dependentsEntry")
    Map<String, Set<String>> dependents;

    /**
     * Runtimes that must be built (not tested) when the key project changes.
     */
    @NonNull
    @Singular("runtimesToBuildEntry")
    Map<String, Set<String>> runtimesToBuild;

    /**
     * Runtimes tested when the key project changes.
     */
    @NonNull
    @Singular("runtimesToTestEntry")
    Map<String, Set<String>> runtimesToTest;

    /**
     * Runtimes tested when the key project changes, through a separate reconfigured build.
     */
    @NonNull
    @Singular("runtimesToTestNeedsReconfigEntry")
    Map<String, Set<String>> runtimesToTestNeedsReconfig;

    @NonNull
    @Singular
    Map<String, String> checkTargets;

    @NonNull
    @Singular("exclusion")
    Map<Platform, Set<String>> exclusions;

    /**
     * Projects dropped from another project's dependents on a platform, while still
     * tested when they change themselves.
     */
    @NonNull
    @Singular("dependentExclusion")
    Map<Platform, Set<String>> dependentExclusions;

    @NonNull
    @Singular
    List<MetaProjectRule> metaProjects;

    /**
     * Meta-projects whose files are ignored entirely.
     */
    @NonNull
    @Singular
    Set<String> skipProjects;

    /**
     * Projects never listed for an explicit build, because another target builds them.
     */
    @NonNull
    @Singular
    Set<String> skipBuildProjects;

    /**
     * Project whose presence in the build closure turns on the CIR build option.
     */
    String cirSentinel;

    public boolean isRuntime(String project) {
        return runtimes.contains(project);
    }

    public Set<String> dependenciesOf(String project) {
        return dependencies.getOrDefault(project, Set.of());
    }

    public Set<String> dependentsOf(String project) {
        return dependents.getOrDefault(project, Set.of());
    }

    public Set<String> runtimesToBuildFor(String project) {
        return runtimesToBuild.getOrDefault(project, Set.of());
    }

    public Set<String> runtimesToTestFor(String project) {
        return runtimesToTest.getOrDefault(project, Set.of());
    }

    public Set<String> runtimesToTestNeedsReconfigFor(String project) {
        return runtimesToTestNeedsReconfig.getOrDefault(project, Set.of());
    }

    public Optional<String> checkTargetOf(String project) {
        return Optional.ofNullable(checkTargets.get(project));
    }

    public Set<String> exclusionsFor(Platform platform) {
        return exclusions.getOrDefault(platform, Set.of());
    }

    public Set<String> dependentExclusionsFor(Platform platform) {
        return dependentExclusions.getOrDefault(platform, Set.of());
    }

    public Optional<String> findCirSentinel() {
        return Optional.ofNullable(cirSentinel);
    }

    /**
     * Every name a table may legitimately reference: projects, runtimes and meta-project targets.
     */
    public Set<String> knownNames() {
        Set<String> known = new HashSet<>(projects);
        known.addAll(runtimes);
        for (MetaProjectRule rule : metaProjects) {
            known.add(rule.getProject());
        }
        return known;
    }
}
