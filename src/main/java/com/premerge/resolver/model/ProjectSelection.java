package com.premerge.resolver.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.Set;

/**
 * What a change requires: the sets derived by the selection engine for one platform.
 */
@Value
@Builder(toBuilder = true)
public class ProjectSelection {
    @NonNull
    Set<String> projectsToTest;

    @NonNull
    Set<String> projectsToBuild;

    @NonNull
    Set<String> runtimesToTest;

    @NonNull
    Set<String> runtimesToTestNeedsReconfig;

    @NonNull
    Set<String> runtimesToBuild;

    boolean cirEnabled;

    public static ProjectSelection empty() {
        return ProjectSelection.builder()
                .projectsToTest(Set.of())
                .projectsToBuild(Set.of())
                .runtimesToTest(Set.of())
                .runtimesToTestNeedsReconfig(Set.of())
                .runtimesToBuild(Set.of())
                .cirEnabled(false)
                .build();
    }
}
