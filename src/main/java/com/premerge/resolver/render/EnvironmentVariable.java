package com.premerge.resolver.render;

/**
 * The variables exported to the CI build scripts, in output order.
 */
public enum EnvironmentVariable {
    PROJECTS_TO_BUILD("projects_to_build"),
    PROJECT_CHECK_TARGETS("project_check_targets"),
    RUNTIMES_TO_BUILD("runtimes_to_build"),
    RUNTIMES_CHECK_TARGETS("runtimes_check_targets"),
    RUNTIMES_CHECK_TARGETS_NEEDS_RECONFIG("runtimes_check_targets_needs_reconfig"),
    ENABLE_CIR("enable_cir");

    private final String key;

    EnvironmentVariable(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
