package com.premerge.resolver.render;

import com.premerge.resolver.model.ProjectConfiguration;
import com.premerge.resolver.model.ProjectSelection;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Renders a {@link ProjectSelection} into shell-ready strings.
 *
 * Output is deterministic: members are sorted lexically, so the same selection
 * always renders to the same bytes.
 */
public class EnvironmentBuilder {

    static final String PROJECT_DELIMITER = ";";
    static final String TARGET_DELIMITER = " ";

    private final ProjectConfiguration configuration;

    public EnvironmentBuilder(ProjectConfiguration configuration) {
        this.configuration = configuration;
    }

    /**
     * @return one entry per {@link EnvironmentVariable}, keyed by its name, in declaration order
     */
    public Map<String, String> render(ProjectSelection selection) {
        Map<String, String> env = new LinkedHashMap<>();
        env.put(EnvironmentVariable.PROJECTS_TO_BUILD.getKey(), joinProjects(selection.getProjectsToBuild()));
        env.put(EnvironmentVariable.PROJECT_CHECK_TARGETS.getKey(), joinCheckTargets(selection.getProjectsToTest()));
        env.put(EnvironmentVariable.RUNTIMES_TO_BUILD.getKey(), joinProjects(selection.getRuntimesToBuild()));
        env.put(EnvironmentVariable.RUNTIMES_CHECK_TARGETS.getKey(), joinCheckTargets(selection.getRuntimesToTest()));
        env.put(EnvironmentVariable.RUNTIMES_CHECK_TARGETS_NEEDS_RECONFIG.getKey(),
                joinCheckTargets(selection.getRuntimesToTestNeedsReconfig()));
        env.put(EnvironmentVariable.ENABLE_CIR.getKey(), selection.isCirEnabled() ? "ON" : "OFF");
        return env;
    }

    private static String joinProjects(Collection<String> projects) {
        return projects.stream()
                .sorted()
                .collect(Collectors.joining(PROJECT_DELIMITER));
    }

    // Ordered by project name, not by target name.
    private String joinCheckTargets(Collection<String> projects) {
        return projects.stream()
                .sorted()
                .map(configuration::checkTargetOf)
                .flatMap(Optional::stream)
                .collect(Collectors.joining(TARGET_DELIMITER));
    }
}
