package com.premerge.resolver;

import com.premerge.resolver.matcher.PathMatcher;
import com.premerge.resolver.model.Platform;
import com.premerge.resolver.model.ProjectConfiguration;
import com.premerge.resolver.model.ProjectSelection;
import com.premerge.resolver.render.EnvironmentBuilder;
import com.premerge.resolver.selection.SelectionEngine;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Map;
import java.util.Set;

/**
 * Maps changed files on a platform to the projects, runtimes and check targets to run.
 *
 * Holds no per-call state; one instance can serve any number of concurrent calls.
 */
public class ProjectResolver {
    private static final Logger log = LoggerFactory.getLogger(ProjectResolver.class);

    @Getter
    private final ProjectConfiguration configuration;
    private final PathMatcher pathMatcher;
    private final SelectionEngine selectionEngine;
    private final EnvironmentBuilder environmentBuilder;

    public ProjectResolver(ProjectConfiguration configuration) {
        this.configuration = configuration;
        this.pathMatcher = new PathMatcher(configuration);
        this.selectionEngine = new SelectionEngine(configuration);
        this.environmentBuilder = new EnvironmentBuilder(configuration);
    }

    public ProjectSelection select(Collection<String> changedFiles, Platform platform) {
        Set<String> modifiedProjects = pathMatcher.resolveAll(changedFiles);
        return selectionEngine.select(modifiedProjects, platform);
    }

    public Map<String, String> computeEnvironment(Collection<String> changedFiles, Platform platform) {
        log.debug("Resolving {} changed files for {}", changedFiles.size(), platform.getDisplayName());
        return environmentBuilder.render(select(changedFiles, platform));
    }
}
