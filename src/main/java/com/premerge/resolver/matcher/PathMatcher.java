package com.premerge.resolver.matcher;

import com.premerge.resolver.model.MetaProjectRule;
import com.premerge.resolver.model.PathPattern;
import com.premerge.resolver.model.ProjectConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Attributes changed files to the projects that own them.
 *
 * A file belongs to its top-level directory plus every meta-project whose pattern
 * matches it. A match on a skipped meta-project drops the file altogether.
 */
public class PathMatcher {
    private static final Logger log = LoggerFactory.getLogger(PathMatcher.class);

    private final ProjectConfiguration configuration;

    public PathMatcher(ProjectConfiguration configuration) {
        this.configuration = configuration;
    }

    public Set<String> resolve(String filePath) {
        List<String> segments = PathPattern.split(filePath);
        if (segments.isEmpty()) {
            return Set.of();
        }

        Set<String> projects = new LinkedHashSet<>();
        for (MetaProjectRule rule : configuration.getMetaProjects()) {
            if (!rule.getPattern().matches(segments)) {
                continue;
            }
            if (configuration.getSkipProjects().contains(rule.getProject())) {
                log.debug("Ignoring {}: matches skipped meta-project {}", filePath, rule.getProject());
                return Set.of();
            }
            projects.add(rule.getProject());
        }

        projects.add(segments.get(0));
        return projects;
    }

    /**
     * Union of {@link #resolve(String)} over all files.
     */
    public Set<String> resolveAll(Collection<String> filePaths) {
        Set<String> projects = new LinkedHashSet<>();
        for (String filePath : filePaths) {
            projects.addAll(resolve(filePath));
        }
        log.debug("Modified projects: {}", projects);
        return projects;
    }
}
