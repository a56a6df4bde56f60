package com.premerge.resolver.model;

import lombok.NonNull;
import lombok.Value;

/**
 * Redirects files under {@link #pattern} to a project other than their top-level directory.
 */
@Value
public class MetaProjectRule {
    @NonNull
    PathPattern pattern;

    @NonNull
    String project;
}
