package com.premerge.resolver.cli.model;

import java.nio.file.Path;

import com.premerge.resolver.model.Platform;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the command. Keeps ComputeProjectsCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedComputeOptions {
    Platform platform;
    Path configFile;
    Path changedFiles;

    public boolean isUsingBundledTables() {
        return configFile == null;
    }

    public boolean isReadingStandardInput() {
        return changedFiles == null;
    }
}
