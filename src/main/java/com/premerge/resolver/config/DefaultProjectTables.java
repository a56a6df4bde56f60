package com.premerge.resolver.config;

import com.premerge.resolver.model.ProjectConfiguration;
import lombok.experimental.UtilityClass;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/**
 * Tables for the LLVM monorepo, bundled as a classpath resource.
 */
@UtilityClass
public class DefaultProjectTables {

    public static final String RESOURCE = "/projects/llvm-monorepo.conf";

    public static ProjectConfiguration llvmMonorepo() {
        try (InputStream in = DefaultProjectTables.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Bundled project tables not found on classpath: " + RESOURCE);
            }
            return new ProjectConfigurationParser().parse(in, RESOURCE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read bundled project tables " + RESOURCE, e);
        }
    }
}
