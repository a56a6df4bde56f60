package com.premerge.resolver.cli.output;

import java.io.PrintWriter;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.premerge.resolver.cli.model.ValidatedComputeOptions;

/**
 * Responsible only for CLI output of the "compute-projects" command.
 * The environment goes to standard output; everything else is logged.
 */
public class EnvironmentPrinter {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentPrinter.class);

    public void printBanner(ValidatedComputeOptions v, int changedFileCount) {
        log.info("Platform: {}", v.getPlatform().getDisplayName());
        log.info("Project Tables: {}", v.isUsingBundledTables() ? "bundled LLVM monorepo" : v.getConfigFile());
        log.info("Changed Files: {} (from {})", changedFileCount,
                v.isReadingStandardInput() ? "standard input" : v.getChangedFiles());
    }

    /**
     * Writes one {@code key='value'} line per entry, suitable for {@code eval} in a shell.
     */
    public void printEnvironment(Map<String, String> env, PrintWriter out) {
        env.forEach((key, value) -> out.println(key + "='" + value + "'"));
        out.flush();
    }
}
