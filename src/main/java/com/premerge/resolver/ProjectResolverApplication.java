package com.premerge.resolver;

import com.premerge.resolver.cli.ComputeProjectsCommand;
import picocli.CommandLine;

/**
 * Main entry point for the premerge project resolver.
 * Reads changed file paths and prints the build and test selection as shell variables.
 */
public class ProjectResolverApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new ComputeProjectsCommand()).execute(args);
        System.exit(exitCode);
    }
}
