package com.premerge.resolver.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds all CLI options for the "compute-projects" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class ComputeProjectsOptions {

	@Parameters(index = "0", arity = "0..1", paramLabel = "PLATFORM",
			description = "Platform to compute projects for: Linux, Windows or Darwin (defaults to the current platform)")
	private String platformName;

	@Option(names = { "--config", "-c" }, description = "Project tables file (defaults to the bundled LLVM monorepo tables)")
	private Path configFile;

	@Option(names = { "--changed-files", "-f" }, description = "File listing changed paths, one per line (defaults to standard input)")
	private Path changedFiles;

	@Option(names = { "--strict-platform" }, description = "Fail instead of applying no exclusions when PLATFORM is not recognized")
	private boolean strictPlatform;

}
