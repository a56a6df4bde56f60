package com.premerge.resolver.cli.exception;

import java.util.List;

import picocli.CommandLine.ExitCode;

/**
 * Rejected compute-projects options. Carries every problem found and maps to the usage exit code.
 */
public class OptionsValidationException extends RuntimeException {

	private static final long serialVersionUID = 1L;
	private final List<String> errors;

	public OptionsValidationException(List<String> errors) {
		super("Invalid compute-projects options:" + System.lineSeparator()
				+ String.join(System.lineSeparator(), errors));
		this.errors = List.copyOf(errors);
	}

	public List<String> getErrors() {
		return errors;
	}

	public int getExitCode() {
		return ExitCode.USAGE;
	}
}
