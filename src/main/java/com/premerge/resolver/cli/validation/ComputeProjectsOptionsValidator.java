package com.premerge.resolver.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.premerge.resolver.cli.exception.OptionsValidationException;
import com.premerge.resolver.cli.model.ComputeProjectsOptions;
import com.premerge.resolver.cli.model.ValidatedComputeOptions;
import com.premerge.resolver.model.Platform;

public class ComputeProjectsOptionsValidator {

	private static final Logger log = LoggerFactory.getLogger(ComputeProjectsOptionsValidator.class);

	public ValidatedComputeOptions validate(ComputeProjectsOptions o) {
		List<String> errors = new ArrayList<>();

		Platform platform = resolvePlatform(o, errors);

		if (o.getConfigFile() != null && !existsFile(o.getConfigFile())) {
			errors.add("Project tables file does not exist or is not a file: " + o.getConfigFile());
		}
		if (o.getChangedFiles() != null && !existsFile(o.getChangedFiles())) {
			errors.add("Changed files list does not exist or is not a file: " + o.getChangedFiles());
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return new ValidatedComputeOptions(platform, normalize(o.getConfigFile()), normalize(o.getChangedFiles()));
	}

	private static Platform resolvePlatform(ComputeProjectsOptions o, List<String> errors) {
		if (isBlank(o.getPlatformName())) {
			Platform current = Platform.current();
			if (current == Platform.UNKNOWN && o.isStrictPlatform()) {
				errors.add("Cannot determine the current platform from os.name=" + System.getProperty("os.name")
						+ "; pass Linux, Windows or Darwin explicitly.");
			}
			return current;
		}

		Optional<Platform> platform = Platform.fromName(o.getPlatformName());
		if (platform.isPresent()) {
			return platform.get();
		}

		if (o.isStrictPlatform()) {
			errors.add("Unrecognized platform: " + o.getPlatformName() + " (expected Linux, Windows or Darwin).");
		} else {
			log.warn("Unrecognized platform {}; no platform exclusions will be applied", o.getPlatformName());
		}
		return Platform.UNKNOWN;
	}

	private static boolean existsFile(Path p) {
		return p != null && Files.exists(p) && Files.isRegularFile(p);
	}

	private static Path normalize(Path p) {
		return p == null ? null : p.toAbsolutePath().normalize();
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}
}
