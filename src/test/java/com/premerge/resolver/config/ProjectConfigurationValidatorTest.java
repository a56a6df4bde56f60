package com.premerge.resolver.config;

import com.premerge.resolver.model.MetaProjectRule;
import com.premerge.resolver.model.PathPattern;
import com.premerge.resolver.model.Platform;
import com.premerge.resolver.model.ProjectConfiguration;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for the load-time table checks.
 */
class ProjectConfigurationValidatorTest {

    private final ProjectConfigurationValidator validator = new ProjectConfigurationValidator();

    private static ProjectConfiguration.ProjectConfigurationBuilder valid() {
        return ProjectConfiguration.builder()
                .project("core")
                .project("frontend")
                .runtime("rt")
                .dependency("frontend", Set.of("core"))
                .dependency("rt", Set.of("frontend"))
                .dependentsEntry("core", Set.of("frontend", "meta"))
                .runtimesToTestEntry("frontend", Set.of("rt"))
                .checkTarget("meta", "check-meta")
                .metaProject(new MetaProjectRule(PathPattern.parse("core/meta"), "meta"))
                .metaProject(new MetaProjectRule(PathPattern.parse("*/docs"), "docs"))
                .skipProject("docs")
                .skipBuildProject("meta")
                .cirSentinel("meta");
    }

    @Test
    void testValidConfiguration() {
        assertThatCode(() -> validator.validate(valid().build(), "test")).doesNotThrowAnyException();
    }

    @Test
    void testBundledTablesAreValid() {
        assertThatCode(DefaultProjectTables::llvmMonorepo).doesNotThrowAnyException();
    }

    @Test
    void testUnknownNamesInGraphs() {
        ProjectConfiguration c = valid()
                .dependency("ghost", Set.of("core"))
                .dependentsEntry("frontend", Set.of("phantom"))
                .build();

        assertThatThrownBy(() -> validator.validate(c, "test"))
                .isInstanceOfSatisfying(ConfigurationException.class, e -> assertThat(e.getErrors())
                        .containsExactlyInAnyOrder(
                                "depends: unknown project ghost",
                                "dependents frontend: unknown project phantom"));
    }

    @Test
    void testRuntimeTablesMayOnlyNameRuntimes() {
        ProjectConfiguration c = valid()
                .runtimesToTestNeedsReconfigEntry("core", Set.of("frontend"))
                .build();

        assertThatThrownBy(() -> validator.validate(c, "test"))
                .isInstanceOfSatisfying(ConfigurationException.class, e -> assertThat(e.getErrors())
                        .containsExactly("runtimes-to-test-reconfig core: frontend is not a runtime"));
    }

    @Test
    void testSkipProjectsMustBeMetaProjects() {
        ProjectConfiguration c = valid().skipProject("core").build();

        assertThatThrownBy(() -> validator.validate(c, "test"))
                .isInstanceOfSatisfying(ConfigurationException.class, e -> assertThat(e.getErrors())
                        .containsExactly("skip: core is not the target of any meta rule"));
    }

    @Test
    void testExclusionsAndSentinelAreChecked() {
        ProjectConfiguration c = valid()
                .exclusion(Platform.LINUX, Set.of("nowhere"))
                .exclusion(Platform.UNKNOWN, Set.of("core"))
                .cirSentinel("CIR")
                .build();

        assertThatThrownBy(() -> validator.validate(c, "test"))
                .isInstanceOfSatisfying(ConfigurationException.class, e -> assertThat(e.getErrors())
                        .containsExactlyInAnyOrder(
                                "exclude Linux: unknown project nowhere",
                                "exclude: exclusions cannot be declared for the unknown platform",
                                "cir-sentinel: unknown project CIR"));
    }

    @Test
    void testRuntimeDeclaredAsProject() {
        ProjectConfiguration c = valid().project("rt").build();

        assertThatThrownBy(() -> validator.validate(c, "test"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Runtime is also declared as a project: rt");
    }
}
