package com.premerge.resolver.selection;

import com.premerge.resolver.ProjectResolver;
import com.premerge.resolver.config.DefaultProjectTables;
import com.premerge.resolver.model.Platform;
import com.premerge.resolver.model.ProjectConfiguration;
import com.premerge.resolver.model.ProjectSelection;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Properties that hold for every change against the bundled LLVM tables.
 */
class SelectionPropertiesTest {

    private static final List<String> SAMPLE_FILES = List.of(
            "llvm/CMakeLists.txt",
            "clang/lib/Sema/Sema.cpp",
            "clang/lib/CIR/CMakeLists.txt",
            "clang-tools-extra/clangd/ClangdServer.cpp",
            "lld/ELF/Driver.cpp",
            "lldb/source/Core/Debugger.cpp",
            "mlir/lib/IR/Builders.cpp",
            "flang/lib/Parser/parsing.cpp",
            "flang-rt/lib/runtime/io-api.cpp",
            "bolt/lib/Core/BinaryContext.cpp",
            "polly/lib/Support/ScopHelper.cpp",
            "libclc/CMakeLists.txt",
            "openmp/runtime/src/kmp.h",
            "compiler-rt/lib/asan/asan_allocator.cpp",
            "libc/src/string/memcpy.cpp",
            "libcxx/include/vector",
            "llvm/utils/lit/lit/main.py",
            "llvm/docs/CIBestPractices.rst",
            ".ci/compute_projects.py",
            "README.md"
    );

    private final ProjectConfiguration configuration = DefaultProjectTables.llvmMonorepo();
    private final ProjectResolver resolver = new ProjectResolver(configuration);

    @ParameterizedTest
    @EnumSource(Platform.class)
    void testRenderingIsIdempotent(Platform platform) {
        Map<String, String> first = resolver.computeEnvironment(SAMPLE_FILES, platform);
        Map<String, String> second = resolver.computeEnvironment(SAMPLE_FILES, platform);

        assertThat(second).isEqualTo(first);
        assertThat(second.toString()).isEqualTo(first.toString());
    }

    @ParameterizedTest
    @EnumSource(Platform.class)
    void testClosureOfTestedProjectsIsComplete(Platform platform) {
        SelectionEngine engine = new SelectionEngine(configuration);

        for (String file : SAMPLE_FILES) {
            ProjectSelection selection = resolver.select(List.of(file), platform);
            Set<String> closure = engine.dependencyClosure(selection.getProjectsToTest(), Set.of());

            for (String project : closure) {
                assertThat(closure)
                        .as("dependencies of %s for %s on %s", project, file, platform)
                        .containsAll(configuration.dependenciesOf(project));
            }

            Set<String> expectedBuilt = new HashSet<>(closure);
            expectedBuilt.removeAll(configuration.getSkipBuildProjects());
            assertThat(selection.getProjectsToBuild())
                    .as("built projects for %s on %s", file, platform)
                    .containsAll(expectedBuilt);
        }
    }

    @ParameterizedTest
    @EnumSource(Platform.class)
    void testRuntimesBringTheirDirectDependencies(Platform platform) {
        for (String file : SAMPLE_FILES) {
            ProjectSelection selection = resolver.select(List.of(file), platform);

            for (String runtime : selection.getRuntimesToBuild()) {
                Set<String> dependencies = new HashSet<>(configuration.dependenciesOf(runtime));
                dependencies.removeAll(configuration.getSkipBuildProjects());
                assertThat(selection.getProjectsToBuild())
                        .as("dependencies of runtime %s for %s on %s", runtime, file, platform)
                        .containsAll(dependencies);
            }
        }
    }

    @Test
    void testRuntimeDependenciesStopAtOneLevel() {
        ProjectSelection selection = resolver.select(List.of("compiler-rt/lib/asan/asan_allocator.cpp"), Platform.LINUX);

        // compiler-rt needs clang and lld; their own dependency on llvm is not pulled in
        assertThat(selection.getProjectsToBuild()).containsExactlyInAnyOrder("clang", "lld");
    }

    @ParameterizedTest
    @EnumSource(value = Platform.class, mode = EnumSource.Mode.EXCLUDE, names = "UNKNOWN")
    void testPlatformExclusionsNeverLeak(Platform platform) {
        Set<String> excluded = configuration.exclusionsFor(platform);
        ProjectSelection selection = resolver.select(SAMPLE_FILES, platform);

        assertThat(selection.getProjectsToTest()).doesNotContainAnyElementsOf(excluded);
        assertThat(selection.getProjectsToBuild()).doesNotContainAnyElementsOf(excluded);
        assertThat(selection.getRuntimesToTest()).doesNotContainAnyElementsOf(excluded);
        assertThat(selection.getRuntimesToTestNeedsReconfig()).doesNotContainAnyElementsOf(excluded);
        assertThat(selection.getRuntimesToBuild()).doesNotContainAnyElementsOf(excluded);
    }

    @ParameterizedTest
    @EnumSource(value = Platform.class, mode = EnumSource.Mode.EXCLUDE, names = "UNKNOWN")
    void testPlatformExclusionsStayOutOfTheBuildForSingleFiles(Platform platform) {
        Set<String> excluded = configuration.exclusionsFor(platform);

        for (String file : SAMPLE_FILES) {
            ProjectSelection selection = resolver.select(List.of(file), platform);

            assertThat(selection.getProjectsToBuild())
                    .as("%s on %s", file, platform)
                    .doesNotContainAnyElementsOf(excluded);
            assertThat(selection.getRuntimesToBuild())
                    .as("%s on %s", file, platform)
                    .doesNotContainAnyElementsOf(excluded);
        }
    }

    @ParameterizedTest
    @EnumSource(Platform.class)
    void testAddingFilesNeverRemovesProjects(Platform platform) {
        List<String> files = new ArrayList<>();
        ProjectSelection previous = resolver.select(files, platform);

        for (String file : SAMPLE_FILES) {
            files.add(file);
            ProjectSelection next = resolver.select(files, platform);

            assertThat(next.getProjectsToTest()).containsAll(previous.getProjectsToTest());
            assertThat(next.getProjectsToBuild()).containsAll(previous.getProjectsToBuild());
            assertThat(next.getRuntimesToTest()).containsAll(previous.getRuntimesToTest());
            assertThat(next.getRuntimesToTestNeedsReconfig()).containsAll(previous.getRuntimesToTestNeedsReconfig());
            assertThat(next.getRuntimesToBuild()).containsAll(previous.getRuntimesToBuild());
            if (previous.isCirEnabled()) {
                assertThat(next.isCirEnabled()).isTrue();
            }
            previous = next;
        }
    }

    @Test
    void testUnknownPlatformExcludesNothing() {
        assertThat(configuration.exclusionsFor(Platform.UNKNOWN)).isEmpty();
        assertThat(resolver.select(List.of("openmp/runtime/src/kmp.h"), Platform.UNKNOWN).getProjectsToTest())
                .contains("openmp");
    }

    @Test
    void testSkippedMetaProjectsAbsorbTheirFiles() {
        for (String file : List.of("llvm/docs/index.rst", "clang/docs/ReleaseNotes.rst", "llvm/utils/gn/build/BUILD.gn")) {
            assertThat(resolver.select(List.of(file), Platform.LINUX)).isEqualTo(ProjectSelection.empty());
        }
    }
}
