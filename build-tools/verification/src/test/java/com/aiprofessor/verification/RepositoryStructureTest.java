package com.aiprofessor.verification;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/**
 * Checks the multi-module layout and the root build file, so a module dropped from the reactor or
 * a stray build system is caught by the normal build.
 */
@DisplayName("Repository Structure")
class RepositoryStructureTest {

    private static final Pattern MODULE = Pattern.compile("<module>([^<]+)</module>");

    private static Path projectRoot;
    private static String rootPom;

    @BeforeAll
    static void resolveProjectRoot() throws IOException {
        // Maven runs tests with CWD = module directory (build-tools/verification)
        projectRoot = Path.of(System.getProperty("user.dir")).getParent().getParent();
        assertThat(projectRoot.resolve("pom.xml"))
                .as("Root pom.xml must exist at project root: %s", projectRoot)
                .exists();
        rootPom = Files.readString(projectRoot.resolve("pom.xml"));
    }

    private static List<String> declaredModules() {
        Matcher matcher = MODULE.matcher(rootPom);
        List<String> modules = new ArrayList<>();
        while (matcher.find()) {
            modules.add(matcher.group(1).trim());
        }
        return modules;
    }

    @Nested
    @DisplayName("Root build")
    class RootBuild {

        @Test
        @DisplayName("declares the libraries, the service and this module")
        void declaresModules() {
            assertThat(declaredModules())
                    .containsExactly(
                            "libs/observability",
                            "libs/security",
                            "libs/database",
                            "services/simulation-service",
                            "build-tools/verification");
        }

        @Test
        @DisplayName("every declared module has its own pom.xml")
        void everyModuleHasPom() {
            for (String module : declaredModules()) {
                assertThat(projectRoot.resolve(module).resolve("pom.xml"))
                        .as("pom.xml of %s", module)
                        .isRegularFile();
            }
        }

        @Test
        @DisplayName("targets Java 17")
        void targetsJava17() {
            assertThat(rootPom).contains("<maven.compiler.release>17</maven.compiler.release>");
            assertThat(rootPom).contains("<project.build.sourceEncoding>UTF-8</project.build.sourceEncoding>");
        }

        @Test
        @DisplayName("pins the Spring Boot parent")
        void springBootParent() {
            assertThat(rootPom).contains("<artifactId>spring-boot-starter-parent</artifactId>");
        }

        @Test
        @DisplayName("enforces the Java and Maven versions")
        void enforcerConfigured() {
            assertThat(rootPom).contains("maven-enforcer-plugin").contains("<requireJavaVersion>");
        }

        @Test
        @DisplayName("declares no extra repositories")
        void noExtraRepositories() {
            assertThat(rootPom).doesNotContain("<repositories>");
        }
    }

    @Nested
    @DisplayName("Build system")
    class BuildSystem {

        @ParameterizedTest
        @ValueSource(strings = {"build.gradle", "build.gradle.kts", "settings.gradle", "gradlew", "build.xml"})
        @DisplayName("only Maven builds the repository")
        void noOtherBuildFiles(String fileName) throws IOException {
            try (Stream<Path> files = Files.walk(projectRoot)) {
                List<Path> found =
                        files.filter(path -> !path.toString().contains("/target/"))
                                .filter(path -> path.getFileName().toString().equals(fileName))
                                .collect(Collectors.toList());
                assertThat(found).isEmpty();
            }
        }
    }

    @Nested
    @DisplayName("Source layout")
    class SourceLayout {

        @ParameterizedTest
        @ValueSource(
                strings = {
                    "libs/observability/src/main/java/com/aiprofessor/observability",
                    "libs/security/src/main/java/com/aiprofessor/security",
                    "libs/database/src/main/java/com/aiprofessor/database",
                    "services/simulation-service/src/main/java/com/aiprofessor/simulation"
                })
        @DisplayName("each module keeps its sources under its own package")
        void modulePackages(String directory) {
            assertThat(projectRoot.resolve(directory)).isDirectory();
        }

        @Test
        @DisplayName("the service ships its configuration and messages")
        void serviceResources() {
            Path resources = projectRoot.resolve("services/simulation-service/src/main/resources");
            assertThat(resources.resolve("application.yml")).isRegularFile();
            assertThat(resources.resolve("logback-spring.xml")).isRegularFile();
            assertThat(resources.resolve("messages.properties")).isRegularFile();
            assertThat(resources.resolve("messages_fr.properties")).isRegularFile();
        }
    }
}
