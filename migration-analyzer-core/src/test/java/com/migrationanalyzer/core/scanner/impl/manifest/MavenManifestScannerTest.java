package com.migrationanalyzer.core.scanner.impl.manifest;

import com.migrationanalyzer.core.config.AnalyzerConfig;
import com.migrationanalyzer.core.model.BuildPlugin;
import com.migrationanalyzer.core.model.Dependency;
import com.migrationanalyzer.core.model.Ecosystem;
import com.migrationanalyzer.core.model.ManifestSummary;
import com.migrationanalyzer.core.model.Severity;
import com.migrationanalyzer.core.scanner.ScanResult;
import com.migrationanalyzer.core.scanner.ScannerTestBase;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Functional tests for {@link MavenManifestScanner}.
 *
 * <p>Tests the scanner's ability to parse real pom.xml files and extract dependencies, build
 * plugins and the declared Java level, including property substitution.
 */
class MavenManifestScannerTest extends ScannerTestBase {

    private final MavenManifestScanner scanner = new MavenManifestScanner();

    @Test
    void scan_withSimplePom_extractsDependencies() throws IOException {
        // Given: A simple pom.xml with 2 dependencies
        createFile("pom.xml", """
            <?xml version="1.0" encoding="UTF-8"?>
            <project xmlns="http://maven.apache.org/POM/4.0.0">
                <modelVersion>4.0.0</modelVersion>
                <groupId>com.example</groupId>
                <artifactId>legacy-app</artifactId>
                <version>1.0.0</version>

                <dependencies>
                    <dependency>
                        <groupId>org.springframework</groupId>
                        <artifactId>spring-core</artifactId>
                        <version>4.3.30.RELEASE</version>
                    </dependency>
                    <dependency>
                        <groupId>junit</groupId>
                        <artifactId>junit</artifactId>
                        <version>4.13.2</version>
                        <scope>test</scope>
                    </dependency>
                </dependencies>
            </project>
            """);

        // When: Scanner is executed
        ScanResult result = scanner.scan(context);

        // Then: Both dependencies are extracted in manifest order, unclassified
        assertThat(result.success()).isTrue();
        ManifestSummary summary = result.manifest();
        assertThat(summary.found()).isTrue();
        assertThat(summary.manifestFiles()).containsExactly("pom.xml");
        assertThat(summary.dependencies()).hasSize(2);

        Dependency spring = summary.dependencies().get(0);
        assertThat(spring.coordinate()).isEqualTo("org.springframework:spring-core");
        assertThat(spring.declaredVersion()).isEqualTo("4.3.30.RELEASE");
        assertThat(spring.scope()).isEqualTo("compile");
        assertThat(spring.ecosystem()).isEqualTo(Ecosystem.MAVEN);
        assertThat(spring.sourceFile()).isEqualTo("pom.xml");
        assertThat(spring.severity()).isEqualTo(Severity.OK);
        assertThat(spring.outdated()).isFalse();

        assertThat(summary.dependencies().get(1).scope()).isEqualTo("test");
    }

    @Test
    void scan_withPropertySubstitution_resolvesVersions() throws IOException {
        // Given: Versions declared through properties and project coordinates
        createFile("pom.xml", """
            <project>
                <groupId>com.example</groupId>
                <artifactId>legacy-app</artifactId>
                <version>2.5.0</version>
                <properties>
                    <jackson.version>2.9.8</jackson.version>
                </properties>
                <dependencies>
                    <dependency>
                        <groupId>com.fasterxml.jackson.core</groupId>
                        <artifactId>jackson-databind</artifactId>
                        <version>${jackson.version}</version>
                    </dependency>
                    <dependency>
                        <groupId>${project.groupId}</groupId>
                        <artifactId>legacy-common</artifactId>
                        <version>${project.version}</version>
                    </dependency>
                </dependencies>
            </project>
            """);

        // When
        ScanResult result = scanner.scan(context);

        // Then
        List<Dependency> dependencies = result.manifest().dependencies();
        assertThat(dependencies.get(0).declaredVersion()).isEqualTo("2.9.8");
        assertThat(dependencies.get(1).coordinate()).isEqualTo("com.example:legacy-common");
        assertThat(dependencies.get(1).declaredVersion()).isEqualTo("2.5.0");
    }

    @Test
    void scan_withUnresolvedPlaceholder_keepsItVerbatimWithNote() throws IOException {
        createFile("pom.xml", """
            <project>
                <dependencies>
                    <dependency>
                        <groupId>org.hibernate</groupId>
                        <artifactId>hibernate-core</artifactId>
                        <version>${hibernate.version}</version>
                    </dependency>
                </dependencies>
            </project>
            """);

        ScanResult result = scanner.scan(context);

        Dependency hibernate = result.manifest().dependencies().get(0);
        assertThat(hibernate.declaredVersion()).isEqualTo("${hibernate.version}");
        assertThat(hibernate.note()).contains("Unresolved version placeholder");
    }

    @Test
    void scan_withParentVersion_usesItForProjectVersion() throws IOException {
        createFile("pom.xml", """
            <project>
                <parent>
                    <groupId>com.example</groupId>
                    <artifactId>parent</artifactId>
                    <version>3.1.0</version>
                </parent>
                <artifactId>child</artifactId>
                <dependencies>
                    <dependency>
                        <groupId>com.example</groupId>
                        <artifactId>sibling</artifactId>
                        <version>${project.version}</version>
                    </dependency>
                </dependencies>
            </project>
            """);

        ScanResult result = scanner.scan(context);

        assertThat(result.manifest().dependencies().get(0).declaredVersion()).isEqualTo("3.1.0");
    }

    @Test
    void scan_withDependencyManagement_includesManagedDependencies() throws IOException {
        createFile("pom.xml", """
            <project>
                <dependencyManagement>
                    <dependencies>
                        <dependency>
                            <groupId>org.apache.logging.log4j</groupId>
                            <artifactId>log4j-core</artifactId>
                            <version>2.13.0</version>
                        </dependency>
                    </dependencies>
                </dependencyManagement>
                <dependencies>
                    <dependency>
                        <groupId>org.apache.logging.log4j</groupId>
                        <artifactId>log4j-core</artifactId>
                    </dependency>
                </dependencies>
            </project>
            """);

        ScanResult result = scanner.scan(context);

        assertThat(result.manifest().dependencies())
            .extracting(Dependency::declaredVersion)
            .containsExactly(null, "2.13.0");
    }

    @Test
    void scan_withCompilerPluginRelease_detectsLanguageVersion() throws IOException {
        // Given: release in plugin configuration takes precedence over properties
        createFile("pom.xml", """
            <project>
                <properties>
                    <java.version>1.8</java.version>
                    <maven.compiler.target>11</maven.compiler.target>
                </properties>
                <build>
                    <plugins>
                        <plugin>
                            <artifactId>maven-compiler-plugin</artifactId>
                            <version>3.11.0</version>
                            <configuration>
                                <release>17</release>
                            </configuration>
                        </plugin>
                    </plugins>
                </build>
            </project>
            """);

        // When
        ScanResult result = scanner.scan(context);

        // Then
        assertThat(result.manifest().languageVersion()).isEqualTo("17");
        BuildPlugin compiler = result.manifest().buildPlugins().get(0);
        assertThat(compiler.groupId()).isEqualTo("org.apache.maven.plugins");
        assertThat(compiler.artifactId()).isEqualTo("maven-compiler-plugin");
        assertThat(compiler.version()).isEqualTo("3.11.0");
    }

    @Test
    void scan_withPropertiesOnly_prefersCompilerPropertiesOverJavaVersion() throws IOException {
        createFile("pom.xml", """
            <project>
                <properties>
                    <java.version>1.8</java.version>
                    <maven.compiler.source>11</maven.compiler.source>
                </properties>
            </project>
            """);

        ScanResult result = scanner.scan(context);

        assertThat(result.manifest().languageVersion()).isEqualTo("11");
    }

    @Test
    void scan_withJavaVersionProperty_detectsLegacyVersion() throws IOException {
        createFile("pom.xml", """
            <project>
                <properties>
                    <java.version>1.8</java.version>
                </properties>
            </project>
            """);

        ScanResult result = scanner.scan(context);

        assertThat(result.manifest().languageVersion()).isEqualTo("1.8");
    }

    @Test
    void scan_withMultiModuleProject_keepsDuplicatesPerFile() throws IOException {
        // Given: The same coordinate declared in two modules
        String module = """
            <project>
                <dependencies>
                    <dependency>
                        <groupId>com.google.guava</groupId>
                        <artifactId>guava</artifactId>
                        <version>20.0</version>
                    </dependency>
                </dependencies>
            </project>
            """;
        createFile("pom.xml", "<project><modules><module>a</module></modules></project>");
        createFile("b/pom.xml", module);
        createFile("a/pom.xml", module);

        // When
        ScanResult result = scanner.scan(context);

        // Then: Root first, then modules by path; no merging
        assertThat(result.manifest().manifestFiles()).containsExactly("pom.xml", "a/pom.xml", "b/pom.xml");
        assertThat(result.manifest().dependencies())
            .extracting(Dependency::sourceFile)
            .containsExactly("a/pom.xml", "b/pom.xml");
    }

    @Test
    void scan_withMalformedPom_reportsWarningAndContinues() throws IOException {
        // Given: One broken and one valid POM
        createFile("pom.xml", "<project><dependencies><dependency>");
        createFile("module/pom.xml", """
            <project>
                <dependencies>
                    <dependency>
                        <groupId>commons-io</groupId>
                        <artifactId>commons-io</artifactId>
                        <version>2.6</version>
                    </dependency>
                </dependencies>
            </project>
            """);

        // When
        ScanResult result = scanner.scan(context);

        // Then: found stays true, the valid file still contributes
        assertThat(result.success()).isTrue();
        assertThat(result.manifest().found()).isTrue();
        assertThat(result.manifest().warnings()).hasSize(1);
        assertThat(result.manifest().warnings().get(0)).startsWith("Malformed Maven manifest pom.xml");
        assertThat(result.manifest().dependencies()).extracting(Dependency::artifactId).containsExactly("commons-io");
        assertThat(result.statistics().filesFailed()).isEqualTo(1);
    }

    @Test
    void scan_withManifestCap_parsesOnlyFirstFiles() throws IOException {
        for (int i = 0; i < 5; i++) {
            createFile("m" + i + "/pom.xml", "<project><artifactId>m" + i + "</artifactId></project>");
        }
        AnalyzerConfig config = new AnalyzerConfig(null, 3, null, null, null, null, null, null, null);

        ScanResult result = scanner.scan(createContext(config));

        assertThat(result.manifest().manifestFiles()).hasSize(3);
        assertThat(result.statistics().filesSkipped()).isEqualTo(2);
    }

    @Test
    void scan_withPomInTargetDirectory_ignoresIt() throws IOException {
        createFile("target/classes/META-INF/maven/pom.xml", "<project/>");

        assertThat(scanner.appliesTo(context)).isFalse();
        assertThat(scanner.scan(context).manifest().found()).isFalse();
    }
}
