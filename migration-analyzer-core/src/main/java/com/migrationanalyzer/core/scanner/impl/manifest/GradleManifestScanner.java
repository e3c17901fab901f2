package com.migrationanalyzer.core.scanner.impl.manifest;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.migrationanalyzer.core.model.BuildPlugin;
import com.migrationanalyzer.core.model.Dependency;
import com.migrationanalyzer.core.model.Ecosystem;
import com.migrationanalyzer.core.model.ManifestSummary;
import com.migrationanalyzer.core.scanner.ScanContext;
import com.migrationanalyzer.core.scanner.ScanResult;
import com.migrationanalyzer.core.scanner.ScanStatistics;
import com.migrationanalyzer.core.scanner.base.AbstractRegexScanner;
import com.migrationanalyzer.core.scanner.base.SourceLine;

/**
 * Scanner for Gradle build scripts ({@code build.gradle} and {@code build.gradle.kts}).
 *
 * <p>This scanner uses line-oriented regex patterns to extract dependency declarations, plugins
 * and the Java language level from both Groovy DSL and Kotlin DSL build files. Comment lines
 * and block comments are ignored.
 *
 * <p><b>Supported Dependency Notations:</b>
 * <ul>
 *   <li><b>String notation:</b> {@code implementation 'org.springframework:spring-core:5.3.0'}</li>
 *   <li><b>Kotlin function:</b> {@code implementation("org.springframework:spring-core:5.3.0")}</li>
 *   <li><b>Map notation:</b> {@code implementation group: 'org.springframework', name: 'spring-core', version: '5.3.0'}</li>
 *   <li><b>Version catalog:</b> {@code implementation(libs.spring.core)}</li>
 *   <li><b>Platform (BOM):</b> {@code implementation platform('org.springframework.boot:spring-boot-dependencies:2.7.18')},
 *       also {@code enforcedPlatform(...)} and the Kotlin function form</li>
 * </ul>
 *
 * <p><b>Version Resolution:</b>
 * {@code $var} and {@code ${var}} are resolved from {@code ext}, {@code def} and {@code val}
 * assignments in the same file. Catalog aliases, buildSrc constants and unresolved variables
 * produce a dependency without a version and a note explaining why.
 *
 * <p><b>Supported Configurations:</b>
 * implementation, api, compile, compileOnly, runtime, runtimeOnly, testImplementation,
 * testCompile, testCompileOnly, testRuntimeOnly, annotationProcessor, kapt.
 *
 * @see Dependency
 */
public class GradleManifestScanner extends AbstractRegexScanner {

    public static final String SCANNER_ID = "gradle-manifest";
    private static final String DISPLAY_NAME = "Gradle Manifest Scanner";
    private static final int PRIORITY = 20;

    private static final String BUILD_GRADLE_GROOVY_PATTERN = "build.gradle";
    private static final String BUILD_GRADLE_KTS_PATTERN = "build.gradle.kts";

    private static final String CONFIG_IMPLEMENTATION = "implementation";
    private static final String CONFIG_API = "api";
    private static final String CONFIG_COMPILE = "compile";
    private static final String CONFIG_COMPILE_ONLY = "compileOnly";
    private static final String CONFIG_RUNTIME = "runtime";
    private static final String CONFIG_RUNTIME_ONLY = "runtimeOnly";
    private static final String CONFIG_TEST_IMPLEMENTATION = "testImplementation";
    private static final String CONFIG_TEST_COMPILE = "testCompile";
    private static final String CONFIG_TEST_COMPILE_ONLY = "testCompileOnly";
    private static final String CONFIG_TEST_RUNTIME_ONLY = "testRuntimeOnly";
    private static final String CONFIG_ANNOTATION_PROCESSOR = "annotationProcessor";
    private static final String CONFIG_KAPT = "kapt";

    private static final String CONFIGURATIONS_REGEX = String.join("|",
        CONFIG_TEST_IMPLEMENTATION,
        CONFIG_TEST_COMPILE_ONLY,
        CONFIG_TEST_COMPILE,
        CONFIG_TEST_RUNTIME_ONLY,
        CONFIG_IMPLEMENTATION,
        CONFIG_API,
        CONFIG_COMPILE_ONLY,
        CONFIG_COMPILE,
        CONFIG_RUNTIME_ONLY,
        CONFIG_RUNTIME,
        CONFIG_ANNOTATION_PROCESSOR,
        CONFIG_KAPT
    );

    private static final String CONFIG_PREFIX = "(?<![\\w.])(%s)";
    private static final String PLATFORM_WRAPPER = "(?:(?:enforcedPlatform|platform)\\s*\\(\\s*)?";
    private static final String STRING_NOTATION_PATTERN = CONFIG_PREFIX
        + "\\s+" + PLATFORM_WRAPPER + "[\"']([^:\"'\\s]+):([^:\"'\\s]+)(?::([^:\"'@\\s]+))?[^\"']*[\"']";
    private static final String KOTLIN_NOTATION_PATTERN = CONFIG_PREFIX
        + "\\s*\\(\\s*" + PLATFORM_WRAPPER + "[\"']([^:\"'\\s]+):([^:\"'\\s]+)(?::([^:\"'@\\s]+))?[^\"']*[\"']";
    private static final String MAP_NOTATION_PATTERN = CONFIG_PREFIX
        + "\\s*\\(?\\s*group\\s*[:=]\\s*[\"']([^\"']+)[\"']\\s*,\\s*name\\s*[:=]\\s*[\"']([^\"']+)[\"']"
        + "(?:\\s*,\\s*version\\s*[:=]\\s*[\"']([^\"']+)[\"'])?";
    private static final String CATALOG_NOTATION_PATTERN = CONFIG_PREFIX
        + "\\s*\\(?\\s*(libs\\.[\\w.]+)";

    private static final Pattern STRING_NOTATION = Pattern.compile(String.format(STRING_NOTATION_PATTERN, CONFIGURATIONS_REGEX));
    private static final Pattern KOTLIN_NOTATION = Pattern.compile(String.format(KOTLIN_NOTATION_PATTERN, CONFIGURATIONS_REGEX));
    private static final Pattern MAP_NOTATION = Pattern.compile(String.format(MAP_NOTATION_PATTERN, CONFIGURATIONS_REGEX));
    private static final Pattern CATALOG_NOTATION = Pattern.compile(String.format(CATALOG_NOTATION_PATTERN, CONFIGURATIONS_REGEX));

    private static final Pattern PLATFORM_IMPORT = Pattern.compile("(?:enforcedPlatform|platform)\\s*\\(");

    private static final Pattern VARIABLE_ASSIGNMENT = Pattern.compile(
        "^\\s*(?:project\\.)?(?:ext\\.)?(?:def\\s+|val\\s+|var\\s+|String\\s+)?([A-Za-z_][\\w.]*)\\s*=\\s*[\"']([^\"'$]+)[\"']");
    private static final Pattern EXTRA_ASSIGNMENT = Pattern.compile(
        "(?:extra\\[|set\\()\\s*[\"']([\\w.\\-]+)[\"']\\s*(?:]\\s*=|,)\\s*[\"']([^\"'$]+)[\"']");
    private static final Pattern VERSION_VARIABLE = Pattern.compile("^\\$\\{?([\\w.]+)}?$");

    private static final Pattern TOOLCHAIN_VERSION = Pattern.compile(
        "languageVersion\\s*(?:=|\\.set\\()\\s*JavaLanguageVersion\\.of\\(\\s*(\\d+)\\s*\\)");
    private static final Pattern JVM_TOOLCHAIN = Pattern.compile("jvmToolchain\\s*\\(?\\s*(\\d+)");
    private static final Pattern TARGET_COMPATIBILITY = Pattern.compile(
        "targetCompatibility\\s*=?\\s*(?:JavaVersion\\.VERSION_([\\d_]+)|[\"']?([\\d.]+)[\"']?)");
    private static final Pattern SOURCE_COMPATIBILITY = Pattern.compile(
        "sourceCompatibility\\s*=?\\s*(?:JavaVersion\\.VERSION_([\\d_]+)|[\"']?([\\d.]+)[\"']?)");

    private static final Pattern PLUGIN_ID = Pattern.compile(
        "^\\s*id\\s*\\(?\\s*[\"']([\\w.\\-]+)[\"']\\s*\\)?(?:\\s+version\\s*\\(?\\s*[\"']([^\"']+)[\"']\\s*\\)?)?");
    private static final Pattern APPLY_PLUGIN = Pattern.compile("apply\\s*\\(?\\s*plugin\\s*[:=]\\s*[\"']([\\w.\\-]+)[\"']");

    private static final String SCOPE_COMPILE = "compile";
    private static final String SCOPE_PROVIDED = "provided";
    private static final String SCOPE_RUNTIME = "runtime";
    private static final String SCOPE_TEST = "test";

    @Override
    public String getId() {
        return SCANNER_ID;
    }

    @Override
    public String getDisplayName() {
        return DISPLAY_NAME;
    }

    @Override
    public Set<String> getSupportedFilePatterns() {
        return Set.of(BUILD_GRADLE_GROOVY_PATTERN, BUILD_GRADLE_KTS_PATTERN);
    }

    @Override
    public int getPriority() {
        return PRIORITY;
    }

    @Override
    public boolean appliesTo(ScanContext context) {
        return hasAnyFiles(context, BUILD_GRADLE_GROOVY_PATTERN, BUILD_GRADLE_KTS_PATTERN);
    }

    @Override
    public ScanResult scan(ScanContext context) {
        log.info("Scanning Gradle build scripts in: {}", context.rootPath());

        List<Path> gradleFiles = context.findFiles(getSupportedFilePatterns());
        if (gradleFiles.isEmpty()) {
            log.debug("No build.gradle or build.gradle.kts files found in project");
            return emptyResult();
        }

        ScanStatistics.Builder stats = new ScanStatistics.Builder();
        List<Path> selected = capFiles(gradleFiles, context.config().manifestCap(), stats);

        List<Dependency> dependencies = new ArrayList<>();
        List<BuildPlugin> plugins = new ArrayList<>();
        List<String> manifestFiles = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        String languageVersion = null;

        for (Path gradleFile : selected) {
            String relativePath = context.relativize(gradleFile);
            manifestFiles.add(relativePath);
            stats.incrementFilesScanned();
            try {
                List<SourceLine> lines = codeLines(readFileLines(gradleFile));
                parseDependencies(lines, relativePath, dependencies);
                parsePlugins(lines, plugins);
                if (languageVersion == null) {
                    languageVersion = detectLanguageVersion(lines);
                }
            } catch (IOException e) {
                recordUnreadable(relativePath, e, stats, warnings);
            }
        }

        log.info("Found {} Gradle dependencies across {} build files", dependencies.size(), selected.size());

        ManifestSummary summary = new ManifestSummary(true, languageVersion, dependencies, plugins, manifestFiles, warnings);
        return new ScanResult(getId(), true, summary, List.of(), List.of(), null, null, warnings, List.of(), stats.build());
    }

    /**
     * Extracts dependencies from the code lines of a single build file.
     *
     * @param lines non-comment lines
     * @param relativePath build file path relative to the root
     * @param dependencies list to add discovered dependencies
     */
    private void parseDependencies(List<SourceLine> lines, String relativePath, List<Dependency> dependencies) {
        Map<String, String> variables = collectVariables(lines);

        for (SourceLine line : lines) {
            String text = line.text();
            Matcher matcher = findFirst(MAP_NOTATION, text);
            if (matcher == null) {
                matcher = findFirst(KOTLIN_NOTATION, text);
            }
            if (matcher == null) {
                matcher = findFirst(STRING_NOTATION, text);
            }
            if (matcher != null) {
                dependencies.add(toDependency(matcher, variables, relativePath));
                continue;
            }

            Matcher catalog = findFirst(CATALOG_NOTATION, text);
            if (catalog != null) {
                String alias = catalog.group(2);
                String artifactId = alias.substring("libs.".length()).replace('.', '-');
                dependencies.add(new Dependency(alias, null, artifactId, null,
                    mapConfigurationToScope(catalog.group(1)), Ecosystem.GRADLE, relativePath,
                    false, null, "Version managed by version catalog (" + alias + ")"));
                log.debug("Found Gradle catalog dependency: {} ({})", alias, catalog.group(1));
            }
        }
    }

    private Dependency toDependency(Matcher matcher, Map<String, String> variables, String relativePath) {
        String configuration = matcher.group(1);
        String groupId = matcher.group(2);
        String artifactId = matcher.group(3);
        String rawVersion = extractGroup(matcher, 4);

        String version = rawVersion;
        String note = null;
        if (rawVersion == null) {
            note = "No version declared; managed by a platform or plugin";
        } else if (rawVersion.startsWith("$")) {
            Matcher variable = VERSION_VARIABLE.matcher(rawVersion);
            String name = variable.matches() ? variable.group(1) : rawVersion;
            version = variables.get(name);
            if (version == null) {
                note = isBuildSrcReference(name)
                    ? "Version defined in buildSrc (" + name + ")"
                    : "Unresolved version variable " + rawVersion;
            }
        }

        if (PLATFORM_IMPORT.matcher(matcher.group()).find()) {
            note = note == null ? "Platform (BOM) import" : "Platform (BOM) import; " + note;
        }

        log.debug("Found Gradle dependency: {}:{}:{} ({})", groupId, artifactId, version, configuration);
        return Dependency.declared(groupId, artifactId, version, mapConfigurationToScope(configuration),
            Ecosystem.GRADLE, relativePath, note);
    }

    /**
     * Collects string assignments that may hold dependency versions.
     */
    private Map<String, String> collectVariables(List<SourceLine> lines) {
        Map<String, String> variables = new HashMap<>();
        for (SourceLine line : lines) {
            Matcher assignment = findFirst(VARIABLE_ASSIGNMENT, line.text());
            if (assignment == null) {
                assignment = findFirst(EXTRA_ASSIGNMENT, line.text());
            }
            if (assignment != null) {
                String name = assignment.group(1);
                variables.put(name, assignment.group(2));
                if (name.startsWith("ext.")) {
                    variables.put(name.substring("ext.".length()), assignment.group(2));
                }
            }
        }
        return variables;
    }

    private void parsePlugins(List<SourceLine> lines, List<BuildPlugin> plugins) {
        for (SourceLine line : lines) {
            Matcher id = findFirst(PLUGIN_ID, line.text());
            if (id != null) {
                plugins.add(new BuildPlugin(null, id.group(1), extractGroup(id, 2)));
                continue;
            }
            Matcher apply = findFirst(APPLY_PLUGIN, line.text());
            if (apply != null) {
                plugins.add(new BuildPlugin(null, apply.group(1), null));
            }
        }
    }

    /**
     * Determines the declared Java level: toolchain, then targetCompatibility, then
     * sourceCompatibility.
     */
    private String detectLanguageVersion(List<SourceLine> lines) {
        String target = null;
        String source = null;
        for (SourceLine line : lines) {
            String text = line.text();
            Matcher toolchain = findFirst(TOOLCHAIN_VERSION, text);
            if (toolchain == null) {
                toolchain = findFirst(JVM_TOOLCHAIN, text);
            }
            if (toolchain != null) {
                return toolchain.group(1);
            }
            if (target == null) {
                target = compatibilityLevel(findFirst(TARGET_COMPATIBILITY, text));
            }
            if (source == null) {
                source = compatibilityLevel(findFirst(SOURCE_COMPATIBILITY, text));
            }
        }
        return target != null ? target : source;
    }

    private String compatibilityLevel(Matcher matcher) {
        if (matcher == null) {
            return null;
        }
        String enumConstant = extractGroup(matcher, 1);
        if (enumConstant != null) {
            // VERSION_1_8 -> 1.8, VERSION_17 -> 17
            return enumConstant.replace('_', '.');
        }
        String literal = extractGroup(matcher, 2);
        return literal == null || literal.isEmpty() ? null : cleanQuotes(literal);
    }

    private static boolean isBuildSrcReference(String name) {
        return name.contains(".") && Character.isUpperCase(name.charAt(0));
    }

    /**
     * Maps Gradle configuration to Maven scope equivalent.
     *
     * @param configuration Gradle configuration (implementation, api, etc.)
     * @return Maven scope (compile, runtime, test, etc.)
     */
    private String mapConfigurationToScope(String configuration) {
        return switch (configuration) {
            case CONFIG_IMPLEMENTATION, CONFIG_API, CONFIG_COMPILE -> SCOPE_COMPILE;
            case CONFIG_COMPILE_ONLY, CONFIG_ANNOTATION_PROCESSOR, CONFIG_KAPT -> SCOPE_PROVIDED;
            case CONFIG_RUNTIME, CONFIG_RUNTIME_ONLY -> SCOPE_RUNTIME;
            case CONFIG_TEST_IMPLEMENTATION, CONFIG_TEST_COMPILE, CONFIG_TEST_COMPILE_ONLY,
                CONFIG_TEST_RUNTIME_ONLY -> SCOPE_TEST;
            default -> SCOPE_COMPILE;
        };
    }
}
