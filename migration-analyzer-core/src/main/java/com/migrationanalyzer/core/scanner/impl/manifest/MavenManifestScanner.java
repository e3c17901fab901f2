package com.migrationanalyzer.core.scanner.impl.manifest;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.fasterxml.jackson.databind.JsonNode;
import com.migrationanalyzer.core.model.BuildPlugin;
import com.migrationanalyzer.core.model.Dependency;
import com.migrationanalyzer.core.model.Ecosystem;
import com.migrationanalyzer.core.model.ManifestSummary;
import com.migrationanalyzer.core.scanner.ScanContext;
import com.migrationanalyzer.core.scanner.ScanResult;
import com.migrationanalyzer.core.scanner.ScanStatistics;
import com.migrationanalyzer.core.scanner.base.AbstractJacksonScanner;

/**
 * Scanner for Maven build manifests ({@code pom.xml}).
 *
 * <p>This scanner parses POM files using Jackson XmlMapper to extract declared dependencies,
 * build plugins and the Java language level. It handles property placeholders like
 * {@code ${project.version}} and {@code ${spring.version}} by resolving them from the POM's own
 * properties section; placeholders that cannot be resolved are kept verbatim.
 *
 * <p><b>Parsing Strategy:</b>
 * <ol>
 *   <li>Locate pom.xml files (shallowest first, bounded by the manifest cap)</li>
 *   <li>Parse XML using Jackson XmlMapper (not regex)</li>
 *   <li>Extract dependencies from dependencies and dependencyManagement sections</li>
 *   <li>Resolve property placeholders from the properties section</li>
 *   <li>Extract build plugins and the compiler release/target/source level</li>
 * </ol>
 *
 * <p><b>Language Level Precedence:</b>
 * maven-compiler-plugin {@code release}, {@code target}, {@code source}; then the properties
 * {@code maven.compiler.release}, {@code maven.compiler.target}, {@code maven.compiler.source};
 * then {@code java.version}.
 *
 * <p>A malformed POM never fails the scan: the file contributes no dependencies and a warning
 * is added to the summary.
 *
 * @see Dependency
 */
public class MavenManifestScanner extends AbstractJacksonScanner {

    private static final Pattern PROPERTY_PATTERN = Pattern.compile("\\$\\{([^}]+)\\}");
    public static final String SCANNER_ID = "maven-manifest";
    private static final String SCANNER_DISPLAY_NAME = "Maven Manifest Scanner";
    private static final String POM_FILE_PATTERN = "pom.xml";
    private static final int SCANNER_PRIORITY = 10;

    private static final String KEY_GROUP_ID = "groupId";
    private static final String KEY_ARTIFACT_ID = "artifactId";
    private static final String KEY_VERSION = "version";
    private static final String KEY_PARENT = "parent";
    private static final String KEY_PROPERTIES = "properties";
    private static final String KEY_DEPENDENCIES = "dependencies";
    private static final String KEY_DEPENDENCY_MANAGEMENT = "dependencyManagement";
    private static final String KEY_DEPENDENCY = "dependency";
    private static final String KEY_SCOPE = "scope";
    private static final String KEY_BUILD = "build";
    private static final String KEY_PLUGINS = "plugins";
    private static final String KEY_PLUGIN = "plugin";
    private static final String KEY_PLUGIN_MANAGEMENT = "pluginManagement";
    private static final String KEY_CONFIGURATION = "configuration";

    private static final String DEFAULT_SCOPE = "compile";
    private static final String DEFAULT_PLUGIN_GROUP_ID = "org.apache.maven.plugins";
    private static final String COMPILER_PLUGIN_ARTIFACT_ID = "maven-compiler-plugin";

    private static final String PROPERTY_PROJECT_GROUP_ID = "project.groupId";
    private static final String PROPERTY_PROJECT_ARTIFACT_ID = "project.artifactId";
    private static final String PROPERTY_PROJECT_VERSION = "project.version";
    private static final String PROPERTY_PROJECT_PARENT_VERSION = "project.parent.version";

    private static final List<String> COMPILER_CONFIGURATION_KEYS = List.of("release", "target", "source");
    private static final List<String> LANGUAGE_LEVEL_PROPERTIES = List.of(
        "maven.compiler.release",
        "maven.compiler.target",
        "maven.compiler.source",
        "java.version"
    );

    @Override
    public String getId() {
        return SCANNER_ID;
    }

    @Override
    public String getDisplayName() {
        return SCANNER_DISPLAY_NAME;
    }

    @Override
    public Set<String> getSupportedFilePatterns() {
        return Set.of(POM_FILE_PATTERN);
    }

    @Override
    public int getPriority() {
        return SCANNER_PRIORITY;
    }

    @Override
    public boolean appliesTo(ScanContext context) {
        return hasAnyFiles(context, POM_FILE_PATTERN);
    }

    @Override
    public ScanResult scan(ScanContext context) {
        log.info("Scanning Maven manifests in: {}", context.rootPath());

        List<Path> pomFiles = context.findFiles(POM_FILE_PATTERN);
        if (pomFiles.isEmpty()) {
            log.debug("No pom.xml files found in project");
            return emptyResult();
        }

        ScanStatistics.Builder stats = new ScanStatistics.Builder();
        List<Path> selected = capFiles(pomFiles, context.config().manifestCap(), stats);

        List<Dependency> dependencies = new ArrayList<>();
        List<BuildPlugin> plugins = new ArrayList<>();
        List<String> manifestFiles = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        String languageVersion = null;

        for (Path pomFile : selected) {
            String relativePath = context.relativize(pomFile);
            manifestFiles.add(relativePath);
            stats.incrementFilesScanned();
            try {
                PomContents pom = parsePomFile(pomFile, relativePath);
                dependencies.addAll(pom.dependencies());
                plugins.addAll(pom.plugins());
                if (languageVersion == null) {
                    languageVersion = pom.languageVersion();
                }
            } catch (IOException e) {
                log.warn("Failed to parse pom.xml {}: {}", relativePath, e.getMessage());
                stats.incrementFilesFailed();
                stats.addError("ManifestParseError", relativePath + ": " + e.getMessage());
                warnings.add("Malformed Maven manifest " + relativePath + ": " + firstLine(e.getMessage()));
            }
        }

        log.info("Found {} Maven dependencies across {} POM files", dependencies.size(), selected.size());

        ManifestSummary summary = new ManifestSummary(true, languageVersion, dependencies, plugins, manifestFiles, warnings);
        return new ScanResult(getId(), true, summary, List.of(), List.of(), null, null, warnings, List.of(), stats.build());
    }

    /**
     * Parses a single pom.xml file.
     *
     * @param pomFile path to pom.xml
     * @param relativePath path relative to the analyzed root
     * @return dependencies, plugins and language level declared by the file
     * @throws IOException if file cannot be read or is not well-formed XML
     */
    private PomContents parsePomFile(Path pomFile, String relativePath) throws IOException {
        JsonNode pom = parseXml(pomFile);
        if (pom == null || !pom.isObject()) {
            throw new IOException("Not a POM document");
        }

        Map<String, String> properties = buildProperties(pom);

        List<Dependency> dependencies = new ArrayList<>();
        extractDependencies(pom.get(KEY_DEPENDENCIES), properties, relativePath, dependencies);
        JsonNode dependencyManagement = pom.get(KEY_DEPENDENCY_MANAGEMENT);
        if (dependencyManagement != null) {
            extractDependencies(dependencyManagement.get(KEY_DEPENDENCIES), properties, relativePath, dependencies);
        }

        List<BuildPlugin> plugins = new ArrayList<>();
        JsonNode build = pom.get(KEY_BUILD);
        if (build != null) {
            extractPlugins(build.get(KEY_PLUGINS), properties, plugins);
            JsonNode pluginManagement = build.get(KEY_PLUGIN_MANAGEMENT);
            if (pluginManagement != null) {
                extractPlugins(pluginManagement.get(KEY_PLUGINS), properties, plugins);
            }
        }

        return new PomContents(dependencies, plugins, detectLanguageVersion(build, properties));
    }

    /**
     * Builds the placeholder map from project coordinates and the properties section.
     */
    private Map<String, String> buildProperties(JsonNode pom) {
        JsonNode parent = pom.get(KEY_PARENT);
        String groupId = extractText(pom, KEY_GROUP_ID, extractText(parent, KEY_GROUP_ID));
        String artifactId = extractText(pom, KEY_ARTIFACT_ID);
        String parentVersion = extractText(parent, KEY_VERSION);
        String version = extractText(pom, KEY_VERSION, parentVersion);

        Map<String, String> properties = new HashMap<>();
        if (groupId != null) properties.put(PROPERTY_PROJECT_GROUP_ID, groupId);
        if (artifactId != null) properties.put(PROPERTY_PROJECT_ARTIFACT_ID, artifactId);
        if (version != null) properties.put(PROPERTY_PROJECT_VERSION, version);
        if (parentVersion != null) properties.put(PROPERTY_PROJECT_PARENT_VERSION, parentVersion);

        JsonNode propertiesSection = pom.get(KEY_PROPERTIES);
        if (propertiesSection != null && propertiesSection.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = propertiesSection.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (field.getValue().isValueNode()) {
                    properties.put(field.getKey(), field.getValue().asText().trim());
                }
            }
        }
        return properties;
    }

    /**
     * Extracts dependencies from a {@code <dependencies>} element.
     */
    private void extractDependencies(JsonNode dependenciesNode, Map<String, String> properties,
                                     String relativePath, List<Dependency> dependencies) {
        if (dependenciesNode == null || !dependenciesNode.isObject()) {
            return;
        }

        for (JsonNode dep : normalizeToArray(dependenciesNode.get(KEY_DEPENDENCY))) {
            String artifactId = resolveProperties(extractText(dep, KEY_ARTIFACT_ID), properties);
            if (artifactId == null) {
                log.debug("Skipping dependency without artifactId in {}", relativePath);
                continue;
            }
            String groupId = resolveProperties(extractText(dep, KEY_GROUP_ID), properties);
            String version = resolveProperties(extractText(dep, KEY_VERSION), properties);
            String scope = extractText(dep, KEY_SCOPE, DEFAULT_SCOPE);
            String note = version != null && version.contains("${")
                ? "Unresolved version placeholder " + version
                : null;

            dependencies.add(Dependency.declared(groupId, artifactId, version, scope,
                Ecosystem.MAVEN, relativePath, note));
        }
    }

    /**
     * Extracts build plugins from a {@code <plugins>} element.
     */
    private void extractPlugins(JsonNode pluginsNode, Map<String, String> properties, List<BuildPlugin> plugins) {
        if (pluginsNode == null || !pluginsNode.isObject()) {
            return;
        }

        for (JsonNode plugin : normalizeToArray(pluginsNode.get(KEY_PLUGIN))) {
            String artifactId = extractText(plugin, KEY_ARTIFACT_ID);
            if (artifactId == null) {
                continue;
            }
            plugins.add(new BuildPlugin(
                extractText(plugin, KEY_GROUP_ID, DEFAULT_PLUGIN_GROUP_ID),
                artifactId,
                resolveProperties(extractText(plugin, KEY_VERSION), properties)
            ));
        }
    }

    /**
     * Determines the declared Java language level.
     *
     * @return resolved level, or null if none is declared or it cannot be resolved
     */
    private String detectLanguageVersion(JsonNode build, Map<String, String> properties) {
        JsonNode compilerConfiguration = findCompilerConfiguration(build);
        for (String key : COMPILER_CONFIGURATION_KEYS) {
            String value = resolvedOrNull(extractText(compilerConfiguration, key), properties);
            if (value != null) {
                return value;
            }
        }
        for (String property : LANGUAGE_LEVEL_PROPERTIES) {
            String value = resolvedOrNull(properties.get(property), properties);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private JsonNode findCompilerConfiguration(JsonNode build) {
        if (build == null) {
            return null;
        }
        List<JsonNode> candidates = new ArrayList<>();
        normalizeToArray(build.get(KEY_PLUGINS) == null ? null : build.get(KEY_PLUGINS).get(KEY_PLUGIN))
            .forEach(candidates::add);
        JsonNode pluginManagement = build.get(KEY_PLUGIN_MANAGEMENT);
        if (pluginManagement != null && pluginManagement.get(KEY_PLUGINS) != null) {
            normalizeToArray(pluginManagement.get(KEY_PLUGINS).get(KEY_PLUGIN)).forEach(candidates::add);
        }
        for (JsonNode plugin : candidates) {
            if (COMPILER_PLUGIN_ARTIFACT_ID.equals(extractText(plugin, KEY_ARTIFACT_ID))) {
                return plugin.get(KEY_CONFIGURATION);
            }
        }
        return null;
    }

    private String resolvedOrNull(String value, Map<String, String> properties) {
        String resolved = resolveProperties(value, properties);
        if (resolved == null || resolved.isBlank() || resolved.contains("${")) {
            return null;
        }
        return resolved.trim();
    }

    /**
     * Resolves Maven property placeholders in a string.
     *
     * <p>Examples:
     * <ul>
     *   <li>{@code ${project.version}} → "1.0.0-SNAPSHOT"</li>
     *   <li>{@code ${spring.version}} → "3.2.1"</li>
     *   <li>{@code ${undefined.version}} → "${undefined.version}"</li>
     * </ul>
     *
     * @param value string possibly containing placeholders
     * @param properties property map
     * @return resolved string
     */
    private String resolveProperties(String value, Map<String, String> properties) {
        if (value == null) {
            return null;
        }

        Matcher matcher = PROPERTY_PATTERN.matcher(value);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            String propertyName = matcher.group(1);
            String propertyValue = properties.getOrDefault(propertyName, matcher.group(0));
            matcher.appendReplacement(result, Matcher.quoteReplacement(propertyValue));
        }
        matcher.appendTail(result);

        return result.toString();
    }

    private static String firstLine(String message) {
        if (message == null) {
            return "unknown error";
        }
        int newline = message.indexOf('\n');
        return newline < 0 ? message : message.substring(0, newline);
    }

    private record PomContents(List<Dependency> dependencies, List<BuildPlugin> plugins, String languageVersion) {
    }
}
