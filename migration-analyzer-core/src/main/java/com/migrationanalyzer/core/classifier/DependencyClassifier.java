package com.migrationanalyzer.core.classifier;

import com.migrationanalyzer.core.config.AnalysisThresholds;
import com.migrationanalyzer.core.config.AnalyzerConfig;
import com.migrationanalyzer.core.model.Dependency;
import com.migrationanalyzer.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Assigns a severity verdict to each declared dependency.
 *
 * <p>Classification is a pure function of the dependency and the rule tables:
 * <ol>
 *   <li>The first matching {@link VulnerabilityRule} decides severity and note; the dependency is
 *       marked outdated.</li>
 *   <li>Otherwise the {@link StalenessRule} table compares major versions with the latest known
 *       release: {@code stalenessMediumMajors} or more behind is MEDIUM, {@code stalenessLowMajors}
 *       or more is LOW.</li>
 *   <li>Otherwise the verdict is OK and not outdated. Missing table data or an unparseable
 *       version never produces a warning severity.</li>
 * </ol>
 *
 * <p>Only vulnerability rules can produce CRITICAL. The built-in tables are immutable; extra
 * vulnerability rules and latest-version overrides come from {@link AnalyzerConfig}.
 */
public class DependencyClassifier {

    private static final Logger log = LoggerFactory.getLogger(DependencyClassifier.class);

    /**
     * Built-in vulnerability table. Order matters: the first matching rule wins.
     */
    public static final List<VulnerabilityRule> DEFAULT_VULNERABILITIES = List.of(
        new VulnerabilityRule("log4j-core", MatchMode.CONTAINS, "CVE-2021-44228",
            "Log4Shell remote code execution via JNDI lookups", Severity.CRITICAL, "2.17.1"),
        new VulnerabilityRule("log4j", MatchMode.EXACT, "CVE-2019-17571",
            "Log4j 1.x is end of life; SocketServer deserialization allows remote code execution",
            Severity.CRITICAL, "2.0"),
        new VulnerabilityRule("struts", MatchMode.CONTAINS, "CVE-2023-50164",
            "Struts file upload path traversal leading to remote code execution", Severity.CRITICAL, "6.3.0.2"),
        new VulnerabilityRule("commons-fileupload", MatchMode.CONTAINS, "CVE-2016-1000031",
            "DiskFileItem deserialization allows remote code execution", Severity.HIGH, "1.3.3"),
        new VulnerabilityRule("commons-beanutils", MatchMode.CONTAINS, "CVE-2019-10086",
            "PropertyUtilsBean does not suppress the class property", Severity.HIGH, "1.9.4"),
        new VulnerabilityRule("commons-collections", MatchMode.CONTAINS, "CVE-2015-7501",
            "InvokerTransformer deserialization gadget chain", Severity.HIGH, "3.2.2"),
        new VulnerabilityRule("spring-beans", MatchMode.CONTAINS, "CVE-2022-22965",
            "Spring4Shell data binding remote code execution", Severity.CRITICAL, "5.3.18"),
        new VulnerabilityRule("jackson-databind", MatchMode.EXACT, "CVE-2019-14540",
            "Polymorphic typing deserialization gadget", Severity.HIGH, "2.10.0"),
        new VulnerabilityRule("xstream", MatchMode.CONTAINS, "CVE-2021-39144",
            "Remote code execution through manipulated input stream", Severity.HIGH, "1.4.18"),
        new VulnerabilityRule("snakeyaml", MatchMode.CONTAINS, "CVE-2022-1471",
            "Constructor deserialization allows remote code execution", Severity.HIGH, "2.0"),
        new VulnerabilityRule("h2", MatchMode.EXACT, "CVE-2021-42392",
            "H2 console JNDI remote code execution", Severity.CRITICAL, "2.0.206")
    );

    /**
     * Built-in latest known versions, keyed {@code group:artifact} or {@code group:*}.
     */
    public static final Map<String, String> DEFAULT_LATEST_VERSIONS = defaultLatestVersions();

    private final List<VulnerabilityRule> vulnerabilityRules;
    private final List<StalenessRule> stalenessRules;
    private final AnalysisThresholds thresholds;

    /**
     * Creates a classifier with the built-in tables and default thresholds.
     */
    public DependencyClassifier() {
        this(AnalyzerConfig.defaults());
    }

    /**
     * Creates a classifier with the built-in tables extended by configuration.
     *
     * @param config analyzer configuration
     */
    public DependencyClassifier(AnalyzerConfig config) {
        List<VulnerabilityRule> rules = new ArrayList<>(DEFAULT_VULNERABILITIES);
        rules.addAll(config.vulnerabilities());
        this.vulnerabilityRules = List.copyOf(rules);

        Map<String, String> latest = new LinkedHashMap<>(DEFAULT_LATEST_VERSIONS);
        latest.putAll(config.latestVersions());
        // exact coordinates take precedence over group-wide entries
        this.stalenessRules = latest.entrySet().stream()
            .map(entry -> new StalenessRule(entry.getKey(), entry.getValue()))
            .sorted(Comparator.comparing(StalenessRule::isGroupWide))
            .toList();
        this.thresholds = config.thresholds();
    }

    /**
     * Classifies dependencies, preserving their order.
     *
     * @param dependencies declared dependencies, may be null
     * @return new list of classified dependencies in the same order
     */
    public List<Dependency> classify(List<Dependency> dependencies) {
        if (dependencies == null) {
            return List.of();
        }
        return dependencies.stream()
            .map(this::classify)
            .toList();
    }

    /**
     * Classifies a single dependency.
     *
     * @param dependency declared dependency
     * @return dependency carrying its verdict
     */
    public Dependency classify(Dependency dependency) {
        for (VulnerabilityRule rule : vulnerabilityRules) {
            if (rule.appliesTo(dependency)) {
                log.debug("{} {} matches {}", dependency.coordinate(), dependency.declaredVersion(), rule.cveId());
                return dependency.withVerdict(rule.severity(), true, combine(dependency.note(), rule.note()));
            }
        }

        Optional<Version> declared = Version.parse(dependency.declaredVersion());
        Optional<StalenessRule> staleness = stalenessRules.stream()
            .filter(rule -> rule.covers(dependency))
            .findFirst();
        if (declared.isEmpty() || staleness.isEmpty()) {
            return dependency.withVerdict(Severity.OK, false, dependency.note());
        }

        Optional<Version> latest = Version.parse(staleness.get().latestVersion());
        if (latest.isEmpty()) {
            return dependency.withVerdict(Severity.OK, false, dependency.note());
        }

        int majorsBehind = latest.get().major() - declared.get().major();
        Severity severity;
        if (majorsBehind >= thresholds.stalenessMediumMajors()) {
            severity = Severity.MEDIUM;
        } else if (majorsBehind >= thresholds.stalenessLowMajors()) {
            severity = Severity.LOW;
        } else {
            return dependency.withVerdict(Severity.OK, false, dependency.note());
        }

        String note = majorsBehind + (majorsBehind == 1 ? " major version" : " major versions")
            + " behind latest known " + staleness.get().latestVersion();
        return dependency.withVerdict(severity, true, combine(dependency.note(), note));
    }

    private static String combine(String existing, String verdict) {
        return existing == null || existing.isBlank() ? verdict : existing + "; " + verdict;
    }

    private static Map<String, String> defaultLatestVersions() {
        Map<String, String> latest = new LinkedHashMap<>();
        latest.put("org.springframework:*", "6.1.10");
        latest.put("org.springframework.boot:*", "3.3.1");
        latest.put("org.springframework.security:*", "6.3.1");
        latest.put("org.hibernate:*", "6.5.2");
        latest.put("org.hibernate.orm:*", "6.5.2");
        latest.put("junit:junit", "4.13.2");
        latest.put("org.junit.jupiter:*", "5.10.3");
        latest.put("org.testng:testng", "7.10.2");
        latest.put("org.mockito:*", "5.12.0");
        latest.put("org.assertj:assertj-core", "3.26.3");
        latest.put("com.fasterxml.jackson.core:*", "2.17.2");
        latest.put("com.google.guava:guava", "33.2.1");
        latest.put("org.apache.commons:commons-lang3", "3.14.0");
        latest.put("commons-io:commons-io", "2.16.1");
        latest.put("org.slf4j:*", "2.0.13");
        latest.put("ch.qos.logback:*", "1.5.6");
        latest.put("org.apache.logging.log4j:*", "2.23.1");
        latest.put("org.apache.httpcomponents:httpclient", "4.5.14");
        latest.put("org.apache.httpcomponents.client5:httpclient5", "5.3.1");
        latest.put("org.postgresql:postgresql", "42.7.3");
        latest.put("com.mysql:mysql-connector-j", "8.4.0");
        latest.put("mysql:mysql-connector-java", "8.0.33");
        latest.put("com.h2database:h2", "2.2.224");
        latest.put("org.projectlombok:lombok", "1.18.34");
        latest.put("org.yaml:snakeyaml", "2.2");
        latest.put("org.apache.struts:*", "6.4.0");
        latest.put("jakarta.servlet:jakarta.servlet-api", "6.1.0");
        latest.put("jakarta.persistence:jakarta.persistence-api", "3.2.0");
        return Collections.unmodifiableMap(latest);
    }
}
