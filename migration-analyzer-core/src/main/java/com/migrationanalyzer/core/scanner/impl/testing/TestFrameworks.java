package com.migrationanalyzer.core.scanner.impl.testing;

import com.migrationanalyzer.core.model.Dependency;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Recognizes test frameworks from import statements and declared dependencies.
 */
public final class TestFrameworks {

    public static final String JUNIT = "JUnit";
    public static final String TESTNG = "TestNG";
    public static final String MOCKITO = "Mockito";
    public static final String ASSERTJ = "AssertJ";
    public static final String HAMCREST = "Hamcrest";

    private static final List<ImportRule> IMPORT_RULES = List.of(
        new ImportRule(JUNIT, Pattern.compile("^\\s*import\\s+(?:static\\s+)?org\\.junit\\b")),
        new ImportRule(TESTNG, Pattern.compile("^\\s*import\\s+(?:static\\s+)?org\\.testng\\b")),
        new ImportRule(MOCKITO, Pattern.compile("^\\s*import\\s+(?:static\\s+)?org\\.mockito\\b")),
        new ImportRule(ASSERTJ, Pattern.compile("^\\s*import\\s+(?:static\\s+)?org\\.assertj\\b")),
        new ImportRule(HAMCREST, Pattern.compile("^\\s*import\\s+(?:static\\s+)?org\\.hamcrest\\b"))
    );

    private static final Set<String> SPRING_BOOT_TEST_BUNDLE = Set.of(JUNIT, MOCKITO, ASSERTJ, HAMCREST);

    private TestFrameworks() {
        // Utility class
    }

    /**
     * Returns the frameworks imported by the given source lines.
     *
     * @param lines source lines of a test file
     * @return framework names, sorted
     */
    public static SortedSet<String> fromImports(List<String> lines) {
        SortedSet<String> frameworks = new TreeSet<>();
        for (String line : lines) {
            for (ImportRule rule : IMPORT_RULES) {
                if (rule.pattern().matcher(line).find()) {
                    frameworks.add(rule.framework());
                }
            }
        }
        return frameworks;
    }

    /**
     * Returns the frameworks declared as dependencies.
     *
     * @param dependencies declared dependencies, may be null
     * @return framework names, sorted
     */
    public static SortedSet<String> fromDependencies(List<Dependency> dependencies) {
        SortedSet<String> frameworks = new TreeSet<>();
        if (dependencies == null) {
            return frameworks;
        }
        for (Dependency dependency : dependencies) {
            if (dependency == null) {
                continue;
            }
            String artifact = dependency.artifactId().toLowerCase(Locale.ROOT);
            if (artifact.equals("junit") || artifact.startsWith("junit-")) {
                frameworks.add(JUNIT);
            } else if (artifact.equals("testng")) {
                frameworks.add(TESTNG);
            } else if (artifact.startsWith("mockito")) {
                frameworks.add(MOCKITO);
            } else if (artifact.startsWith("assertj")) {
                frameworks.add(ASSERTJ);
            } else if (artifact.startsWith("hamcrest") || artifact.startsWith("java-hamcrest")) {
                frameworks.add(HAMCREST);
            } else if (artifact.equals("spring-boot-starter-test")) {
                frameworks.addAll(SPRING_BOOT_TEST_BUNDLE);
            }
        }
        return frameworks;
    }

    private record ImportRule(String framework, Pattern pattern) {
    }
}
