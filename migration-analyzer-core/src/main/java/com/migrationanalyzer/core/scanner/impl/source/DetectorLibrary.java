package com.migrationanalyzer.core.scanner.impl.source;

import com.migrationanalyzer.core.model.FindingCategory;
import com.migrationanalyzer.core.model.Severity;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

import static com.migrationanalyzer.core.model.FindingCategory.DEPRECATED_API;
import static com.migrationanalyzer.core.model.FindingCategory.EXCEPTION_HANDLING;
import static com.migrationanalyzer.core.model.FindingCategory.HARDCODED_VALUE;
import static com.migrationanalyzer.core.model.FindingCategory.NULL_SAFETY;
import static com.migrationanalyzer.core.model.FindingCategory.SERIALIZATION;
import static com.migrationanalyzer.core.model.FindingCategory.STRING_COMPARISON;
import static com.migrationanalyzer.core.model.FindingCategory.THREAD_SAFETY;

/**
 * Ordered, immutable set of line detectors.
 *
 * <p>Detector order is part of the finding order: for a given line, findings appear in the order
 * their detectors are listed here.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * SourcePatternScanner scanner = new SourcePatternScanner(DetectorLibrary.defaults());
 * }</pre>
 */
public final class DetectorLibrary {

    private static final DetectorLibrary DEFAULTS = new DetectorLibrary(List.of(
        // deprecated_api
        RegexDetector.of("boxed-primitive-constructor", DEPRECATED_API, Severity.MEDIUM,
            "\\bnew\\s+(?:Integer|Long|Double|Float|Short|Byte|Character|Boolean)\\s*\\(",
            "Boxed primitive constructors are deprecated for removal; use valueOf() or autoboxing"),
        new RegexDetector("class-new-instance", DEPRECATED_API, Severity.MEDIUM,
            Pattern.compile("\\.newInstance\\s*\\(\\s*\\)"),
            Pattern.compile("(?:getDeclaredConstructor|getConstructor)\\s*\\("), null,
            "Class.newInstance() is deprecated; use getDeclaredConstructor().newInstance()"),
        RegexDetector.of("legacy-date", DEPRECATED_API, Severity.LOW,
            "\\bnew\\s+(?:java\\.util\\.)?Date\\s*\\(",
            "Use java.time types (Instant, LocalDate, LocalDateTime) instead of java.util.Date"),
        RegexDetector.of("simple-date-format", DEPRECATED_API, Severity.LOW,
            "\\bnew\\s+SimpleDateFormat\\s*\\(",
            "Use java.time.format.DateTimeFormatter instead of SimpleDateFormat"),
        RegexDetector.of("raw-collection-type", DEPRECATED_API, Severity.LOW,
            "\\b(?:List|ArrayList|LinkedList|Map|HashMap|TreeMap|Set|HashSet|TreeSet|Collection|Vector|Hashtable)"
                + "\\s+\\w+\\s*=\\s*new\\s+\\w+\\s*\\(",
            "Declare generic type arguments instead of raw collection types"),
        RegexDetector.of("finalize-override", DEPRECATED_API, Severity.MEDIUM,
            "\\b(?:protected|public)\\s+void\\s+finalize\\s*\\(\\s*\\)",
            "finalize() is deprecated for removal; use java.lang.ref.Cleaner or try-with-resources"),
        RegexDetector.of("security-manager", DEPRECATED_API, Severity.HIGH,
            "\\bSecurityManager\\b",
            "The SecurityManager is deprecated for removal since Java 17; remove the dependency on it"),
        RegexDetector.of("javax-ee-import", DEPRECATED_API, Severity.HIGH,
            "^\\s*import\\s+(?:static\\s+)?javax\\.(?:servlet|persistence|validation|ws\\.rs|ejb|inject|transaction"
                + "|jms|faces|xml\\.bind|enterprise|mail|websocket|json|annotation\\.(?:PostConstruct|PreDestroy"
                + "|Resource))\\b[\\w.*]*",
            "Jakarta EE 9+ moved this API to the jakarta.* namespace; migrate the import and dependency"),
        new SubstringDetector("internal-sun-import", DEPRECATED_API, Severity.HIGH, "import sun.",
            "JDK internal sun.* APIs are strongly encapsulated since Java 16; use a supported API"),
        new SubstringDetector("run-finalization", DEPRECATED_API, Severity.MEDIUM, "System.runFinalization(",
            "Finalization is deprecated for removal; release resources explicitly"),

        // null_safety
        RegexDetector.of("equals-null", NULL_SAFETY, Severity.HIGH,
            "\\.equals\\s*\\(\\s*null\\s*\\)",
            "x.equals(null) is always false or throws; use x == null or Objects.isNull(x)"),
        RegexDetector.of("explicit-null-check", NULL_SAFETY, Severity.MEDIUM,
            "\\bif\\s*\\(\\s*\\w+\\s*==\\s*null\\s*\\)",
            "Use Objects.requireNonNull() or Optional for null safety"),
        new RegexDetector("unguarded-getter-chain", NULL_SAFETY, Severity.LOW,
            Pattern.compile("\\b\\w+\\.get\\w*\\(\\)\\.get\\w*\\(\\)\\.\\w+\\("),
            Pattern.compile("!=\\s*null|==\\s*null|Optional|requireNonNull"), null,
            "Guard chained getter calls with null checks or Optional"),

        // exception_handling
        RegexDetector.of("catch-generic-exception", EXCEPTION_HANDLING, Severity.HIGH,
            "\\bcatch\\s*\\(\\s*(?:final\\s+)?(?:java\\.lang\\.)?(?:Exception|Throwable)\\s+\\w+\\s*\\)",
            "Catch specific exceptions instead of generic Exception or Throwable"),
        RegexDetector.of("empty-catch-block", EXCEPTION_HANDLING, Severity.HIGH,
            "\\bcatch\\s*\\([^)]*\\)\\s*\\{\\s*}",
            "Never use empty catch blocks; log or handle the exception"),
        new NextLineRegexDetector("empty-catch-block", EXCEPTION_HANDLING, Severity.HIGH,
            Pattern.compile("\\bcatch\\s*\\([^)]*\\)\\s*\\{\\s*$"),
            Pattern.compile("^\\s*}"),
            "Never use empty catch blocks; log or handle the exception"),
        RegexDetector.of("print-stack-trace", EXCEPTION_HANDLING, Severity.MEDIUM,
            "\\.printStackTrace\\s*\\(\\s*\\)",
            "Log the exception through the logging framework instead of printStackTrace()"),

        // thread_safety
        RegexDetector.of("static-mutable-collection", THREAD_SAFETY, Severity.MEDIUM,
            "\\bstatic\\b.*=\\s*new\\s+(?:ArrayList|LinkedList|HashMap|LinkedHashMap|TreeMap|HashSet|LinkedHashSet"
                + "|TreeSet)\\b",
            "Shared static collections are not thread-safe; use concurrent or immutable collections"),
        RegexDetector.of("static-date-format", THREAD_SAFETY, Severity.HIGH,
            "\\bstatic\\b.*\\b(?:SimpleDateFormat|DateFormat)\\b",
            "SimpleDateFormat is not thread-safe; use an immutable DateTimeFormatter"),

        // string_comparison
        RegexDetector.of("string-identity-comparison", STRING_COMPARISON, Severity.HIGH,
            "[=!]=\\s*\"|\"\\s*[=!]="
                + "|[=!]=\\s*[\\w.]+\\.(?:toString|trim|strip|toLowerCase|toUpperCase|substring|getName|getText"
                + "|getString)\\s*\\("
                + "|\\.(?:toString|trim|strip|toLowerCase|toUpperCase|getName|getText|getString)\\s*\\([^()]*\\)"
                + "\\s*[=!]=(?!\\s*null\\b)",
            "Use equals() or equalsIgnoreCase() instead of == or != for string comparison"),

        // hardcoded_value
        RegexDetector.of("hardcoded-credential", HARDCODED_VALUE, Severity.HIGH,
            "(?i)\\b\\w*(?:password|passwd|pwd|secret|api_?key|token|credential)\\w*\\s*[=:]\\s*\"[^\"]+\""
                + "|(?i)\\bset(?:Password|Secret|ApiKey|Token)\\s*\\(\\s*\"[^\"]+\"",
            "Move credentials to a secret store or externalized configuration"),
        new RegexDetector("hardcoded-url", HARDCODED_VALUE, Severity.MEDIUM,
            Pattern.compile("\"(?:https?|ftp)://[^\"]+\"|\"jdbc:[^\"]+\""),
            Pattern.compile("www\\.w3\\.org|xmlns|/schemas?/"), null,
            "Move URLs and connection strings to externalized configuration"),
        RegexDetector.of("magic-number-condition", HARDCODED_VALUE, Severity.MEDIUM,
            "\\b(?:if|while)\\s*\\(.*[<>=!]=?\\s*-?(?:[2-9]|\\d{2,})(?:\\.\\d+)?[LlFfDd]?\\b",
            "Replace magic numbers in conditions with named constants"),

        // serialization
        new RegexDetector("missing-serial-version-uid", SERIALIZATION, Severity.LOW,
            Pattern.compile("\\bclass\\s+\\w+[^{]*\\bimplements\\b[^{]*\\bSerializable\\b"),
            null, "serialVersionUID",
            "Declare a serialVersionUID in Serializable classes")
    ));

    private final List<LineDetector> detectors;

    /**
     * Creates a library from an ordered list of detectors.
     *
     * @param detectors detectors in evaluation order
     */
    public DetectorLibrary(List<LineDetector> detectors) {
        this.detectors = List.copyOf(Objects.requireNonNull(detectors, "detectors must not be null"));
    }

    /**
     * Returns the built-in detectors.
     *
     * @return default library
     */
    public static DetectorLibrary defaults() {
        return DEFAULTS;
    }

    /**
     * Returns the detectors in evaluation order.
     *
     * @return immutable detector list
     */
    public List<LineDetector> detectors() {
        return detectors;
    }

    /**
     * Returns the detectors of one category, in evaluation order.
     *
     * @param category finding category
     * @return matching detectors
     */
    public List<LineDetector> detectors(FindingCategory category) {
        return detectors.stream()
            .filter(detector -> detector.category() == category)
            .toList();
    }

    public int size() {
        return detectors.size();
    }
}
