package org.dxworks.clippy.parser;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Infers a code block's language from its class attribute, e.g. {@code language-java}
 * or a bare {@code python} class.
 */
public class CodeLanguageDetector {

    private static final List<Pattern> CLASS_PATTERNS = List.of(
            Pattern.compile("(?:^|\\s)language-([\\w+#-]+)"),
            Pattern.compile("(?:^|\\s)lang-([\\w+#-]+)"),
            Pattern.compile("(?:^|\\s)highlight-([\\w+#-]+)"),
            Pattern.compile("(?:^|\\s)(\\w+)-code(?:\\s|$)")
    );

    private static final Set<String> KNOWN_LANGUAGES = Set.of(
            "javascript", "js", "typescript", "ts", "python", "py", "java", "c", "cpp", "csharp", "cs",
            "php", "ruby", "go", "rust", "swift", "kotlin", "scala", "html", "css", "scss", "sass",
            "less", "xml", "json", "yaml", "yml", "markdown", "md", "bash", "sh", "sql", "r",
            "matlab", "julia"
    );

    public static Optional<String> detectLanguage(String classAttribute) {
        if (classAttribute == null || classAttribute.isBlank()) {
            return Optional.empty();
        }
        String classes = classAttribute.trim();
        for (Pattern pattern : CLASS_PATTERNS) {
            Matcher matcher = pattern.matcher(classes);
            if (matcher.find()) {
                return Optional.of(matcher.group(1).toLowerCase(Locale.ROOT));
            }
        }
        for (String token : classes.split("\\s+")) {
            String lower = token.toLowerCase(Locale.ROOT);
            if (KNOWN_LANGUAGES.contains(lower)) {
                return Optional.of(lower);
            }
        }
        return Optional.empty();
    }
}
