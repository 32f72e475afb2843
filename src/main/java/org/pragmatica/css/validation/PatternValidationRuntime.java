package org.pragmatica.css.validation;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Default runtime: scripts are lists of {@code property-glob = value-regex} lines.
 *
 * <pre>
 * # colors must be hexadecimal
 * *color = #[0-9a-fA-F]{3,6}
 * </pre>
 *
 * A declaration fails when its property matches a glob and its value does not match the
 * associated expression. Lines starting with {@code #} are comments.
 */
public final class PatternValidationRuntime implements ValidationRuntime {

    record PatternRule(String glob, PathMatcher property, Pattern value) {}

    record PatternScript(String name, List<PatternRule> rules) implements ValidationScript {}

    @Override
    public ValidationScript load(String name, Path path) throws IOException {
        return parse(name, Files.readAllLines(path));
    }

    /**
     * Build a script from its lines.
     *
     * @throws IllegalArgumentException when a line is not {@code glob = regex} or the regex is invalid
     */
    public static ValidationScript parse(String name, List<String> lines) {
        var rules = new ArrayList<PatternRule>();
        int lineNumber = 0;
        for (var line : lines) {
            lineNumber++;
            var trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            int eq = trimmed.indexOf('=');
            if (eq <= 0) {
                throw new IllegalArgumentException(name + ":" + lineNumber + ": expected 'property-glob = value-regex'");
            }
            var glob = trimmed.substring(0, eq).trim();
            var regex = trimmed.substring(eq + 1).trim();
            try {
                rules.add(new PatternRule(glob,
                                          FileSystems.getDefault().getPathMatcher("glob:" + glob),
                                          Pattern.compile(regex)));
            } catch (PatternSyntaxException e) {
                throw new IllegalArgumentException(name + ":" + lineNumber + ": " + e.getDescription(), e);
            }
        }
        return new PatternScript(name, List.copyOf(rules));
    }

    @Override
    public Verdict run(ValidationScript script, Map<String, String> variables) {
        if (!(script instanceof PatternScript patterns)) {
            return Verdict.failed("script \"" + script.name() + "\" was not loaded by this runtime");
        }
        var property = variables.getOrDefault("property", "");
        var value = variables.getOrDefault("value", "");
        var propertyPath = Path.of(property.isEmpty() ? "_" : property);
        for (var rule : patterns.rules()) {
            if (rule.property().matches(propertyPath) && !rule.value().matcher(value).matches()) {
                return Verdict.failed("value \"" + value + "\" of \"" + property
                                      + "\" does not match " + rule.value().pattern());
            }
        }
        return Verdict.PASSED;
    }
}
