package com.dbbaskette.envsync.service.classify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Compiled exclusion patterns for one run. Matching is against the original secret name.
 * Patterns that fail to compile are logged and never match.
 */
public final class ExclusionRules {

    private static final Logger log = LoggerFactory.getLogger(ExclusionRules.class);

    public record Rule(String pattern, String reason) {}

    /** Names GitHub reserves or that belong to the CI runtime itself. */
    public static final List<Rule> DEFAULT_GLOBAL = List.of(
            new Rule("^GITHUB_", "Reserved by GitHub; secrets may not start with GITHUB_"),
            new Rule("^ACTIONS_", "Set by the GitHub Actions runtime"),
            new Rule("^RUNNER_", "Set by the GitHub Actions runner"),
            new Rule("^CI$", "Set by every CI provider"),
            new Rule("^PNPM_", "Package manager configuration"),
            new Rule("^NPM_", "Package manager configuration"));

    private record Compiled(Rule rule, Pattern regex) {}

    private final List<Compiled> compiled;

    private ExclusionRules(List<Compiled> compiled) {
        this.compiled = compiled;
    }

    public static ExclusionRules of(List<Rule> rules) {
        List<Compiled> compiled = new ArrayList<>();
        for (Rule rule : rules) {
            try {
                compiled.add(new Compiled(rule, Pattern.compile(rule.pattern())));
            } catch (PatternSyntaxException e) {
                log.warn("Ignoring invalid exclusion pattern '{}': {}", rule.pattern(), e.getDescription());
            }
        }
        return new ExclusionRules(List.copyOf(compiled));
    }

    public static ExclusionRules defaults() {
        return of(DEFAULT_GLOBAL);
    }

    /** The first rule matching the name, if any. */
    public Optional<Rule> match(String originalName) {
        for (Compiled c : compiled) {
            if (c.regex().matcher(originalName).find()) {
                return Optional.of(c.rule());
            }
        }
        return Optional.empty();
    }

    public boolean isExcluded(String originalName) {
        return match(originalName).isPresent();
    }

    public int size() {
        return compiled.size();
    }
}
