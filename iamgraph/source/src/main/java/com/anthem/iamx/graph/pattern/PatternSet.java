package com.anthem.iamx.graph.pattern;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * The Action or Resource element of a policy statement.
 *
 * <p>A negated set comes from {@code NotAction} / {@code NotResource}: it matches every
 * value that none of its patterns match.
 */
public final class PatternSet {

    public static final PatternSet ANY = new PatternSet(List.of(WildcardPattern.ANY), false);

    private final List<WildcardPattern> patterns;
    private final boolean negated;

    private PatternSet(List<WildcardPattern> patterns, boolean negated) {
        this.patterns = Collections.unmodifiableList(patterns);
        this.negated = negated;
    }

    public static PatternSet of(Collection<String> patterns) {
        return new PatternSet(compile(patterns), false);
    }

    public static PatternSet not(Collection<String> patterns) {
        return new PatternSet(compile(patterns), true);
    }

    public List<WildcardPattern> getPatterns() {
        return patterns;
    }

    public List<String> getValues() {
        return patterns.stream().map(WildcardPattern::getPattern).collect(Collectors.toList());
    }

    public boolean isNegated() {
        return negated;
    }

    /**
     * Match a concrete action or resource.
     */
    public boolean matches(String value) {
        boolean any = patterns.stream().anyMatch(p -> p.matches(value));
        return negated != any;
    }

    /**
     * True if some concrete value matched by {@code query} is also matched by this set.
     *
     * <p>For a negated set the answer is exact only when a single excluded pattern covers
     * the whole query; a query covered by the union of several excluded patterns is still
     * reported as overlapping, which errs towards reporting access.
     */
    public boolean overlaps(WildcardPattern query) {
        if (negated) {
            return patterns.stream().noneMatch(p -> p.covers(query));
        }
        return patterns.stream().anyMatch(p -> p.overlaps(query));
    }

    /**
     * True if every concrete value matched by {@code query} is matched by this set.
     *
     * <p>Coverage by the union of several patterns is not detected; only a single covering
     * pattern counts, which errs towards reporting access.
     */
    public boolean covers(WildcardPattern query) {
        if (negated) {
            return patterns.stream().noneMatch(p -> p.overlaps(query));
        }
        return patterns.stream().anyMatch(p -> p.covers(query));
    }

    private static List<WildcardPattern> compile(Collection<String> values) {
        Objects.requireNonNull(values, "patterns");
        List<WildcardPattern> compiled = new ArrayList<>(values.size());
        for (String value : values) {
            compiled.add(WildcardPattern.of(value));
        }
        return compiled;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PatternSet)) return false;
        PatternSet that = (PatternSet) o;
        return negated == that.negated && patterns.equals(that.patterns);
    }

    @Override
    public int hashCode() {
        return Objects.hash(patterns, negated);
    }

    @Override
    public String toString() {
        return (negated ? "Not" : "") + getValues();
    }
}
