package com.anthem.iamx.graph.pattern;

import java.util.ArrayDeque;
import java.util.BitSet;
import java.util.Deque;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * AWS-style glob pattern used for IAM actions, resources and principals.
 *
 * <p>{@code *} matches any (possibly empty) substring and {@code ?} matches exactly
 * one character. Matching is case-sensitive and always covers the full string.
 *
 * <p>Besides plain matching against a concrete value, two patterns can be compared:
 * <ul>
 *   <li>{@link #overlaps(WildcardPattern)}: at least one concrete string matches both</li>
 *   <li>{@link #covers(WildcardPattern)}: every string matching the other pattern matches this one</li>
 * </ul>
 * Both are decided on the pattern automata, never by string containment.
 */
public final class WildcardPattern {

    public static final WildcardPattern ANY = new WildcardPattern("*");

    private static final char STAR = '*';
    private static final char QUESTION = '?';

    /**
     * Stands for every character that appears as a literal in neither pattern.
     * All such characters behave identically in both automata.
     */
    private static final int OTHER = -1;

    private final String pattern;

    private WildcardPattern(String pattern) {
        this.pattern = pattern;
    }

    public static WildcardPattern of(String pattern) {
        Objects.requireNonNull(pattern, "pattern");
        if (isMatchAll(pattern)) {
            return ANY;
        }
        return new WildcardPattern(pattern);
    }

    public String getPattern() {
        return pattern;
    }

    /**
     * True when the pattern consists of stars only and therefore matches everything.
     */
    public boolean isMatchAll() {
        return isMatchAll(pattern);
    }

    /**
     * True when the pattern contains no wildcard characters.
     */
    public boolean isLiteral() {
        return pattern.indexOf(STAR) < 0 && pattern.indexOf(QUESTION) < 0;
    }

    /**
     * Match a concrete value against this pattern.
     */
    public boolean matches(String value) {
        if (value == null) {
            return false;
        }
        if (isMatchAll()) {
            return true;
        }

        int p = 0;
        int s = 0;
        int starAt = -1;
        int resumeAt = 0;
        int n = pattern.length();

        while (s < value.length()) {
            if (p < n && pattern.charAt(p) == STAR) {
                starAt = p++;
                resumeAt = s;
            } else if (p < n && (pattern.charAt(p) == QUESTION || pattern.charAt(p) == value.charAt(s))) {
                p++;
                s++;
            } else if (starAt >= 0) {
                // let the last star swallow one more character and retry
                p = starAt + 1;
                s = ++resumeAt;
            } else {
                return false;
            }
        }

        while (p < n && pattern.charAt(p) == STAR) {
            p++;
        }
        return p == n;
    }

    /**
     * True if some concrete string matches both this pattern and {@code other}.
     *
     * <p>Breadth-first search over the product of both automata. A state {@code (i, j)}
     * means "i characters of this pattern and j characters of the other have been used".
     */
    public boolean overlaps(WildcardPattern other) {
        if (isMatchAll() || other.isMatchAll()) {
            return true;
        }

        String a = pattern;
        String b = other.pattern;
        int n = a.length();
        int m = b.length();
        boolean[][] seen = new boolean[n + 1][m + 1];
        Deque<int[]> queue = new ArrayDeque<>();
        seen[0][0] = true;
        queue.add(new int[]{0, 0});

        while (!queue.isEmpty()) {
            int[] state = queue.poll();
            int i = state[0];
            int j = state[1];
            if (i == n && j == m) {
                return true;
            }

            boolean aStar = i < n && a.charAt(i) == STAR;
            boolean bStar = j < m && b.charAt(j) == STAR;

            // a star may match the empty string
            if (aStar) {
                visit(seen, queue, i + 1, j);
            }
            if (bStar) {
                visit(seen, queue, i, j + 1);
            }

            // consume one shared character
            if (aStar && j < m && !bStar) {
                visit(seen, queue, i, j + 1);
            }
            if (bStar && i < n && !aStar) {
                visit(seen, queue, i + 1, j);
            }
            if (i < n && j < m && !aStar && !bStar && compatible(a.charAt(i), b.charAt(j))) {
                visit(seen, queue, i + 1, j + 1);
            }
        }
        return false;
    }

    /**
     * True if every concrete string matched by {@code other} is also matched by this pattern.
     *
     * <p>Runs a subset construction of this pattern's automaton against the other pattern's
     * automaton. The alphabet is reduced to the literal characters of both patterns plus one
     * symbol standing for everything else, which keeps the search finite and exact.
     */
    public boolean covers(WildcardPattern other) {
        if (isMatchAll()) {
            return true;
        }
        if (other.isLiteral()) {
            return matches(other.pattern);
        }

        String a = pattern;
        String b = other.pattern;
        int n = a.length();
        int m = b.length();
        int[] alphabet = alphabet(a, b);

        Set<String> seen = new HashSet<>();
        Deque<CoverState> queue = new ArrayDeque<>();
        CoverState start = new CoverState(0, closure(a, single(0)));
        seen.add(start.key());
        queue.add(start);

        while (!queue.isEmpty()) {
            CoverState state = queue.poll();
            int j = state.position;
            BitSet current = state.coveringStates;

            if (j == m && !current.get(n)) {
                // the other pattern accepts a string this pattern rejects
                return false;
            }
            if (j < m && b.charAt(j) == STAR) {
                enqueue(seen, queue, new CoverState(j + 1, current));
            }
            if (j == m) {
                continue;
            }

            char bc = b.charAt(j);
            for (int symbol : alphabet) {
                if (bc != STAR && bc != QUESTION && symbol != bc) {
                    continue;
                }
                int nextJ = bc == STAR ? j : j + 1;
                BitSet next = closure(a, step(a, current, symbol));
                enqueue(seen, queue, new CoverState(nextJ, next));
            }
        }
        return true;
    }

    private static boolean isMatchAll(String pattern) {
        if (pattern.isEmpty()) {
            return false;
        }
        for (int i = 0; i < pattern.length(); i++) {
            if (pattern.charAt(i) != STAR) {
                return false;
            }
        }
        return true;
    }

    private static boolean compatible(char x, char y) {
        return x == QUESTION || y == QUESTION || x == y;
    }

    private static void visit(boolean[][] seen, Deque<int[]> queue, int i, int j) {
        if (!seen[i][j]) {
            seen[i][j] = true;
            queue.add(new int[]{i, j});
        }
    }

    private static void enqueue(Set<String> seen, Deque<CoverState> queue, CoverState state) {
        if (seen.add(state.key())) {
            queue.add(state);
        }
    }

    private static int[] alphabet(String a, String b) {
        Set<Integer> symbols = new TreeSet<>();
        for (String s : new String[]{a, b}) {
            for (int i = 0; i < s.length(); i++) {
                char c = s.charAt(i);
                if (c != STAR && c != QUESTION) {
                    symbols.add((int) c);
                }
            }
        }
        symbols.add(OTHER);
        return symbols.stream().mapToInt(Integer::intValue).toArray();
    }

    private static BitSet single(int position) {
        BitSet set = new BitSet();
        set.set(position);
        return set;
    }

    private static BitSet closure(String a, BitSet states) {
        BitSet closed = (BitSet) states.clone();
        // stars only move forward, so a single ascending sweep reaches the fixpoint
        for (int i = closed.nextSetBit(0); i >= 0 && i < a.length(); i = closed.nextSetBit(i + 1)) {
            if (a.charAt(i) == STAR) {
                closed.set(i + 1);
            }
        }
        return closed;
    }

    private static BitSet step(String a, BitSet states, int symbol) {
        BitSet next = new BitSet();
        for (int i = states.nextSetBit(0); i >= 0 && i < a.length(); i = states.nextSetBit(i + 1)) {
            char c = a.charAt(i);
            if (c == STAR) {
                next.set(i);
            } else if (c == QUESTION || c == symbol) {
                next.set(i + 1);
            }
        }
        return next;
    }

    private static final class CoverState {
        private final int position;
        private final BitSet coveringStates;

        private CoverState(int position, BitSet coveringStates) {
            this.position = position;
            this.coveringStates = coveringStates;
        }

        private String key() {
            return position + "|" + coveringStates;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WildcardPattern)) return false;
        return pattern.equals(((WildcardPattern) o).pattern);
    }

    @Override
    public int hashCode() {
        return pattern.hashCode();
    }

    @Override
    public String toString() {
        return pattern;
    }
}
