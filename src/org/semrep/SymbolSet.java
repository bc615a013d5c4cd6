/*
 * @LICENSE@
 */

package org.semrep;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;

/**
 * An immutable value class representing a set of input symbols, as used by
 * the {@link Transition.Kind#CHAR_SET} and
 * {@link Transition.Kind#NEGATED_CHAR_SET} transitions. A set is the union of
 * a sorted array of disjoint {@link Interval}s and a set of named Unicode aware
 * {@link Category categories}. Immutability allows SymbolSets to be used as
 * parts of map keys during subset construction.
 * <p>
 * The static classification methods ({@link #isAlphabetic(char)},
 * {@link #isAlphanumeric(char)}, {@link #isWhitespace(char)}) are the single
 * source of character classification for the whole package, including the
 * source scanners in {@code org.semrep.lang}; offsets reported by the scanners
 * and by the automata therefore always agree.
 */
public final class SymbolSet {

    public static boolean isAlphabetic(char c) {
        return Character.isLetter(c);
    }

    public static boolean isAlphanumeric(char c) {
        return Character.isLetterOrDigit(c);
    }

    public static boolean isWhitespace(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c);
    }

    public static boolean isWord(char c) {
        return isAlphanumeric(c) || c == '_';
    }

    /**
     * Named classes which cannot be enumerated as intervals.
     */
    public enum Category {
        LETTER("\\p{L}") {
            @Override
            boolean contains(char c) {
                return isAlphabetic(c);
            }
        },
        DIGIT("\\d") {
            @Override
            boolean contains(char c) {
                return Character.isDigit(c);
            }
        },
        WORD("\\w") {
            @Override
            boolean contains(char c) {
                return isWord(c);
            }
        },
        WHITESPACE("\\s") {
            @Override
            boolean contains(char c) {
                return isWhitespace(c);
            }
        };

        final String label;

        private Category(String label) {
            this.label = label;
        }

        abstract boolean contains(char c);
    }

    static final class Interval implements Comparable<Interval> {

        final char begin;
        final char end;     // inclusive

        Interval(char begin, char end) {
            assert begin <= end;
            this.begin = begin;
            this.end = end;
        }

        public int compareTo(Interval iv) {
            if (begin != iv.begin) return begin < iv.begin ? -1 : 1;
            if (end != iv.end) return end < iv.end ? -1 : 1;
            return 0;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof Interval))
                return false;
            final Interval iv = (Interval) o;
            return begin == iv.begin && end == iv.end;
        }

        @Override
        public int hashCode() { // per Bloch
            int result = 17;
            result = 37 * result + begin;
            result = 37 * result + end;
            return result;
        }

        @Override
        public String toString() {
            return begin == end ? esc(begin) : esc(begin) + '-' + esc(end);
        }
    }

    public static final SymbolSet EMPTY = new Builder().build();
    public static final SymbolSet LETTER = new Builder().add(Category.LETTER).build();
    public static final SymbolSet DIGIT = new Builder().add(Category.DIGIT).build();
    public static final SymbolSet WORD = new Builder().add(Category.WORD).build();
    public static final SymbolSet WHITESPACE = new Builder().add(Category.WHITESPACE).build();
    /** First character of an identifier: a letter or '_'. */
    public static final SymbolSet IDENTIFIER_START =
            new Builder().add(Category.LETTER).add('_').build();

    private final Interval[] intervals;
    private final EnumSet<Category> categories;
    private String s = null;

    private SymbolSet(Interval[] intervals, EnumSet<Category> categories) {
        this.intervals = intervals;
        this.categories = categories;
    }

    public static SymbolSet of(CharSequence members) {
        Builder b = new Builder();
        for (int i = 0; i < members.length(); ++i) b.add(members.charAt(i));
        return b.build();
    }

    public boolean contains(char c) {
        int lo = 0, hi = intervals.length - 1;
        while (lo <= hi) {
            int mid = (lo + hi) >>> 1;
            Interval iv = intervals[mid];
            if (c < iv.begin) hi = mid - 1;
            else if (c > iv.end) lo = mid + 1;
            else return true;
        }
        for (Category cat : categories) {
            if (cat.contains(c)) return true;
        }
        return false;
    }

    public boolean isEmpty() {
        return intervals.length == 0 && categories.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SymbolSet))
            return false;
        final SymbolSet ss = (SymbolSet) o;
        return Arrays.equals(intervals, ss.intervals)
                && categories.equals(ss.categories);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(intervals) + categories.hashCode();
    }

    @Override
    public String toString() {
        if (s == null) {
            StringBuilder sb = new StringBuilder();
            sb.append('[');
            for (Interval iv : intervals) sb.append(iv);
            for (Category cat : categories) sb.append(cat.label);
            sb.append(']');
            s = sb.toString();
        }
        return s;
    }

    private static String esc(char c) {
        switch (c) {
        case '\n': return "\\n";
        case '\r': return "\\r";
        case '\t': return "\\t";
        case '\\': case ']': case '[': case '-': case '^':
            return "\\" + c;
        default:
            return (c < 32 || 126 < c)
                    ? String.format("\\u%04x", Integer.valueOf(c))
                    : String.valueOf(c);
        }
    }

    /**
     * Incrementally builds a SymbolSet, keeping the intervals sorted and
     * merged.
     */
    public static final class Builder {

        private final List<Interval> list = new ArrayList<Interval>();
        private final EnumSet<Category> categories = EnumSet.noneOf(Category.class);

        public Builder() {
        }

        public Builder(SymbolSet ss) {
            add(ss);
        }

        public Builder add(char c) {
            return add(c, c);
        }

        public Builder add(char begin, char end) {
            if (begin > end) {
                throw new IllegalArgumentException(
                    "illegal range: " + esc(begin) + '-' + esc(end));
            }
            list.add(new Interval(begin, end));
            return this;
        }

        public Builder add(Category cat) {
            categories.add(cat);
            return this;
        }

        public Builder add(SymbolSet ss) {
            Collections.addAll(list, ss.intervals);
            categories.addAll(ss.categories);
            return this;
        }

        public SymbolSet build() {
            List<Interval> sorted = new ArrayList<Interval>(list);
            Collections.sort(sorted);
            List<Interval> merged = new ArrayList<Interval>(sorted.size());
            Interval prev = null;
            for (Interval iv : sorted) {
                if (prev != null && iv.begin <= prev.end + 1) {
                    if (iv.end > prev.end) {
                        prev = new Interval(prev.begin, iv.end);
                        merged.set(merged.size() - 1, prev);
                    }
                } else {
                    merged.add(prev = iv);
                }
            }
            return new SymbolSet(
                merged.toArray(new Interval[merged.size()]),
                EnumSet.copyOf(categories));
        }
    }
}
