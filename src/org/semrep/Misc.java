/*
 * @LICENSE@
 */

package org.semrep;

import java.util.ArrayList;
import java.util.List;

/**
 * This class implements a bunch of possibly reusable, miscelaneous static
 * objects, interfaces, classes, and methods.
 */
final class Misc {

    private Misc() {
    } // never instantiated

    public static final String LS = System.getProperty("line.separator");

    /*
     * idiom suppression for clearing StringBuilders
     */
    public static void clear(StringBuilder sb) {
        sb.delete(0, sb.length());
    }

    static boolean isSet(int flags, int FLAG) {
        return (flags & FLAG) != 0;
    }

    /*
     * Java lang escaping for log and toString output: backslash, quote,
     * and anything outside printable ASCII.
     */
    static String esc(CharSequence cs) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < cs.length(); ++i) {
            char c = cs.charAt(i);
            switch (c) {
            case '\\': sb.append("\\\\"); break;
            case '"':  sb.append("\\\""); break;
            case '\n': sb.append("\\n"); break;
            case '\r': sb.append("\\r"); break;
            case '\t': sb.append("\\t"); break;
            default:
                if (c < 32 || 126 < c) {
                    sb.append(String.format("\\u%04x", Integer.valueOf(c)));
                } else {
                    sb.append(c);
                }
            }
        }
        return sb.toString();
    }

    /**
     * Hands out single bit flags, each with a label, and validates flag words
     * against the set of flags defined so far.
     */
    static final class FlagMgr {

        private List<String> labels = new ArrayList<String>(4);
        private int defined = 0;
        boolean frozen = false;

        private boolean contains(int f, int g) {
            return (g | f) == f;
        }

        int next(String label) {
            if (frozen)
                throw new IllegalStateException("frozen FlagMgr");
            labels.add(label);
            int flag = 1 << (labels.size() - 1);
            defined |= flag;
            return flag;
        }

        void freeze() {
            frozen = true;
        }

        void check(int flags) {
            if (!contains(defined, flags)) {
                throw new IllegalArgumentException(
                    "unknown flags: " + (flags & ~defined));
            }
        }

        String stringFrom(int flags) {
            StringBuilder sb = new StringBuilder();
            int n = 0;
            while (flags != 0) {
                for (; (flags & 1) == 0; flags >>>= 1, ++n)
                    ;
                sb.append(sb.length() == 0 ? "" : ", ").append(labels.get(n));
                flags &= ~1;
            }
            return sb.toString();
        }
    }
}
