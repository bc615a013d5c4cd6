/* @LICENSE@
 */
package org.semrep.lang;

/**
 * A function declaration found by a {@link FunctionScanner}: the name and its
 * span, <code>end</code> being the offset of the opening parenthesis.
 */
public final class FunctionRecord {

    private final String name;
    private final int start;
    private final int end;

    public FunctionRecord(String name, int start, int end) {
        if (name == null) throw new NullPointerException("name");
        this.name = name;
        this.start = start;
        this.end = end;
    }

    public String name() {
        return name;
    }

    public int start() {
        return start;
    }

    public int end() {
        return end;
    }

    @Override
    public int hashCode() {
        return (name.hashCode() * 31 + start) * 31 + end;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof FunctionRecord))
            return false;
        final FunctionRecord other = (FunctionRecord) obj;
        return name.equals(other.name) && start == other.start && end == other.end;
    }

    @Override
    public String toString() {
        return name + "(" + start + "," + end + ")";
    }
}
