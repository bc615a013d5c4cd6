/* @LICENSE@
 */
package org.semrep.lang;

/**
 * One occurrence of a typed identifier: either its declaration site
 * (<code>Type name</code>) or a use resolved through the scope stack. The
 * span <code>[start, end)</code> covers the name only.
 */
public final class IdentifierRecord {

    private final String name;
    private final String type;
    private final int start;
    private final int end;

    public IdentifierRecord(String name, String type, int start, int end) {
        if (name == null) throw new NullPointerException("name");
        if (type == null) throw new NullPointerException("type");
        this.name = name;
        this.type = type;
        this.start = start;
        this.end = end;
    }

    public String name() {
        return name;
    }

    public String type() {
        return type;
    }

    public int start() {
        return start;
    }

    public int end() {
        return end;
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = name.hashCode();
        result = prime * result + type.hashCode();
        result = prime * result + start;
        result = prime * result + end;
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof IdentifierRecord))
            return false;
        final IdentifierRecord other = (IdentifierRecord) obj;
        return name.equals(other.name) && type.equals(other.type)
            && start == other.start && end == other.end;
    }

    @Override
    public String toString() {
        return type + " " + name + "(" + start + "," + end + ")";
    }
}
