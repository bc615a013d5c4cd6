/* @LICENSE@
 */
package org.semrep.lang;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * The C family: C, C++, C#, Java, JavaScript and friends. Brace delimited
 * blocks, <code>name(...) {</code> functions and <code>Type name</code>
 * declarations.
 */
public final class CLike implements Language {

    public static final CLike INSTANCE = new CLike();

    private static final Set<String> DISALLOWED = Collections.unmodifiableSet(
        new HashSet<String>(Arrays.asList(
            "public", "package", "private", "protected", "import",
            "void", "true", "false", "extends")));

    private CLike() {
    }

    public String name() {
        return "c-like";
    }

    public List<FunctionRecord> readFunctions(CharSequence text) {
        return new FunctionScanner().scan(text);
    }

    public List<IdentifierRecord> readIdentifiers(CharSequence text) {
        return new IdentifierScanner(this).scan(text);
    }

    public boolean isDisallowed(String token) {
        return DISALLOWED.contains(token);
    }

    @Override
    public String toString() {
        return name();
    }
}
