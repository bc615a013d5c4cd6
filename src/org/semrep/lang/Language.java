/* @LICENSE@
 */
package org.semrep.lang;

import java.util.List;

/**
 * A source language as far as semantic matching is concerned: a way to find
 * function declarations and typed identifiers in a text.
 */
public interface Language {

    String name();

    List<FunctionRecord> readFunctions(CharSequence text);

    List<IdentifierRecord> readIdentifiers(CharSequence text);

    /**
     * @return true if <code>token</code> is a keyword that can never be
     *         half of a <code>Type name</code> declaration.
     */
    boolean isDisallowed(String token);
}
