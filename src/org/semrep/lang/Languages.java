/* @LICENSE@
 */
package org.semrep.lang;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Maps file names to the {@link Language} that can scan them.
 */
public final class Languages {

    private Languages() {
    } // never instantiated

    private static final Map<String, Language> BY_EXTENSION;

    static {
        Map<String, Language> m = new HashMap<String, Language>();
        for (String ext : new String[] {
                "c", "h", "cc", "cpp", "cxx", "hh", "hpp", "hxx",
                "cs", "java", "js", "mjs", "ts", "go", "kt", "scala", "swift" }) {
            m.put(ext, CLike.INSTANCE);
        }
        BY_EXTENSION = Collections.unmodifiableMap(m);
    }

    /**
     * @return the language for <code>fileName</code>, judging by its
     *         extension, or null if the file is not supported.
     */
    public static Language forFileName(String fileName) {
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) return null;
        return BY_EXTENSION.get(fileName.substring(dot + 1).toLowerCase(Locale.ROOT));
    }
}
