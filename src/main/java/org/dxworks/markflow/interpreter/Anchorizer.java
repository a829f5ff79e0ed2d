package org.dxworks.markflow.interpreter;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns heading text into url fragment slugs that are unique across a
 * document. One instance is shared by every branch of a traversal.
 */
public class Anchorizer {
    private static final Pattern REJECTED_CHARS = Pattern.compile("[^\\p{L}\\p{M}\\p{N}\\p{Pc} -]");

    private final Set<String> used = new HashSet<>();

    public synchronized String anchorize(String header) {
        String id = header.toLowerCase(Locale.ROOT);
        id = REJECTED_CHARS.matcher(id).replaceAll("");
        id = id.replace(' ', '-');

        String candidate = id;
        int suffix = 0;
        while (used.contains(candidate)) {
            suffix++;
            candidate = id + "-" + suffix;
        }
        used.add(candidate);
        return candidate;
    }
}
