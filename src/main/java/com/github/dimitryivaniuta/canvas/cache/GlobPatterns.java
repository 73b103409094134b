package com.github.dimitryivaniuta.canvas.cache;

import java.util.regex.Pattern;

/**
 * Glob to regex for cache key patterns: {@code *} is the only wildcard, everything else is literal.
 */
public final class GlobPatterns {
    private GlobPatterns() {}

    public static Pattern toRegex(String glob) {
        StringBuilder sb = new StringBuilder("^");
        int start = 0;
        int star;
        while ((star = glob.indexOf('*', start)) >= 0) {
            if (star > start) sb.append(Pattern.quote(glob.substring(start, star)));
            sb.append(".*");
            start = star + 1;
        }
        if (start < glob.length()) sb.append(Pattern.quote(glob.substring(start)));
        return Pattern.compile(sb.append('$').toString(), Pattern.DOTALL);
    }
}
