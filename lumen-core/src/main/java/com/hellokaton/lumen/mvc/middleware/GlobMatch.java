package com.hellokaton.lumen.mvc.middleware;

import com.hellokaton.lumen.exception.ImproperlyConfiguredException;

import java.util.regex.Pattern;

/**
 * Host glob. {@code *} matches any run of characters including dots,
 * {@code ?} a single character other than a dot, and {@code \} escapes the
 * next character. Matching ignores case.
 */
public class GlobMatch {

    private final String glob;
    private final Pattern pattern;

    private GlobMatch(String glob, Pattern pattern) {
        this.glob = glob;
        this.pattern = pattern;
    }

    public static GlobMatch compile(String glob) {
        StringBuilder regex = new StringBuilder();
        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            switch (c) {
                case '\\':
                    if (i + 1 < glob.length()) {
                        regex.append(Pattern.quote(String.valueOf(glob.charAt(++i))));
                    } else {
                        regex.append("\\\\");
                    }
                    break;
                case '*':
                    // collapse consecutive stars
                    while (i + 1 < glob.length() && glob.charAt(i + 1) == '*') {
                        i++;
                    }
                    regex.append(".*");
                    break;
                case '?':
                    regex.append("[^.]");
                    break;
                default:
                    regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        try {
            return new GlobMatch(glob, Pattern.compile("^" + regex + "$", Pattern.CASE_INSENSITIVE));
        } catch (RuntimeException e) {
            throw new ImproperlyConfiguredException("Invalid host pattern '" + glob + "'", e);
        }
    }

    public boolean matches(String host) {
        return null != host && pattern.matcher(host).matches();
    }

    @Override
    public String toString() {
        return glob;
    }

}
