package com.hellokaton.lumen.kit;

/**
 * Route path helpers.
 */
public final class PathKit {

    private PathKit() {
    }

    /**
     * Fix a path: leading slash, no duplicate slashes, no trailing slash
     * except for the root path.
     */
    public static String fixPath(String path) {
        if (null == path || path.isEmpty()) {
            return "/";
        }
        String fixed = path.replaceAll("/+", "/");
        if (!fixed.startsWith("/")) {
            fixed = "/" + fixed;
        }
        if (fixed.length() > 1 && fixed.endsWith("/")) {
            fixed = fixed.substring(0, fixed.length() - 1);
        }
        return fixed;
    }

    public static String join(String prefix, String path) {
        return fixPath(fixPath(prefix) + "/" + (null == path ? "" : path));
    }

    /**
     * Whether {@code path} lies under {@code prefix}. The root prefix covers every path.
     */
    public static boolean isUnder(String prefix, String path) {
        if ("/".equals(prefix)) {
            return true;
        }
        return path.equals(prefix) || path.startsWith(prefix + "/");
    }

    /**
     * Remaining path after a mount prefix, always starting with a slash.
     */
    public static String strip(String prefix, String path) {
        if ("/".equals(prefix)) {
            return path;
        }
        String rest = path.substring(prefix.length());
        return rest.isEmpty() ? "/" : rest;
    }

}
