package org.impactengine.utils;

/**
 * Expands {@code ${VAR}} references and a leading {@code ~} in storage locations.
 * <p>
 * Variables resolve against Java system properties first, then environment variables,
 * so {@code -Dvar=...} on the command line overrides the environment.
 * <pre>
 * expandPath("${user.home}/impact")   → "/home/analyst/impact"
 * expandPath("~/impact")              → "/home/analyst/impact"
 * expandPath("/srv/impact")           → "/srv/impact"
 * </pre>
 */
public final class PathExpansion {

    private PathExpansion() {
        // Utility class - prevent instantiation
    }

    /**
     * @param path a path that may contain {@code ${VAR}} references or start with {@code ~}
     * @return the expanded path, or {@code null} for {@code null}
     * @throws IllegalArgumentException if a variable is undefined or a reference is unclosed
     */
    public static String expandPath(String path) {
        if (path == null) {
            return null;
        }
        String expanded = path;
        if (expanded.equals("~") || expanded.startsWith("~/")) {
            expanded = System.getProperty("user.home") + expanded.substring(1);
        }
        if (!expanded.contains("${")) {
            return expanded;
        }

        StringBuilder result = new StringBuilder();
        int pos = 0;
        while (pos < expanded.length()) {
            int start = expanded.indexOf("${", pos);
            if (start == -1) {
                result.append(expanded, pos, expanded.length());
                break;
            }
            result.append(expanded, pos, start);

            int end = expanded.indexOf('}', start + 2);
            if (end == -1) {
                throw new IllegalArgumentException("Unclosed variable in path: " + path);
            }
            String name = expanded.substring(start + 2, end);
            String value = System.getProperty(name);
            if (value == null) {
                value = System.getenv(name);
            }
            if (value == null) {
                throw new IllegalArgumentException(
                    "Undefined variable '${" + name + "}' in path: " + path
                        + ". Define it as a system property or environment variable.");
            }
            result.append(value);
            pos = end + 1;
        }
        return result.toString();
    }
}
