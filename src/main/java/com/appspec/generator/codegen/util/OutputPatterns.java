package com.appspec.generator.codegen.util;

import java.util.regex.Pattern;

/**
 * Glob matching and overlap detection for declared generator output paths.
 *
 * Supported wildcards: {@code *} (within one path segment), {@code **} (any number of
 * segments) and {@code ?} (one character). Overlap detection is conservative: two patterns
 * are reported as overlapping unless they can be proven disjoint segment by segment.
 */
public final class OutputPatterns {

    private OutputPatterns() {
        // Utility class
    }

    public static boolean matches(String pattern, String path) {
        return toRegex(pattern).matcher(path).matches();
    }

    public static boolean mayOverlap(String a, String b) {
        if (a.equals(b)) {
            return true;
        }
        if (!hasWildcard(a)) {
            return matches(b, a);
        }
        if (!hasWildcard(b)) {
            return matches(a, b);
        }
        String[] sa = a.split("/");
        String[] sb = b.split("/");
        boolean deep = a.contains("**") || b.contains("**");
        if (!deep && sa.length != sb.length) {
            return false;
        }
        int limit = deep ? Math.min(firstDeepSegment(sa), firstDeepSegment(sb)) : sa.length;
        for (int i = 0; i < limit && i < sa.length && i < sb.length; i++) {
            if (!segmentsMayOverlap(sa[i], sb[i])) {
                return false;
            }
        }
        return true;
    }

    private static boolean segmentsMayOverlap(String x, String y) {
        if (!hasWildcard(x) && !hasWildcard(y)) {
            return x.equals(y);
        }
        if (!hasWildcard(x)) {
            return matches(y, x);
        }
        if (!hasWildcard(y)) {
            return matches(x, y);
        }
        String px = literalPrefix(x);
        String py = literalPrefix(y);
        if (!px.startsWith(py) && !py.startsWith(px)) {
            return false;
        }
        String fx = literalSuffix(x);
        String fy = literalSuffix(y);
        return fx.endsWith(fy) || fy.endsWith(fx);
    }

    private static int firstDeepSegment(String[] segments) {
        for (int i = 0; i < segments.length; i++) {
            if (segments[i].contains("**")) {
                return i;
            }
        }
        return segments.length;
    }

    private static boolean hasWildcard(String s) {
        return s.indexOf('*') >= 0 || s.indexOf('?') >= 0;
    }

    private static String literalPrefix(String segment) {
        int i = 0;
        while (i < segment.length() && segment.charAt(i) != '*' && segment.charAt(i) != '?') {
            i++;
        }
        return segment.substring(0, i);
    }

    private static String literalSuffix(String segment) {
        int i = segment.length();
        while (i > 0 && segment.charAt(i - 1) != '*' && segment.charAt(i - 1) != '?') {
            i--;
        }
        return segment.substring(i);
    }

    private static Pattern toRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            if (c == '*' || c == '?') {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                if (c == '?') {
                    regex.append("[^/]");
                } else if (i + 1 < glob.length() && glob.charAt(i + 1) == '*') {
                    boolean slashFollows = i + 2 < glob.length() && glob.charAt(i + 2) == '/';
                    // "**/" also matches zero directories
                    regex.append(slashFollows ? "(?:.*/)?" : ".*");
                    i += slashFollows ? 2 : 1;
                } else {
                    regex.append("[^/]*");
                }
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return Pattern.compile(regex.toString());
    }
}
