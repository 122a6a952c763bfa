package work.lcod.envbase.config;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Shell-style key pattern supporting {@code ?}, {@code *}, {@code [abc]} and {@code [!abc]}.
 * Unlike a file glob, {@code *} is not stopped by separators: keys are plain names.
 */
public final class GlobPattern {
    private final String glob;
    private final Pattern regex;

    private GlobPattern(String glob, Pattern regex) {
        this.glob = glob;
        this.regex = regex;
    }

    public static GlobPattern compile(String glob) {
        Objects.requireNonNull(glob, "glob");
        return new GlobPattern(glob, Pattern.compile(translate(glob), Pattern.DOTALL));
    }

    public boolean matches(String candidate) {
        return candidate != null && regex.matcher(candidate).matches();
    }

    /** Keys of {@code candidates} matching this pattern, in iteration order. */
    public List<String> filter(Collection<String> candidates) {
        var matches = new ArrayList<String>();
        for (var candidate : candidates) {
            if (matches(candidate)) {
                matches.add(candidate);
            }
        }
        return matches;
    }

    @Override
    public String toString() {
        return glob;
    }

    static String translate(String glob) {
        var out = new StringBuilder(glob.length() * 2);
        int i = 0;
        int n = glob.length();
        while (i < n) {
            char ch = glob.charAt(i++);
            if (ch == '*') {
                out.append(".*");
            } else if (ch == '?') {
                out.append('.');
            } else if (ch == '[') {
                int j = i;
                if (j < n && glob.charAt(j) == '!') {
                    j++;
                }
                if (j < n && glob.charAt(j) == ']') {
                    j++;
                }
                while (j < n && glob.charAt(j) != ']') {
                    j++;
                }
                if (j >= n) {
                    // unterminated class is a literal bracket
                    out.append("\\[");
                    continue;
                }
                String body = glob.substring(i, j);
                i = j + 1;
                out.append('[');
                if (body.startsWith("!")) {
                    out.append('^');
                    body = body.substring(1);
                }
                out.append(escapeClassBody(body));
                out.append(']');
            } else {
                out.append(Pattern.quote(String.valueOf(ch)));
            }
        }
        return out.toString();
    }

    private static String escapeClassBody(String body) {
        var out = new StringBuilder(body.length() + 4);
        for (int k = 0; k < body.length(); k++) {
            char ch = body.charAt(k);
            boolean literalCaret = ch == '^' && k == 0;
            if (ch == '\\' || ch == '[' || ch == ']' || ch == '&' || literalCaret) {
                out.append('\\');
            }
            out.append(ch);
        }
        return out.toString();
    }
}
