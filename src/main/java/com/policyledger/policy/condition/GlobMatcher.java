package com.policyledger.policy.condition;

import java.util.regex.Pattern;

/**
 * Glob to regex translation: {@code **} matches any run of characters,
 * {@code *} any run without {@code /}, {@code ?} exactly one character.
 * Everything else is literal.
 */
public final class GlobMatcher {

    private GlobMatcher() {
    }

    public static Pattern compile(String glob) {
        StringBuilder regex = new StringBuilder("^");
        StringBuilder literal = new StringBuilder();
        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            if (c == '*' || c == '?') {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                if (c == '?') {
                    regex.append('.');
                } else if (i + 1 < glob.length() && glob.charAt(i + 1) == '*') {
                    regex.append(".*");
                    i++;
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
        return Pattern.compile(regex.append('$').toString());
    }

    public static boolean matches(String value, String glob) {
        return value != null && compile(glob).matcher(value).matches();
    }
}
