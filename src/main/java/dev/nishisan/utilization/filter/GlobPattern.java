/*
 *  Copyright (C) 2020-2025 Lucas Nishimura <lucas.nishimura at gmail.com>
 *
 *  This program is free software: you can redistribute it and/or modify
 *  it under the terms of the GNU General Public License as published by
 *  the Free Software Foundation, either version 3 of the License, or
 *  (at your option) any later version.
 *
 *  This program is distributed in the hope that it will be useful,
 *  but WITHOUT ANY WARRANTY; without even the implied warranty of
 *  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *  GNU General Public License for more details.
 *
 *  You should have received a copy of the GNU General Public License
 *  along with this program.  If not, see <https://www.gnu.org/licenses/>
 */

package dev.nishisan.utilization.filter;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Shell-style wildcard pattern over a whole string. {@code *} matches any run
 * of characters, {@code ?} one character, {@code [abc]} a class and
 * {@code [!abc]} a negated class. Unlike file-system globs, {@code /} has no
 * special meaning, so {@code *} freely crosses path separators.
 */
public final class GlobPattern {

    private final String pattern;
    private final Pattern regex;

    private GlobPattern(String pattern, Pattern regex) {
        this.pattern = pattern;
        this.regex = regex;
    }

    /**
     * Tells whether a configured rule should be read as a glob rather than as
     * a literal executable name.
     */
    public static boolean isGlob(String pattern) {
        return pattern.indexOf('*') >= 0 || pattern.indexOf('[') >= 0 || pattern.indexOf(']') >= 0;
    }

    public static GlobPattern compile(String pattern) {
        Objects.requireNonNull(pattern, "pattern");
        return new GlobPattern(pattern, Pattern.compile(translate(pattern), Pattern.DOTALL));
    }

    public boolean matches(String input) {
        return regex.matcher(input).matches();
    }

    public boolean isMatchAll() {
        return CommandFilter.MATCH_ALL.equals(pattern);
    }

    public String pattern() {
        return pattern;
    }

    static String translate(String pattern) {
        StringBuilder out = new StringBuilder(pattern.length() * 2);
        int i = 0;
        int n = pattern.length();
        while (i < n) {
            char c = pattern.charAt(i++);
            switch (c) {
                case '*' -> {
                    out.append(".*");
                    // collapse runs of '*'
                    while (i < n && pattern.charAt(i) == '*') {
                        i++;
                    }
                }
                case '?' -> out.append('.');
                case '[' -> {
                    int j = i;
                    if (j < n && pattern.charAt(j) == '!') {
                        j++;
                    }
                    if (j < n && pattern.charAt(j) == ']') {
                        j++;
                    }
                    while (j < n && pattern.charAt(j) != ']') {
                        j++;
                    }
                    if (j >= n) {
                        // unterminated class, '[' is literal
                        out.append("\\[");
                    } else {
                        out.append(characterClass(pattern.substring(i, j)));
                        i = j + 1;
                    }
                }
                default -> out.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return out.toString();
    }

    private static String characterClass(String body) {
        StringBuilder cls = new StringBuilder("[");
        int k = 0;
        if (body.startsWith("!")) {
            cls.append('^');
            k = 1;
        }
        for (; k < body.length(); k++) {
            char c = body.charAt(k);
            if (c == '-' && k > 0 && k < body.length() - 1 && !(k == 1 && body.charAt(0) == '!')) {
                cls.append('-');
            } else if (Character.isLetterOrDigit(c)) {
                cls.append(c);
            } else {
                cls.append('\\').append(c);
            }
        }
        return cls.append(']').toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GlobPattern other)) {
            return false;
        }
        return pattern.equals(other.pattern);
    }

    @Override
    public int hashCode() {
        return pattern.hashCode();
    }

    @Override
    public String toString() {
        return pattern;
    }
}
