package name.nkonev.versionfolders.core;

import java.util.Optional;

/**
 * Finds a version at the start of a folder name, e.g. "1.2", "01_02_03", "2.0 hotfix".
 * <p>
 * Between 1 and 4 decimal groups are read, separated by runs of the characters {@code ^ _ - . , ~} and space.
 * Text after the version is ignored. A name starting with 5 or more groups is not a version at all.
 */
public abstract class VersionParser {

    private static final int MAX_GROUPS = 4;

    private static final String DELIMITERS = "^_-.,~ ";

    public static Version parse(String str) {
        return tryParse(str).orElseThrow(() -> new MalformedVersionException(str));
    }

    public static Optional<Version> tryParse(String str) {
        if (str == null) {
            return Optional.empty();
        }
        int[] groups = new int[MAX_GROUPS];
        int count = 0;

        int position = skipDigits(str, 0);
        if (position == 0) {
            return Optional.empty();
        }
        Integer first = toInt(str, 0, position);
        if (first == null) {
            return Optional.empty();
        }
        groups[count++] = first;

        while (true) {
            int groupStart = skipDelimiters(str, position);
            if (groupStart == position) {
                break;
            }
            int groupEnd = skipDigits(str, groupStart);
            if (groupEnd == groupStart) {
                // delimiters followed by text, the version ends before them
                break;
            }
            if (count == MAX_GROUPS) {
                return Optional.empty();
            }
            Integer value = toInt(str, groupStart, groupEnd);
            if (value == null) {
                return Optional.empty();
            }
            groups[count++] = value;
            position = groupEnd;
        }

        return Optional.of(new Version(groups[0], groups[1], groups[2], groups[3]));
    }

    private static int skipDigits(String str, int from) {
        int i = from;
        while (i < str.length() && isDigit(str.charAt(i))) {
            i++;
        }
        return i;
    }

    private static int skipDelimiters(String str, int from) {
        int i = from;
        while (i < str.length() && DELIMITERS.indexOf(str.charAt(i)) >= 0) {
            i++;
        }
        return i;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    // null on int overflow; leading zeros just add nothing
    private static Integer toInt(String str, int from, int to) {
        long value = 0;
        for (int i = from; i < to; i++) {
            value = value * 10 + (str.charAt(i) - '0');
            if (value > Integer.MAX_VALUE) {
                return null;
            }
        }
        return (int) value;
    }
}
