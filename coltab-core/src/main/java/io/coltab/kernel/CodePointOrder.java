package io.coltab.kernel;

import java.util.Comparator;

/**
 * Lexicographic string order by Unicode code point, the order of the strings' UTF-8 bytes.
 * {@link String#compareTo} compares UTF-16 code units instead, which puts supplementary
 * characters before U+E000..U+FFFF.
 */
public final class CodePointOrder {

    public static final Comparator<String> COMPARATOR = CodePointOrder::compare;

    private CodePointOrder() {
    }

    public static int compare(String left, String right) {
        int i = 0;
        int j = 0;
        while (i < left.length() && j < right.length()) {
            int a = left.codePointAt(i);
            int b = right.codePointAt(j);
            if (a != b) {
                return Integer.compare(a, b);
            }
            i += Character.charCount(a);
            j += Character.charCount(b);
        }
        return Integer.compare(left.length() - i, right.length() - j);
    }
}
