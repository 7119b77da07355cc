package io.coltab.table;

import io.coltab.core.ColtabException;
import io.coltab.core.ErrorCode;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Least-recently-used cache of compiled string predicates.
 */
final class PatternCache {

    private final int capacity;
    private final Map<String, Pattern> patterns;

    PatternCache(int capacity) {
        this.capacity = capacity;
        this.patterns = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Pattern> eldest) {
                return size() > PatternCache.this.capacity;
            }
        };
    }

    Pattern compile(String expression) {
        if (capacity == 0) {
            return doCompile(expression);
        }
        Pattern cached = patterns.get(expression);
        if (cached == null) {
            cached = doCompile(expression);
            patterns.put(expression, cached);
        }
        return cached;
    }

    int size() {
        return patterns.size();
    }

    private static Pattern doCompile(String expression) {
        try {
            return Pattern.compile(expression);
        } catch (PatternSyntaxException e) {
            throw new ColtabException(ErrorCode.ILLEGAL_INPUT, "invalid regular expression: " + expression, e);
        }
    }
}
