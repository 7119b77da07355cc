package io.coltab.core;

import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable configuration shared by a table and every table derived from it.
 * <p>
 * Use the builder to override defaults:
 * <pre>
 * ColtabConfiguration config = ColtabConfiguration.builder()
 *     .indexedColumnLookup(false)
 *     .defaultFormat(ElementKind.DOUBLE, "%10.3f")
 *     .build();
 * </pre>
 */
public final class ColtabConfiguration {

    private static final ColtabConfiguration DEFAULTS = builder().build();

    // Column lookup
    private final boolean indexedColumnLookup;

    // String predicates
    private final int patternCacheSize;

    // Text dump
    private final Map<ElementKind, String> defaultFormats;
    private final String dumpNullMarker;

    private ColtabConfiguration(Builder builder) {
        this.indexedColumnLookup = builder.indexedColumnLookup;
        this.patternCacheSize = builder.patternCacheSize;
        this.defaultFormats = new EnumMap<>(builder.defaultFormats);
        this.dumpNullMarker = builder.dumpNullMarker;
    }

    /**
     * Create a new builder pre-populated with the default settings.
     *
     * @return a new Builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * The shared default configuration.
     */
    public static ColtabConfiguration defaults() {
        return DEFAULTS;
    }

    /**
     * Whether tables keep a name to column hash index next to the column list.
     *
     * @return true for hashed lookup (default), false for a linear scan
     */
    public boolean indexedColumnLookup() {
        return indexedColumnLookup;
    }

    /**
     * Maximum number of compiled string patterns kept per table.
     *
     * @return cache size, 0 disables caching
     */
    public int patternCacheSize() {
        return patternCacheSize;
    }

    /**
     * Display format used for a column of the given kind that has no format of its own.
     *
     * @param kind element kind
     * @return a {@link java.util.Formatter} pattern
     */
    public String defaultFormat(ElementKind kind) {
        return defaultFormats.get(kind);
    }

    /**
     * Text printed by the dump for invalid elements.
     */
    public String dumpNullMarker() {
        return dumpNullMarker;
    }

    /**
     * Builder for ColtabConfiguration.
     */
    public static class Builder {
        private boolean indexedColumnLookup = true;
        private int patternCacheSize = 64;
        private final Map<ElementKind, String> defaultFormats = new EnumMap<>(ElementKind.class);
        private String dumpNullMarker = "-";

        private Builder() {
            for (ElementKind kind : ElementKind.values()) {
                defaultFormats.put(kind, builtInFormat(kind));
            }
        }

        /**
         * Enable or disable the name to column hash index.
         *
         * @param indexedColumnLookup true to keep the index
         * @return this builder for method chaining
         */
        public Builder indexedColumnLookup(boolean indexedColumnLookup) {
            this.indexedColumnLookup = indexedColumnLookup;
            return this;
        }

        /**
         * Set how many compiled string patterns a table caches.
         *
         * @param patternCacheSize non-negative cache size
         * @return this builder for method chaining
         */
        public Builder patternCacheSize(int patternCacheSize) {
            if (patternCacheSize < 0) {
                throw ColtabException.illegal("patternCacheSize must be non-negative: " + patternCacheSize);
            }
            this.patternCacheSize = patternCacheSize;
            return this;
        }

        /**
         * Override the display format for one element kind.
         *
         * @param kind   element kind
         * @param format a {@link java.util.Formatter} pattern
         * @return this builder for method chaining
         */
        public Builder defaultFormat(ElementKind kind, String format) {
            if (kind == null) {
                throw ColtabException.nullInput("kind");
            }
            if (format == null) {
                throw ColtabException.nullInput("format");
            }
            defaultFormats.put(kind, format);
            return this;
        }

        public Builder dumpNullMarker(String dumpNullMarker) {
            if (dumpNullMarker == null) {
                throw ColtabException.nullInput("dumpNullMarker");
            }
            this.dumpNullMarker = dumpNullMarker;
            return this;
        }

        /**
         * Build the immutable configuration.
         *
         * @return a new ColtabConfiguration instance
         */
        public ColtabConfiguration build() {
            return new ColtabConfiguration(this);
        }

        private static String builtInFormat(ElementKind kind) {
            return switch (kind) {
                case BOOLEAN, BYTE, UNSIGNED_BYTE, SHORT, INT, LONG -> "%7d";
                case FLOAT, DOUBLE -> "%1.5e";
                case FLOAT_COMPLEX, DOUBLE_COMPLEX -> "%1.5e%+1.5ei";
                case STRING -> "%s";
            };
        }
    }
}
