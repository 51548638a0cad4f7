package com.github.alexishuf.fluentsparql;

import com.github.alexishuf.fluentsparql.sparql.builder.QueryFormatter;
import org.checkerframework.checker.index.qual.NonNegative;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Settings read from JVM properties ({@code -Dfluentsparql.format.indent=4}) or, if the JVM
 * property is not set, from the environment variable with the property name in upper case
 * and with {@code '.'} replaced by {@code '_'} ({@code FLUENTSPARQL_FORMAT_INDENT=4}).
 *
 * <p>Values are cached after the first read. Call {@link #refresh()} after changing them.</p>
 */
public class FSProperties {

    /* --- --- --- property names --- --- --- */
    public static final String FORMAT_INDENT = "fluentsparql.format.indent";
    public static final String FORMAT_TABS   = "fluentsparql.format.tabs";

    /* --- --- --- default values --- --- --- */
    public static final int     DEF_FORMAT_INDENT = 2;
    public static final boolean DEF_FORMAT_TABS   = false;

    /* --- --- --- cached values --- --- --- */
    private static int     CACHE_FORMAT_INDENT = -1;
    private static Boolean CACHE_FORMAT_TABS   = null;

    /* --- --- --- internal use --- --- --- */

    protected interface Parser<T> {
        T parse(String source, String value) throws IllegalArgumentException;
    }

    protected static <T> T readProperty(String propertyName, T defaultValue,
                                        Parser<T> parser) {
        String source = "JVM property "+propertyName;
        String value = System.getProperty(propertyName);
        if (value == null) {
            String envName = propertyName.toUpperCase().replace('.', '_');
            source = "Environment var "+envName;
            value = System.getenv(envName);
        }
        return value == null ? defaultValue : parser.parse(source, value);
    }

    private static final Pattern BOOL_RX =
            Pattern.compile("(?i)\\s*(?:(t|true|1|y|yes)|(f|false|0|n|no))\\s*");
    protected static boolean readBoolean(String propertyName, boolean defaultValue) {
        return readProperty(propertyName, defaultValue, (src, val) -> {
            Matcher m = BOOL_RX.matcher(val);
            if (!m.matches())
                throw new IllegalArgumentException(src+"="+val+" is not a boolean");
            return m.group(1) != null;
        });
    }

    @SuppressWarnings("SameParameterValue")
    protected static @NonNegative int readNonNegativeInteger(String propertyName, int defaultValue) {
        return readProperty(propertyName, defaultValue, (src, val) -> {
            int i = -1;
            try { i = Integer.parseInt(val.trim()); } catch (NumberFormatException ignored) {}
            if (i < 0)
                throw new IllegalArgumentException(src+"="+val+" is not a non-negative integer");
            return i;
        });
    }

    /* --- --- --- management --- --- --- */

    /**
     * Drops all cached property values, causing properties to be re-read from
     * {@link System#getProperty(String)} and {@link System#getenv(String)}.
     */
    public static void refresh() {
        CACHE_FORMAT_INDENT = -1;
        CACHE_FORMAT_TABS   = null;
    }

    /* --- --- --- accessors --- --- --- */

    /**
     * How many spaces {@link QueryFormatter} uses for each nesting level. Ignored if
     * {@link #formatTabs()}. <strong>The default</strong> is {@link #DEF_FORMAT_INDENT}.
     */
    public static @NonNegative int formatIndent() {
        int v = CACHE_FORMAT_INDENT;
        if (v < 0)
            CACHE_FORMAT_INDENT = v = readNonNegativeInteger(FORMAT_INDENT, DEF_FORMAT_INDENT);
        return v;
    }

    /** Whether {@link QueryFormatter} indents with one tab per level instead of spaces. */
    public static boolean formatTabs() {
        Boolean v = CACHE_FORMAT_TABS;
        if (v == null)
            CACHE_FORMAT_TABS = v = readBoolean(FORMAT_TABS, DEF_FORMAT_TABS);
        return v == Boolean.TRUE;
    }
}
