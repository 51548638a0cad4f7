package com.github.alexishuf.fluentsparql.sparql.builder;

import com.github.alexishuf.fluentsparql.FSProperties;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Pretty-prints the single-line SPARQL produced by {@link QueryBuilder#sparql()}.
 *
 * <p>Only whitespace is changed: declarations, {@code SELECT}, {@code FILTER} and solution
 * modifiers start new lines, group contents are indented and every triple ends its line.
 * Quoted literals are copied verbatim.</p>
 */
public class QueryFormatter {
    private static final Set<String> LINE_STARTERS = Set.of(
            "PREFIX", "SELECT", "FILTER", "GROUP", "HAVING", "ORDER", "LIMIT", "OFFSET");

    private final String indentUnit;

    /** Create a formatter configured by {@link FSProperties#formatIndent()} and
     *  {@link FSProperties#formatTabs()}. */
    public QueryFormatter() {
        this(FSProperties.formatTabs() ? "\t" : " ".repeat(FSProperties.formatIndent()));
    }

    /** Create a formatter that repeats {@code indentUnit} once per nesting level. */
    public QueryFormatter(String indentUnit) {
        this.indentUnit = indentUnit;
    }

    public String format(String sparql) {
        return new Rendering().render(words(sparql));
    }

    /** Splits on whitespace that is not inside a quoted literal. */
    static List<String> words(String sparql) {
        List<String> words = new ArrayList<>();
        var word = new StringBuilder();
        char quote = 0;
        for (int i = 0, n = sparql.length(); i < n; i++) {
            char c = sparql.charAt(i);
            if (quote != 0) {
                word.append(c);
                if (c == '\\' && i+1 < n)
                    word.append(sparql.charAt(++i));
                else if (c == quote)
                    quote = 0;
            } else if (Character.isWhitespace(c)) {
                if (word.length() > 0) {
                    words.add(word.toString());
                    word.setLength(0);
                }
            } else {
                if (c == '"' || c == '\'')
                    quote = c;
                word.append(c);
            }
        }
        if (word.length() > 0)
            words.add(word.toString());
        return words;
    }

    private final class Rendering {
        private final StringBuilder out = new StringBuilder();
        private int indent = 0;
        private boolean lineStart = true, continuation = false;

        String render(List<String> words) {
            for (String w : words) {
                if (w.startsWith("\"") || w.startsWith("'")) {
                    emit(w);
                    continue;
                }
                int begin = 0, end = w.length();
                while (begin < end && w.charAt(begin) == '{') {
                    openBrace();
                    ++begin;
                }
                int closing = 0;
                while (end > begin && w.charAt(end-1) == '}') {
                    ++closing;
                    --end;
                }
                if (begin < end)
                    word(w.substring(begin, end));
                for (int i = 0; i < closing; i++)
                    closeBrace();
            }
            int len = out.length();
            while (len > 0 && Character.isWhitespace(out.charAt(len-1))) --len;
            out.setLength(len);
            return out.toString();
        }

        private void word(String w) {
            switch (w) {
                case "." -> {
                    out.append(" .");
                    continuation = false;
                    newline();
                }
                case ";" -> {
                    out.append(" ;");
                    continuation = true;
                    newline();
                }
                default -> {
                    if (LINE_STARTERS.contains(w)) {
                        continuation = false;
                        newline();
                    }
                    emit(w);
                }
            }
        }

        private void emit(String w) {
            if (!lineStart)
                out.append(' ');
            out.append(w);
            lineStart = false;
        }

        private void openBrace() {
            emit("{");
            ++indent;
            continuation = false;
            newline();
        }

        private void closeBrace() {
            indent = Math.max(0, indent-1);
            continuation = false;
            newline();
            out.append('}');
            lineStart = false;
            newline();
        }

        private void newline() {
            if (lineStart) {
                int lineBegin = out.lastIndexOf("\n")+1;
                out.setLength(lineBegin);
            } else {
                out.append('\n');
            }
            int levels = indent + (continuation ? 1 : 0);
            for (int i = 0; i < levels; i++)
                out.append(indentUnit);
            lineStart = true;
        }
    }
}
