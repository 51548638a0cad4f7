package com.github.alexishuf.fluentsparql;

import com.github.alexishuf.fluentsparql.sparql.builder.QueryBuilder;
import com.github.alexishuf.fluentsparql.sparql.builder.QueryFormatter;

import java.util.Map;

@SuppressWarnings("unused")
public class FluentSparql {
    /* --- --- --- factory methods --- --- --- */

    /** Create a {@link QueryBuilder} with no prefix declarations. */
    public static QueryBuilder query() { return new QueryBuilder(); }

    /**
     * Create a {@link QueryBuilder} that declares the given prefixes.
     *
     * @param prefixes map from prefix names to IRIs, see {@link QueryBuilder#QueryBuilder(Map)}
     */
    public static QueryBuilder query(Map<String, String> prefixes) {
        return new QueryBuilder(prefixes);
    }

    /** Pretty-print a SPARQL string with a {@link QueryFormatter} configured by {@link FSProperties}. */
    public static String format(String sparql) { return new QueryFormatter().format(sparql); }
}
