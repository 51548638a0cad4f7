package com.github.alexishuf.fluentsparql.sparql.expr;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Grammatical categories a builder token may belong to.
 *
 * <p>Declaration order is the precedence order used by
 * {@link ExpressionClassifier#classify(CharSequence, Set)}: the first accepted category
 * whose grammar matches the whole token wins.</p>
 */
public enum ExpressionCategory {
    /** {@code ?name} or {@code $name} */
    VARIABLE,
    /** {@code <http://example.org/>} or the {@code a} shorthand for {@code rdf:type} */
    IRI,
    /** {@code foaf:name} */
    PREFIXED_IRI,
    /** A bare prefix label, such as {@code foaf} */
    PREFIX,
    /** A function call or other expression, such as {@code STRLEN(?name) > 3} */
    FUNCTION,
    /** A function bound to a variable: {@code COUNT(?x) AS ?count} */
    FUNCTION_AS;

    /** Categories accepted when no explicit set is given: variables and IRIs. */
    public static final Set<ExpressionCategory> DEFAULT
            = Collections.unmodifiableSet(EnumSet.of(VARIABLE, IRI, PREFIXED_IRI));

    public static final Set<ExpressionCategory> ALL
            = Collections.unmodifiableSet(EnumSet.allOf(ExpressionCategory.class));
}
