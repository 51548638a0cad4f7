package com.github.alexishuf.fluentsparql.sparql.builder;

import com.github.alexishuf.fluentsparql.exceptions.FSIllegalStateException;
import com.github.alexishuf.fluentsparql.sparql.expr.ExpressionClassifier;
import com.github.alexishuf.fluentsparql.sparql.expr.InvalidExpressionException;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.checkerframework.common.returnsreceiver.qual.This;

import java.util.*;

import static com.github.alexishuf.fluentsparql.sparql.expr.ExpressionCategory.FUNCTION;

/**
 * Builds the triple patterns and filters of a group graph pattern.
 *
 * <p>Triples are grouped by subject and then by predicate, in first-use order, so that
 * {@code where("?s", "?p", "?o1").also("?o2")} renders as {@code ?s ?p ?o1 , ?o2 .}</p>
 */
public class GraphPatternBuilder {
    private final ExpressionClassifier classifier = new ExpressionClassifier();
    private final Map<String, Map<String, List<String>>> triples = new LinkedHashMap<>();
    private final List<String> filters = new ArrayList<>();
    private @Nullable String subject, predicate;

    /**
     * Adds the triple pattern {@code subject predicate object}.
     *
     * @throws InvalidExpressionException if any term is not a variable, IRI or prefixed IRI
     */
    public @This GraphPatternBuilder where(String subject, String predicate, String object) {
        validate("subject", subject);
        validate("predicate", predicate);
        validate("object", object);
        triples.computeIfAbsent(subject, k -> new LinkedHashMap<>())
               .computeIfAbsent(predicate, k -> new ArrayList<>()).add(object);
        this.subject = subject;
        this.predicate = predicate;
        return this;
    }

    private void validate(String role, String term) {
        try {
            classifier.classify(term);
        } catch (InvalidExpressionException e) {
            e.id("role", role);
            throw e;
        }
    }

    /**
     * Adds another object for the subject and predicate of the last triple.
     *
     * @throws FSIllegalStateException if no triple was added yet
     */
    public @This GraphPatternBuilder also(String object) {
        if (subject == null || predicate == null)
            throw new FSIllegalStateException("also(object) called before where()");
        return where(subject, predicate, object);
    }

    /**
     * Adds another predicate and object for the subject of the last triple.
     *
     * @throws FSIllegalStateException if no triple was added yet
     */
    public @This GraphPatternBuilder also(String predicate, String object) {
        if (subject == null)
            throw new FSIllegalStateException("also(predicate, object) called before where()");
        return where(subject, predicate, object);
    }

    /** Same as {@link #where(String, String, String)} */
    public @This GraphPatternBuilder also(String subject, String predicate, String object) {
        return where(subject, predicate, object);
    }

    /**
     * Adds {@code FILTER (expression)} to this graph pattern.
     *
     * @throws InvalidExpressionException if {@code expression} does not look like an expression
     */
    public @This GraphPatternBuilder filter(String expression) {
        classifier.classify(expression, EnumSet.of(FUNCTION));
        filters.add(expression);
        return this;
    }

    /** Variables mentioned in triples and filters. */
    public List<String> definedVariables() { return classifier.variables(); }

    /** Prefixes used in triples and filters. */
    public List<String> referencedPrefixes() { return classifier.prefixes(); }

    public boolean isEmpty() { return triples.isEmpty() && filters.isEmpty(); }

    /** Renders the body of the group, with a leading space for each element. */
    public String sparql() {
        var sb = new StringBuilder();
        for (var e : triples.entrySet()) {
            sb.append(' ').append(e.getKey());
            boolean first = true;
            for (var pe : e.getValue().entrySet()) {
                if (!first) sb.append(" ;");
                first = false;
                sb.append(' ').append(pe.getKey()).append(' ')
                  .append(String.join(" , ", pe.getValue()));
            }
            sb.append(" .");
        }
        for (String f : filters)
            sb.append(" FILTER (").append(f).append(')');
        return sb.toString();
    }

    @Override public String toString() { return sparql(); }
}
