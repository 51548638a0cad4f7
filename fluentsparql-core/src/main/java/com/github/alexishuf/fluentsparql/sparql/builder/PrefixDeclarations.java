package com.github.alexishuf.fluentsparql.sparql.builder;

import com.github.alexishuf.fluentsparql.exceptions.FSInvalidArgument;
import com.github.alexishuf.fluentsparql.sparql.expr.ExpressionClassifier;
import com.github.alexishuf.fluentsparql.sparql.expr.InvalidExpressionException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import static com.github.alexishuf.fluentsparql.sparql.expr.ExpressionCategory.IRI;
import static com.github.alexishuf.fluentsparql.sparql.expr.ExpressionCategory.PREFIX;

/**
 * The {@code PREFIX name: <iri>} declarations of a query, in the order given.
 */
public class PrefixDeclarations {
    private final ExpressionClassifier classifier = new ExpressionClassifier();
    private final Map<String, String> prefix2iri = new LinkedHashMap<>();

    public PrefixDeclarations() { }

    /**
     * Declares all prefixes in {@code prefixes}.
     *
     * @param prefixes map from prefix name (without the trailing {@code ':'}) to an IRI. The
     *                 surrounding angle brackets of the IRI are optional.
     * @throws FSInvalidArgument if a name or IRI is null
     * @throws InvalidExpressionException if a name is not a prefix label or an IRI is not valid
     */
    public PrefixDeclarations(Map<String, String> prefixes) {
        for (var e : prefixes.entrySet())
            add(e.getKey(), e.getValue());
    }

    /**
     * Declares {@code name} as a prefix for {@code iri}, replacing any previous declaration
     * of {@code name}.
     *
     * @param name the prefix name, without the trailing {@code ':'}
     * @param iri the IRI, optionally surrounded by angle brackets
     * @throws FSInvalidArgument if {@code name} or {@code iri} is null
     * @throws InvalidExpressionException if {@code name} is not a prefix label or {@code iri}
     *                                    is not a valid IRI
     */
    public void add(String name, String iri) {
        if (name == null || iri == null)
            throw new FSInvalidArgument("null prefix name or IRI: "+name+" -> "+iri);
        if (iri.isEmpty() || iri.charAt(0) != '<')
            iri = '<'+iri+'>';
        else if (iri.charAt(iri.length()-1) != '>')
            iri = iri+'>';
        try {
            classifier.classify(name, Set.of(PREFIX));
            classifier.classify(iri, Set.of(IRI));
        } catch (InvalidExpressionException e) {
            e.id("prefix", name);
            throw e;
        }
        prefix2iri.put(name, iri);
    }

    /** Names of the declared prefixes, in declaration order. */
    public Set<String> declared() { return Collections.unmodifiableSet(prefix2iri.keySet()); }

    /** Whether {@code name} (without trailing {@code ':'}) is declared. */
    public boolean contains(String name) { return prefix2iri.containsKey(name); }

    /** A copy of the declarations. IRIs are wrapped in angle brackets. */
    public Map<String, String> asMap() { return new LinkedHashMap<>(prefix2iri); }

    public int size() { return prefix2iri.size(); }

    /** {@code PREFIX name: <iri> } for each declaration, or the empty string. */
    public String sparql() {
        var sb = new StringBuilder();
        for (var e : prefix2iri.entrySet())
            sb.append("PREFIX ").append(e.getKey()).append(": ").append(e.getValue()).append(' ');
        return sb.toString();
    }

    @Override public String toString() { return sparql(); }
}
