package com.github.alexishuf.fluentsparql.sparql.builder;

import com.github.alexishuf.fluentsparql.exceptions.FSIllegalStateException;
import com.github.alexishuf.fluentsparql.exceptions.FSInvalidArgument;
import com.github.alexishuf.fluentsparql.sparql.expr.ExpressionCategory;
import com.github.alexishuf.fluentsparql.sparql.expr.ExpressionClassifier;
import com.github.alexishuf.fluentsparql.sparql.expr.InvalidExpressionException;
import org.checkerframework.checker.index.qual.NonNegative;
import org.checkerframework.common.returnsreceiver.qual.This;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

import static com.github.alexishuf.fluentsparql.sparql.expr.ExpressionCategory.FUNCTION_AS;
import static com.github.alexishuf.fluentsparql.sparql.expr.ExpressionCategory.VARIABLE;

/**
 * Builds a SPARQL {@code SELECT} query through chained calls.
 *
 * <pre>{@code
 * String sparql = new QueryBuilder(Map.of("foaf", "http://xmlns.com/foaf/0.1/"))
 *         .select("?name")
 *         .where("?person", "foaf:name", "?name")
 *         .limit(10)
 *         .sparql();
 * }</pre>
 *
 * <p>Tokens are validated as soon as they are given. Whether every used prefix is declared
 * and every selected or modifier variable occurs in the query can only be known once the
 * query is complete, thus these checks happen on every {@link #sparql(boolean)} call.</p>
 *
 * <p>Subqueries are attached by reference: changes made to a subquery after
 * {@link #subquery(QueryBuilder)} are visible when this query is rendered. A query can never
 * be reachable from itself through subqueries.</p>
 *
 * <p>Instances are not thread-safe.</p>
 */
public class QueryBuilder {
    private static final Logger log = LoggerFactory.getLogger(QueryBuilder.class);
    private static final Set<ExpressionCategory> PROJECTION = EnumSet.of(VARIABLE, FUNCTION_AS);
    private static final String AS = " AS ";

    private final ExpressionClassifier classifier = new ExpressionClassifier();
    private final PrefixDeclarations prefixes;
    private final GraphPatternBuilder graph = new GraphPatternBuilder();
    private final SolutionModifiers modifiers = new SolutionModifiers();
    private final List<Projection> projections = new ArrayList<>();
    private final List<QueryBuilder> subqueries = new ArrayList<>();

    /** Create a query without prefix declarations. */
    public QueryBuilder() { this(Map.of()); }

    /**
     * Create a query with the given prefix declarations.
     *
     * @param prefixes map from prefix names (without trailing {@code ':'}) to IRIs (angle
     *                 brackets are optional)
     * @throws InvalidExpressionException if a name or IRI is malformed
     * @throws FSInvalidArgument if a name or IRI is null
     */
    public QueryBuilder(Map<String, String> prefixes) {
        this.prefixes = new PrefixDeclarations(prefixes);
    }

    /* --- --- --- projection --- --- --- */

    /** Equivalent to {@link #select(List)} with {@code first} followed by {@code rest}. */
    public @This QueryBuilder select(String first, String... rest) {
        var list = new ArrayList<String>(rest.length+1);
        list.add(first);
        list.addAll(Arrays.asList(rest));
        return select(list);
    }

    /**
     * Appends each of {@code variables} to the {@code SELECT} clause, in order.
     *
     * <p>Items may be variables ({@code ?x} or {@code $x}) or expressions bound to a variable
     * ({@code COUNT(?x) AS ?count}). Duplicates are not removed.</p>
     *
     * <p>If an item is rejected, the items before it remain selected.</p>
     *
     * @throws InvalidExpressionException if an item is null, not a variable and not an
     *                                    expression bound to a variable.
     */
    public @This QueryBuilder select(List<String> variables) {
        for (String v : variables) {
            if (classifier.classify(v, PROJECTION) == VARIABLE) {
                projections.add(Projection.of(v.substring(1)));
            } else {
                int as = v.lastIndexOf(AS);
                projections.add(new Projection(v.substring(as+AS.length()+1),
                                               v.substring(0, as)));
            }
        }
        return this;
    }

    /** The items selected so far, in selection order. */
    public List<Projection> projections() { return Collections.unmodifiableList(projections); }

    /* --- --- --- subqueries --- --- --- */

    /**
     * Adds {@code query} as a subquery, which will be rendered as a nested {@code SELECT}
     * group before the triples of this query.
     *
     * @throws SelfSubqueryException if {@code query} is {@code this}
     * @throws CyclicSubqueryException if {@code query} already contains {@code this} as a
     *                                 direct or indirect subquery.
     */
    public @This QueryBuilder subquery(QueryBuilder query) {
        if (query == this)
            throw new SelfSubqueryException();
        if (query.hasSubquery(this)) {
            log.debug("Rejecting subquery {} of {}: would create a cycle", id(query), id(this));
            throw new CyclicSubqueryException();
        }
        subqueries.add(query);
        return this;
    }

    /**
     * Whether {@code query} is a subquery of this query or of any of its subqueries,
     * recursively. Comparison is by reference.
     */
    public boolean hasSubquery(QueryBuilder query) {
        var visited = Collections.newSetFromMap(new IdentityHashMap<QueryBuilder, Boolean>());
        var stack = new ArrayDeque<>(subqueries);
        while (!stack.isEmpty()) {
            QueryBuilder q = stack.pop();
            if (q == query)
                return true;
            if (visited.add(q))
                stack.addAll(q.subqueries);
        }
        return false;
    }

    /**
     * Creates an empty query that declares the same prefixes this query declares now. The
     * new query is not attached: call {@link #subquery(QueryBuilder)} to attach it.
     *
     * <p>Prefixes are copied: the new query will not see later changes to this one.</p>
     */
    public QueryBuilder newSubquery() {
        return new QueryBuilder(prefixes.asMap());
    }

    /**
     * Declares {@code name} as a prefix for {@code iri}. Subqueries previously created with
     * {@link #newSubquery()} are not affected.
     *
     * @see PrefixDeclarations#add(String, String)
     */
    public @This QueryBuilder prefix(String name, String iri) {
        prefixes.add(name, iri);
        return this;
    }

    /** Attached subqueries, in attachment order. */
    public List<QueryBuilder> subqueries() { return Collections.unmodifiableList(subqueries); }

    /** A copy of the declared prefixes, with IRIs wrapped in angle brackets. */
    public Map<String, String> prefixes() { return prefixes.asMap(); }

    /* --- --- --- graph pattern --- --- --- */

    /** @see GraphPatternBuilder#where(String, String, String) */
    public @This QueryBuilder where(String subject, String predicate, String object) {
        graph.where(subject, predicate, object);
        return this;
    }

    /**
     * Adds {@code object} for the subject and predicate of the last triple.
     *
     * @throws FSIllegalStateException if there is no previous triple.
     */
    public @This QueryBuilder also(String object) {
        graph.also(object);
        return this;
    }

    /**
     * Adds a {@code predicate} and {@code object} for the subject of the last triple.
     *
     * @throws FSIllegalStateException if there is no previous triple.
     */
    public @This QueryBuilder also(String predicate, String object) {
        graph.also(predicate, object);
        return this;
    }

    /** Same as {@link #where(String, String, String)}. */
    public @This QueryBuilder also(String subject, String predicate, String object) {
        graph.also(subject, predicate, object);
        return this;
    }

    /** @see GraphPatternBuilder#filter(String) */
    public @This QueryBuilder filter(String expression) {
        graph.filter(expression);
        return this;
    }

    /* --- --- --- solution modifiers --- --- --- */

    /** @see SolutionModifiers#groupBy(String) */
    public @This QueryBuilder groupBy(String expression) {
        modifiers.groupBy(expression);
        return this;
    }

    /** @see SolutionModifiers#having(String) */
    public @This QueryBuilder having(String expression) {
        modifiers.having(expression);
        return this;
    }

    /** @see SolutionModifiers#orderBy(String) */
    public @This QueryBuilder orderBy(String expression) {
        modifiers.orderBy(expression);
        return this;
    }

    /** @see SolutionModifiers#orderBy(String, OrderDirection) */
    public @This QueryBuilder orderBy(String expression, OrderDirection direction) {
        modifiers.orderBy(expression, direction);
        return this;
    }

    /** @see SolutionModifiers#limit(int) */
    public @This QueryBuilder limit(@NonNegative int limit) {
        modifiers.limit(limit);
        return this;
    }

    /** @see SolutionModifiers#offset(int) */
    public @This QueryBuilder offset(@NonNegative int offset) {
        modifiers.offset(offset);
        return this;
    }

    /* --- --- --- rendering --- --- --- */

    /**
     * Renders this query as a single line of SPARQL.
     *
     * @param includePrefixes whether {@code PREFIX} declarations are rendered. Subqueries
     *                        are always rendered without them.
     * @return the SPARQL query
     * @throws UndefinedPrefixException if any prefix used in the query is not declared
     * @throws UndefinedVariableException if a selected variable or a variable used by a
     *                                    solution modifier does not occur in the graph
     *                                    pattern nor in the projection of a subquery
     */
    public String sparql(boolean includePrefixes) {
        validatePrefixes();
        validateVariables();

        var sb = new StringBuilder();
        if (includePrefixes)
            sb.append(prefixes.sparql());
        sb.append("SELECT ");
        if (projections.isEmpty()) {
            sb.append('*');
        } else {
            for (Projection p : projections)
                sb.append(p.sparql()).append(' ');
            sb.setLength(sb.length()-1);
        }
        sb.append(" WHERE {");
        for (QueryBuilder q : subqueries)
            sb.append(" {").append(q.sparql(false)).append('}');
        sb.append(graph.sparql()).append(" }").append(modifiers.sparql());
        String sparql = sb.toString();
        log.trace("Rendered {}: {}", id(this), sparql);
        return sparql;
    }

    /** Equivalent to {@link #sparql(boolean)} with {@code true}. */
    public String sparql() { return sparql(true); }

    /** Renders with {@link #sparql()} and pretty-prints with a {@link QueryFormatter}. */
    public String format() { return new QueryFormatter().format(sparql()); }

    private void validatePrefixes() {
        var used = new LinkedHashSet<String>(graph.referencedPrefixes());
        used.addAll(modifiers.referencedPrefixes());
        used.addAll(classifier.prefixes());
        used.removeAll(prefixes.declared());
        if (!used.isEmpty()) {
            log.debug("Undeclared prefixes {} in {}", used, id(this));
            throw new UndefinedPrefixException(new ArrayList<>(used));
        }
    }

    private void validateVariables() {
        var used = new LinkedHashSet<String>(classifier.variables());
        used.addAll(modifiers.referencedVariables());
        used.removeAll(definedVariables());
        if (!used.isEmpty()) {
            log.debug("Undefined variables {} in {}", used, id(this));
            throw new UndefinedVariableException(new ArrayList<>(used));
        }
    }

    /**
     * Variables in scope within this query: those in the graph pattern, those projected by
     * subqueries and those bound by {@code AS} in the projection.
     */
    private Set<String> definedVariables() {
        var defined = new HashSet<>(graph.definedVariables());
        for (QueryBuilder q : subqueries)
            defined.addAll(q.exposedVariables());
        for (Projection p : projections) {
            if (p.isBound())
                defined.add(p.var());
        }
        return defined;
    }

    /** Variables visible to a query that has this one as subquery. */
    private Set<String> exposedVariables() {
        if (projections.isEmpty())
            return definedVariables();
        var exposed = new HashSet<String>();
        for (Projection p : projections)
            exposed.add(p.var());
        return exposed;
    }

    private static String id(QueryBuilder q) {
        return "QueryBuilder@"+Integer.toHexString(System.identityHashCode(q));
    }

    @Override public String toString() { return sparql(); }
}
