package com.github.alexishuf.fluentsparql.sparql.builder;

import com.github.alexishuf.fluentsparql.exceptions.FSIllegalStateException;
import com.github.alexishuf.fluentsparql.exceptions.FSInvalidArgument;
import com.github.alexishuf.fluentsparql.sparql.expr.InvalidExpressionException;
import com.github.alexishuf.fluentsparql.sparql.expr.UnmatchedExpressionException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class QueryBuilderTest {
    private static final String FOAF = "http://xmlns.com/foaf/0.1/";
    private static final String FOAF_DECL = "PREFIX foaf: <"+FOAF+"> ";

    @ParameterizedTest @ValueSource(strings = {FOAF, "<"+FOAF+">"})
    void testSelectWithPrefix(String iri) {
        var q = new QueryBuilder(Map.of("foaf", iri))
                .select(List.of("?name"))
                .where("?person", "foaf:name", "?name");
        String expected = FOAF_DECL+"SELECT ?name WHERE { ?person foaf:name ?name . }";
        assertEquals(expected, q.sparql());
        assertEquals(expected, q.sparql());
        assertEquals(expected, q.sparql(true));
        assertEquals(expected, q.toString());
    }

    @Test
    void testOmitPrefixes() {
        var q = new QueryBuilder(Map.of("foaf", FOAF)).where("?person", "foaf:name", "?name");
        assertEquals("SELECT * WHERE { ?person foaf:name ?name . }", q.sparql(false));
    }

    @Test
    void testSelectAll() {
        assertEquals("SELECT * WHERE { }", new QueryBuilder().sparql());
        assertEquals("SELECT * WHERE { ?s ?p ?o . }",
                     new QueryBuilder().where("?s", "?p", "?o").sparql());
    }

    @Test
    void testSelectKeepsOrderAndDuplicates() {
        var q = new QueryBuilder().select("?o", "$s", "?o").where("?s", "?p", "?o");
        assertEquals("SELECT ?o ?s ?o WHERE { ?s ?p ?o . }", q.sparql());
        assertEquals(List.of(Projection.of("o"), Projection.of("s"), Projection.of("o")),
                     q.projections());
    }

    @Test
    void testSelectBoundExpression() {
        var q = new QueryBuilder()
                .select("?s", "COUNT(?o) AS ?n")
                .where("?s", "?p", "?o")
                .groupBy("?s")
                .orderBy("?n", OrderDirection.DESC);
        assertEquals("SELECT ?s (COUNT(?o) AS ?n) WHERE { ?s ?p ?o . }"
                     + " GROUP BY ?s ORDER BY DESC(?n)", q.sparql());
        assertEquals(new Projection("n", "COUNT(?o)"), q.projections().get(1));
    }

    @Test
    void testSelectBoundExpressionWithUndefinedVariable() {
        var q = new QueryBuilder().select("COUNT(?z) AS ?n").where("?s", "?p", "?o");
        var e = assertThrows(UndefinedVariableException.class, q::sparql);
        assertEquals(List.of("z"), e.names());
    }

    @Test
    void testSelectRejectsAndKeepsPrevious() {
        var q = new QueryBuilder();
        assertThrows(UnmatchedExpressionException.class, () -> q.select("?a", "name", "?b"));
        assertThrows(UnmatchedExpressionException.class, () -> q.select("foaf:name"));
        assertThrows(InvalidExpressionException.class, () -> q.select(Arrays.asList("?c", null)));
        assertEquals(List.of(Projection.of("a"), Projection.of("c")), q.projections());
        q.where("?a", "?p", "?c");
        assertEquals("SELECT ?a ?c WHERE { ?a ?p ?c . }", q.sparql());
    }

    @Test
    void testUndefinedVariable() {
        var q = new QueryBuilder().select("?x");
        var e = assertThrows(UndefinedVariableException.class, q::sparql);
        assertEquals(List.of("x"), e.names());
        assertEquals("The variables ?x don't occur in this query", e.getMessage());
    }

    @Test
    void testUndefinedVariablesListsAll() {
        var q = new QueryBuilder().select("?x", "?s", "?y").where("?s", "?p", "?o").orderBy("?z");
        var e = assertThrows(UndefinedVariableException.class, q::sparql);
        assertEquals(List.of("x", "y", "z"), e.names());
    }

    @Test
    void testUndefinedPrefix() {
        var q = new QueryBuilder().where("?person", "foaf:name", "?name");
        var e = assertThrows(UndefinedPrefixException.class, q::sparql);
        assertEquals(List.of("foaf"), e.names());
        assertEquals("The prefixes foaf aren't defined for this query", e.getMessage());
    }

    @Test
    void testPrefixCheckedBeforeVariables() {
        var q = new QueryBuilder().select("?undefined").where("?s", "ex:p", "?o");
        assertThrows(UndefinedPrefixException.class, q::sparql);
    }

    @Test
    void testUndefinedPrefixesListsAll() {
        var q = new QueryBuilder(Map.of("ex", "http://example.org/"))
                .select("STR(dc:title) AS ?t")
                .where("?s", "foaf:name", "ex:x")
                .filter("?s != owl:Nothing")
                .groupBy("xsd:int(?s)");
        var e = assertThrows(UndefinedPrefixException.class, q::sparql);
        assertEquals(List.of("foaf", "owl", "xsd", "dc"), e.names());
    }

    @Test
    void testRevalidateAfterMutation() {
        var q = new QueryBuilder().select("?s").where("?s", "?p", "?o");
        assertEquals("SELECT ?s WHERE { ?s ?p ?o . }", q.sparql());
        q.select("?z");
        assertThrows(UndefinedVariableException.class, q::sparql);
        q.where("?z", "?p", "?o");
        assertEquals("SELECT ?s ?z WHERE { ?s ?p ?o . ?z ?p ?o . }", q.sparql());
    }

    @Test
    void testTriplesAndFilter() {
        var q = new QueryBuilder(Map.of("foaf", FOAF))
                .select("?name")
                .where("?person", "foaf:name", "?name")
                .also("foaf:age", "?age")
                .also("?otherAge")
                .filter("?age > 18");
        assertEquals(FOAF_DECL+"SELECT ?name WHERE { ?person foaf:name ?name ;"
                     + " foaf:age ?age , ?otherAge . FILTER (?age > 18) }", q.sparql());
    }

    @Test
    void testModifiers() {
        var q = new QueryBuilder()
                .select("?s")
                .where("?s", "?p", "?o")
                .groupBy("?s")
                .having("COUNT(?o) > 2")
                .orderBy("?s")
                .limit(10)
                .offset(20);
        assertEquals("SELECT ?s WHERE { ?s ?p ?o . } GROUP BY ?s HAVING (COUNT(?o) > 2)"
                     + " ORDER BY ASC(?s) LIMIT 10 OFFSET 20", q.sparql());
    }

    @Test
    void testDelegatedFailures() {
        var q = new QueryBuilder();
        assertThrows(FSIllegalStateException.class, () -> q.also("?o"));
        assertThrows(FSInvalidArgument.class, () -> q.limit(-1));
        assertThrows(FSInvalidArgument.class, () -> q.offset(-1));
        assertThrows(UnmatchedExpressionException.class, () -> q.filter("(?x)"));
        assertThrows(UnmatchedExpressionException.class, () -> q.where("?s", "?p", "o"));
        assertEquals("SELECT * WHERE { }", q.sparql());
    }

    /* --- --- --- subqueries --- --- --- */

    @Test
    void testSelfSubquery() {
        var q = new QueryBuilder();
        assertThrows(SelfSubqueryException.class, () -> q.subquery(q));
        assertEquals(List.of(), q.subqueries());
    }

    @Test
    void testCyclicSubquery() {
        var a = new QueryBuilder();
        var b = new QueryBuilder();
        a.subquery(b);
        assertThrows(CyclicSubqueryException.class, () -> b.subquery(a));
        assertEquals(List.of(), b.subqueries());
    }

    @Test
    void testIndirectCyclicSubquery() {
        var a = new QueryBuilder();
        var b = new QueryBuilder();
        var c = new QueryBuilder();
        a.subquery(b);
        b.subquery(c);
        assertTrue(a.hasSubquery(c));
        assertFalse(c.hasSubquery(a));
        assertFalse(a.hasSubquery(a));
        assertThrows(CyclicSubqueryException.class, () -> c.subquery(a));
        assertThrows(CyclicSubqueryException.class, () -> c.subquery(b));
    }

    @Test
    void testSharedSubqueryIsNotCycle() {
        var a = new QueryBuilder();
        var b = new QueryBuilder();
        var c = new QueryBuilder();
        var d = new QueryBuilder().where("?s", "?p", "?o");
        a.subquery(b).subquery(c);
        b.subquery(d);
        c.subquery(d);
        a.subquery(d);
        assertTrue(a.hasSubquery(d));
        String dSparql = "{SELECT * WHERE { ?s ?p ?o . }}";
        assertEquals("SELECT * WHERE { {SELECT * WHERE { "+dSparql+" }} {SELECT * WHERE { "
                     + dSparql+" }} "+dSparql+" }", a.sparql());
    }

    @Test
    void testNestedRendering() {
        var parent = new QueryBuilder(Map.of("foaf", FOAF));
        var child1 = parent.newSubquery().select("?name").where("?person", "foaf:name", "?name");
        var child2 = parent.newSubquery().where("?person", "foaf:mbox", "?mbox");
        parent.subquery(child1).subquery(child2).select("?name", "?mbox");

        String child1Sparql = "SELECT ?name WHERE { ?person foaf:name ?name . }";
        String child2Sparql = "SELECT * WHERE { ?person foaf:mbox ?mbox . }";
        assertEquals(FOAF_DECL+child1Sparql, child1.sparql());
        assertEquals(child1Sparql, child1.sparql(false));
        assertEquals(FOAF_DECL+"SELECT ?name ?mbox WHERE { {"+child1Sparql+"} {"
                     + child2Sparql+"} }", parent.sparql());
    }

    @Test
    void testSubqueryProjectionScope() {
        var parent = new QueryBuilder();
        var child = parent.newSubquery().select("?s").where("?s", "?p", "?o");
        parent.subquery(child).select("?s");
        assertEquals("SELECT ?s WHERE { {SELECT ?s WHERE { ?s ?p ?o . }} }", parent.sparql());
        parent.select("?o");
        var e = assertThrows(UndefinedVariableException.class, parent::sparql);
        assertEquals(List.of("o"), e.names());
    }

    @Test
    void testSubqueryFailurePropagates() {
        var parent = new QueryBuilder(Map.of("foaf", FOAF));
        var child = new QueryBuilder().where("?s", "foaf:name", "?o");
        parent.subquery(child);
        var e = assertThrows(UndefinedPrefixException.class, parent::sparql);
        assertEquals(List.of("foaf"), e.names());
    }

    @Test
    void testSubqueryAttachedByReference() {
        var parent = new QueryBuilder();
        var child = parent.newSubquery();
        parent.subquery(child);
        child.where("?s", "?p", "?o");
        assertEquals("SELECT * WHERE { {SELECT * WHERE { ?s ?p ?o . }} }", parent.sparql());
    }

    @Test
    void testNewSubqueryCopiesPrefixes() {
        var parent = new QueryBuilder(Map.of("foaf", FOAF));
        var child = parent.newSubquery();
        assertNotSame(parent, child);
        assertFalse(parent.hasSubquery(child));
        assertEquals(Map.of("foaf", "<"+FOAF+">"), child.prefixes());
        assertEquals(List.of(), child.projections());

        parent.prefix("ex", "http://example.org/");
        assertEquals(Map.of("foaf", "<"+FOAF+">"), child.prefixes());
        child.where("?s", "ex:p", "?o");
        assertThrows(UndefinedPrefixException.class, child::sparql);
    }

    /* --- --- --- format --- --- --- */

    @Test
    void testFormat() {
        var q = new QueryBuilder(Map.of("foaf", FOAF))
                .select("?name")
                .where("?person", "foaf:name", "?name")
                .limit(3);
        String expected = "PREFIX foaf: <"+FOAF+">\n"
                + "SELECT ?name WHERE {\n"
                + "  ?person foaf:name ?name .\n"
                + "}\n"
                + "LIMIT 3";
        assertEquals(expected, new QueryFormatter("  ").format(q.sparql()));
    }
}
