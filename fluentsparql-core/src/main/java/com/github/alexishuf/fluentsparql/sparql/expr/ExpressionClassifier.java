package com.github.alexishuf.fluentsparql.sparql.expr;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.github.alexishuf.fluentsparql.sparql.expr.ExpressionCategory.*;

/**
 * Classifies short SPARQL tokens into {@link ExpressionCategory}s and tracks every variable
 * and prefix mentioned by accepted tokens.
 *
 * <p>This is not a SPARQL expression parser. Grammars are deliberately shallow: a
 * {@link ExpressionCategory#FUNCTION} is anything that starts like a function call, a
 * number, a name or a variable. Balance of parentheses is not checked.</p>
 *
 * <p>Observed variables and prefixes are only ever added, never removed. Instances are
 * owned by a single builder and are not thread-safe.</p>
 */
public class ExpressionClassifier {
    private static final Logger log = LoggerFactory.getLogger(ExpressionClassifier.class);

    /** SPARQL 1.0/1.1 built-in function names that may start a {@link ExpressionCategory#FUNCTION}. */
    public static final List<String> FUNCTIONS = List.of(
            "COUNT", "SUM", "MIN", "MAX", "AVG", "SAMPLE", "GROUP_CONCAT", "STR",
            "LANG", "LANGMATCHES", "DATATYPE", "BOUND", "IRI", "URI", "BNODE",
            "RAND", "ABS", "CEIL", "FLOOR", "ROUND", "CONCAT", "STRLEN", "UCASE",
            "LCASE", "ENCODE_FOR_URI", "CONTAINS", "STRSTARTS", "STRENDS",
            "STRBEFORE", "STRAFTER", "YEAR", "MONTH", "DAY", "HOURS", "MINUTES",
            "SECONDS", "TIMEZONE", "TZ", "NOW", "UUID", "STRUUID", "MD5", "SHA1",
            "SHA256", "SHA384", "SHA512", "COALESCE", "IF", "STRLANG", "STRDT",
            "sameTerm", "isIRI", "isURI", "isBLANK", "isLITERAL", "isNUMERIC",
            "REGEX", "SUBSTR", "REPLACE", "EXISTS", "NOT EXISTS");

    private static final String VAR = "[?$](\\w+)";
    private static final String PREFIX_LABEL = "[A-Za-z_]+";
    private static final String FUNCTION_HEAD
            = "(?:\\d|\\w|"+VAR+"|"+String.join("|", FUNCTIONS)+")";

    private static final Pattern VAR_RX          = Pattern.compile(VAR);
    private static final Pattern IRI_RX          = Pattern.compile("<(?:\\\\.|[^<>\\\\])+>");
    private static final Pattern PREFIXED_IRI_RX = Pattern.compile("("+PREFIX_LABEL+"):\\w+");
    private static final Pattern PREFIX_RX       = Pattern.compile(PREFIX_LABEL);
    private static final Pattern FUNCTION_RX     = Pattern.compile(FUNCTION_HEAD+".*");
    private static final Pattern FUNCTION_AS_RX  = Pattern.compile(FUNCTION_HEAD+".* AS "+VAR);

    /** A variable not glued to a preceding word char and not the target of {@code AS}. */
    private static final Pattern MENTIONED_VAR_RX = Pattern.compile("(?<!\\w)(?<!AS )"+VAR);
    private static final Pattern MENTIONED_PREFIX_RX = Pattern.compile("(?<!\\w)("+PREFIX_LABEL+"):");

    private final Set<String> observedVariables = new LinkedHashSet<>();
    private final Set<String> observedPrefixes = new LinkedHashSet<>();

    /** Equivalent to {@link #classify(CharSequence, Set)} with {@link ExpressionCategory#DEFAULT}. */
    public ExpressionCategory classify(@Nullable CharSequence expression) {
        return classify(expression, DEFAULT);
    }

    /**
     * Finds the first category in {@code accepted} (in {@link ExpressionCategory} declaration
     * order) whose grammar matches the whole {@code expression}.
     *
     * <p>If the token is accepted, the variables and prefixes it mentions are recorded and
     * will be visible in {@link #variables()} and {@link #prefixes()}.</p>
     *
     * @param expression the token to classify
     * @param accepted the categories that may be returned.
     * @return the matched category, which is always a member of {@code accepted}
     * @throws InvalidExpressionException if {@code expression} is null
     * @throws UnmatchedExpressionException if no category in {@code accepted} matches
     */
    public ExpressionCategory classify(@Nullable CharSequence expression,
                                       Set<ExpressionCategory> accepted) {
        if (expression == null)
            throw new InvalidExpressionException("expression must be a non-null string");
        for (ExpressionCategory category : ExpressionCategory.values()) {
            if (accepted.contains(category) && matches(category, expression)) {
                track(category, expression);
                return category;
            }
        }
        log.debug("Rejected \"{}\", accepted categories: {}", expression, accepted);
        throw new UnmatchedExpressionException(expression, accepted);
    }

    /** Tests whether {@code expression} matches the grammar of {@code category}. Nothing is tracked. */
    public static boolean matches(ExpressionCategory category, CharSequence expression) {
        return switch (category) {
            case VARIABLE     -> VAR_RX.matcher(expression).matches();
            case IRI          -> isA(expression) || IRI_RX.matcher(expression).matches();
            case PREFIXED_IRI -> PREFIXED_IRI_RX.matcher(expression).matches();
            case PREFIX       -> PREFIX_RX.matcher(expression).matches();
            case FUNCTION     -> FUNCTION_RX.matcher(expression).matches();
            case FUNCTION_AS  -> FUNCTION_AS_RX.matcher(expression).matches();
        };
    }

    private static boolean isA(CharSequence expression) {
        return expression.length() == 1 && expression.charAt(0) == 'a';
    }

    private void track(ExpressionCategory category, CharSequence expression) {
        switch (category) {
            case VARIABLE -> observedVariables.add(expression.subSequence(1, expression.length()).toString());
            case IRI -> { }
            case PREFIXED_IRI -> {
                Matcher m = PREFIXED_IRI_RX.matcher(expression);
                if (m.matches())
                    observedPrefixes.add(m.group(1));
            }
            case PREFIX -> observedPrefixes.add(expression.toString());
            case FUNCTION, FUNCTION_AS -> {
                scan(MENTIONED_VAR_RX, expression, observedVariables::add);
                scan(MENTIONED_PREFIX_RX, expression, observedPrefixes::add);
            }
        }
    }

    private static void scan(Pattern rx, CharSequence expression, Consumer<String> sink) {
        for (Matcher m = rx.matcher(expression); m.find(); )
            sink.accept(m.group(1));
    }

    /** Variables (without sigil) mentioned by accepted tokens, in first-seen order. */
    public List<String> variables() { return List.copyOf(observedVariables); }

    /** Prefix labels mentioned by accepted tokens, in first-seen order. */
    public List<String> prefixes() { return List.copyOf(observedPrefixes); }

    @Override public String toString() {
        return "ExpressionClassifier{variables="+observedVariables+", prefixes="+observedPrefixes+"}";
    }
}
