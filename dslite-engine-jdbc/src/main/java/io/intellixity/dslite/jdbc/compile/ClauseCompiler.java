package io.intellixity.dslite.jdbc.compile;

import io.intellixity.dslite.query.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Compiles a clause tree into one SQL boolean expression with positional parameters.
 * <p>
 * Values only ever appear as parameters; field references go through {@link FieldRefLowering}.
 */
public final class ClauseCompiler implements ClauseVisitor<SqlFragment> {
  private static final Logger log = LoggerFactory.getLogger(ClauseCompiler.class);

  private final FieldRefLowering fields;

  public ClauseCompiler(FieldRefLowering fields) {
    this.fields = Objects.requireNonNull(fields, "fields");
  }

  /** A null clause matches every row. */
  public SqlFragment compile(QueryClause clause) {
    return (clause == null) ? SqlFragment.TRUE : clause.accept(this);
  }

  @Override
  public SqlFragment visitTerm(TermClause term) {
    return SqlFragment.of(fields.lower(term.field()) + " = ?", term.value());
  }

  @Override
  public SqlFragment visitTerms(TermsClause terms) {
    String expr = fields.lower(terms.field());
    if (terms.values().isEmpty()) return SqlFragment.FALSE;
    List<String> ph = new ArrayList<>(terms.values().size());
    for (int i = 0; i < terms.values().size(); i++) ph.add("?");
    return new SqlFragment(expr + " IN (" + String.join(", ", ph) + ")", terms.values());
  }

  @Override
  public SqlFragment visitMatch(MatchClause match) {
    String expr = fields.lower(match.field());
    List<String> tokens = tokens(match.text());
    if (tokens.isEmpty()) return SqlFragment.TRUE;
    return likeAll(expr, tokens);
  }

  @Override
  public SqlFragment visitMatchPhrase(MatchPhraseClause matchPhrase) {
    return SqlFragment.of(fields.lower(matchPhrase.field()) + " LIKE ?", "%" + matchPhrase.phrase() + "%");
  }

  @Override
  public SqlFragment visitMultiMatch(MultiMatchClause multiMatch) {
    if (multiMatch.text().isEmpty() || multiMatch.fields().isEmpty()) return SqlFragment.FALSE;
    List<String> tokens = tokens(multiMatch.text());
    if (tokens.isEmpty()) return SqlFragment.TRUE;

    List<String> blocks = new ArrayList<>();
    List<Object> params = new ArrayList<>();
    for (String f : multiMatch.fields()) {
      SqlFragment block = likeAll(fields.lower(f), tokens);
      blocks.add(block.sql());
      params.addAll(block.params());
    }
    return new SqlFragment("(" + String.join(" OR ", blocks) + ")", params);
  }

  @Override
  public SqlFragment visitRange(RangeClause range) {
    String expr = fields.lower(range.field());
    List<String> conditions = new ArrayList<>();
    List<Object> params = new ArrayList<>();
    for (Map.Entry<String, Object> e : range.bounds().entrySet()) {
      RangeOp op = RangeOp.fromKey(e.getKey());
      if (op == null) continue;
      conditions.add(expr + " " + op.symbol() + " ?");
      params.add(e.getValue());
    }
    if (conditions.isEmpty()) return SqlFragment.TRUE;
    return new SqlFragment("(" + String.join(" AND ", conditions) + ")", params);
  }

  @Override
  public SqlFragment visitExists(ExistsClause exists) {
    if (exists.field() == null || exists.field().isEmpty()) return SqlFragment.FALSE;
    return SqlFragment.of(fields.lower(exists.field()) + " IS NOT NULL");
  }

  @Override
  public SqlFragment visitBool(BoolClause bool) {
    if (bool.isEmpty()) return SqlFragment.TRUE;
    List<String> conjuncts = new ArrayList<>();
    List<Object> params = new ArrayList<>();

    List<QueryClause> andGroup = new ArrayList<>(bool.must());
    andGroup.addAll(bool.filter());
    SqlFragment g1 = group(andGroup, " AND ");
    // should is compiled even when it will be discarded, so its validation errors still surface
    SqlFragment shouldGroup = group(bool.should(), " OR ");
    if (g1 == null) g1 = shouldGroup;
    if (g1 != null) {
      conjuncts.add(g1.sql());
      params.addAll(g1.params());
    }

    for (QueryClause c : bool.mustNot()) {
      SqlFragment neg = compile(c);
      conjuncts.add("(NOT " + neg.sql() + ")");
      params.addAll(neg.params());
    }

    if (conjuncts.isEmpty()) return SqlFragment.TRUE;
    return new SqlFragment("(" + String.join(" AND ", conjuncts) + ")", params);
  }

  @Override
  public SqlFragment visitUnknown(UnknownClause unknown) {
    log.warn("dslite unsupported query type={}; clause ignored (matches all rows)", unknown.tag());
    return SqlFragment.TRUE;
  }

  private SqlFragment group(List<QueryClause> clauses, String joiner) {
    if (clauses.isEmpty()) return null;
    List<String> parts = new ArrayList<>(clauses.size());
    List<Object> params = new ArrayList<>();
    for (QueryClause c : clauses) {
      SqlFragment f = compile(c);
      parts.add(f.sql());
      params.addAll(f.params());
    }
    return new SqlFragment("(" + String.join(joiner, parts) + ")", params);
  }

  private static SqlFragment likeAll(String expr, List<String> tokens) {
    List<String> parts = new ArrayList<>(tokens.size());
    List<Object> params = new ArrayList<>(tokens.size());
    for (String t : tokens) {
      parts.add(expr + " LIKE ?");
      params.add("%" + t + "%");
    }
    return new SqlFragment("(" + String.join(" AND ", parts) + ")", params);
  }

  private static List<String> tokens(String text) {
    List<String> out = new ArrayList<>();
    for (String t : text.trim().split("\\s+")) {
      if (!t.isEmpty()) out.add(t);
    }
    return out;
  }
}
