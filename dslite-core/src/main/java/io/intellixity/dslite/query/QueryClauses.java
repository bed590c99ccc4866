package io.intellixity.dslite.query;

import java.util.*;

public final class QueryClauses {
  private QueryClauses() {}

  public static TermClause term(String field, Object value) { return new TermClause(field, value); }
  public static TermsClause terms(String field, Collection<?> values) {
    return new TermsClause(field, values == null ? null : new ArrayList<>(values));
  }
  public static MatchClause match(String field, String text) { return new MatchClause(field, text); }
  public static MatchPhraseClause matchPhrase(String field, String phrase) { return new MatchPhraseClause(field, phrase); }
  public static MultiMatchClause multiMatch(String text, String... fields) { return new MultiMatchClause(text, List.of(fields)); }
  public static ExistsClause exists(String field) { return new ExistsClause(field); }

  public static RangeClause range(String field, RangeOp op, Object value) {
    Map<String, Object> bounds = new LinkedHashMap<>();
    bounds.put(op.key(), value);
    return new RangeClause(field, bounds);
  }

  /** Inclusive range on both ends; a null bound is left out. */
  public static RangeClause between(String field, Object gte, Object lte) {
    Map<String, Object> bounds = new LinkedHashMap<>();
    if (gte != null) bounds.put(RangeOp.GTE.key(), gte);
    if (lte != null) bounds.put(RangeOp.LTE.key(), lte);
    return new RangeClause(field, bounds);
  }

  public static BoolClause must(QueryClause... clauses) { return bool().must(clauses).build(); }
  public static BoolClause should(QueryClause... clauses) { return bool().should(clauses).build(); }
  public static BoolClause mustNot(QueryClause... clauses) { return bool().mustNot(clauses).build(); }

  public static BoolBuilder bool() { return new BoolBuilder(); }

  public static final class BoolBuilder {
    private final List<QueryClause> must = new ArrayList<>();
    private final List<QueryClause> filter = new ArrayList<>();
    private final List<QueryClause> should = new ArrayList<>();
    private final List<QueryClause> mustNot = new ArrayList<>();

    private BoolBuilder() {}

    public BoolBuilder must(QueryClause... clauses) { must.addAll(List.of(clauses)); return this; }
    public BoolBuilder filter(QueryClause... clauses) { filter.addAll(List.of(clauses)); return this; }
    public BoolBuilder should(QueryClause... clauses) { should.addAll(List.of(clauses)); return this; }
    public BoolBuilder mustNot(QueryClause... clauses) { mustNot.addAll(List.of(clauses)); return this; }

    public BoolClause build() { return new BoolClause(must, filter, should, mustNot); }
  }
}
