package io.intellixity.dslite.query;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import io.intellixity.dslite.query.aggregation.Aggregation;

import java.util.*;

/**
 * Search / aggregate envelope: {@code {_source, query, join, sort, aggs, size, from}}.
 * <p>
 * {@code size} and {@code from} stay null until set so engines can tell "absent" from an explicit value.
 */
@JsonSerialize(using = QueryJsonSerializer.class)
@JsonDeserialize(using = QueryJsonDeserializer.class)
public final class SearchRequest {
  private List<String> source = new ArrayList<>();
  private QueryClause query;
  private List<JoinSpec> join = new ArrayList<>();
  private List<SortField> sort = new ArrayList<>();
  private Aggregation aggs;
  private Integer size;
  private Integer from;

  public SearchRequest() {}

  public List<String> source() { return source; }
  public QueryClause query() { return query; }
  public List<JoinSpec> join() { return join; }
  public List<SortField> sort() { return sort; }
  public Aggregation aggs() { return aggs; }
  public Integer size() { return size; }
  public Integer from() { return from; }

  public SearchRequest withSource(List<String> source) { this.source = new ArrayList<>(source == null ? List.of() : source); return this; }
  public SearchRequest withSource(String... source) { return withSource(List.of(source)); }
  public SearchRequest withQuery(QueryClause query) { this.query = query; return this; }
  public SearchRequest withJoin(List<JoinSpec> join) { this.join = new ArrayList<>(join == null ? List.of() : join); return this; }
  public SearchRequest withJoin(JoinSpec... join) { return withJoin(List.of(join)); }
  public SearchRequest withSort(List<SortField> sort) { this.sort = new ArrayList<>(sort == null ? List.of() : sort); return this; }
  public SearchRequest withSort(SortField... sort) { return withSort(List.of(sort)); }
  public SearchRequest withAggs(Aggregation aggs) { this.aggs = aggs; return this; }
  public SearchRequest withSize(Integer size) { this.size = size; return this; }
  public SearchRequest withFrom(Integer from) { this.from = from; return this; }

  public static SearchRequest of(QueryClause query) {
    return new SearchRequest().withQuery(query);
  }

  public static SearchRequest matchAll() {
    return new SearchRequest();
  }

  @Override
  public String toString() {
    return "SearchRequest{source=" + source + ", query=" + query + ", join=" + join + ", sort=" + sort
        + ", aggs=" + aggs + ", size=" + size + ", from=" + from + "}";
  }
}
