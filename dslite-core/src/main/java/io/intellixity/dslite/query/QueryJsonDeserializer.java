package io.intellixity.dslite.query;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.*;
import io.intellixity.dslite.query.aggregation.Aggregation;
import io.intellixity.dslite.query.aggregation.Metric;

import java.io.IOException;
import java.util.*;

/** Canonical JSON deserializer for {@link SearchRequest}. */
public final class QueryJsonDeserializer extends JsonDeserializer<SearchRequest> {
  @Override
  public SearchRequest deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    ObjectCodec codec = p.getCodec();
    JsonNode root = codec.readTree(p);
    if (root == null || root.isNull()) return null;
    if (!root.isObject()) throw new QueryValidationException("Search request JSON must be an object");

    SearchRequest r = new SearchRequest();

    JsonNode source = root.get("_source");
    if (source != null && source.isArray()) {
      r.withSource(textList(source));
    }

    JsonNode query = root.get("query");
    if (query != null && !query.isNull()) {
      r.withQuery(ClauseJsonDeserializer.parseClause(query, codec));
    }

    JsonNode join = root.get("join");
    if (join != null && join.isArray()) {
      List<JoinSpec> joins = new ArrayList<>();
      for (JsonNode j : join) joins.add(parseJoin(j));
      r.withJoin(joins);
    }

    JsonNode sort = root.get("sort");
    if (sort != null && sort.isArray()) {
      List<SortField> fields = new ArrayList<>();
      for (JsonNode s : sort) {
        // {"age": "desc"}: first entry only
        if (!s.isObject()) continue;
        Iterator<Map.Entry<String, JsonNode>> it = s.fields();
        if (!it.hasNext()) continue;
        Map.Entry<String, JsonNode> e = it.next();
        fields.add(new SortField(e.getKey(), SortField.Direction.lenient(ClauseJsonDeserializer.textOrNull(e.getValue()))));
      }
      r.withSort(fields);
    }

    JsonNode aggs = root.get("aggs");
    if (aggs != null && !aggs.isNull()) {
      r.withAggs(parseAggs(aggs));
    }

    r.withSize(intOrNull(root.get("size"), "size"));
    r.withFrom(intOrNull(root.get("from"), "from"));
    return r;
  }

  private static JoinSpec parseJoin(JsonNode j) {
    if (!j.isObject()) throw new QueryValidationException("join entry must be an object: " + j);
    JoinType type = JoinType.parse(ClauseJsonDeserializer.textOrNull(j.get("type")));
    String target = ClauseJsonDeserializer.textOrNull(j.get("target"));
    JsonNode on = j.get("on");
    JoinSpec.On o = null;
    if (on != null && on.isObject()) {
      o = new JoinSpec.On(
          ClauseJsonDeserializer.textOrNull(on.get("left")),
          ClauseJsonDeserializer.textOrNull(on.get("right")),
          ClauseJsonDeserializer.textOrNull(on.get("op")));
    }
    return new JoinSpec(type, target, o);
  }

  private static Aggregation parseAggs(JsonNode aggs) {
    if (!aggs.isObject()) throw new QueryValidationException("aggs must be an object");
    List<String> groupBy = List.of();
    JsonNode gb = aggs.get("group_by");
    if (gb != null && gb.isArray()) groupBy = textList(gb);

    List<Metric> metrics = new ArrayList<>();
    JsonNode m = aggs.get("metrics");
    if (m != null && m.isObject()) {
      Iterator<Map.Entry<String, JsonNode>> it = m.fields();
      while (it.hasNext()) {
        Map.Entry<String, JsonNode> e = it.next();
        JsonNode op = e.getValue();
        // {"total": {"sum": "amount"}}: the single operator key
        if (op == null || !op.isObject() || !op.fieldNames().hasNext()) {
          metrics.add(new Metric(e.getKey(), null, null));
          continue;
        }
        String opKey = op.fieldNames().next();
        metrics.add(new Metric(e.getKey(), opKey, ClauseJsonDeserializer.textOrNull(op.get(opKey))));
      }
    }
    return new Aggregation(groupBy, metrics);
  }

  private static List<String> textList(JsonNode arr) {
    List<String> out = new ArrayList<>();
    for (JsonNode x : arr) if (x.isTextual()) out.add(x.asText());
    return out;
  }

  private static Integer intOrNull(JsonNode n, String name) {
    if (n == null || n.isNull()) return null;
    if (n.isIntegralNumber() && n.canConvertToInt()) return n.intValue();
    if (n.isTextual()) {
      try {
        return Integer.parseInt(n.asText().trim());
      } catch (NumberFormatException e) {
        throw new QueryValidationException(name + " must be an integer: " + n.asText(), e);
      }
    }
    throw new QueryValidationException(name + " must be an integer: " + n);
  }
}
