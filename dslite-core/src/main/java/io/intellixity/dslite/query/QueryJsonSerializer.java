package io.intellixity.dslite.query;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import io.intellixity.dslite.query.aggregation.Aggregation;
import io.intellixity.dslite.query.aggregation.Metric;

import java.io.IOException;

/** Canonical JSON serializer for {@link SearchRequest}. */
public final class QueryJsonSerializer extends JsonSerializer<SearchRequest> {
  @Override
  public void serialize(SearchRequest r, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (r == null) {
      g.writeNull();
      return;
    }

    g.writeStartObject();

    if (!r.source().isEmpty()) {
      g.writeObjectField("_source", r.source());
    }

    if (r.query() != null) {
      g.writeFieldName("query");
      ClauseJsonSerializer.writeClause(r.query(), g, serializers);
    }

    if (!r.join().isEmpty()) {
      g.writeArrayFieldStart("join");
      for (JoinSpec j : r.join()) {
        g.writeStartObject();
        g.writeStringField("type", j.type().name());
        g.writeStringField("target", j.target());
        if (j.on() != null) {
          g.writeObjectFieldStart("on");
          g.writeStringField("left", j.on().left());
          g.writeStringField("right", j.on().right());
          g.writeStringField("op", j.on().op());
          g.writeEndObject();
        }
        g.writeEndObject();
      }
      g.writeEndArray();
    }

    if (!r.sort().isEmpty()) {
      g.writeArrayFieldStart("sort");
      for (SortField sf : r.sort()) {
        g.writeStartObject();
        g.writeStringField(sf.field(), sf.direction().name().toLowerCase(java.util.Locale.ROOT));
        g.writeEndObject();
      }
      g.writeEndArray();
    }

    Aggregation aggs = r.aggs();
    if (aggs != null) {
      g.writeObjectFieldStart("aggs");
      if (!aggs.groupBy().isEmpty()) g.writeObjectField("group_by", aggs.groupBy());
      if (!aggs.metrics().isEmpty()) {
        g.writeObjectFieldStart("metrics");
        for (Metric m : aggs.metrics()) {
          g.writeObjectFieldStart(m.alias());
          if (m.op() != null) g.writeStringField(m.op(), m.field());
          g.writeEndObject();
        }
        g.writeEndObject();
      }
      g.writeEndObject();
    }

    if (r.size() != null) g.writeNumberField("size", r.size());
    if (r.from() != null) g.writeNumberField("from", r.from());

    g.writeEndObject();
  }
}
