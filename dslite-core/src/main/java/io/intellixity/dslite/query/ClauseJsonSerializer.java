package io.intellixity.dslite.query;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/** Writes clauses back into their tagged DSL form. {@link UnknownClause} is written as an empty tag object. */
public final class ClauseJsonSerializer extends JsonSerializer<QueryClause> {
  @Override
  public void serialize(QueryClause clause, JsonGenerator g, SerializerProvider serializers) throws IOException {
    writeClause(clause, g, serializers);
  }

  static void writeClause(QueryClause c, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (c == null) {
      g.writeNull();
      return;
    }

    g.writeStartObject();
    if (c instanceof BoolClause b) {
      g.writeObjectFieldStart("bool");
      writeClauses("must", b.must(), g, serializers);
      writeClauses("filter", b.filter(), g, serializers);
      writeClauses("should", b.should(), g, serializers);
      writeClauses("must_not", b.mustNot(), g, serializers);
      g.writeEndObject();
    } else if (c instanceof TermClause t) {
      g.writeObjectFieldStart("term");
      g.writeFieldName(t.field());
      serializers.defaultSerializeValue(t.value(), g);
      g.writeEndObject();
    } else if (c instanceof TermsClause t) {
      g.writeObjectFieldStart("terms");
      g.writeFieldName(t.field());
      serializers.defaultSerializeValue(t.values(), g);
      g.writeEndObject();
    } else if (c instanceof MatchClause m) {
      g.writeObjectFieldStart("match");
      g.writeStringField(m.field(), m.text());
      g.writeEndObject();
    } else if (c instanceof MatchPhraseClause m) {
      g.writeObjectFieldStart("match_phrase");
      g.writeStringField(m.field(), m.phrase());
      g.writeEndObject();
    } else if (c instanceof MultiMatchClause m) {
      g.writeObjectFieldStart("multi_match");
      g.writeStringField("query", m.text());
      g.writeObjectField("fields", m.fields());
      g.writeEndObject();
    } else if (c instanceof RangeClause r) {
      g.writeObjectFieldStart("range");
      g.writeFieldName(r.field());
      g.writeStartObject();
      for (Map.Entry<String, Object> e : r.bounds().entrySet()) {
        g.writeFieldName(e.getKey());
        serializers.defaultSerializeValue(e.getValue(), g);
      }
      g.writeEndObject();
      g.writeEndObject();
    } else if (c instanceof ExistsClause e) {
      g.writeObjectFieldStart("exists");
      if (e.field() != null) g.writeStringField("field", e.field());
      g.writeEndObject();
    } else if (c instanceof UnknownClause u) {
      g.writeObjectFieldStart(u.tag() == null ? "unknown" : u.tag());
      g.writeEndObject();
    } else {
      throw new IllegalArgumentException("Unsupported clause: " + c.getClass().getName());
    }
    g.writeEndObject();
  }

  private static void writeClauses(String key, List<QueryClause> clauses, JsonGenerator g,
                                   SerializerProvider serializers) throws IOException {
    if (clauses.isEmpty()) return;
    g.writeArrayFieldStart(key);
    for (QueryClause c : clauses) writeClause(c, g, serializers);
    g.writeEndArray();
  }
}
