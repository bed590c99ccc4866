package io.intellixity.dslite.query;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.*;

/**
 * Reads one clause object such as {@code {"term": {"status": "active"}}}.
 * <p>
 * When an object carries several tags the first one present in {@link #TAG_PRECEDENCE} wins and the rest are
 * ignored. An object with none of them becomes an {@link UnknownClause}.
 */
public final class ClauseJsonDeserializer extends JsonDeserializer<QueryClause> {
  static final List<String> TAG_PRECEDENCE =
      List.of("bool", "match", "match_phrase", "multi_match", "exists", "term", "terms", "range");

  @Override
  public QueryClause deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    ObjectCodec codec = p.getCodec();
    JsonNode root = codec.readTree(p);
    return parseClause(root, codec);
  }

  static QueryClause parseClause(JsonNode n, ObjectCodec codec) throws IOException {
    if (n == null || n.isNull()) return null;
    if (!n.isObject()) throw new QueryValidationException("Query clause must be an object: " + n);

    String tag = null;
    for (String t : TAG_PRECEDENCE) {
      if (n.has(t)) { tag = t; break; }
    }
    if (tag == null) {
      Iterator<String> it = n.fieldNames();
      return new UnknownClause(it.hasNext() ? it.next() : null);
    }

    JsonNode body = n.get(tag);
    return switch (tag) {
      case "bool" -> parseBool(body, codec);
      case "match" -> {
        Map.Entry<String, JsonNode> e = singleField(tag, body);
        yield new MatchClause(e.getKey(), textOf(e.getValue()));
      }
      case "match_phrase" -> {
        Map.Entry<String, JsonNode> e = singleField(tag, body);
        yield new MatchPhraseClause(e.getKey(), textOf(e.getValue()));
      }
      case "multi_match" -> parseMultiMatch(body);
      case "exists" -> {
        requireObject(tag, body);
        yield new ExistsClause(textOrNull(body.get("field")));
      }
      case "term" -> {
        Map.Entry<String, JsonNode> e = singleField(tag, body);
        yield new TermClause(e.getKey(), decodeValue(e.getValue(), codec));
      }
      case "terms" -> {
        Map.Entry<String, JsonNode> e = singleField(tag, body);
        List<Object> values = new ArrayList<>();
        // a non-array value is read as "no values", which never matches
        if (e.getValue().isArray()) {
          for (JsonNode v : e.getValue()) values.add(decodeValue(v, codec));
        }
        yield new TermsClause(e.getKey(), values);
      }
      case "range" -> {
        Map.Entry<String, JsonNode> e = singleField(tag, body);
        Map<String, Object> bounds = new LinkedHashMap<>();
        if (e.getValue().isObject()) {
          Iterator<Map.Entry<String, JsonNode>> it = e.getValue().fields();
          while (it.hasNext()) {
            Map.Entry<String, JsonNode> b = it.next();
            bounds.put(b.getKey(), decodeValue(b.getValue(), codec));
          }
        }
        yield new RangeClause(e.getKey(), bounds);
      }
      default -> throw new IllegalStateException("Unhandled clause tag: " + tag);
    };
  }

  private static BoolClause parseBool(JsonNode body, ObjectCodec codec) throws IOException {
    requireObject("bool", body);
    return new BoolClause(
        parseClauseList(body.get("must"), codec),
        parseClauseList(body.get("filter"), codec),
        parseClauseList(body.get("should"), codec),
        parseClauseList(body.get("must_not"), codec));
  }

  /** Accepts an array of clauses or a single clause object. */
  private static List<QueryClause> parseClauseList(JsonNode n, ObjectCodec codec) throws IOException {
    if (n == null || n.isNull()) return List.of();
    if (n.isObject()) return List.of(parseClause(n, codec));
    if (!n.isArray()) throw new QueryValidationException("bool section must be an array of clauses: " + n);
    List<QueryClause> out = new ArrayList<>();
    for (JsonNode x : n) {
      QueryClause c = parseClause(x, codec);
      if (c != null) out.add(c);
    }
    return out;
  }

  private static MultiMatchClause parseMultiMatch(JsonNode body) {
    requireObject("multi_match", body);
    List<String> fields = new ArrayList<>();
    JsonNode f = body.get("fields");
    if (f != null && f.isArray()) {
      for (JsonNode x : f) if (x.isTextual()) fields.add(x.asText());
    }
    return new MultiMatchClause(textOrNull(body.get("query")), fields);
  }

  private static Map.Entry<String, JsonNode> singleField(String tag, JsonNode body) {
    requireObject(tag, body);
    Iterator<Map.Entry<String, JsonNode>> it = body.fields();
    if (!it.hasNext()) throw new QueryValidationException(tag + " requires a field");
    return it.next();
  }

  private static void requireObject(String tag, JsonNode body) {
    if (body == null || !body.isObject()) throw new QueryValidationException(tag + " must be an object");
  }

  static Object decodeValue(JsonNode v, ObjectCodec codec) throws IOException {
    if (v == null || v.isNull()) return null;
    return codec.treeToValue(v, Object.class);
  }

  private static String textOf(JsonNode n) {
    return (n == null || n.isNull()) ? "" : n.asText();
  }

  static String textOrNull(JsonNode n) {
    return (n == null || n.isNull()) ? null : n.asText();
  }
}
