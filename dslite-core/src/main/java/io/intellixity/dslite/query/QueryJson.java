package io.intellixity.dslite.query;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Map;

/**
 * Entry points for requests that arrive as JSON text or as already-deserialized maps.
 * <p>
 * Validation problems surface as {@link QueryValidationException} regardless of how Jackson wraps them.
 */
public final class QueryJson {
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private QueryJson() {}

  public static ObjectMapper mapper() { return MAPPER; }

  public static SearchRequest read(String json) {
    try {
      return MAPPER.readValue(json, SearchRequest.class);
    } catch (JsonProcessingException | IllegalArgumentException e) {
      throw unwrap("Malformed search request", e);
    }
  }

  public static SearchRequest fromMap(Map<String, ?> map) {
    try {
      JsonNode tree = MAPPER.valueToTree(map);
      return MAPPER.treeToValue(tree, SearchRequest.class);
    } catch (JsonProcessingException | IllegalArgumentException e) {
      throw unwrap("Malformed search request", e);
    }
  }

  public static QueryClause readClause(String json) {
    try {
      return MAPPER.readValue(json, QueryClause.class);
    } catch (JsonProcessingException | IllegalArgumentException e) {
      throw unwrap("Malformed query clause", e);
    }
  }

  public static QueryClause clauseFromMap(Map<String, ?> map) {
    try {
      JsonNode tree = MAPPER.valueToTree(map);
      return MAPPER.treeToValue(tree, QueryClause.class);
    } catch (JsonProcessingException | IllegalArgumentException e) {
      throw unwrap("Malformed query clause", e);
    }
  }

  public static String write(SearchRequest request) {
    try {
      return MAPPER.writeValueAsString(request);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to write search request", e);
    }
  }

  private static QueryValidationException unwrap(String message, Exception e) {
    for (Throwable t = e; t != null; t = t.getCause()) {
      if (t instanceof QueryValidationException qve) return qve;
    }
    return new QueryValidationException(message + ": " + e.getMessage(), e);
  }
}
