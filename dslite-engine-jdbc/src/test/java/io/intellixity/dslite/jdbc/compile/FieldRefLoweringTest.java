package io.intellixity.dslite.jdbc.compile;

import io.intellixity.dslite.query.InvalidIdentifierException;
import io.intellixity.dslite.query.QueryValidationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class FieldRefLoweringTest {
  private final FieldRefLowering fields = new FieldRefLowering(id -> "`" + id + "`");

  @Test
  void quotesPlainAndQualifiedNames() {
    assertEquals("`age`", fields.lower("age"));
    assertEquals("`users`.`name`", fields.lower("users.name"));
    assertEquals("*", fields.lower("*"));
  }

  @Test
  void lowersJsonAccessors() {
    assertEquals("`meta` ->> '$.address.city'", fields.lower("meta->>address.city"));
    assertEquals("`meta` -> '$.tags[0]'", fields.lower("meta -> tags[0]"));
    assertEquals("`u`.`meta` ->> '$.k'", fields.lower("u.meta->>k"));
  }

  @Test
  void rejectsUnsafeNames() {
    InvalidIdentifierException e = assertThrows(InvalidIdentifierException.class,
        () -> fields.lower("name; DROP TABLE users"));
    assertEquals("field name", e.context());
    assertThrows(InvalidIdentifierException.class, () -> fields.lower("users..name"));
    assertThrows(InvalidIdentifierException.class, () -> fields.lower("bad col->>x"));
  }

  @Test
  void rejectsQuotesInJsonPath() {
    assertThrows(QueryValidationException.class, () -> fields.lower("meta->>a' OR '1'='1"));
    assertThrows(QueryValidationException.class, () -> fields.lower("meta->>tags[x]"));
    assertThrows(QueryValidationException.class, () -> fields.lower("meta->>"));
  }

  @Test
  void jsonKeysMustBeIdentifiers() {
    InvalidIdentifierException e = assertThrows(InvalidIdentifierException.class,
        () -> fields.lower("meta->>first-name"));
    assertEquals("JSON path", e.context());
    assertEquals("first-name", e.identifier());
    assertThrows(InvalidIdentifierException.class, () -> fields.lower("meta->>address.zip code"));
  }

  @Test
  void nullReferenceIsInvalid() {
    assertThrows(QueryValidationException.class, () -> fields.lower(null));
  }
}
