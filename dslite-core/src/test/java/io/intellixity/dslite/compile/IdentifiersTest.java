package io.intellixity.dslite.compile;

import io.intellixity.dslite.query.InvalidIdentifierException;
import io.intellixity.dslite.query.QueryValidationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class IdentifiersTest {
  @Test
  void acceptsLettersDigitsAndUnderscore() {
    assertTrue(Identifiers.isSafe("users"));
    assertTrue(Identifiers.isSafe("user_id_2"));
    assertTrue(Identifiers.isSafe("_"));
    assertTrue(Identifiers.isSafe("9lives"));
    assertEquals("Orders", Identifiers.validate("Orders", "table name"));
  }

  @Test
  void rejectsEverythingElse() {
    for (String bad : new String[] {"", "bad-name", "a b", "a.b", "users;", "`users`", "naïve", "x'--", "tab\t"}) {
      assertFalse(Identifiers.isSafe(bad), bad);
    }
    assertFalse(Identifiers.isSafe(null));
  }

  @Test
  void validationFailureCarriesIdentifierAndContext() {
    InvalidIdentifierException ex = assertThrows(
        InvalidIdentifierException.class,
        () -> Identifiers.validate("users; DROP TABLE users", "table name")
    );
    assertEquals("users; DROP TABLE users", ex.identifier());
    assertEquals("table name", ex.context());
    assertEquals("Invalid characters detected in table name: users; DROP TABLE users", ex.getMessage());
    assertInstanceOf(QueryValidationException.class, ex);
  }
}
