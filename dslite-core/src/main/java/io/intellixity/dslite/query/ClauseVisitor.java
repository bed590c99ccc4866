package io.intellixity.dslite.query;

public interface ClauseVisitor<R> {
  R visitTerm(TermClause term);
  R visitTerms(TermsClause terms);
  R visitMatch(MatchClause match);
  R visitMatchPhrase(MatchPhraseClause matchPhrase);
  R visitMultiMatch(MultiMatchClause multiMatch);
  R visitRange(RangeClause range);
  R visitExists(ExistsClause exists);
  R visitBool(BoolClause bool);
  R visitUnknown(UnknownClause unknown);
}
