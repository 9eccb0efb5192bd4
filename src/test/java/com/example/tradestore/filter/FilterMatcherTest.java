package com.example.tradestore.filter;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import static com.example.tradestore.TradeFixtures.json;
import static org.assertj.core.api.Assertions.assertThat;

class FilterMatcherTest {

    private final FilterMatcher matcher = new FilterMatcher();
    private final FilterParser parser = new FilterParser();

    private final ObjectNode document = json("""
            {"type": "IR_SWAP", "notional": 5000000, "rate": 0.045, "code": "1",
             "counterparty": "BANK-A", "active": true, "comment": null,
             "legs": [{"ccy": "USD"}], "details": {"book": "B1"}}
            """);

    private boolean matches(String filter) {
        return matcher.matches(document, TradeFilter.builder().predicates(parser.parse(json(filter))).build());
    }

    @Test
    void shouldMatchEverythingWithEmptyFilter() {
        assertThat(matcher.matches(document, TradeFilter.all())).isTrue();
        assertThat(matcher.matches(json("{}"), TradeFilter.all())).isTrue();
    }

    @Test
    void shouldCombinePredicatesWithAnd() {
        assertThat(matches("{\"type\": {\"eq\": \"IR_SWAP\"}, \"notional\": {\"gte\": 1000000}}")).isTrue();
        assertThat(matches("{\"type\": {\"eq\": \"FX\"}, \"notional\": {\"gte\": 1000000}}")).isFalse();
        assertThat(matches("{\"type\": {\"eq\": \"IR_SWAP\"}, \"notional\": {\"gte\": 9000000}}")).isFalse();
    }

    @Test
    void shouldCombineOperatorsOnOnePath() {
        assertThat(matches("{\"notional\": {\"gte\": 1000000, \"lte\": 10000000}}")).isTrue();
        assertThat(matches("{\"notional\": {\"gt\": 5000000}}")).isFalse();
        assertThat(matches("{\"notional\": {\"lt\": 5000001}}")).isTrue();
    }

    @Test
    void shouldNeverMatchAbsentField() {
        assertThat(matches("{\"x\": {\"eq\": \"anything\"}}")).isFalse();
        assertThat(matches("{\"x\": {\"ne\": \"anything\"}}")).isFalse();
        assertThat(matches("{\"x\": {\"nin\": [1, 2]}}")).isFalse();
        assertThat(matches("{\"details.missing\": {\"gte\": 0}}")).isFalse();
        assertThat(matches("{\"comment\": {\"eq\": null}}")).isFalse();
    }

    @Test
    void shouldMatchMissingFieldOnlyThroughExists() {
        assertThat(matches("{\"x\": {\"exists\": false}}")).isTrue();
        assertThat(matches("{\"x\": {\"exists\": true}}")).isFalse();
        assertThat(matches("{\"details.book\": {\"exists\": true}}")).isTrue();
        assertThat(matches("{\"comment\": {\"exists\": false}}")).isTrue();
    }

    @Test
    void shouldCompareEqualityTypeSensitively() {
        assertThat(matches("{\"code\": {\"eq\": \"1\"}}")).isTrue();
        assertThat(matches("{\"code\": {\"eq\": 1}}")).isFalse();
        assertThat(matches("{\"code\": {\"ne\": 1}}")).isTrue();
        assertThat(matches("{\"active\": {\"eq\": true}}")).isTrue();
        assertThat(matches("{\"active\": {\"eq\": \"true\"}}")).isFalse();
    }

    @Test
    void shouldCompareNumbersByValue() {
        assertThat(matches("{\"notional\": {\"eq\": 5000000.00}}")).isTrue();
        assertThat(matches("{\"rate\": {\"eq\": 0.0450}}")).isTrue();
    }

    @Test
    void shouldCompareNestedNumbersByValue() {
        ObjectNode terms = json("{\"terms\": {\"tenor\": 5, \"rates\": [0.045, 1]}}");

        assertThat(matcher.matches(terms, TradeFilter.builder().predicates(parser.parse(
                json("{\"terms\": {\"eq\": {\"tenor\": 5.0, \"rates\": [0.0450, 1.00]}}}"))).build())).isTrue();
        assertThat(matcher.matches(terms, TradeFilter.builder().predicates(parser.parse(
                json("{\"terms\": {\"in\": [{\"rates\": [0.045, 1], \"tenor\": 5.00}]}}"))).build())).isTrue();
        assertThat(matcher.matches(terms, TradeFilter.builder().predicates(parser.parse(
                json("{\"terms\": {\"eq\": {\"tenor\": \"5\", \"rates\": [0.045, 1]}}}"))).build())).isFalse();
        assertThat(matcher.matches(terms, TradeFilter.builder().predicates(parser.parse(
                json("{\"terms\": {\"eq\": {\"tenor\": 5}}}"))).build())).isFalse();
    }

    @Test
    void shouldNotMatchOrderingAcrossTypes() {
        assertThat(matches("{\"counterparty\": {\"gt\": 5}}")).isFalse();
        assertThat(matches("{\"notional\": {\"lt\": \"9\"}}")).isFalse();
        assertThat(matches("{\"details\": {\"gt\": 1}}")).isFalse();
    }

    @Test
    void shouldOrderTextLexicographically() {
        assertThat(matches("{\"counterparty\": {\"gte\": \"BANK-A\", \"lt\": \"BANK-B\"}}")).isTrue();
    }

    @Test
    void shouldMatchRegexOnTextOnly() {
        assertThat(matches("{\"counterparty\": {\"regex\": \"^BANK\"}}")).isTrue();
        assertThat(matches("{\"counterparty\": {\"regex\": \"-A$\"}}")).isTrue();
        assertThat(matches("{\"notional\": {\"regex\": \"5\"}}")).isFalse();
    }

    @Test
    void shouldTestMembership() {
        assertThat(matches("{\"type\": {\"in\": [\"FX\", \"IR_SWAP\"]}}")).isTrue();
        assertThat(matches("{\"type\": {\"nin\": [\"FX\", \"IR_SWAP\"]}}")).isFalse();
        assertThat(matches("{\"notional\": {\"in\": [5000000.0]}}")).isTrue();
    }

    @Test
    void shouldNotMatchArrayValuedFields() {
        assertThat(matches("{\"legs\": {\"eq\": [{\"ccy\": \"USD\"}]}}")).isFalse();
        assertThat(matches("{\"legs\": {\"ne\": 1}}")).isFalse();
        assertThat(matches("{\"legs.ccy\": {\"eq\": \"USD\"}}")).isFalse();
        assertThat(matches("{\"legs\": {\"exists\": true}}")).isTrue();
    }

    @Test
    void shouldMatchThroughCustomResolver() {
        FieldResolver resolver = path -> path.equals("id") ? json("{\"v\": \"T-1\"}").get("v") : document.path(path);

        assertThat(matcher.matches(resolver, TradeFilter.of(FilterPredicate.eq("id", "T-1")))).isTrue();
        assertThat(matcher.matches(resolver, TradeFilter.of(FilterPredicate.eq("id", "T-2")))).isFalse();
        assertThat(matcher.matches(resolver, TradeFilter.of(FilterPredicate.ne("id", "T-2")))).isTrue();
    }
}
