package com.example.tradestore.validation;

import com.example.tradestore.exception.InvalidContextException;
import com.example.tradestore.model.Context;
import com.example.tradestore.model.ValidationResult;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContextGuardTest {

    private final ContextGuard guard = new ContextGuard();

    @Test
    void shouldAcceptCompleteContext() {
        assertThat(guard.check(new Context("jdoe", "trade-ui", "SAVE", "book")).success()).isTrue();
    }

    @Test
    void shouldReportEachBlankField() {
        ValidationResult result = guard.check(new Context("jdoe", "  ", null, ""));

        assertThat(result.success()).isFalse();
        assertThat(result.errors()).containsExactly(
                "Context field 'agent' is required",
                "Context field 'action' is required",
                "Context field 'intent' is required");
    }

    @Test
    void shouldRejectMissingContext() {
        assertThat(guard.check(null).errors()).hasSize(4);
        assertThatThrownBy(() -> guard.require(null)).isInstanceOf(InvalidContextException.class);
    }

    @Test
    void shouldReturnTrimmedContext() {
        Context context = guard.require(new Context(" jdoe ", "trade-ui", " SAVE", "book "));

        assertThat(context).isEqualTo(new Context("jdoe", "trade-ui", "SAVE", "book"));
    }

    @Test
    void shouldCarryErrorsInException() {
        assertThatThrownBy(() -> guard.require(new Context("", "a", "b", "c")))
                .isInstanceOfSatisfying(InvalidContextException.class, e -> assertThat(e.getResult().errors())
                        .containsExactly("Context field 'user' is required"));
    }
}
