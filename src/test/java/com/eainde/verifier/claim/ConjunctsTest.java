package com.eainde.verifier.claim;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ConjunctsTest {

    @Test
    void splitsOnlyAtTopLevel() {
        assertThat(Conjuncts.split("Log[a, b] > 0 && (x > 1 && y > 1)"))
                .containsExactly("Log[a, b] > 0", "x > 1 && y > 1");
    }

    @Test
    void unwrapsParenthesizedConjuncts() {
        assertThat(Conjuncts.split("(x > 0) && ((y < 2))")).containsExactly("x > 0", "y < 2");
    }

    @Test
    void dropsTrue() {
        assertThat(Conjuncts.split("True && x > 0")).containsExactly("x > 0");
        assertThat(Conjuncts.join(List.of())).isEqualTo("True");
    }

    @Test
    void dedupeIgnoresWhitespaceAndKeepsFirstSpelling() {
        assertThat(Conjuncts.dedupe(List.of("x > 0", "y>1", "x>0")))
                .containsExactly("x > 0", "y>1");
    }

    @Test
    void keepsDisjunctionsGroupedOnJoin() {
        List<String> conjuncts = Conjuncts.split("(x<0 || x>1) && y>0");

        assertThat(conjuncts).containsExactly("x<0 || x>1", "y>0");
        assertThat(Conjuncts.join(conjuncts)).isEqualTo("(x<0 || x>1) && y>0");
        assertThat(Conjuncts.split(Conjuncts.join(conjuncts))).isEqualTo(conjuncts);
    }

    @Test
    void neverSplitsAnUngroupedDisjunction() {
        assertThat(Conjuncts.split("x<0 || x>1 && y>0")).containsExactly("x<0 || x>1 && y>0");
        assertThat(Conjuncts.join(List.of("x<0 || x>1 && y>0"))).isEqualTo("(x<0 || x>1 && y>0)");
    }
}
