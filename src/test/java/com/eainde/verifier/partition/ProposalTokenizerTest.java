package com.eainde.verifier.partition;

import com.eainde.verifier.partition.MalformedPartitionException.Reason;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProposalTokenizerTest {

    @Nested
    @DisplayName("Accepted proposals")
    class Accepted {

        @Test
        @DisplayName("should split a plain list at top-level commas only")
        void plainList() {
            assertThat(ProposalTokenizer.tokenize("[0, Sqrt[h*m], Log[h, m], Infinity]"))
                    .containsExactly("0", "Sqrt[h*m]", "Log[h, m]", "Infinity");
        }

        @Test
        @DisplayName("should accept braces as the outer delimiters")
        void bracedList() {
            assertThat(ProposalTokenizer.tokenize("{x>0 && x<1, x>=1}"))
                    .containsExactly("x>0 && x<1", "x>=1");
        }

        @Test
        @DisplayName("should skip prose and markdown code fences")
        void proseAndFences() {
            String answer = "```mathematica\n[1, h (the scale), Infinity]\n```";
            assertThat(ProposalTokenizer.tokenize(answer)).containsExactly("1", "h (the scale)", "Infinity");

            String chatty = "Sure (happy to help): [0, h, Infinity]. Hope this helps!";
            assertThat(ProposalTokenizer.tokenize(chatty)).containsExactly("0", "h", "Infinity");
        }

        @Test
        @DisplayName("should unwrap a doubly bracketed list and strip quotes")
        void doubleBracketsAndQuotes() {
            assertThat(ProposalTokenizer.tokenize("[[\"0\", \"h\", \"Infinity\"]]"))
                    .containsExactly("0", "h", "Infinity");
        }

        @Test
        @DisplayName("should keep a single braced subdomain as one element")
        void singleBracedElement() {
            assertThat(ProposalTokenizer.tokenize("[{x>1, y>1}]")).containsExactly("{x>1, y>1}");
        }

        @Test
        @DisplayName("should return no elements for an empty list")
        void emptyList() {
            assertThat(ProposalTokenizer.tokenize("[]")).isEmpty();
            assertThat(ProposalTokenizer.tokenize("{ }")).isEmpty();
        }
    }

    @Nested
    @DisplayName("Rejected proposals")
    class Rejected {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource(delimiter = '|', value = {
                "'   '                         | EMPTY_PROPOSAL",
                "I cannot decompose this       | NO_LIST_LITERAL",
                "[0, Sqrt[h, Infinity]         | UNBALANCED_DELIMITERS",
                "[0, h), Infinity]             | UNBALANCED_DELIMITERS",
                "done) [0, 1]                  | UNBALANCED_DELIMITERS",
                "[0, , Infinity]               | EMPTY_ELEMENT",
                "[0, Infinity,]                | EMPTY_ELEMENT",
                "[0, 1] or maybe [0, 2]        | TRAILING_CONTENT"
        })
        void reasons(String proposal, Reason expected) {
            assertThatThrownBy(() -> ProposalTokenizer.tokenize(proposal))
                    .isInstanceOf(MalformedPartitionException.class)
                    .extracting(e -> ((MalformedPartitionException) e).getReason())
                    .isEqualTo(expected);
        }

        @Test
        @DisplayName("should report null as an empty proposal")
        void nullProposal() {
            assertThatThrownBy(() -> ProposalTokenizer.tokenize(null))
                    .isInstanceOf(MalformedPartitionException.class)
                    .extracting(e -> ((MalformedPartitionException) e).getReason())
                    .isEqualTo(Reason.EMPTY_PROPOSAL);
        }
    }
}
