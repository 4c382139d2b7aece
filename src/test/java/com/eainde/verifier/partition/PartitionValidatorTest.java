package com.eainde.verifier.partition;

import com.eainde.verifier.claim.ClaimCatalog;
import com.eainde.verifier.claim.InequalityClaim;
import com.eainde.verifier.claim.SeriesBoundClaim;
import com.eainde.verifier.partition.MalformedPartitionException.Reason;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PartitionValidatorTest {

    private final PartitionValidator validator = new PartitionValidator();

    private final SeriesBoundClaim series = SeriesBoundClaim.builder("s")
            .formula("(2*d+1)/(h^2+d^2)")
            .index("d")
            .variables("h")
            .bounds("0", "Infinity")
            .conditions("h > 1")
            .bound("1+Log[h]")
            .build();

    private final InequalityClaim inequality =
            InequalityClaim.of("i", "{x,y}", "{x>0, y>1}", "x*y", "y*Log[y]+Exp[x]");

    @Nested
    @DisplayName("Series breakpoints")
    class SeriesBreakpoints {

        @Test
        @DisplayName("should insert missing summation bounds at both ends")
        void insertsBounds() {
            SeriesPartition partition = (SeriesPartition) validator.validate(series, "[h]");

            assertThat(partition.breakpoints()).containsExactly("0", "h", "Infinity");
            assertThat(partition.lower()).isEqualTo("0");
            assertThat(partition.upper()).isEqualTo("Infinity");
            assertThat(partition.pieceCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("should keep bounds the proposal already carries, whatever the infinity spelling")
        void keepsBounds() {
            SeriesPartition partition = (SeriesPartition) validator.validate(series, "[0, h^2, oo]");

            assertThat(partition.breakpoints()).containsExactly("0", "h^2", "Infinity");
        }

        @Test
        @DisplayName("should turn an empty list into the whole range")
        void emptyListIsWholeRange() {
            SeriesPartition partition = (SeriesPartition) validator.validate(series, "[]");

            assertThat(partition.breakpoints()).containsExactly("0", "Infinity");
            assertThat(partition.subranges()).singleElement()
                    .isEqualTo(new Subrange(1, "0", "Infinity"));
        }

        @Test
        @DisplayName("should reject breakpoints mentioning the summation index")
        void rejectsIndex() {
            assertThatThrownBy(() -> validator.validate(series, "[0, d/2, Infinity]"))
                    .isInstanceOf(MalformedPartitionException.class)
                    .extracting(e -> ((MalformedPartitionException) e).getReason())
                    .isEqualTo(Reason.REFERENCES_INDEX);
        }

        @Test
        @DisplayName("should reject breakpoints mentioning undeclared symbols")
        void rejectsUnknownSymbol() {
            assertThatThrownBy(() -> validator.validate(series, "[0, k, Infinity]"))
                    .isInstanceOf(MalformedPartitionException.class)
                    .extracting(e -> ((MalformedPartitionException) e).getReason())
                    .isEqualTo(Reason.UNKNOWN_SYMBOL);
        }

        @Test
        @DisplayName("should start at -Infinity for doubly infinite sums")
        void doublyInfinite() {
            SeriesBoundClaim claim = ClaimCatalog.defaults().find("series_2")
                    .map(SeriesBoundClaim.class::cast)
                    .orElseThrow();

            SeriesPartition partition = (SeriesPartition) validator.validate(claim, "[0]");

            assertThat(partition.breakpoints()).containsExactly("-Infinity", "0", "Infinity");
        }
    }

    @Nested
    @DisplayName("Inequality subdomains")
    class InequalitySubdomains {

        @Test
        @DisplayName("should prepend the base domain and drop echoed base conjuncts")
        void prependsBase() {
            DomainPartition partition = (DomainPartition) validator.validate(inequality,
                    "[x>0 && y>1 && x<=1, x > 1 && y>1]");

            assertThat(partition.pieces()).extracting(Subdomain::conjuncts).containsExactly(
                    List.of("x>0", "y>1", "x<=1"),
                    List.of("x>0", "y>1", "x > 1"));
            assertThat(partition.basePredicate()).isEqualTo("x>0 && y>1");
        }

        @Test
        @DisplayName("should deduplicate repeated conjuncts in first-seen order")
        void dedupes() {
            DomainPartition partition = (DomainPartition) validator.validate(inequality,
                    "[x<1 && x < 1 && y<2]");

            assertThat(partition.pieces().get(0).conjuncts())
                    .containsExactly("x>0", "y>1", "x<1", "y<2");
        }

        @Test
        @DisplayName("should keep a disjunctive subdomain grouped under the base domain")
        void groupsDisjunction() {
            InequalityClaim claim = InequalityClaim.of("split_line", "x", "x>0", "x", "x");

            DomainPartition partition = (DomainPartition) validator.validate(claim, "[(x<1 || x>5), x>=1 && x<=5]");

            assertThat(partition.pieces().get(0).conjuncts()).containsExactly("x>0", "x<1 || x>5");
            assertThat(partition.pieces().get(0).predicate()).isEqualTo("x>0 && (x<1 || x>5)");
            assertThat(partition.pieces().get(1).predicate()).isEqualTo("x>0 && x>=1 && x<=5");
            assertThat(validator.validate(claim, partition.toProposalText())).isEqualTo(partition);
        }

        @Test
        @DisplayName("should reject an empty subdomain list")
        void rejectsEmpty() {
            assertThatThrownBy(() -> validator.validate(inequality, "[]"))
                    .isInstanceOf(MalformedPartitionException.class)
                    .extracting(e -> ((MalformedPartitionException) e).getReason())
                    .isEqualTo(Reason.EMPTY_PARTITION);
        }

        @Test
        @DisplayName("should reject subdomains over foreign variables")
        void rejectsForeignVariable() {
            assertThatThrownBy(() -> validator.validate(inequality, "[z > 1]"))
                    .isInstanceOf(MalformedPartitionException.class)
                    .extracting(e -> ((MalformedPartitionException) e).getReason())
                    .isEqualTo(Reason.UNKNOWN_SYMBOL);
        }
    }

    @Test
    @DisplayName("should be idempotent on its own output")
    void idempotent() {
        Partition first = validator.validate(series, "[h, h^2]");
        assertThat(validator.validate(series, first.toProposalText())).isEqualTo(first);

        Partition domains = validator.validate(inequality, "[x<=1, x>1 && y<=2, x>1 && y>2]");
        assertThat(validator.validate(inequality, domains.toProposalText())).isEqualTo(domains);
    }
}
