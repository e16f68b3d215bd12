package com.dailycode.application.delivery;

import com.dailycode.application.delivery.exception.NoContentAvailableException;
import com.dailycode.domain.problem.model.Difficulty;
import com.dailycode.domain.problem.model.Problem;
import com.dailycode.domain.subscriber.model.DifficultyPreference;
import com.dailycode.domain.subscriber.model.Subscriber;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import static com.dailycode.support.Fixtures.problem;
import static com.dailycode.support.Fixtures.subscriber;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProblemSelectorTest {

    private static final LocalDate DATE = LocalDate.of(2024, 3, 1);

    private final List<Problem> catalog = List.of(
            problem("valid-parentheses", Difficulty.EASY),
            problem("two-sum", Difficulty.EASY),
            problem("merge-intervals", Difficulty.MEDIUM),
            problem("median-of-two-sorted-arrays", Difficulty.HARD));

    @Nested
    @DisplayName("LOWEST_ID")
    class LowestId {

        private final ProblemSelector selector = new ProblemSelector(SelectionPolicy.LOWEST_ID);

        @Test
        @DisplayName("picks the smallest matching identity")
        void picksSmallestMatchingIdentity() {
            Subscriber alice = subscriber("alice@example.com", DifficultyPreference.EASY);

            Problem selected = selector.select(alice, catalog, Set.of(), DATE);

            assertThat(selected.getId()).isEqualTo("two-sum");
        }

        @Test
        @DisplayName("never picks a problem already delivered")
        void skipsDeliveredProblems() {
            Subscriber alice = subscriber("alice@example.com", DifficultyPreference.EASY);

            Problem selected = selector.select(alice, catalog, Set.of("two-sum"), DATE);

            assertThat(selected.getId()).isEqualTo("valid-parentheses");
        }

        @Test
        @DisplayName("ANY preference considers every difficulty")
        void anyPreferenceMatchesEveryDifficulty() {
            Subscriber bob = subscriber("bob@example.com", DifficultyPreference.ANY);

            Problem selected = selector.select(bob, catalog, Set.of(), DATE);

            assertThat(selected.getId()).isEqualTo("median-of-two-sorted-arrays");
        }

        @Test
        @DisplayName("filters by the subscriber's difficulty")
        void filtersByDifficulty() {
            Subscriber carol = subscriber("carol@example.com", DifficultyPreference.HARD);

            Problem selected = selector.select(carol, catalog, Set.of(), DATE);

            assertThat(selected.getDifficulty()).isEqualTo(Difficulty.HARD);
        }

        @Test
        @DisplayName("throws NoContentAvailableException when every match was delivered")
        void exhaustedPreference() {
            Subscriber alice = subscriber("alice@example.com", DifficultyPreference.EASY);

            assertThatThrownBy(() -> selector.select(alice, catalog, Set.of("two-sum", "valid-parentheses"), DATE))
                    .isInstanceOf(NoContentAvailableException.class)
                    .hasMessageContaining("alice@example.com");
        }

        @Test
        @DisplayName("throws NoContentAvailableException for an empty catalog")
        void emptyCatalog() {
            Subscriber alice = subscriber("alice@example.com", DifficultyPreference.ANY);

            assertThatThrownBy(() -> selector.select(alice, List.of(), Set.of(), DATE))
                    .isInstanceOf(NoContentAvailableException.class);
        }
    }

    @Nested
    @DisplayName("RANDOM")
    class RandomPolicy {

        private final ProblemSelector selector = new ProblemSelector(SelectionPolicy.RANDOM);

        @Test
        @DisplayName("is deterministic for the same subscriber, snapshot and date")
        void deterministic() {
            Subscriber bob = subscriber("bob@example.com", DifficultyPreference.ANY);

            Problem first = selector.select(bob, catalog, Set.of(), DATE);
            List<Problem> reordered = new ArrayList<>(catalog);
            Collections.reverse(reordered);
            Problem second = selector.select(bob, reordered, Set.of(), DATE);

            assertThat(second.getId()).isEqualTo(first.getId());
        }

        @Test
        @DisplayName("still respects the no-repeat rule")
        void respectsDeliveredSet() {
            Subscriber alice = subscriber("alice@example.com", DifficultyPreference.EASY);

            for (int day = 0; day < 30; day++) {
                Problem selected = selector.select(alice, catalog, Set.of("two-sum"), DATE.plusDays(day));
                assertThat(selected.getId()).isEqualTo("valid-parentheses");
            }
        }

        @Test
        @DisplayName("seed depends on both subscriber and date")
        void seedVaries() {
            assertThat(ProblemSelector.seed("alice@example.com", DATE))
                    .isEqualTo(ProblemSelector.seed("alice@example.com", DATE))
                    .isNotEqualTo(ProblemSelector.seed("alice@example.com", DATE.plusDays(1)))
                    .isNotEqualTo(ProblemSelector.seed("bob@example.com", DATE));
        }
    }
}
