package com.dailycode.infrastructure.persistence;

import com.dailycode.domain.problem.model.Difficulty;
import com.dailycode.domain.problem.model.Problem;
import com.dailycode.domain.problem.repository.ProblemRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.util.List;

import static com.dailycode.support.Fixtures.problem;
import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@Import(JpaProblemCatalog.class)
class JpaProblemCatalogTest {

    @Autowired
    private ProblemRepository problemRepository;

    @Autowired
    private JpaProblemCatalog catalog;

    @BeforeEach
    void seed() {
        problemRepository.saveAll(List.of(
                problem("valid-parentheses", Difficulty.EASY),
                problem("merge-intervals", Difficulty.MEDIUM),
                problem("two-sum", Difficulty.EASY)));
    }

    @Test
    @DisplayName("the catalog is listed by identity")
    void findAll() {
        assertThat(catalog.findAll())
                .extracting(Problem::getId)
                .containsExactly("merge-intervals", "two-sum", "valid-parentheses");
    }

    @Test
    @DisplayName("problems are looked up by identity")
    void findById() {
        assertThat(catalog.findById("two-sum"))
                .get()
                .satisfies(p -> {
                    assertThat(p.getTitle()).isEqualTo("Two Sum");
                    assertThat(p.getTags()).containsExactly("array");
                });
        assertThat(catalog.findById("unknown")).isEmpty();
    }

    @Test
    @DisplayName("every difficulty is counted, including empty ones")
    void countByDifficulty() {
        assertThat(catalog.countByDifficulty())
                .containsEntry(Difficulty.EASY, 2L)
                .containsEntry(Difficulty.MEDIUM, 1L)
                .containsEntry(Difficulty.HARD, 0L);
    }
}
