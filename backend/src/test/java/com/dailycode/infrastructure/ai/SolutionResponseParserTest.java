package com.dailycode.infrastructure.ai;

import com.dailycode.domain.delivery.model.Solution;
import com.dailycode.domain.subscriber.model.Language;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SolutionResponseParserTest {

    private SolutionResponseParser parser;

    @BeforeEach
    void setUp() {
        parser = new SolutionResponseParser();
    }

    @Test
    @DisplayName("splits a well-formed response into its sections")
    void parse_allSections() {
        String content = """
                SOLUTION:
                ```python
                def two_sum(nums, target):
                    seen = {}
                    for i, n in enumerate(nums):
                        if target - n in seen:
                            return [seen[target - n], i]
                        seen[n] = i
                ```

                EXPLANATION:
                Store each value's index and look up the complement.

                TIME COMPLEXITY:
                O(n)

                SPACE COMPLEXITY:
                O(n)

                APPROACH:
                1. Iterate once
                2. Check the complement
                """;

        Solution solution = parser.parse(content, Language.PYTHON);

        assertThat(solution.language()).isEqualTo(Language.PYTHON);
        assertThat(solution.code()).startsWith("def two_sum(nums, target):").endsWith("seen[n] = i");
        assertThat(solution.code()).doesNotContain("```");
        assertThat(solution.explanation()).isEqualTo("Store each value's index and look up the complement.");
        assertThat(solution.timeComplexity()).isEqualTo("O(n)");
        assertThat(solution.spaceComplexity()).isEqualTo("O(n)");
        assertThat(solution.approach()).contains("Iterate once", "Check the complement");
    }

    @Test
    @DisplayName("headers are matched case-insensitively and keep text on the same line")
    void parse_inlineHeaders() {
        String content = """
                Solution:
                ```java
                class Solution {}
                ```
                Time complexity: O(n log n)
                Space Complexity: O(1)
                """;

        Solution solution = parser.parse(content, Language.JAVA);

        assertThat(solution.code()).isEqualTo("class Solution {}");
        assertThat(solution.timeComplexity()).isEqualTo("O(n log n)");
        assertThat(solution.spaceComplexity()).isEqualTo("O(1)");
    }

    @Test
    @DisplayName("without section headers the first fence is the code and the whole text the explanation")
    void parse_unstructuredResponse() {
        String content = """
                Here is my answer:
                ```
                fn main() {}
                ```
                It runs in linear time.""";

        Solution solution = parser.parse(content, Language.RUST);

        assertThat(solution.code()).isEqualTo("fn main() {}");
        assertThat(solution.explanation()).isEqualTo(content.strip());
        assertThat(solution.timeComplexity()).isEmpty();
    }

    @Test
    @DisplayName("a response without any fence has no code")
    void parse_noCode() {
        Solution solution = parser.parse("I cannot solve this problem.", Language.GO);

        assertThat(solution.hasCode()).isFalse();
    }

    @Test
    @DisplayName("prefers the fence tagged with the requested language")
    void extractCode_prefersTaggedFence() {
        String content = """
                ```text
                sample input
                ```
                ```cpp
                int main() { return 0; }
                ```
                """;

        assertThat(parser.extractCode(content, Language.CPP)).isEqualTo("int main() { return 0; }");
        assertThat(parser.extractCode(content, Language.JAVA)).isEqualTo("sample input");
    }
}
