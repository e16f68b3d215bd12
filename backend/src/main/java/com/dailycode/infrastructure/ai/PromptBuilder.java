package com.dailycode.infrastructure.ai;

import com.dailycode.domain.delivery.model.ProblemExample;
import com.dailycode.domain.delivery.model.ProblemPayload;
import com.dailycode.domain.delivery.model.Solution;
import com.dailycode.domain.subscriber.model.Language;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

@Component
public class PromptBuilder {

    static final String SOLVE_SYSTEM_PROMPT = """
            You are an expert software engineer and competitive programmer. \
            Provide clear, efficient and well-commented solutions to coding problems.""";

    static final String COMMENTARY_SYSTEM_PROMPT = """
            You are a witty senior engineer who writes short, friendly, programming-themed jokes.
            Keep every line family-friendly and under 120 characters.
            Respond with a JSON object only:
            {"intro": "<one sentence>", "quips": ["<joke>", "<joke>", "<joke>"], "outro": "<one sentence>"}""";

    private static final Map<Language, String> SIGNATURE_EXAMPLES = Map.of(
            Language.PYTHON, "def two_sum(nums, target):",
            Language.JAVA, "public int[] twoSum(int[] nums, int target)",
            Language.CPP, "vector<int> twoSum(vector<int>& nums, int target)",
            Language.JAVASCRIPT, "function twoSum(nums, target)",
            Language.GO, "func twoSum(nums []int, target int) []int",
            Language.RUST, "fn two_sum(nums: Vec<i32>, target: i32) -> Vec<i32>"
    );

    public String getSolveSystemPrompt() {
        return SOLVE_SYSTEM_PROMPT;
    }

    public String getCommentarySystemPrompt() {
        return COMMENTARY_SYSTEM_PROMPT;
    }

    public String buildSolveUserMessage(ProblemPayload problem, Language language) {
        String languageName = language.code().toUpperCase(Locale.ROOT);
        return """
                Please solve the following coding problem in %s.

                PROBLEM TITLE: %s

                PROBLEM DESCRIPTION:
                %s

                CONSTRAINTS:
                %s

                EXAMPLES:
                %s

                REQUIREMENTS:
                1. Provide a complete, working solution in %s
                2. Include comments explaining the approach
                3. Analyze time and space complexity
                4. Make sure the solution handles the edge cases in the constraints
                5. Use idiomatic signatures, for example: %s

                Structure your response exactly as follows:

                SOLUTION:
                ```%s
                [complete solution code]
                ```

                EXPLANATION:
                [explanation of the algorithm]

                TIME COMPLEXITY:
                [Big O time complexity]

                SPACE COMPLEXITY:
                [Big O space complexity]

                APPROACH:
                [step-by-step breakdown]
                """.formatted(
                languageName,
                problem.title(),
                problem.description(),
                problem.constraints().isBlank() ? "None given" : problem.constraints(),
                formatExamples(problem),
                languageName,
                SIGNATURE_EXAMPLES.get(language),
                language.code());
    }

    public String buildCommentaryUserMessage(ProblemPayload problem, Solution solution) {
        return """
                Problem: %s (%s)
                Tags: %s
                Language: %s
                Approach: %s

                Write an intro line, three quips about this solution and an outro line.""".formatted(
                problem.title(),
                problem.difficulty().label(),
                problem.tags().isEmpty() ? "none" : String.join(", ", problem.tags()),
                solution.language().displayName(),
                solution.approach() == null || solution.approach().isBlank()
                        ? solution.explanation()
                        : solution.approach());
    }

    private static String formatExamples(ProblemPayload problem) {
        if (problem.examples().isEmpty()) {
            return "None given";
        }
        StringBuilder sb = new StringBuilder();
        int n = 1;
        for (ProblemExample example : problem.examples()) {
            sb.append("Example ").append(n++).append(": Input: ").append(example.input())
                    .append(" -> Output: ").append(example.output());
            if (example.explanation() != null && !example.explanation().isBlank()) {
                sb.append(" (").append(example.explanation()).append(')');
            }
            sb.append('\n');
        }
        return sb.toString().trim();
    }
}
