package com.dailycode.infrastructure.email;

import com.dailycode.config.DailyCodeProperties;
import com.dailycode.domain.delivery.model.Commentary;
import com.dailycode.domain.delivery.model.OutboundMessage;
import com.dailycode.domain.delivery.model.ProblemExample;
import com.dailycode.domain.delivery.model.ProblemPayload;
import com.dailycode.domain.delivery.model.Solution;
import com.dailycode.domain.problem.model.Difficulty;
import com.dailycode.domain.subscriber.model.DifficultyPreference;
import com.dailycode.domain.subscriber.model.Subscriber;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds the plain-text and HTML bodies of every message the service sends.
 */
@Component
public class MessageComposer {

    private static final int MAX_HINTS = 2;
    private static final int MAX_TEST_CASES = 3;

    private final Clock clock;
    private final ZoneId zone;
    private final String subjectPrefix;

    public MessageComposer(Clock clock, DailyCodeProperties properties) {
        this.clock = clock;
        this.zone = properties.schedule().zoneId();
        this.subjectPrefix = properties.mail().subjectPrefix();
    }

    public OutboundMessage composeDaily(Subscriber subscriber, ProblemPayload problem, Solution solution,
                                        Commentary commentary) {
        LocalDate today = LocalDate.now(clock.withZone(zone));
        String subject = String.format("%s Daily Coding Challenge - %s (%s)",
                emoji(problem.difficulty()), problem.title(), today);
        return new OutboundMessage(
                subscriber.getId(),
                subject,
                dailyText(subscriber, problem, solution, commentary, today),
                dailyHtml(subscriber, problem, solution, commentary));
    }

    public OutboundMessage composeWelcome(Subscriber subscriber) {
        String text = String.format("""
                Hello %s,

                Welcome to Daily Code! Starting tomorrow you will receive one coding problem a day,
                solved in %s, picked from %s problems.

                You will never get the same problem twice.

                Happy coding!""",
                subscriber.displayName(),
                subscriber.getLanguage().displayName(),
                subscriber.getDifficulty() == DifficultyPreference.ANY
                        ? "all"
                        : subscriber.getDifficulty().name().toLowerCase(Locale.ROOT));
        return new OutboundMessage(subscriber.getId(), subjectPrefix + " Welcome aboard!", text, toHtml(text));
    }

    public OutboundMessage composeUnsubscribed(Subscriber subscriber) {
        String text = String.format("""
                Hello %s,

                You have been unsubscribed from Daily Code and will not receive further problems.
                Subscribe again at any time to pick up where you left off.""",
                subscriber.displayName());
        return new OutboundMessage(subscriber.getId(), subjectPrefix + " You have been unsubscribed", text, toHtml(text));
    }

    private String dailyText(Subscriber subscriber, ProblemPayload problem, Solution solution,
                             Commentary commentary, LocalDate today) {
        StringBuilder sb = new StringBuilder();
        sb.append("DAILY CODING CHALLENGE - ").append(today).append("\n\n");
        sb.append("Hello ").append(subscriber.displayName()).append("! Ready to code?\n\n");
        sb.append("PROBLEM: ").append(problem.title()).append('\n');
        sb.append("DIFFICULTY: ").append(problem.difficulty().label()).append('\n');
        if (!problem.tags().isEmpty()) {
            sb.append("TAGS: ").append(String.join(", ", problem.tags())).append('\n');
        }
        sb.append('\n').append(problem.description()).append('\n');

        List<ProblemExample> examples = problem.examples();
        if (!examples.isEmpty()) {
            sb.append("\nEXAMPLES:\n");
            for (int i = 0; i < examples.size(); i++) {
                ProblemExample example = examples.get(i);
                sb.append("\nExample ").append(i + 1).append(":\n");
                sb.append("Input: ").append(orNa(example.input())).append('\n');
                sb.append("Output: ").append(orNa(example.output())).append('\n');
                if (example.explanation() != null && !example.explanation().isBlank()) {
                    sb.append("Explanation: ").append(example.explanation()).append('\n');
                }
            }
        }
        if (!problem.constraints().isBlank()) {
            sb.append("\nCONSTRAINTS:\n").append(problem.constraints()).append('\n');
        }
        List<String> hints = firstHints(problem);
        if (!hints.isEmpty()) {
            sb.append("\nHINTS:\n");
            hints.forEach(h -> sb.append("- ").append(h).append('\n'));
        }

        sb.append("\nSOLUTION (").append(solution.language().displayName()).append("):\n\n");
        if (commentary != null && hasText(commentary.intro())) {
            sb.append(commentary.intro()).append("\n\n");
        }
        sb.append(solution.code()).append("\n\n");
        if (commentary != null && commentary.quips() != null) {
            commentary.quips().forEach(q -> sb.append(solution.language().commentPrefix()).append(' ').append(q).append('\n'));
        }
        if (hasText(solution.explanation())) {
            sb.append("\nEXPLANATION:\n").append(solution.explanation()).append('\n');
        }
        sb.append("\nTime complexity: ").append(orNa(solution.timeComplexity())).append('\n');
        sb.append("Space complexity: ").append(orNa(solution.spaceComplexity())).append('\n');
        if (commentary != null && hasText(commentary.outro())) {
            sb.append('\n').append(commentary.outro()).append('\n');
        }
        sb.append("\nKeep coding, keep growing! Tomorrow brings a new challenge.\n");
        return sb.toString();
    }

    private String dailyHtml(Subscriber subscriber, ProblemPayload problem, Solution solution, Commentary commentary) {
        StringBuilder sb = new StringBuilder();
        sb.append("""
                <!DOCTYPE html>
                <html>
                <head><meta charset="UTF-8"><title>Daily Coding Challenge</title></head>
                <body style="font-family: sans-serif; line-height: 1.6; color: #333; max-width: 800px; margin: 0 auto;">
                """);
        sb.append("<h1>Daily Coding Challenge</h1>\n");
        sb.append("<p>Hello ").append(escape(subscriber.displayName())).append("! Ready to code?</p>\n");
        sb.append("<h2>").append(escape(problem.title()))
                .append(" <span style=\"color: ").append(badgeColor(problem.difficulty())).append(";\">")
                .append(problem.difficulty().label()).append("</span></h2>\n");
        sb.append("<div>").append(toHtmlLines(problem.description())).append("</div>\n");

        if (!problem.examples().isEmpty()) {
            sb.append("<h3>Examples</h3>\n");
            int n = 1;
            for (ProblemExample example : problem.examples()) {
                sb.append("<div style=\"background-color: #f8f9fa; padding: 10px; margin: 10px 0;\">")
                        .append("<strong>Example ").append(n++).append(":</strong><br>")
                        .append("<strong>Input:</strong> ").append(escape(orNa(example.input()))).append("<br>")
                        .append("<strong>Output:</strong> ").append(escape(orNa(example.output()))).append("<br>");
                if (hasText(example.explanation())) {
                    sb.append("<strong>Explanation:</strong> ").append(escape(example.explanation())).append("<br>");
                }
                sb.append("</div>\n");
            }
        }
        if (!problem.constraints().isBlank()) {
            sb.append("<h3>Constraints</h3>\n<div>").append(toHtmlLines(problem.constraints())).append("</div>\n");
        }
        List<Map<String, Object>> testCases = problem.testCases();
        if (!testCases.isEmpty()) {
            sb.append("<h3>Test Cases</h3>\n");
            for (int i = 0; i < Math.min(MAX_TEST_CASES, testCases.size()); i++) {
                Map<String, Object> testCase = testCases.get(i);
                sb.append("<div style=\"font-family: monospace;\"><strong>Test ").append(i + 1).append(":</strong> Input: ")
                        .append(escape(String.valueOf(testCase.getOrDefault("input", "N/A"))))
                        .append(" &rarr; Output: ")
                        .append(escape(String.valueOf(testCase.getOrDefault("output", "N/A"))))
                        .append("</div>\n");
            }
        }
        List<String> hints = firstHints(problem);
        if (!hints.isEmpty()) {
            sb.append("<h3>Hints</h3>\n<ul>\n");
            hints.forEach(h -> sb.append("<li>").append(escape(h)).append("</li>\n"));
            sb.append("</ul>\n");
        }

        sb.append("<h2>Solution in ").append(solution.language().displayName()).append("</h2>\n");
        if (commentary != null && hasText(commentary.intro())) {
            sb.append("<p><em>").append(escape(commentary.intro())).append("</em></p>\n");
        }
        sb.append("<pre style=\"background-color: #2d3748; color: #e2e8f0; padding: 20px;\">")
                .append(escape(solution.code())).append("</pre>\n");
        if (commentary != null && commentary.quips() != null && !commentary.quips().isEmpty()) {
            sb.append("<ul>\n");
            commentary.quips().forEach(q -> sb.append("<li>").append(escape(q)).append("</li>\n"));
            sb.append("</ul>\n");
        }
        if (hasText(solution.explanation())) {
            sb.append("<h3>Explanation</h3>\n<div>").append(toHtmlLines(solution.explanation())).append("</div>\n");
        }
        sb.append("<p><strong>Time Complexity:</strong> ").append(escape(orNa(solution.timeComplexity()))).append("<br>")
                .append("<strong>Space Complexity:</strong> ").append(escape(orNa(solution.spaceComplexity())))
                .append("</p>\n");
        if (commentary != null && hasText(commentary.outro())) {
            sb.append("<p><em>").append(escape(commentary.outro())).append("</em></p>\n");
        }
        sb.append("<p style=\"color: #6c757d; font-size: 12px;\">Keep coding, keep growing! ")
                .append("Language: ").append(solution.language().displayName())
                .append(" | Difficulty: ").append(problem.difficulty().label()).append("</p>\n");
        sb.append("</body>\n</html>\n");
        return sb.toString();
    }

    private static List<String> firstHints(ProblemPayload problem) {
        return problem.hints().stream().limit(MAX_HINTS).toList();
    }

    private static String emoji(Difficulty difficulty) {
        return switch (difficulty) {
            case EASY -> "🟢";
            case MEDIUM -> "🟡";
            case HARD -> "🔴";
        };
    }

    private static String badgeColor(Difficulty difficulty) {
        return switch (difficulty) {
            case EASY -> "#28a745";
            case MEDIUM -> "#ffc107";
            case HARD -> "#dc3545";
        };
    }

    private static String toHtml(String text) {
        return "<html><body><p>" + toHtmlLines(text) + "</p></body></html>";
    }

    private static String toHtmlLines(String text) {
        return escape(text).replace("\n", "<br>");
    }

    private static String escape(String text) {
        return text == null ? "" : HtmlUtils.htmlEscape(text);
    }

    private static String orNa(String value) {
        return hasText(value) ? value : "N/A";
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
