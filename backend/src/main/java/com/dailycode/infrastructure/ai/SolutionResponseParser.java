package com.dailycode.infrastructure.ai;

import com.dailycode.domain.delivery.model.Solution;
import com.dailycode.domain.subscriber.model.Language;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a sectioned solve response into a {@link Solution}.
 * <p>
 * Sections start at a line beginning with their header (case-insensitive). Code is taken from the first
 * fenced block of the SOLUTION section, falling back to the first fenced block anywhere. When no
 * EXPLANATION section is found the whole response becomes the explanation.
 */
@Component
public class SolutionResponseParser {

    private static final Pattern ANY_FENCE = Pattern.compile("```[^\\n]*\\n(.*?)\\n\\s*```", Pattern.DOTALL);

    enum Section {
        SOLUTION("solution:"),
        EXPLANATION("explanation:"),
        TIME_COMPLEXITY("time complexity:"),
        SPACE_COMPLEXITY("space complexity:"),
        APPROACH("approach:");

        private final String header;

        Section(String header) {
            this.header = header;
        }

        static Section match(String line) {
            String normalized = line.strip().toLowerCase(Locale.ROOT);
            for (Section section : values()) {
                if (normalized.startsWith(section.header)) {
                    return section;
                }
            }
            return null;
        }
    }

    public Solution parse(String content, Language language) {
        Map<Section, StringBuilder> sections = new EnumMap<>(Section.class);
        Section current = null;
        for (String line : content.split("\n", -1)) {
            Section header = Section.match(line);
            if (header != null) {
                current = header;
                StringBuilder sb = new StringBuilder();
                // Text on the header line itself belongs to the section.
                String rest = line.strip().substring(header.header.length()).strip();
                if (!rest.isEmpty()) {
                    sb.append(rest).append('\n');
                }
                sections.put(current, sb);
            } else if (current != null) {
                sections.get(current).append(line).append('\n');
            }
        }

        String code = extractCode(text(sections, Section.SOLUTION), language);
        if (code.isEmpty()) {
            code = extractCode(content, language);
        }
        String explanation = text(sections, Section.EXPLANATION);
        if (explanation.isEmpty()) {
            explanation = content.strip();
        }

        return new Solution(
                language,
                code,
                explanation,
                text(sections, Section.TIME_COMPLEXITY),
                text(sections, Section.SPACE_COMPLEXITY),
                text(sections, Section.APPROACH));
    }

    /**
     * Body of the first fence tagged with the language, else of the first fence of any kind.
     */
    String extractCode(String content, Language language) {
        Pattern tagged = Pattern.compile("```" + Pattern.quote(language.code()) + "\\s*\\n(.*?)\\n\\s*```",
                Pattern.DOTALL | Pattern.CASE_INSENSITIVE);
        Matcher matcher = tagged.matcher(content);
        if (matcher.find()) {
            return matcher.group(1).strip();
        }
        matcher = ANY_FENCE.matcher(content);
        if (matcher.find()) {
            return matcher.group(1).strip();
        }
        return "";
    }

    private static String text(Map<Section, StringBuilder> sections, Section section) {
        StringBuilder sb = sections.get(section);
        return sb == null ? "" : sb.toString().strip();
    }
}
