package fr.lapetina.lex.core.domain.routing;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Matches prompts against canned responses that need no downstream call.
 * Templates are tried in registration order; the first match wins.
 */
public final class TemplateMatcher {

    private final List<Template> templates;

    public TemplateMatcher(List<Template> templates) {
        this.templates = List.copyOf(templates);
    }

    public static TemplateMatcher withDefaults() {
        return new TemplateMatcher(defaultTemplates());
    }

    public Optional<Template> match(String prompt) {
        if (prompt == null || prompt.isBlank()) {
            return Optional.empty();
        }
        for (Template template : templates) {
            if (template.pattern().matcher(prompt).find()) {
                return Optional.of(template);
            }
        }
        return Optional.empty();
    }

    public List<Template> getTemplates() {
        return templates;
    }

    public static List<Template> defaultTemplates() {
        List<Template> defaults = new ArrayList<>();
        defaults.add(Template.of("greeting", "\\b(hi|hello|hey|greetings)\\b",
                "Hello! I'm LEX, your AI assistant. How can I help you today?", 0.95));
        defaults.add(Template.of("status", "\\b(status|how are you|are you working)\\b",
                "LEX is fully operational and ready to assist. All systems are running normally.", 0.90));
        defaults.add(Template.of("capabilities", "\\b(what can you do|capabilities|features)\\b",
                "LEX capabilities:\n- Reasoning and analysis\n- Code generation and review\n"
                        + "- Document summarization\n- Conversation with memory", 0.85));
        return defaults;
    }

    /**
     * A canned response and the case-insensitive pattern that triggers it.
     */
    public record Template(String name, Pattern pattern, String response, double confidence) {

        public Template {
            Objects.requireNonNull(name, "Name is required");
            Objects.requireNonNull(pattern, "Pattern is required");
            Objects.requireNonNull(response, "Response is required");
        }

        public static Template of(String name, String regex, String response, double confidence) {
            return new Template(name, Pattern.compile(regex, Pattern.CASE_INSENSITIVE), response, confidence);
        }
    }
}
