package com.clapgrow.channels.whatsapp.autoreply;

import com.clapgrow.channels.whatsapp.entity.BotConfigEntity;
import org.springframework.stereotype.Component;

/**
 * Builds the system prompt for a channel from the fixed reply rules and its bot configuration.
 */
@Component
public class PromptBuilder {

    static final String GLOBAL_RULES = String.join("\n",
        "You are the WhatsApp assistant of a business and answer its customers.",
        "Rules:",
        "- Reply briefly, clearly and usefully.",
        "- Use emoji sparingly.",
        "- When information needed to help is missing, ask one or two key questions.",
        "- Never invent prices, stock, dates or any other data that is not in the context below.",
        "- Reply in the language the customer writes in.");

    public String systemPrompt(BotConfigEntity config) {
        StringBuilder prompt = new StringBuilder(GLOBAL_RULES);
        appendSection(prompt, "Sales strategy", config.getSalesStrategy());
        appendSection(prompt, "Product details", config.getProductDetails());
        return prompt.toString();
    }

    private static void appendSection(StringBuilder prompt, String title, String content) {
        if (content == null || content.isBlank()) {
            return;
        }
        prompt.append("\n\n").append(title).append(":\n").append(content.trim());
    }
}
