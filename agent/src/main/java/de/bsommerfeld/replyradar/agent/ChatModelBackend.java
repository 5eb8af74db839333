package de.bsommerfeld.replyradar.agent;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.output.Response;

import java.util.List;

/**
 * {@link ClassifierBackend} over a langchain4j {@link ChatLanguageModel}.
 * When a system prompt is given it is sent ahead of the user prompt.
 */
public class ChatModelBackend implements ClassifierBackend {

    private final String name;
    private final ChatLanguageModel model;
    private final String systemPrompt;

    public ChatModelBackend(String name, ChatLanguageModel model) {
        this(name, model, null);
    }

    public ChatModelBackend(String name, ChatLanguageModel model, String systemPrompt) {
        this.name = name;
        this.model = model;
        this.systemPrompt = systemPrompt;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String complete(String prompt) {
        if (systemPrompt == null) {
            return model.generate(prompt);
        }
        List<ChatMessage> messages = List.of(SystemMessage.from(systemPrompt), UserMessage.from(prompt));
        Response<AiMessage> response = model.generate(messages);
        if (response == null || response.content() == null) {
            return "";
        }
        return response.content().text();
    }
}
