package email.labeler.app.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.theokanning.openai.completion.chat.ChatCompletionRequest;
import com.theokanning.openai.completion.chat.ChatMessage;
import com.theokanning.openai.service.OpenAiService;
import email.labeler.app.model.CategoryConfigStore;

import java.util.List;

public class OpenAiMlClassifier extends LlmMlClassifier {
    private final OpenAiService openAiService;
    private final String model;

    public OpenAiMlClassifier(OpenAiService openAiService, String model,
                              CategoryConfigStore configStore, ObjectMapper objectMapper) {
        super(configStore, objectMapper);
        this.openAiService = openAiService;
        this.model = model;
    }

    @Override
    protected String complete(String prompt) {
        ChatMessage message = new ChatMessage("user", prompt);
        ChatCompletionRequest request = ChatCompletionRequest.builder()
            .model(model)
            .messages(List.of(message))
            .maxTokens(60)
            .temperature(0.0)
            .build();

        return openAiService.createChatCompletion(request)
            .getChoices().get(0).getMessage().getContent().trim();
    }

    @Override
    protected String providerName() {
        return "OpenAI";
    }

    @Override
    public boolean isAvailable() {
        return openAiService != null;
    }
}
