package io.firefeed.pipeline.api.service.translation;

import dev.langchain4j.model.ollama.OllamaChatModel;
import io.firefeed.pipeline.api.exception.TranslationException;
import io.firefeed.pipeline.config.OllamaModelConfig;
import io.firefeed.pipeline.config.TranslationConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

/**
 * Loads translation models into an Ollama server.
 * <p>
 * A load asks Ollama to keep the model in memory for the idle timeout; closing the
 * model sends {@code keep_alive: 0}, which unloads it immediately.
 */
@Component
public class OllamaTranslationModelLoader implements TranslationModelLoader {

    private static final Logger logger = LoggerFactory.getLogger(OllamaTranslationModelLoader.class);

    private final OllamaModelConfig ollama;
    private final long keepAliveSeconds;
    private final RestTemplate restTemplate;

    public OllamaTranslationModelLoader(TranslationConfig translationConfig, RestTemplate ollamaRestTemplate) {
        this.ollama = translationConfig.ollama();
        this.keepAliveSeconds = translationConfig.modelIdleTimeout().toSeconds();
        this.restTemplate = ollamaRestTemplate;
    }

    @Override
    public TranslationModel load(ModelKey key) throws TranslationException {
        try {
            restTemplate.postForObject(generateUrl(),
                    Map.of("model", ollama.modelName(), "keep_alive", keepAliveSeconds), Map.class);
        } catch (RestClientException e) {
            throw new TranslationException("Ollama could not load " + ollama.modelName() + " for " + key + ": " + e.getMessage(),
                    e, TranslationException.Reason.MODEL_LOAD_FAILED);
        }

        OllamaChatModel chatModel = OllamaChatModel.builder()
                .baseUrl(ollama.baseUrl())
                .modelName(ollama.modelName())
                .temperature(ollama.temperature())
                .timeout(ollama.requestTimeout())
                .maxRetries(0)
                .build();

        return new OllamaTranslationModel(key, chatModel, () -> unload(key));
    }

    private void unload(ModelKey key) {
        try {
            restTemplate.postForObject(generateUrl(), Map.of("model", ollama.modelName(), "keep_alive", 0), Map.class);
        } catch (RestClientException e) {
            logger.warn("Failed to unload {} for {}: {}", ollama.modelName(), key, e.getMessage());
        }
    }

    private String generateUrl() {
        String base = ollama.baseUrl().endsWith("/") ? ollama.baseUrl().substring(0, ollama.baseUrl().length() - 1)
                : ollama.baseUrl();
        return base + "/api/generate";
    }
}
