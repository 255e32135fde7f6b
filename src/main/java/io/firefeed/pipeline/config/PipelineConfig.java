package io.firefeed.pipeline.config;

import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.ollama.OllamaEmbeddingModel;
import io.firefeed.pipeline.api.exception.StorageException;
import io.firefeed.pipeline.api.exception.TranslationException;
import io.firefeed.pipeline.api.service.cache.TtlCache;
import io.firefeed.pipeline.api.service.translation.ModelManager;
import io.firefeed.pipeline.api.service.translation.TranslationCache;
import io.firefeed.pipeline.api.service.translation.TranslationModelLoader;
import io.firefeed.pipeline.api.service.translation.TranslationTaskQueue;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class PipelineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // executors

    @Bean(name = "feedFanOutExecutor")
    public ExecutorService feedFanOutExecutor() {
        return Executors.newCachedThreadPool(namedThreads("feed-fanout-"));
    }

    @Bean(name = "feedDownloadExecutor")
    public ExecutorService feedDownloadExecutor() {
        return Executors.newCachedThreadPool(namedThreads("feed-download-"));
    }

    @Bean(name = "pipelineFeedExecutor")
    public ExecutorService pipelineFeedExecutor(RssConfig rssConfig) {
        int threads = Math.max(2, rssConfig.processing().maxConcurrentFeeds());
        return Executors.newFixedThreadPool(threads, namedThreads("feed-pipeline-"));
    }

    // retry policies

    @Bean(name = "persistRetryTemplate")
    public RetryTemplate persistRetryTemplate(PublicationConfig publicationConfig) {
        long delay = publicationConfig.persistRetryDelay().toMillis();
        return RetryTemplate.builder()
                .maxAttempts(Math.max(1, publicationConfig.persistMaxAttempts()))
                .exponentialBackoff(delay, 2.0, delay * 4)
                .retryOn(StorageException.class)
                .build();
    }

    @Bean(name = "translationRetryTemplate")
    public RetryTemplate translationRetryTemplate(TranslationConfig translationConfig) {
        RetrySettings retry = translationConfig.retry();
        return RetryTemplate.builder()
                .maxAttempts(Math.max(1, retry.maxAttempts()))
                .exponentialBackoff(retry.baseDelay().toMillis(), 2.0, retry.maxDelay().toMillis(), retry.jitter())
                .retryOn(TranslationException.class)
                .build();
    }

    // translation engine

    @Bean
    public TranslationCache translationCache(CacheConfig cacheConfig, Clock clock) {
        return new TranslationCache(new TtlCache<>("translation", cacheConfig.maxSize(), cacheConfig.defaultTtl(), clock));
    }

    @Bean
    public ModelManager modelManager(TranslationModelLoader loader, TranslationConfig translationConfig, Clock clock) {
        return new ModelManager(loader, translationConfig.maxCachedModels(), translationConfig.modelLoadTimeout(), clock);
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    public TranslationTaskQueue translationTaskQueue(ModelManager modelManager, QueueConfig queueConfig) {
        return new TranslationTaskQueue(
                modelManager,
                queueConfig.maxSize(),
                queueConfig.defaultWorkers(),
                queueConfig.maxBatchSize(),
                queueConfig.taskTimeout(),
                queueConfig.enqueueTimeout()
        );
    }

    // ollama

    @Bean
    public EmbeddingModel embeddingModel(DeduplicationConfig deduplicationConfig) {
        EmbeddingConfig embedding = deduplicationConfig.embedding();
        return OllamaEmbeddingModel.builder()
                .baseUrl(embedding.baseUrl())
                .modelName(embedding.modelName())
                .timeout(embedding.timeout())
                .maxRetries(1)
                .build();
    }

    @Bean
    public RestTemplate ollamaRestTemplate(RestTemplateBuilder builder, TranslationConfig translationConfig) {
        return builder
                .setConnectTimeout(translationConfig.modelLoadTimeout())
                .setReadTimeout(translationConfig.modelLoadTimeout())
                .build();
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
