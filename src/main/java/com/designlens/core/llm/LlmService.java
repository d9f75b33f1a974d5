package com.designlens.core.llm;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.stereotype.Service;
import org.springframework.util.MimeType;
import org.springframework.util.MimeTypeUtils;

import java.net.MalformedURLException;
import java.net.URI;
import java.net.URL;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wraps Spring AI's {@link ChatClient} to produce structured (typed) output from model calls.
 * <p>
 * Uses {@link BeanOutputConverter} to generate a JSON schema from the target Java class,
 * append format instructions to the user prompt, and deserialize the model's JSON response.
 * Every call runs on a bounded executor and is abandoned after {@code designlens.llm.timeout};
 * failures come back as a {@link ModelCallResult} instead of an exception.
 */
@Service
public class LlmService implements DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(LlmService.class);

    private static final ObjectMapper LENIENT_MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(DeserializationFeature.ACCEPT_EMPTY_STRING_AS_NULL_OBJECT, true)
            .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true)
            .registerModule(new ParameterNamesModule());

    private final ChatClient chatClient;
    private final LlmProperties properties;
    private final ExecutorService executor;

    public LlmService(ChatClient.Builder builder, LlmProperties properties) {
        this.chatClient = builder.build();
        this.properties = properties;
        this.executor = Executors.newFixedThreadPool(Math.max(1, properties.getMaxConcurrentCalls()), daemonThreads());
        log.info("LlmService initialized (model: {}, timeout: {}s)",
                properties.hasModel() ? properties.getModel() : "default", properties.getTimeout().toSeconds());
    }

    /**
     * Sends a system + user prompt and deserializes the response into {@code outputType}.
     */
    public <T> ModelCallResult<T> structuredCall(String systemPrompt, String userPrompt,
                                                 Class<T> outputType, CallSettings settings) {
        return withTimeout(outputType, () -> {
            var converter = new BeanOutputConverter<>(outputType);
            String response = chatClient.prompt()
                    .system(systemPrompt)
                    .user(userPrompt + "\n\n" + converter.getFormat())
                    .options(options(settings))
                    .call()
                    .content();
            return convert(response, converter, outputType);
        });
    }

    /**
     * Like {@link #structuredCall}, with the image attached to the user message as media.
     */
    public <T> ModelCallResult<T> visionCall(String systemPrompt, String userPrompt, ImageInput image,
                                             Class<T> outputType, CallSettings settings) {
        return withTimeout(outputType, () -> {
            var converter = new BeanOutputConverter<>(outputType);
            String text = userPrompt + "\n\n" + converter.getFormat();
            MimeType mimeType = MimeTypeUtils.parseMimeType(image.mimeType());
            String response = chatClient.prompt()
                    .system(systemPrompt)
                    .user(u -> {
                        u.text(text);
                        if (image.hasBytes()) {
                            u.media(mimeType, new ByteArrayResource(image.bytes()));
                        } else {
                            u.media(mimeType, toUrl(image.url()));
                        }
                    })
                    .options(options(settings))
                    .call()
                    .content();
            return convert(response, converter, outputType);
        });
    }

    private <T> ModelCallResult<T> withTimeout(Class<T> outputType, Callable<T> call) {
        String name = outputType.getSimpleName();
        Duration timeout = properties.getTimeout();
        log.info("LLM call started → {}", name);
        long start = System.currentTimeMillis();
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        Future<T> future = executor.submit(() -> {
            if (mdc != null) {
                MDC.setContextMap(mdc);
            }
            try {
                return call.call();
            } finally {
                MDC.clear();
            }
        });
        try {
            T value = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            log.info("LLM call complete → {} ({}s)", name,
                    String.format("%.1f", (System.currentTimeMillis() - start) / 1000.0));
            return new ModelCallResult.Ok<>(value);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("LLM call → {} timed out after {}s", name, timeout.toSeconds());
            return new ModelCallResult.Timeout<>(timeout);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return new ModelCallResult.TransportError<>("interrupted while waiting for " + name);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof LlmParseException || cause instanceof LlmEmptyResponseException) {
                log.warn("LLM call → {} returned unusable content: {}", name, cause.getMessage());
                return new ModelCallResult.ParseError<>(cause.getMessage());
            }
            log.warn("LLM call → {} failed: {}", name, cause.getMessage());
            return new ModelCallResult.TransportError<>(cause.getClass().getSimpleName() + ": " + cause.getMessage());
        }
    }

    private <T> T convert(String response, BeanOutputConverter<T> converter, Class<T> outputType) {
        if (response == null || response.isBlank()) {
            throw new LlmEmptyResponseException("LLM returned empty content for " + outputType.getSimpleName()
                    + ". Check that the model is running and supports structured JSON output.");
        }
        try {
            T value = converter.convert(response);
            if (value == null) {
                throw new LlmParseException("Converter produced no " + outputType.getSimpleName());
            }
            return value;
        } catch (Exception e) {
            log.debug("Converter rejected response for {}: {}", outputType.getSimpleName(), e.getMessage());
            return parseWithJackson(response, outputType);
        }
    }

    /**
     * Fallback JSON parsing with lenient settings, after stripping code fences and prose.
     */
    static <T> T parseWithJackson(String json, Class<T> outputType) {
        String cleaned = JsonFences.strip(json);
        try {
            T result = LENIENT_MAPPER.readValue(cleaned, outputType);
            if (result == null) {
                throw new LlmParseException("Response for " + outputType.getSimpleName() + " was JSON null");
            }
            log.info("Jackson fallback parsing succeeded for {}", outputType.getSimpleName());
            return result;
        } catch (LlmParseException e) {
            throw e;
        } catch (Exception e) {
            log.debug("Raw LLM response: {}", json);
            throw new LlmParseException("Failed to parse LLM response to " + outputType.getSimpleName()
                    + ": " + e.getMessage(), e);
        }
    }

    private ChatOptions options(CallSettings settings) {
        return ChatOptions.builder()
                .model(properties.hasModel() ? properties.getModel() : null)
                .temperature(settings.temperature())
                .maxTokens(settings.maxTokens())
                .build();
    }

    private static URL toUrl(String url) {
        try {
            return URI.create(url).toURL();
        } catch (MalformedURLException | IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid image URL: " + url, e);
        }
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "llm-call-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    @Override
    public void destroy() {
        executor.shutdownNow();
    }
}
