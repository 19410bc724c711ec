package me.golemcore.memory.adapter.outbound.embedding;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.infrastructure.config.MemoryStoreProperties;
import me.golemcore.memory.port.outbound.EmbeddingPort;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Computes memory content embeddings through langchain4j against an
 * OpenAI-compatible endpoint ({@code memstore.embedding.*}). The model client is
 * built on first use; a blank API key leaves the adapter permanently
 * unavailable.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jEmbeddingAdapter implements EmbeddingPort {

    private static final String FALLBACK_MODEL = "text-embedding-3-small";

    private final MemoryStoreProperties properties;

    private EmbeddingModel model;
    private boolean resolved;

    private synchronized Optional<EmbeddingModel> model() {
        if (!resolved) {
            model = createModel(properties.getEmbedding());
            resolved = true;
        }
        return Optional.ofNullable(model);
    }

    private EmbeddingModel createModel(MemoryStoreProperties.EmbeddingProperties config) {
        if (isBlank(config.getApiKey())) {
            log.info("[Embedding] No API key, near-duplicate warnings are off");
            return null;
        }
        String modelName = isBlank(config.getModel()) ? FALLBACK_MODEL : config.getModel();
        try {
            OpenAiEmbeddingModel.OpenAiEmbeddingModelBuilder builder = OpenAiEmbeddingModel.builder()
                    .apiKey(config.getApiKey())
                    .modelName(modelName)
                    .timeout(Duration.ofSeconds(config.getTimeoutSeconds()));
            if (!isBlank(config.getBaseUrl())) {
                builder.baseUrl(config.getBaseUrl());
            }
            EmbeddingModel created = builder.build();
            log.info("[Embedding] Using model {}", modelName);
            return created;
        } catch (RuntimeException e) {
            log.error("[Embedding] Could not create model client for {}", modelName, e);
            return null;
        }
    }

    @Override
    public CompletableFuture<List<float[]>> embedBatch(List<String> texts) {
        return CompletableFuture.supplyAsync(() -> {
            EmbeddingModel client = model()
                    .orElseThrow(() -> new IllegalStateException("Embedding model is not configured"));
            List<TextSegment> segments = texts.stream().map(TextSegment::from).toList();
            List<Embedding> embeddings = client.embedAll(segments).content();
            return embeddings.stream().map(Embedding::vector).toList();
        });
    }

    @Override
    public boolean isAvailable() {
        return model().isPresent();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
