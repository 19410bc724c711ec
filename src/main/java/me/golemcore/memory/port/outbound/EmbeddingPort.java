package me.golemcore.memory.port.outbound;

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

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Dense vector embeddings for memory content. The only consumer is the
 * near-duplicate check that runs before a new key is stored, so an
 * implementation may be unavailable without affecting writes.
 */
public interface EmbeddingPort {

    /**
     * One vector per input, same order as {@code texts}.
     */
    CompletableFuture<List<float[]>> embedBatch(List<String> texts);

    boolean isAvailable();

    /**
     * Cosine of the angle between two vectors of equal length, in [-1, 1]. A
     * zero vector yields 0.
     */
    default double cosineSimilarity(float[] left, float[] right) {
        if (left.length != right.length) {
            throw new IllegalArgumentException(
                    "Embedding length mismatch: " + left.length + " vs " + right.length);
        }
        double dot = 0;
        double leftSquares = 0;
        double rightSquares = 0;
        for (int idx = 0; idx < left.length; idx++) {
            float l = left[idx];
            float r = right[idx];
            dot += l * r;
            leftSquares += l * l;
            rightSquares += r * r;
        }
        double magnitude = Math.sqrt(leftSquares * rightSquares);
        return magnitude == 0 ? 0 : dot / magnitude;
    }
}
