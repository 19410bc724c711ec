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
 * Text documents grouped into named directories ({@code memories},
 * {@code locks}). All calls are asynchronous; callers that need ordering join
 * the returned future.
 */
public interface StoragePort {

    /**
     * Completes with {@code null} when the document does not exist.
     */
    CompletableFuture<String> getText(String directory, String path);

    /**
     * Replaces a document so that readers observe either the old or the new
     * content, never a partial write. The new content is staged beside the
     * target, flushed, then moved over it. With {@code backup} set the previous
     * content is kept under the same name plus {@code .bak}.
     */
    CompletableFuture<Void> putTextAtomic(String directory, String path, String content, boolean backup);

    /** Missing documents are not an error. */
    CompletableFuture<Void> deleteObject(String directory, String path);

    /**
     * Relative paths under {@code directory} starting with {@code prefix}.
     */
    CompletableFuture<List<String>> listObjects(String directory, String prefix);
}
