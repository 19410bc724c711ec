package me.golemcore.memory.domain.model;

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

/**
 * Acquire outcome. When {@code acquired} is false, {@code lock} is the lock
 * currently held by someone else.
 */
public record LockResult(boolean acquired, MemoryLock lock) {

    public static LockResult acquired(MemoryLock lock) {
        return new LockResult(true, lock);
    }

    public static LockResult held(MemoryLock existing) {
        return new LockResult(false, existing);
    }
}
