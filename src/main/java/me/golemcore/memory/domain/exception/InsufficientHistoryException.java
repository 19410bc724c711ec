package me.golemcore.memory.domain.exception;

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

import java.util.LinkedHashMap;
import java.util.Map;

public class InsufficientHistoryException extends MemoryStoreException {

    private static final long serialVersionUID = 1L;

    public InsufficientHistoryException(String key, int availableVersions, int requestedSteps) {
        super(ErrorKind.INSUFFICIENT_HISTORY,
                "Not enough version history for '" + key + "'. Memory has " + availableVersions
                        + " versions, requested " + requestedSteps + " steps back.",
                details(availableVersions, requestedSteps));
    }

    private static Map<String, Object> details(int availableVersions, int requestedSteps) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("availableVersions", availableVersions);
        details.put("requestedSteps", requestedSteps);
        return details;
    }
}
