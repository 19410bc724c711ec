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

/**
 * Org-wide hard limit reached while creating a new key.
 */
public class QuotaExceededException extends MemoryStoreException {

    private static final long serialVersionUID = 1L;

    private final long used;
    private final long limit;

    public QuotaExceededException(long used, long limit) {
        super(ErrorKind.QUOTA_EXCEEDED,
                "Organization memory limit reached (" + used + "/" + limit
                        + "). Archive or delete memories before storing new keys.",
                details(used, limit));
        this.used = used;
        this.limit = limit;
    }

    public long getUsed() {
        return used;
    }

    public long getLimit() {
        return limit;
    }

    private static Map<String, Object> details(long used, long limit) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("used", used);
        details.put("limit", limit);
        return details;
    }
}
