package me.golemcore.memory;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableAsync;

/**
 * Entry point of the memory store: a REST service in which coding agents keep
 * versioned project knowledge.
 *
 * <p>
 * Inbound web controllers call domain services that depend only on the
 * interfaces in {@code port.outbound}; JSON file storage, the plan catalog and
 * the embedding client live in {@code adapter.outbound}. Settings are bound
 * from the {@code memstore.*} properties.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableAsync
public class MemoryStoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(MemoryStoreApplication.class, args);
    }
}
