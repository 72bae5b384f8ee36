package me.scout.cron.domain.service;

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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import me.scout.cron.domain.model.JobDefinition;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Reads job definitions from {@code .json}, {@code .yaml} and {@code .yml}
 * files. Fields a file leaves out keep the {@link JobDefinition} defaults.
 */
@Component
public class JobDefinitionLoader {

    private final ObjectMapper jsonMapper;
    private final ObjectMapper yamlMapper;

    public JobDefinitionLoader(ObjectMapper objectMapper) {
        this.jsonMapper = objectMapper;
        this.yamlMapper = new ObjectMapper(new YAMLFactory())
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public JobDefinition load(Path file) throws IOException {
        ObjectMapper mapper = mapperFor(file);
        JobDefinition defaults = JobDefinition.builder().build();
        return mapper.readerForUpdating(defaults).readValue(Files.readString(file));
    }

    /**
     * Job definition files directly inside {@code directory}, sorted by name.
     */
    public List<Path> listJobFiles(Path directory) throws IOException {
        try (Stream<Path> entries = Files.list(directory)) {
            return entries
                    .filter(Files::isRegularFile)
                    .filter(JobDefinitionLoader::isSupported)
                    .sorted()
                    .toList();
        }
    }

    static boolean isSupported(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".json") || name.endsWith(".yaml") || name.endsWith(".yml");
    }

    private ObjectMapper mapperFor(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".json")) {
            return jsonMapper;
        }
        if (name.endsWith(".yaml") || name.endsWith(".yml")) {
            return yamlMapper;
        }
        throw new IllegalArgumentException("Unsupported job file format: " + file.getFileName());
    }
}
