package com.scrapesentinel.service.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.scrapesentinel.core.util.JsonUtils;
import com.scrapesentinel.service.runtime.SchedulerSettings;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

public final class ConfigLoader {
    public static final String SCHEDULER_FILE = "scheduler.json";
    public static final String JOBS_FILE = "jobs.json";

    private ConfigLoader() {
    }

    public static SchedulerSettings loadSettings(Path configDir) {
        return read(configDir.resolve(SCHEDULER_FILE), new TypeReference<>() {
        });
    }

    public static List<JobConfig> loadJobs(Path configDir) {
        return read(configDir.resolve(JOBS_FILE), new TypeReference<>() {
        });
    }

    private static <T> T read(Path path, TypeReference<T> ref) {
        try (InputStream in = Files.newInputStream(path)) {
            return JsonUtils.objectMapper().readValue(in, ref);
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }
}
