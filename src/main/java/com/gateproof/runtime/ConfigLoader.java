package com.gateproof.runtime;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

public final class ConfigLoader {
    private ConfigLoader() {
    }

    /** Reads YAML config; a missing file yields the defaults. */
    public static AppConfig load(Path config) throws IOException {
        if (config == null || !Files.exists(config)) {
            return new AppConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        AppConfig loaded = mapper.readValue(config.toFile(), AppConfig.class);
        return loaded == null ? new AppConfig() : loaded;
    }
}
