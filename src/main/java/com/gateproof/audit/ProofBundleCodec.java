package com.gateproof.audit;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

public class ProofBundleCodec {
    private final ObjectMapper mapper = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .build();

    public String toJson(ProofBundle bundle) throws IOException {
        return mapper.writeValueAsString(bundle);
    }

    public ProofBundle fromJson(String json) throws IOException {
        return mapper.readValue(json, ProofBundle.class);
    }

    public void write(ProofBundle bundle, Path path) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        mapper.writeValue(path.toFile(), bundle);
    }

    public ProofBundle read(Path path) throws IOException {
        return mapper.readValue(path.toFile(), ProofBundle.class);
    }
}
