package com.project.hatchmark.config;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

public class DeploymentRegistry {

    private final Path deploymentsDirectory;
    private final ObjectMapper mapper = new ObjectMapper();

    public DeploymentRegistry(Path deploymentsDirectory) {
        this.deploymentsDirectory = deploymentsDirectory;
    }

    public Optional<DeploymentMetadata> load(String networkName) {
        Path file = deploymentsDirectory.resolve(networkName + ".json");
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            DeploymentMetadata metadata = mapper.readValue(file.toFile(), DeploymentMetadata.class);
            if (metadata.packageId() == null || metadata.packageId().isBlank()) {
                throw new IllegalStateException("Deployment metadata has no packageId: " + file);
            }
            return Optional.of(metadata);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read deployment metadata: " + file, e);
        }
    }
}
