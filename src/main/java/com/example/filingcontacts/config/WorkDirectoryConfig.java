package com.example.filingcontacts.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Root directory under which each document gets its own scratch directory.
 */
@Configuration
public class WorkDirectoryConfig {

    private static final Logger logger = LoggerFactory.getLogger(WorkDirectoryConfig.class);

    @Value("${extraction.work-dir:work}")
    private String workDir;

    @PostConstruct
    public void init() {
        try {
            Path root = Paths.get(workDir);
            if (!Files.exists(root)) {
                Files.createDirectories(root);
            }
            logger.info("✅ Extraction work directory: {}", root.toAbsolutePath());
        } catch (IOException e) {
            throw new IllegalStateException("Could not create extraction work directory " + workDir, e);
        }
    }

    public Path createDocumentDirectory() throws IOException {
        return Files.createTempDirectory(Paths.get(workDir), "doc-");
    }

    public String getWorkDir() {
        return workDir;
    }
}
