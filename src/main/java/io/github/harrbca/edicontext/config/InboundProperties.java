package io.github.harrbca.edicontext.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;

@Data
@Component
@ConfigurationProperties(prefix = "app.inbound")
public class InboundProperties {

    private String baseDirectory = "edi";
    private String incomingDirectory = "incoming";
    private String archiveDirectory = "archive";
    private String errorDirectory = "errors";
    private String processingDirectory = "processing";
    private int retryAttempts = 3;
    private long retryDelayMs = 1000;

    // loop counted as one occurrence per tree in the processing summary
    private String summaryLoopId = "2000A";

    public Path getBaseDirectoryPath() {
        return Paths.get(baseDirectory);
    }

    public Path getIncomingDirectoryPath() {
        return getBaseDirectoryPath().resolve(incomingDirectory);
    }

    public Path getArchiveDirectoryPath() {
        return getBaseDirectoryPath().resolve(archiveDirectory);
    }

    public Path getErrorDirectoryPath() {
        return getBaseDirectoryPath().resolve(errorDirectory);
    }

    public Path getProcessingDirectoryPath() {
        return getBaseDirectoryPath().resolve(processingDirectory);
    }
}
