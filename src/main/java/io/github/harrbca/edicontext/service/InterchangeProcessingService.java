package io.github.harrbca.edicontext.service;

import io.github.harrbca.edicontext.config.InboundProperties;
import io.github.harrbca.edicontext.event.InterchangeProcessedEvent;
import io.github.harrbca.edicontext.x12.X12ContextReader;
import io.github.harrbca.edicontext.x12.error.ErrorCollector;
import io.github.harrbca.edicontext.x12.map.MapNode;
import io.github.harrbca.edicontext.x12.model.Segment;
import io.github.harrbca.edicontext.x12.model.ValidationError;
import io.github.harrbca.edicontext.x12.tree.DocumentNode;
import io.github.harrbca.edicontext.x12.tree.SegmentDataNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@Slf4j
@Service
@RequiredArgsConstructor
public class InterchangeProcessingService {

    private final InboundProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final X12ContextReaderFactory readerFactory;
    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private volatile long totalFilesProcessed = 0;

    // Process every regular file waiting in the incoming directory.
    public long processIncoming() throws IOException {
        Path incomingDir = properties.getIncomingDirectoryPath();
        if (!Files.isDirectory(incomingDir)) {
            log.info("Incoming directory does not exist yet: {}", incomingDir);
            return 0;
        }
        List<Path> files;
        try (Stream<Path> listing = Files.list(incomingDir)) {
            files = listing.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
        }
        long processed = files.stream().filter(file -> processFile(file).isPresent()).count();
        log.info("Processed {} of {} files from {}", processed, files.size(), incomingDir);
        return processed;
    }

    // Read one interchange file end to end and archive it.
    public Optional<InterchangeSummary> processFile(Path sourceFile) {
        String fileName = sourceFile.getFileName().toString();

        try {
            log.info("Started processing file {}", fileName);
            Path processingFile = moveToProcessingDirectory(sourceFile);

            InterchangeSummary summary = summarize(processingFile, fileName);
            log.info("Processed file {}, Types: {}, Sender: {}, Receiver: {}, Segments: {}, {} occurrences: {}, Errors: {}",
                    fileName, summary.getTransactionSetIds(), summary.getSenderId(), summary.getReceiverId(),
                    summary.getSegmentCount(), summary.getLoopId(), summary.getLoopOccurrences(), summary.getErrorCount());

            moveToArchiveDirectory(processingFile);
            log.info("Successfully processed file {}", fileName);
            publishProcessedEvent(fileName, true, summary);
            return Optional.of(summary);

        } catch (Exception e) {
            log.error("Error processing file {}: {}", sourceFile, e.getMessage(), e);
            try {
                Path failed = Files.exists(sourceFile) ? sourceFile
                        : properties.getProcessingDirectoryPath().resolve(sourceFile.getFileName());
                moveToErrorDirectory(failed, e.getMessage());
            } catch (Exception moveError) {
                log.error("Failed to move error file {}: {}", sourceFile, moveError.getMessage());
            }
            publishProcessedEvent(fileName, false, null);
            return Optional.empty();
        }
    }

    public InterchangeSummary summarize(Path file, String fileName) {
        String loopId = properties.getSummaryLoopId();
        ErrorCollector errors = new ErrorCollector();
        InterchangeSummary.InterchangeSummaryBuilder summary = InterchangeSummary.builder()
                .fileName(fileName)
                .loopId(loopId);
        int segmentCount = 0;
        int occurrences = 0;

        try (X12ContextReader reader = readerFactory.open(file, errors)) {
            Iterator<DocumentNode> nodes = reader.iterate();
            while (nodes.hasNext()) {
                SegmentDataNode node = (SegmentDataNode) nodes.next();
                Segment seg = node.getSegment();
                segmentCount++;
                for (MapNode loop : node.getStartLoops()) {
                    if (loop.getId().equals(loopId)) {
                        occurrences++;
                    }
                }
                switch (seg.getSegmentId()) {
                    case "ISA" -> summary.senderId(trim(seg.getValue("ISA06")))
                            .receiverId(trim(seg.getValue("ISA08")))
                            .interchangeControlNumber(seg.getValue("ISA13"));
                    case "ST" -> summary.transactionSetId(seg.getValue("ST01"));
                    default -> {
                    }
                }
            }
        }

        for (ValidationError error : errors.getAllErrors()) {
            summary.errorMessage(error.getFormattedMessage());
        }
        return summary.segmentCount(segmentCount)
                .loopOccurrences(occurrences)
                .build();
    }

    private static String trim(String value) {
        return value == null ? null : value.trim();
    }

    private Path moveToProcessingDirectory(Path sourceFile) throws IOException {
        Path targetFile = properties.getProcessingDirectoryPath()
                .resolve(sourceFile.getFileName());

        return moveFileWithRetry(sourceFile, targetFile);
    }

    private void moveToArchiveDirectory(Path sourceFile) throws IOException {
        Path archiveDir = properties.getArchiveDirectoryPath();
        Files.createDirectories(archiveDir);

        Path targetFile = archiveDir.resolve(sourceFile.getFileName());
        moveFileWithRetry(sourceFile, targetFile);
    }

    private void moveToErrorDirectory(Path sourceFile, String errorReason) throws IOException {
        String timestamp = LocalDateTime.now().format(TIMESTAMP_FORMAT);
        String fileName = sourceFile.getFileName().toString();
        String nameWithoutExt = fileName.contains(".") ?
                fileName.substring(0, fileName.lastIndexOf('.')) : fileName;
        String extension = fileName.contains(".") ?
                fileName.substring(fileName.lastIndexOf('.')) : "";

        Path targetFile = properties.getErrorDirectoryPath()
                .resolve(nameWithoutExt + "_ERROR_" + timestamp + extension);

        moveFileWithRetry(sourceFile, targetFile);

        Path errorLogFile = properties.getErrorDirectoryPath()
                .resolve(nameWithoutExt + "_ERROR_" + timestamp + ".log");

        String errorLog = String.format("File: %s%nTimestamp: %s%nError: %s%n",
                fileName, LocalDateTime.now(), errorReason);
        Files.writeString(errorLogFile, errorLog);
    }

    private Path moveFileWithRetry(Path source, Path target) throws IOException {
        Files.createDirectories(target.getParent());

        IOException lastException = null;
        for (int attempt = 1; attempt <= properties.getRetryAttempts(); attempt++) {
            try {
                return Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException e) {
                lastException = e;
                log.warn("Attempt {} to move file {} failed: {}", attempt, source, e.getMessage());

                if (attempt < properties.getRetryAttempts()) {
                    try {
                        Thread.sleep(properties.getRetryDelayMs());
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        throw new IOException("File move interrupted", ie);
                    }
                }
            }
        }

        throw new IOException("Failed to move file after " + properties.getRetryAttempts() + " attempts", lastException);
    }

    private void publishProcessedEvent(String fileName, boolean success, InterchangeSummary summary) {
        totalFilesProcessed++;
        eventPublisher.publishEvent(new InterchangeProcessedEvent(this, fileName, success, summary));
    }

    public long getTotalFilesProcessed() {
        return totalFilesProcessed;
    }
}
