package io.github.harrbca.edicontext.cli;

import io.github.harrbca.edicontext.config.CliProperties;
import io.github.harrbca.edicontext.service.InterchangeProcessingService;
import io.github.harrbca.edicontext.service.InterchangeSummary;
import io.github.harrbca.edicontext.service.X12ContextReaderFactory;
import io.github.harrbca.edicontext.x12.X12ContextReader;
import io.github.harrbca.edicontext.x12.error.ErrorCollector;
import io.github.harrbca.edicontext.x12.map.MapNode;
import io.github.harrbca.edicontext.x12.model.ValidationError;
import io.github.harrbca.edicontext.x12.tree.DocumentNode;
import io.github.harrbca.edicontext.x12.tree.LoopEvent;
import io.github.harrbca.edicontext.x12.tree.SegmentDataNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Iterator;
import java.util.Scanner;

@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.cli", name = "enabled", havingValue = "true", matchIfMissing = true)
public class InteractiveCliService {

    private final X12ContextReaderFactory readerFactory;
    private final InterchangeProcessingService processingService;
    private final CliProperties cliProperties;
    private PrintStream out = System.out;
    private boolean running = true;

    @EventListener(ApplicationReadyEvent.class)
    public void startInteractiveCli() {
        if (cliProperties.isShowWelcomeMessage()) {
            out.println("\n=== X12 Context Reader CLI ===");
            out.println("Type 'help' for available commands, 'quit' to exit\n");
        }

        Scanner scanner = new Scanner(System.in);

        while (running) {
            out.print(cliProperties.getPrompt());
            if (!scanner.hasNextLine()) {
                break;
            }
            String input = scanner.nextLine().trim();

            if (!input.isEmpty()) {
                processCommand(input);
            }
        }

        scanner.close();
        out.println("CLI session ended.");
    }

    void setOut(PrintStream out) {
        this.out = out;
    }

    boolean isRunning() {
        return running;
    }

    void processCommand(String input) {
        String[] parts = input.split("\\s+");
        String command = parts[0].toLowerCase();

        try {
            switch (command) {
                case "help" -> showHelp();
                case "segments" -> handleSegments(parts);
                case "loops" -> handleLoops(parts);
                case "process" -> handleProcess(parts);
                case "quit", "exit" -> {
                    running = false;
                    out.println("Goodbye!");
                }
                default -> out.println("Unknown command: " + command + ". Type 'help' for available commands.");
            }
        } catch (Exception e) {
            out.println("Error executing command: " + e.getMessage());
            log.debug("Command error details", e);
        }
    }

    private void showHelp() {
        out.println("""
            Available commands:

            Reading:
              segments <file>
                - Print every segment with the loops it opens and closes
              loops <file> <loopId>
                - Print one tree per occurrence of a loop
                - Example: loops claims.x12 2000A

            Processing:
              process [file]
                - Summarize and archive one file, or everything in the incoming directory

            General:
              help                - Show this help message
              quit/exit           - Exit the CLI
            """);
    }

    private void handleSegments(String[] parts) {
        if (parts.length < 2) {
            out.println("Usage: segments <file>");
            return;
        }
        Path file = existingFile(parts[1]);
        if (file == null) {
            return;
        }
        ErrorCollector errors = new ErrorCollector();
        try (X12ContextReader reader = readerFactory.open(file, errors)) {
            Iterator<DocumentNode> nodes = reader.iterate();
            int depth = 0;
            while (nodes.hasNext()) {
                SegmentDataNode node = (SegmentDataNode) nodes.next();
                for (MapNode loop : node.getEndLoops()) {
                    depth = Math.max(0, depth - 1);
                    out.println("  ".repeat(depth) + "</" + loop.getId() + ">");
                }
                for (MapNode loop : node.getStartLoops()) {
                    out.println("  ".repeat(depth) + "<" + loop.getId() + ">");
                    depth++;
                }
                out.println("  ".repeat(depth) + node.getSegment().format());
            }
        }
        printErrors(errors);
    }

    private void handleLoops(String[] parts) {
        if (parts.length < 3) {
            out.println("Usage: loops <file> <loopId>");
            return;
        }
        Path file = existingFile(parts[1]);
        if (file == null) {
            return;
        }
        String loopId = parts[2];
        ErrorCollector errors = new ErrorCollector();
        int trees = 0;
        try (X12ContextReader reader = readerFactory.open(file, errors)) {
            Iterator<DocumentNode> nodes = reader.iterate(loopId);
            while (nodes.hasNext()) {
                DocumentNode tree = nodes.next();
                trees++;
                out.println("--- " + loopId + " #" + trees + " ---");
                int depth = 0;
                for (LoopEvent event : tree.produceLoopEvents()) {
                    switch (event.getType()) {
                        case LOOP_START -> {
                            out.println("  ".repeat(depth) + "<" + event.getId() + ">");
                            depth++;
                        }
                        case LOOP_END -> {
                            depth--;
                            out.println("  ".repeat(depth) + "</" + event.getId() + ">");
                        }
                        case SEGMENT -> out.println("  ".repeat(depth) + event.getSegment().format());
                    }
                }
            }
        }
        out.println("Found " + trees + " occurrences of " + loopId);
        printErrors(errors);
    }

    private void handleProcess(String[] parts) throws Exception {
        if (parts.length < 2) {
            long processed = processingService.processIncoming();
            out.println("Processed " + processed + " files");
            return;
        }
        Path file = existingFile(parts[1]);
        if (file == null) {
            return;
        }
        InterchangeSummary summary = processingService.processFile(file).orElse(null);
        if (summary == null) {
            out.println("✗ Failed, see the error directory");
            return;
        }
        out.println("✓ Processed " + summary.getFileName());
        out.println("  Sender: " + summary.getSenderId());
        out.println("  Receiver: " + summary.getReceiverId());
        out.println("  Transaction sets: " + String.join(", ", summary.getTransactionSetIds()));
        out.println("  Segments: " + summary.getSegmentCount());
        out.println("  " + summary.getLoopId() + " occurrences: " + summary.getLoopOccurrences());
        out.println("  Errors: " + summary.getErrorCount());
    }

    private Path existingFile(String name) {
        Path file = Paths.get(name);
        if (!Files.isRegularFile(file)) {
            out.println("File not found: " + name);
            return null;
        }
        return file;
    }

    private void printErrors(ErrorCollector errors) {
        if (errors.getErrorCount() == 0) {
            return;
        }
        out.println("Validation errors:");
        for (ValidationError error : errors.getAllErrors()) {
            out.println("  " + error.getFormattedMessage());
        }
    }
}
