package io.github.harrbca.edicontext;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Sample interchanges under {@code src/test/resources/x12}.
 */
public final class X12Fixtures {

    public static final String THREE_SUBSCRIBERS = "270-three-subscribers.x12";
    public static final String ISA_ONLY = "isa-only.x12";
    public static final String BAD_TRAILERS = "270-bad-trailers.x12";
    public static final String SERVICES_REVIEW_RESPONSE = "278-response.x12";
    public static final String UNKNOWN_VERSION = "unknown-version.x12";

    private X12Fixtures() {
    }

    public static String read(String name) {
        try (InputStream in = X12Fixtures.class.getClassLoader().getResourceAsStream("x12/" + name)) {
            if (in == null) {
                throw new IllegalArgumentException("Missing fixture " + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static Path copyTo(Path dir, String name) throws IOException {
        Path target = dir.resolve(name);
        Files.writeString(target, read(name));
        return target;
    }
}
