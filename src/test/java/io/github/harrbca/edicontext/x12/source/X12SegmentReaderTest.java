package io.github.harrbca.edicontext.x12.source;

import io.github.harrbca.edicontext.X12Fixtures;
import io.github.harrbca.edicontext.x12.model.Segment;
import io.github.harrbca.edicontext.x12.model.ValidationError;
import io.github.harrbca.edicontext.x12.model.ValidationError.ErrorScope;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

@DisplayName("X12SegmentReader")
class X12SegmentReaderTest {

    private static final String ISA_PIPES =
            "ISA|00|          |00|          |ZZ|SUBMITTER01    |ZZ|RECEIVER01     |230101|1253|U|00401|000000042|0|P|>!";

    private static List<Segment> readAll(SegmentSource source) {
        List<Segment> segments = new ArrayList<>();
        Optional<Segment> next;
        while ((next = source.next()).isPresent()) {
            segments.add(next.get());
        }
        return segments;
    }

    @Nested
    @DisplayName("Splitting")
    class Splitting {

        @Test
        @DisplayName("Should detect delimiters from the ISA segment")
        void shouldDetectDelimitersFromIsa() {
            X12SegmentReader reader = new X12SegmentReader(ISA_PIPES + "IEA|0|000000042!");

            List<Segment> segments = readAll(reader);

            assertThat(segments).extracting(Segment::getSegmentId).containsExactly("ISA", "IEA");
            Segment isa = segments.get(0);
            assertThat(isa.getDelimiters().getElementSeparator()).isEqualTo('|');
            assertThat(isa.getDelimiters().getComponentSeparator()).isEqualTo('>');
            assertThat(isa.getDelimiters().getSegmentTerminator()).isEqualTo('!');
            assertThat(isa.getValue("ISA13")).isEqualTo("000000042");
            assertThat(reader.drainErrors()).isEmpty();
        }

        @Test
        @DisplayName("Should skip leading noise and track line numbers")
        void shouldTrackLines() {
            String edi = "\n\n" + X12Fixtures.read(X12Fixtures.ISA_ONLY);
            X12SegmentReader reader = new X12SegmentReader(edi);

            assertThat(reader.next()).map(Segment::getSegmentId).contains("ISA");
            assertThat(reader.getCurrentLine()).isEqualTo(3);
            assertThat(reader.next()).map(Segment::getSegmentId).contains("IEA");
            assertThat(reader.getCurrentLine()).isEqualTo(4);
            assertThat(reader.getSegmentCount()).isEqualTo(2);
            assertThat(reader.next()).isEmpty();
        }

        @Test
        @DisplayName("Should fail without an ISA segment")
        void shouldFailWithoutIsa() {
            assertThatThrownBy(() -> new X12SegmentReader("GS*HS*A*B~"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("No ISA segment found");
        }

        @Test
        @DisplayName("Should wrap unreadable files")
        void shouldWrapUnreadableFile(@TempDir Path dir) {
            assertThatThrownBy(() -> X12SegmentReader.of(dir.resolve("missing.x12")))
                    .isInstanceOf(UncheckedIOException.class);
        }

        @Test
        @DisplayName("Should return nothing after close")
        void shouldStopAfterClose() {
            X12SegmentReader reader = new X12SegmentReader(X12Fixtures.read(X12Fixtures.ISA_ONLY));
            reader.close();

            assertThat(reader.next()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("Should accept matching envelope trailers")
        void shouldAcceptMatchingTrailers() {
            X12SegmentReader reader = new X12SegmentReader(X12Fixtures.read(X12Fixtures.THREE_SUBSCRIBERS));

            readAll(reader);

            assertThat(reader.drainErrors()).isEmpty();
        }

        @Test
        @DisplayName("Should report trailer counts and control numbers that do not match")
        void shouldReportTrailerMismatches() {
            X12SegmentReader reader = new X12SegmentReader(X12Fixtures.read(X12Fixtures.BAD_TRAILERS));

            readAll(reader);
            List<ValidationError> errors = reader.drainErrors();

            assertThat(errors).extracting(ValidationError::getScope, ValidationError::getCode, ValidationError::getSegmentId)
                    .containsExactly(
                            tuple(ErrorScope.ST, "4", "SE"),
                            tuple(ErrorScope.ISA, "001", "IEA"));
            assertThat(errors.get(0).getDescription()).contains("expected 13");
            assertThat(reader.drainErrors()).isEmpty();
        }

        @Test
        @DisplayName("Should report bad segment ids and trailing separators")
        void shouldReportSyntaxErrors() {
            String edi = X12Fixtures.read(X12Fixtures.ISA_ONLY).replace("IEA*0*000000001~", "n1*X~EQ*30*~IEA*0*000000001~");
            X12SegmentReader reader = new X12SegmentReader(edi);

            readAll(reader);

            assertThat(reader.drainErrors()).extracting(ValidationError::getCode)
                    .containsExactly("1", "SEG1");
        }

        @Test
        @DisplayName("Should expose the innermost LS loop id")
        void shouldTrackLoopRepeatId() {
            String edi = X12Fixtures.read(X12Fixtures.ISA_ONLY)
                    .replace("IEA*0*000000001~", "LS*2700~LS*2710~LE*2710~IEA*0*000000001~");
            X12SegmentReader reader = new X12SegmentReader(edi);

            reader.next();
            reader.next();
            assertThat(reader.getCurrentLoopRepeatId()).isEqualTo("2700");
            reader.next();
            assertThat(reader.getCurrentLoopRepeatId()).isEqualTo("2710");
            reader.next();
            assertThat(reader.getCurrentLoopRepeatId()).isEqualTo("2700");
        }
    }
}
