package io.github.harrbca.edicontext.x12.source;

import io.github.harrbca.edicontext.x12.model.Delimiters;
import io.github.harrbca.edicontext.x12.model.Segment;
import io.github.harrbca.edicontext.x12.model.ValidationError;
import io.github.harrbca.edicontext.x12.model.ValidationError.ErrorScope;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

@Slf4j
public class X12SegmentReader implements SegmentSource {

    private static final Pattern SEGMENT_ID = Pattern.compile("^[A-Z][A-Z0-9]{1,2}$");
    private static final int ISA_ELEMENT_COUNT = 16;

    private final String edi;
    private int cursor;
    private int line = 1;
    private int segmentLine = 1;
    private int segmentCount;
    private boolean closed;
    private Delimiters delimiters = Delimiters.defaults();

    private final List<ValidationError> errors = new ArrayList<>();
    private final Deque<String> lsLoops = new ArrayDeque<>();

    // envelope bookkeeping
    private String isaControlNumber;
    private int groupCount;
    private String gsControlNumber;
    private int transactionCount;
    private String stControlNumber;
    private int transactionSegmentCount;

    public X12SegmentReader(@NonNull String edi) {
        int isaIdx = edi.indexOf("ISA");
        if (isaIdx < 0) throw new IllegalArgumentException("No ISA segment found");
        this.edi = edi;
        this.cursor = isaIdx;
        for (int i = 0; i < isaIdx; i++) {
            if (edi.charAt(i) == '\n') line++;
        }
    }

    public static X12SegmentReader of(@NonNull InputStream in) {
        try {
            return new X12SegmentReader(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read EDI content", e);
        }
    }

    public static X12SegmentReader of(@NonNull Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return of(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read EDI from path: " + path, e);
        }
    }

    @Override
    public Optional<Segment> next() {
        if (closed) {
            return Optional.empty();
        }
        skipWhitespace();
        if (cursor >= edi.length()) {
            return Optional.empty();
        }
        segmentLine = line;
        if (edi.startsWith("ISA", cursor)) {
            delimiters = detectDelimiters(cursor);
        }

        int end = edi.indexOf(delimiters.getSegmentTerminator(), cursor);
        if (end < 0) end = edi.length();
        String raw = edi.substring(cursor, end);
        countLines(raw);
        cursor = Math.min(end + 1, edi.length());
        if (end < edi.length() && delimiters.getSegmentTerminator() == '\n') {
            line++;
        }

        Segment seg = split(raw.strip());
        segmentCount++;
        checkSyntax(seg, raw.strip());
        trackEnvelope(seg);
        return Optional.of(seg);
    }

    @Override
    public int getCurrentLine() {
        return segmentLine;
    }

    @Override
    public int getSegmentCount() {
        return segmentCount;
    }

    @Override
    public String getCurrentLoopRepeatId() {
        return lsLoops.peek();
    }

    @Override
    public List<ValidationError> drainErrors() {
        List<ValidationError> drained = new ArrayList<>(errors);
        errors.clear();
        return drained;
    }

    @Override
    public void close() {
        closed = true;
    }

    // --- Helpers ---

    private Delimiters detectDelimiters(int isaIdx) {
        if (isaIdx + 3 >= edi.length()) {
            throw new IllegalArgumentException("Truncated after ISA");
        }
        char elementSep = edi.charAt(isaIdx + 3);

        // walk ISA01..ISA16; ISA16 is a single character followed by the segment terminator
        int pos = isaIdx + 4;
        List<String> isaFields = new ArrayList<>(ISA_ELEMENT_COUNT);
        for (int i = 0; i < ISA_ELEMENT_COUNT - 1; i++) {
            int nextSep = edi.indexOf(elementSep, pos);
            if (nextSep < 0) {
                throw new IllegalArgumentException("Could not locate ISA element separator for element " + (i + 1));
            }
            isaFields.add(edi.substring(pos, nextSep));
            pos = nextSep + 1;
        }
        if (pos + 1 >= edi.length()) {
            throw new IllegalArgumentException("Unexpected end of file after ISA16");
        }
        char componentSep = edi.charAt(pos);
        char segmentTerm = edi.charAt(pos + 1);
        String isa11 = isaFields.get(10);
        // ISA11 is a repetition separator only from 00402 on; older versions carry the "U" standards id
        char repetitionSep = isa11.length() == 1 && !Character.isLetterOrDigit(isa11.charAt(0)) ? isa11.charAt(0) : '^';

        Delimiters detected = Delimiters.builder()
                .elementSeparator(elementSep)
                .segmentTerminator(segmentTerm)
                .repetitionSeparator(repetitionSep)
                .componentSeparator(componentSep)
                .build();
        log.debug("Detected delimiters {}", detected);
        return detected;
    }

    private Segment split(String raw) {
        char elementSep = delimiters.getElementSeparator();
        List<String> parts = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < raw.length(); i++) {
            if (raw.charAt(i) == elementSep) {
                parts.add(raw.substring(start, i));
                start = i + 1;
            }
        }
        parts.add(raw.substring(start));
        String tag = parts.remove(0);
        return new Segment(tag, parts, delimiters);
    }

    private void checkSyntax(Segment seg, String raw) {
        if (!SEGMENT_ID.matcher(seg.getSegmentId()).matches()) {
            addError(seg, ErrorScope.SEG, "1", "Segment identifier is not valid", seg.getSegmentId());
        }
        if (seg.getElementCount() > 0 && raw.charAt(raw.length() - 1) == delimiters.getElementSeparator()) {
            addError(seg, ErrorScope.SEG, "SEG1", "Segment has trailing element separators", raw);
        }
    }

    private void trackEnvelope(Segment seg) {
        String id = seg.getSegmentId();
        if (stControlNumber != null) {
            transactionSegmentCount++;
        }
        switch (id) {
            case "ISA" -> {
                isaControlNumber = seg.getValue("ISA13");
                groupCount = 0;
            }
            case "IEA" -> {
                if (!Objects.equals(isaControlNumber, seg.getValue("IEA02"))) {
                    addError(seg, ErrorScope.ISA, "001",
                            "Interchange control number in header and trailer do not match", seg.getValue("IEA02"));
                }
                if (!Integer.toString(groupCount).equals(strip(seg.getValue("IEA01")))) {
                    addError(seg, ErrorScope.ISA, "021",
                            "Invalid number of included groups, expected " + groupCount, seg.getValue("IEA01"));
                }
                isaControlNumber = null;
            }
            case "GS" -> {
                groupCount++;
                gsControlNumber = seg.getValue("GS06");
                transactionCount = 0;
            }
            case "GE" -> {
                if (!Objects.equals(gsControlNumber, seg.getValue("GE02"))) {
                    addError(seg, ErrorScope.GS, "4",
                            "Group control number in header and trailer do not match", seg.getValue("GE02"));
                }
                if (!Integer.toString(transactionCount).equals(strip(seg.getValue("GE01")))) {
                    addError(seg, ErrorScope.GS, "5",
                            "Number of included transaction sets does not match, expected " + transactionCount,
                            seg.getValue("GE01"));
                }
                gsControlNumber = null;
            }
            case "ST" -> {
                transactionCount++;
                stControlNumber = seg.getValue("ST02");
                transactionSegmentCount = 1;
            }
            case "SE" -> {
                if (!Objects.equals(stControlNumber, seg.getValue("SE02"))) {
                    addError(seg, ErrorScope.ST, "3",
                            "Transaction set control number in header and trailer do not match", seg.getValue("SE02"));
                }
                if (!Integer.toString(transactionSegmentCount).equals(strip(seg.getValue("SE01")))) {
                    addError(seg, ErrorScope.ST, "4",
                            "Number of included segments does not match, expected " + transactionSegmentCount,
                            seg.getValue("SE01"));
                }
                stControlNumber = null;
            }
            case "LS" -> lsLoops.push(seg.getValue("LS01"));
            case "LE" -> {
                if (!lsLoops.isEmpty()) lsLoops.pop();
            }
            default -> {
                // no envelope bookkeeping
            }
        }
    }

    private void addError(Segment seg, ErrorScope scope, String code, String description, String value) {
        errors.add(ValidationError.builder()
                .scope(scope)
                .code(code)
                .description(description)
                .value(value)
                .segmentId(seg.getSegmentId())
                .segmentCount(segmentCount)
                .line(segmentLine)
                .build());
    }

    private void skipWhitespace() {
        while (cursor < edi.length()) {
            char c = edi.charAt(cursor);
            if (c == '\n') {
                line++;
            } else if (c != '\r' && c != ' ' && c != '\t') {
                return;
            }
            cursor++;
        }
    }

    private void countLines(String raw) {
        for (int i = 0; i < raw.length(); i++) {
            if (raw.charAt(i) == '\n') line++;
        }
    }

    private static String strip(String value) {
        if (value == null) return null;
        String trimmed = value.strip();
        // numeric counts may be zero padded
        int i = 0;
        while (i < trimmed.length() - 1 && trimmed.charAt(i) == '0') i++;
        return trimmed.substring(i);
    }
}
