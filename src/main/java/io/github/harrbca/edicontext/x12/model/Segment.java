package io.github.harrbca.edicontext.x12.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Getter
@EqualsAndHashCode
public class Segment {

    // ISA12, GS08, 03, CLM05-1
    private static final Pattern REF_PATTERN = Pattern.compile("^(?:[A-Z0-9]{2,3}?)?(\\d{2})(?:-(\\d{1,2}))?$");

    private final String segmentId;
    private final List<String> elements;
    @EqualsAndHashCode.Exclude
    private final Delimiters delimiters;

    public Segment(@NonNull String segmentId, @NonNull List<String> elements, @NonNull Delimiters delimiters) {
        this.segmentId = segmentId;
        this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
        this.delimiters = delimiters;
    }

    public static Segment of(String segmentId, String... elements) {
        return new Segment(segmentId, List.of(elements), Delimiters.defaults());
    }

    public int getElementCount() {
        return elements.size();
    }

    // Raw element value at the 1-based position, or null when the segment is shorter.
    public String getElement(int position) {
        int idx = position - 1;
        return idx >= 0 && idx < elements.size() ? elements.get(idx) : null;
    }

    // Components of a composite element.
    public List<String> getComposite(int position) {
        String raw = getElement(position);
        if (raw == null) {
            return List.of();
        }
        List<String> parts = new ArrayList<>();
        char sep = delimiters.getComponentSeparator();
        int start = 0;
        for (int i = 0; i < raw.length(); i++) {
            if (raw.charAt(i) == sep) {
                parts.add(raw.substring(start, i));
                start = i + 1;
            }
        }
        parts.add(raw.substring(start));
        return parts;
    }

    // Value by reference designator, such as ISA12, 03 or CLM05-1.
    public String getValue(@NonNull String ref) {
        Matcher m = REF_PATTERN.matcher(ref);
        if (!m.matches()) {
            throw new IllegalArgumentException("Invalid element reference: " + ref);
        }
        int position = Integer.parseInt(m.group(1));
        if (m.group(2) == null) {
            return getElement(position);
        }
        int component = Integer.parseInt(m.group(2));
        List<String> parts = getComposite(position);
        return component >= 1 && component <= parts.size() ? parts.get(component - 1) : null;
    }

    public String format() {
        StringBuilder sb = new StringBuilder(segmentId);
        for (String element : elements) {
            sb.append(delimiters.getElementSeparator()).append(element);
        }
        return sb.append(delimiters.getSegmentTerminator()).toString();
    }

    @Override
    public String toString() {
        return format();
    }
}
