package io.github.harrbca.edicontext.x12.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class ValidationError {
    private ErrorScope scope;
    private String code;
    private String description;
    private String value;
    private String segmentId;
    private int segmentCount;
    private int line;

    public enum ErrorScope {
        ISA, GS, ST, SEG, ELE
    }

    public String getFormattedMessage() {
        return String.format("[%s %s] %s (segment %s #%d, line %d)%s",
                scope, code, description, segmentId, segmentCount, line,
                value != null ? ": " + value : "");
    }
}
