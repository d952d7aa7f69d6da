package io.github.harrbca.edicontext.x12.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class Delimiters {
    // Detected from the fixed-width ISA segment
    @Builder.Default char elementSeparator = '*';
    @Builder.Default char segmentTerminator = '~';
    @Builder.Default char repetitionSeparator = '^';
    @Builder.Default char componentSeparator = ':';

    public static Delimiters defaults() {
        return Delimiters.builder().build();
    }
}
