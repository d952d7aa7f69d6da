package io.github.harrbca.edicontext.x12.source;

import io.github.harrbca.edicontext.x12.model.Segment;
import io.github.harrbca.edicontext.x12.model.ValidationError;

import java.io.Closeable;
import java.util.List;
import java.util.Optional;

// Produces the segments of an interchange one at a time.
public interface SegmentSource extends Closeable {

    Optional<Segment> next();

    // 1-based line on which the current segment starts
    int getCurrentLine();

    int getSegmentCount();

    String getCurrentLoopRepeatId();

    // Returns and clears the errors detected while reading the current segment.
    List<ValidationError> drainErrors();

    @Override
    void close();
}
