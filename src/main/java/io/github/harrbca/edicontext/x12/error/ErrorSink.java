package io.github.harrbca.edicontext.x12.error;

import io.github.harrbca.edicontext.x12.map.MapNode;
import io.github.harrbca.edicontext.x12.model.Segment;
import io.github.harrbca.edicontext.x12.model.ValidationError;
import io.github.harrbca.edicontext.x12.source.SegmentSource;

import java.util.List;

public interface ErrorSink {

    void addIsaLoop(Segment segment, SegmentSource source);

    void closeIsaLoop(MapNode node, Segment segment, SegmentSource source);

    void addGsLoop(Segment segment, SegmentSource source);

    void closeGsLoop(MapNode node, Segment segment, SegmentSource source);

    void addStLoop(Segment segment, SegmentSource source);

    void closeStLoop(MapNode node, Segment segment, SegmentSource source);

    void addSegment(MapNode node, Segment segment, int segmentCount, int line, String loopRepeatId);

    void handleErrors(List<ValidationError> errors);
}
