package io.github.harrbca.edicontext.x12.tree;

import io.github.harrbca.edicontext.x12.map.MapNode;
import io.github.harrbca.edicontext.x12.model.Segment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Stream;

// A data segment together with the map definition it matched. Outside a tree, startLoops are the
// loops entered just before it (outermost first) and endLoops those exited since the previous segment
// (innermost first). On a repeat of the enclosing loop both lists hold that loop.
public class SegmentDataNode extends DocumentNode {

    private final Segment segment;
    private final List<MapNode> startLoops;
    private final List<MapNode> endLoops;

    SegmentDataNode(DocumentTree tree, int handle, MapNode segmentNode, Segment segment,
                    List<MapNode> startLoops, List<MapNode> endLoops) {
        super(tree, handle, segmentNode);
        this.segment = segment;
        this.startLoops = Collections.unmodifiableList(new ArrayList<>(startLoops));
        this.endLoops = Collections.unmodifiableList(new ArrayList<>(endLoops));
    }

    // A standalone segment node with its loop boundary markers.
    public static SegmentDataNode flat(MapNode segmentNode, Segment segment, List<MapNode> startLoops, List<MapNode> endLoops) {
        return new DocumentTree().addFlatSegment(segmentNode, segment, startLoops, endLoops);
    }

    public Segment getSegment() {
        return segment;
    }

    public List<MapNode> getStartLoops() {
        return startLoops;
    }

    public List<MapNode> getEndLoops() {
        return endLoops;
    }

    @Override
    public boolean isLoop() {
        return false;
    }

    @Override
    protected Stream<Segment> segmentStream() {
        return Stream.of(segment);
    }

    @Override
    protected Stream<LoopEvent> eventStream() {
        LoopEvent seg = LoopEvent.builder()
                .type(LoopEvent.Type.SEGMENT)
                .id(getId())
                .node(getMapNode())
                .segment(segment)
                .startLoops(startLoops)
                .endLoops(endLoops)
                .build();
        return Stream.of(
                startLoops.stream().map(LoopEvent::loopStart),
                Stream.of(seg),
                endLoops.stream().map(LoopEvent::loopEnd)
        ).flatMap(s -> s);
    }

    @Override
    public String toString() {
        return "SegmentDataNode[" + segment.getSegmentId() + " -> " + getMapNode().getPath() + "]";
    }
}
