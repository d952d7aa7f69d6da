package io.github.harrbca.edicontext.x12.tree;

import io.github.harrbca.edicontext.x12.map.MapNode;
import io.github.harrbca.edicontext.x12.model.Segment;

import java.util.stream.Stream;

public class LoopDataNode extends DocumentNode {

    LoopDataNode(DocumentTree tree, int handle, MapNode loop) {
        super(tree, handle, loop);
    }

    @Override
    public boolean isLoop() {
        return true;
    }

    @Override
    protected Stream<Segment> segmentStream() {
        return childStream().flatMap(DocumentNode::segmentStream);
    }

    @Override
    protected Stream<LoopEvent> eventStream() {
        return Stream.of(
                Stream.of(LoopEvent.loopStart(getMapNode())),
                childStream().flatMap(DocumentNode::eventStream),
                Stream.of(LoopEvent.loopEnd(getMapNode()))
        ).flatMap(s -> s);
    }

    @Override
    public String toString() {
        return "LoopDataNode[" + getCurrentPath() + ", children=" + getChildren().size() + "]";
    }
}
