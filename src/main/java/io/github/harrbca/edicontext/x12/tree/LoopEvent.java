package io.github.harrbca.edicontext.x12.tree;

import io.github.harrbca.edicontext.x12.map.MapNode;
import io.github.harrbca.edicontext.x12.model.Segment;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class LoopEvent {
    Type type;
    String id;
    MapNode node;
    Segment segment;
    // only set for segments read outside a materialized tree
    List<MapNode> startLoops;
    List<MapNode> endLoops;

    public enum Type {
        LOOP_START, SEGMENT, LOOP_END
    }

    public static LoopEvent loopStart(MapNode loop) {
        return LoopEvent.builder().type(Type.LOOP_START).id(loop.getId()).node(loop).build();
    }

    public static LoopEvent loopEnd(MapNode loop) {
        return LoopEvent.builder().type(Type.LOOP_END).id(loop.getId()).node(loop).build();
    }
}
