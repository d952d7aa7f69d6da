package io.github.harrbca.edicontext.x12.walk;

import io.github.harrbca.edicontext.x12.map.MapNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

// Loop levels exited and entered when moving between two map positions.
public final class LoopTransitions {

    private LoopTransitions() {
    }

    // Loops exited, innermost first.
    public static List<MapNode> popLoops(MapNode from, MapNode to) {
        if (from == null) {
            return new ArrayList<>();
        }
        List<MapNode> fromChain = from.getLoopChain();
        int common = commonDepth(fromChain, to);
        List<MapNode> popped = new ArrayList<>(fromChain.subList(common, fromChain.size()));
        Collections.reverse(popped);
        return popped;
    }

    // Loops entered, outermost first.
    public static List<MapNode> pushLoops(MapNode from, MapNode to) {
        List<MapNode> toChain = to.getLoopChain();
        if (from == null) {
            return new ArrayList<>(toChain);
        }
        int common = commonDepth(from.getLoopChain(), to);
        return new ArrayList<>(toChain.subList(common, toChain.size()));
    }

    private static int commonDepth(List<MapNode> fromChain, MapNode to) {
        List<MapNode> toChain = to.getLoopChain();
        int depth = 0;
        int max = Math.min(fromChain.size(), toChain.size());
        while (depth < max && fromChain.get(depth).getPath().equals(toChain.get(depth).getPath())) {
            depth++;
        }
        if (to.isFirstSegInLoop() && depth == toChain.size() && depth > 0) {
            depth--;
        }
        return depth;
    }
}
