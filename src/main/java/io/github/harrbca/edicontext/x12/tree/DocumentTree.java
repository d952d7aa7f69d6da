package io.github.harrbca.edicontext.x12.tree;

import io.github.harrbca.edicontext.x12.map.MapNode;
import io.github.harrbca.edicontext.x12.model.Segment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class DocumentTree {

    public static final int NO_PARENT = -1;

    private final List<DocumentNode> nodes = new ArrayList<>();
    private final List<Integer> parents = new ArrayList<>();
    private final List<List<Integer>> children = new ArrayList<>();

    public LoopDataNode addLoop(MapNode loop, DocumentNode parent) {
        LoopDataNode node = new LoopDataNode(this, nodes.size(), loop);
        register(node, parent);
        return node;
    }

    public SegmentDataNode addSegment(MapNode segmentNode, Segment segment, DocumentNode parent) {
        SegmentDataNode node = new SegmentDataNode(this, nodes.size(), segmentNode, segment,
                new ArrayList<>(), new ArrayList<>());
        register(node, parent);
        return node;
    }

    SegmentDataNode addFlatSegment(MapNode segmentNode, Segment segment, List<MapNode> startLoops, List<MapNode> endLoops) {
        SegmentDataNode node = new SegmentDataNode(this, nodes.size(), segmentNode, segment, startLoops, endLoops);
        register(node, null);
        return node;
    }

    public DocumentNode getRoot() {
        return nodes.isEmpty() ? null : nodes.get(0);
    }

    public int size() {
        return nodes.size();
    }

    DocumentNode get(int handle) {
        return handle == NO_PARENT ? null : nodes.get(handle);
    }

    int parentOf(int handle) {
        return parents.get(handle);
    }

    List<Integer> childrenOf(int handle) {
        return Collections.unmodifiableList(children.get(handle));
    }

    private void register(DocumentNode node, DocumentNode parent) {
        if (parent != null && parent.getTree() != this) {
            throw new IllegalArgumentException("Parent belongs to another tree");
        }
        if (parent != null && parent.isSegment()) {
            throw new IllegalArgumentException("Segment node " + parent.getId() + " cannot hold children");
        }
        nodes.add(node);
        children.add(new ArrayList<>());
        if (parent == null) {
            parents.add(NO_PARENT);
        } else {
            parents.add(parent.getHandle());
            children.get(parent.getHandle()).add(node.getHandle());
        }
    }
}
