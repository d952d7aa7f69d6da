package io.github.harrbca.edicontext.x12.map;

import io.github.harrbca.edicontext.x12.model.Segment;
import lombok.Builder;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedList;
import java.util.List;
import java.util.Set;

// One definition in an X12 map: a loop, segment, composite or element.
@Getter
public class MapNode {

    public static final int UNBOUNDED = Integer.MAX_VALUE;

    private final NodeType type;
    private final String id;
    private final String name;
    private final String usage;
    private final int position;
    private final int maxUse;
    private final String dataType;
    private final Set<String> validCodes;
    private final MapNode parent;
    private final String path;
    @Getter(lombok.AccessLevel.NONE)
    private final List<MapNode> children = new ArrayList<>();

    @Builder
    private MapNode(NodeType type, String id, String name, String usage, int position, int maxUse,
                    String dataType, Set<String> validCodes, MapNode parent) {
        this.type = type;
        this.id = id;
        this.name = name;
        this.usage = usage;
        this.position = position;
        this.maxUse = maxUse;
        this.dataType = dataType;
        this.validCodes = validCodes == null ? Set.of() : Set.copyOf(validCodes);
        this.parent = parent;
        if (parent == null || parent.isMapRoot()) {
            this.path = type == NodeType.MAP_ROOT ? "" : "/" + id;
        } else {
            this.path = parent.getPath() + "/" + id;
        }
        if (parent != null) {
            parent.children.add(this);
        }
    }

    public List<MapNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public boolean isMapRoot() {
        return type == NodeType.MAP_ROOT;
    }

    public boolean isLoop() {
        return type == NodeType.LOOP;
    }

    public boolean isSegment() {
        return type == NodeType.SEGMENT;
    }

    public boolean isElement() {
        return type == NodeType.ELEMENT;
    }

    public boolean isComposite() {
        return type == NodeType.COMPOSITE;
    }

    // Nearest loop ancestor, or the map root for top level nodes.
    public MapNode getParentLoop() {
        MapNode node = parent;
        while (node != null && !node.isLoop() && !node.isMapRoot()) {
            node = node.parent;
        }
        return node;
    }

    public List<String> getLoopPath() {
        LinkedList<String> ids = new LinkedList<>();
        MapNode node = isLoop() ? this : getParentLoop();
        while (node != null && node.isLoop()) {
            ids.addFirst(node.getId());
            node = node.getParentLoop();
        }
        return ids;
    }

    // outermost first, including this node when it is a loop
    public List<MapNode> getLoopChain() {
        LinkedList<MapNode> chain = new LinkedList<>();
        MapNode node = isLoop() ? this : getParentLoop();
        while (node != null && node.isLoop()) {
            chain.addFirst(node);
            node = node.getParentLoop();
        }
        return chain;
    }

    // siblings sharing the opening position are told apart by qualifier, so they all open the loop
    public boolean isFirstSegInLoop() {
        if (!isSegment() || parent == null || !parent.isLoop() || parent.children.isEmpty()) {
            return false;
        }
        MapNode first = parent.children.get(0);
        return first.isSegment() && parent.getSegmentsAtPosition(first.position).contains(this);
    }

    public List<MapNode> getSegmentsAtPosition(int pos) {
        List<MapNode> found = new ArrayList<>();
        for (MapNode child : children) {
            if (child.isSegment() && child.position == pos) {
                found.add(child);
            }
        }
        return found;
    }

    // The segment that opens this loop.
    public MapNode getFirstSegment() {
        if (isSegment()) return this;
        if (children.isEmpty()) return null;
        return children.get(0).getFirstSegment();
    }

    // tag, then a coded first element (HL03 for HL) must carry a valid code
    public boolean isMatch(Segment seg) {
        if (!isSegment() || !id.equals(seg.getSegmentId())) {
            return false;
        }
        if ("HL".equals(id)) {
            return codeMatches(3, seg.getElement(3));
        }
        return codeMatches(1, seg.getElement(1));
    }

    private boolean codeMatches(int seq, String value) {
        MapNode element = getElementAt(seq);
        if (element == null || element.validCodes.isEmpty()) {
            return true;
        }
        return value != null && element.validCodes.contains(value);
    }

    private MapNode getElementAt(int seq) {
        for (MapNode child : children) {
            if ((child.isElement() || child.isComposite()) && child.position == seq) {
                return child.isComposite() && !child.children.isEmpty() ? child.children.get(0) : child;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return type + "[" + path + "]";
    }
}
