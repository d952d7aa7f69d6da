package io.github.harrbca.edicontext.x12.tree;

import io.github.harrbca.edicontext.x12.map.MapNode;
import io.github.harrbca.edicontext.x12.model.Segment;
import io.github.harrbca.edicontext.x12.model.ValidationError;
import lombok.AccessLevel;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

@Getter
public abstract class DocumentNode {

    @Getter(AccessLevel.PACKAGE)
    private final DocumentTree tree;
    @Getter(AccessLevel.PACKAGE)
    private final int handle;
    private final MapNode mapNode;
    @Getter(AccessLevel.NONE)
    private final List<ValidationError> errors = new ArrayList<>();

    protected DocumentNode(DocumentTree tree, int handle, MapNode mapNode) {
        this.tree = tree;
        this.handle = handle;
        this.mapNode = mapNode;
    }

    public String getId() {
        return mapNode.getId();
    }

    public abstract boolean isLoop();

    public boolean isSegment() {
        return !isLoop();
    }

    public Optional<DocumentNode> getParent() {
        return Optional.ofNullable(tree.get(tree.parentOf(handle)));
    }

    public List<DocumentNode> getChildren() {
        List<DocumentNode> result = new ArrayList<>();
        for (int child : tree.childrenOf(handle)) {
            result.add(tree.get(child));
        }
        return result;
    }

    // Ids of the loop nodes from the root of this fragment down to this node (inclusive for loops).
    public List<String> getPath() {
        LinkedList<String> ids = new LinkedList<>();
        DocumentNode node = isLoop() ? this : getParent().orElse(null);
        while (node != null) {
            ids.addFirst(node.getId());
            node = node.getParent().orElse(null);
        }
        return ids;
    }

    public String getCurrentPath() {
        return "/" + String.join("/", getPath());
    }

    public List<ValidationError> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public void addError(ValidationError error) {
        errors.add(error);
    }

    public Iterable<Segment> produceSegments() {
        return () -> segmentStream().iterator();
    }

    public Iterable<LoopEvent> produceLoopEvents() {
        return () -> eventStream().iterator();
    }

    protected abstract Stream<Segment> segmentStream();

    protected abstract Stream<LoopEvent> eventStream();

    protected Stream<DocumentNode> childStream() {
        return tree.childrenOf(handle).stream().map(tree::get);
    }
}
