package io.github.harrbca.edicontext.x12;

import io.github.harrbca.edicontext.config.X12MapProperties;
import io.github.harrbca.edicontext.x12.error.ErrorSink;
import io.github.harrbca.edicontext.x12.map.LoopCounters;
import io.github.harrbca.edicontext.x12.map.MapIndex;
import io.github.harrbca.edicontext.x12.map.MapLoader;
import io.github.harrbca.edicontext.x12.map.MapNode;
import io.github.harrbca.edicontext.x12.map.MapResolver;
import io.github.harrbca.edicontext.x12.map.X12Map;
import io.github.harrbca.edicontext.x12.model.Segment;
import io.github.harrbca.edicontext.x12.model.ValidationError;
import io.github.harrbca.edicontext.x12.source.SegmentSource;
import io.github.harrbca.edicontext.x12.tree.DocumentNode;
import io.github.harrbca.edicontext.x12.tree.DocumentTree;
import io.github.harrbca.edicontext.x12.tree.SegmentDataNode;
import io.github.harrbca.edicontext.x12.walk.GrammarMatcher;
import io.github.harrbca.edicontext.x12.walk.LoopTransitions;
import io.github.harrbca.edicontext.x12.walk.MapWalker;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

// Reads an X12 interchange and rebuilds its loop structure.
@Slf4j
public class X12ContextReader implements Closeable {

    private static final String ISA_PATH = SegmentKind.ISA.getEnvelopePath();
    private static final String GS_PATH = SegmentKind.GS.getEnvelopePath();

    private final ErrorSink errorSink;
    private final SegmentSource source;
    private final MapLoader mapLoader;
    private final MapResolver mapResolver;
    private final GrammarMatcher matcher;
    private final Set<String> purposeCodeVersions;
    private final X12Map controlMap;

    private ActiveMap active;
    @Getter
    private MapNode cursor;
    private final List<ValidationError> matchErrors = new ArrayList<>();
    private List<ValidationError> segmentErrors = new ArrayList<>();

    // envelope identifiers seen so far
    @Getter
    private String icvn;
    @Getter
    private String functionalIdCode;
    @Getter
    private String versionCode;
    @Getter
    private String purposeCode;

    public X12ContextReader(@NonNull X12MapProperties config, @NonNull ErrorSink errorSink, @NonNull SegmentSource source,
                            @NonNull MapLoader mapLoader, @NonNull MapResolver mapResolver, @NonNull GrammarMatcher matcher) {
        this.errorSink = errorSink;
        this.source = source;
        this.mapLoader = mapLoader;
        this.mapResolver = mapResolver;
        this.matcher = matcher;
        this.purposeCodeVersions = new HashSet<>(config.getPurposeCodeVersions());
        this.controlMap = mapLoader.load(config.getControlMapFile());
        this.active = new ActiveMap(controlMap, new LoopCounters());
        this.cursor = controlMap.getNodeByPath(ISA_PATH);
    }

    public static X12ContextReader open(@NonNull X12MapProperties config, @NonNull ErrorSink errorSink, @NonNull SegmentSource source) {
        MapLoader loader = new MapLoader(config.getMapPath());
        MapIndex index = MapIndex.load(config.getMapPath(), config.getMapIndexFile());
        return new X12ContextReader(config, errorSink, source, loader, index, new MapWalker());
    }

    // One node per segment, with loop boundary markers.
    public Iterator<DocumentNode> iterate() {
        return new DocumentIterator(null);
    }

    // One tree per occurrence of loopId; with a null id, the same as iterate().
    public Iterator<DocumentNode> iterate(String loopId) {
        return new DocumentIterator(loopId);
    }

    public Stream<DocumentNode> stream(String loopId) {
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(iterate(loopId),
                Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    public X12Map getActiveMap() {
        return active.getMap();
    }

    public LoopCounters getCounters() {
        return active.getCounters();
    }

    @Override
    public void close() {
        source.close();
    }

    // --- Per segment resolution ---

    private Resolution resolve(Segment seg) {
        SegmentKind kind = SegmentKind.of(seg.getSegmentId());
        MapNode previous = cursor;
        segmentErrors = new ArrayList<>();

        MapNode node;
        if (kind.isEnvelope()) {
            node = envelopeNode(kind.getEnvelopePath());
            matcher.recordTransition(previous, node, active.getCounters(), matchErrors);
        } else {
            node = matcher.resolve(previous, seg, active.getCounters(), matchErrors).orElse(null);
        }

        if (node == null) {
            // keep the previous position; the matcher has reported why
            log.debug("No map position for {} at line {}, staying at {}", seg.getSegmentId(),
                    source.getCurrentLine(), previous.getPath());
            forwardErrors();
            return new Resolution(previous, false, segmentErrors);
        }
        cursor = node;

        switch (kind) {
            case ISA -> {
                errorSink.addIsaLoop(seg, source);
                icvn = seg.getValue("ISA12");
                forwardErrors();
            }
            case IEA -> {
                forwardErrors();
                errorSink.closeIsaLoop(cursor, seg, source);
            }
            case GS -> {
                functionalIdCode = seg.getValue("GS01");
                versionCode = seg.getValue("GS08");
                String mapFile = mapResolver.lookup(icvn, versionCode, functionalIdCode)
                        .orElseThrow(() -> new X12StructureException(String.format(
                                "Map not found.  icvn=%s, fic=%s, vriic=%s", icvn, functionalIdCode, versionCode)));
                if (switchMap(mapFile)) {
                    resetEnvelopeCounts();
                }
                cursor = active.getMap().getNodeByPath(GS_PATH);
                errorSink.addGsLoop(seg, source);
                forwardErrors();
            }
            case BHT -> {
                if (purposeCodeVersions.contains(versionCode)) {
                    purposeCode = seg.getValue("BHT02");
                    String mapFile = mapResolver.lookup(icvn, versionCode, functionalIdCode, purposeCode)
                            .orElseThrow(() -> new X12StructureException(String.format(
                                    "Map not found.  icvn=%s, fic=%s, vriic=%s, tspc=%s",
                                    icvn, functionalIdCode, versionCode, purposeCode)));
                    if (switchMap(mapFile)) {
                        cursor = active.getMap().getNodeByPath(SegmentKind.BHT_PATH);
                    }
                }
                errorSink.addSegment(cursor, seg, source.getSegmentCount(), source.getCurrentLine(),
                        source.getCurrentLoopRepeatId());
                forwardErrors();
            }
            case GE -> {
                forwardErrors();
                errorSink.closeGsLoop(cursor, seg, source);
            }
            case ST -> {
                errorSink.addStLoop(seg, source);
                forwardErrors();
            }
            case SE -> {
                forwardErrors();
                errorSink.closeStLoop(cursor, seg, source);
            }
            default -> {
                errorSink.addSegment(cursor, seg, source.getSegmentCount(), source.getCurrentLine(),
                        source.getCurrentLoopRepeatId());
                forwardErrors();
            }
        }
        return new Resolution(cursor, true, segmentErrors);
    }

    private MapNode envelopeNode(String path) {
        return active.getMap().findNodeByPath(path)
                .orElseGet(() -> controlMap.getNodeByPath(path));
    }

    // Replace the active map when mapFile differs from it, carrying the counts over.
    private boolean switchMap(String mapFile) {
        if (mapFile.equals(active.getMap().getMapFile())) {
            return false;
        }
        log.info("Switching map from {} to {}", active.getMap().getMapFile(), mapFile);
        X12Map next = mapLoader.load(mapFile);
        active = new ActiveMap(next, active.getCounters().transferTo(next));
        return true;
    }

    private void resetEnvelopeCounts() {
        LoopCounters counters = active.getCounters();
        counters.setCount("/ISA_LOOP", 1);
        counters.setCount("/ISA_LOOP/ISA", 1);
        counters.reset("/ISA_LOOP/GS_LOOP");
        counters.setCount("/ISA_LOOP/GS_LOOP", 1);
        counters.setCount(GS_PATH, 1);
    }

    private void forwardErrors() {
        List<ValidationError> errors = new ArrayList<>(source.drainErrors());
        for (ValidationError error : matchErrors) {
            errors.add(error.toBuilder()
                    .segmentCount(source.getSegmentCount())
                    .line(source.getCurrentLine())
                    .build());
        }
        matchErrors.clear();
        errorSink.handleErrors(errors);
        segmentErrors.addAll(errors);
    }

    // --- Tree cursor reconciliation ---

    // closes and opens loop nodes as the map position moved
    private SegmentDataNode addSegment(DocumentTree tree, DocumentNode current, Resolution resolution, Segment seg) {
        MapNode segmentNode = resolution.getNode();
        if (!segmentNode.isSegment()) {
            throw new X12StructureException("Node must be a segment: " + segmentNode.getPath());
        }
        DocumentNode parent = current.isLoop() ? current : current.getParent().orElse(null);
        if (resolution.isMatched()) {
            for (MapNode loop : LoopTransitions.popLoops(current.getMapNode(), segmentNode)) {
                if (parent == null || !parent.getId().equals(loop.getId())) {
                    throw new X12StructureException(String.format("Loop pop: %s != %s",
                            parent == null ? "<root>" : parent.getId(), loop.getId()));
                }
                parent = parent.getParent().orElse(null);
            }
            for (MapNode loop : LoopTransitions.pushLoops(current.getMapNode(), segmentNode)) {
                if (parent == null) {
                    throw new X12StructureException("Loop push of " + loop.getId() + " outside the captured tree");
                }
                parent = tree.addLoop(loop, parent);
            }
        }
        if (parent == null) {
            throw new X12StructureException("Segment " + seg.getSegmentId() + " falls outside the captured tree");
        }
        return attach(tree, parent, resolution, seg);
    }

    private SegmentDataNode attach(DocumentTree tree, DocumentNode parent, Resolution resolution, Segment seg) {
        SegmentDataNode node = tree.addSegment(resolution.getNode(), seg, parent);
        resolution.getErrors().forEach(node::addError);
        return node;
    }

    private SegmentDataNode flatSegment(MapNode last, Resolution resolution, Segment seg) {
        MapNode segmentNode = resolution.getNode();
        if (!segmentNode.isSegment()) {
            throw new X12StructureException("Node must be a segment: " + segmentNode.getPath());
        }
        List<MapNode> startLoops;
        List<MapNode> endLoops;
        if (!resolution.isMatched()) {
            startLoops = new ArrayList<>();
            endLoops = new ArrayList<>();
        } else {
            startLoops = LoopTransitions.pushLoops(last, segmentNode);
            endLoops = LoopTransitions.popLoops(last, segmentNode);
        }
        SegmentDataNode node = SegmentDataNode.flat(segmentNode, seg, startLoops, endLoops);
        resolution.getErrors().forEach(node::addError);
        return node;
    }

    private class DocumentIterator implements Iterator<DocumentNode> {

        private final String loopId;
        private DocumentNode pending;
        private boolean finished;

        // flat mode
        private MapNode lastNode;

        // scoped mode
        private DocumentTree tree;
        private DocumentNode treeCursor;

        DocumentIterator(String loopId) {
            this.loopId = loopId;
        }

        @Override
        public boolean hasNext() {
            while (pending == null && !finished) {
                step();
            }
            return pending != null;
        }

        @Override
        public DocumentNode next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            DocumentNode node = pending;
            pending = null;
            return node;
        }

        private void step() {
            Optional<Segment> next = source.next();
            if (next.isEmpty()) {
                finished = true;
                pending = completeTree();
                return;
            }
            Segment seg = next.get();
            Resolution resolution = resolve(seg);
            if (loopId == null) {
                pending = flatSegment(lastNode, resolution, seg);
                lastNode = resolution.getNode();
            } else {
                scoped(resolution, seg);
            }
        }

        private void scoped(Resolution resolution, Segment seg) {
            MapNode node = resolution.getNode();
            boolean inScope = node.getLoopPath().contains(loopId);
            if (inScope && resolution.isMatched() && startsRequestedLoop(node)) {
                pending = completeTree();
                tree = new DocumentTree();
                DocumentNode root = tree.addLoop(node.getParentLoop(), null);
                treeCursor = attach(tree, root, resolution, seg);
            } else if (inScope && tree != null) {
                treeCursor = addSegment(tree, treeCursor, resolution, seg);
            } else if (!inScope && tree != null) {
                pending = completeTree();
            }
            // otherwise outside the requested loop: skipped
        }

        private boolean startsRequestedLoop(MapNode node) {
            MapNode parentLoop = node.getParentLoop();
            return parentLoop != null && parentLoop.isLoop() && loopId.equals(parentLoop.getId())
                    && node.isFirstSegInLoop();
        }

        private DocumentNode completeTree() {
            if (tree == null) {
                return null;
            }
            DocumentNode root = tree.getRoot();
            tree = null;
            treeCursor = null;
            return root;
        }
    }

    @Getter
    private static class ActiveMap {
        private final X12Map map;
        private final LoopCounters counters;

        ActiveMap(X12Map map, LoopCounters counters) {
            this.map = map;
            this.counters = counters;
        }
    }

    @Getter
    private static class Resolution {
        private final MapNode node;
        private final boolean matched;
        private final List<ValidationError> errors;

        Resolution(MapNode node, boolean matched, List<ValidationError> errors) {
            this.node = node;
            this.matched = matched;
            this.errors = errors;
        }
    }
}
