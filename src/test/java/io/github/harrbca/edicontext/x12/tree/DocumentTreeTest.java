package io.github.harrbca.edicontext.x12.tree;

import io.github.harrbca.edicontext.x12.map.MapLoader;
import io.github.harrbca.edicontext.x12.map.MapNode;
import io.github.harrbca.edicontext.x12.map.X12Map;
import io.github.harrbca.edicontext.x12.model.Segment;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("DocumentTree")
class DocumentTreeTest {

    private static final String SUBSCRIBER = "/ISA_LOOP/GS_LOOP/ST_LOOP/DETAIL/2000A/2000B/2000C";

    private X12Map map;
    private DocumentTree tree;
    private LoopDataNode root;
    private SegmentDataNode eq;

    @BeforeEach
    void setUp() {
        map = new MapLoader("classpath:maps").load("270.4010.X092.A1.xml");
        tree = new DocumentTree();
        root = tree.addLoop(map.getNodeByPath(SUBSCRIBER), null);
        tree.addSegment(map.getNodeByPath(SUBSCRIBER + "/HL"), Segment.of("HL", "3", "2", "22", "0"), root);
        LoopDataNode name = tree.addLoop(map.getNodeByPath(SUBSCRIBER + "/2100C"), root);
        tree.addSegment(map.getNodeByPath(SUBSCRIBER + "/2100C/NM1"), Segment.of("NM1", "IL", "1", "SMITH"), name);
        LoopDataNode benefit = tree.addLoop(map.getNodeByPath(SUBSCRIBER + "/2100C/2110C"), name);
        eq = tree.addSegment(map.getNodeByPath(SUBSCRIBER + "/2100C/2110C/EQ"), Segment.of("EQ", "30"), benefit);
    }

    @Test
    @DisplayName("Loop events should be well nested")
    void eventsShouldBeWellNested() {
        Deque<String> open = new ArrayDeque<>();
        List<String> segments = new ArrayList<>();

        for (LoopEvent event : root.produceLoopEvents()) {
            switch (event.getType()) {
                case LOOP_START -> open.push(event.getId());
                case LOOP_END -> assertThat(open.pop()).isEqualTo(event.getId());
                case SEGMENT -> segments.add(event.getSegment().getSegmentId());
            }
        }

        assertThat(open).isEmpty();
        assertThat(segments).containsExactly("HL", "NM1", "EQ");
    }

    @Test
    @DisplayName("Produced sequences should restart on each iteration")
    void sequencesShouldRestart() {
        List<String> first = new ArrayList<>();
        List<String> second = new ArrayList<>();
        root.produceSegments().forEach(s -> first.add(s.getSegmentId()));
        root.produceSegments().forEach(s -> second.add(s.getSegmentId()));

        assertThat(first).containsExactly("HL", "NM1", "EQ").isEqualTo(second);
    }

    @Test
    @DisplayName("Paths should follow the loop nodes and not change between calls")
    void pathsShouldBeStable() {
        assertThat(eq.getPath()).containsExactly("2000C", "2100C", "2110C");
        assertThat(eq.getPath()).isEqualTo(eq.getPath());
        assertThat(eq.getCurrentPath()).isEqualTo("/2000C/2100C/2110C");
        assertThat(root.getPath()).containsExactly("2000C");
        assertThat(root.getParent()).isEmpty();
        assertThat(eq.getParent()).map(DocumentNode::getId).contains("2110C");
    }

    @Test
    @DisplayName("Should expose children in insertion order")
    void shouldExposeChildren() {
        assertThat(root.getChildren()).extracting(DocumentNode::getId).containsExactly("HL", "2100C");
        assertThat(tree.getRoot()).isSameAs(root);
        assertThat(tree.size()).isEqualTo(6);
    }

    @Test
    @DisplayName("Should reject parents that cannot hold the node")
    void shouldRejectInvalidParents() {
        DocumentTree other = new DocumentTree();
        MapNode dmg = map.getNodeByPath(SUBSCRIBER + "/2100C/DMG");

        assertThatThrownBy(() -> other.addSegment(dmg, Segment.of("DMG", "D8"), root))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> tree.addSegment(dmg, Segment.of("DMG", "D8"), eq))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("A standalone segment should emit its loop markers around itself")
    void flatSegmentShouldEmitMarkers() {
        MapNode hl = map.getNodeByPath("/ISA_LOOP/GS_LOOP/ST_LOOP/DETAIL/2000A/HL");
        SegmentDataNode node = SegmentDataNode.flat(hl, Segment.of("HL", "1", "", "20", "1"),
                List.of(hl.getParent().getParent(), hl.getParent()), List.of(map.getNodeByPath("/ISA_LOOP/GS_LOOP/ST_LOOP/HEADER")));

        List<String> events = new ArrayList<>();
        node.produceLoopEvents().forEach(e -> events.add(e.getType() + ":" + e.getId()));

        assertThat(events).containsExactly("LOOP_START:DETAIL", "LOOP_START:2000A", "SEGMENT:HL", "LOOP_END:HEADER");
        assertThat(node.getParent()).isEmpty();
        assertThat(node.getErrors()).isEmpty();
    }
}
