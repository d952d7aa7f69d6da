package io.github.harrbca.edicontext.x12.map;

import io.github.harrbca.edicontext.x12.X12StructureException;
import lombok.Getter;
import lombok.NonNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Getter
public class X12Map {

    private final String mapFile;
    private final String transactionId;
    private final String name;
    private final MapNode root;
    @Getter(lombok.AccessLevel.NONE)
    private final Map<String, MapNode> byPath;

    public X12Map(@NonNull String mapFile, String transactionId, String name, @NonNull MapNode root) {
        this.mapFile = mapFile;
        this.transactionId = transactionId;
        this.name = name;
        this.root = root;
        Map<String, MapNode> index = new LinkedHashMap<>();
        indexNodes(root, index);
        this.byPath = Collections.unmodifiableMap(index);
    }

    public Optional<MapNode> findNodeByPath(String path) {
        return Optional.ofNullable(byPath.get(path));
    }

    public MapNode getNodeByPath(String path) {
        MapNode node = byPath.get(path);
        if (node == null) {
            throw new X12StructureException("Path " + path + " not found in map " + mapFile);
        }
        return node;
    }

    public boolean hasPath(String path) {
        return byPath.containsKey(path);
    }

    public List<MapNode> getLoops() {
        List<MapNode> loops = new ArrayList<>();
        for (MapNode node : byPath.values()) {
            if (node.isLoop()) loops.add(node);
        }
        return loops;
    }

    private static void indexNodes(MapNode node, Map<String, MapNode> index) {
        if (node.isLoop() || node.isSegment()) {
            index.putIfAbsent(node.getPath(), node);
        }
        for (MapNode child : node.getChildren()) {
            if (child.isLoop() || child.isSegment()) {
                indexNodes(child, index);
            }
        }
    }

    @Override
    public String toString() {
        return "X12Map[" + mapFile + "]";
    }
}
