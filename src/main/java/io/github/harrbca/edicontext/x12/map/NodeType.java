package io.github.harrbca.edicontext.x12.map;

public enum NodeType {
    MAP_ROOT, LOOP, SEGMENT, COMPOSITE, ELEMENT
}
