package io.github.harrbca.edicontext.x12.walk;

import io.github.harrbca.edicontext.x12.map.LoopCounters;
import io.github.harrbca.edicontext.x12.map.MapNode;
import io.github.harrbca.edicontext.x12.model.Segment;
import io.github.harrbca.edicontext.x12.model.ValidationError;

import java.util.List;
import java.util.Optional;

// Finds where a data segment belongs in a map, starting from the position of the previous one.
public interface GrammarMatcher {

    Optional<MapNode> resolve(MapNode cursor, Segment segment, LoopCounters counters, List<ValidationError> errors);

    // Counts a move decided without searching, as for envelope segments located by path.
    void recordTransition(MapNode from, MapNode to, LoopCounters counters, List<ValidationError> errors);
}
