package io.github.harrbca.edicontext.x12.walk;

import io.github.harrbca.edicontext.x12.map.LoopCounters;
import io.github.harrbca.edicontext.x12.map.MapNode;
import io.github.harrbca.edicontext.x12.model.Segment;
import io.github.harrbca.edicontext.x12.model.ValidationError;
import io.github.harrbca.edicontext.x12.model.ValidationError.ErrorScope;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

@Slf4j
public class MapWalker implements GrammarMatcher {

    @Override
    public Optional<MapNode> resolve(MapNode cursor, Segment segment, LoopCounters counters, List<ValidationError> errors) {
        MapNode node = cursor;
        while (node != null && !node.isMapRoot()) {
            MapNode container = node.getParent();
            if (container == null) {
                break;
            }
            for (MapNode child : container.getChildren()) {
                if (child.getPosition() < node.getPosition()) {
                    continue;
                }
                MapNode candidate = child.isLoop() ? child.getFirstSegment() : child;
                if (candidate != null && candidate.isMatch(segment)) {
                    log.trace("Segment {} matched {}", segment.getSegmentId(), candidate.getPath());
                    recordTransition(cursor, candidate, counters, errors);
                    return Optional.of(candidate);
                }
            }
            node = container;
        }
        errors.add(ValidationError.builder()
                .scope(ErrorScope.SEG)
                .code("1")
                .description("Segment not found in map after " + cursor.getPath())
                .segmentId(segment.getSegmentId())
                .value(segment.getSegmentId())
                .build());
        return Optional.empty();
    }

    @Override
    public void recordTransition(MapNode from, MapNode to, LoopCounters counters, List<ValidationError> errors) {
        for (MapNode loop : LoopTransitions.pushLoops(from, to)) {
            int count = counters.enterLoop(loop.getPath());
            if (count > loop.getMaxUse()) {
                errors.add(ValidationError.builder()
                        .scope(ErrorScope.SEG)
                        .code("4")
                        .description("Loop " + loop.getId() + " exceeds maximum repeat of " + loop.getMaxUse())
                        .segmentId(to.getId())
                        .value(Integer.toString(count))
                        .build());
            }
        }
        int count = counters.increment(to.getPath());
        if (count > to.getMaxUse()) {
            errors.add(ValidationError.builder()
                    .scope(ErrorScope.SEG)
                    .code("5")
                    .description("Segment " + to.getId() + " exceeds maximum use of " + to.getMaxUse())
                    .segmentId(to.getId())
                    .value(Integer.toString(count))
                    .build());
        }
    }
}
