package io.github.harrbca.edicontext.service;

import io.github.harrbca.edicontext.config.X12MapProperties;
import io.github.harrbca.edicontext.x12.X12ContextReader;
import io.github.harrbca.edicontext.x12.error.ErrorSink;
import io.github.harrbca.edicontext.x12.map.MapIndex;
import io.github.harrbca.edicontext.x12.map.MapLoader;
import io.github.harrbca.edicontext.x12.source.SegmentSource;
import io.github.harrbca.edicontext.x12.source.X12SegmentReader;
import io.github.harrbca.edicontext.x12.walk.MapWalker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;

@Slf4j
@Service
public class X12ContextReaderFactory {

    private final X12MapProperties properties;
    private final MapLoader mapLoader;
    private final MapIndex mapIndex;
    private final MapWalker walker = new MapWalker();

    public X12ContextReaderFactory(X12MapProperties properties) {
        this.properties = properties;
        this.mapLoader = new MapLoader(properties.getMapPath());
        this.mapIndex = MapIndex.load(properties.getMapPath(), properties.getMapIndexFile());
        log.info("Loaded map index {} with {} entries from {}", properties.getMapIndexFile(),
                mapIndex.getEntries().size(), properties.getMapPath());
    }

    public X12ContextReader open(Path file, ErrorSink errorSink) {
        return open(X12SegmentReader.of(file), errorSink);
    }

    public X12ContextReader open(String edi, ErrorSink errorSink) {
        return open(new X12SegmentReader(edi), errorSink);
    }

    public X12ContextReader open(SegmentSource source, ErrorSink errorSink) {
        return new X12ContextReader(properties, errorSink, source, mapLoader, mapIndex, walker);
    }
}
