package io.github.harrbca.edicontext.x12.map;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

// MapResolver backed by a maps.xml index
@Slf4j
public class MapIndex implements MapResolver {

    private final List<Entry> entries;

    public MapIndex(@NonNull List<Entry> entries) {
        this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public static MapIndex load(@NonNull String mapPath, @NonNull String indexFile) {
        try (InputStream in = MapLoader.openResource(mapPath, indexFile)) {
            Element maps = MapLoader.readXml(in).getDocumentElement();
            List<Entry> entries = new ArrayList<>();
            NodeList versions = maps.getElementsByTagName("version");
            for (int i = 0; i < versions.getLength(); i++) {
                Element version = (Element) versions.item(i);
                NodeList mapNodes = version.getElementsByTagName("map");
                for (int j = 0; j < mapNodes.getLength(); j++) {
                    Element map = (Element) mapNodes.item(j);
                    entries.add(Entry.builder()
                            .icvn(version.getAttribute("icvn"))
                            .vriic(map.getAttribute("vriic"))
                            .fic(map.getAttribute("fic"))
                            .tspc(map.getAttribute("tspc"))
                            .mapFile(map.getTextContent().trim())
                            .build());
                }
            }
            log.info("Loaded {} map index entries from {}", entries.size(), indexFile);
            return new MapIndex(entries);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load map index " + indexFile, e);
        }
    }

    @Override
    public Optional<String> lookup(String icvn, String vriic, String fic, String tspc) {
        for (Entry entry : entries) {
            if (Objects.equals(entry.getIcvn(), icvn)
                    && Objects.equals(entry.getVriic(), vriic)
                    && Objects.equals(entry.getFic(), fic)
                    && (tspc == null || tspc.equals(entry.getTspc()))) {
                return Optional.of(entry.getMapFile());
            }
        }
        log.debug("No map for icvn={}, vriic={}, fic={}, tspc={}", icvn, vriic, fic, tspc);
        return Optional.empty();
    }

    public List<Entry> getEntries() {
        return entries;
    }

    @Value
    @Builder
    public static class Entry {
        String icvn;
        String vriic;
        String fic;
        String tspc;
        String mapFile;
    }
}
