package io.github.harrbca.edicontext.x12.map;

import io.github.harrbca.edicontext.x12.X12StructureException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("MapIndex")
class MapIndexTest {

    private final MapIndex index = MapIndex.load("classpath:maps", "maps.xml");

    @Test
    @DisplayName("Should read every map entry of the index")
    void shouldLoadEntries() {
        assertThat(index.getEntries()).extracting(MapIndex.Entry::getMapFile).containsExactly(
                "270.4010.X092.A1.xml", "278.4010.X094.27.A1.xml", "278.4010.X094.A1.xml");
        assertThat(index.getEntries()).allMatch(e -> "00401".equals(e.getIcvn()));
    }

    @Test
    @DisplayName("Should select by version, functional group and purpose code")
    void shouldLookupByKey() {
        assertThat(index.lookup("00401", "004010X092A1", "HS")).contains("270.4010.X092.A1.xml");
        assertThat(index.lookup("00401", "004010X094A1", "HI", "11")).contains("278.4010.X094.A1.xml");
        assertThat(index.lookup("00401", "004010X094A1", "HI", "13")).contains("278.4010.X094.27.A1.xml");
    }

    @Test
    @DisplayName("Should take the first entry when no purpose code is given")
    void shouldTakeFirstWithoutPurposeCode() {
        assertThat(index.lookup("00401", "004010X094A1", "HI")).contains("278.4010.X094.27.A1.xml");
    }

    @Test
    @DisplayName("Should find nothing for unknown keys")
    void shouldReturnEmptyForUnknown() {
        assertThat(index.lookup("00501", "004010X092A1", "HS")).isEmpty();
        assertThat(index.lookup("00401", "004010X098A1", "HC")).isEmpty();
        assertThat(index.lookup("00401", "004010X094A1", "HI", "99")).isEmpty();
    }

    @Test
    @DisplayName("Should accept entries built in code")
    void shouldAcceptBuiltEntries() {
        MapIndex custom = new MapIndex(List.of(MapIndex.Entry.builder()
                .icvn("00501").vriic("005010X279A1").fic("HS").tspc("").mapFile("270.5010.X279.A1.xml")
                .build()));

        assertThat(custom.lookup("00501", "005010X279A1", "HS")).contains("270.5010.X279.A1.xml");
    }

    @Test
    @DisplayName("Should fail on a missing index file")
    void shouldFailOnMissingIndex() {
        assertThatThrownBy(() -> MapIndex.load("classpath:maps", "missing.xml"))
                .isInstanceOf(X12StructureException.class);
    }
}
