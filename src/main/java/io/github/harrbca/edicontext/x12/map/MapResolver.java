package io.github.harrbca.edicontext.x12.map;

import java.util.Optional;

// Chooses the map file for the identifiers found in the control envelope.
public interface MapResolver {

    Optional<String> lookup(String icvn, String vriic, String fic, String tspc);

    default Optional<String> lookup(String icvn, String vriic, String fic) {
        return lookup(icvn, vriic, fic, null);
    }
}
