package space.ketterling.climatecache.schema;

import java.util.ArrayList;
import java.util.List;

/**
 * Where a migrated field's value comes from in a legacy document.
 *
 * @param sourcePath       preferred dot-separated source path, may be null
 * @param sourceCandidates further paths tried in order
 */
public record FieldMapping(String sourcePath, List<String> sourceCandidates) {

    public FieldMapping {
        sourceCandidates = sourceCandidates == null ? List.of() : List.copyOf(sourceCandidates);
    }

    public static FieldMapping of(String sourcePath) {
        return new FieldMapping(sourcePath, List.of());
    }

    /**
     * Returns the source path followed by the candidates.
     */
    public List<String> orderedPaths() {
        List<String> out = new ArrayList<>();
        if (sourcePath != null)
            out.add(sourcePath);
        out.addAll(sourceCandidates);
        return out;
    }
}
