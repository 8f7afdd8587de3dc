package space.ketterling.climatecache.retrieval;

import java.util.List;

/**
 * Which places must hit the fetcher for a request.
 */
public record RetrievalPlan(List<String> placesNeedingFetch, int totalPlaces) {

    private static final String RULE = "=".repeat(60);

    public RetrievalPlan {
        placesNeedingFetch = List.copyOf(placesNeedingFetch);
    }

    public boolean fetchRequired() {
        return !placesNeedingFetch.isEmpty();
    }

    /**
     * Multi-line, user-facing summary of the plan.
     */
    public String summary() {
        StringBuilder sb = new StringBuilder();
        sb.append(RULE).append('\n');
        if (placesNeedingFetch.isEmpty()) {
            sb.append("All data already cached - no fetch needed").append('\n');
        } else {
            sb.append("Fetch required: ").append(placesNeedingFetch.size()).append(" place(s)").append('\n');
            sb.append(RULE).append('\n');
            for (String p : placesNeedingFetch)
                sb.append("  - ").append(p).append('\n');
        }
        sb.append(RULE);
        return sb.toString();
    }
}
