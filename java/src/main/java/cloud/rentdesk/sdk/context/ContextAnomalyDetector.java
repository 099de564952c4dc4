package cloud.rentdesk.sdk.context;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Flags context combinations that are allowed but worth a second look. Nothing is rejected here.
 */
public final class ContextAnomalyDetector {

    private static final Logger LOGGER = Logger.getLogger(ContextAnomalyDetector.class.getName());

    /**
     * More switches than this within a minute count as rapid switching.
     */
    public static final int RAPID_SWITCH_THRESHOLD = 10;

    private final Clock clock;

    public ContextAnomalyDetector(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public List<ContextAnomaly> detect(List<UserContext> contexts) {
        return detect(contexts, 0);
    }

    /**
     * @param recentSwitches context switches committed during the last minute.
     */
    public List<ContextAnomaly> detect(List<UserContext> contexts, int recentSwitches) {
        List<UserContext> checked = contexts == null ? List.of() : contexts;

        // workspace id -> active context count per type, in first-seen order
        Map<String, EnumMap<ContextType, Integer>> byWorkspace = new LinkedHashMap<>();
        Map<String, String> workspaceNames = new LinkedHashMap<>();
        for (UserContext context : checked) {
            if (context == null || !context.isActive() || context.contextType() == null
                || context.workspaceId() == null || context.workspaceId().isBlank()) {
                continue;
            }
            byWorkspace.computeIfAbsent(context.workspaceId(), id -> new EnumMap<>(ContextType.class))
                .merge(context.contextType(), 1, Integer::sum);
            if (context.workspaceName() != null) {
                workspaceNames.putIfAbsent(context.workspaceId(), context.workspaceName());
            }
        }

        Instant now = clock.instant();
        List<ContextAnomaly> anomalies = new ArrayList<>();
        for (Map.Entry<String, EnumMap<ContextType, Integer>> entry : byWorkspace.entrySet()) {
            String workspaceId = entry.getKey();
            String workspaceName = workspaceNames.getOrDefault(workspaceId, "Unknown");
            EnumMap<ContextType, Integer> counts = entry.getValue();

            if (counts.containsKey(ContextType.STAFF) && counts.containsKey(ContextType.TENANT)) {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("workspace_id", workspaceId);
                details.put("context_types", wireValues(counts));
                anomalies.add(new ContextAnomaly(ContextAnomaly.Type.STAFF_AND_TENANT_SAME_WORKSPACE,
                    ContextAnomaly.Severity.MEDIUM,
                    "User is both staff and tenant at " + workspaceName, details, now));
            }
            for (Map.Entry<ContextType, Integer> count : counts.entrySet()) {
                if (count.getValue() < 2) {
                    continue;
                }
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("workspace_id", workspaceId);
                details.put("context_type", count.getKey().wireValue());
                details.put("count", count.getValue());
                anomalies.add(new ContextAnomaly(ContextAnomaly.Type.DUPLICATE_ROLE_SAME_WORKSPACE,
                    ContextAnomaly.Severity.HIGH,
                    String.format(Locale.ROOT, "User holds %d %s contexts at %s",
                        count.getValue(), count.getKey().wireValue(), workspaceName),
                    details, now));
            }
        }

        if (recentSwitches > RAPID_SWITCH_THRESHOLD) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("switch_count", recentSwitches);
            anomalies.add(new ContextAnomaly(ContextAnomaly.Type.RAPID_CONTEXT_SWITCHING,
                ContextAnomaly.Severity.HIGH,
                String.format(Locale.ROOT, "%d context switches in the last minute", recentSwitches),
                details, now));
        }

        for (ContextAnomaly anomaly : anomalies) {
            LOGGER.warning(() -> "[rentdesk-sdk] context anomaly " + anomaly.type() + ": " + anomaly.message());
        }
        return List.copyOf(anomalies);
    }

    private static List<String> wireValues(EnumMap<ContextType, Integer> counts) {
        List<String> values = new ArrayList<>();
        for (ContextType type : counts.keySet()) {
            values.add(type.wireValue());
        }
        return values;
    }
}
