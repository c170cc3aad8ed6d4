package dev.rxcache.api;

import com.fasterxml.jackson.databind.JsonNode;
import dev.rxcache.error.NotCachedException;
import dev.rxcache.error.PayloadFormatException;
import dev.rxcache.remote.ConceptStatus;
import dev.rxcache.remote.RemoteClient;
import dev.rxcache.remote.RequestKeys;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Read API over the cache, used by code that derives reports from a completed cache.
 *
 * <p>Every method is a thin projection of one fetch through the wrapped {@link RemoteClient}.
 * Consumers normally pass a cache-only client, so a missing result raises
 * {@link NotCachedException} instead of reaching the network. The orchestrator uses the
 * same projections with a forwarding client while it builds the cache.
 */
public class CacheQueries {
    private final RemoteClient client;
    private final RequestKeys keys;

    public CacheQueries(RemoteClient client, RequestKeys keys) {
        this.client = Objects.requireNonNull(client, "client cannot be null");
        this.keys = Objects.requireNonNull(keys, "keys cannot be null");
    }

    /**
     * @return the cached payload text for {@code requestKey}
     * @throws NotCachedException if the key is absent and the client is cache-only
     */
    public String lookup(String requestKey) {
        return client.fetchText(requestKey);
    }

    public JsonNode historicalConcept(int code) {
        return client.fetch(keys.historicalConcept(code));
    }

    /**
     * Projects the requested attributes out of the code's history record, in request order.
     *
     * @return the attribute values, or empty if the service has no history concept for the code
     */
    public Optional<List<Object>> historicalAttributes(int code, HistoricalAttribute... attributes) {
        JsonNode history = historicalConcept(code).path("rxcuiHistoryConcept");
        JsonNode concept = history.path("rxcuiConcept");
        if (concept.isMissingNode() || concept.isNull()) {
            return Optional.empty();
        }
        List<Object> values = new ArrayList<>(attributes.length);
        for (HistoricalAttribute attribute : attributes) {
            switch (attribute) {
                case NAME:
                    values.add(concept.path("str").asText(null));
                    break;
                case TTY:
                    values.add(concept.path("tty").asText(null));
                    break;
                case STATUS:
                    values.add(concept.path("status").asText(null));
                    break;
                case START:
                    values.add(concept.path("startDate").asText(null));
                    break;
                case END:
                    values.add(concept.path("endDate").asText(null));
                    break;
                case SCDRXCUI:
                    values.add(parseCode(concept.path("scdRxcui").asText("")));
                    break;
                case BOSSRXCUIS:
                    List<Integer> bosses = new ArrayList<>();
                    for (JsonNode boss : elements(history.path("bossConcept"))) {
                        Integer bossCode = parseCode(boss.path("bossRxcui").asText(""));
                        if (bossCode != null) {
                            bosses.add(bossCode);
                        }
                    }
                    values.add(bosses);
                    break;
                default:
                    throw new IllegalArgumentException("Unsupported attribute " + attribute);
            }
        }
        return Optional.of(values);
    }

    public Optional<String> termType(int code) {
        return historicalAttributes(code, HistoricalAttribute.TTY).map(v -> (String) v.get(0));
    }

    public JsonNode allRelated(int code) {
        return client.fetch(keys.allRelated(code));
    }

    /**
     * Groups the codes of an allrelated result by term type, in result order.
     *
     * @throws PayloadFormatException if a group's concept properties are not a list
     */
    public static Map<String, List<Integer>> relatedByTermType(JsonNode allRelated) {
        Map<String, List<Integer>> groups = new LinkedHashMap<>();
        for (JsonNode group : elements(allRelated.path("allRelatedGroup").path("conceptGroup"))) {
            JsonNode properties = group.get("conceptProperties");
            if (properties == null) {
                continue;
            }
            if (!properties.isArray()) {
                throw new PayloadFormatException("Non-list conceptProperties in allrelated result: " + properties, null);
            }
            List<Integer> codes = groups.computeIfAbsent(group.path("tty").asText(), t -> new ArrayList<>());
            for (JsonNode property : properties) {
                codes.add(requireCode(property.path("rxcui"), "allrelated conceptProperties"));
            }
        }
        return groups;
    }

    public static List<Integer> relatedCodes(JsonNode allRelated, Collection<String> termTypes) {
        List<Integer> result = new ArrayList<>();
        relatedByTermType(allRelated).forEach((tty, codes) -> {
            if (termTypes.contains(tty)) {
                result.addAll(codes);
            }
        });
        return result;
    }

    public List<Integer> ingredientsForMultiIngredient(int minCode) {
        return relatedCodes(allRelated(minCode), List.of("IN", "PIN"));
    }

    public List<Integer> drugsForIngredient(int ingredientCode) {
        return relatedCodes(allRelated(ingredientCode), TermTypeCategory.DRUG_TTYS);
    }

    public List<Integer> ingredientsForGenericDrug(int scdCode) {
        return relatedCodes(allRelated(scdCode), List.of("IN"));
    }

    public List<Integer> brandedDrugsForGenericDrug(int scdCode) {
        return relatedCodes(allRelated(scdCode), List.of("SBD", "BPCK"));
    }

    /**
     * @return every NDC code ever associated with the drug, empty if the service knows none
     */
    public Set<String> ndcCodesFor(int drugCode) {
        JsonNode concept = client.fetch(keys.historicalNdcs(drugCode)).path("historicalNdcConcept");
        Set<String> ndcs = new LinkedHashSet<>();
        for (JsonNode time : elements(concept.path("historicalNdcTime"))) {
            for (JsonNode ndcTime : elements(time.path("ndcTime"))) {
                for (JsonNode ndc : elements(ndcTime.path("ndc"))) {
                    ndcs.add(ndc.asText());
                }
            }
        }
        return ndcs;
    }

    public JsonNode classTree(String rootClassId) {
        return client.fetch(keys.classTree(rootClassId));
    }

    /**
     * Walks a class tree depth-first and returns the ids of classes without subclasses,
     * in traversal order.
     */
    public static List<String> leafClassIds(JsonNode classTree) {
        Set<String> leaves = new LinkedHashSet<>();
        collectLeaves(classTree.path("rxclassTree"), leaves);
        return new ArrayList<>(leaves);
    }

    private static void collectLeaves(JsonNode level, Set<String> leaves) {
        for (JsonNode node : elements(level)) {
            JsonNode children = node.path("rxclassTree");
            if (children.isMissingNode() || children.isNull() || children.size() == 0) {
                leaves.add(node.path("rxclassMinConceptItem").path("classId").asText());
            } else {
                collectLeaves(children, leaves);
            }
        }
    }

    /**
     * @return generic drug codes (SCD, GPCK) the VA assigns to the class
     */
    public List<Integer> genericDrugsForVaClass(String classId) {
        JsonNode members = client.fetch(keys.vaClassMembers(classId)).path("drugMemberGroup").path("drugMember");
        List<Integer> codes = new ArrayList<>();
        for (JsonNode member : elements(members)) {
            codes.add(requireCode(member.path("minConcept").path("rxcui"), "class member"));
        }
        return codes;
    }

    public Set<Integer> statusEnumeration(ConceptStatus status) {
        JsonNode codes = client.fetch(keys.statusEnumeration(status)).path("rxcuiList").path("rxcuis");
        Set<Integer> result = new TreeSet<>();
        for (JsonNode code : elements(codes)) {
            result.add(requireCode(code, "status enumeration"));
        }
        return result;
    }

    /**
     * Maps every code of the given categories to its category. A code reported under more
     * than one category keeps the last one requested.
     */
    public Map<Integer, ConceptStatus> codesByStatus(Collection<ConceptStatus> statuses) {
        Map<Integer, ConceptStatus> result = new LinkedHashMap<>();
        for (ConceptStatus status : statuses) {
            for (Integer code : statusEnumeration(status)) {
                result.put(code, status);
            }
        }
        return result;
    }

    public RemoteClient client() {
        return client;
    }

    // RxNav returns a bare object where a one-element list is expected in some responses
    private static Iterable<JsonNode> elements(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return Collections.emptyList();
        }
        return node.isArray() ? node : List.of(node);
    }

    private static int requireCode(JsonNode node, String where) {
        Integer code = node.isMissingNode() || node.isNull() ? null : parseCode(node.asText(""));
        if (code == null) {
            throw new PayloadFormatException("Missing concept code in " + where, null);
        }
        return code;
    }

    private static Integer parseCode(String text) {
        if (text == null || text.isEmpty()) {
            return null;
        }
        try {
            return Integer.valueOf(text);
        } catch (NumberFormatException e) {
            throw new PayloadFormatException("Not a concept code: '" + text + "'", e);
        }
    }
}
