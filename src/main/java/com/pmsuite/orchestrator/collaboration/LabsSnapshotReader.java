package com.pmsuite.orchestrator.collaboration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pmsuite.orchestrator.proxy.BackendService;
import com.pmsuite.orchestrator.proxy.ServiceProxy;
import com.pmsuite.orchestrator.tenant.OrganizationContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads the current labs and researchers from the Labs backend.
 *
 * The backend's field names vary between versions, so both spellings are
 * accepted: "domain" or "focus_area" for the focus, "orchestrator_org_id"
 * or "organization_id" for the owner, and an "expertise" list or a
 * comma-separated "field" for researcher tags.
 */
@Slf4j
@Component
public class LabsSnapshotReader {

    static final String LABS_PATH = "/labs";
    static final String RESEARCHERS_PATH = "/researchers";

    private final ServiceProxy serviceProxy;
    private final ObjectMapper objectMapper;

    public LabsSnapshotReader(ServiceProxy serviceProxy, ObjectMapper objectMapper) {
        this.serviceProxy = serviceProxy;
        this.objectMapper = objectMapper;
    }

    public Mono<LabsSnapshot> read(OrganizationContext context) {
        return Mono.zip(
                        serviceProxy.get(BackendService.LABS, LABS_PATH, context),
                        serviceProxy.get(BackendService.LABS, RESEARCHERS_PATH, context))
                .map(responses -> new LabsSnapshot(
                        parseLabs(responses.getT1().bodyAsJson(objectMapper)),
                        parseResearchers(responses.getT2().bodyAsJson(objectMapper))));
    }

    List<Lab> parseLabs(JsonNode body) {
        List<Lab> labs = new ArrayList<>();
        for (JsonNode node : items(body, "labs")) {
            String id = text(node, "id");
            if (id == null) {
                log.warn("Ignoring lab without id from Labs backend");
                continue;
            }
            labs.add(new Lab(
                    id,
                    text(node, "orchestrator_org_id", "organization_id"),
                    text(node, "name"),
                    text(node, "domain", "focus_area"),
                    text(node, "description")));
        }
        return labs;
    }

    List<Researcher> parseResearchers(JsonNode body) {
        List<Researcher> researchers = new ArrayList<>();
        for (JsonNode node : items(body, "researchers")) {
            String id = text(node, "id");
            if (id == null) {
                log.warn("Ignoring researcher without id from Labs backend");
                continue;
            }
            researchers.add(new Researcher(id, text(node, "lab_id"), text(node, "name"), expertise(node)));
        }
        return researchers;
    }

    private static Set<String> expertise(JsonNode node) {
        Set<String> tags = new LinkedHashSet<>();
        JsonNode expertise = node.get("expertise");
        if (expertise != null && expertise.isArray()) {
            expertise.forEach(tag -> tags.add(tag.asText()));
        }
        String field = text(node, "field");
        if (field != null) {
            tags.addAll(Arrays.asList(field.split(",")));
        }
        return tags;
    }

    private static Iterable<JsonNode> items(JsonNode body, String wrapper) {
        if (body.isArray()) {
            return body;
        }
        JsonNode wrapped = body.get(wrapper);
        if (wrapped != null && wrapped.isArray()) {
            return wrapped;
        }
        return List.of();
    }

    private static String text(JsonNode node, String... fieldNames) {
        for (String fieldName : fieldNames) {
            JsonNode value = node.get(fieldName);
            if (value != null && !value.isNull()) {
                return value.asText();
            }
        }
        return null;
    }
}
