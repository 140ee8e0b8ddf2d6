package com.entigraph.controller.rest;

import com.entigraph.entity.guid.GuidCodec;
import com.entigraph.entity.model.EntityIdentity;
import com.entigraph.entity.model.RelationshipRecord;
import com.entigraph.service.core.config.RuleLookup;
import com.entigraph.service.core.config.RuleSnapshot;
import com.entigraph.service.core.pipeline.TelemetryPipeline;
import com.entigraph.service.core.store.EntityStore;
import com.entigraph.service.core.telemetry.EngineTelemetryRegistry;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class EntityQueryController {

    private final EntityStore store;
    private final EngineTelemetryRegistry telemetry;
    private final RuleLookup rules;
    private final TelemetryPipeline pipeline;

    public EntityQueryController(
            EntityStore store, EngineTelemetryRegistry telemetry, RuleLookup rules, TelemetryPipeline pipeline) {
        this.store = store;
        this.telemetry = telemetry;
        this.rules = rules;
        this.pipeline = pipeline;
    }

    @GetMapping("/entities/{guid}")
    public ResponseEntity<EntityView> entity(@PathVariable String guid) {
        GuidCodec.decode(guid);
        return store.findEntity(guid)
                .map(EntityView::of)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/entities/{guid}/relationships")
    public List<RelationshipRecord> relationships(@PathVariable String guid) {
        GuidCodec.decode(guid);
        return store.relationshipsOf(guid);
    }

    @GetMapping("/guids/{guid}")
    public EntityIdentity decode(@PathVariable String guid) {
        return GuidCodec.decode(guid);
    }

    @GetMapping("/engine/stats")
    public Map<String, Object> stats() {
        RuleSnapshot snapshot = rules.snapshot();
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("entities", store.entityCount());
        out.put("relationships", store.relationshipCount());
        out.put("queueDepth", pipeline.queueDepth());
        out.put("ruleVersion", snapshot.version());
        out.put("counters", telemetry.snapshot());
        return out;
    }
}
