package com.entigraph.controller.rest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class RuleAdminControllerTest {

    private final EngineStack stack = new EngineStack();
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        mvc = MockMvcBuilders.standaloneSetup(new RuleAdminController(stack.rules, stack.coordinator, stack.ingest))
                .setControllerAdvice(new RestErrorHandler())
                .build();
    }

    @Test
    void describesActiveRules() throws Exception {
        mvc.perform(get("/api/admin/rules"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.version").value(1))
                .andExpect(jsonPath("$.ruleSets[0].name").value("kafka-rest"))
                .andExpect(jsonPath("$.ruleSets[0].provider").value("kafka-self-managed"))
                .andExpect(jsonPath("$.ruleSets[0].synthesisRules[0]").value("kafka-rest/cluster"))
                .andExpect(jsonPath("$.ruleSets[0].relationshipRules[0]").value("kafka-rest/account-manages-cluster"));
    }

    @Test
    void forcedReloadBumpsVersion() throws Exception {
        mvc.perform(post("/api/admin/rules/reload"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("LOADED"))
                .andExpect(jsonPath("$.version").value(2))
                .andExpect(jsonPath("$.ruleSets").value(1));
    }

    @Test
    void appliesNewRuleSet() throws Exception {
        String body =
                """
                {"ruleSet":"hosts","eventTypes":["SystemSample"],
                 "synthesis":[{"name":"host","domain":"INFRA","type":"HOST","identifier":{"attribute":"hostname"}}]}
                """;

        mvc.perform(post("/api/admin/rules").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ruleSet").value("hosts"))
                .andExpect(jsonPath("$.synthesisRules").value(1))
                .andExpect(jsonPath("$.version").value(2));

        assertThat(stack.rules.synthesisRules("SystemSample")).hasSize(1);
        assertThat(stack.rules.synthesisRules("KafkaClusterSample")).hasSize(1);
    }

    @Test
    void invalidRuleSetIsUnprocessableAndKeepsRules() throws Exception {
        String body =
                """
                {"ruleSet":"broken","eventTypes":["SystemSample"],
                 "synthesis":[{"name":"host","domain":"infra","type":"HOST","identifier":{"attribute":"hostname"}}]}
                """;

        mvc.perform(post("/api/admin/rules").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.status").value(422));

        assertThat(stack.rules.snapshot().version()).isEqualTo(1);
        assertThat(stack.rules.synthesisRules("SystemSample")).isEmpty();
    }
}
