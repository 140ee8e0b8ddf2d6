package com.entigraph.controller.rest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.entigraph.entity.guid.GuidCodec;
import com.entigraph.service.core.pipeline.TelemetryPipeline;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class EventPublishControllerTest {

    private static final String CLUSTER_EVENT =
            """
            {"eventType":"KafkaClusterSample","clusterName":"prod-kafka","accountId":42,
             "cluster":{"activeControllerCount":1}}
            """;

    private final EngineStack stack = new EngineStack();

    @Test
    void processesSingleEventInline() throws Exception {
        MockMvc mvc = mvc(stack.pipeline);

        mvc.perform(post("/api/events").contentType(MediaType.APPLICATION_JSON).content(CLUSTER_EVENT))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.entityGuid").value(GuidCodec.encode(42, "INFRA", "MESSAGE_QUEUE_CLUSTER", "prod-kafka")))
                .andExpect(jsonPath("$.relationships").value(1))
                .andExpect(jsonPath("$.deadLettered").value(false));

        assertThat(stack.store.entityCount()).isEqualTo(1);
        assertThat(stack.store.relationshipCount()).isEqualTo(1);
    }

    @Test
    void reportsNoMatchWhenIdentifierIsMissing() throws Exception {
        mvc(stack.pipeline)
                .perform(post("/api/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"eventType\":\"KafkaClusterSample\",\"accountId\":42}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.noMatch").value("IDENTIFIER_UNRESOLVED"));

        assertThat(stack.store.entityCount()).isZero();
    }

    @Test
    void rejectsNonObjectBody() throws Exception {
        mvc(stack.pipeline)
                .perform(post("/api/events").contentType(MediaType.APPLICATION_JSON).content("[1,2]"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("event body must be a JSON object"))
                .andExpect(jsonPath("$.path").value("/api/events"));
    }

    @Test
    void rejectsUnparseableTimestamp() throws Exception {
        mvc(stack.pipeline)
                .perform(post("/api/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"eventType\":\"KafkaClusterSample\",\"timestamp\":\"yesterday\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void queuesBatchAfterMappingEveryEvent() throws Exception {
        TelemetryPipeline pipeline = mock(TelemetryPipeline.class);
        when(pipeline.submit(any())).thenReturn(true);

        mvc(pipeline)
                .perform(post("/api/events/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[" + CLUSTER_EVENT + "," + CLUSTER_EVENT + "]"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.accepted").value(2));

        verify(pipeline, times(2)).submit(any());
    }

    @Test
    void reportsPartialBatchWhenPipelineStopsAccepting() throws Exception {
        TelemetryPipeline pipeline = mock(TelemetryPipeline.class);
        when(pipeline.submit(any())).thenReturn(true, false);

        mvc(pipeline)
                .perform(post("/api/events/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[" + CLUSTER_EVENT + "," + CLUSTER_EVENT + "," + CLUSTER_EVENT + "]"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.accepted").value(1))
                .andExpect(jsonPath("$.rejected").value(2));

        verify(pipeline, times(2)).submit(any());
    }

    @Test
    void rejectsWholeBatchWhenOneEventIsInvalid() throws Exception {
        TelemetryPipeline pipeline = mock(TelemetryPipeline.class);

        mvc(pipeline)
                .perform(post("/api/events/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[" + CLUSTER_EVENT + ",\"oops\"]"))
                .andExpect(status().isBadRequest());

        verify(pipeline, never()).submit(any());
    }

    private MockMvc mvc(TelemetryPipeline pipeline) {
        return MockMvcBuilders.standaloneSetup(new EventPublishController(pipeline, stack.mapper))
                .setControllerAdvice(new RestErrorHandler())
                .build();
    }
}
