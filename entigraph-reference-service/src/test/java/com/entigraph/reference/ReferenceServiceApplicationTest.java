package com.entigraph.reference;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.entigraph.entity.guid.GuidCodec;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest(properties = {"entigraph.expiry.enabled=false", "entigraph.rules.reload-cron=-"})
@AutoConfigureMockMvc
class ReferenceServiceApplicationTest {

    @Autowired
    private MockMvc mvc;

    @Test
    void loadsShippedRulesOnStartup() throws Exception {
        mvc.perform(get("/api/admin/rules"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ruleSets.length()").value(3))
                .andExpect(jsonPath("$.ruleSets[2].name").value("kafka-self-managed"));
    }

    @Test
    void publishedClusterSampleIsReadable() throws Exception {
        String guid = GuidCodec.encode(42, "INFRA", "MESSAGE_QUEUE_CLUSTER", "ctx-kafka");

        mvc.perform(post("/api/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"eventType\":\"KafkaClusterSample\",\"clusterName\":\"ctx-kafka\",\"accountId\":42}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.entityGuid").value(guid));

        mvc.perform(get("/api/entities/{guid}", guid))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tags['kafka.cluster.name'].value").value("ctx-kafka"));
    }
}
