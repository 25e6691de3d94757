package openorchestrator.scheduler.api.v1.dto;

import com.fasterxml.jackson.databind.JsonNode;
import openorchestrator.scheduler.TestTriggers;
import openorchestrator.scheduler.model.Trigger;
import openorchestrator.scheduler.server.RouterHandler;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TriggerResponse DTO mapping.
 */
class TriggerResponseTest {

    @Test
    void fromScheduledTrigger_mapsCronAndNextRun() throws Exception {
        Instant next = Instant.parse("2024-03-06T00:00:00Z");
        Trigger trigger = TestTriggers.scheduled("nightly", "0 0 * * *", next)
                .priority(3)
                .schedulerWhitelist(List.of("host-a"))
                .build();

        TriggerResponse response = TriggerResponse.from(trigger);

        assertEquals("SCHEDULED", response.type());
        assertEquals("IDLE", response.status());
        assertEquals("0 0 * * *", response.cron());
        assertEquals(next, response.nextRun());
        assertNull(response.queueName());

        JsonNode json = RouterHandler.mapper().readTree(RouterHandler.mapper().writeValueAsString(response));
        assertEquals("2024-03-06T00:00:00Z", json.get("nextRun").asText());
        assertEquals("host-a", json.get("schedulerWhitelist").get(0).asText());
    }

    @Test
    void fromQueueTrigger_omitsTimeFields() throws Exception {
        Trigger trigger = TestTriggers.queue("batch", "invoices", 5).build();

        TriggerResponse response = TriggerResponse.from(trigger);
        JsonNode json = RouterHandler.mapper().readTree(RouterHandler.mapper().writeValueAsString(response));

        assertEquals("invoices", json.get("queueName").asText());
        assertEquals(5, json.get("minBatchSize").asInt());
        assertFalse(json.has("nextRun"));
        assertFalse(json.has("cron"));
        assertFalse(json.has("lastRun"));
    }

    @Test
    void toggleRequest_requiresEnabled() throws Exception {
        ToggleRequest empty = RouterHandler.mapper().readValue("{}", ToggleRequest.class);
        assertThrows(IllegalArgumentException.class, empty::validate);

        ToggleRequest on = RouterHandler.mapper().readValue("{\"enabled\":true,\"extra\":1}", ToggleRequest.class);
        on.validate();
        assertTrue(on.enabled());
    }
}
