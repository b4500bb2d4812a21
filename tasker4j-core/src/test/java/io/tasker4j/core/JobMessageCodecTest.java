package io.tasker4j.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobMessageCodecTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final JobMessageCodec codec = new JobMessageCodec(mapper);

    @Test
    void delayedMessageShouldSurviveEncodeAndDecode() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("to", "a@b.com");
        params.put("count", 3);
        params.put("tags", List.of("x", "y"));
        JobMessage msg = JobMessage.delayed("send-email", params, 1_700_000_000L, RetryPolicy.create(1, 2, 5));

        JobMessage decoded = codec.decode(codec.encode(msg));

        assertThat(decoded).isEqualTo(msg);
    }

    @Test
    void numericParamsShouldBeNarrowedButKeepTheirValue() throws Exception {
        JobMessage msg = JobMessage.immediate("report", Map.of("id", 42L, "big", 5_000_000_000L));

        JobMessage decoded = codec.decode(codec.encode(msg));

        assertThat(decoded.params().get("id")).isInstanceOf(Integer.class);
        assertThat(((Number) decoded.params().get("id")).longValue()).isEqualTo(42L);
        assertThat(decoded.params().get("big")).isEqualTo(5_000_000_000L);
        assertThat(mapper.readTree(codec.encode(decoded))).isEqualTo(mapper.readTree(codec.encode(msg)));
    }

    @Test
    void delayedMessageShouldUseWireFieldNames() throws Exception {
        JobMessage msg = JobMessage.delayed("send-email", Map.of("to", "a@b.com"), 1_700_000_000L, RetryPolicy.of(2, 5));

        JsonNode node = mapper.readTree(codec.encode(msg));

        assertThat(node.get("taskClass").asText()).isEqualTo("send-email");
        assertThat(node.get("taskParams").get("to").asText()).isEqualTo("a@b.com");
        assertThat(node.get("runAt").asLong()).isEqualTo(1_700_000_000L);
        assertThat(node.get("retryAttempts").asInt()).isEqualTo(2);
        assertThat(node.get("retryInterval").asInt()).isEqualTo(5);
        assertThat(node.get("failTimes").asInt()).isZero();
    }

    @Test
    void plainImmediateMessageShouldCarryOnlyClassAndParams() throws Exception {
        JsonNode node = mapper.readTree(codec.encode(JobMessage.immediate("ping", Map.of())));

        assertThat(node.size()).isEqualTo(2);
        assertThat(node.has("taskClass")).isTrue();
        assertThat(node.get("taskParams").isObject()).isTrue();
    }

    @Test
    void immediateMessageWithRetryPolicyShouldCarryRetryFieldsButNoRunAt() throws Exception {
        JsonNode node = mapper.readTree(codec.encode(JobMessage.immediate("ping", Map.of(), RetryPolicy.of(3, 10))));

        assertThat(node.has("runAt")).isFalse();
        assertThat(node.get("retryAttempts").asInt()).isEqualTo(3);
        assertThat(node.get("retryInterval").asInt()).isEqualTo(10);
    }

    @Test
    void decodeShouldAcceptNumericStringsAndEmptyParamsArray() {
        JobMessage msg = codec.decode(
                "{\"taskClass\":\"x\",\"taskParams\":[],\"runAt\":\"1700000000\",\"retryAttempts\":\"2\",\"retryInterval\":5}");

        assertThat(msg.params()).isEmpty();
        assertThat(msg.runAt()).isEqualTo(1_700_000_000L);
        assertThat(msg.retryAttempts()).isEqualTo(2);
        assertThat(msg.retryIntervalSeconds()).isEqualTo(5);
        assertThat(msg.failTimes()).isZero();
    }

    @Test
    void decodeShouldRejectUnusablePayloads() {
        for (String bad : new String[]{
                "",
                "not json",
                "[]",
                "{}",
                "{\"taskParams\":{}}",
                "{\"taskClass\":\" \"}",
                "{\"taskClass\":\"x\",\"taskParams\":5}",
                "{\"taskClass\":\"x\",\"runAt\":\"soon\"}"
        }) {
            assertThatThrownBy(() -> codec.decode(bad))
                    .as(bad)
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
