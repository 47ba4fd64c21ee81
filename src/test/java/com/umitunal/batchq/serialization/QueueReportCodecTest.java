package com.umitunal.batchq.serialization;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.umitunal.batchq.config.QueueConfig;
import com.umitunal.batchq.core.ItemStatus;
import com.umitunal.batchq.core.Priority;
import com.umitunal.batchq.core.WorkRequest;
import com.umitunal.batchq.error.ErrorType;
import com.umitunal.batchq.error.ProcessingException;
import com.umitunal.batchq.queue.PriorityBatchQueue;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.UncheckedIOException;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class QueueReportCodecTest {

    private PriorityBatchQueue<String> queue;
    private QueueReportCodec codec;

    @BeforeEach
    void setUp() {
        queue = new PriorityBatchQueue<>(QueueConfig.newBuilder().withBatchDelay(0).withMaxRetries(1).build());
        codec = new QueueReportCodec();
    }

    @AfterEach
    void tearDown() {
        queue.close();
    }

    @Test
    @DisplayName("Report should describe stats and items after a run")
    void testReportAfterRun() throws Exception {
        // Given
        queue.add(List.of(
                WorkRequest.builder("ok", "ok").withPriority(Priority.HIGH).withMetadata("source", "crm").build(),
                WorkRequest.of("bad", "bad"),
                WorkRequest.builder("waiting", "w").dependsOn("bad").build()));
        queue.start(item -> {
            if ("bad".equals(item.getPayload())) {
                throw ProcessingException.withStatus(422, "Unprocessable Entity");
            }
            return null;
        });

        // When
        String json = codec.encodeToString(QueueReport.of(queue));
        QueueReport decoded = codec.decode(json);

        // Then
        assertThat(decoded.getStats().getTotal()).isEqualTo(3);
        assertThat(decoded.getStats().getCompleted()).isEqualTo(1);
        assertThat(decoded.getStats().getFailed()).isEqualTo(1);
        assertThat(decoded.getStats().getBlocked()).isEqualTo(1);

        QueueReport.Item bad = decoded.getItems().stream().filter(i -> i.getId().equals("bad")).findFirst().orElseThrow();
        assertThat(bad.getStatus()).isEqualTo(ItemStatus.FAILED);
        assertThat(bad.getErrorType()).isEqualTo(ErrorType.VALIDATION);
        assertThat(bad.getError()).isEqualTo("Unprocessable Entity");

        QueueReport.Item waiting = decoded.getItems().stream().filter(i -> i.getId().equals("waiting")).findFirst().orElseThrow();
        assertThat(waiting.getUnmetDependencies()).containsExactly("bad");

        JsonNode tree = new ObjectMapper().readTree(json);
        assertThat(tree.get("items").get(0).get("metadata").get("source").asText()).isEqualTo("crm");
        assertThat(tree.get("items").get(0).has("payload")).isFalse();
    }

    @Test
    @DisplayName("Bytes and string encodings should decode alike")
    void testBytesEncoding() {
        // Given
        queue.addItem(WorkRequest.of("a", "a"));
        QueueReport report = QueueReport.of(queue);

        // When
        QueueReport fromBytes = codec.decode(codec.encode(report));

        // Then
        assertThat(fromBytes.getGeneratedAt()).isEqualTo(report.getGeneratedAt());
        assertThat(fromBytes.getItems()).hasSize(1);
        assertThat(fromBytes.getItems().get(0).getStatus()).isEqualTo(ItemStatus.PENDING);
        assertThat(fromBytes.getItems().get(0).getPriority()).isEqualTo(Priority.NORMAL);
    }

    @Test
    @DisplayName("Decoding should ignore unknown fields and reject malformed input")
    void testDecodeLeniencyAndErrors() {
        QueueReport report = codec.decode("{\"generatedAt\":1,\"extra\":true,\"items\":[]}");
        assertThat(report.getGeneratedAt()).isEqualTo(1);
        assertThat(report.getItems()).isEmpty();

        assertThatThrownBy(() -> codec.decode("{not json"))
                .isInstanceOf(UncheckedIOException.class);
    }
}
