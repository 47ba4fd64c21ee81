package com.umitunal.batchq.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class BatchTemplatesTest {

    @Test
    @DisplayName("Sync batch should default to NORMAL priority and three retries")
    void testSyncBatch() {
        // When
        List<WorkRequest<String>> requests = BatchTemplates.syncBatch(List.of("a", "b", "c"));

        // Then
        assertThat(requests).hasSize(3);
        assertThat(requests).allSatisfy(request -> {
            assertThat(request.getPriority()).isEqualTo(Priority.NORMAL);
            assertThat(request.getMaxRetries()).isEqualTo(3);
            assertThat(request.getMetadata()).containsEntry("type", BatchTemplates.SYNC);
            assertThat(request.getId()).matches("sync_\\d+_\\d");
        });
        assertThat(requests).extracting(WorkRequest::getPayload).containsExactly("a", "b", "c");
        assertThat(requests.get(2).getMetadata()).containsEntry("originalIndex", 2);
    }

    @Test
    @DisplayName("Import and export batches should carry their retry budgets")
    void testImportExport() {
        List<WorkRequest<Integer>> imports = BatchTemplates.importBatch(List.of(1, 2), Priority.HIGH);
        List<WorkRequest<String>> exports = BatchTemplates.exportBatch(List.of("q"));

        assertThat(imports).allSatisfy(request -> {
            assertThat(request.getPriority()).isEqualTo(Priority.HIGH);
            assertThat(request.getMaxRetries()).isEqualTo(2);
            assertThat(request.getId()).startsWith("import_");
        });
        assertThat(exports.get(0).getMaxRetries()).isEqualTo(1);
        assertThat(exports.get(0).getMetadata()).containsEntry("type", BatchTemplates.EXPORT);
    }

    @Test
    @DisplayName("Ids within one batch should be unique")
    void testUniqueIds() {
        List<WorkRequest<String>> requests = BatchTemplates.syncBatch(List.of("x", "x", "x", "x"));

        assertThat(requests).extracting(WorkRequest::getId).doesNotHaveDuplicates();
    }

    @Test
    @DisplayName("Request builder should validate its input")
    void testRequestValidation() {
        assertThatThrownBy(() -> WorkRequest.of(" ", "p")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> WorkRequest.builder("a", "p").withMaxRetries(0))
                .isInstanceOf(IllegalArgumentException.class);

        WorkRequest<String> request = WorkRequest.of("a", "p");
        assertThat(request.getPriority()).isEqualTo(Priority.NORMAL);
        assertThat(request.getMaxRetries()).isNull();
        assertThat(request.getDependencies()).isEmpty();
    }
}
