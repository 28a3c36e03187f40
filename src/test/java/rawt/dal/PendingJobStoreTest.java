package rawt.dal;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import rawt.common.EContentType;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for PendingJobStore
 * @since 19/10/2026
 */
class PendingJobStoreTest {

    @TempDir
    Path tempDir;

    private StoreConfig storeConfig;

    @BeforeEach
    void setUp() {
        storeConfig = new StoreConfig(tempDir.resolve("data"));
    }

    private static InputStream bytes(String content) {
        return new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Should store content copy and record")
    void shouldStoreContentAndRecord() throws Exception {
        // Given
        PendingJobStore store = new PendingJobStore(storeConfig);

        // When
        PendingJob job = store.add("job-1", "Invoice", EContentType.DOCUMENT, "application/pdf", bytes("%PDF-1.4"));

        // Then
        assertThat(job.contentFile()).isEqualTo("job-1.pdf");
        assertThat(store.contentPath(job)).exists();
        assertThat(new String(store.readContent(job), StandardCharsets.UTF_8)).isEqualTo("%PDF-1.4");
        assertThat(storeConfig.pendingJobsFile()).exists();
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should list jobs in creation order")
    void shouldListInCreationOrder() throws Exception {
        // Given
        PendingJobStore store = new PendingJobStore(storeConfig);

        // When
        store.add("c", "C", EContentType.RAW, null, bytes("1"));
        store.add("a", "A", EContentType.RAW, null, bytes("2"));
        store.add("b", "B", EContentType.RAW, null, bytes("3"));

        // Then
        assertThat(store.list()).extracting(PendingJob::id).containsExactly("c", "a", "b");
    }

    @Test
    @DisplayName("Should survive a restart in the same order")
    void shouldReloadAfterRestart() throws Exception {
        // Given
        PendingJobStore store = new PendingJobStore(storeConfig);
        store.add("first", "First", EContentType.TEXT, "application/json", bytes("{\"text\":\"x\"}"));
        store.add("second", "Second", EContentType.RAW, null, bytes("raw"));

        // When
        PendingJobStore reloaded = new PendingJobStore(storeConfig);

        // Then
        assertThat(reloaded.list()).extracting(PendingJob::id).containsExactly("first", "second");
        assertThat(reloaded.get("first")).get().extracting(PendingJob::contentType).isEqualTo(EContentType.TEXT);

        // new jobs keep sorting after the reloaded ones
        reloaded.add("third", "Third", EContentType.RAW, null, bytes("raw"));
        assertThat(new PendingJobStore(storeConfig).list()).extracting(PendingJob::id)
                .containsExactly("first", "second", "third");
    }

    @Test
    @DisplayName("Should drop records whose content file is gone")
    void shouldDropRecordsWithMissingContent() throws Exception {
        // Given
        PendingJobStore store = new PendingJobStore(storeConfig);
        PendingJob job = store.add("lost", "Lost", EContentType.RAW, null, bytes("raw"));
        Files.delete(store.contentPath(job));

        // When
        PendingJobStore reloaded = new PendingJobStore(storeConfig);

        // Then
        assertThat(reloaded.size()).isZero();
    }

    @Test
    @DisplayName("Should remove record and content")
    void shouldRemoveRecordAndContent() throws Exception {
        // Given
        PendingJobStore store = new PendingJobStore(storeConfig);
        PendingJob job = store.add("job-1", "Job", EContentType.RAW, null, bytes("raw"));

        // When
        boolean removed = store.remove("job-1");

        // Then
        assertThat(removed).isTrue();
        assertThat(store.contentPath(job)).doesNotExist();
        assertThat(new PendingJobStore(storeConfig).size()).isZero();
        assertThat(store.remove("job-1")).isFalse();
    }

    @Test
    @DisplayName("Should reject duplicate job id")
    void shouldRejectDuplicateId() throws Exception {
        // Given
        PendingJobStore store = new PendingJobStore(storeConfig);
        store.add("job-1", "Job", EContentType.RAW, null, bytes("raw"));

        // When & Then
        assertThatThrownBy(() -> store.add("job-1", "Again", EContentType.RAW, null, bytes("raw")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should fail when content cannot be stored")
    void shouldFailWhenContentCannotBeStored() throws Exception {
        // Given
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "not a directory");
        PendingJobStore store = new PendingJobStore(new StoreConfig(blocker));

        // When & Then
        assertThatThrownBy(() -> store.add("job-1", "Job", EContentType.RAW, null, bytes("raw")))
                .isInstanceOf(StoreException.class)
                .hasMessageContaining("job-1");
        assertThat(store.size()).isZero();
    }

    @Test
    @DisplayName("Should report unreadable records file")
    void shouldReportCorruptRecordsFile() throws Exception {
        // Given
        Files.createDirectories(storeConfig.dataDirectory());
        Files.writeString(storeConfig.pendingJobsFile(), "{not json");

        // When & Then
        assertThatThrownBy(() -> new PendingJobStore(storeConfig)).isInstanceOf(StoreException.class);
    }
}
