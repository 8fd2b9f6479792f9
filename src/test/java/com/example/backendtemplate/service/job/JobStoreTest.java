package com.example.backendtemplate.service.job;

import com.example.backendtemplate.domain.entity.ScheduledJobRecord;
import com.example.backendtemplate.domain.repository.ScheduledJobRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@DisplayName("JobStore Tests")
class JobStoreTest {

    private static final Instant NEXT_RUN = Instant.parse("2030-01-01T00:00:00Z");

    @Nested
    @DisplayName("InMemoryJobStore Tests")
    class InMemoryJobStoreTests {

        private final InMemoryJobStore store = new InMemoryJobStore();

        @Test
        @DisplayName("Should return copies that do not alias stored state")
        void shouldReturnCopies() {
            // Given
            var job = StoredJob.builder().id("job").cronExpression("* * * * *").nextRunTime(NEXT_RUN).build();
            store.save(job);

            // When
            job.setNextRunTime(Instant.EPOCH);
            store.find("job").orElseThrow().setCronExpression("changed");

            // Then
            var stored = store.find("job").orElseThrow();
            assertThat(stored.getNextRunTime()).isEqualTo(NEXT_RUN);
            assertThat(stored.getCronExpression()).isEqualTo("* * * * *");
        }

        @Test
        @DisplayName("Should remove stored jobs")
        void shouldRemove() {
            store.save(StoredJob.builder().id("a").cronExpression("* * * * *").build());
            store.save(StoredJob.builder().id("b").cronExpression("* * * * *").build());

            store.remove("a");

            assertThat(store.findAll()).extracting(StoredJob::getId).containsExactly("b");
        }
    }

    @Nested
    @ExtendWith(MockitoExtension.class)
    @DisplayName("JpaJobStore Tests")
    class JpaJobStoreTests {

        @Mock
        private ScheduledJobRepository repository;

        @InjectMocks
        private JpaJobStore store;

        @Test
        @DisplayName("Should insert a record for a new job")
        void shouldInsertNewJob() {
            // Given
            when(repository.findById("job")).thenReturn(Optional.empty());

            // When
            store.save(StoredJob.builder().id("job").cronExpression("*/5 * * * *").nextRunTime(NEXT_RUN).build());

            // Then
            var captor = ArgumentCaptor.forClass(ScheduledJobRecord.class);
            verify(repository).save(captor.capture());
            assertThat(captor.getValue().getId()).isEqualTo("job");
            assertThat(captor.getValue().getCronExpression()).isEqualTo("*/5 * * * *");
            assertThat(captor.getValue().getNextRunTime()).isEqualTo(NEXT_RUN);
        }

        @Test
        @DisplayName("Should update the existing record of a job")
        void shouldUpdateExistingJob() {
            // Given
            var existing = ScheduledJobRecord.builder().id("job").cronExpression("old").build();
            when(repository.findById("job")).thenReturn(Optional.of(existing));

            // When
            store.save(StoredJob.builder().id("job").cronExpression("new").nextRunTime(NEXT_RUN)
                    .lastRunTime(Instant.EPOCH).build());

            // Then
            verify(repository).save(existing);
            assertThat(existing.getCronExpression()).isEqualTo("new");
            assertThat(existing.getLastRunTime()).isEqualTo(Instant.EPOCH);
        }

        @Test
        @DisplayName("Should map records to stored jobs")
        void shouldMapRecords() {
            // Given
            when(repository.findAll()).thenReturn(List.of(
                    ScheduledJobRecord.builder().id("job").cronExpression("* * * * *").nextRunTime(NEXT_RUN).build()));

            // When
            var jobs = store.findAll();

            // Then
            assertThat(jobs).singleElement().satisfies(job -> {
                assertThat(job.getId()).isEqualTo("job");
                assertThat(job.getNextRunTime()).isEqualTo(NEXT_RUN);
            });
        }

        @Test
        @DisplayName("Should delete by job id")
        void shouldRemove() {
            store.remove("job");

            verify(repository).deleteById("job");
        }
    }
}
