package blackcap.coordinator.cluster;

import blackcap.coordinator.model.JobStatus;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class StatusVocabularyTest {

    @Test
    void anyFailureWins() {
        assertEquals(Optional.of(JobStatus.FAILED),
                StatusVocabulary.SLURM.fold(List.of("COMPLETED", "RUNNING", "NODE_FAIL")));
    }

    @Test
    void cancelWinsOverSuccess() {
        assertEquals(Optional.of(JobStatus.CANCELLED),
                StatusVocabulary.SLURM.fold(List.of("COMPLETED", "CANCELLED")));
    }

    @Test
    void allSucceeded() {
        assertEquals(Optional.of(JobStatus.SUCCEEDED),
                StatusVocabulary.KUBERNETES.fold(List.of("Succeeded", "Succeeded")));
    }

    @Test
    void partialSuccessIsStillRunning() {
        assertEquals(Optional.of(JobStatus.RUNNING),
                StatusVocabulary.KUBERNETES.fold(List.of("Succeeded", "Pending")));
    }

    @Test
    void onlyQueuedIsScheduled() {
        assertEquals(Optional.of(JobStatus.SCHEDULED),
                StatusVocabulary.LOCAL.fold(List.of("QUEUED", "QUEUED")));
    }

    @Test
    void unknownValuesAreIgnored() {
        assertEquals(Optional.of(JobStatus.RUNNING),
                StatusVocabulary.SLURM.fold(List.of("WEIRD_STATE", "RUNNING")));
        assertTrue(StatusVocabulary.SLURM.fold(List.of("WEIRD_STATE")).isEmpty());
        assertTrue(StatusVocabulary.SLURM.fold(List.<String>of()).isEmpty());
    }

    @Test
    void mappingIsCaseInsensitive() {
        assertEquals(Optional.of(JobStatus.RUNNING), StatusVocabulary.SLURM.map(" running "));
        assertTrue(StatusVocabulary.SLURM.map(null).isEmpty());
    }
}
