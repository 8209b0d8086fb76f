package com.social.automation.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import com.social.automation.model.ApprovalStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ApprovalRepositoryTest {

    @Mock private AerospikeClient client;

    private ApprovalRepository repository;

    @BeforeEach
    void setUp() {
        repository = new ApprovalRepository(client, "automation", new WritePolicy(), new Policy());
    }

    private static Record pending(int generation) {
        Map<String, Object> bins = new HashMap<>();
        bins.put("approvalId", "A1");
        bins.put("status", "PENDING");
        return new Record(bins, generation, 0);
    }

    @Test
    void approve_writesApproverAndTimestamp() {
        when(client.get(any(Policy.class), any(Key.class))).thenReturn(pending(2));

        assertThat(repository.transitionFromPending("A1", ApprovalStatus.APPROVED, "ops", null, 5_000L)).isTrue();

        ArgumentCaptor<Bin[]> bins = ArgumentCaptor.forClass(Bin[].class);
        verify(client).put(any(WritePolicy.class), any(Key.class), bins.capture());
        Map<String, Object> written = Arrays.stream(bins.getValue())
                .collect(Collectors.toMap(b -> b.name, b -> b.value.getObject()));
        assertThat(written).containsEntry("status", "APPROVED")
                .containsEntry("approvedBy", "ops")
                .containsEntry("approvedAt", 5_000L)
                .doesNotContainKey("reason");
    }

    @Test
    void reject_recordsReasonWithoutApprover() {
        when(client.get(any(Policy.class), any(Key.class))).thenReturn(pending(2));

        assertThat(repository.transitionFromPending("A1", ApprovalStatus.REJECTED, "ops", "off-brand", 5_000L)).isTrue();

        ArgumentCaptor<Bin[]> bins = ArgumentCaptor.forClass(Bin[].class);
        verify(client).put(any(WritePolicy.class), any(Key.class), bins.capture());
        assertThat(Arrays.stream(bins.getValue()).map(b -> b.name))
                .contains("reason")
                .doesNotContain("approvedBy");
    }

    @Test
    void concurrentTransition_losesOnGenerationMismatch() {
        when(client.get(any(Policy.class), any(Key.class))).thenReturn(pending(2));
        doThrow(new AerospikeException(ResultCode.GENERATION_ERROR))
                .when(client).put(any(WritePolicy.class), any(Key.class), any(Bin[].class));

        assertThat(repository.transitionFromPending("A1", ApprovalStatus.AUTO_APPROVED, "system", null, 5_000L))
                .isFalse();
    }
}
