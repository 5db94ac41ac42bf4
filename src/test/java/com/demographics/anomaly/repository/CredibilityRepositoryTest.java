package com.demographics.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ScanCallback;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.demographics.anomaly.config.AerospikeConfig;
import com.demographics.anomaly.exception.PersistenceException;
import com.demographics.anomaly.model.CredibilityRecord;
import com.demographics.anomaly.model.OverallCredibilityRecord;
import com.demographics.anomaly.model.ScoringModel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CredibilityRepositoryTest {

    private static final String NAMESPACE = "demographics_test";

    @Mock private AerospikeClient client;

    private CredibilityRepository repository;

    @BeforeEach
    void setUp() {
        repository = new CredibilityRepository(client, NAMESPACE, new WritePolicy(), new Policy());
    }

    @Test
    void upsertProvider_failedOverallWrite_restoresPreviousEntityRow() {
        Key entityKey = new Key(NAMESPACE, AerospikeConfig.SET_PROVIDER_ENTITY_CRED, "WB|NPL");
        Key overallKey = new Key(NAMESPACE, AerospikeConfig.SET_PROVIDER_CRED, "WB");
        Map<String, Object> previousBins = new HashMap<>();
        previousBins.put("providerId", "WB");
        previousBins.put("score", -3.0);
        Record previous = new Record(previousBins, 1, 0);

        when(client.get(any(Policy.class), any(Key.class)))
                .thenAnswer(invocation -> entityKey.equals(invocation.getArgument(1)) ? previous : null);
        doAnswer(invocation -> {
            if (overallKey.equals(invocation.getArgument(1))) {
                throw new AerospikeException("write timeout");
            }
            return null;
        }).when(client).put(any(WritePolicy.class), any(Key.class), any(Bin[].class));

        assertThatThrownBy(() -> repository.upsertProvider(overall(), List.of(entityRow())))
                .isInstanceOf(PersistenceException.class)
                .satisfies(e -> assertThat(((PersistenceException) e).getUnit()).isEqualTo("credibility:WB"));

        ArgumentCaptor<Bin[]> bins = ArgumentCaptor.forClass(Bin[].class);
        verify(client, times(2)).put(any(WritePolicy.class), eq(entityKey), bins.capture());
        Bin[] restored = bins.getAllValues().get(1);
        assertThat(restored).extracting(b -> b.name).containsExactlyInAnyOrder("providerId", "score");
        verify(client, never()).delete(any(WritePolicy.class), any(Key.class));
    }

    @Test
    void upsertProvider_deletesEntityRowsNoLongerScored() {
        Key keptKey = new Key(NAMESPACE, AerospikeConfig.SET_PROVIDER_ENTITY_CRED, "WB|NPL");
        Key staleKey = new Key(NAMESPACE, AerospikeConfig.SET_PROVIDER_ENTITY_CRED, "WB|BGD");
        stubStoredEntityRows("WB", "NPL", "BGD");
        when(client.get(any(Policy.class), any(Key.class)))
                .thenAnswer(invocation -> staleKey.equals(invocation.getArgument(1)) ? storedRow("BGD") : null);

        repository.upsertProvider(overall(), List.of(entityRow()));

        verify(client).delete(any(WritePolicy.class), eq(staleKey));
        verify(client, never()).delete(any(WritePolicy.class), eq(keptKey));
        verify(client).put(any(WritePolicy.class), eq(keptKey), any(Bin[].class));
    }

    @Test
    void removeProvider_deletesEntityRowsAndOverallRow() {
        Key entityKey = new Key(NAMESPACE, AerospikeConfig.SET_PROVIDER_ENTITY_CRED, "WB|NPL");
        Key overallKey = new Key(NAMESPACE, AerospikeConfig.SET_PROVIDER_CRED, "WB");
        stubStoredEntityRows("WB", "NPL");
        when(client.get(any(Policy.class), any(Key.class))).thenReturn(storedRow("NPL"));

        repository.removeProvider("WB");

        verify(client).delete(any(WritePolicy.class), eq(entityKey));
        verify(client).delete(any(WritePolicy.class), eq(overallKey));
        verify(client, never()).put(any(WritePolicy.class), any(Key.class), any(Bin[].class));
    }

    @Test
    void removeProvider_failedDelete_restoresRowsAlreadyDeleted() {
        Key entityKey = new Key(NAMESPACE, AerospikeConfig.SET_PROVIDER_ENTITY_CRED, "WB|NPL");
        Key overallKey = new Key(NAMESPACE, AerospikeConfig.SET_PROVIDER_CRED, "WB");
        stubStoredEntityRows("WB", "NPL");
        when(client.get(any(Policy.class), any(Key.class))).thenReturn(storedRow("NPL"));
        when(client.delete(any(WritePolicy.class), any(Key.class)))
                .thenAnswer(invocation -> {
                    if (overallKey.equals(invocation.getArgument(1))) {
                        throw new AerospikeException("device overload");
                    }
                    return true;
                });

        assertThatThrownBy(() -> repository.removeProvider("WB"))
                .isInstanceOf(PersistenceException.class);

        verify(client).put(any(WritePolicy.class), eq(entityKey), any(Bin[].class));
    }

    private void stubStoredEntityRows(String providerId, String... entityIds) {
        doAnswer(invocation -> {
            ScanCallback callback = invocation.getArgument(3);
            for (String entityId : entityIds) {
                Map<String, Object> bins = new HashMap<>();
                bins.put("providerId", providerId);
                bins.put("entityId", entityId);
                callback.scanCallback(new Key(NAMESPACE, AerospikeConfig.SET_PROVIDER_ENTITY_CRED,
                        providerId + "|" + entityId), new Record(bins, 1, 0));
            }
            return null;
        }).when(client).scanAll(any(ScanPolicy.class), eq(NAMESPACE), eq(AerospikeConfig.SET_PROVIDER_ENTITY_CRED),
                any(ScanCallback.class), any(String[].class));
    }

    private static Record storedRow(String entityId) {
        Map<String, Object> bins = new HashMap<>();
        bins.put("providerId", "WB");
        bins.put("entityId", entityId);
        bins.put("score", -2.0);
        return new Record(bins, 1, 0);
    }

    private static OverallCredibilityRecord overall() {
        return OverallCredibilityRecord.builder()
                .providerId("WB")
                .model(ScoringModel.PENALTY)
                .score(-1.0)
                .normalizedWeight(0.4)
                .entityCount(1)
                .anomalyCount(2)
                .computedAt(1_000L)
                .build();
    }

    private static CredibilityRecord entityRow() {
        return CredibilityRecord.builder()
                .providerId("WB")
                .entityId("NPL")
                .model(ScoringModel.PENALTY)
                .score(-1.0)
                .weight(1.0)
                .anomalyCount(2)
                .computedAt(1_000L)
                .build();
    }
}
