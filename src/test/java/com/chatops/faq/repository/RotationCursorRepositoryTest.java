package com.chatops.faq.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import com.chatops.faq.config.AerospikeConfig;
import com.chatops.faq.exception.PersistenceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RotationCursorRepositoryTest {

    @Mock private AerospikeClient client;

    private RotationCursorRepository repository;
    private final Key cursorKey = new Key("test", AerospikeConfig.SET_REVIEWER_ROTATION, "last_reviewer_index");

    @BeforeEach
    void setUp() {
        repository = new RotationCursorRepository(client, "test", new WritePolicy(), new Policy());
    }

    @Test
    void read_absent_isEmpty() {
        when(client.get(any(Policy.class), eq(cursorKey))).thenReturn(null);

        assertThat(repository.read()).isEmpty();
    }

    @Test
    void read_storedValue() {
        when(client.get(any(Policy.class), eq(cursorKey)))
                .thenReturn(new Record(Map.<String, Object>of("index", 2L), 1, 0));

        assertThat(repository.read()).hasValue(2);
    }

    @Test
    void save_writesIndexBin() {
        repository.save(3);

        verify(client).put(any(WritePolicy.class), eq(cursorKey), eq(new Bin("index", 3)));
    }

    @Test
    void readFailure_wrapped() {
        when(client.get(any(Policy.class), eq(cursorKey))).thenThrow(new AerospikeException(ResultCode.TIMEOUT));

        assertThatThrownBy(() -> repository.read()).isInstanceOf(PersistenceException.class);
    }
}
