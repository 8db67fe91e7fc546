package com.chatops.faq.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import com.chatops.faq.config.AerospikeConfig;
import com.chatops.faq.exception.PersistenceException;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.OptionalInt;

/**
 * Single persisted integer: the index of the last reviewer handed a review.
 */
@Repository
public class RotationCursorRepository {

    static final String CURSOR_KEY = "last_reviewer_index";
    private static final String BIN_INDEX = "index";

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    public RotationCursorRepository(AerospikeClient client,
                                    @Qualifier("aerospikeNamespace") String namespace,
                                    @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                    @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    public OptionalInt read() {
        try {
            Record record = client.get(readPolicy, key());
            if (record == null || record.getValue(BIN_INDEX) == null) {
                return OptionalInt.empty();
            }
            return OptionalInt.of(record.getInt(BIN_INDEX));
        } catch (AerospikeException e) {
            throw new PersistenceException("Failed to read reviewer rotation cursor", e);
        }
    }

    public void save(int index) {
        try {
            client.put(writePolicy, key(), new Bin(BIN_INDEX, index));
        } catch (AerospikeException e) {
            throw new PersistenceException("Failed to save reviewer rotation cursor", e);
        }
    }

    private Key key() {
        return new Key(namespace, AerospikeConfig.SET_REVIEWER_ROTATION, CURSOR_KEY);
    }
}
