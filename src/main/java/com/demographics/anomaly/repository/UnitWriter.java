package com.demographics.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.Value;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import com.demographics.anomaly.exception.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes a logical unit of records all-or-nothing. If any put or delete fails, the
 * keys of the unit already written are deleted again (or restored to their
 * previous bins for upserts and deletes) before a {@link PersistenceException} is
 * thrown.
 */
class UnitWriter {

    private static final Logger log = LoggerFactory.getLogger(UnitWriter.class);

    record PendingWrite(Key key, Bin[] bins) {}

    private final AerospikeClient client;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    UnitWriter(AerospikeClient client, WritePolicy writePolicy, Policy readPolicy) {
        this.client = client;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    /** Insert-only unit: rollback deletes what was written. */
    void insert(String unit, List<PendingWrite> writes) {
        write(unit, writes, List.of(), false);
    }

    /**
     * Upsert unit that also deletes keys the unit no longer produces. Rollback puts
     * back what each overwritten or deleted key held before.
     */
    void replace(String unit, List<PendingWrite> writes, List<Key> deletes) {
        write(unit, writes, deletes, true);
    }

    private void write(String unit, List<PendingWrite> writes, List<Key> deletes, boolean restorePrevious) {
        Map<Key, Record> previous = new LinkedHashMap<>();
        List<Key> touched = new ArrayList<>(writes.size() + deletes.size());
        try {
            for (PendingWrite w : writes) {
                if (restorePrevious) {
                    previous.put(w.key(), client.get(readPolicy, w.key()));
                }
                client.put(writePolicy, w.key(), w.bins());
                touched.add(w.key());
            }
            for (Key key : deletes) {
                Record before = client.get(readPolicy, key);
                if (before == null) continue;
                previous.put(key, before);
                client.delete(writePolicy, key);
                touched.add(key);
            }
        } catch (AerospikeException e) {
            log.error("Write of unit {} failed after {}/{} records, rolling back",
                    unit, touched.size(), writes.size() + deletes.size(), e);
            rollback(unit, touched, previous);
            throw new PersistenceException(unit, e.getMessage(), e);
        }
    }

    private void rollback(String unit, List<Key> touched, Map<Key, Record> previous) {
        for (Key key : touched) {
            Record before = previous.get(key);
            try {
                if (before == null) {
                    client.delete(writePolicy, key);
                } else {
                    client.put(writePolicy, key, toBins(before));
                }
            } catch (AerospikeException e) {
                log.error("Rollback of unit {} could not revert key {}", unit, key.userKey, e);
            }
        }
    }

    private static Bin[] toBins(Record record) {
        List<Bin> bins = new ArrayList<>(record.bins.size());
        record.bins.forEach((name, value) -> bins.add(new Bin(name, Value.get(value))));
        return bins.toArray(new Bin[0]);
    }
}
