package com.osint.correlation.graph;

import com.osint.correlation.core.model.MergeRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Append-only ledger of entity merges. Records are never modified or removed.
 */
public class MergeLedger {
    private static final Logger log = LoggerFactory.getLogger(MergeLedger.class);

    private final List<MergeRecord> records = new CopyOnWriteArrayList<>();

    public MergeRecord record(MergeRecord mergeRecord) {
        records.add(mergeRecord);
        log.info("merge.recorded source={} target={} confidence={} reason={}",
                mergeRecord.sourceEntityId(), mergeRecord.targetEntityId(),
                mergeRecord.confidence(), mergeRecord.reason());
        return mergeRecord;
    }

    public List<MergeRecord> getAllRecords() {
        return List.copyOf(records);
    }

    public List<MergeRecord> getRecordsForTarget(String targetEntityId) {
        return records.stream()
                .filter(r -> r.targetEntityId().equals(targetEntityId))
                .toList();
    }

    public int size() {
        return records.size();
    }

    /**
     * Every entity merged into {@code entityId}, directly or through earlier merges.
     */
    public List<String> getMergeChain(String entityId) {
        List<String> chain = new ArrayList<>();
        collectMergeChain(entityId, chain);
        return chain;
    }

    private void collectMergeChain(String entityId, List<String> chain) {
        for (MergeRecord record : getRecordsForTarget(entityId)) {
            if (!chain.contains(record.sourceEntityId())) {
                chain.add(record.sourceEntityId());
                collectMergeChain(record.sourceEntityId(), chain);
            }
        }
    }
}
