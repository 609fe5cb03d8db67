package com.flagship.budget_reconciliation.batch;

import com.flagship.budget_reconciliation.persistence.Filter;
import com.flagship.budget_reconciliation.persistence.RecordKind;
import com.flagship.budget_reconciliation.persistence.RecordStore;
import com.flagship.budget_reconciliation.persistence.StoredRecord;
import com.flagship.budget_reconciliation.polog.DetailLine;
import com.flagship.budget_reconciliation.reconciliation.DetailItemState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Writes one chunk of parsed detail lines in a single transaction.
 *
 * - a new key is created with the parsed state
 * - an existing non-terminal item gets its content refreshed, never its state
 * - a terminal item is left alone
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DetailItemLoader {

    private final RecordStore store;

    @Transactional
    public LoadCounts loadChunk(List<DetailLine> lines) {
        LoadCounts counts = LoadCounts.empty();
        for (DetailLine line : lines) {
            counts = load(line, counts);
        }
        log.debug("Detail item chunk loaded: size={}, {}", lines.size(), counts);
        return counts;
    }

    private LoadCounts load(DetailLine line, LoadCounts counts) {
        List<Filter> key = Filter.from(line.keyFields(), RecordKind.DETAIL_ITEM.naturalKey());
        Optional<StoredRecord> existing = store.findOne(RecordKind.DETAIL_ITEM, key);

        if (existing.isEmpty()) {
            return store.create(RecordKind.DETAIL_ITEM, line.toCreateFields(), RecordKind.DETAIL_ITEM.naturalKey())
                .isPresent() ? counts.withCreated() : counts.withFailed();
        }

        StoredRecord item = existing.get();
        if (DetailItemState.fromLabel(item.getString("state")).isTerminal()) {
            return counts.withUnchanged();
        }

        Map<String, Object> content = line.contentFields();
        if (!store.hasChanges(RecordKind.DETAIL_ITEM, item.getId(), content)) {
            return counts.withUnchanged();
        }
        if (store.update(RecordKind.DETAIL_ITEM, item.getId(), content).isEmpty()) {
            log.warn("Could not refresh detail item {}", item.naturalKeyString());
            return counts.withFailed();
        }
        return counts.withUpdated();
    }
}
