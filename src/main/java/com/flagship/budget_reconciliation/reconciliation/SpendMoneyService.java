package com.flagship.budget_reconciliation.reconciliation;

import com.flagship.budget_reconciliation.persistence.Filter;
import com.flagship.budget_reconciliation.persistence.RecordKind;
import com.flagship.budget_reconciliation.persistence.RecordStore;
import com.flagship.budget_reconciliation.persistence.StoredRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Keeps the SpendMoney record of a receipt-backed detail item in step with its
 * receipt match.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SpendMoneyService {

    static final String DRAFT = "DRAFT";
    static final String AUTHORIZED = "AUTHORIZED";

    private final RecordStore store;
    private final ReferenceDataResolver referenceData;

    /**
     * Creates the SpendMoney record at the item's key, or updates only its state
     * when it already exists.
     *
     * @param authorized whether the receipt matched the item
     */
    @Transactional
    public Optional<StoredRecord> upsert(StoredRecord item, boolean authorized) {
        String state = authorized ? AUTHORIZED : DRAFT;
        List<Filter> key = Filter.from(item.getFields(), RecordKind.SPEND_MONEY.naturalKey());

        Optional<StoredRecord> existing = store.findOne(RecordKind.SPEND_MONEY, key);
        if (existing.isPresent()) {
            Map<String, Object> change = Map.of("state", state);
            if (!store.hasChanges(RecordKind.SPEND_MONEY, existing.get().getId(), change)) {
                return existing;
            }
            log.info("SpendMoney {} state {} -> {}",
                existing.get().naturalKeyString(), existing.get().getString("state"), state);
            return store.update(RecordKind.SPEND_MONEY, existing.get().getId(), change);
        }

        int projectNumber = item.getInteger("project_number");
        Map<String, Object> fields = new LinkedHashMap<>(item.naturalKey());
        fields.put("amount", item.getDecimal("sub_total"));
        fields.put("description", item.getString("description"));
        fields.put("state", state);
        fields.put("transaction_date", item.getDate("transaction_date"));
        fields.put("tax_code", referenceData.taxCodeFor(projectNumber, item.getString("account_code")));
        fields.put("contact_id", referenceData.contactIdFor(projectNumber, item.getInteger("po_number")));

        Optional<StoredRecord> created = store.create(RecordKind.SPEND_MONEY, fields, RecordKind.SPEND_MONEY.naturalKey());
        if (created.isEmpty()) {
            log.warn("Could not create SpendMoney for detail item {}", item.naturalKeyString());
        }
        return created;
    }
}
