package com.flagship.budget_reconciliation.batch;

import com.flagship.budget_reconciliation.persistence.Filter;
import com.flagship.budget_reconciliation.persistence.RecordKind;
import com.flagship.budget_reconciliation.persistence.RecordStore;
import com.flagship.budget_reconciliation.persistence.StoredRecord;
import com.flagship.budget_reconciliation.polog.MainItem;
import com.flagship.budget_reconciliation.reconciliation.PaymentType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Writes parsed purchase orders, creating the project row on first sight.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PurchaseOrderLoader {

    private static final List<String> PROJECT_LOOKUP = List.of("project_number");

    private final RecordStore store;

    @Transactional
    public LoadCounts load(int projectNumber, List<MainItem> mainItems, Map<String, Long> contactIds) {
        Long projectId = ensureProject(projectNumber);
        LoadCounts counts = LoadCounts.empty();

        for (MainItem item : mainItems) {
            Map<String, Object> fields = fieldsFor(item, projectId, contactIds);
            List<Filter> key = Filter.from(fields, RecordKind.PURCHASE_ORDER.naturalKey());

            Optional<StoredRecord> existing = store.findOne(RecordKind.PURCHASE_ORDER, key);
            if (existing.isEmpty()) {
                counts = store.create(RecordKind.PURCHASE_ORDER, fields, RecordKind.PURCHASE_ORDER.naturalKey())
                    .isPresent() ? counts.withCreated() : counts.withFailed();
            } else if (store.hasChanges(RecordKind.PURCHASE_ORDER, existing.get().getId(), fields)) {
                counts = store.update(RecordKind.PURCHASE_ORDER, existing.get().getId(), fields)
                    .isPresent() ? counts.withUpdated() : counts.withFailed();
            } else {
                counts = counts.withUnchanged();
            }
        }

        log.info("Purchase orders loaded: project={}, {}", projectNumber, counts);
        return counts;
    }

    private Map<String, Object> fieldsFor(MainItem item, Long projectId, Map<String, Long> contactIds) {
        PaymentType poType = item.getPoType() == PaymentType.PROJ ? PaymentType.INV : item.getPoType();
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("project_number", item.getProjectNumber());
        fields.put("po_number", item.getPoNumber());
        fields.put("description", item.getDescription());
        fields.put("po_type", poType == null ? null : poType.name());
        fields.put("vendor_name", item.getContactName());
        fields.put("amount", item.getAmount());
        fields.put("contact_id", item.getContactName() == null ? null : contactIds.get(item.getContactName().trim()));
        fields.put("project_id", projectId);
        return fields;
    }

    private Long ensureProject(int projectNumber) {
        Optional<StoredRecord> project = store.findOne(RecordKind.PROJECT, Filter.eq("project_number", projectNumber));
        if (project.isEmpty()) {
            project = store.create(RecordKind.PROJECT, Map.of("project_number", projectNumber), PROJECT_LOOKUP);
            project.ifPresent(p -> log.info("Created project {}", projectNumber));
        }
        return project.map(StoredRecord::getId).orElse(null);
    }
}
