package com.flagship.budget_reconciliation.reconciliation;

import com.flagship.budget_reconciliation.persistence.Filter;
import com.flagship.budget_reconciliation.persistence.RecordKind;
import com.flagship.budget_reconciliation.persistence.RecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Lookups against reference data needed when building downstream bookkeeping records.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReferenceDataResolver {

    private final RecordStore store;

    /**
     * Tax account code for a detail line's account code.
     *
     * Follows project -> budget map -> account code -> tax account. Any missing
     * link falls back to the line's own account code.
     */
    public String taxCodeFor(int projectNumber, String accountCode) {
        if (accountCode == null || accountCode.isBlank()) {
            return accountCode;
        }
        Optional<Long> budgetMapId = store.findOne(RecordKind.PROJECT, Filter.eq("project_number", projectNumber))
            .map(project -> project.getLong("budget_map_id"));
        if (budgetMapId.isEmpty()) {
            log.debug("Project {} has no budget map; using account code {}", projectNumber, accountCode);
            return accountCode;
        }

        return store.findOne(RecordKind.ACCOUNT_CODE,
                Filter.eq("code", accountCode),
                Filter.eq("budget_map_id", budgetMapId.get()))
            .map(code -> code.getLong("tax_id"))
            .flatMap(taxId -> store.findById(RecordKind.TAX_ACCOUNT, taxId))
            .map(tax -> tax.getString("tax_code"))
            .orElse(accountCode);
    }

    /**
     * Contact linked to the purchase order, if any.
     */
    public Long contactIdFor(int projectNumber, int poNumber) {
        return store.findOne(RecordKind.PURCHASE_ORDER,
                Filter.eq("project_number", projectNumber),
                Filter.eq("po_number", poNumber))
            .map(po -> po.getLong("contact_id"))
            .orElse(null);
    }
}
