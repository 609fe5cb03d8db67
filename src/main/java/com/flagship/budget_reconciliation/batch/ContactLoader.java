package com.flagship.budget_reconciliation.batch;

import com.flagship.budget_reconciliation.persistence.RecordKind;
import com.flagship.budget_reconciliation.persistence.RecordStore;
import com.flagship.budget_reconciliation.persistence.StoredRecord;
import com.flagship.budget_reconciliation.polog.ContactCandidate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves each distinct contact candidate to a stored contact, matching
 * existing contacts approximately and creating the rest.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ContactLoader {

    private static final List<String> LOOKUP = List.of("name");

    private final RecordStore store;

    /**
     * @return contact id per candidate name; names that could not be stored are absent
     */
    @Transactional
    public Map<String, Long> load(List<ContactCandidate> candidates) {
        Map<String, ContactCandidate> distinct = new LinkedHashMap<>();
        for (ContactCandidate candidate : candidates) {
            if (candidate.getName() != null && !candidate.getName().isBlank()) {
                distinct.putIfAbsent(candidate.getName().trim(), candidate);
            }
        }

        List<StoredRecord> known = new ArrayList<>(store.search(RecordKind.CONTACT).records());
        Map<String, Long> ids = new LinkedHashMap<>();
        int created = 0;

        for (Map.Entry<String, ContactCandidate> entry : distinct.entrySet()) {
            String name = entry.getKey();
            Optional<StoredRecord> match = ContactMatcher.match(name, known);
            if (match.isPresent()) {
                if (!name.equals(match.get().getString("name"))) {
                    log.info("Contact '{}' matched existing '{}'", name, match.get().getString("name"));
                }
                ids.put(name, match.get().getId());
                continue;
            }

            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put("name", name);
            fields.put("vendor_type", entry.getValue().getVendorType());
            Optional<StoredRecord> stored = store.create(RecordKind.CONTACT, fields, LOOKUP);
            if (stored.isEmpty()) {
                log.warn("Could not store contact '{}'", name);
                continue;
            }
            known.add(stored.get());
            ids.put(name, stored.get().getId());
            created++;
        }

        log.info("Contacts loaded: distinct={}, created={}", distinct.size(), created);
        return ids;
    }
}
