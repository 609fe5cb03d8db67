package com.flagship.budget_reconciliation.batch;

import com.flagship.budget_reconciliation.persistence.StoredRecord;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Approximate contact-name matching used during ingestion.
 *
 * An exact name wins. Otherwise the first contact (in the given order) whose
 * lowercase name starts with the same character and is at most one insertion,
 * deletion or substitution away.
 */
public final class ContactMatcher {

    private ContactMatcher() {
    }

    public static Optional<StoredRecord> match(String name, List<StoredRecord> contacts) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String wanted = name.trim();
        Optional<StoredRecord> exact = contacts.stream()
            .filter(contact -> wanted.equals(contact.getString("name")))
            .findFirst();
        if (exact.isPresent()) {
            return exact;
        }
        return contacts.stream()
            .filter(contact -> isCloseMatch(wanted, contact.getString("name")))
            .findFirst();
    }

    static boolean isCloseMatch(String candidate, String existing) {
        if (candidate == null || existing == null) {
            return false;
        }
        String a = candidate.trim().toLowerCase(Locale.ROOT);
        String b = existing.trim().toLowerCase(Locale.ROOT);
        if (a.isEmpty() || b.isEmpty() || a.charAt(0) != b.charAt(0)) {
            return false;
        }
        return isOneEditAway(a, b);
    }

    static boolean isOneEditAway(String first, String second) {
        String shorter = first.length() <= second.length() ? first : second;
        String longer = shorter == first ? second : first;
        if (longer.length() - shorter.length() > 1) {
            return false;
        }

        int i = 0;
        int j = 0;
        boolean edited = false;
        while (i < shorter.length() && j < longer.length()) {
            if (shorter.charAt(i) != longer.charAt(j)) {
                if (edited) {
                    return false;
                }
                edited = true;
                if (shorter.length() == longer.length()) {
                    i++;
                }
                j++;
            } else {
                i++;
                j++;
            }
        }
        return true;
    }
}
