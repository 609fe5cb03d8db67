package com.flagship.budget_reconciliation.polog;

import lombok.Value;

@Value
public class ContactCandidate {
    String name;
    String vendorType;
}
