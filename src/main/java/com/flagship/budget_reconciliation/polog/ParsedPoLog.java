package com.flagship.budget_reconciliation.polog;

import lombok.Value;

import java.util.List;

/**
 * Output of one parser run. Collections keep file order and are not deduplicated.
 */
@Value
public class ParsedPoLog {
    int projectNumber;
    String filename;
    List<MainItem> mainItems;
    List<DetailLine> detailItems;
    List<ContactCandidate> contacts;
    int rowsRead;
    int rowsSkipped;
}
