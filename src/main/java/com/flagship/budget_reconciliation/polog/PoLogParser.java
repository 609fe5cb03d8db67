package com.flagship.budget_reconciliation.polog;

import com.flagship.budget_reconciliation.reconciliation.DetailItemState;
import com.flagship.budget_reconciliation.reconciliation.PaymentType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.MalformedInputException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses a tab-delimited PO log into main items, detail lines and contact candidates.
 *
 * Row handling is independent per row, apart from the per-(po, detail) line
 * counter and the per-PO main item accumulation. Any field that cannot be read
 * degrades to a default with a warning; a bad row never aborts the file.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PoLogParser {

    static final int COLUMN_COUNT = 11;
    static final String UNKNOWN_PROJECT = "0000";

    private static final int COL_DATE = 0;
    private static final int COL_TYPE = 1;
    private static final int COL_PAY_ID = 2;
    private static final int COL_ACCOUNT = 3;
    private static final int COL_ITEM_ID = 4;
    private static final int COL_VENDOR = 5;
    private static final int COL_DESCRIPTION = 6;
    private static final int COL_PO = 7;
    private static final int COL_FACTORS = 8;
    private static final int COL_SUBTOTAL = 9;
    private static final int COL_FRINGES = 10;

    private static final Pattern FILENAME = Pattern.compile(
        "^PO_LOG_(\\d{4})[-_]\\d{4}-\\d{2}-\\d{2}_\\d{2}-\\d{2}-\\d{2}\\.txt$");
    private static final Pattern NET_TERMS = Pattern.compile("^NET(\\d+)$");

    // Two-digit years 69-99 read as 19xx, 00-68 as 20xx. Strict: 2/30 is rejected, not clamped.
    private static final DateTimeFormatter LOG_DATE = new DateTimeFormatterBuilder()
        .appendPattern("M/d/")
        .appendValueReduced(ChronoField.YEAR, 2, 2, 1969)
        .toFormatter(Locale.ROOT)
        .withResolverStyle(ResolverStyle.STRICT);

    private final Clock clock;

    /**
     * Parses the file at {@code path}. The project number comes from the file name.
     *
     * @throws IOException if the file cannot be read
     */
    public ParsedPoLog parse(Path path) throws IOException {
        String filename = path.getFileName().toString();
        List<String> lines = readLines(path);
        log.info("Parsing PO log: file={}, lines={}", filename, lines.size());
        return parse(filename, lines);
    }

    /**
     * Parses already-read lines. The first line is the header.
     */
    public ParsedPoLog parse(String filename, List<String> lines) {
        int projectNumber = Integer.parseInt(projectNumberFrom(filename));
        LocalDate today = LocalDate.now(clock);

        Map<Integer, MainItemAccumulator> mainItems = new LinkedHashMap<>();
        List<DetailLine> detailItems = new ArrayList<>();
        List<ContactCandidate> contacts = new ArrayList<>();
        Map<String, Integer> lineCounters = new HashMap<>();
        int skipped = 0;

        for (int i = 1; i < lines.size(); i++) {
            String[] row = normalizeRow(lines.get(i));
            if (row == null || "DATE".equals(row[COL_DATE].toUpperCase(Locale.ROOT))) {
                continue;
            }
            DetailLine line = parseRow(row, i + 1, projectNumber, today, lineCounters);
            if (line == null) {
                skipped++;
                continue;
            }
            detailItems.add(line);

            ContactCandidate contact = contactFor(line, row[COL_VENDOR]);
            contacts.add(contact);

            mainItems.computeIfAbsent(line.getPoNumber(), po -> new MainItemAccumulator(line, contact))
                .add(line);
        }

        List<MainItem> builtMainItems = mainItems.values().stream()
            .map(MainItemAccumulator::build)
            .toList();

        log.info("Parsed PO log: file={}, project={}, mainItems={}, detailItems={}, skippedRows={}",
            filename, projectNumber, builtMainItems.size(), detailItems.size(), skipped);

        return new ParsedPoLog(projectNumber, filename, builtMainItems, List.copyOf(detailItems),
            List.copyOf(contacts), Math.max(0, lines.size() - 1), skipped);
    }

    /**
     * Four-digit project number embedded in the file name, or "0000" when the name
     * does not follow the PO_LOG convention.
     */
    public static String projectNumberFrom(String filename) {
        Matcher matcher = FILENAME.matcher(filename);
        if (matcher.matches()) {
            return matcher.group(1);
        }
        log.warn("File name {} does not match the PO log pattern; using project {}", filename, UNKNOWN_PROJECT);
        return UNKNOWN_PROJECT;
    }

    /**
     * Splits, trims and pads or truncates to exactly 11 columns. Returns null for
     * a row whose fields are all blank.
     */
    static String[] normalizeRow(String line) {
        String[] raw = line.split("\t", -1);
        String[] row = new String[COLUMN_COUNT];
        boolean anyValue = false;
        for (int c = 0; c < COLUMN_COUNT; c++) {
            row[c] = c < raw.length ? raw[c].trim() : "";
            anyValue |= !row[c].isEmpty();
        }
        return anyValue ? row : null;
    }

    private DetailLine parseRow(String[] row, int rowNumber, int projectNumber, LocalDate today,
                                Map<String, Integer> lineCounters) {
        String rawType = row[COL_TYPE];
        if (row[COL_DATE].isEmpty() || rawType.isEmpty()) {
            log.debug("Row {} skipped: missing date or payment type", rowNumber);
            return null;
        }
        PaymentType paymentType = PaymentType.fromLogCode(rawType);
        String rawPo = row[COL_PO];
        if (rawPo.isEmpty() && paymentType != PaymentType.PC) {
            log.debug("Row {} skipped: no PO number", rowNumber);
            return null;
        }

        Integer poNumber = paymentType == PaymentType.PC ? Integer.valueOf(1) : parseInteger(stripLeadingZeros(rawPo));
        if (poNumber == null) {
            log.warn("Row {} skipped: PO number '{}' is not numeric", rowNumber, rawPo);
            return null;
        }

        String payId = row[COL_PAY_ID].toUpperCase(Locale.ROOT);
        LocalDate transactionDate = parseDate(row[COL_DATE], rowNumber, today);
        BigDecimal subtotal = parseAmount(row[COL_SUBTOTAL], "subtotal", rowNumber);
        BigDecimal fringes = parseAmount(row[COL_FRINGES], "fringes", rowNumber);
        Factors factors = parseFactors(row[COL_FACTORS], subtotal, rowNumber);
        StatusAndDueDate status = deriveStatus(payId, paymentType, transactionDate, today);

        int detailNumber;
        int lineNumber;
        String itemId = stripLeadingZeros(row[COL_ITEM_ID]);
        if (paymentType == PaymentType.PC) {
            detailNumber = envelopeNumber(payId);
            Integer parsedLine = parseInteger(itemId);
            lineNumber = parsedLine == null ? 1 : parsedLine;
        } else {
            Integer parsedDetail = parseInteger(itemId.isEmpty() ? "1" : itemId);
            detailNumber = parsedDetail == null ? 1 : parsedDetail;
            lineNumber = lineCounters.merge(poNumber + ":" + detailNumber, 1, Integer::sum);
        }

        return DetailLine.builder()
            .projectNumber(projectNumber)
            .poNumber(poNumber)
            .detailNumber(detailNumber)
            .lineNumber(lineNumber)
            .paymentType(paymentType)
            .state(status.state())
            .payId(payId)
            .accountCode(emptyToNull(stripLeadingZeros(row[COL_ACCOUNT])))
            .vendor(emptyToNull(row[COL_VENDOR]))
            .description(row[COL_DESCRIPTION])
            .transactionDate(transactionDate)
            .dueDate(status.dueDate())
            .quantity(factors.getQuantity())
            .rate(factors.getRate())
            .ot(factors.getOt())
            .fringes(fringes)
            .subTotal(subtotal)
            .build();
    }

    /**
     * Status and due date from the pay-status code, evaluated in rule order.
     */
    static StatusAndDueDate deriveStatus(String payId, PaymentType paymentType,
                                         LocalDate transactionDate, LocalDate today) {
        if (paymentType.isReceiptBacked()) {
            return new StatusAndDueDate(DetailItemState.SUBMITTED, transactionDate);
        }
        boolean invoice = paymentType == PaymentType.INV;
        if (invoice && "RTP".equals(payId)) {
            return new StatusAndDueDate(DetailItemState.RTP, today);
        }
        if (invoice && "NET0".equals(payId)) {
            return new StatusAndDueDate(DetailItemState.RTP, transactionDate);
        }
        Matcher net = NET_TERMS.matcher(payId);
        if (invoice && net.matches()) {
            return new StatusAndDueDate(DetailItemState.RTP, transactionDate.plusDays(Long.parseLong(net.group(1))));
        }
        if (invoice && "PAID".equals(payId)) {
            return new StatusAndDueDate(DetailItemState.PAID, today);
        }
        if (invoice) {
            return new StatusAndDueDate(DetailItemState.PENDING, transactionDate.plusDays(30));
        }
        return new StatusAndDueDate(DetailItemState.PENDING, transactionDate);
    }

    /**
     * Petty-cash envelope number: the last underscore-delimited segment of the pay
     * id when it has at least three segments, else 0.
     */
    static int envelopeNumber(String payId) {
        String[] parts = payId.split("_");
        if (parts.length < 3) {
            return 0;
        }
        Integer envelope = parseInteger(stripLeadingZeros(parts[parts.length - 1]));
        return envelope == null ? 0 : envelope;
    }

    private static ContactCandidate contactFor(DetailLine line, String vendor) {
        return switch (line.getPaymentType()) {
            case PC -> new ContactCandidate("PETTY CASH", "PC");
            case CC -> new ContactCandidate("Credit Card " + line.getPayId(), "CC");
            default -> new ContactCandidate(vendor.isEmpty() ? "UNKNOWN CONTACT" : vendor, "Vendor");
        };
    }

    private LocalDate parseDate(String value, int rowNumber, LocalDate today) {
        try {
            return LocalDate.parse(value, LOG_DATE);
        } catch (DateTimeParseException e) {
            log.warn("Row {}: invalid date '{}', using today", rowNumber, value);
            return today;
        }
    }

    private BigDecimal parseAmount(String value, String field, int rowNumber) {
        String cleaned = value.replace(",", "").trim();
        if (cleaned.isEmpty()) {
            return BigDecimal.ZERO;
        }
        try {
            return new BigDecimal(cleaned);
        } catch (NumberFormatException e) {
            log.warn("Row {}: invalid {} '{}', using 0", rowNumber, field, value);
            return BigDecimal.ZERO;
        }
    }

    private Factors parseFactors(String value, BigDecimal subtotal, int rowNumber) {
        try {
            return Factors.parse(value, subtotal);
        } catch (NumberFormatException e) {
            log.warn("Row {}: unreadable factors '{}', using 1 x subtotal", rowNumber, value);
            return new Factors(BigDecimal.ONE, subtotal, BigDecimal.ZERO);
        }
    }

    private static List<String> readLines(Path path) throws IOException {
        try {
            return Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (MalformedInputException e) {
            log.warn("{} is not valid UTF-8, reading as ISO-8859-1", path.getFileName());
            return Files.readAllLines(path, StandardCharsets.ISO_8859_1);
        }
    }

    static String stripLeadingZeros(String value) {
        int i = 0;
        while (i < value.length() && value.charAt(i) == '0') {
            i++;
        }
        return value.substring(i);
    }

    private static Integer parseInteger(String value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        try {
            return Integer.valueOf(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }

    record StatusAndDueDate(DetailItemState state, LocalDate dueDate) {
    }

    /**
     * Collects one PO's defaults from its first row and sums its lines.
     */
    private static final class MainItemAccumulator {
        private final MainItem.MainItemBuilder builder;
        private String description;
        private BigDecimal amount = BigDecimal.ZERO;

        MainItemAccumulator(DetailLine first, ContactCandidate contact) {
            this.builder = MainItem.builder()
                .projectNumber(first.getProjectNumber())
                .poNumber(first.getPoNumber())
                .contactName(contact.getName())
                .vendorType(contact.getVendorType())
                .poType(first.getPaymentType());
        }

        void add(DetailLine line) {
            if ((description == null || description.isBlank())
                    && line.getDescription() != null && !line.getDescription().isBlank()) {
                description = line.getDescription();
            }
            amount = amount.add(line.getSubTotal());
        }

        MainItem build() {
            return builder.description(description).amount(amount).build();
        }
    }
}
