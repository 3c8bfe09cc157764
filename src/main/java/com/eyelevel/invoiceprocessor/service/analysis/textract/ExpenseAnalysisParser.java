package com.eyelevel.invoiceprocessor.service.analysis.textract;

import com.eyelevel.invoiceprocessor.service.analysis.parsing.ExtractedValueParser;
import com.eyelevel.invoiceprocessor.service.analysis.parsing.ExtractedValueParser.MoneyKind;
import com.eyelevel.invoiceprocessor.service.analysis.parsing.ParsedInvoice;
import com.eyelevel.invoiceprocessor.service.analysis.parsing.ParsedLineItem;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;
import software.amazon.awssdk.services.textract.model.ExpenseDetection;
import software.amazon.awssdk.services.textract.model.ExpenseDocument;
import software.amazon.awssdk.services.textract.model.ExpenseField;
import software.amazon.awssdk.services.textract.model.LineItemFields;
import software.amazon.awssdk.services.textract.model.LineItemGroup;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns Textract expense-analysis documents into a {@link ParsedInvoice}. Only the first expense
 * document is read; multi-invoice files are not split.
 */
@Slf4j
@Component
public class ExpenseAnalysisParser {

    static final String VENDOR_NAME = "VENDOR_NAME";
    static final String INVOICE_RECEIPT_ID = "INVOICE_RECEIPT_ID";
    static final String INVOICE_RECEIPT_DATE = "INVOICE_RECEIPT_DATE";
    static final String TOTAL = "TOTAL";
    static final String TAX = "TAX";
    static final String SUBTOTAL = "SUBTOTAL";
    static final String ITEM = "ITEM";
    static final String EXPENSE_ROW = "EXPENSE_ROW";
    static final String QUANTITY = "QUANTITY";
    static final String UNIT_PRICE = "UNIT_PRICE";
    static final String PRICE = "PRICE";
    static final String PRODUCT_CODE = "PRODUCT_CODE";

    /**
     * A line needs at least this many confident fields before it gets its own confidence score.
     */
    private static final int MIN_LINE_CONFIDENCE_INPUTS = 2;

    public ParsedInvoice parse(final List<ExpenseDocument> expenseDocuments) {
        if (CollectionUtils.isEmpty(expenseDocuments)) {
            return ParsedInvoice.empty();
        }
        final ExpenseDocument document = expenseDocuments.get(0);
        final List<ExpenseField> summaryFields = document.summaryFields();

        final Optional<ExpenseField> totalField = findField(summaryFields, TOTAL);
        final String currency = totalField.map(ExpenseField::currency)
                                          .map(c -> c.code())
                                          .orElse(null);

        final double confidence = summaryFields.stream()
                                               .mapToDouble(f -> confidenceOf(f.valueDetection()))
                                               .average()
                                               .orElse(0);

        final List<ParsedLineItem> lineItems = new ArrayList<>();
        for (LineItemGroup group : document.lineItemGroups()) {
            for (LineItemFields item : group.lineItems()) {
                parseLineItem(item.lineItemExpenseFields()).ifPresent(lineItems::add);
            }
        }

        final ParsedInvoice parsed = new ParsedInvoice(
                valueOf(summaryFields, VENDOR_NAME),
                valueOf(summaryFields, INVOICE_RECEIPT_ID),
                ExtractedValueParser.parseDate(valueOf(summaryFields, INVOICE_RECEIPT_DATE)),
                ExtractedValueParser.parseMoney(valueOf(summaryFields, SUBTOTAL), MoneyKind.OTHER),
                ExtractedValueParser.parseMoney(valueOf(summaryFields, TAX), MoneyKind.TAX),
                ExtractedValueParser.parseMoney(totalField.map(f -> textOf(f.valueDetection())).orElse(null),
                                                MoneyKind.OTHER),
                currency,
                confidence,
                lineItems);
        log.debug("Parsed expense document: supplier='{}', total={}, {} line item(s), confidence {}",
                  parsed.supplierName(), parsed.total(), lineItems.size(), confidence);
        return parsed;
    }

    /**
     * Flattens the expense documents into plain maps so the payload can be stored as JSON.
     */
    public List<Map<String, Object>> snapshot(final List<ExpenseDocument> expenseDocuments) {
        final List<Map<String, Object>> documents = new ArrayList<>();
        if (expenseDocuments == null) {
            return documents;
        }
        for (ExpenseDocument document : expenseDocuments) {
            final Map<String, Object> flat = new LinkedHashMap<>();
            flat.put("expenseIndex", document.expenseIndex());
            flat.put("summaryFields", document.summaryFields().stream().map(this::flattenField).toList());
            final List<List<Map<String, Object>>> rows = new ArrayList<>();
            for (LineItemGroup group : document.lineItemGroups()) {
                for (LineItemFields item : group.lineItems()) {
                    rows.add(item.lineItemExpenseFields().stream().map(this::flattenField).toList());
                }
            }
            flat.put("lineItems", rows);
            documents.add(flat);
        }
        return documents;
    }

    private Optional<ParsedLineItem> parseLineItem(final List<ExpenseField> fields) {
        Optional<ExpenseField> descriptionField = findField(fields, ITEM)
                .filter(f -> StringUtils.hasText(textOf(f.valueDetection())));
        if (descriptionField.isEmpty()) {
            descriptionField = findField(fields, EXPENSE_ROW)
                    .filter(f -> StringUtils.hasText(textOf(f.valueDetection())));
        }
        if (descriptionField.isEmpty()) {
            return Optional.empty();
        }

        final ExpenseDetection description = descriptionField.get().valueDetection();
        final ExpenseDetection quantity = detectionOf(fields, QUANTITY);
        final ExpenseDetection unitPrice = detectionOf(fields, UNIT_PRICE);
        final ExpenseDetection lineTotal = detectionOf(fields, PRICE);
        final ExpenseDetection productCode = detectionOf(fields, PRODUCT_CODE);

        // description counts twice
        final List<Float> inputs = new ArrayList<>();
        addConfidence(inputs, description);
        addConfidence(inputs, description);
        addConfidence(inputs, quantity);
        addConfidence(inputs, unitPrice);
        addConfidence(inputs, lineTotal);
        addConfidence(inputs, productCode);
        final Double lineConfidence = inputs.size() >= MIN_LINE_CONFIDENCE_INPUTS
                ? inputs.stream().mapToDouble(Float::doubleValue).average().orElse(0)
                : null;

        final String quantityText = textOf(quantity);
        return Optional.of(new ParsedLineItem(
                textOf(description).trim(),
                StringUtils.hasText(textOf(productCode)) ? textOf(productCode).trim() : null,
                ExtractedValueParser.parseQuantity(quantityText),
                ExtractedValueParser.extractUnitLabel(quantityText),
                ExtractedValueParser.parseMoney(textOf(unitPrice), MoneyKind.UNIT_PRICE),
                ExtractedValueParser.parseMoney(textOf(lineTotal), MoneyKind.LINE_TOTAL),
                lineConfidence));
    }

    private Map<String, Object> flattenField(final ExpenseField field) {
        final Map<String, Object> flat = new LinkedHashMap<>();
        flat.put("type", field.type() != null ? field.type().text() : null);
        flat.put("label", field.labelDetection() != null ? field.labelDetection().text() : null);
        flat.put("value", textOf(field.valueDetection()));
        flat.put("confidence", field.valueDetection() != null ? field.valueDetection().confidence() : null);
        flat.put("currency", field.currency() != null ? field.currency().code() : null);
        flat.put("page", field.pageNumber());
        return flat;
    }

    private static Optional<ExpenseField> findField(final List<ExpenseField> fields, final String type) {
        return fields.stream()
                     .filter(f -> f.type() != null && type.equals(f.type().text()))
                     .findFirst();
    }

    private static String valueOf(final List<ExpenseField> fields, final String type) {
        return findField(fields, type).map(f -> textOf(f.valueDetection())).orElse(null);
    }

    private static ExpenseDetection detectionOf(final List<ExpenseField> fields, final String type) {
        return findField(fields, type).map(ExpenseField::valueDetection).orElse(null);
    }

    private static String textOf(final ExpenseDetection detection) {
        return detection != null ? detection.text() : null;
    }

    private static double confidenceOf(final ExpenseDetection detection) {
        return detection != null && detection.confidence() != null ? detection.confidence() : 0;
    }

    private static void addConfidence(final List<Float> inputs, final ExpenseDetection detection) {
        if (detection != null && detection.confidence() != null && detection.confidence() > 0) {
            inputs.add(detection.confidence());
        }
    }
}
