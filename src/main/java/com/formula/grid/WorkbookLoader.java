package com.formula.grid;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.formula.config.Resources;
import com.formula.exception.ConfigurationException;
import com.formula.layout.AddressCodec;
import com.formula.layout.Position;
import com.formula.parse.FormulaParser;
import com.formula.value.Blank;
import com.formula.value.BooleanValue;
import com.formula.value.NumberValue;
import com.formula.value.ScalarValue;
import com.formula.value.TextValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Iterator;
import java.util.Map;

/**
 * Builds an {@link InMemoryWorkbook} from JSON:
 * <pre>
 * {
 *   "active": "Sheet1",
 *   "sheets": {
 *     "Sheet1": {"A1": 1, "B1": "foo", "C1": "=A1+1"}
 *   }
 * }
 * </pre>
 * Text starting with {@code =} is parsed as a formula.
 */
public class WorkbookLoader {

    private static final Logger log = LoggerFactory.getLogger(WorkbookLoader.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String FORMULA_PREFIX = "=";

    private final FormulaParser parser;

    public WorkbookLoader() {
        this(new FormulaParser());
    }

    public WorkbookLoader(FormulaParser parser) {
        this.parser = parser;
    }

    /**
     * Load a workbook from a path, {@code classpath:} prefix supported.
     */
    public InMemoryWorkbook load(String path) {
        log.debug("Loading workbook from: {}", path);
        try (InputStream in = Resources.resolve(path).getInputStream()) {
            return read(MAPPER.readTree(in));
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load workbook from: " + path, e);
        }
    }

    public InMemoryWorkbook parse(String json) {
        try {
            return read(MAPPER.readTree(json));
        } catch (IOException e) {
            throw new ConfigurationException("Invalid workbook document", e);
        }
    }

    private InMemoryWorkbook read(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new ConfigurationException("Workbook document must be a JSON object");
        }
        JsonNode sheets = root.path("sheets");
        if (!sheets.isObject()) {
            throw new ConfigurationException("Workbook document has no 'sheets' object");
        }

        InMemoryWorkbook workbook = new InMemoryWorkbook();
        Iterator<Map.Entry<String, JsonNode>> it = sheets.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            InMemorySheet sheet = workbook.addSheet(entry.getKey());
            readCells(sheet, entry.getValue());
        }

        JsonNode active = root.get("active");
        if (active != null && !active.isNull()) {
            workbook.setActive(active.asText());
        }
        log.debug("Loaded workbook with {} sheets", workbook.sheets().size());
        return workbook;
    }

    private void readCells(InMemorySheet sheet, JsonNode cells) {
        if (!cells.isObject()) {
            throw new ConfigurationException("Sheet " + sheet.name() + " must be a JSON object");
        }
        Iterator<Map.Entry<String, JsonNode>> it = cells.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            Position pos = AddressCodec.decode(entry.getKey());
            JsonNode node = entry.getValue();
            if (node.isTextual() && node.asText().startsWith(FORMULA_PREFIX)) {
                sheet.setFormula(pos, parser.parse(node.asText()));
            } else {
                sheet.setValue(pos, scalar(node));
            }
        }
    }

    private static ScalarValue scalar(JsonNode node) {
        if (node == null || node.isNull()) {
            return Blank.INSTANCE;
        }
        if (node.isNumber()) {
            return new NumberValue(node.asDouble());
        }
        if (node.isBoolean()) {
            return BooleanValue.of(node.asBoolean());
        }
        if (node.isTextual()) {
            return new TextValue(node.asText());
        }
        throw new ConfigurationException("Unsupported cell content: " + node);
    }
}
