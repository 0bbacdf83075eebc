package com.formula.context;

import com.formula.grid.InMemorySheet;
import com.formula.grid.InMemoryWorkbook;
import com.formula.layout.AddressCodec;
import com.formula.layout.Position;
import com.formula.value.ErrorCode;
import com.formula.value.ErrorValue;
import com.formula.value.NumberValue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for WorkbookContext.
 */
class WorkbookContextTest {

    @Test
    @DisplayName("Unqualified references read the active sheet")
    void shouldReadActiveSheet() {
        InMemoryWorkbook workbook = new InMemoryWorkbook();
        workbook.addSheet("One").setValue(Position.of(1, 1), new NumberValue(1));
        workbook.addSheet("Two").setValue(Position.of(1, 1), new NumberValue(2));
        WorkbookContext ctx = new WorkbookContext(null, workbook);

        assertEquals(new NumberValue(1), ctx.at(AddressCodec.decode("A1")));

        workbook.setActive("Two");
        assertEquals(new NumberValue(2), ctx.at(AddressCodec.decode("A1")));
        assertEquals(new NumberValue(1), ctx.at(AddressCodec.decode("One!A1")));
    }

    @Test
    @DisplayName("Unknown sheets and empty workbooks give #REF!")
    void shouldReportMissingSheets() {
        InMemoryWorkbook workbook = new InMemoryWorkbook();
        WorkbookContext ctx = new WorkbookContext(null, workbook);

        assertEquals(ErrorValue.of(ErrorCode.REF), ctx.at(AddressCodec.decode("A1")));

        InMemorySheet sheet = workbook.addSheet("One");
        sheet.setValue(Position.of(1, 1), new NumberValue(1));
        Position missing = AddressCodec.decode("Nope!A1");
        assertEquals(ErrorValue.of(ErrorCode.REF), ctx.at(missing));
        assertEquals(ErrorValue.of(ErrorCode.REF), ctx.range(missing, missing));
    }
}
