package com.formula.layout;

import com.formula.exception.InvalidAddressException;

import java.util.Optional;

/**
 * Conversion between textual cell references ({@code $A$1}, {@code Sheet1!B2}) and {@link Position}.
 * <p>
 * Columns use a base-26 numbering without zero digit: A=1 ... Z=26, AA=27.
 * Sheet names that are not plain identifiers are quoted: {@code 'My Sheet'!A1}.
 * All methods are pure and can be used without parsing a formula, e.g. to move
 * references when rows or columns are inserted.
 */
public final class AddressCodec {

    private static final char DOLLAR = '$';
    private static final char BANG = '!';
    private static final char COLON = ':';
    private static final char QUOTE_SINGLE = '\'';
    private static final char QUOTE_DOUBLE = '"';
    private static final int RADIX = 26;

    private AddressCodec() {
    }

    /**
     * Decode a cell address.
     *
     * @param text Address such as {@code B2}, {@code $B$2}, {@code Sheet1!B2} or {@code 'My Sheet'!B2}
     * @return Decoded position
     * @throws InvalidAddressException if the text is not a valid address
     */
    public static Position decode(String text) {
        if (text == null || text.isEmpty()) {
            throw new InvalidAddressException("empty cell address");
        }
        String sheet = null;
        String addr = text;
        char first = text.charAt(0);
        if (first == QUOTE_SINGLE || first == QUOTE_DOUBLE) {
            int close = text.indexOf(first, 1);
            if (close < 0 || close + 1 >= text.length() || text.charAt(close + 1) != BANG) {
                throw new InvalidAddressException(text + ": invalid cell address - malformed sheet name");
            }
            sheet = text.substring(1, close);
            addr = text.substring(close + 2);
        } else {
            int bang = text.lastIndexOf(BANG);
            if (bang >= 0) {
                sheet = text.substring(0, bang);
                addr = text.substring(bang + 1);
            }
        }
        if (sheet != null && sheet.isEmpty()) {
            throw new InvalidAddressException(text + ": invalid cell address - empty sheet name");
        }

        int offset = 0;
        boolean absoluteColumn = false;
        boolean absoluteRow = false;
        if (offset < addr.length() && addr.charAt(offset) == DOLLAR) {
            absoluteColumn = true;
            offset++;
        }

        int startColumn = offset;
        long column = 0;
        while (offset < addr.length() && isLetter(addr.charAt(offset))) {
            try {
                column = Math.addExact(Math.multiplyExact(column, RADIX), letterValue(addr.charAt(offset)));
            } catch (ArithmeticException e) {
                throw new InvalidAddressException(text + ": invalid cell address - column out of range");
            }
            offset++;
        }
        if (offset == startColumn) {
            throw new InvalidAddressException(text + ": invalid cell address - missing column");
        }
        if (offset >= addr.length()) {
            throw new InvalidAddressException(text + ": invalid cell address - missing row");
        }

        if (addr.charAt(offset) == DOLLAR) {
            absoluteRow = true;
            offset++;
        }
        String digits = addr.substring(offset);
        if (digits.isEmpty()) {
            throw new InvalidAddressException(text + ": invalid cell address - missing row");
        }
        for (int i = 0; i < digits.length(); i++) {
            if (!isDigit(digits.charAt(i))) {
                throw new InvalidAddressException(text + ": invalid cell address - invalid row number");
            }
        }
        long row;
        try {
            row = Long.parseLong(digits);
        } catch (NumberFormatException e) {
            throw new InvalidAddressException(text + ": invalid cell address - invalid row number");
        }
        return new Position(sheet, column, row, absoluteColumn, absoluteRow);
    }

    /**
     * Decode a cell address without failing.
     *
     * @param text Candidate address
     * @return Decoded position, or empty if the text is not an address
     */
    public static Optional<Position> tryDecode(String text) {
        try {
            return Optional.of(decode(text));
        } catch (InvalidAddressException e) {
            return Optional.empty();
        }
    }

    /**
     * Decode a range such as {@code A1:B9} or {@code Sheet1!A1:B9}.
     * The end of the range inherits the sheet of its start.
     */
    public static Range decodeRange(String text) {
        if (text == null || text.isEmpty()) {
            throw new InvalidAddressException("empty range");
        }
        int colon = text.indexOf(COLON);
        if (colon < 0) {
            Position pos = decode(text);
            return new Range(pos, pos);
        }
        Position start = decode(text.substring(0, colon));
        Position end = decode(text.substring(colon + 1));
        if (end.isQualified() && !end.sheet().equals(start.sheet())) {
            throw new InvalidAddressException(text + ": range spans multiple sheets");
        }
        return new Range(start, end.withSheet(start.sheet()));
    }

    /**
     * Encode a position back to its textual form.
     * A position without column encodes to the empty string.
     */
    public static String encode(Position pos) {
        if (pos.column() == 0) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        if (pos.isQualified()) {
            sb.append(sheetName(pos.sheet())).append(BANG);
        }
        if (pos.absoluteColumn()) {
            sb.append(DOLLAR);
        }
        sb.append(columnName(pos.column()));
        if (pos.absoluteRow()) {
            sb.append(DOLLAR);
        }
        sb.append(pos.row());
        return sb.toString();
    }

    /**
     * Sheet name as written in a formula, quoted unless it is a plain identifier.
     */
    public static String sheetName(String sheet) {
        if (isPlainName(sheet)) {
            return sheet;
        }
        char quote = sheet.indexOf(QUOTE_SINGLE) >= 0 ? QUOTE_DOUBLE : QUOTE_SINGLE;
        return quote + sheet + quote;
    }

    /**
     * Move a position by the given delta.
     * Absolute components are left untouched. A set column or row can not move below 1.
     *
     * @param pos         Position to move
     * @param deltaLine   Number of rows to add
     * @param deltaColumn Number of columns to add
     * @return Moved position
     * @throws InvalidAddressException if the position leaves the grid
     */
    public static Position offset(Position pos, long deltaLine, long deltaColumn) {
        long row = pos.absoluteRow() ? pos.row() : pos.row() + deltaLine;
        long column = pos.absoluteColumn() ? pos.column() : pos.column() + deltaColumn;
        if (row < minimum(pos.row()) || column < minimum(pos.column())) {
            throw new InvalidAddressException(encode(pos) + ": offset moves reference out of the grid");
        }
        return new Position(pos.sheet(), column, row, pos.absoluteColumn(), pos.absoluteRow());
    }

    /**
     * Letters of a column index: 1 is A, 27 is AA.
     */
    public static String columnName(long index) {
        StringBuilder sb = new StringBuilder();
        long ix = index;
        while (ix > 0) {
            ix--;
            sb.append((char) ('A' + (ix % RADIX)));
            ix /= RADIX;
        }
        return sb.reverse().toString();
    }

    /**
     * Column index of a run of letters: A is 1, AA is 27.
     */
    public static long columnIndex(String letters) {
        if (letters == null || letters.isEmpty()) {
            throw new InvalidAddressException("empty column name");
        }
        long index = 0;
        for (int i = 0; i < letters.length(); i++) {
            char c = letters.charAt(i);
            if (!isLetter(c)) {
                throw new InvalidAddressException(letters + ": invalid column name");
            }
            index = index * RADIX + letterValue(c);
        }
        return index;
    }

    private static long minimum(long component) {
        return component > 0 ? 1 : 0;
    }

    private static boolean isPlainName(String name) {
        if (name.isEmpty() || isDigit(name.charAt(0))) {
            return false;
        }
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (!isLetter(c) && !isDigit(c) && c != '_') {
                return false;
            }
        }
        return true;
    }

    private static int letterValue(char c) {
        char base = Character.isLowerCase(c) ? 'a' : 'A';
        return c - base + 1;
    }

    private static boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
