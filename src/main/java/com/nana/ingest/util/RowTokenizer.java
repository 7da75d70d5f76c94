package com.nana.ingest.util;

import java.util.ArrayList;
import java.util.List;

/**
 * RowTokenizer - Splits one CSV line into trimmed field values.
 *
 * <p>STATE MACHINE:
 * A single left-to-right scan with one character of lookahead, tracking
 * whether the scan is inside a quoted section:
 * <ul>
 *   <li>Plain fields: {@code Pro,Hotel,Sweden}</li>
 *   <li>Quoted fields: {@code "Smith, John",Pro}</li>
 *   <li>Escaped quotes: {@code "The ""Grand"" Hotel",Pro}</li>
 *   <li>Empty fields: {@code Pro,,Sweden} gives ["Pro","","Sweden"]</li>
 * </ul>
 *
 * <p>The tokenizer never fails. An unterminated quote keeps accumulating
 * to the end of the line, so the row usually ends up with too few fields
 * and is rejected later by the field-count check in the record shape.
 *
 * <p>The number of fields returned is always the number of commas outside
 * quotes plus one.
 */
public class RowTokenizer {

    private static final char QUOTE     = '"';
    private static final char DELIMITER = ',';

    /**
     * Tokenizes a single logical CSV line.
     *
     * @param line the raw line (without its line terminator); null is
     *             treated as an empty line
     * @return the trimmed field values, quotes removed and escapes resolved
     */
    public List<String> tokenize(String line) {
        List<String> fields = new ArrayList<>();
        StringBuilder current = new StringBuilder();

        if (line == null) {
            fields.add("");
            return fields;
        }

        boolean inQuotes = false;
        int length = line.length();

        for (int i = 0; i < length; i++) {
            char c = line.charAt(i);

            if (inQuotes) {
                if (c == QUOTE) {
                    if (i + 1 < length && line.charAt(i + 1) == QUOTE) {
                        // "" inside quotes is a literal quote
                        current.append(QUOTE);
                        i++;
                    } else {
                        inQuotes = false;
                    }
                } else {
                    current.append(c);
                }
            } else {
                if (c == QUOTE) {
                    inQuotes = true;
                } else if (c == DELIMITER) {
                    fields.add(current.toString().trim());
                    current.setLength(0);
                } else {
                    current.append(c);
                }
            }
        }

        fields.add(current.toString().trim());
        return fields;
    }
}
