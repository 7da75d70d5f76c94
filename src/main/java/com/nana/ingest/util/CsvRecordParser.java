package com.nana.ingest.util;

import com.nana.ingest.domain.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * CsvRecordParser - Generic line-oriented CSV record parser
 *
 * <p>Turns the decoded text of a CRM export into records of one shape.
 * The shape is passed in as a {@link RecordShape} strategy, so the same
 * parser reads both the customer and the sentiment exports.
 *
 * <p>PROCESSING PIPELINE:
 * <ol>
 *   <li>Reject empty or whitespace-only content ({@code EMPTY_FILE}).</li>
 *   <li>Strip a UTF-8 BOM, normalise CRLF and CR line endings to LF,
 *       drop blank lines.</li>
 *   <li>Reject a file with no data rows ({@code EMPTY_FILE}).</li>
 *   <li>Tokenize the first line and check it against the shape's
 *       {@link HeaderContract} ({@code INVALID_HEADERS}).</li>
 *   <li>Tokenize and map every remaining line. A row the shape cannot
 *       map is recorded as a {@code MALFORMED_ROW} error and skipped;
 *       the rest of the file is still processed.</li>
 * </ol>
 *
 * <p>ROW NUMBERS:
 * Row numbers are 1-based positions among the non-blank lines, with the
 * header as row 1, so the first data row is row 2.
 *
 * <p>Only the two structural conditions (empty input, bad header row)
 * fail the whole parse. Everything else ends up as a row error inside a
 * successful {@link ParseResult}.
 *
 * @param <R> the record type produced by the shape
 */
public class CsvRecordParser<R> {

    private static final Logger log = LoggerFactory.getLogger(CsvRecordParser.class);

    private static final String BOM = "\uFEFF";

    private final RecordShape<R> shape;
    private final RowTokenizer   tokenizer;

    /**
     * Creates a parser for the given shape.
     *
     * @param shape the record shape; must not be null
     */
    public CsvRecordParser(RecordShape<R> shape) {
        this(shape, new RowTokenizer());
    }

    /**
     * Creates a parser with an explicit tokenizer.
     *
     * @param shape     the record shape; must not be null
     * @param tokenizer the row tokenizer; must not be null
     */
    public CsvRecordParser(RecordShape<R> shape, RowTokenizer tokenizer) {
        if (shape == null) {
            throw new IllegalArgumentException("RecordShape must not be null.");
        }
        if (tokenizer == null) {
            throw new IllegalArgumentException("RowTokenizer must not be null.");
        }
        this.shape     = shape;
        this.tokenizer = tokenizer;
    }

    // -----------------------------------------------------------------------
    // PUBLIC API
    // -----------------------------------------------------------------------

    /**
     * Parses decoded CSV content.
     *
     * @param content the full file content
     * @return a {@link ParseResult} on success, or the single structural
     *         {@link ParseError} that stopped the parse
     */
    public Result<ParseResult<R>, ParseError> parse(String content) {
        if (content == null || content.isBlank()) {
            log.warn("Rejected {} CSV: content is empty.", shape.getName());
            return Result.failure(new ParseError(0,
                    "CSV file is empty", ParseErrorCode.EMPTY_FILE));
        }

        List<String> lines = splitLines(content);
        if (lines.size() < 2) {
            log.warn("Rejected {} CSV: {} non-blank line(s), no data rows.",
                    shape.getName(), lines.size());
            return Result.failure(new ParseError(0,
                    "CSV file must contain a header row and at least one data row",
                    ParseErrorCode.EMPTY_FILE));
        }

        List<String> headers = tokenizer.tokenize(lines.get(0));
        HeaderValidation headerValidation =
                shape.getHeaderContract().validate(headers);

        if (!headerValidation.isValid()) {
            log.warn("Rejected {} CSV: missing headers {}.",
                    shape.getName(), headerValidation.getMissingHeaders());
            return Result.failure(new ParseError(1,
                    "Invalid CSV headers. Missing: "
                    + String.join(", ", headerValidation.getMissingHeaders()),
                    ParseErrorCode.INVALID_HEADERS));
        }
        if (!headerValidation.getExtraHeaders().isEmpty()) {
            log.debug("Ignoring extra {} columns: {}",
                    shape.getName(), headerValidation.getExtraHeaders());
        }

        List<R>          records    = new ArrayList<>();
        List<Integer>    sourceRows = new ArrayList<>();
        List<ParseError> errors     = new ArrayList<>();

        for (int i = 1; i < lines.size(); i++) {
            int rowNumber = i + 1;
            List<String> fields = tokenizer.tokenize(lines.get(i).trim());

            Result<R, String> mapped = shape.mapFields(fields, headers, rowNumber);
            if (mapped.isFailure()) {
                log.debug("Row {} rejected: {}", rowNumber, mapped.getError());
                errors.add(new ParseError(rowNumber, mapped.getError(),
                        ParseErrorCode.MALFORMED_ROW));
                continue;
            }

            records.add(mapped.getValue());
            sourceRows.add(rowNumber);
        }

        ParseResult<R> result = new ParseResult<>(
                records, sourceRows, errors, lines.size() - 1);
        log.info("Parsed {} CSV: {} of {} rows mapped, {} rejected.",
                shape.getName(), result.getSuccessfulRows(),
                result.getTotalRows(), errors.size());
        return Result.success(result);
    }

    // -----------------------------------------------------------------------
    // PRIVATE HELPERS
    // -----------------------------------------------------------------------

    /**
     * Splits content into non-blank lines, handling LF, CRLF and CR
     * terminators and a leading BOM.
     */
    private List<String> splitLines(String content) {
        String text = content.startsWith(BOM) ? content.substring(1) : content;
        String normalised = text.replace("\r\n", "\n").replace('\r', '\n');

        List<String> lines = new ArrayList<>();
        for (String line : normalised.split("\n", -1)) {
            if (!line.isBlank()) {
                lines.add(line);
            }
        }
        return lines;
    }
}
