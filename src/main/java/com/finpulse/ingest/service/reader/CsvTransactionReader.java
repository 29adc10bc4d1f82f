package com.finpulse.ingest.service.reader;

import com.finpulse.ingest.config.IngestionProperties;
import com.finpulse.ingest.exception.DecodeException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads uploaded bank exports and hand-made spreadsheets.
 * The first line is the header; each following line becomes one raw record
 * keyed by header name, in header order.
 */
@Slf4j
@Service
public class CsvTransactionReader {

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setAllowMissingColumnNames(true)
            .setIgnoreEmptyLines(true)
            .build();

    private final Charset primaryCharset;
    private final Charset fallbackCharset;

    public CsvTransactionReader(IngestionProperties properties) {
        this.primaryCharset = Charset.forName(properties.csv().primaryCharset());
        this.fallbackCharset = Charset.forName(properties.csv().fallbackCharset());
    }

    /**
     * Decodes and parses the upload. Rows whose cells are all empty are dropped.
     *
     * @param content raw bytes of the uploaded file
     * @return raw records in file order
     * @throws DecodeException if the bytes are valid in neither charset or the table is malformed
     */
    public List<Map<String, Object>> read(byte[] content) {
        String text = decode(content);
        return parse(text);
    }

    String decode(byte[] content) {
        try {
            return stripByteOrderMark(decodeStrict(content, primaryCharset));
        } catch (CharacterCodingException primaryFailure) {
            log.debug("Upload is not valid {}, retrying as {}", primaryCharset, fallbackCharset);
            try {
                return stripByteOrderMark(decodeStrict(content, fallbackCharset));
            } catch (CharacterCodingException fallbackFailure) {
                DecodeException ex = new DecodeException(
                        "Content is neither valid " + primaryCharset + " nor " + fallbackCharset, fallbackFailure);
                ex.addSuppressed(primaryFailure);
                throw ex;
            }
        }
    }

    private List<Map<String, Object>> parse(String text) {
        List<Map<String, Object>> rows = new ArrayList<>();
        int blankRows = 0;

        try (CSVParser parser = CSVParser.parse(text, FORMAT)) {
            List<String> headers = parser.getHeaderNames();
            for (CSVRecord record : parser) {
                Map<String, Object> row = new LinkedHashMap<>();
                for (String header : headers) {
                    row.put(header, record.isSet(header) ? record.get(header) : null);
                }
                if (isBlank(row)) {
                    blankRows++;
                    continue;
                }
                rows.add(row);
            }
        } catch (IOException | UncheckedIOException | IllegalArgumentException | IllegalStateException e) {
            throw new DecodeException("Malformed delimited text: " + e.getMessage(), e);
        }

        if (blankRows > 0) {
            log.debug("Skipped {} blank rows", blankRows);
        }
        return rows;
    }

    private static String decodeStrict(byte[] content, Charset charset) throws CharacterCodingException {
        return charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(content))
                .toString();
    }

    private static String stripByteOrderMark(String text) {
        return !text.isEmpty() && text.charAt(0) == BYTE_ORDER_MARK ? text.substring(1) : text;
    }

    private static boolean isBlank(Map<String, Object> row) {
        return row.values().stream().allMatch(value -> value == null || value.toString().isEmpty());
    }
}
