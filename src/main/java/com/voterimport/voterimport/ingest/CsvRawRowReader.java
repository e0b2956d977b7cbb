package com.voterimport.voterimport.ingest;

import com.voterimport.voterimport.config.VoterImportConstants;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.csv.DuplicateHeaderMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Reads delimited text extracts (plain or as the first text entry of a ZIP archive) with commons-csv.
 * The delimiter is taken from the header line unless given, and the charset falls back to windows-1252
 * when the leading bytes are not valid UTF-8.
 */
public class CsvRawRowReader implements RawRowReader {

    private static final Logger log = LoggerFactory.getLogger(CsvRawRowReader.class);

    private static final int HEADER_LINE_LIMIT = 1 << 20;
    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final Path input;
    private final String delimiter;
    private final Charset charset;
    private final CSVParser parser;
    private final List<String> headers;
    private boolean consumed;

    public CsvRawRowReader(Path input) {
        this(input, null);
    }

    /**
     * @param delimiterOverride delimiter to use instead of detecting one, or {@code null}
     */
    public CsvRawRowReader(Path input, String delimiterOverride) {
        this.input = input;
        if (input == null || !Files.isRegularFile(input)) {
            throw new IllegalStateException(VoterImportConstants.MSG_INPUT_NOT_FOUND.formatted(input));
        }

        InputStream stream = null;
        try {
            stream = new BufferedInputStream(openPayload(input));
            this.charset = detectCharset(stream);
            BufferedReader reader = new BufferedReader(new InputStreamReader(stream, charset));
            reader.mark(HEADER_LINE_LIMIT);
            String headerLine = reader.readLine();
            if (headerLine == null || headerLine.isBlank()) {
                throw new IllegalStateException(VoterImportConstants.MSG_INPUT_EMPTY.formatted(input));
            }
            reader.reset();
            this.delimiter = delimiterOverride == null || delimiterOverride.isEmpty()
                    ? detectDelimiter(headerLine)
                    : delimiterOverride;

            CSVFormat csvFormat = CSVFormat.DEFAULT.builder()
                    .setDelimiter(delimiter)
                    .setHeader()
                    .setSkipHeaderRecord(true)
                    .setTrim(true)
                    .setIgnoreEmptyLines(true)
                    .setAllowMissingColumnNames(true)
                    .setDuplicateHeaderMode(DuplicateHeaderMode.ALLOW_ALL)
                    .build();
            this.parser = csvFormat.parse(reader);
            this.headers = cleanHeaders(parser.getHeaderNames());
        } catch (IOException | UncheckedIOException ex) {
            closeQuietly(stream, ex);
            throw new IllegalStateException(VoterImportConstants.MSG_INPUT_READ_FAILED.formatted(input), ex);
        } catch (RuntimeException ex) {
            closeQuietly(stream, ex);
            throw ex;
        }
        log.debug("Opened {} as {} with delimiter '{}' and {} columns", input, charset, delimiter, headers.size());
    }

    @Override
    public List<String> headers() {
        return headers;
    }

    @Override
    public Stream<RawRow> rows() {
        if (consumed) {
            throw new IllegalStateException("Rows of " + input + " were already read");
        }
        consumed = true;
        Iterator<RawRow> iterator = new RowIterator(parser.iterator());
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    @Override
    public String delimiter() {
        return delimiter;
    }

    public Charset charset() {
        return charset;
    }

    @Override
    public void close() {
        try {
            parser.close();
        } catch (IOException ex) {
            throw new IllegalStateException(VoterImportConstants.MSG_INPUT_READ_FAILED.formatted(input), ex);
        }
    }

    /**
     * Returns the pipe when the header line contains one, otherwise tab when it has tabs but no commas, otherwise comma.
     */
    static String detectDelimiter(String headerLine) {
        if (headerLine.indexOf('|') >= 0) {
            return "|";
        }
        if (headerLine.indexOf('\t') >= 0 && headerLine.indexOf(',') < 0) {
            return "\t";
        }
        return ",";
    }

    private static InputStream openPayload(Path input) throws IOException {
        InputStream raw = Files.newInputStream(input);
        if (!input.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(VoterImportConstants.FILE_EXT_ZIP)) {
            return raw;
        }
        ZipInputStream zis = new ZipInputStream(raw);
        try {
            ZipEntry entry;
            while ((entry = zis.getNextEntry()) != null) {
                if (!entry.isDirectory() && isTextFile(entry.getName())) {
                    log.info("Reading {} from {}", entry.getName(), input);
                    return zis;
                }
            }
        } catch (IOException ex) {
            closeQuietly(zis, ex);
            throw ex;
        }
        zis.close();
        throw new IllegalStateException(VoterImportConstants.MSG_ZIP_NO_TEXT_FILE.formatted(input));
    }

    /**
     * Strictly decodes the leading bytes as UTF-8; any malformed sequence selects the fallback charset.
     */
    private static Charset detectCharset(InputStream stream) throws IOException {
        stream.mark(VoterImportConstants.CHARSET_SAMPLE_BYTES + 1);
        byte[] sample = stream.readNBytes(VoterImportConstants.CHARSET_SAMPLE_BYTES);
        stream.reset();

        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        boolean endOfInput = sample.length < VoterImportConstants.CHARSET_SAMPLE_BYTES;
        // a multi-byte sequence cut at the sample boundary is left undecoded rather than reported
        boolean valid = !decoder.decode(ByteBuffer.wrap(sample), CharBuffer.allocate(sample.length), endOfInput).isError();
        return valid ? StandardCharsets.UTF_8 : Charset.forName(VoterImportConstants.FALLBACK_CHARSET);
    }

    private static boolean isTextFile(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        return lower.endsWith(VoterImportConstants.FILE_EXT_TXT)
                || lower.endsWith(VoterImportConstants.FILE_EXT_CSV)
                || lower.endsWith(VoterImportConstants.FILE_EXT_DAT)
                || lower.endsWith(VoterImportConstants.FILE_EXT_PSV)
                || lower.endsWith(VoterImportConstants.FILE_EXT_TSV);
    }

    private static List<String> cleanHeaders(List<String> rawHeaders) {
        List<String> cleaned = new ArrayList<>(rawHeaders.size());
        for (int i = 0; i < rawHeaders.size(); i++) {
            String header = rawHeaders.get(i) == null ? "" : rawHeaders.get(i);
            if (i == 0 && !header.isEmpty() && header.charAt(0) == BYTE_ORDER_MARK) {
                header = header.substring(1);
            }
            cleaned.add(header.trim());
        }
        return Collections.unmodifiableList(cleaned);
    }

    private static void closeQuietly(AutoCloseable closeable, Exception primary) {
        if (closeable == null) {
            return;
        }
        try {
            closeable.close();
        } catch (Exception suppressed) {
            primary.addSuppressed(suppressed);
        }
    }

    private final class RowIterator implements Iterator<RawRow> {

        private final Iterator<CSVRecord> records;
        private long rowNumber;

        private RowIterator(Iterator<CSVRecord> records) {
            this.records = records;
        }

        @Override
        public boolean hasNext() {
            return records.hasNext();
        }

        @Override
        public RawRow next() {
            CSVRecord record = records.next();
            rowNumber++;
            Map<String, String> values = new LinkedHashMap<>();
            for (int i = 0; i < headers.size(); i++) {
                // the first of several same-named columns wins
                values.putIfAbsent(headers.get(i), record.isSet(i) ? record.get(i) : "");
            }
            return new RawRow(rowNumber, values);
        }
    }
}
