package dev.bykey.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Reads the records of a JSON array lazily, as a single-pass input for the
 * by-key operations.
 *
 * <p>Built on Jackson's streaming {@link JsonParser}: a record is bound only
 * when the consumer asks for it, so the document is never held as a whole.
 *
 * <p>Two layouts are accepted, a top-level array or an object holding the
 * array under a named top-level field (default {@code "data"}):
 * <pre>{@code
 * {
 *   "data": [
 *     {"sensor": "boiler", "celsius": 71.5},
 *     {"sensor": "attic", "celsius": 24.0}
 *   ]
 * }
 * }</pre>
 *
 * @param <T> the record type
 */
public class StreamingJsonParser<T> {

    private static final Logger LOGGER = LogManager.getLogger(StreamingJsonParser.class);

    static final String DEFAULT_ARRAY_FIELD = "data";

    private final ObjectMapper objectMapper;
    private final JavaType recordType;
    private final String arrayField;

    public StreamingJsonParser(Class<T> recordClass) {
        this(recordClass, DEFAULT_ARRAY_FIELD);
    }

    public StreamingJsonParser(Class<T> recordClass, String arrayField) {
        this(new ObjectMapper(), recordClass, arrayField);
    }

    /**
     * @param objectMapper mapper used to bind each record
     * @param recordClass the record type
     * @param arrayField top-level field holding the array when the document is an object
     */
    public StreamingJsonParser(ObjectMapper objectMapper, Class<T> recordClass, String arrayField) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.recordType = objectMapper.getTypeFactory().constructType(recordClass);
        this.arrayField = Objects.requireNonNull(arrayField, "arrayField must not be null");
    }

    /**
     * Opens a lazy stream over the records of {@code inputStream}.
     *
     * <p>Closing the returned stream closes the parser and, with it, the input
     * stream. A malformed record surfaces as an {@link UncheckedIOException}
     * from the terminal operation.
     *
     * @return the records in document order, empty if the document holds no array
     * @throws IOException if the document cannot be read up to the array
     */
    public Stream<T> parseItems(InputStream inputStream) throws IOException {
        JsonParser parser = objectMapper.getFactory().createParser(inputStream);
        try {
            if (!seekArray(parser)) {
                LOGGER.debug("No record array under top-level field '{}'", arrayField);
                parser.close();
                return Stream.empty();
            }
        } catch (IOException e) {
            parser.close();
            throw e;
        }
        Spliterator<T> records = Spliterators.spliteratorUnknownSize(
                new RecordIterator(parser), Spliterator.ORDERED | Spliterator.NONNULL);
        return StreamSupport.stream(records, false).onClose(() -> close(parser));
    }

    /**
     * Leaves the parser on the START_ARRAY token of the record array.
     */
    private boolean seekArray(JsonParser parser) throws IOException {
        JsonToken root = parser.nextToken();
        if (root == JsonToken.START_ARRAY) {
            return true;
        }
        if (root != JsonToken.START_OBJECT) {
            return false;
        }
        while (parser.nextToken() == JsonToken.FIELD_NAME) {
            String field = parser.currentName();
            JsonToken value = parser.nextToken();
            if (arrayField.equals(field) && value == JsonToken.START_ARRAY) {
                return true;
            }
            parser.skipChildren();
        }
        return false;
    }

    private static void close(JsonParser parser) {
        try {
            parser.close();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to close JSON parser", e);
        }
    }

    /**
     * Binds one array element per {@link #next()} call.
     */
    private final class RecordIterator implements Iterator<T> {

        private final JsonParser parser;
        private JsonToken pending;
        private boolean exhausted;

        RecordIterator(JsonParser parser) {
            this.parser = parser;
        }

        @Override
        public boolean hasNext() {
            if (exhausted) {
                return false;
            }
            if (pending == null) {
                try {
                    pending = parser.nextToken();
                } catch (IOException e) {
                    exhausted = true;
                    throw new UncheckedIOException("Failed to read JSON record", e);
                }
                if (pending == null || pending == JsonToken.END_ARRAY) {
                    exhausted = true;
                    return false;
                }
            }
            return true;
        }

        @Override
        public T next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            pending = null;
            try {
                return objectMapper.readValue(parser, recordType);
            } catch (IOException e) {
                exhausted = true;
                throw new UncheckedIOException("Failed to parse JSON record", e);
            }
        }
    }
}
