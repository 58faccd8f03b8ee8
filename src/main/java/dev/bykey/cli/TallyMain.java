package dev.bykey.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.bykey.aggregation.Aggregations;
import dev.bykey.aggregation.Aggregator;
import dev.bykey.aggregation.Summation;
import dev.bykey.json.StreamingJsonParser;
import dev.bykey.ranking.Ranking;
import dev.bykey.streaming.AggregatorCollector;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Tallies the records of a JSON array by one of their fields.
 *
 * <p>The array is streamed record by record and folded in a single pass:
 * occurrences are counted per key, or a numeric field is summed per key.
 *
 * <p>Usage:
 * <pre>
 * java -cp ... dev.bykey.cli.TallyMain \
 *     --input=readings.json \
 *     --key=sensor \
 *     [--array=data] \
 *     [--sum=celsius] \
 *     [--top=3]
 * </pre>
 *
 * <p>Output: JSON to stdout, an object of key to total, or with {@code --top}
 * an array of {@code {"key":...,"value":...}} pairs, largest first:
 * <pre>
 * [{"key":"boiler","value":12},{"key":"attic","value":5}]
 * </pre>
 *
 * <p>Records without the key field are skipped. When summing, a record whose
 * sum field is missing or not a JSON number rejects the whole input.
 */
public class TallyMain {

    private static final Logger LOGGER = LogManager.getLogger(TallyMain.class);

    private final ObjectMapper objectMapper = new ObjectMapper();

    public static void main(String[] args) {
        int status = new TallyMain().run(args, System.out, System.err);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Runs the tool and returns its exit status.
     */
    int run(String[] args, PrintStream out, PrintStream err) {
        TallyOptions options;
        try {
            options = TallyOptions.parse(args);
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            err.println("Usage: java ... TallyMain --input=<file> --key=<field> [--array=<field>] [--sum=<field>] [--top=N]");
            return 1;
        }

        try {
            Object result = tally(options);
            out.println(objectMapper.writeValueAsString(result));
            return 0;
        } catch (IOException | UncheckedIOException e) {
            LOGGER.error("Failed to tally {}", options.input(), e);
            err.println("Error reading " + options.input() + ": " + e.getMessage());
            return 1;
        } catch (IllegalArgumentException e) {
            LOGGER.error("Rejected a record of {}", options.input(), e);
            err.println("Error: invalid record in " + options.input() + ": " + e.getMessage());
            return 1;
        }
    }

    /**
     * Reads the input named by {@code options} and returns the JSON-ready result.
     */
    Object tally(TallyOptions options) throws IOException {
        StreamingJsonParser<JsonNode> parser = new StreamingJsonParser<>(
                objectMapper, JsonNode.class, options.arrayField());
        String keyField = options.keyField();

        try (InputStream in = Files.newInputStream(Path.of(options.input()));
             Stream<JsonNode> records = parser.parseItems(in)) {
            Stream<JsonNode> keyed = records.filter(node -> node.hasNonNull(keyField));
            if (options.summing()) {
                String sumField = options.sumField();
                Aggregator<JsonNode, ?, Map<String, BigDecimal>> sums = Aggregations.summing(
                        node -> node.get(keyField).asText(),
                        node -> amount(node, keyField, sumField),
                        Summation.BIG_DECIMAL,
                        0);
                return finish(collect(keyed, sums), options);
            }
            Aggregator<JsonNode, ?, Map<String, Long>> counts = Aggregations.counting(
                    node -> node.get(keyField).asText());
            return finish(collect(keyed, counts), options);
        }
    }

    private static BigDecimal amount(JsonNode node, String keyField, String sumField) {
        JsonNode field = node.get(sumField);
        if (field == null || !field.isNumber()) {
            throw new IllegalArgumentException("Field '" + sumField + "' of record with key '"
                    + node.get(keyField).asText() + "' is not a number: " + (field == null ? "missing" : field));
        }
        return field.decimalValue();
    }

    private static <A, R> R collect(Stream<JsonNode> records, Aggregator<JsonNode, A, R> aggregator) {
        return records.collect(AggregatorCollector.of(aggregator));
    }

    private static <V extends Comparable<? super V>> Object finish(Map<String, V> totals, TallyOptions options) {
        LOGGER.info("Tallied {} keys by '{}'", totals.size(), options.keyField());
        if (options.top().isPresent()) {
            return Ranking.topKByValue(totals, options.top().getAsInt());
        }
        return totals;
    }
}
