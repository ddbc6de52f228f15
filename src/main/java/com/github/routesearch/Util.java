package com.github.routesearch;

import org.ojalgo.type.context.NumberContext;

import java.io.IOException;
import java.io.LineNumberReader;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Random;
import java.util.stream.IntStream;

/**
 * Miscellaneous utilities.
 */
public class Util {
    private Util() {
    }

    // 9 significant digits (about 1e-8 relative), and 9 decimals when comparing against zero
    private static final NumberContext TOLERANCE = NumberContext.of(9, 9);

    /**
     * Validate a cost table and return a copy of it.
     *
     * @param matrix the table, which must be <code>rows</code> x <code>cols</code>
     * @param rows   expected number of rows
     * @param cols   expected number of columns
     * @param name   used in the error message
     * @return a deep copy of <code>matrix</code>
     * @throws IllegalArgumentException if the dimensions are wrong or a cost is not finite
     */
    public static double[][] validate(double[][] matrix, int rows, int cols, String name) {
        if (matrix.length != rows) {
            throw new IllegalArgumentException(name + " must have " + rows + " rows");
        }
        if (Arrays.stream(matrix).anyMatch(row -> row.length != cols)) {
            throw new IllegalArgumentException(name + " must have " + cols + " columns");
        }
        if (Arrays.stream(matrix).flatMapToDouble(Arrays::stream).anyMatch(c -> !Double.isFinite(c))) {
            throw new IllegalArgumentException(name + " must only contain finite costs");
        }
        return Arrays.stream(matrix).map(double[]::clone).toArray(double[][]::new);
    }

    /**
     * Compare two costs with the tolerance used by {@link AbstractSolution#verify()}.
     *
     * @param expected the reference value
     * @param actual   the value to check
     * @return true if they agree to 9 significant digits, i.e. a relative difference of about 1e-8. Near zero the
     * difference must round to zero at 9 decimals, so <code>1e-9</code> already counts as different.
     */
    public static boolean isClose(double expected, double actual) {
        return !TOLERANCE.isDifferent(expected, actual);
    }

    /**
     * Shuffle the integers <code>from .. to - 1</code>.
     *
     * @param from   inclusive lower end
     * @param to     exclusive upper end
     * @param random the generator to use
     * @return a new array in uniformly random order
     */
    public static int[] shuffledRange(int from, int to, Random random) {
        var values = IntStream.range(from, to).toArray();

        for (var i = values.length - 1; i > 0; i--) {
            var j = random.nextInt(i + 1);
            var tmp = values[i];
            values[i] = values[j];
            values[j] = tmp;
        }
        return values;
    }

    /**
     * A uniformly random permutation of <code>0 .. size - 1</code>, produced lazily. This is a Fisher-Yates shuffle
     * that only records the positions it has disturbed, so taking the first <code>k</code> elements costs O(k)
     * time and space regardless of <code>size</code>.
     * <p>
     * The returned stream is sequential and single-use.
     *
     * @param size   the number of elements
     * @param random the generator to use
     * @return the permutation
     */
    public static IntStream randomPermutation(int size, Random random) {
        var displaced = new HashMap<Integer, Integer>();

        return IntStream.range(0, size).map(k -> {
            var pick = k + random.nextInt(size - k);
            var value = displaced.getOrDefault(pick, pick);
            var current = displaced.getOrDefault(k, k);

            displaced.remove(k);
            if (pick != k) {
                displaced.put(pick, current);
            }
            return value;
        });
    }

    /**
     * Read the size line that starts both problem formats.
     *
     * @param in the input
     * @return the size, at least 1
     * @throws IOException              if reading fails
     * @throws IllegalArgumentException if the line is missing, malformed or not positive
     */
    public static int readSize(LineNumberReader in) throws IOException {
        var size = (int) readRow(in, 1, true)[0];

        if (size < 1) {
            throw new IllegalArgumentException("line " + in.getLineNumber() + ": size must be positive");
        }
        return size;
    }

    /**
     * Read one line of exactly <code>count</code> whitespace-separated numbers.
     *
     * @param in       the input
     * @param count    the expected number of values
     * @param integral whether the values must be integers
     * @return the values
     * @throws IOException              if reading fails
     * @throws IllegalArgumentException if the line is missing or malformed
     */
    public static double[] readRow(LineNumberReader in, int count, boolean integral) throws IOException {
        var line = in.readLine();

        if (line == null) {
            throw new IllegalArgumentException("unexpected end of input after line " + in.getLineNumber());
        }

        var tokens = line.isBlank() ? new String[0] : line.trim().split("\\s+");
        if (tokens.length != count) {
            throw new IllegalArgumentException("line " + in.getLineNumber() + ": expected " + count +
                    " values but found " + tokens.length);
        }

        var row = new double[count];
        for (var i = 0; i < count; i++) {
            try {
                row[i] = integral ? Integer.parseInt(tokens[i]) : Double.parseDouble(tokens[i]);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("line " + in.getLineNumber() + ": not a number: " + tokens[i], e);
            }
        }
        return row;
    }
}
