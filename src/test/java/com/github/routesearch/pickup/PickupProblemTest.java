package com.github.routesearch.pickup;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.StringReader;
import java.util.Objects;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PickupProblemTest {
    @Test
    void readsBlocksInFileOrder() throws IOException {
        PickupProblem problem;
        try (var reader = new InputStreamReader(
                Objects.requireNonNull(getClass().getResourceAsStream("sample.txt")), UTF_8)) {
            problem = PickupProblem.read(reader);
        }
        var expected = PickupSolutionTest.twoContainers();

        assertEquals(2, problem.size());
        for (var from = 0; from < 2; from++) {
            for (var fromOrientation = 0; fromOrientation < 2; fromOrientation++) {
                assertEquals(expected.entryCost(from, fromOrientation), problem.entryCost(from, fromOrientation));
                assertEquals(expected.exitCost(from, fromOrientation), problem.exitCost(from, fromOrientation));

                for (var to = 0; to < 2; to++) {
                    for (var toOrientation = 0; toOrientation < 2; toOrientation++) {
                        assertEquals(expected.transitionCost(from, fromOrientation, to, toOrientation),
                                problem.transitionCost(from, fromOrientation, to, toOrientation));
                    }
                }
            }
        }
        // block 4 of the file is orientation pair 10
        assertEquals(40.0, problem.transitionCost(new Pickup(0, 1), new Pickup(1, 0)));
        assertEquals(31.0, problem.transitionCost(new Pickup(1, 1), new Pickup(0, 1)));
    }

    @Test
    void rejectsMalformedInput() {
        var truncated = assertThrows(IllegalArgumentException.class,
                () -> PickupProblem.read(new StringReader("2\n1 2\n3 4\n5 6\n")));
        assertTrue(truncated.getMessage().contains("end of input"));

        var wrongCount = assertThrows(IllegalArgumentException.class,
                () -> PickupProblem.read(new StringReader("2\n1 2 3\n")));
        assertTrue(wrongCount.getMessage().startsWith("line 2"));

        var notANumber = assertThrows(IllegalArgumentException.class,
                () -> PickupProblem.read(new StringReader("2\n1 x\n")));
        assertTrue(notANumber.getMessage().contains("not a number: x"));

        assertThrows(IllegalArgumentException.class, () -> PickupProblem.read(new StringReader("0\n")));
        assertThrows(IllegalArgumentException.class, () -> PickupProblem.read(new StringReader("")));
    }

    @Test
    void validatesDimensions() {
        assertThrows(IllegalArgumentException.class, () -> new PickupProblem(
                new double[][]{{1, 2}, {3}},
                new double[][]{{5, 6}, {7, 8}},
                new double[4][2][2]));
        assertThrows(IllegalArgumentException.class, () -> new PickupProblem(
                new double[][]{{1, 2}, {3, 4}},
                new double[][]{{5, 6}, {7, 8}},
                new double[3][2][2]));
        assertThrows(IllegalArgumentException.class, () -> new PickupProblem(
                new double[][]{{1, 2}, {3, 4}},
                new double[][]{{5, 6}, {7, Double.NaN}},
                new double[4][2][2]));
    }

    @Test
    void tablesAreCopied() {
        var entry = new double[][]{{1}, {2}};
        var problem = new PickupProblem(entry, new double[][]{{0}, {0}}, new double[4][1][1]);

        entry[0][0] = 100;
        assertEquals(1.0, problem.entryCost(0, 0));
    }
}
