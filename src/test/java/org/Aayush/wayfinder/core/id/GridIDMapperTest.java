package org.Aayush.wayfinder.core.id;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Grid ID Mapper Tests")
class GridIDMapperTest {

    private final GridIDMapper mapper = new GridIDMapper(4, 5);

    @Test
    @DisplayName("Row-major flattening and its inverse")
    void testIndexRoundTrip() {
        assertEquals(0, mapper.toIndex(0, 0));
        assertEquals(7, mapper.toIndex(1, 2));
        assertEquals(19, mapper.toIndex(3, 4));

        assertEquals(new GridIDMapper.Cell(1, 2), mapper.toCell(7));
        assertEquals(3, mapper.rowOf(19));
        assertEquals(4, mapper.columnOf(19));
        assertEquals(20, mapper.size());
    }

    @Test
    @DisplayName("External ids use the rendered (row, col) form")
    void testExternalForm() {
        assertEquals("(1, 2)", mapper.toExternal(7));
        assertEquals(7, mapper.toInternal("(1, 2)"));
        assertEquals(7, mapper.toInternal("1,2"));
        assertEquals(7, mapper.toInternal(" ( 1 ,2 ) "));
        assertTrue(mapper.containsExternal("(3, 4)"));
        assertFalse(mapper.containsExternal("(4, 0)"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "abc", "(1)", "(1, 2, 3)", "(-1, 0)", "(0, 5)", "(99999999999, 0)"})
    @DisplayName("Malformed or outside cell ids are unknown")
    void testUnknownExternalIds(String externalId) {
        assertThrows(IDMapper.UnknownIDException.class, () -> mapper.toInternal(externalId));
    }

    @Test
    @DisplayName("Bounds errors on cells and indices")
    void testBounds() {
        assertThrows(IndexOutOfBoundsException.class, () -> mapper.toIndex(4, 0));
        assertThrows(IndexOutOfBoundsException.class, () -> mapper.toIndex(0, -1));
        assertThrows(IndexOutOfBoundsException.class, () -> mapper.toCell(20));
        assertThrows(IndexOutOfBoundsException.class, () -> mapper.toExternal(-1));
        assertFalse(mapper.isValid(-1, 0));
        assertTrue(mapper.isValid(3, 4));
    }

    @Test
    @DisplayName("Dimensions must be positive")
    void testDimensionValidation() {
        assertThrows(IllegalArgumentException.class, () -> new GridIDMapper(0, 3));
        assertThrows(IllegalArgumentException.class, () -> new GridIDMapper(3, -1));
        assertThrows(IllegalArgumentException.class, () -> new GridIDMapper(100_000, 100_000));
    }
}
