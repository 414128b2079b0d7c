package org.Aayush.wayfinder.routing.search;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class VisitedSetTest {

    @Test
    @DisplayName("First mark wins, later marks report already visited")
    void testMarkVisited() {
        VisitedSet visited = new VisitedSet(10);

        assertTrue(visited.markVisited(3));
        assertFalse(visited.markVisited(3));
        assertTrue(visited.isVisited(3));
        assertFalse(visited.isVisited(4));
        assertEquals(1, visited.count());
    }

    @Test
    @DisplayName("Count tracks distinct marked nodes")
    void testCount() {
        VisitedSet visited = new VisitedSet(100);
        for (int i = 0; i < 100; i += 7) {
            visited.markVisited(i);
            visited.markVisited(i);
        }
        assertEquals(15, visited.count());
        assertFalse(visited.isVisited(1));
    }
}
