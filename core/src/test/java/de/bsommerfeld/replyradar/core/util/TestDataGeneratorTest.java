package de.bsommerfeld.replyradar.core.util;

import de.bsommerfeld.replyradar.core.domain.Item;
import de.bsommerfeld.replyradar.core.domain.ItemType;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TestDataGeneratorTest {

    @Test
    void generateItems_shouldProduceUniqueIds() {
        List<Item> items = new TestDataGenerator(42).generateItems(50);

        Set<String> ids = new HashSet<>();
        items.forEach(i -> ids.add(i.effectiveId()));
        assertEquals(50, ids.size());
    }

    @Test
    void generateItems_searchItemsShouldCarryKeyword() {
        for (Item item : new TestDataGenerator(7).generateItems(100)) {
            assertNotNull(item.published());
            if (item.type() == ItemType.SEARCH) {
                assertNotNull(item.searchKeyword());
            } else {
                assertNull(item.searchKeyword());
            }
        }
    }
}
