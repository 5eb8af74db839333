package de.bsommerfeld.replyradar.reddit;

import com.google.inject.Singleton;
import de.bsommerfeld.replyradar.core.domain.Item;
import de.bsommerfeld.replyradar.core.util.TestDataGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Offline stub that replaces {@link RedditContentSource} when the
 * application runs in TEST mode. No HTTP requests are made; every call
 * returns {@value #ITEMS_PER_FETCH} synthetic items from
 * {@link TestDataGenerator}.
 */
@Singleton
public class TestContentSource implements ContentSource {

    private static final Logger LOG = LoggerFactory.getLogger(TestContentSource.class);

    static final int ITEMS_PER_FETCH = 25;

    private final TestDataGenerator generator;

    public TestContentSource() {
        this(new TestDataGenerator());
    }

    TestContentSource(TestDataGenerator generator) {
        this.generator = generator;
        LOG.warn("#######################################################");
        LOG.warn("#  TEST MODE ENABLED: Reddit fetching is DISABLED     #");
        LOG.warn("#  Using Dummy Data Generator for content             #");
        LOG.warn("#######################################################");
    }

    @Override
    public List<Item> fetchAllNewItems() {
        List<Item> items = generator.generateItems(ITEMS_PER_FETCH);
        LOG.debug("[TEST] Generated {} items", items.size());
        return items;
    }
}
