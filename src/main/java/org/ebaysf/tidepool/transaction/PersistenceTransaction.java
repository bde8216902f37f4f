package org.ebaysf.tidepool.transaction;

import com.google.common.collect.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * A tag passed through every persistence call made on behalf of one transaction.
 * Callbacks registered with {@link #addOnCommittedListener(Runnable)} run once the transaction's result
 * is available, and never on the commit path itself.
 */
public abstract class PersistenceTransaction {

    private static final Logger LOG = LoggerFactory.getLogger(PersistenceTransaction.class);

    private final List<Runnable> _onCommittedListeners = Lists.newArrayList();

    public abstract long getCurrentSequenceNumber();

    public void addOnCommittedListener(final Runnable listener) {

        _onCommittedListeners.add(listener);
    }

    public void raiseOnCommittedEvent() {

        LOG.trace("[transaction] raising committed event to {} listeners", _onCommittedListeners.size());

        for (Runnable listener : _onCommittedListeners) {
            listener.run();
        }
    }
}
