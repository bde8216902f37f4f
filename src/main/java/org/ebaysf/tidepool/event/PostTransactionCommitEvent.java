package org.ebaysf.tidepool.event;

import org.ebaysf.tidepool.transaction.PersistenceTransaction;

import java.util.EventObject;

/**
 * Posted once a transaction has committed and its result is available.
 */
public class PostTransactionCommitEvent extends EventObject {

    private final String _action;

    public PostTransactionCommitEvent(final PersistenceTransaction source, final String action) {

        super(source);

        _action = action;
    }

    public @Override PersistenceTransaction getSource() {

        return (PersistenceTransaction) super.getSource();
    }

    public String getAction() {

        return _action;
    }
}
