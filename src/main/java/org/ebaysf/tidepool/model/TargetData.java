package org.ebaysf.tidepool.model;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/**
 * Metadata of an active query subscription, keyed by its canonical target string.
 */
public final class TargetData {

    private final String _target;
    private final int _targetId;
    private final long _sequenceNumber;

    public TargetData(final String target, final int targetId, final long sequenceNumber) {

        _target = Preconditions.checkNotNull(target);
        _targetId = targetId;
        _sequenceNumber = sequenceNumber;
    }

    public String getTarget() {
        return _target;
    }

    public int getTargetId() {
        return _targetId;
    }

    public long getSequenceNumber() {
        return _sequenceNumber;
    }

    public TargetData withSequenceNumber(final long sequenceNumber) {

        return new TargetData(_target, _targetId, sequenceNumber);
    }

    public @Override boolean equals(final Object other) {

        if (!(other instanceof TargetData)) {
            return false;
        }
        final TargetData that = (TargetData) other;
        return _targetId == that._targetId
                && _sequenceNumber == that._sequenceNumber
                && _target.equals(that._target);
    }

    public @Override int hashCode() {

        return Objects.hashCode(_target, _targetId, _sequenceNumber);
    }

    public @Override String toString() {

        return MoreObjects.toStringHelper(this)
                .add("target", _target)
                .add("targetId", _targetId)
                .add("sequenceNumber", _sequenceNumber)
                .toString();
    }
}
