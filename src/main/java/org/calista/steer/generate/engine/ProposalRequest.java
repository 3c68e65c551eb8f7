package org.calista.steer.generate.engine;

import org.calista.steer.generate.SequenceState;

import java.util.Objects;

/**
 * A live particle to advance: its population index, the random stream it draws from, and its
 * current state. With one candidate per particle the stream equals the index; candidate {@code j}
 * of particle {@code i} among {@code k} uses stream {@code i * k + j}.
 */
public final class ProposalRequest {

    private final int index;
    private final int stream;
    private final SequenceState state;

    public ProposalRequest(int index, SequenceState state) {
        this(index, index, state);
    }

    public ProposalRequest(int index, int stream, SequenceState state) {
        if (stream < 0) throw new IllegalArgumentException("stream must be >= 0: " + stream);
        this.index = index;
        this.stream = stream;
        this.state = Objects.requireNonNull(state, "state");
    }

    public int index() {
        return index;
    }

    public int stream() {
        return stream;
    }

    public SequenceState state() {
        return state;
    }
}
