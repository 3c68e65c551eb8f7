package org.calista.steer.sampling.particle;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Particle: one weighted hypothesis.
 *
 * <p>Immutable: every change produces a new instance, so particles can be handed to worker
 * threads without copying. {@code parentId} is -1 for particles that were never resampled.</p>
 */
public final class Particle<S> {

    public static final long NO_PARENT = -1L;

    private final long id;
    private final S state;
    private final double logWeight;
    private final long parentId;
    private final Map<String, String> metadata;

    public Particle(long id, S state, double logWeight, long parentId, Map<String, String> metadata) {
        this.id = id;
        this.state = Objects.requireNonNull(state, "state");
        this.logWeight = logWeight;
        this.parentId = parentId;
        this.metadata = (metadata == null || metadata.isEmpty())
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static <S> Particle<S> root(long id, S state) {
        return new Particle<>(id, state, 0.0, NO_PARENT, null);
    }

    public long id() { return id; }

    public S state() { return state; }

    public double logWeight() { return logWeight; }

    public long parentId() { return parentId; }

    public Map<String, String> metadata() { return metadata; }

    public boolean alive() {
        return logWeight != Double.NEGATIVE_INFINITY;
    }

    public Particle<S> withState(S newState) {
        return new Particle<>(id, newState, logWeight, parentId, metadata);
    }

    public Particle<S> withLogWeight(double w) {
        return new Particle<>(id, state, w, parentId, metadata);
    }

    /** Adds {@code delta} to the log-weight. -∞ is absorbing. */
    public Particle<S> reweighted(double delta) {
        return new Particle<>(id, state, logWeight + delta, parentId, metadata);
    }

    public Particle<S> withMeta(String key, String value) {
        LinkedHashMap<String, String> m = new LinkedHashMap<>(metadata);
        m.put(Objects.requireNonNull(key, "key"), value);
        return new Particle<>(id, state, logWeight, parentId, m);
    }

    /** Offspring of resampling: new id, parent link, log-weight reset to 0. */
    public Particle<S> offspring(long newId) {
        return new Particle<>(newId, state, 0.0, id, metadata);
    }

    @Override
    public String toString() {
        return "Particle{id=" + id + ", parent=" + parentId + ", logW=" + logWeight + ", state=" + state + "}";
    }
}
