package org.calista.steer.events;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.calista.steer.generate.GenerationResult;

/**
 * One journal record. Public fields so Jackson binds it without annotations on accessors.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class RunEvent {
    public String type;          // "RUN", "RUN_FAILED", "SESSION_START", "SESSION_END"
    public long tsEpochMs;
    public String sessionId;
    public String query;
    public String bestSequence;
    public Double bestLogWeight;
    public Integer steps;
    public Boolean timedOut;
    public Long elapsedMs;
    public Integer resampleCount;
    public String error;

    public static RunEvent of(String type, String sessionId, long tsEpochMs) {
        RunEvent e = new RunEvent();
        e.type = type;
        e.sessionId = sessionId;
        e.tsEpochMs = tsEpochMs;
        return e;
    }

    public static RunEvent completed(String sessionId, String query, GenerationResult r, long tsEpochMs) {
        RunEvent e = of("RUN", sessionId, tsEpochMs);
        e.query = query;
        e.bestSequence = r.bestSequence();
        e.bestLogWeight = Double.isFinite(r.bestLogWeight()) ? r.bestLogWeight() : null;
        e.steps = r.stepsCompleted();
        e.timedOut = r.timedOut();
        e.elapsedMs = r.elapsed().toMillis();
        e.resampleCount = r.resampleCount();
        return e;
    }

    public static RunEvent failed(String sessionId, String query, Throwable error, long tsEpochMs) {
        RunEvent e = of("RUN_FAILED", sessionId, tsEpochMs);
        e.query = query;
        e.error = error.getClass().getSimpleName() + ": " + error.getMessage();
        return e;
    }
}
