package org.calista.steer.generate.potential.impl;

import org.calista.steer.generate.SequenceState;
import org.calista.steer.generate.potential.AbstractPotential;
import org.calista.steer.generate.potential.PotentialScope;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.HostAccess;
import org.graalvm.polyglot.PolyglotException;
import org.graalvm.polyglot.Source;
import org.graalvm.polyglot.Value;

import java.util.Objects;

/**
 * Potential written in JavaScript.
 *
 * <p>The script must define {@code function score(text, appendedText, done)} returning a number.
 * A polyglot context admits one thread at a time, so calls are serialized on this instance.</p>
 */
public final class ScriptPotential extends AbstractPotential implements AutoCloseable {

    private final Context context;
    private final boolean ownsContext;
    private final Value scoreFn;

    public ScriptPotential(String name, PotentialScope scope, boolean fatalOnError, Context context, String script) {
        this(name, scope, fatalOnError, context, script, false);
    }

    private ScriptPotential(String name, PotentialScope scope, boolean fatalOnError, Context context, String script, boolean ownsContext) {
        super(name, scope, fatalOnError);
        this.context = Objects.requireNonNull(context, "context");
        this.ownsContext = ownsContext;
        Objects.requireNonNull(script, "script");

        Value fn;
        synchronized (context) {
            context.eval(Source.create("js", script));
            fn = context.getBindings("js").getMember("score");
        }
        if (fn == null || !fn.canExecute()) {
            if (ownsContext) context.close();
            throw new IllegalArgumentException("Script for potential '" + name + "' does not define function score(text, appendedText, done)");
        }
        this.scoreFn = fn;
    }

    /** Potential with its own sandboxed JS context; close it when done. */
    public static ScriptPotential standalone(String name, PotentialScope scope, String script) {
        Context ctx = Context.newBuilder("js")
                .allowHostAccess(HostAccess.NONE)
                .option("engine.WarnInterpreterOnly", "false")
                .build();
        return new ScriptPotential(name, scope, false, ctx, script, true);
    }

    @Override
    public double score(SequenceState state) {
        synchronized (context) {
            try {
                Value r = scoreFn.execute(state.text(), state.appendedText(), state.done());
                if (!r.isNumber()) {
                    throw new IllegalStateException("score() of '" + name() + "' returned a non-number: " + r);
                }
                return r.asDouble();
            } catch (PolyglotException e) {
                throw new IllegalStateException("score() of '" + name() + "' failed: " + e.getMessage(), e);
            }
        }
    }

    @Override
    public void close() {
        if (ownsContext) {
            synchronized (context) {
                context.close(true);
            }
        }
    }
}
