package com.aistudio.orchestrator.workflow;

import java.util.Objects;

/**
 * How one entry of an agent's result map lands in the workflow context.
 *
 * @param contextKey context key written by the binding
 * @param kind       resolution rule
 * @param sourceKey  result key read by {@link Kind#DIRECT} and {@link Kind#RENAME_FROM}
 */
public record OutputBinding(String contextKey, Kind kind, String sourceKey) {

    public enum Kind {
        /** {@code context[contextKey] = result[contextKey]} */
        DIRECT,
        /** {@code context[contextKey] = result} */
        WHOLE_RESULT,
        /** {@code context[contextKey] = result[sourceKey]} */
        RENAME_FROM,
        /**
         * Verbatim key, else the whole result for a single-output step, else the
         * one result key ending with {@code contextKey}.
         */
        INFERRED
    }

    public OutputBinding {
        Objects.requireNonNull(contextKey, "contextKey");
        Objects.requireNonNull(kind, "kind");
        if (kind == Kind.RENAME_FROM && sourceKey == null) {
            throw new IllegalArgumentException("RENAME_FROM binding for '" + contextKey + "' needs a source key");
        }
        if (kind == Kind.DIRECT) sourceKey = contextKey;
    }

    public static OutputBinding direct(String key)                          { return new OutputBinding(key, Kind.DIRECT, key); }
    public static OutputBinding wholeResult(String contextKey)              { return new OutputBinding(contextKey, Kind.WHOLE_RESULT, null); }
    public static OutputBinding renameFrom(String contextKey, String source) { return new OutputBinding(contextKey, Kind.RENAME_FROM, source); }
    public static OutputBinding inferred(String key)                        { return new OutputBinding(key, Kind.INFERRED, null); }
}
