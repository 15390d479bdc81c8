package org.pragmatica.litedoc.error;

import org.pragmatica.litedoc.parser.Profile;

import java.util.EnumMap;
import java.util.Map;

/**
 * Lookup table from (error kind, profile) to the recovery the parser applies and
 * whether the diagnostic is fatal for the strict entry point.
 *
 * <p>The applied strategy is the same under every profile, so the best-effort tree does
 * not depend on strictness; profiles differ in which diagnostics are fatal. A policy is
 * immutable; {@link #with(ParseErrorKind, RecoveryStrategy)} derives a new one.
 */
public final class RecoveryPolicy {
    public static final RecoveryPolicy DEFAULT = new RecoveryPolicy(defaults());

    private final Map<ParseErrorKind, RecoveryStrategy> strategies;

    private RecoveryPolicy(Map<ParseErrorKind, RecoveryStrategy> strategies) {
        this.strategies = strategies;
    }

    /**
     * One table entry.
     */
    public record Recovery(RecoveryStrategy strategy, boolean fatal) {}

    private static Map<ParseErrorKind, RecoveryStrategy> defaults() {
        var table = new EnumMap<ParseErrorKind, RecoveryStrategy>(ParseErrorKind.class);
        for (var kind : ParseErrorKind.values()) {
            table.put(kind, kind.defaultStrategy());
        }
        return table;
    }

    /**
     * Policy applying {@code strategy} for {@code kind} and this policy's entries otherwise.
     *
     * @throws IllegalArgumentException when the parser cannot apply {@code strategy} to {@code kind}
     */
    public RecoveryPolicy with(ParseErrorKind kind, RecoveryStrategy strategy) {
        if (!kind.supports(strategy)) {
            throw new IllegalArgumentException("Recovery " + strategy + " is not supported for " + kind
                                               + ", expected one of " + kind.supportedStrategies());
        }
        var table = new EnumMap<>(strategies);
        table.put(kind, strategy);
        return new RecoveryPolicy(table);
    }

    public Recovery lookup(ParseErrorKind kind, Profile profile) {
        var strategy = strategies.get(kind);
        return new Recovery(strategy, profile.isStrict() || strategy == RecoveryStrategy.ABORT);
    }

    public RecoveryStrategy strategyFor(ParseErrorKind kind, Profile profile) {
        return lookup(kind, profile).strategy();
    }

    public boolean isFatal(ParseErrorKind kind, Profile profile) {
        return lookup(kind, profile).fatal();
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof RecoveryPolicy policy && strategies.equals(policy.strategies);
    }

    @Override
    public int hashCode() {
        return strategies.hashCode();
    }

    @Override
    public String toString() {
        return "RecoveryPolicy" + strategies;
    }
}
