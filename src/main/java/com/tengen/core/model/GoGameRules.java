package com.tengen.core.model;

/**
 * Rule parameters that are mirrored into the engine with {@code go_param_rules}.
 */
public record GoGameRules(KoRule koRule, ScoringSystem scoringSystem) {

    public static final GoGameRules DEFAULT = new GoGameRules(KoRule.SIMPLE, ScoringSystem.AREA_SCORING);

    public enum KoRule {
        SIMPLE("simple"),
        SUPERKO_POSITIONAL("pos_superko"),
        SUPERKO_SITUATIONAL("superko");

        private final String gtpName;

        KoRule(String gtpName) {
            this.gtpName = gtpName;
        }

        public String gtpName() {
            return gtpName;
        }
    }

    public enum ScoringSystem {
        AREA_SCORING,
        TERRITORY_SCORING;

        /** Value for {@code go_param_rules japanese_scoring}. */
        public int japaneseScoring() {
            return this == TERRITORY_SCORING ? 1 : 0;
        }

        /** Value for {@code go_param_rules extra_handicap_komi}. */
        public int handicapCompensation() {
            return this == AREA_SCORING ? 1 : 0;
        }
    }
}
