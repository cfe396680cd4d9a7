package dev.tabsuite.formatter.config;

/**
 * Which layout transforms run.
 */
public record EnabledTransforms(boolean alignKeywords,
                                boolean alignTestCases,
                                boolean alignSettings,
                                boolean alignVariables,
                                boolean splitTooLongLines,
                                boolean alignTemplatedTestCases) {

    /**
     * Every transform except templated test case alignment, which has to be asked for.
     */
    public static EnabledTransforms defaults() {
        return new EnabledTransforms(true, true, true, true, true, false);
    }

    public EnabledTransforms withAlignTemplatedTestCases(boolean enabled) {
        return new EnabledTransforms(alignKeywords, alignTestCases, alignSettings, alignVariables, splitTooLongLines, enabled);
    }
}
