package com.brigade.vacuum.core.model;

/**
 * Upper bound on the number of retained builds.
 */
public sealed interface CountLimit permits CountLimit.Unlimited, CountLimit.AtMost {

    /** Value of {@code max-builds} meaning "keep everything". */
    int NO_MAX_BUILDS = -1;

    CountLimit UNLIMITED = new Unlimited();

    record Unlimited() implements CountLimit {
        @Override
        public String toString() {
            return "unlimited";
        }
    }

    record AtMost(int max) implements CountLimit {
        public AtMost {
            if (max < 0) {
                throw new IllegalArgumentException("max must be >= 0: " + max);
            }
        }

        @Override
        public String toString() {
            return "at most " + max;
        }
    }

    /**
     * @throws IllegalArgumentException for values below {@link #NO_MAX_BUILDS}
     */
    static CountLimit fromMaxBuilds(int maxBuilds) {
        if (maxBuilds == NO_MAX_BUILDS) {
            return UNLIMITED;
        }
        if (maxBuilds < NO_MAX_BUILDS) {
            throw new IllegalArgumentException("max-builds must be -1 or >= 0: " + maxBuilds);
        }
        return new AtMost(maxBuilds);
    }
}
