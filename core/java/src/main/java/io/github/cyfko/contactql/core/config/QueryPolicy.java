package io.github.cyfko.contactql.core.config;

/**
 * Parsing limits and options applied by {@link io.github.cyfko.contactql.core.impl.BasicQueryParser}.
 *
 * <h2>Predefined Policies</h2>
 * <ul>
 *   <li>{@link #defaults()} - 5000 characters, phone query cleanup on</li>
 *   <li>{@link #strict()} - 1000 characters, for queries typed into public-facing inputs</li>
 *   <li>{@link #relaxed()} - 10000 characters, for saved group queries built by tools</li>
 * </ul>
 *
 * <pre>{@code
 * QueryPolicy policy = QueryPolicy.builder()
 *     .maxQueryLength(2000)
 *     .cleanPhoneQueries(false)
 *     .build();
 * }</pre>
 *
 * @param policyName        name reported in error messages
 * @param maxQueryLength    maximum query length in characters after trimming
 * @param cleanPhoneQueries whether a query made only of phone characters ({@code +12 (34)-56})
 *                          is stripped to its digits before parsing, in non-anonymous organizations
 * @since 1.0.0
 */
public record QueryPolicy(String policyName, int maxQueryLength, boolean cleanPhoneQueries) {

    public QueryPolicy {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
        if (maxQueryLength <= 0) {
            throw new IllegalArgumentException("maxQueryLength must be positive, got: " + maxQueryLength);
        }
    }

    public static QueryPolicy defaults() {
        return new QueryPolicy(PolicyName.DEFAULT_POLICY.name(), 5000, true);
    }

    public static QueryPolicy strict() {
        return new QueryPolicy(PolicyName.STRICT_POLICY.name(), 1000, true);
    }

    public static QueryPolicy relaxed() {
        return new QueryPolicy(PolicyName.RELAXED_POLICY.name(), 10000, true);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String _policyName = PolicyName.CUSTOM_POLICY.name();
        private int _maxQueryLength = 5000;
        private boolean _cleanPhoneQueries = true;

        private Builder() {}

        public QueryPolicy build() {
            return new QueryPolicy(_policyName, _maxQueryLength, _cleanPhoneQueries);
        }

        public Builder policyName(String policyName) { this._policyName = policyName; return this; }
        public Builder maxQueryLength(int maxQueryLength) { this._maxQueryLength = maxQueryLength; return this; }
        public Builder cleanPhoneQueries(boolean clean) { this._cleanPhoneQueries = clean; return this; }
    }

    public enum PolicyName {
        DEFAULT_POLICY,
        STRICT_POLICY,
        RELAXED_POLICY,
        CUSTOM_POLICY
    }
}
