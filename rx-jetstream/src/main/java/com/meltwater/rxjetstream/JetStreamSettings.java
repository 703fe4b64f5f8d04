package com.meltwater.rxjetstream;

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;

/**
 * This class contains the JetStream settings used by a {@link Context}.
 *
 * Either an explicit api prefix or a domain can be configured, not both.
 */
public class JetStreamSettings {

    public static final String DEFAULT_API_PREFIX = "$JS.API";

    private String api_prefix   = DEFAULT_API_PREFIX;
    private String domain       = null; //null means the local domain

    public String getApi_prefix() {
        return api_prefix;
    }

    public String getDomain() {
        return domain;
    }

    /**
     * @return the prefix of the JetStream api subjects, derived from the domain if one is set
     */
    public String resolveApiPrefix() {
        if (domain != null) {
            return "$JS." + domain + ".API";
        }
        return api_prefix;
    }

    public JetStreamSettings withApiPrefix(String api_prefix) {
        Preconditions.checkArgument(isValidToken(api_prefix), "Invalid api prefix: '%s'", api_prefix);
        Preconditions.checkArgument(domain == null, "An api prefix can not be combined with a domain");
        this.api_prefix = api_prefix;
        return this;
    }

    public JetStreamSettings withDomain(String domain) {
        Preconditions.checkArgument(isValidToken(domain), "Invalid domain: '%s'", domain);
        Preconditions.checkArgument(DEFAULT_API_PREFIX.equals(api_prefix), "A domain can not be combined with an api prefix");
        this.domain = domain;
        return this;
    }

    private static boolean isValidToken(String value) {
        return value != null
                && !value.isEmpty()
                && CharMatcher.whitespace().matchesNoneOf(value)
                && !value.startsWith(".")
                && !value.endsWith(".");
    }

    @Override
    public String toString() {
        return "{" +
                "api_prefix:'" + api_prefix + "'" +
                ", domain:'" + domain + "'" +
                '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        JetStreamSettings that = (JetStreamSettings) o;
        if (!api_prefix.equals(that.api_prefix)) return false;
        return !(domain != null ? !domain.equals(that.domain) : that.domain != null);
    }

    @Override
    public int hashCode() {
        int result = api_prefix.hashCode();
        result = 31 * result + (domain != null ? domain.hashCode() : 0);
        return result;
    }
}
