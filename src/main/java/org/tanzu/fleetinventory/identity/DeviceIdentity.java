package org.tanzu.fleetinventory.identity;

import java.util.Locale;
import java.util.Objects;

/**
 * Canonical identity of a device, used to correlate the same machine across inventory sources.
 *
 * An identity is a short name plus an optional domain, both upper-cased. Equality is a
 * correlation rule rather than strict value equality: two identities are equal when their
 * short names match and either one of them carries no domain or both domains match.
 * The hash code is derived from the short name only, so identities that correlate always
 * share a hash bucket.
 *
 * The raw name the identity was derived from is kept for display and does not take part
 * in equality.
 *
 * Instances are created by {@link DeviceIdentityNormalizer}.
 */
public final class DeviceIdentity implements Comparable<DeviceIdentity> {

    private final String shortName;
    private final String domain;
    private final String rawName;

    DeviceIdentity(String shortName, String domain, String rawName) {
        this.shortName = shortName.toUpperCase(Locale.ROOT);
        this.domain = domain == null || domain.isEmpty() ? null : domain.toUpperCase(Locale.ROOT);
        this.rawName = rawName;
    }

    /**
     * Creates an identity from an already-normalized short name and optional domain.
     *
     * @param shortName The short name (case is ignored)
     * @param domain The domain, or null if unknown
     * @return The identity
     */
    public static DeviceIdentity of(String shortName, String domain) {
        Objects.requireNonNull(shortName, "shortName");
        return new DeviceIdentity(shortName, domain, domain == null ? shortName : domain + "\\" + shortName);
    }

    public String getShortName() { return shortName; }
    public String getDomain() { return domain; }
    public String getRawName() { return rawName; }
    public boolean hasDomain() { return domain != null; }

    /**
     * Checks whether the other identity names the same short name but a different domain.
     *
     * Such a pair is never merged: it is reported as a merge conflict.
     *
     * @param other The identity to compare against
     * @return true if short names match and both domains are present but differ
     */
    public boolean conflictsWith(DeviceIdentity other) {
        return other != null
                && shortName.equals(other.shortName)
                && domain != null
                && other.domain != null
                && !domain.equals(other.domain);
    }

    /**
     * Returns the identity with the domain filled in, when this one has none.
     *
     * @param fallbackDomain Domain to use if this identity carries none
     * @return This identity, or a copy carrying the fallback domain
     */
    public DeviceIdentity withDomainIfAbsent(String fallbackDomain) {
        if (domain != null || fallbackDomain == null || fallbackDomain.isEmpty()) {
            return this;
        }
        return new DeviceIdentity(shortName, fallbackDomain, rawName);
    }

    /**
     * Renders the identity as {@code DOMAIN\SHORTNAME}, or the short name alone.
     *
     * @return The qualified name
     */
    public String qualifiedName() {
        return domain == null ? shortName : domain + "\\" + shortName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DeviceIdentity)) return false;
        DeviceIdentity other = (DeviceIdentity) o;
        if (!shortName.equals(other.shortName)) return false;
        return domain == null || other.domain == null || domain.equals(other.domain);
    }

    @Override
    public int hashCode() {
        return shortName.hashCode();
    }

    @Override
    public int compareTo(DeviceIdentity other) {
        int byName = shortName.compareTo(other.shortName);
        if (byName != 0) {
            return byName;
        }
        String left = domain == null ? "" : domain;
        String right = other.domain == null ? "" : other.domain;
        return left.compareTo(right);
    }

    @Override
    public String toString() {
        return "DeviceIdentity{" + qualifiedName() + (rawName.equalsIgnoreCase(qualifiedName()) ? "" : ", raw='" + rawName + '\'') + '}';
    }
}
