package org.tanzu.fleetinventory.identity;

import java.util.regex.Pattern;

/**
 * Derives a canonical {@link DeviceIdentity} from the name formats used by the different
 * management planes.
 *
 * Supported forms:
 * - {@code NAME} (short name)
 * - {@code DOMAIN\NAME} (broker and directory style)
 * - {@code name.domain.tld} (DNS style; the first label after the host is the implied domain)
 * - {@code vmname<split>suffix} (hypervisor display names, when a split character is supplied)
 *
 * Normalization never fails. Input that does not fit any form keeps the whole trimmed
 * string as the short name.
 */
public final class DeviceIdentityNormalizer {

    private static final Pattern IPV4 = Pattern.compile("^\\d{1,3}(\\.\\d{1,3}){3}$");

    private DeviceIdentityNormalizer() {
    }

    /**
     * Normalizes a raw name with no explicit domain and no split character.
     *
     * @param rawName The raw device name
     * @return The canonical identity
     */
    public static DeviceIdentity normalize(String rawName) {
        return normalize(rawName, null, null);
    }

    /**
     * Normalizes a raw name.
     *
     * The explicit domain is used only when the name carries no domain of its own.
     * Only the first label of any domain is kept, so {@code corp.local} becomes {@code CORP}.
     *
     * @param rawName The raw device name, possibly domain- or DNS-qualified
     * @param explicitDomain Domain reported separately by the source, or null
     * @param splitChar Character after which hypervisor display names carry a suffix, or null
     * @return The canonical identity
     */
    public static DeviceIdentity normalize(String rawName, String explicitDomain, Character splitChar) {
        String raw = rawName == null ? "" : rawName.trim();
        String name = raw;

        if (splitChar != null) {
            int split = name.indexOf(splitChar);
            if (split > 0) {
                name = name.substring(0, split);
            }
        }

        String shortName = name;
        String domain = null;

        int backslash = name.lastIndexOf('\\');
        if (backslash >= 0) {
            String domainPart = name.substring(0, backslash);
            String namePart = name.substring(backslash + 1);
            if (!domainPart.isEmpty() && !namePart.isEmpty()) {
                shortName = namePart;
                domain = firstLabel(domainPart);
            }
        } else if (name.indexOf('.') >= 0 && !IPV4.matcher(name).matches()) {
            int dot = name.indexOf('.');
            String host = name.substring(0, dot);
            String remainder = name.substring(dot + 1);
            if (!host.isEmpty() && !remainder.isEmpty()) {
                shortName = host;
                domain = firstLabel(remainder);
            }
        }

        if (domain == null && explicitDomain != null && !explicitDomain.trim().isEmpty()) {
            domain = firstLabel(explicitDomain.trim());
        }

        return new DeviceIdentity(shortName, domain, raw);
    }

    private static String firstLabel(String domain) {
        int dot = domain.indexOf('.');
        String label = dot > 0 ? domain.substring(0, dot) : domain;
        return label.isEmpty() ? null : label;
    }
}
