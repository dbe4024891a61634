package tech.idmirror.platform.organization;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * URL-safe slug derivation for organization names.
 *
 * <p>"Acme Corp, Inc." becomes "acme-corp-inc". Slugs are at most {@value #MAX_LENGTH}
 * characters and never start or end with a hyphen.
 */
public final class Slugs {

    public static final int MAX_LENGTH = 100;

    static final String FALLBACK = "org";
    private static final int ID_SUFFIX_LENGTH = 6;

    private static final Pattern INVALID = Pattern.compile("[^a-z0-9\\s-]");
    private static final Pattern SEPARATORS = Pattern.compile("[\\s_]+");
    private static final Pattern REPEATED_HYPHENS = Pattern.compile("-+");

    private Slugs() {
    }

    public static String generate(String name) {
        if (name == null) {
            return FALLBACK;
        }
        String slug = name.toLowerCase(Locale.ROOT).trim();
        slug = INVALID.matcher(slug).replaceAll("");
        slug = SEPARATORS.matcher(slug).replaceAll("-");
        slug = REPEATED_HYPHENS.matcher(slug).replaceAll("-");
        slug = truncate(stripHyphens(slug), MAX_LENGTH);
        return slug.isEmpty() ? FALLBACK : slug;
    }

    /**
     * Slug used when the base slug already belongs to a different organization:
     * {@code <base>-<last 6 characters of the id>}. Still a pure function of (name, id).
     */
    public static String disambiguate(String baseSlug, String organizationId) {
        String id = organizationId.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
        String suffix = id.length() > ID_SUFFIX_LENGTH ? id.substring(id.length() - ID_SUFFIX_LENGTH) : id;
        String base = truncate(baseSlug, MAX_LENGTH - suffix.length() - 1);
        return base + "-" + suffix;
    }

    private static String truncate(String slug, int maxLength) {
        if (slug.length() <= maxLength) {
            return slug;
        }
        return stripHyphens(slug.substring(0, maxLength));
    }

    private static String stripHyphens(String slug) {
        int start = 0;
        int end = slug.length();
        while (start < end && slug.charAt(start) == '-') {
            start++;
        }
        while (end > start && slug.charAt(end - 1) == '-') {
            end--;
        }
        return slug.substring(start, end);
    }
}
