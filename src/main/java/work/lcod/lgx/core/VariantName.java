package work.lcod.lgx.core;

import java.util.Optional;
import work.lcod.lgx.shared.LgxException;
import work.lcod.lgx.shared.PathNormalizer;

/**
 * Lowercase, NFC-normalized variant identifier. Instances only exist in canonical
 * form, so comparisons never need to re-fold case.
 */
public record VariantName(String value) implements Comparable<VariantName> {
    public VariantName {
        if (!isCanonical(value)) {
            throw new IllegalArgumentException("Not a canonical variant name: " + value);
        }
    }

    /**
     * Folds {@code raw} to canonical form, failing with a usage error when nothing usable remains.
     */
    public static VariantName of(String raw) {
        if (raw == null || raw.isEmpty()) {
            throw LgxException.usage("Variant name cannot be empty");
        }
        return parse(raw).orElseThrow(() -> LgxException.usage("Invalid variant name: " + raw));
    }

    public static Optional<VariantName> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        return PathNormalizer.toNfc(raw)
            .map(PathNormalizer::toLowercase)
            .filter(VariantName::isUsable)
            .map(VariantName::new);
    }

    /** {@code variants/<name>} */
    public String directory() {
        return "variants/" + value;
    }

    /** {@code variants/<name>/} */
    public String prefix() {
        return directory() + "/";
    }

    @Override
    public int compareTo(VariantName other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }

    private static boolean isCanonical(String value) {
        return value != null
            && isUsable(value)
            && PathNormalizer.isNfc(value)
            && value.equals(PathNormalizer.toLowercase(value));
    }

    private static boolean isUsable(String value) {
        return !value.isEmpty()
            && !".".equals(value)
            && !"..".equals(value)
            && value.indexOf('/') < 0
            && value.indexOf('\\') < 0;
    }
}
