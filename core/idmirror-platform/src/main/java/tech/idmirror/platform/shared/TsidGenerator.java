package tech.idmirror.platform.shared;

import com.github.f4b6a3.tsid.TsidCreator;

import java.util.Objects;

/**
 * TSID generation for locally owned records.
 *
 * <p>Format: "{prefix}_{tsid}" (e.g. "aud_0HZXEQ5Y8JY5Z"), 17 characters. TSIDs sort by
 * creation time, so the id doubles as a stable pagination cursor.
 */
public final class TsidGenerator {

    public static final String SEPARATOR = "_";

    private TsidGenerator() {
    }

    public static String generate(EntityType type) {
        Objects.requireNonNull(type, "EntityType must not be null");
        return type.prefix() + SEPARATOR + TsidCreator.getTsid().toString();
    }
}
