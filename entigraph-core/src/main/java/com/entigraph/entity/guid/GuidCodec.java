package com.entigraph.entity.guid;

import com.entigraph.entity.model.EntityIdentity;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.regex.Pattern;

/**
 * Reversible entity identity codec.
 *
 * A GUID is the unpadded URL-safe Base64 form of {@code accountId|DOMAIN|TYPE|identifier}. Domain
 * and type are restricted to the upper-case taxonomy alphabet so the first three separators are
 * unambiguous; the identifier is free text and may itself contain {@code |}.
 */
public final class GuidCodec {

    private static final Pattern TAXONOMY = Pattern.compile("[A-Z][A-Z0-9_]*");
    private static final char SEPARATOR = '|';

    private GuidCodec() {}

    public static String encode(long accountId, String domain, String type, String identifier) {
        if (accountId <= 0) {
            throw new IllegalArgumentException("accountId must be positive: " + accountId);
        }
        if (!isTaxonomyValue(domain)) {
            throw new IllegalArgumentException("Invalid entity domain: " + domain);
        }
        if (!isTaxonomyValue(type)) {
            throw new IllegalArgumentException("Invalid entity type: " + type);
        }
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("identifier must not be empty");
        }
        String raw = accountId + "" + SEPARATOR + domain + SEPARATOR + type + SEPARATOR + identifier;
        return Base64.getUrlEncoder().withoutPadding().encodeToString(raw.getBytes(StandardCharsets.UTF_8));
    }

    public static String encode(EntityIdentity identity) {
        return encode(identity.accountId(), identity.domain(), identity.type(), identity.identifier());
    }

    public static EntityIdentity decode(String guid) {
        if (guid == null || guid.isBlank()) {
            throw new InvalidGuidException(guid, "GUID must not be blank");
        }
        String raw;
        try {
            raw = new String(Base64.getUrlDecoder().decode(guid), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException ex) {
            throw new InvalidGuidException(guid, "GUID is not valid base64: " + guid, ex);
        }
        String[] parts = raw.split("\\|", 4);
        if (parts.length != 4) {
            throw new InvalidGuidException(guid, "GUID does not contain account, domain, type and identifier");
        }
        long accountId;
        try {
            accountId = Long.parseLong(parts[0]);
        } catch (NumberFormatException ex) {
            throw new InvalidGuidException(guid, "GUID account is not numeric: " + parts[0], ex);
        }
        if (accountId <= 0) {
            throw new InvalidGuidException(guid, "GUID account must be positive");
        }
        if (!isTaxonomyValue(parts[1]) || !isTaxonomyValue(parts[2])) {
            throw new InvalidGuidException(guid, "GUID domain/type are malformed");
        }
        if (parts[3].isEmpty()) {
            throw new InvalidGuidException(guid, "GUID identifier is empty");
        }
        EntityIdentity identity = new EntityIdentity(accountId, parts[1], parts[2], parts[3]);
        // padding, surrounding whitespace, stray trailing bits and zero-padded accounts all decode
        // to a valid tuple; only the form encode produces is accepted
        if (!encode(identity).equals(guid)) {
            throw new InvalidGuidException(guid, "GUID is not in canonical form");
        }
        return identity;
    }

    public static boolean isValid(String guid) {
        try {
            decode(guid);
            return true;
        } catch (InvalidGuidException ex) {
            return false;
        }
    }

    /** Whether a value is usable as a domain or type. */
    public static boolean isTaxonomyValue(String value) {
        return value != null && TAXONOMY.matcher(value).matches();
    }
}
