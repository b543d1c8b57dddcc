package com.cgi.schemasense.cache;

import com.cgi.schemasense.model.ColumnMetadata;
import com.cgi.schemasense.model.enums.Regulation;
import lombok.Value;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Stable identity of a schema request: SHA-256 over the sorted (table, column, type) tuples,
 * salted with the requested regulations, region, tenant and pattern library version.
 * Column order does not matter.
 */
@Value
public class SchemaFingerprint {
    String hash;

    /**
     * Regulations, region, tenant and library version the hash was salted with. Similarity search only
     * compares fingerprints with the same salt.
     */
    String salt;

    /**
     * Sorted {@code table|column|type} tuples, lower-cased.
     */
    Set<String> columnTuples;

    public static SchemaFingerprint of(Collection<ColumnMetadata> schema, Set<Regulation> regulations,
                                       String region, String tenant, String libraryVersion) {
        TreeSet<String> tuples = new TreeSet<>();
        for (ColumnMetadata column : schema) {
            if (column != null) {
                tuples.add(tuple(column));
            }
        }
        String salt = salt(regulations, region, tenant, libraryVersion);
        String hash = sha256(String.join("\n", tuples) + "\n#" + salt);
        return new SchemaFingerprint(hash, salt, Collections.unmodifiableSet(tuples));
    }

    /**
     * Jaccard similarity of the two tuple sets.
     *
     * @param other Fingerprint to compare with
     * @return Similarity in [0,1]; 0 when the salts differ
     */
    public double similarity(SchemaFingerprint other) {
        if (!salt.equals(other.salt)) {
            return 0.0;
        }
        return jaccard(columnTuples, other.columnTuples);
    }

    public static double jaccard(Set<String> left, Set<String> right) {
        if (left.isEmpty() && right.isEmpty()) {
            return 1.0;
        }
        int intersection = 0;
        for (String tuple : left) {
            if (right.contains(tuple)) {
                intersection++;
            }
        }
        int union = left.size() + right.size() - intersection;
        return (double) intersection / union;
    }

    static String tuple(ColumnMetadata column) {
        return lower(column.getTableName()) + "|" + lower(column.getColumnName()) + "|" + lower(column.getDataType());
    }

    private static String salt(Set<Regulation> regulations, String region, String tenant, String libraryVersion) {
        Set<Regulation> effective = regulations == null || regulations.isEmpty()
                ? EnumSet.allOf(Regulation.class)
                : EnumSet.copyOf(regulations);
        String regs = effective.stream().map(Regulation::getId).sorted().collect(Collectors.joining(","));
        return "regs=" + regs + ";region=" + lower(region) + ";tenant=" + lower(tenant)
                + ";library=" + lower(libraryVersion);
    }

    private static String lower(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }

    private static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] bytes = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder(bytes.length * 2);
            for (byte b : bytes) {
                hex.append(String.format("%02x", b));
            }
            return hex.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
