package com.lazyduck.expression;

import com.lazyduck.types.DataType;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Deterministic content hashing for expression names.
 *
 * <p>Operands are rendered into a canonical string (expressions by their
 * name, {@link Tokenizable} values by their token, collections element by
 * element) and hashed with SHA-256. Equal operand trees therefore always
 * produce equal names, and a name changes whenever any operand changes.
 */
public final class Tokenizer {

    private static final int TOKEN_LENGTH = 32;
    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private Tokenizer() {}

    /**
     * Hashes the given values into a hex token.
     *
     * @param parts the values to hash
     * @return a 32-character hex token
     */
    public static String tokenize(Object... parts) {
        StringBuilder canonical = new StringBuilder();
        for (Object part : parts) {
            normalize(part, canonical);
        }
        return sha256(canonical.toString());
    }

    private static void normalize(Object value, StringBuilder out) {
        if (value == null) {
            out.append("N;");
        } else if (value instanceof Expr) {
            out.append("E:").append(((Expr) value).name()).append(';');
        } else if (value instanceof Tokenizable) {
            out.append("T:").append(value.getClass().getName())
                .append(':').append(((Tokenizable) value).token()).append(';');
        } else if (value instanceof String) {
            String s = (String) value;
            out.append("S").append(s.length()).append(':').append(s).append(';');
        } else if (value instanceof Number || value instanceof Boolean || value instanceof Character) {
            out.append(value.getClass().getSimpleName()).append(':').append(value).append(';');
        } else if (value instanceof Enum) {
            Enum<?> e = (Enum<?>) value;
            out.append("Enum:").append(e.getDeclaringClass().getName()).append('.').append(e.name()).append(';');
        } else if (value instanceof DataType) {
            out.append("Type:").append(value).append(';');
        } else if (value instanceof Map) {
            List<String> entries = new ArrayList<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                StringBuilder item = new StringBuilder();
                normalize(entry.getKey(), item);
                item.append("=>");
                normalize(entry.getValue(), item);
                entries.add(item.toString());
            }
            entries.sort(null);
            out.append("M{");
            entries.forEach(out::append);
            out.append("};");
        } else if (value instanceof Set) {
            List<String> items = new ArrayList<>();
            for (Object item : (Set<?>) value) {
                StringBuilder rendered = new StringBuilder();
                normalize(item, rendered);
                items.add(rendered.toString());
            }
            items.sort(null);
            out.append("Set{");
            items.forEach(out::append);
            out.append("};");
        } else if (value instanceof Collection) {
            out.append("L[");
            for (Object item : (Collection<?>) value) {
                normalize(item, out);
            }
            out.append("];");
        } else if (value instanceof Object[]) {
            out.append("A[");
            for (Object item : (Object[]) value) {
                normalize(item, out);
            }
            out.append("];");
        } else {
            // Functions and other opaque values are only stable within this process.
            out.append("O:").append(value.getClass().getName())
                .append('@').append(System.identityHashCode(value)).append(';');
        }
    }

    private static String sha256(String canonical) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(canonical.getBytes(StandardCharsets.UTF_8));
            char[] hex = new char[TOKEN_LENGTH];
            for (int i = 0; i < TOKEN_LENGTH / 2; i++) {
                hex[2 * i] = HEX[(hash[i] >> 4) & 0xF];
                hex[2 * i + 1] = HEX[hash[i] & 0xF];
            }
            return new String(hex);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
