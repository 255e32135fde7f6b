package io.firefeed.pipeline.api.service.storage;

import java.util.Locale;

/**
 * Conversion between {@code float[]} and the pgvector text literal {@code [1.0,2.0,...]}.
 */
final class PgVectors {

    private PgVectors() {
    }

    static String toLiteral(float[] vector) {
        if (vector == null || vector.length == 0) {
            return null;
        }
        StringBuilder sb = new StringBuilder(vector.length * 10 + 2);
        sb.append('[');
        for (int i = 0; i < vector.length; i++) {
            float v = vector[i];
            if (i > 0) {
                sb.append(',');
            }
            sb.append(String.format(Locale.ROOT, "%.7f", Float.isFinite(v) ? v : 0.0f));
        }
        sb.append(']');
        return sb.toString();
    }

    static float[] parse(String text) {
        if (text == null) {
            return null;
        }
        String raw = text.trim();
        if (raw.startsWith("[")) {
            raw = raw.substring(1);
        }
        if (raw.endsWith("]")) {
            raw = raw.substring(0, raw.length() - 1);
        }
        if (raw.isBlank()) {
            return null;
        }
        String[] parts = raw.split(",");
        float[] out = new float[parts.length];
        for (int i = 0; i < parts.length; i++) {
            out[i] = Float.parseFloat(parts[i].trim());
        }
        return out;
    }
}
