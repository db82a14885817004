package com.tsl.search.embed;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.springframework.stereotype.Component;

/**
 * Deterministic unit-length vectors seeded from the text hash. Used for local runs without an
 * embedding provider; similar texts do not land close together.
 */
@Component
public class ToyEmbedder {
    private final int dimension;

    public ToyEmbedder(EmbeddingProperties properties) {
        this.dimension = Math.max(1, properties.getDimension());
    }

    public int getDimension() {
        return dimension;
    }

    public List<Double> embed(String text) {
        Random random = new Random(stableSeed(text == null ? "" : text));
        double[] values = new double[dimension];
        double sumSquares = 0.0;
        for (int i = 0; i < dimension; i++) {
            double value = random.nextDouble() - 0.5;
            values[i] = value;
            sumSquares += value * value;
        }
        double norm = Math.sqrt(sumSquares);
        if (norm == 0.0) {
            norm = 1.0;
        }
        List<Double> vector = new ArrayList<>(dimension);
        for (double value : values) {
            vector.add(value / norm);
        }
        return vector;
    }

    private long stableSeed(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(text.getBytes(StandardCharsets.UTF_8));
            return ByteBuffer.wrap(hash, 0, 8).getLong();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
