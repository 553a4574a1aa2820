package com.demo.triage.infrastructure;

import com.demo.triage.domain.VectorMath;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Deterministic feature-hashing embedder for offline runs.
 *
 * Lower-cased word tokens are hashed into a signed bucket; the result is L2-normalized,
 * so texts sharing most of their words land close together.
 */
@Component
@Slf4j
@ConditionalOnProperty(name = "triage.embedder.mode", havingValue = "hashing", matchIfMissing = true)
public class HashingEmbedder implements Embedder {

    private final int dimension;

    public HashingEmbedder(@Value("${triage.embedder.dimension:256}") int dimension) {
        if (dimension < 1) {
            throw new IllegalArgumentException("dimension must be positive: " + dimension);
        }
        this.dimension = dimension;
        log.info("HashingEmbedder active: dimension={}", dimension);
    }

    @Override
    public double[] embed(String text) {
        double[] vector = new double[dimension];
        for (String token : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
            if (token.isEmpty()) {
                continue;
            }
            int hash = token.hashCode();
            int bucket = Math.floorMod(hash, dimension);
            vector[bucket] += ((hash >>> 31) == 0) ? 1.0 : -1.0;
        }
        return VectorMath.normalize(vector);
    }

    public int getDimension() {
        return dimension;
    }
}
