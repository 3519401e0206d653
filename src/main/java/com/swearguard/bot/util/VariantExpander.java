package com.swearguard.bot.util;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Enumerates the canonical strings a token could stand for, one reverse-substitution choice per
 * code point, in lexicographic product order (the last position varies fastest).
 *
 * <p>The product is exponential in token length, so enumeration stops after {@code cap} strings.
 * The capped result is best effort: a spelling that sorts past the cap is not produced.
 */
public final class VariantExpander {
    private final GlyphTables glyphTables;

    public VariantExpander(GlyphTables glyphTables) {
        this.glyphTables = Objects.requireNonNull(glyphTables, "glyphTables");
    }

    public Set<String> expand(String token, int cap) {
        Set<String> variants = new LinkedHashSet<>();
        enumerate(token, cap, variant -> {
            variants.add(variant);
            return true;
        });
        return variants;
    }

    /**
     * Equivalent to {@code expand(token, cap).contains(candidate)} without materializing the set:
     * computes the candidate's position in the enumeration order and compares it with the cap.
     */
    public boolean contains(String token, String candidate, int cap) {
        if (token == null || candidate == null || cap <= 0) {
            return false;
        }
        int[] tokenCodePoints = token.codePoints().toArray();
        int[] candidateCodePoints = candidate.codePoints().toArray();
        if (tokenCodePoints.length != candidateCodePoints.length) {
            return false;
        }
        if (tokenCodePoints.length == 0) {
            return true;
        }
        long rank = 0;
        long weight = 1;
        for (int index = tokenCodePoints.length - 1; index >= 0; index--) {
            List<String> options = glyphTables.candidatesFor(tokenCodePoints[index]);
            int choice = options.indexOf(new String(Character.toChars(candidateCodePoints[index])));
            if (choice < 0) {
                return false;
            }
            if (choice > 0) {
                if (weight >= cap) {
                    return false;
                }
                rank += choice * weight;
                if (rank >= cap) {
                    return false;
                }
            }
            weight = Math.min(weight * options.size(), cap);
        }
        return rank < cap;
    }

    /**
     * Feeds variants to {@code visitor} until it returns false or {@code cap} variants were produced.
     *
     * @return the number of variants produced
     */
    public int enumerate(String token, int cap, Predicate<String> visitor) {
        if (token == null || cap <= 0) {
            return 0;
        }
        int[] codePoints = token.codePoints().toArray();
        if (codePoints.length == 0) {
            visitor.test("");
            return 1;
        }
        List<List<String>> options = new java.util.ArrayList<>(codePoints.length);
        for (int codePoint : codePoints) {
            options.add(glyphTables.candidatesFor(codePoint));
        }
        int[] choices = new int[codePoints.length];
        int produced = 0;
        StringBuilder variant = new StringBuilder(token.length());
        while (produced < cap) {
            variant.setLength(0);
            for (int index = 0; index < choices.length; index++) {
                variant.append(options.get(index).get(choices[index]));
            }
            produced++;
            if (!visitor.test(variant.toString())) {
                return produced;
            }
            int position = choices.length - 1;
            while (position >= 0 && ++choices[position] == options.get(position).size()) {
                choices[position] = 0;
                position--;
            }
            if (position < 0) {
                break;
            }
        }
        return produced;
    }
}
