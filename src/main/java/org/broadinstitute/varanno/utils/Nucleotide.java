package org.broadinstitute.varanno.utils;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Represents the nucleotide alphabet with support for IUPAC ambiguity codes.
 *
 * <p>
 *    Each value carries a four bit mask (0bTGCA) of the standard bases it stands for, so
 *    ambiguity codes can be combined and compared with plain bit arithmetic.  {@link #X}
 *    (a.k.a. {@link #INVALID}) is the code for anything that is not a nucleotide.
 * </p>
 *
 * <p>
 *     There is no code for the gap ({@code '-'}) used in allele strings; callers handle it
 *     before decoding.  Uracil decodes as {@link #T}.
 * </p>
 */
public enum Nucleotide {

    A(0b0001),
    C(0b0010),
    G(0b0100),
    T(0b1000),

    R(A, G), // Purines.
    Y(C, T), // Pyrimidines.
    S(C, G), // Strong nucleotides.
    W(A, T), // Weak nucleotides.
    K(G, T), // Keto nucleotides.
    M(A, C), // Amino nucleotides.
    B(C, G, T), // Not-A
    D(A, G, T), // Not-C
    H(A, C, T), // Not-G
    V(A, C, G), // Not-T
    N(A, C, G, T), // Any/Unknown

    X();

    public static final Nucleotide INVALID = X;

    /**
     * List of the standard (non-redundant) nucleotide values in their preferred alphabetical order.
     */
    public static final List<Nucleotide> STANDARD_BASES = Collections.unmodifiableList(Arrays.asList(A, C, G, T));

    /**
     * Values indexed by their upper-case char encodings. Non-valid encodings point to {@link #INVALID}.
     */
    private static final Nucleotide[] charToValue = new Nucleotide[1 << Byte.SIZE];

    /**
     * Values indexed by their mask.
     */
    private static final Nucleotide[] maskToValue = new Nucleotide[1 << STANDARD_BASES.size()];

    static {
        Arrays.fill(charToValue, INVALID);
        for (final Nucleotide nucleotide : values()) {
            maskToValue[nucleotide.mask] = nucleotide;
            charToValue[nucleotide.name().charAt(0)] = nucleotide;
        }
        charToValue['U'] = T;
    }

    private final int mask;

    Nucleotide(final int mask) {
        this.mask = mask;
    }

    Nucleotide(final Nucleotide ... nucs) {
        this(Arrays.stream(nucs).mapToInt(nuc -> nuc.mask).reduce((a, b) -> a | b).orElse(0));
    }

    /**
     * Returns the nucleotide that corresponds to a particular {@code char} typed base code, regardless of case.
     * @param ch the query base code.
     * @return never {@code null}, but {@link #INVALID} if the base code does not correspond
     * to a valid IUPAC nucleotide code.
     */
    public static Nucleotide decode(final char ch) {
        final char upper = Character.toUpperCase(ch);
        if ((upper & 0xFF00) != 0) {
            return INVALID;
        }
        return charToValue[upper];
    }

    /**
     * Returns the narrowest code that includes every nucleotide in {@code nucleotides}.
     * @param nucleotides codes to combine.  Must not be {@code null}.
     * @return {@link #INVALID} if {@code nucleotides} is empty or contains {@link #INVALID}.
     */
    public static Nucleotide union(final Collection<Nucleotide> nucleotides) {
        Utils.nonNull(nucleotides, "the nucleotide collection cannot be null");
        int combined = 0;
        for (final Nucleotide nucleotide : nucleotides) {
            if (nucleotide == INVALID) {
                return INVALID;
            }
            combined |= nucleotide.mask;
        }
        return maskToValue[combined];
    }

    /**
     * Checks whether the nucleotide refers to a concrete (rather than ambiguous) base.
     * @return {@code true} iff this is one of {@link #STANDARD_BASES}.
     */
    public boolean isStandard() {
        return Integer.bitCount(mask) == 1;
    }

    /**
     * Checks whether the nucleotide refer to an ambiguous base.
     * @return {@code true} iff this is an ambiguous nucleotide.
     */
    public boolean isAmbiguous() {
        return Integer.bitCount(mask) > 1;
    }

    /**
     * Whether this nucleotide code is valid or not.
     * @return {@code true} iff valid.
     */
    public boolean isValid() {
        return this != INVALID;
    }

    /**
     * Returns the code for the complementary strand, so {@link #R} (A or G) becomes {@link #Y} (T or C).
     * @return {@link #INVALID} for {@link #INVALID}.
     */
    public Nucleotide complement() {
        // swap the A/T bits and the C/G bits of 0bTGCA
        final int complementMask = ((mask & 0b0001) << 3) | ((mask & 0b1000) >> 3)
                | ((mask & 0b0010) << 1) | ((mask & 0b0100) >> 1);
        return this == INVALID ? INVALID : maskToValue[complementMask];
    }

    /**
     * @return the upper-case single letter encoding of this code.
     */
    public char encodeAsChar() {
        return name().charAt(0);
    }
}
