package org.circomscan.structure.constants;

import java.math.BigInteger;

/*
The prime fields the analysis supports. Constant evaluation during lowering is done modulo the prime.
 */
public enum Curve {
    BN254("21888242871839275222246405745257275088548364400416034343698204186575808495617"),
    BLS12_381("52435875175126190479447740508185965837690552500527637822603658699938581184513"),
    GOLDILOCKS("18446744069414584321");

    private final BigInteger prime;

    Curve(String prime) {
        this.prime = new BigInteger(prime);
    }

    public BigInteger prime() {
        return prime;
    }

    public BigInteger reduce(BigInteger value) {
        return value.mod(prime);
    }

    public static Curve defaultCurve() {
        return BN254;
    }

    // unknown names fall back to the default curve
    public static Curve fromName(String name) {
        if (name != null) {
            for (Curve curve : values()) {
                if (curve.name().equalsIgnoreCase(name.trim())) return curve;
            }
        }
        return defaultCurve();
    }
}
