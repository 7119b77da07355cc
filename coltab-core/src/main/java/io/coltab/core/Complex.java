package io.coltab.core;

/**
 * Immutable complex number. Complex columns store both parts in double precision
 * while reading; {@link ElementKind#FLOAT_COMPLEX} columns round each part to float on write.
 */
public record Complex(double re, double im) {

    public static final Complex ZERO = new Complex(0.0, 0.0);

    public static Complex of(double re, double im) {
        return new Complex(re, im);
    }

    public static Complex ofReal(double re) {
        return new Complex(re, 0.0);
    }

    public Complex plus(Complex other) {
        return new Complex(re + other.re, im + other.im);
    }

    public Complex minus(Complex other) {
        return new Complex(re - other.re, im - other.im);
    }

    public Complex times(Complex other) {
        return new Complex(re * other.re - im * other.im, re * other.im + im * other.re);
    }

    /**
     * Quotient, or {@code null} when the divisor is exactly zero.
     */
    public Complex dividedBy(Complex other) {
        double denominator = other.re * other.re + other.im * other.im;
        if (denominator == 0.0) {
            return null;
        }
        return new Complex((re * other.re + im * other.im) / denominator,
                (im * other.re - re * other.im) / denominator);
    }

    public Complex conjugate() {
        return new Complex(re, -im);
    }

    public double abs() {
        return Math.hypot(re, im);
    }

    public double arg() {
        return Math.atan2(im, re);
    }

    /**
     * Component-wise {@code ==}: {@code -0.0} equals {@code 0.0} and NaN equals nothing,
     * unlike {@link #equals(Object)}.
     */
    public boolean equalsNumerically(Complex other) {
        return other != null && re == other.re && im == other.im;
    }

    public boolean isZero() {
        return re == 0.0 && im == 0.0;
    }

    /**
     * Principal natural logarithm.
     */
    public Complex log() {
        return new Complex(Math.log(abs()), arg());
    }

    public Complex exp() {
        double scale = Math.exp(re);
        return new Complex(scale * Math.cos(im), scale * Math.sin(im));
    }

    /**
     * Principal value of this raised to a real exponent. Zero to the power zero is one, as with
     * {@link Math#pow}; zero to a negative exponent is {@code null}.
     */
    public Complex pow(double exponent) {
        if (isZero()) {
            if (exponent == 0.0) {
                return ofReal(1.0);
            }
            return exponent > 0.0 ? ZERO : null;
        }
        double modulus = Math.pow(abs(), exponent);
        double angle = arg() * exponent;
        return new Complex(modulus * Math.cos(angle), modulus * Math.sin(angle));
    }

    public Complex scale(double factor) {
        return new Complex(re * factor, im * factor);
    }

    /**
     * Both parts rounded to float precision.
     */
    public Complex toFloatPrecision() {
        return new Complex((float) re, (float) im);
    }

    @Override
    public String toString() {
        return re + (im < 0 || (im == 0.0 && 1.0 / im < 0) ? "" : "+") + im + "i";
    }
}
