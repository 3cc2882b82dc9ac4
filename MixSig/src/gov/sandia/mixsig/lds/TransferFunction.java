/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.mixsig.lds;

import java.util.Arrays;

import gov.sandia.mixsig.linear.MatrixDense;

/**
    Single-input single-output rational transfer function num(s)/den(s).
    Coefficients are listed from the highest power down, and den is normalized so den[0]==1.
    A discrete transfer function uses the same layout in powers of z, which reads as a difference equation:
    <pre>
    y[k] = num[0] x[k] + num[1] x[k-1] + ... - den[1] y[k-1] - den[2] y[k-2] - ...
    </pre>
**/
public class TransferFunction
{
    public final double[] num;  // same length as den, padded with leading zeros
    public final double[] den;
    public final boolean  discrete;

    public TransferFunction (double[] numerator, double[] denominator)
    {
        this (numerator, denominator, false);
    }

    public TransferFunction (double[] numerator, double[] denominator, boolean discrete)
    {
        double[] d = stripLeadingZeros (denominator);
        double[] n = stripLeadingZeros (numerator);
        if (d.length == 0) throw new DiscretizationException ("Transfer function denominator is zero.");
        if (n.length > d.length) throw new DiscretizationException ("Transfer function is improper: numerator order " + (n.length - 1) + " exceeds denominator order " + (d.length - 1));

        double a0 = d[0];
        den = new double[d.length];
        num = new double[d.length];
        for (int i = 0; i < d.length; i++) den[i] = d[i] / a0;
        int pad = d.length - n.length;
        for (int i = 0; i < n.length; i++) num[pad + i] = n[i] / a0;
        this.discrete = discrete;
    }

    protected static double[] stripLeadingZeros (double[] coefficients)
    {
        int i = 0;
        while (i < coefficients.length  &&  coefficients[i] == 0) i++;
        return Arrays.copyOfRange (coefficients, i, coefficients.length);
    }

    public int order ()
    {
        return den.length - 1;
    }

    /**
        Controllable canonical realization. The first row of A holds the negated denominator,
        ones fill the subdiagonal, and B selects the first state.
    **/
    public LinearDynamicalSystem toStateSpace ()
    {
        int n = order ();
        MatrixDense A = new MatrixDense (n, n);
        MatrixDense B = new MatrixDense (n, 1);
        MatrixDense C = new MatrixDense (1, n);
        MatrixDense D = new MatrixDense (1, 1);
        double b0 = num[0];
        for (int i = 0; i < n; i++)
        {
            A.set (0, i, -den[i + 1]);
            if (i > 0) A.set (i, i - 1, 1);
            C.set (0, i, num[i + 1] - den[i + 1] * b0);
        }
        if (n > 0) B.set (0, 0, 1);
        D.set (0, 0, b0);
        return new LinearDynamicalSystem (A, B, C, D, discrete);
    }

    /**
        Recovers the transfer function of a single-input single-output system, using
        C(sI-A)^-1 B = (det(sI-A+BC) - det(sI-A)) / det(sI-A).
    **/
    public static TransferFunction fromStateSpace (LinearDynamicalSystem lds)
    {
        if (lds.numInputs () != 1  ||  lds.numOutputs () != 1) throw new IllegalArgumentException ("Only single-input single-output systems have a scalar transfer function.");
        double[] den    = lds.A.characteristicPolynomial ();
        double[] closed = lds.A.subtract (lds.B.multiply (lds.C)).characteristicPolynomial ();
        double   d      = lds.D.get (0, 0);
        double[] num    = new double[den.length];
        for (int i = 0; i < den.length; i++) num[i] = closed[i] + (d - 1) * den[i];
        return new TransferFunction (num, den, lds.discrete);
    }

    /**
        Zero-order-hold conversion to a discrete transfer function at the given sample interval.
    **/
    public TransferFunction discretize (Discretizer discretizer)
    {
        if (discrete) return this;
        if (order () == 0) return new TransferFunction (num, den, true);
        return fromStateSpace (discretizer.discretize (toStateSpace ()));
    }

    /**
        A strictly proper function has no direct path from input to output.
    **/
    public boolean isStrictlyProper ()
    {
        return num[0] == 0;
    }

    public String toString ()
    {
        return Arrays.toString (num) + "/" + Arrays.toString (den) + (discrete ? " (z)" : " (s)");
    }
}
