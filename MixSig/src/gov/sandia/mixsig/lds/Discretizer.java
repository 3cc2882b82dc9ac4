/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.mixsig.lds;

import org.apache.log4j.Logger;

import gov.sandia.mixsig.linear.FactorQR;
import gov.sandia.mixsig.linear.MatrixDense;

/**
    Converts a continuous-time system into the exact discrete update at a fixed sample interval,
    assuming inputs hold their value between samples.
**/
public class Discretizer
{
    public enum Method
    {
        /**
            Exponential of the augmented matrix [[A,B],[0,0]]*dt. The upper blocks of the result
            are Ad and Bd. Exact for any A, including singular ones such as pure integrators.
        **/
        EXACT,
        /**
            Ad = exp(A*dt), then Bd from the linear solve A*Bd = (Ad-I)*B.
            Requires A to be invertible, and fails otherwise.
        **/
        SOLVE;

        public static Method parse (String value)
        {
            if (value == null  ||  value.isEmpty ()) return EXACT;
            try
            {
                return valueOf (value.trim ().toUpperCase ());
            }
            catch (IllegalArgumentException e)
            {
                throw new DiscretizationException ("Unknown discretization method: " + value, e);
            }
        }
    }

    public static double singularTolerance = 1e-12;

    public final double dt;
    public final Method method;

    private static Logger logger = Logger.getLogger (Discretizer.class);

    public Discretizer (double dt)
    {
        this (dt, Method.EXACT);
    }

    public Discretizer (double dt, Method method)
    {
        if (! (dt > 0)  ||  Double.isInfinite (dt)) throw new DiscretizationException ("Sample interval dt must be a positive number, not " + dt);
        this.dt     = dt;
        this.method = method;
    }

    /**
        Checks that a sample interval is present before any continuous dynamics are compiled.
        @param dt May be null if the model did not declare one.
    **/
    public static Discretizer require (Double dt, Method method)
    {
        if (dt == null) throw new DiscretizationException ("Continuous dynamics require a sample interval dt, but none was given.");
        return new Discretizer (dt, method);
    }

    public LinearDynamicalSystem discretize (LinearDynamicalSystem lds)
    {
        if (lds.discrete) return lds;

        int n = lds.numStates ();
        int m = lds.numInputs ();
        MatrixDense Ad;
        MatrixDense Bd;
        if (n == 0)
        {
            Ad = new MatrixDense (0, 0);
            Bd = new MatrixDense (0, m);
        }
        else if (method == Method.SOLVE)
        {
            FactorQR qr = new FactorQR (lds.A);
            if (qr.rankRelative (singularTolerance) < n) throw new DiscretizationException ("State matrix is singular, so the input matrix can't be discretized by linear solve. A=" + lds.A);
            Ad = lds.A.multiply (dt).exp ();
            MatrixDense rhs = Ad.subtract (MatrixDense.identity (n)).multiply (lds.B);
            Bd = qr.solve (rhs);
        }
        else
        {
            MatrixDense augmented = new MatrixDense (n + m, n + m);
            augmented.setRegion (0, 0, lds.A.multiply (dt));
            augmented.setRegion (0, n, lds.B.multiply (dt));
            MatrixDense E = augmented.exp ();
            Ad = new MatrixDense (E.getRegion (0, 0, n - 1, n - 1));
            if (m == 0) Bd = new MatrixDense (n, 0);
            else        Bd = new MatrixDense (E.getRegion (0, n, n - 1, n + m - 1));
        }

        if (! Ad.isFinite ()  ||  ! Bd.isFinite ()) throw new DiscretizationException ("Discretization at dt=" + dt + " produced non-finite coefficients. A=" + lds.A);
        if (logger.isDebugEnabled ()) logger.debug ("Discretized " + lds.shape () + " at dt=" + dt + ": Ad=" + Ad + " Bd=" + Bd);
        return new LinearDynamicalSystem (Ad, Bd, lds.C, lds.D, true);
    }
}
