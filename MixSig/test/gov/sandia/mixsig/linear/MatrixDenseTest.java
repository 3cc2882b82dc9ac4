/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.mixsig.linear;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class MatrixDenseTest
{
    @Test
    public void testMultiply ()
    {
        MatrixDense A = new MatrixDense (new double[][] {{1, 2}, {3, 4}});
        MatrixDense B = new MatrixDense (new double[][] {{5}, {6}});
        MatrixDense C = A.multiply (B);
        assertEquals (2, C.rows ());
        assertEquals (1, C.columns ());
        assertEquals (17, C.get (0, 0), 0);
        assertEquals (39, C.get (1, 0), 0);
        assertEquals (3, A.transpose ().get (0, 1), 0);
    }

    @Test
    public void testExp ()
    {
        // Zero matrix gives identity.
        assertTrue (new MatrixDense (3, 3).exp ().equals (MatrixDense.identity (3), 1e-14));

        // Diagonal
        MatrixDense D = new MatrixDense (new double[][] {{-1, 0}, {0, 2}});
        MatrixDense expected = new MatrixDense (new double[][] {{Math.exp (-1), 0}, {0, Math.exp (2)}});
        assertTrue (D.exp ().equals (expected, 1e-12));

        // Nilpotent: exp([[0,1],[0,0]]) = [[1,1],[0,1]]
        MatrixDense N = new MatrixDense (new double[][] {{0, 1}, {0, 0}});
        assertTrue (N.exp ().equals (new MatrixDense (new double[][] {{1, 1}, {0, 1}}), 1e-14));

        // Rotation, with a norm large enough to require scaling and squaring.
        double t = 10;
        MatrixDense R = new MatrixDense (new double[][] {{0, t}, {-t, 0}});
        MatrixDense expectedR = new MatrixDense (new double[][] {{Math.cos (t), Math.sin (t)}, {-Math.sin (t), Math.cos (t)}});
        assertTrue (R.exp ().equals (expectedR, 1e-10));
    }

    @Test
    public void testCharacteristicPolynomial ()
    {
        // Eigenvalues -1 and -2: s^2 + 3s + 2
        MatrixDense A = new MatrixDense (new double[][] {{0, 1}, {-2, -3}});
        assertArrayEquals (new double[] {1, 3, 2}, A.characteristicPolynomial (), 1e-12);
        assertArrayEquals (new double[] {1}, new MatrixDense (0, 0).characteristicPolynomial (), 0);
    }

    @Test
    public void testRegion ()
    {
        MatrixDense A = new MatrixDense (3, 3);
        A.setRegion (1, 1, new MatrixDense (new double[][] {{1, 2}, {3, 4}}));
        MatrixDense R = new MatrixDense (A.getRegion (1, 1, 2, 2));
        assertEquals (4, R.get (1, 1), 0);
        assertEquals (0, A.get (0, 0), 0);
        assertEquals (2, A.get (1, 2), 0);
    }

    @Test
    public void testQR ()
    {
        // Overdetermined but consistent.
        MatrixDense A = new MatrixDense (new double[][] {{1, 0}, {0, 1}, {1, 1}});
        MatrixDense b = new MatrixDense (new double[][] {{2}, {3}, {5}});
        FactorQR qr = new FactorQR (A);
        assertEquals (2, qr.rankRelative (1e-10));
        MatrixDense x = qr.solve (b);
        assertEquals (2, x.get (0, 0), 1e-12);
        assertEquals (3, x.get (1, 0), 1e-12);

        FactorQR singular = new FactorQR (new MatrixDense (new double[][] {{1, 2}, {2, 4}}));
        assertEquals (1, singular.rankRelative (1e-10));
        assertEquals (0, new FactorQR (new MatrixDense (2, 2)).rankRelative (1e-10));
    }
}
