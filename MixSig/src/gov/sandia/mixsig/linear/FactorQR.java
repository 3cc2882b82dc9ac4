/*
Copyright 2013-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.mixsig.linear;

/**
    QR factorization with column pivoting, AP = QR, computed by Householder reflections.

    <p>Columns are brought forward in order of decreasing remaining norm, so the magnitude of
    the diagonal of R falls off along its length, and the numerical rank can be read from it.
    The factorization exists for any matrix with at least as many rows as columns.
    Solving is only meaningful when the rank equals the column count.
**/
public class FactorQR
{
    public MatrixDense H;         // Householder vectors on and below the diagonal. Strict upper triangle of R above it.
    public double[]    diagonal;  // of R
    public int[]       P;         // P[k] is the column of A that was moved to position k.

    protected int rows;
    protected int columns;

    public FactorQR (MatrixDense A)
    {
        rows    = A.rows ();
        columns = A.columns ();
        if (rows < columns) throw new IllegalArgumentException ("Factoring a " + rows + "x" + columns + " matrix requires at least as many rows as columns.");

        H        = new MatrixDense (A);
        diagonal = new double[columns];
        P        = new int[columns];
        for (int k = 0; k < columns; k++) P[k] = k;

        for (int k = 0; k < columns; k++)
        {
            pivot (k);

            double alpha = Math.sqrt (sumSquares (H, k, k));
            if (alpha != 0)
            {
                if (H.get (k, k) < 0) alpha = -alpha;
                for (int r = k; r < rows; r++) H.set (r, k, H.get (r, k) / alpha);
                H.set (k, k, H.get (k, k) + 1);
                for (int c = k + 1; c < columns; c++) reflect (k, H, c);
            }
            diagonal[k] = -alpha;
        }
    }

    /**
        Swaps the column with the largest norm below row k into position k.
    **/
    protected void pivot (int k)
    {
        int    best     = k;
        double bestNorm = sumSquares (H, k, k);
        for (int c = k + 1; c < columns; c++)
        {
            double norm = sumSquares (H, k, c);
            if (norm > bestNorm)
            {
                best     = c;
                bestNorm = norm;
            }
        }
        if (best == k) return;

        for (int r = 0; r < rows; r++)
        {
            double t = H.get (r, k);
            H.set (r, k,    H.get (r, best));
            H.set (r, best, t);
        }
        int t   = P[k];
        P[k]    = P[best];
        P[best] = t;
    }

    /**
        Sum of squares of the given column of M, over rows from firstRow down.
    **/
    protected double sumSquares (MatrixDense M, int firstRow, int column)
    {
        double result = 0;
        for (int r = firstRow; r < rows; r++)
        {
            double e = M.get (r, column);
            result += e * e;
        }
        return result;
    }

    /**
        Applies reflection k to one column of M in place.
    **/
    protected void reflect (int k, MatrixDense M, int column)
    {
        double hk = H.get (k, k);
        if (hk == 0) return;
        double s = 0;
        for (int r = k; r < rows; r++) s += H.get (r, k) * M.get (r, column);
        s = -s / hk;
        for (int r = k; r < rows; r++) M.set (r, column, M.get (r, column) + s * H.get (r, k));
    }

    /**
        Counts leading diagonal entries of R whose magnitude is at least the given fraction of the first one.
    **/
    public int rankRelative (double tolerance)
    {
        if (columns == 0  ||  diagonal[0] == 0) return 0;
        double cutoff = Math.abs (diagonal[0]) * tolerance;
        int result = 0;
        while (result < columns  &&  Math.abs (diagonal[result]) >= cutoff) result++;
        return result;
    }

    /**
        Least-squares solution X of AX = B.
        @param B Has as many rows as A, and any number of columns.
    **/
    public MatrixDense solve (MatrixDense B)
    {
        if (B.rows () != rows) throw new IllegalArgumentException ("Right-hand side has " + B.rows () + " rows, but the factored matrix has " + rows);
        int width = B.columns ();

        // Y = Q'B
        MatrixDense Y = new MatrixDense (B);
        for (int k = 0; k < columns; k++)
        {
            for (int c = 0; c < width; c++) reflect (k, Y, c);
        }

        // Back-substitute RZ = Y, then undo the column permutation.
        MatrixDense X = new MatrixDense (columns, width);
        double[]    z = new double[columns];
        for (int c = 0; c < width; c++)
        {
            for (int k = columns - 1; k >= 0; k--)
            {
                double v = Y.get (k, c);
                for (int j = k + 1; j < columns; j++) v -= H.get (k, j) * z[j];
                z[k] = v / diagonal[k];
            }
            for (int k = 0; k < columns; k++) X.set (P[k], c, z[k]);
        }
        return X;
    }
}
