/*
Copyright 2013-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.mixsig.linear;

/**
    Matrix with a single block of storage and strided access pattern.
    Strided access allows us to wrap subregions (such as single columns or rows) and transposes
    around the same block of memory.
**/
public class MatrixDense
{
    protected double[] data;  // stored in column-major order
    protected int      offset;
    protected int      rows;
    protected int      columns;
    protected int      strideR;  // elements to skip to reach next row at current column
    protected int      strideC;  // elements to skip to reach next column at current row

    public MatrixDense (int rows, int columns)
    {
        this (rows, columns, 0);
    }

    public MatrixDense (int rows, int columns, double initialValue)
    {
        this.rows    = rows;
        this.columns = columns;
        data         = new double[rows * columns];
        strideR      = 1;
        strideC      = rows;

        if (initialValue == 0) return;
        for (int i = 0; i < data.length; i++) data[i] = initialValue;
    }

    /**
        Makes a compact copy of A.
    **/
    public MatrixDense (MatrixDense A)
    {
        rows    = A.rows;
        columns = A.columns;
        data    = new double[rows * columns];
        strideR = 1;
        strideC = rows;

        int i = 0;
        for (int c = 0; c < columns; c++)
        {
            int d   = A.offset + c * A.strideC;
            int end = d + rows * A.strideR;
            while (d != end)
            {
                data[i++] = A.data[d];
                d += A.strideR;
            }
        }
    }

    /**
        Builds a matrix from row-major nested arrays, which is the natural way to write one in source code.
    **/
    public MatrixDense (double[][] values)
    {
        this (values.length, values.length == 0 ? 0 : values[0].length);
        for (int r = 0; r < rows; r++)
        {
            if (values[r].length != columns) throw new IllegalArgumentException ("Ragged matrix: row " + r + " has " + values[r].length + " elements rather than " + columns);
            for (int c = 0; c < columns; c++) data[c * rows + r] = values[r][c];
        }
    }

    public MatrixDense (double[] data, int offset, int rows, int columns, int strideR, int strideC)
    {
        this.data    = data;
        this.offset  = offset;
        this.rows    = rows;
        this.columns = columns;
        this.strideR = strideR;
        this.strideC = strideC;
    }

    public int rows ()
    {
        return rows;
    }

    public int columns ()
    {
        return columns;
    }

    public double get (int row, int column)
    {
        return data[offset + row * strideR + column * strideC];
    }

    public MatrixDense getRegion (int firstRow, int firstColumn, int lastRow, int lastColumn)
    {
        int offset  = this.offset + firstColumn * strideC + firstRow * strideR;
        int rows    = lastRow    - firstRow    + 1;
        int columns = lastColumn - firstColumn + 1;
        return new MatrixDense (data, offset, rows, columns, strideR, strideC);
    }

    public MatrixDense transpose ()
    {
        return new MatrixDense (data, offset, columns, rows, strideC, strideR);
    }

    public void set (int row, int column, double a)
    {
        data[offset + row * strideR + column * strideC] = a;
    }

    /**
        Copies the given matrix into this one, with its upper-left corner at (row, column).
    **/
    public void setRegion (int row, int column, MatrixDense A)
    {
        for (int c = 0; c < A.columns; c++)
        {
            for (int r = 0; r < A.rows; r++)
            {
                set (row + r, column + c, A.get (r, c));
            }
        }
    }

    public static MatrixDense identity (int size)
    {
        MatrixDense result = new MatrixDense (size, size);
        for (int r = 0; r < size; r++) result.data[r * (size + 1)] = 1;
        return result;
    }

    public boolean isFinite ()
    {
        for (int c = 0; c < columns; c++)
        {
            for (int r = 0; r < rows; r++)
            {
                if (! Double.isFinite (get (r, c))) return false;
            }
        }
        return true;
    }

    protected void checkSameShape (MatrixDense B)
    {
        if (rows != B.rows  ||  columns != B.columns) throw new IllegalArgumentException ("Matrix dimensions must agree: " + rows + "x" + columns + " vs " + B.rows + "x" + B.columns);
    }

    public MatrixDense add (MatrixDense B)
    {
        checkSameShape (B);
        MatrixDense result = new MatrixDense (rows, columns);
        int stepA =   strideC - rows *   strideR;
        int stepB = B.strideC - rows * B.strideR;
        int a = offset;
        int b = B.offset;
        int r = 0;
        int end = rows * columns;
        while (r < end)
        {
            int columnEnd = r + rows;
            while (r < columnEnd)
            {
                result.data[r++] = data[a] + B.data[b];
                a +=   strideR;
                b += B.strideR;
            }
            a += stepA;
            b += stepB;
        }
        return result;
    }

    public MatrixDense subtract (MatrixDense B)
    {
        return add (B.multiply (-1));
    }

    public MatrixDense multiply (MatrixDense B)
    {
        if (columns != B.rows) throw new IllegalArgumentException ("Matrix inner dimensions must agree: " + columns + " vs " + B.rows);
        int h = rows;
        int m = columns;
        MatrixDense result = new MatrixDense (h, B.columns);
        int b = B.offset;
        int r = 0;
        int end = rows * B.columns;
        while (r < end)
        {
            int a = offset;
            int columnEnd = r + rows;
            while (r < columnEnd)
            {
                double sum = 0;
                int i = a;
                int j = b;
                int rowEnd = j + m * B.strideR;
                while (j != rowEnd)
                {
                    sum += data[i] * B.data[j];
                    i +=   strideC;
                    j += B.strideR;
                }
                result.data[r++] = sum;
                a += strideR;
            }
            b += B.strideC;
        }
        return result;
    }

    public MatrixDense multiply (double scalar)
    {
        MatrixDense result = new MatrixDense (rows, columns);
        int step = strideC - rows * strideR;
        int i   = offset;
        int r   = 0;
        int end = rows * columns;
        while (r < end)
        {
            int columnEnd = r + rows;
            while (r < columnEnd)
            {
                result.data[r++] = data[i] * scalar;
                i += strideR;
            }
            i += step;
        }
        return result;
    }

    /**
        Induced 1-norm: the largest absolute column sum.
    **/
    public double norm1 ()
    {
        double result = 0;
        for (int c = 0; c < columns; c++)
        {
            double sum = 0;
            for (int r = 0; r < rows; r++) sum += Math.abs (get (r, c));
            result = Math.max (result, sum);
        }
        return result;
    }

    /**
        Largest absolute element.
    **/
    public double normInfinity ()
    {
        double result = 0;
        for (int c = 0; c < columns; c++)
        {
            for (int r = 0; r < rows; r++) result = Math.max (result, Math.abs (get (r, c)));
        }
        return result;
    }

    /**
        Matrix exponential by scaling and squaring with a diagonal Pade approximant of order 6.
        The matrix is scaled by a power of 2 until its 1-norm is at most 1/2, the approximant
        is evaluated, and the result is squared back up.
    **/
    public MatrixDense exp ()
    {
        if (rows != columns) throw new IllegalArgumentException ("Matrix exponential requires a square matrix.");
        int n = rows;
        if (n == 0) return new MatrixDense (0, 0);

        double norm = norm1 ();
        int squarings = 0;
        if (norm > 0.5) squarings = Math.max (0, (int) Math.ceil (Math.log (norm / 0.5) / Math.log (2)));
        MatrixDense X = multiply (1.0 / Math.pow (2, squarings));

        final int q = 6;
        double c = 1;
        MatrixDense I   = identity (n);
        MatrixDense N   = I;  // numerator
        MatrixDense D   = I;  // denominator
        MatrixDense Xk  = I;
        for (int k = 1; k <= q; k++)
        {
            c = c * (q - k + 1) / (k * (2.0 * q - k + 1));
            Xk = Xk.multiply (X);
            MatrixDense term = Xk.multiply (c);
            N = N.add (term);
            if (k % 2 == 0) D = D.add (term);
            else            D = D.subtract (term);
        }
        MatrixDense result = new FactorQR (D).solve (N);
        for (int k = 0; k < squarings; k++) result = result.multiply (result);
        return result;
    }

    /**
        Coefficients of the characteristic polynomial det(sI - A), highest power first, with leading coefficient 1.
        Computed by the Faddeev-LeVerrier recurrence.
    **/
    public double[] characteristicPolynomial ()
    {
        if (rows != columns) throw new IllegalArgumentException ("Characteristic polynomial requires a square matrix.");
        int n = rows;
        double[] result = new double[n + 1];
        result[0] = 1;
        MatrixDense I = identity (n);
        MatrixDense M = new MatrixDense (n, n);  // M_0 = 0
        for (int k = 1; k <= n; k++)
        {
            M = multiply (M).add (I.multiply (result[k - 1]));
            MatrixDense AM = multiply (M);
            double trace = 0;
            for (int i = 0; i < n; i++) trace += AM.get (i, i);
            result[k] = -trace / k;
        }
        return result;
    }

    public boolean equals (MatrixDense B, double tolerance)
    {
        if (rows != B.rows  ||  columns != B.columns) return false;
        for (int c = 0; c < columns; c++)
        {
            for (int r = 0; r < rows; r++)
            {
                if (Math.abs (get (r, c) - B.get (r, c)) > tolerance) return false;
            }
        }
        return true;
    }

    public String toString ()
    {
        StringBuilder result = new StringBuilder ();
        result.append ("[");
        for (int r = 0; r < rows; r++)
        {
            if (r > 0) result.append (";");
            for (int c = 0; c < columns; c++)
            {
                if (c > 0) result.append (",");
                result.append (get (r, c));
            }
        }
        result.append ("]");
        return result.toString ();
    }
}
