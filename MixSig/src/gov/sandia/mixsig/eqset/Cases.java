/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.mixsig.eqset;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import gov.sandia.mixsig.language.AccessSignal;
import gov.sandia.mixsig.language.ArraySelect;
import gov.sandia.mixsig.language.Case;
import gov.sandia.mixsig.language.Concatenate;
import gov.sandia.mixsig.language.Constant;
import gov.sandia.mixsig.language.Operator;
import gov.sandia.mixsig.language.operator.Add;
import gov.sandia.mixsig.language.operator.EQ;
import gov.sandia.mixsig.language.operator.Multiply;

/**
    Construction and resolution of case tables.
**/
public class Cases
{
    /**
        Decodes an address into one bit per selector. The first selector receives the most significant bit.
        @return Map from selector name to 0 or 1, in the order of the selector list.
    **/
    public static Map<String,Integer> addressToSettings (int address, List<Signal> selectors)
    {
        int n = selectors.size ();
        if (n > 30) throw new IllegalArgumentException ("Too many selector bits: " + n);
        if (address < 0  ||  address >= 1 << n) throw new IllegalArgumentException ("The address " + address + " cannot be represented using " + n + " selector bits.");

        Map<String,Integer> result = new LinkedHashMap<String,Integer> ();
        for (int i = 0; i < n; i++)
        {
            int shift = n - 1 - i;
            result.put (selectors.get (i).name, (address >> shift) & 1);
        }
        return result;
    }

    /**
        Builds a case table from raw values. Numbers are wrapped as constants, signals as references.
        A single case is returned as is, without a table around it.
    **/
    public static Operator eqnCase (List<?> cases, List<Signal> selectors)
    {
        if (cases == null  ||  cases.isEmpty ()) throw new CaseShapeException ("A case table must have at least one case.");
        List<Operator> wrapped = Operator.wrap (cases);
        Case result = new Case (wrapped, selectors);  // validates shape and selectors
        if (wrapped.size () == 1) return wrapped.get (0);
        return result;
    }

    /**
        Resolves every case table in expr under the given selector settings.
        Settings for selectors that a table does not use are ignored.
        The result contains no Case nodes, and substituting it again is a no-op.
    **/
    public static Operator substitute (Operator expr, Map<String,Integer> settings)
    {
        return expr.dispatch (new Substitution (settings));
    }

    public static class Substitution implements Operator.Dispatcher<Operator>
    {
        protected Map<String,Integer> settings;
        protected Set<Case>           active = Collections.newSetFromMap (new IdentityHashMap<Case,Boolean> ());  // tables currently being resolved, to catch a table that reaches itself

        public Substitution (Map<String,Integer> settings)
        {
            this.settings = settings;
        }

        protected List<Operator> substituteAll (List<Operator> operands)
        {
            List<Operator> result = new ArrayList<Operator> (operands.size ());
            for (Operator o : operands) result.add (o.dispatch (this));
            return result;
        }

        protected boolean same (List<Operator> a, List<Operator> b)
        {
            for (int i = 0; i < a.size (); i++) if (a.get (i) != b.get (i)) return false;
            return true;
        }

        public Operator constant (Constant op)
        {
            return op;
        }

        public Operator signal (AccessSignal op)
        {
            return op;
        }

        public Operator add (Add op)
        {
            List<Operator> operands = substituteAll (op.operands);
            if (same (operands, op.operands)) return op;
            return Add.make (operands);
        }

        public Operator multiply (Multiply op)
        {
            List<Operator> operands = substituteAll (op.operands);
            if (same (operands, op.operands)) return op;
            return Multiply.make (operands);
        }

        public Operator equal (EQ op)
        {
            Operator lhs = op.operand0.dispatch (this);
            Operator rhs = op.operand1.dispatch (this);
            if (lhs == op.operand0  &&  rhs == op.operand1) return op;
            return new EQ (lhs, rhs);
        }

        public Operator concatenate (Concatenate op)
        {
            return op;
        }

        public Operator arraySelect (ArraySelect op)
        {
            List<Operator> values = substituteAll (op.values);
            if (same (values, op.values)) return op;
            return new ArraySelect (values, op.selector);
        }

        public Operator cases (Case op)
        {
            if (! active.add (op)) throw new CaseShapeException ("Case table refers to itself: " + op.selectors);
            try
            {
                // The selected branch may itself contain tables.
                return op.getCase (settings).dispatch (this);
            }
            finally
            {
                active.remove (op);
            }
        }
    }
}
