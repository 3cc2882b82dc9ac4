/*
Copyright 2013-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.mixsig.language;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import gov.sandia.mixsig.eqset.Signal;
import gov.sandia.mixsig.language.operator.Add;
import gov.sandia.mixsig.language.operator.EQ;
import gov.sandia.mixsig.language.operator.Multiply;
import gov.sandia.mixsig.language.type.Format;

/**
    Base class of the expression tree for model equations.
    Nodes are immutable once built, so subexpressions may be shared freely between trees.
    The set of node kinds is closed: every traversal that must treat each kind explicitly
    implements Dispatcher, so adding a kind breaks the build of every such traversal
    until it handles the newcomer.
**/
public abstract class Operator
{
    /**
        Exhaustive dispatch over the node kinds.
    **/
    public interface Dispatcher<T>
    {
        public T constant    (Constant     op);
        public T signal      (AccessSignal op);
        public T add         (Add          op);
        public T multiply    (Multiply     op);
        public T equal       (EQ           op);
        public T concatenate (Concatenate  op);
        public T arraySelect (ArraySelect  op);
        public T cases       (Case         op);
    }

    public abstract <T> T dispatch (Dispatcher<T> dispatcher);

    /**
        Representation of the value produced by this node, derived from the operands.
    **/
    public abstract Format getFormat ();

    /**
        Binding strength used when rendering. Smaller numbers bind tighter.
    **/
    public int precedence ()
    {
        return 1;
    }

    public void visit (Visitor visitor)
    {
        visitor.visit (this);
    }

    /**
        Produces a rewritten tree. Since nodes are immutable, any node with a changed
        operand is rebuilt, while untouched subtrees are returned as is.
    **/
    public Operator transform (Transformer transformer)
    {
        Operator result = transformer.transform (this);
        if (result != null) return result;
        return this;
    }

    public String render ()
    {
        Renderer renderer = new Renderer ();
        render (renderer);
        return renderer.result.toString ();
    }

    public void render (Renderer renderer)
    {
        if (renderer.render (this)) return;
        renderer.result.append (toString ());
    }

    /**
        Helper for subclasses. Puts parentheses around an operand that binds more loosely than we do.
    **/
    protected void renderOperand (Renderer renderer, Operator operand)
    {
        boolean needParens = operand.precedence () >= precedence ()  &&  operand.precedence () > 1;
        if (needParens) renderer.result.append ("(");
        operand.render (renderer);
        if (needParens) renderer.result.append (")");
    }

    /**
        Determines if this is a numeric constant.
    **/
    public boolean isScalar ()
    {
        return this instanceof Constant;
    }

    /**
        Extracts the value of a constant. If this is not a constant, then return 0.
    **/
    public double getDouble ()
    {
        if (! (this instanceof Constant)) return 0;
        return ((Constant) this).value;
    }

    /**
        Utility function to determine whether this operator tree contains the given object.
    **/
    public boolean contains (Operator target)
    {
        class ContainsVisitor implements Visitor
        {
            public boolean found;
            public boolean visit (Operator op)
            {
                if (found) return false;
                if (op == target  ||  op.equals (target))
                {
                    found = true;
                    return false;
                }
                return true;
            }
        }
        ContainsVisitor cv = new ContainsVisitor ();
        visit (cv);
        return cv.found;
    }

    // Expression building --------------------------------------------------

    public Operator plus (Object that)
    {
        return Add.make (this, wrap (that));
    }

    public Operator minus (Object that)
    {
        return Add.make (this, wrap (that).negate ());
    }

    public Operator times (Object that)
    {
        return Multiply.make (this, wrap (that));
    }

    public Operator negate ()
    {
        return Multiply.make (new Constant (-1), this);
    }

    public EQ equalTo (Object that)
    {
        return new EQ (this, wrap (that));
    }

    /**
        Lifts a raw value into the expression tree.
        Numbers become constants and signals become references to them.
    **/
    public static Operator wrap (Object value)
    {
        if (value instanceof Operator) return (Operator) value;
        if (value instanceof Signal)   return ((Signal) value).access ();
        if (value instanceof Number)   return new Constant (((Number) value).doubleValue ());
        throw new IllegalArgumentException ("Can't use " + value + " in an expression.");
    }

    public static List<Operator> wrap (Object... values)
    {
        return wrap (Arrays.asList (values));
    }

    public static List<Operator> wrap (List<?> values)
    {
        List<Operator> result = new ArrayList<Operator> (values.size ());
        for (Object v : values) result.add (wrap (v));
        return result;
    }
}
