package strata.hir;

/** Constants of the source; they are leaves of the expression tree. */
public abstract class Literal extends Expression {

    protected Literal() {
        super(-1);
    }

    @Override
    public Literal clone() {
        return (Literal)super.clone();
    }

}
