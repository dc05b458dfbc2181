package strata.hir;

import java.io.PrintWriter;

/**
* Represents an extent that is not known at declaration time, printed as a
* single colon (e.g. the dimensions of <code>real, allocatable :: a(:,:)</code>).
* It also stands for an omitted bound of a section triplet.
*/
public class DeferredExtent extends Expression {

    public DeferredExtent() {
        super(-1);
    }

    @Override
    public DeferredExtent clone() {
        return (DeferredExtent)super.clone();
    }

    public void print(PrintWriter o) {
        o.print(":");
    }

}
