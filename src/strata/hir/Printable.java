package strata.hir;

import java.io.PrintWriter;

/** Something that prints itself as Fortran source text. */
public interface Printable {

    void print(PrintWriter o);

}
