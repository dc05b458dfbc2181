package strata.hir;

import java.util.List;

/** List helpers shared by the IR classes. */
public final class Tools {

    private Tools() {
    }

    /** Position of <b>o</b> in <b>l</b> compared with ==, or -1. */
    public static int identityIndexOf(List<?> l, Object o) {
        int pos = 0;
        for (Object e : l) {
            if (e == o) {
                return pos;
            }
            pos++;
        }
        return -1;
    }

    /** Joins the printed elements with <b>sep</b>. */
    public static String listToString(List<?> list, String sep) {
        StringBuilder sb = new StringBuilder(80);
        String glue = "";
        for (Object e : list) {
            sb.append(glue).append(e);
            glue = sep;
        }
        return sb.toString();
    }

}
