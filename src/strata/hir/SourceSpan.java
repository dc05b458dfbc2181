package strata.hir;

/**
* Line span and raw text of the source a procedure was built from.
*/
public class SourceSpan {

    private final int begin;
    private final int end;
    private final String text;

    public SourceSpan(int begin, int end, String text) {
        this.begin = begin;
        this.end = end;
        this.text = text;
    }

    public int getBegin() {
        return begin;
    }

    public int getEnd() {
        return end;
    }

    /** Returns the raw source text, or null if it was not provided. */
    public String getText() {
        return text;
    }

    @Override
    public String toString() {
        return "lines " + begin + "-" + end;
    }

}
