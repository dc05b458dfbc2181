package strata.hir;

import java.util.List;

/**
* A node of the IR tree. Each node has at most one parent and knows it; the
* parent lists the node among its children.
*/
public interface Traversable extends Printable {

    /**
    * The live child list. Edit the tree through the methods of the concrete
    * node classes rather than through this list.
    */
    List<Traversable> getChildren();

    /** The owning node, or null for a root or an orphan. */
    Traversable getParent();

    /**
    * Drops a child, matched by identity.
    * @throws NotAChildException if it is not a child.
    * @throws UnsupportedOperationException if this node has a fixed shape.
    */
    void removeChild(Traversable child);

    /**
    * Puts the orphan <var>t</var> at the given position; the replaced child
    * becomes an orphan.
    * @throws NotAnOrphanException if <var>t</var> has a parent.
    * @throws IllegalArgumentException if <var>t</var> does not fit there.
    */
    void setChild(int index, Traversable t);

    /** Only called by a parent that already lists this node. */
    void setParent(Traversable t);

}
