package strata.transforms;

import strata.analysis.Polyhedron;
import strata.hir.AnnotationStatement;
import strata.hir.BinaryExpression;
import strata.hir.BinaryOperator;
import strata.hir.CommentAnnotation;
import strata.hir.CompoundStatement;
import strata.hir.DFIterator;
import strata.hir.DoLoop;
import strata.hir.Expression;
import strata.hir.ExpressionParser;
import strata.hir.FunctionCall;
import strata.hir.IRTools;
import strata.hir.IfStatement;
import strata.hir.NameID;
import strata.hir.PrintTools;
import strata.hir.Procedure;
import strata.hir.Program;
import strata.hir.RangeExpression;
import strata.hir.Statement;
import strata.hir.StrataAnnotation;
import strata.hir.Symbolic;
import strata.hir.Variable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
* Fuses the loop nests annotated with
* <code>!$strata loop-fusion [group(g)] [collapse(n)] [range(s:e, ...)]</code>.
* <p>
* The loops of a group are replaced by one loop nest of depth
* <code>collapse</code>, placed where the first loop of the group was. The
* fused loop variables are those of the first loop. Unless the group states
* an explicit range, the fused bounds are derived from the iteration space
* of every loop of the group such that no original iteration is lost: the
* lower bound is the minimum and the upper bound is the maximum of the
* bounds that are not known to be redundant. The body of a loop whose
* bounds differ from the fused bounds is guarded by a conditional.
* <p>
* Groups are processed one at a time in program order; a group whose loops
* sit inside the loops of another group is fused inside the fused copy. A
* group that cannot be fused is left untouched, and the first error is
* rethrown once the other groups have been fused.
*/
public class LoopFusion extends ProcedureTransformPass {

    /** The directive name */
    public static final String DIRECTIVE = "loop-fusion";

    /** The group of loops that do not name one */
    public static final String DEFAULT_GROUP = "default";

    private static final String pass_name = "[LoopFusion]";

    public LoopFusion(Program program) {
        super(program);
    }

    public String getPassName() {
        return pass_name;
    }

    public void transformProcedure(Procedure proc) {
        fuse(proc);
    }

    /**
    * Fuses the annotated loops in the body of the procedure.
    *
    * @param proc the procedure to be transformed.
    * @return the number of fused groups.
    * @throws TransformException the first error raised by a group.
    */
    public static int fuse(Procedure proc) {
        Set<String> fused = new LinkedHashSet<String>();
        Set<String> failed = new HashSet<String>();
        List<TransformException> errors = new ArrayList<TransformException>();
        int num_loops = 0;
        // Groups are collected again after every fusion: a fused loop holds
        // copies of the annotated loops nested in the originals.
        while (true) {
            Map<String, List<DoLoop>> groups = collectGroups(proc);
            groups.keySet().removeAll(failed);
            if (groups.isEmpty()) {
                break;
            }
            String group = groups.keySet().iterator().next();
            List<DoLoop> loops = groups.get(group);
            DoLoop fused_loop;
            try {
                fused_loop = fuseGroup(proc, group, loops);
            } catch(TransformException e) {
                PrintTools.printlnStatus(0, "[WARNING]", pass_name,
                        "cannot fuse group", group, "in", proc.getName() +
                        ":", e.getMessage());
                errors.add(e);
                failed.add(group);
                continue;
            }
            replaceGroup(group, loops, fused_loop);
            fused.add(group);
            num_loops += loops.size();
        }
        if (fused.isEmpty() && errors.isEmpty()) {
            return 0;
        }
        PrintTools.printlnStatus(1, pass_name, proc.getName() + ":", "fused",
                num_loops, "loops in", fused.size(), "groups");
        if (!errors.isEmpty()) {
            TransformException ret = errors.get(0);
            for (int i = 1; i < errors.size(); i++) {
                ret.addSuppressed(errors.get(i));
            }
            throw ret;
        }
        return fused.size();
    }

    /**
    * Puts the fused loop, preceded by a marker comment, where the first loop
    * of the group was and removes the loops of the group.
    */
    private static void
            replaceGroup(String group, List<DoLoop> loops, DoLoop fused) {
        DoLoop first = loops.get(0);
        CompoundStatement parent = (CompoundStatement)first.getParent();
        parent.addStatementBefore(first, new AnnotationStatement(
                new CommentAnnotation("strata transformation " +
                DIRECTIVE + " group(" + group + ")")));
        parent.addStatementBefore(first, fused);
        for (DoLoop loop : loops) {
            loop.detach();
        }
    }

    /** Returns the annotated loops keyed by their group, in program order. */
    private static Map<String, List<DoLoop>> collectGroups(Procedure proc) {
        Map<String, List<DoLoop>> ret = new LinkedHashMap<String, List<DoLoop>>();
        DFIterator<DoLoop> iter =
                new DFIterator<DoLoop>(proc.getBody(), DoLoop.class);
        while (iter.hasNext()) {
            DoLoop loop = iter.next();
            StrataAnnotation note = StrataAnnotation.find(loop, DIRECTIVE);
            if (note == null) {
                continue;
            }
            String group = note.getParameter("group");
            if (group == null || group.trim().length() == 0) {
                group = DEFAULT_GROUP;
            }
            group = group.trim();
            if (!ret.containsKey(group)) {
                ret.put(group, new ArrayList<DoLoop>());
            }
            ret.get(group).add(loop);
        }
        return ret;
    }

    /**
    * Builds the fused loop nest of a group without modifying the IR.
    */
    private static DoLoop
            fuseGroup(Procedure proc, String group, List<DoLoop> loops) {
        int collapse = -1;
        List<RangeExpression> fused_ranges = null;
        for (DoLoop loop : loops) {
            StrataAnnotation note = StrataAnnotation.find(loop, DIRECTIVE);
            if (!note.isWellFormed()) {
                throw new InvalidDirectiveException("malformed directive '" +
                        note + "' in group " + group + ": " + note.getError());
            }
            int depth = getCollapse(note, group);
            if (collapse != -1 && depth != collapse) {
                throw new ConflictingDirectiveException(
                        "conflicting collapse values in group " + group);
            }
            collapse = depth;
            List<RangeExpression> ranges = getRanges(proc, note, group, depth);
            if (ranges == null) {
                continue;
            }
            if (fused_ranges != null && !fused_ranges.equals(ranges)) {
                throw new ConflictingDirectiveException(
                        "ranges in group " + group + " do not match");
            }
            fused_ranges = ranges;
        }
        List<List<DoLoop>> nests = new ArrayList<List<DoLoop>>();
        for (DoLoop loop : loops) {
            nests.add(getNest(loop, collapse));
        }
        List<DoLoop> first_nest = nests.get(0);
        Map<String, Expression> fused_vars = new HashMap<String, Expression>();
        List<Map<String, Expression>> var_maps =
                new ArrayList<Map<String, Expression>>();
        for (List<DoLoop> nest : nests) {
            Map<String, Expression> var_map =
                    new LinkedHashMap<String, Expression>();
            for (int level = 0; level < collapse; level++) {
                String name = nest.get(level).getVariable().getName();
                Variable fused_var = first_nest.get(level).getVariable();
                if (!name.equalsIgnoreCase(fused_var.getName())) {
                    var_map.put(name, fused_var);
                }
            }
            var_maps.add(var_map);
        }
        if (fused_ranges == null) {
            fused_ranges = computeRanges(nests, var_maps, collapse);
        }
        CompoundStatement fused_body = new CompoundStatement();
        for (int k = 0; k < nests.size(); k++) {
            List<DoLoop> nest = nests.get(k);
            Map<String, Expression> var_map = var_maps.get(k);
            CompoundStatement body = nest.get(collapse - 1).getBody().clone();
            if (!var_map.isEmpty()) {
                IRTools.replaceVariables(body, var_map);
            }
            Expression cond = null;
            for (int level = 0; level < collapse; level++) {
                RangeExpression range = nest.get(level).getBounds();
                RangeExpression fused_range = fused_ranges.get(level);
                Variable fused_var = first_nest.get(level).getVariable();
                Expression start = IRTools.substitute(
                        range.getStart().clone(), var_map);
                Expression stop = IRTools.substitute(
                        range.getStop().clone(), var_map);
                if (!Symbolic.isEqual(start, fused_range.getStart())) {
                    cond = conjoin(cond, new BinaryExpression(fused_var.clone(),
                            BinaryOperator.COMPARE_GE, start));
                }
                if (!Symbolic.isEqual(stop, fused_range.getStop())) {
                    cond = conjoin(cond, new BinaryExpression(fused_var.clone(),
                            BinaryOperator.COMPARE_LE, stop));
                }
            }
            if (cond == null) {
                for (Statement stmt : body.removeStatements()) {
                    fused_body.addStatement(stmt);
                }
            } else {
                fused_body.addStatement(new IfStatement(cond, body));
            }
        }
        DoLoop ret = null;
        for (int level = collapse - 1; level >= 0; level--) {
            if (ret != null) {
                fused_body = new CompoundStatement();
                fused_body.addStatement(ret);
            }
            RangeExpression range = fused_ranges.get(level);
            ret = new DoLoop(first_nest.get(level).getVariable().clone(),
                    new RangeExpression(range.getStart().clone(),
                    range.getStop().clone()), fused_body);
        }
        return ret;
    }

    private static int getCollapse(StrataAnnotation note, String group) {
        String value = note.getParameter("collapse");
        if (value == null) {
            return 1;
        }
        int ret;
        try {
            ret = Integer.parseInt(value.trim());
        } catch(NumberFormatException e) {
            throw new InvalidDirectiveException("invalid collapse value '" +
                    value + "' in group " + group, e);
        }
        if (ret < 1) {
            throw new InvalidDirectiveException("invalid collapse value '" +
                    value + "' in group " + group);
        }
        return ret;
    }

    /** Returns the explicit ranges of the directive, or null. */
    private static List<RangeExpression> getRanges(Procedure proc,
            StrataAnnotation note, String group, int collapse) {
        String value = note.getParameter("range");
        if (value == null) {
            return null;
        }
        List<RangeExpression> ret;
        try {
            ret = new ExpressionParser(proc).parseRangeList(value);
        } catch(IllegalArgumentException e) {
            throw new InvalidDirectiveException("invalid range '" + value +
                    "' in group " + group, e);
        }
        if (ret.size() != collapse) {
            throw new InvalidDirectiveException(ret.size() +
                    " ranges for collapse(" + collapse + ") in group " + group);
        }
        for (RangeExpression range : ret) {
            if (!range.hasUnitStep()) {
                throw new UnsupportedLoopShapeException("step of range " +
                        range + " in group " + group + " is not 1");
            }
        }
        return ret;
    }

    /**
    * Returns the <var>depth</var> perfectly nested loops starting at
    * <var>loop</var>, outermost first. Besides the nested loop, a loop of
    * the nest may only contain comments.
    */
    private static List<DoLoop> getNest(DoLoop loop, int depth) {
        List<DoLoop> ret = new ArrayList<DoLoop>(depth);
        ret.add(loop);
        while (ret.size() < depth) {
            DoLoop inner = null;
            for (Statement stmt : loop.getBody().getStatements()) {
                if (stmt instanceof DoLoop && inner == null) {
                    inner = (DoLoop)stmt;
                } else if (!(stmt instanceof AnnotationStatement &&
                           ((AnnotationStatement)stmt).isComment())) {
                    throw new UnsupportedLoopShapeException("loop over " +
                            loop.getVariable() + " is not perfectly nested" +
                            " to depth " + depth);
                }
            }
            if (inner == null) {
                throw new UnsupportedLoopShapeException("loop over " +
                        loop.getVariable() + " is not nested to depth " +
                        depth);
            }
            loop = inner;
            ret.add(loop);
        }
        for (DoLoop l : ret) {
            if (!l.getBounds().hasUnitStep()) {
                throw new UnsupportedLoopShapeException("step of loop over " +
                        l.getVariable() + " is not 1");
            }
        }
        return ret;
    }

    /**
    * Computes the fused range of every level from the iteration spaces of
    * the loop nests. The bounds of every nest are expressed in terms of the
    * fused loop variables.
    */
    private static List<RangeExpression>
            computeRanges(List<List<DoLoop>> nests,
                          List<Map<String, Expression>> var_maps,
                          int collapse) {
        List<Polyhedron> spaces = new ArrayList<Polyhedron>();
        for (List<DoLoop> nest : nests) {
            List<Variable> vars = new ArrayList<Variable>();
            List<RangeExpression> ranges = new ArrayList<RangeExpression>();
            for (DoLoop loop : nest) {
                vars.add(loop.getVariable());
                ranges.add(loop.getBounds());
            }
            spaces.add(Polyhedron.fromLoopRanges(vars, ranges));
        }
        List<RangeExpression> ret = new ArrayList<RangeExpression>(collapse);
        for (int level = 0; level < collapse; level++) {
            List<Expression> lower = new ArrayList<Expression>();
            List<Expression> upper = new ArrayList<Expression>();
            for (int k = 0; k < nests.size(); k++) {
                List<DoLoop> nest = nests.get(k);
                Polyhedron p = spaces.get(k);
                for (Expression bound : p.lowerBounds(level)) {
                    if (!dependsOnInner(bound, nest, level)) {
                        mergeBound(lower, IRTools.substitute(
                                bound, var_maps.get(k)), -1);
                    }
                }
                for (Expression bound : p.upperBounds(level)) {
                    if (!dependsOnInner(bound, nest, level)) {
                        mergeBound(upper, IRTools.substitute(
                                bound, var_maps.get(k)), 1);
                    }
                }
            }
            ret.add(new RangeExpression(combine(lower, "min"),
                                        combine(upper, "max")));
        }
        return ret;
    }

    /**
    * Checks if the bound refers to the loop variable of the given level or
    * of a deeper level of the nest. Such rows of the polyhedron constrain
    * the inner loops and do not bound this level on their own.
    */
    private static boolean
            dependsOnInner(Expression bound, List<DoLoop> nest, int level) {
        List<Variable> refs =
                new DFIterator<Variable>(bound, Variable.class).getList();
        for (Variable ref : refs) {
            for (int i = level; i < nest.size(); i++) {
                if (ref.getName().equalsIgnoreCase(
                        nest.get(i).getVariable().getName())) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
    * Adds a bound to the list unless an existing bound is known to be at
    * least as loose. Existing bounds known to be tighter are dropped; a
    * bound comparable with none of the others is kept next to them.
    * <var>dir</var> is -1 for lower bounds and 1 for upper bounds.
    */
    private static void
            mergeBound(List<Expression> bounds, Expression bound, int dir) {
        boolean looser = false, not_looser = false;
        List<Integer> diffs = new ArrayList<Integer>(bounds.size());
        for (Expression b : bounds) {
            Integer diff = Symbolic.compare(bound, b);
            diffs.add(diff);
            if (diff != null) {
                if (diff.intValue() * dir > 0) {
                    looser = true;
                } else {
                    not_looser = true;
                }
            }
        }
        boolean is_new = bounds.isEmpty() || looser || !not_looser;
        if (!is_new) {
            return;
        }
        for (int i = bounds.size() - 1; i >= 0; i--) {
            Integer diff = diffs.get(i);
            if (diff != null && diff.intValue() * dir > 0) {
                bounds.remove(i);
            }
        }
        bounds.add(bound);
    }

    private static Expression combine(List<Expression> bounds, String name) {
        if (bounds.size() == 1) {
            return bounds.get(0);
        }
        List<Expression> args = new ArrayList<Expression>(bounds.size());
        for (Expression bound : bounds) {
            args.add(bound.clone());
        }
        return new FunctionCall(new NameID(name), args);
    }

    private static Expression conjoin(Expression e1, Expression e2) {
        if (e1 == null) {
            return e2;
        }
        return new BinaryExpression(e1, BinaryOperator.LOGICAL_AND, e2);
    }

}
