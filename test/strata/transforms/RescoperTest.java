package strata.transforms;

import org.junit.Before;
import org.junit.Test;
import strata.hir.AssignmentExpression;
import strata.hir.Expression;
import strata.hir.ExpressionStatement;
import strata.hir.IRBuilder;
import strata.hir.ImportStatement;
import strata.hir.IntegerLiteral;
import strata.hir.Procedure;
import strata.hir.Scope;
import strata.hir.SymbolAttributes;
import strata.hir.Variable;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.junit.Assert.assertThat;

public class RescoperTest {

    private Scope module;

    private Scope elsewhere;

    private Procedure proc;

    @Before
    public void setUp() {
        module = new Scope(null);
        module.declare("g", IRBuilder.real());
        elsewhere = new Scope(null);
        proc = new Procedure("kernel", new ArrayList<String>(), false, null,
                module);
        IRBuilder.declare(proc, IRBuilder.integer(), "n", null);
    }

    private ExpressionStatement use(Procedure owner, String name) {
        return use(owner, new Variable(name, null, elsewhere));
    }

    private ExpressionStatement use(Procedure owner, Variable ref) {
        ExpressionStatement ret = new ExpressionStatement(
                new AssignmentExpression(ref, new IntegerLiteral(1)));
        owner.getBody().addStatement(ret);
        return ret;
    }

    private static Variable target(ExpressionStatement stmt) {
        Expression lhs = ((AssignmentExpression)stmt.getExpression()).getLHS();
        return (Variable)lhs;
    }

    @Test
    public void enclosingDeclarationsGiveScopeAndType() {
        ExpressionStatement stmt = use(proc, "G");
        Rescoper.rescope(proc);
        assertThat(target(stmt).getScope(), is(sameInstance(module)));
        assertThat(target(stmt).getType().getType(),
                is(SymbolAttributes.BasicType.REAL));
    }

    @Test
    public void localNamesBindToTheProcedure() {
        ExpressionStatement stmt = use(proc, "n");
        Rescoper.rescope(proc);
        assertThat(target(stmt).getScope(), is(sameInstance((Scope)proc)));
    }

    @Test
    public void importedNamesBindToTheProcedure() {
        proc.getSpec().addStatement(
                new ImportStatement("yomhook", Arrays.asList("lhook")));
        ExpressionStatement stmt = use(proc, "lhook");
        Rescoper.rescope(proc);
        assertThat(target(stmt).getScope(), is(sameInstance((Scope)proc)));
    }

    @Test
    public void unknownNamesBindToTheProcedure() {
        ExpressionStatement stmt = use(proc, "nowhere");
        Rescoper.rescope(proc);
        assertThat(target(stmt).getScope(), is(sameInstance((Scope)proc)));
    }

    @Test
    public void rescopingTwiceChangesNothing() {
        ExpressionStatement stmt = use(proc, "g");
        Rescoper.rescope(proc);
        Variable first = target(stmt);
        Rescoper.rescope(proc);
        assertThat(target(stmt), is(sameInstance(first)));
    }

    @Test
    public void membersSeeTheirHostVariables() {
        Procedure member = new Procedure("helper", new ArrayList<String>(),
                false, null, proc);
        proc.addMember(member);
        ExpressionStatement stmt = use(member, "n");
        Rescoper.rescope(member);
        assertThat(target(stmt).getScope(), is(sameInstance((Scope)proc)));
        assertThat(target(stmt).getType().getType(),
                is(SymbolAttributes.BasicType.INTEGER));
    }

    @Test
    public void declaredTypeReplacesAConflictingCarriedType() {
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        PrintStream saved = System.err;
        System.setErr(new PrintStream(err, true));
        ExpressionStatement stmt;
        try {
            stmt = use(proc, new Variable("g", IRBuilder.integer(), elsewhere));
            Rescoper.rescope(proc);
        } finally {
            System.setErr(saved);
        }
        assertThat(target(stmt).getScope(), is(sameInstance(module)));
        assertThat(target(stmt).getType().getType(),
                is(SymbolAttributes.BasicType.REAL));
        assertThat(err.toString(), containsString("[WARNING] Type of g"));
    }

    @Test
    public void foreignTypedReferenceKeepsItsType() {
        ExpressionStatement stmt =
                use(proc, new Variable("n", IRBuilder.real(), elsewhere));
        Rescoper.rescope(proc);
        assertThat(target(stmt).getScope(), is(sameInstance((Scope)proc)));
        assertThat(target(stmt).getType().getType(),
                is(SymbolAttributes.BasicType.REAL));
        assertThat(target(stmt).getName(), is("n"));
    }

    @Test
    public void memberChainsFollowTheirParent() {
        IRBuilder.declare(proc, SymbolAttributes.derived("state"), "a", null);
        Variable a = new Variable("a", null, elsewhere);
        Variable b = new Variable("b", IRBuilder.real(), elsewhere, a, null);
        Variable c = new Variable("c", IRBuilder.integer(), elsewhere, b, null);
        ExpressionStatement stmt = use(proc, c);
        Rescoper.rescope(proc);
        Variable ref = target(stmt);
        assertThat(ref.getFullName(), is("a%b%c"));
        assertThat(ref.getScope(), is(sameInstance((Scope)proc)));
        assertThat(ref.getType().getType(),
                is(SymbolAttributes.BasicType.INTEGER));
        Variable parent = ref.getParentVariable();
        assertThat(parent.getScope(), is(sameInstance((Scope)proc)));
        assertThat(parent.getType().getType(),
                is(SymbolAttributes.BasicType.REAL));
        assertThat(parent.getParentVariable().getScope(),
                is(sameInstance((Scope)proc)));
        Rescoper.rescope(proc);
        assertThat(target(stmt), is(sameInstance(ref)));
    }

}
