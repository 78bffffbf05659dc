package unit;

import static unit.ExamplePrograms.local;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

import junit.framework.TestCase;
import analysis.ir.Mutability;
import analysis.ir.Operand;
import analysis.ir.Place;
import analysis.ir.Procedure;
import analysis.ir.ProcedureBuilder;
import analysis.ir.Rvalue;
import analysis.ir.StructuralTypeOracle;
import analysis.ir.Type;
import analysis.pointer.BorrowPointsToAnalysis;
import analysis.pointer.Loan;

public class TestBorrowPointsTo extends TestCase {

    private static final Type INT = Type.integer();

    private static BorrowPointsToAnalysis analyze(Procedure p) {
        return new BorrowPointsToAnalysis(p, new StructuralTypeOracle(), 4);
    }

    private static Set<Place> places(Place... ps) {
        return new HashSet<>(Arrays.asList(ps));
    }

    public void testMutableBorrow() {
        ProcedureBuilder b = new ProcedureBuilder("m::f", Type.unit());
        int x = b.local("x", INT);
        int r = b.local("r", Type.ref(Mutability.MUT, INT));
        b.assign(local(r), Rvalue.ref(Mutability.MUT, local(x)));
        b.ret();
        BorrowPointsToAnalysis a = analyze(b.build());

        assertEquals(Collections.singleton(new Loan(local(x), Mutability.MUT)), a.getLoans(local(r)));
        assertEquals(places(local(r).deref(), local(x)), new HashSet<>(a.aliases(local(r).deref(), Mutability.MUT)));
        assertEquals(places(local(r).deref(), local(x)), new HashSet<>(a.aliases(local(r).deref(), Mutability.NOT)));
        assertEquals(places(local(x)), new HashSet<>(a.aliases(local(x), Mutability.MUT)));
    }

    public void testSharedBorrowIsNotWritable() {
        ProcedureBuilder b = new ProcedureBuilder("m::f", Type.unit());
        int x = b.local("x", INT);
        int s = b.local("s", Type.ref(Mutability.NOT, INT));
        b.assign(local(s), Rvalue.ref(Mutability.NOT, local(x)));
        b.ret();
        BorrowPointsToAnalysis a = analyze(b.build());

        assertEquals(places(local(s).deref()), new HashSet<>(a.aliases(local(s).deref(), Mutability.MUT)));
        assertEquals(places(local(s).deref(), local(x)), new HashSet<>(a.aliases(local(s).deref(), Mutability.NOT)));
    }

    public void testLoansFlowThroughCopies() {
        ProcedureBuilder b = new ProcedureBuilder("m::f", Type.unit());
        int x = b.local("x", INT);
        int r = b.local("r", Type.ref(Mutability.MUT, INT));
        int r2 = b.local("r2", Type.ref(Mutability.MUT, INT));
        b.assign(local(r), Rvalue.ref(Mutability.MUT, local(x)));
        b.assign(local(r2), Rvalue.use(Operand.move(local(r))));
        b.ret();
        BorrowPointsToAnalysis a = analyze(b.build());

        assertTrue(a.aliases(local(r2).deref(), Mutability.MUT).contains(local(x)));
    }

    public void testParameterWithoutLoansAliasesItsDeref() {
        ProcedureBuilder b = new ProcedureBuilder("m::f", Type.unit());
        int r = b.arg("r", Type.ref(Mutability.MUT, INT));
        b.ret();
        BorrowPointsToAnalysis a = analyze(b.build());

        assertTrue(a.getLoans(local(r)).isEmpty());
        assertEquals(places(local(r).deref()), new HashSet<>(a.aliases(local(r).deref(), Mutability.MUT)));
    }

    public void testReachableValues() {
        ProcedureBuilder b = new ProcedureBuilder("m::f", Type.unit());
        int r = b.arg("r", Type.ref(Mutability.MUT, INT));
        int s = b.arg("s", Type.ref(Mutability.NOT, INT));
        int t = b.arg("t", Type.tuple(INT, Type.ref(Mutability.MUT, INT)));
        int rr = b.arg("rr", Type.ref(Mutability.MUT, Type.ref(Mutability.MUT, INT)));
        b.ret();
        BorrowPointsToAnalysis a = analyze(b.build());

        assertEquals(places(local(r), local(r).deref()), a.reachableValues(local(r), Mutability.MUT));
        assertEquals(places(local(s)), a.reachableValues(local(s), Mutability.MUT));
        assertEquals(places(local(s), local(s).deref()), a.reachableValues(local(s), Mutability.NOT));
        assertTrue(a.reachableValues(local(t), Mutability.MUT).contains(local(t).field(1).deref()));
        assertFalse(a.reachableValues(local(t), Mutability.MUT).contains(local(t).field(0)));
        assertEquals(places(local(rr), local(rr).deref(), local(rr).deref().deref()),
                     a.reachableValues(local(rr), Mutability.MUT));
    }
}
