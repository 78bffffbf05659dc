package unit;

import java.util.Arrays;
import java.util.Collections;

import analysis.dataflow.interprocedural.infoflow.InfoFlowSettings;
import analysis.dataflow.interprocedural.infoflow.InterproceduralInfoFlow;
import analysis.dataflow.interprocedural.pdg.CallChangeCallback;
import analysis.ir.AdtDef;
import analysis.ir.ClosureKind;
import analysis.ir.FieldDef;
import analysis.ir.InMemoryProgram;
import analysis.ir.Location;
import analysis.ir.Mutability;
import analysis.ir.Operand;
import analysis.ir.Place;
import analysis.ir.ProcedureBuilder;
import analysis.ir.ProcedureId;
import analysis.ir.ProcedureKind;
import analysis.ir.ProcedureSignature;
import analysis.ir.ProgramRepository;
import analysis.ir.Rvalue;
import analysis.ir.StructuralTypeOracle;
import analysis.ir.Terminator;
import analysis.ir.Type;
import analysis.ir.Visibility;
import analysis.pointer.BorrowPointsToAnalysis;

/**
 * Small programs shared by the unit tests. Location comments give the
 * locations the builder assigns.
 */
public final class ExamplePrograms {

    public static final ProcedureId MAIN = ProcedureId.parse("m::main");

    private ExamplePrograms() {
        // intentionally blank
    }

    public static Place local(int i) {
        return Place.local(i);
    }

    public static Location loc(int block, int statement) {
        return Location.make(block, statement);
    }

    public static Operand constInt(int value) {
        return Operand.constant(Integer.toString(value), Type.integer());
    }

    public static InterproceduralInfoFlow engine(ProgramRepository program, InfoFlowSettings settings) {
        return engine(program, settings, null);
    }

    public static InterproceduralInfoFlow engine(ProgramRepository program, InfoFlowSettings settings,
                                                 CallChangeCallback callback) {
        return new InterproceduralInfoFlow(program, new StructuralTypeOracle(),
                                           new BorrowPointsToAnalysis.Factory(settings.getMaxPlaceDepth()), settings,
                                           callback);
    }

    /**
     * <pre>
     * fn first(x: int, y: int) -> int { _0 = x; }
     * fn main() -> int {
     *     bb0[0] a = 1
     *     bb0[1] c = 2
     *     bb0[2] _0 = first(a, c)
     *     bb1[0] return
     * }
     * </pre>
     */
    public static InMemoryProgram firstOfTwo() {
        ProcedureBuilder f = new ProcedureBuilder("m::first", Type.integer());
        int x = f.arg("x", Type.integer());
        f.arg("y", Type.integer());
        f.assign(local(0), Rvalue.use(Operand.copy(local(x))));
        f.ret();

        ProcedureBuilder m = new ProcedureBuilder(MAIN, Type.integer());
        int a = m.local("a", Type.integer());
        int c = m.local("c", Type.integer());
        m.assign(local(a), Rvalue.use(constInt(1)));
        m.assign(local(c), Rvalue.use(constInt(2)));
        m.call(ProcedureId.parse("m::first"), local(0), Operand.copy(local(a)), Operand.copy(local(c)));
        m.ret();
        return new InMemoryProgram().add(f.build()).add(m.build());
    }

    /**
     * <pre>
     * fn set(r: &mut int, v: int) { *r = v; }
     * fn main() -> int {
     *     bb0[0] x = 0
     *     bb0[1] v = 7
     *     bb0[2] r = &mut x
     *     bb0[3] set(move r, v)
     *     bb1[0] _0 = x
     *     bb1[1] return
     * }
     * </pre>
     */
    public static InMemoryProgram writeThroughReference() {
        ProcedureBuilder s = new ProcedureBuilder("m::set", Type.unit());
        int r = s.arg("r", Type.ref(Mutability.MUT, Type.integer()));
        int v = s.arg("v", Type.integer());
        s.assign(local(r).deref(), Rvalue.use(Operand.copy(local(v))));
        s.ret();

        ProcedureBuilder m = new ProcedureBuilder(MAIN, Type.integer());
        int x = m.local("x", Type.integer());
        int val = m.local("v", Type.integer());
        int ref = m.local("r", Type.ref(Mutability.MUT, Type.integer()));
        int unit = m.local(null, Type.unit());
        m.assign(local(x), Rvalue.use(constInt(0)));
        m.assign(local(val), Rvalue.use(constInt(7)));
        m.assign(local(ref), Rvalue.ref(Mutability.MUT, local(x)));
        m.call(ProcedureId.parse("m::set"), local(unit), Operand.move(local(ref)), Operand.copy(local(val)));
        m.assign(local(0), Rvalue.use(Operand.copy(local(x))));
        m.ret();
        return new InMemoryProgram().add(s.build()).add(m.build());
    }

    /**
     * <pre>
     * fn peek(r: &mut int) -> int { _0 = *r; }
     * fn main() -> int {
     *     bb0[0] x = 1
     *     bb0[1] r = &mut x
     *     bb0[2] _0 = peek(move r)
     *     bb1[0] return
     * }
     * </pre>
     */
    public static InMemoryProgram readThroughReference() {
        ProcedureBuilder p = new ProcedureBuilder("m::peek", Type.integer());
        int r = p.arg("r", Type.ref(Mutability.MUT, Type.integer()));
        p.assign(local(0), Rvalue.use(Operand.copy(local(r).deref())));
        p.ret();

        ProcedureBuilder m = new ProcedureBuilder(MAIN, Type.integer());
        int x = m.local("x", Type.integer());
        int ref = m.local("r", Type.ref(Mutability.MUT, Type.integer()));
        m.assign(local(x), Rvalue.use(constInt(1)));
        m.assign(local(ref), Rvalue.ref(Mutability.MUT, local(x)));
        m.call(ProcedureId.parse("m::peek"), local(0), Operand.move(local(ref)));
        m.ret();
        return new InMemoryProgram().add(p.build()).add(m.build());
    }

    /**
     * <pre>
     * extern fn read(x: int) -> int;
     * fn main() -> int {
     *     bb0[0] a = 3
     *     bb0[1] _0 = read(a)
     *     bb1[0] return
     * }
     * </pre>
     */
    public static InMemoryProgram callsExternal() {
        ProcedureBuilder m = new ProcedureBuilder(MAIN, Type.integer());
        int a = m.local("a", Type.integer());
        m.assign(local(a), Rvalue.use(constInt(3)));
        m.call(ProcedureId.parse("ext::read"), local(0), Operand.copy(local(a)));
        m.ret();
        return new InMemoryProgram().add(m.build()).addExternal(new ProcedureSignature(ProcedureId
                .parse("ext::read"), Collections.<String> emptyList(), Arrays.asList(Type.integer()), Type.integer()));
    }

    /**
     * <pre>
     * fn apply(f: closure, x: int) -> int { _0 = x; }
     * fn main() -> int {
     *     bb0[0] _0 = apply(move f, 1)
     *     bb1[0] return
     * }
     * </pre>
     *
     * @param kind
     *            kind of the closure passed to apply
     */
    public static InMemoryProgram passesClosure(ClosureKind kind) {
        Type closure = Type.closure(ProcedureId.parse("m::main::{closure}"), kind, Collections.<Type> emptyList());
        ProcedureBuilder a = new ProcedureBuilder("m::apply", Type.integer());
        a.arg("f", closure);
        int x = a.arg("x", Type.integer());
        a.assign(local(0), Rvalue.use(Operand.copy(local(x))));
        a.ret();

        ProcedureBuilder m = new ProcedureBuilder(MAIN, Type.integer());
        int f = m.local("f", closure);
        m.call(ProcedureId.parse("m::apply"), local(0), Operand.move(local(f)), constInt(1));
        m.ret();
        return new InMemoryProgram().add(a.build()).add(m.build());
    }

    /**
     * <pre>
     * fn fact(n: int) -> int { _0 = fact(n); }
     * </pre>
     */
    public static InMemoryProgram selfRecursive() {
        ProcedureBuilder f = new ProcedureBuilder("m::fact", Type.integer());
        int n = f.arg("n", Type.integer());
        f.call(ProcedureId.parse("m::fact"), local(0), Operand.copy(local(n)));
        f.ret();
        return new InMemoryProgram().add(f.build());
    }

    /**
     * <pre>
     * fn even(n: int) -> int { _0 = odd(n); }
     * fn odd(n: int) -> int { _0 = even(n); }
     * </pre>
     */
    public static InMemoryProgram mutuallyRecursive() {
        ProcedureBuilder e = new ProcedureBuilder("m::even", Type.integer());
        int n = e.arg("n", Type.integer());
        e.call(ProcedureId.parse("m::odd"), local(0), Operand.copy(local(n)));
        e.ret();

        ProcedureBuilder o = new ProcedureBuilder("m::odd", Type.integer());
        int k = o.arg("n", Type.integer());
        o.call(ProcedureId.parse("m::even"), local(0), Operand.copy(local(k)));
        o.ret();
        return new InMemoryProgram().add(e.build()).add(o.build());
    }

    /**
     * Struct <code>a::inner::S { pub x: int, secret: int }</code> whose second
     * field is only visible in <code>a::inner</code>
     */
    public static AdtDef secretStruct() {
        return AdtDef.struct("a::inner::S",
                             Arrays.asList(new FieldDef("x", Type.integer(), Visibility.PUBLIC),
                                           new FieldDef("secret", Type.integer(), Visibility.restricted("a::inner"))));
    }

    /**
     * <pre>
     * fn a::inner::set_secret(s: &mut S, v: int) { (*s).1 = v; }
     * fn caller() {
     *     bb0[0] s = S { 1, 2 }
     *     bb0[1] v = 9
     *     bb0[2] r = &mut s
     *     bb0[3] set_secret(move r, v)
     *     bb1[0] return
     * }
     * </pre>
     *
     * @param caller
     *            qualified name of the calling procedure
     */
    public static InMemoryProgram writesPrivateField(String caller) {
        AdtDef def = secretStruct();
        Type s = Type.adt(def);
        ProcedureBuilder set = new ProcedureBuilder("a::inner::set_secret", Type.unit());
        int r = set.arg("s", Type.ref(Mutability.MUT, s));
        int v = set.arg("v", Type.integer());
        set.assign(local(r).deref().field(1), Rvalue.use(Operand.copy(local(v))));
        set.ret();

        ProcedureBuilder m = new ProcedureBuilder(caller, Type.unit());
        int sv = m.local("s", s);
        int val = m.local("v", Type.integer());
        int ref = m.local("r", Type.ref(Mutability.MUT, s));
        m.assign(local(sv), Rvalue.aggregate(s, 0, Arrays.asList(constInt(1), constInt(2))));
        m.assign(local(val), Rvalue.use(constInt(9)));
        m.assign(local(ref), Rvalue.ref(Mutability.MUT, local(sv)));
        m.call(ProcedureId.parse("a::inner::set_secret"), local(0), Operand.move(local(ref)),
               Operand.copy(local(val)));
        m.ret();
        return new InMemoryProgram().add(set.build()).add(m.build());
    }

    /**
     * <pre>
     * fn f(c: bool) -> int {
     *     bb0[0] switch c [bb1, bb2]
     *     bb1[0] _0 = 1     bb1[1] goto bb3
     *     bb2[0] _0 = 2     bb2[1] goto bb3
     *     bb3[0] return
     * }
     * </pre>
     */
    public static InMemoryProgram branch() {
        ProcedureBuilder b = new ProcedureBuilder(MAIN, Type.integer());
        int c = b.arg("c", Type.bool());
        int then = b.newBlock();
        int otherwise = b.newBlock();
        int join = b.newBlock();
        b.terminate(Terminator.switchInt(Operand.copy(local(c)), Arrays.asList(then, otherwise)));
        b.atBlock(then);
        b.assign(local(0), Rvalue.use(constInt(1)));
        b.terminate(Terminator.jump(join));
        b.atBlock(otherwise);
        b.assign(local(0), Rvalue.use(constInt(2)));
        b.terminate(Terminator.jump(join));
        b.atBlock(join);
        b.ret();
        return new InMemoryProgram().add(b.build());
    }

    /**
     * <pre>
     * fn helper(x: int) -> int { _0 = x; }
     * fn main(a: int) -> int {
     *     bb0[0] t = helper(a)
     *     bb1[0] _0 = helper(t)
     *     bb2[0] return
     * }
     * </pre>
     */
    public static InMemoryProgram twoCallsToHelper() {
        ProcedureBuilder h = new ProcedureBuilder("m::helper", Type.integer());
        int x = h.arg("x", Type.integer());
        h.assign(local(0), Rvalue.use(Operand.copy(local(x))));
        h.ret();

        ProcedureBuilder m = new ProcedureBuilder(MAIN, Type.integer());
        int a = m.arg("a", Type.integer());
        int t = m.local("t", Type.integer());
        m.call(ProcedureId.parse("m::helper"), local(t), Operand.copy(local(a)));
        m.call(ProcedureId.parse("m::helper"), local(0), Operand.copy(local(t)));
        m.ret();
        return new InMemoryProgram().add(h.build()).add(m.build());
    }

    /**
     * <pre>
     * fn work(x: int) -> int { _0 = x; }
     * async_wrapper fn wrapper(x: int) -> int { _0 = work(x); }
     * fn main(a: int) -> int {
     *     bb0[0] _0 = wrapper(a)
     *     bb1[0] return
     * }
     * </pre>
     */
    public static InMemoryProgram asyncWrapper() {
        ProcedureBuilder w = new ProcedureBuilder("m::work", Type.integer());
        int x = w.arg("x", Type.integer());
        w.assign(local(0), Rvalue.use(Operand.copy(local(x))));
        w.ret();

        ProcedureBuilder wrap = new ProcedureBuilder("m::wrapper", Type.integer()).kind(ProcedureKind.ASYNC_WRAPPER);
        int y = wrap.arg("x", Type.integer());
        wrap.call(ProcedureId.parse("m::work"), local(0), Operand.copy(local(y)));
        wrap.ret();

        ProcedureBuilder m = new ProcedureBuilder(MAIN, Type.integer());
        int a = m.arg("a", Type.integer());
        m.call(ProcedureId.parse("m::wrapper"), local(0), Operand.copy(local(a)));
        m.ret();
        return new InMemoryProgram().add(w.build()).add(wrap.build()).add(m.build());
    }

    /**
     * <pre>
     * fn five() -> int { _0 = 5; }
     * fn main() -> int {
     *     bb0[0] y = 1
     *     bb0[1] y = five()
     *     bb1[0] _0 = y
     *     bb1[1] return
     * }
     * </pre>
     */
    public static InMemoryProgram overwritesWithCallResult() {
        ProcedureBuilder f = new ProcedureBuilder("m::five", Type.integer());
        f.assign(local(0), Rvalue.use(constInt(5)));
        f.ret();

        ProcedureBuilder m = new ProcedureBuilder(MAIN, Type.integer());
        int y = m.local("y", Type.integer());
        m.assign(local(y), Rvalue.use(constInt(1)));
        m.call(ProcedureId.parse("m::five"), local(y));
        m.assign(local(0), Rvalue.use(Operand.copy(local(y))));
        m.ret();
        return new InMemoryProgram().add(f.build()).add(m.build());
    }

    /**
     * <pre>
     * fn bump(x: &mut (int, int)) { (*x).0 = (*x).0 + 1; }
     * fn main() -> int {
     *     bb0[0] a = 1
     *     bb0[1] v = (a, 2)
     *     bb0[2] r = &mut v
     *     bb0[3] bump(move r)
     *     bb1[0] _0 = v.0
     *     bb1[1] return
     * }
     * </pre>
     */
    public static InMemoryProgram bumpsTupleField() {
        Type pair = Type.tuple(Type.integer(), Type.integer());
        ProcedureBuilder g = new ProcedureBuilder("m::bump", Type.unit());
        int x = g.arg("x", Type.ref(Mutability.MUT, pair));
        g.assign(local(x).deref().field(0),
                 Rvalue.binary("+", Operand.copy(local(x).deref().field(0)), constInt(1)));
        g.ret();

        ProcedureBuilder m = new ProcedureBuilder(MAIN, Type.integer());
        int a = m.local("a", Type.integer());
        int v = m.local("v", pair);
        int ref = m.local("r", Type.ref(Mutability.MUT, pair));
        int unit = m.local(null, Type.unit());
        m.assign(local(a), Rvalue.use(constInt(1)));
        m.assign(local(v), Rvalue.aggregate(pair, 0, Arrays.asList(Operand.copy(local(a)), constInt(2))));
        m.assign(local(ref), Rvalue.ref(Mutability.MUT, local(v)));
        m.call(ProcedureId.parse("m::bump"), local(unit), Operand.move(local(ref)));
        m.assign(local(0), Rvalue.use(Operand.copy(local(v).field(0))));
        m.ret();
        return new InMemoryProgram().add(g.build()).add(m.build());
    }

    /**
     * <pre>
     * fn store(r: &mut int) { *r = 5; }
     * fn main() -> int {
     *     bb0[0] x = 0
     *     bb0[1] r = &mut x
     *     bb0[2] store(move r)
     *     bb1[0] _0 = x
     *     bb1[1] return
     * }
     * </pre>
     */
    public static InMemoryProgram storesConstantThroughReference() {
        ProcedureBuilder s = new ProcedureBuilder("m::store", Type.unit());
        int r = s.arg("r", Type.ref(Mutability.MUT, Type.integer()));
        s.assign(local(r).deref(), Rvalue.use(constInt(5)));
        s.ret();

        ProcedureBuilder m = new ProcedureBuilder(MAIN, Type.integer());
        int x = m.local("x", Type.integer());
        int ref = m.local("r", Type.ref(Mutability.MUT, Type.integer()));
        int unit = m.local(null, Type.unit());
        m.assign(local(x), Rvalue.use(constInt(0)));
        m.assign(local(ref), Rvalue.ref(Mutability.MUT, local(x)));
        m.call(ProcedureId.parse("m::store"), local(unit), Operand.move(local(ref)));
        m.assign(local(0), Rvalue.use(Operand.copy(local(x))));
        m.ret();
        return new InMemoryProgram().add(s.build()).add(m.build());
    }

    /**
     * <pre>
     * fn id&lt;F&gt;(x: int) -> int { _0 = x; }
     * fn main() -> int {
     *     bb0[0] _0 = id::&lt;closure&gt;(1)
     *     bb1[0] return
     * }
     * </pre>
     *
     * @param kind
     *            kind of the closure type the callee is instantiated with
     */
    public static InMemoryProgram instantiatedWithClosure(ClosureKind kind) {
        Type closure = Type.closure(ProcedureId.parse("m::main::{closure}"), kind, Collections.<Type> emptyList());
        ProcedureBuilder f = new ProcedureBuilder("m::id", Type.integer()).typeParameter("F");
        int x = f.arg("x", Type.integer());
        f.assign(local(0), Rvalue.use(Operand.copy(local(x))));
        f.ret();

        ProcedureBuilder m = new ProcedureBuilder(MAIN, Type.integer());
        m.call(Operand.function(ProcedureId.parse("m::id"), Arrays.asList(closure)), local(0),
               Arrays.asList(constInt(1)));
        m.ret();
        return new InMemoryProgram().add(f.build()).add(m.build());
    }

    /**
     * <pre>
     * fn chain() -> int {
     *     bb0[0] x_1 = 0 ... bb0[n-1] x_n = 0
     *     bb1[0] x_0 = x_1 ... bb1[n-1] x_(n-1) = x_n
     *     bb1[n] x_n = 1
     *     bb1[n+1] switch x_0 [bb1, bb2]
     *     bb2[0] _0 = x_0
     *     bb2[1] return
     * }
     * </pre>
     *
     * A value written at the end of the loop body needs one trip around the
     * loop per assignment to reach x_0.
     *
     * @param n
     *            length of the chain
     */
    public static InMemoryProgram longLoopChain(int n) {
        ProcedureBuilder b = new ProcedureBuilder(MAIN, Type.integer());
        int first = b.local("x0", Type.integer());
        for (int i = 1; i <= n; i++) {
            b.local("x" + i, Type.integer());
        }
        int body = b.newBlock();
        int exit = b.newBlock();
        for (int i = 1; i <= n; i++) {
            b.assign(local(first + i), Rvalue.use(constInt(0)));
        }
        b.terminate(Terminator.jump(body));
        b.atBlock(body);
        for (int i = 0; i < n; i++) {
            b.assign(local(first + i), Rvalue.use(Operand.copy(local(first + i + 1))));
        }
        b.assign(local(first + n), Rvalue.use(constInt(1)));
        b.terminate(Terminator.switchInt(Operand.copy(local(first)), Arrays.asList(body, exit)));
        b.atBlock(exit);
        b.assign(local(0), Rvalue.use(Operand.copy(local(first))));
        b.ret();
        return new InMemoryProgram().add(b.build());
    }
}
